package io.downscale.series;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/// Thrown when a period key is looked up in fitted state that never saw it.
///
/// A key present at predict time but absent at fit time cannot be corrected;
/// it is never skipped or imputed.
public class UnseenPeriodException extends RuntimeException {

    private final int periodKey;

    public UnseenPeriodException(int periodKey, String what) {
        super(String.format("Period %d was not seen when %s was fitted", periodKey, what));
        this.periodKey = periodKey;
    }

    public int getPeriodKey() {
        return periodKey;
    }
}
