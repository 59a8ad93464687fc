package io.downscale.bcsd;

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

/// Thrown at fit time when a target climatology violates a modeling assumption
/// of the correction, such as a non-positive precipitation mean that would make
/// ratio correction meaningless.
///
/// This is distinct from malformed input: the data is well formed, but the
/// model cannot be applied to it.
public class InvalidClimatologyException extends RuntimeException {

    private final int periodKey;
    private final double value;

    public InvalidClimatologyException(int periodKey, double value, String requirement) {
        super(String.format("Invalid value in target climatology: period %d has mean %s, %s",
            periodKey, value, requirement));
        this.periodKey = periodKey;
        this.value = value;
    }

    public int getPeriodKey() {
        return periodKey;
    }

    public double getValue() {
        return value;
    }
}
