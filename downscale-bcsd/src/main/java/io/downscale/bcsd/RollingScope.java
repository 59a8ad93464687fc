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

import com.google.gson.annotations.SerializedName;

import java.util.Locale;

/// Which samples the rolling mean of the temperature shift runs over.
public enum RollingScope {

    /// One moving window over the whole series in timestamp order.
    @SerializedName("series")
    SERIES,

    /// A separate moving window over each period group, e.g. a running mean of
    /// successive Januaries.
    @SerializedName("period")
    PERIOD;

    public static RollingScope fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("rolling scope cannot be null");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "series":
                return SERIES;
            case "period":
                return PERIOD;
            default:
                throw new IllegalArgumentException("Unknown rolling scope: '" + name + "', expected series or period");
        }
    }

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
