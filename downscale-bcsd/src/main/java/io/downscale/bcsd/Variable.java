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

/// The kind of variable a BCSD model corrects.
public enum Variable {

    /// Non-negative, skewed amounts; corrected as a ratio to the target climatology.
    @SerializedName("precipitation")
    PRECIPITATION,

    /// Corrected additively, with a rolling-mean shift removed and restored
    /// around quantile mapping.
    @SerializedName("temperature")
    TEMPERATURE;

    /// Parses a variable name.
    ///
    /// @param name "precipitation"/"pr" or "temperature"/"tas", case-insensitive
    /// @return the variable
    /// @throws IllegalArgumentException for any other name
    public static Variable fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("variable cannot be null");
        }
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "precipitation":
            case "pr":
                return PRECIPITATION;
            case "temperature":
            case "tas":
                return TEMPERATURE;
            default:
                throw new IllegalArgumentException("Unknown variable: '" + name + "'");
        }
    }

    public String configName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
