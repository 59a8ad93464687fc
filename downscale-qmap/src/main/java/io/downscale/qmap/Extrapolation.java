package io.downscale.qmap;

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

/// How a fitted empirical quantile function answers probabilities outside the
/// range of its plotting positions.
public enum Extrapolation {

    /// Clamp to the smallest or largest fitted value.
    @SerializedName("constant")
    CONSTANT,

    /// Extend the least-squares line through the tail points.
    @SerializedName("linear")
    LINEAR;

    /// Parses an option value.
    ///
    /// @param name "constant" or "linear", case-insensitive
    /// @return the extrapolation mode
    /// @throws IllegalArgumentException for any other value
    public static Extrapolation fromName(String name) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "constant":
                return CONSTANT;
            case "linear":
                return LINEAR;
            default:
                throw new IllegalArgumentException("extrapolate must be 'constant' or 'linear', got '" + name + "'");
        }
    }
}
