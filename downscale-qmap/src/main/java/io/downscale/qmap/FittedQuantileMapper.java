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

/// Fitted quantile-mapping state for one sample group.
///
/// Instances are immutable and thread-safe. Concrete classes carry a
/// [MapperType] annotation so they can be written to and read from JSON.
public interface FittedQuantileMapper {

    /// Returns the mapper type identifier.
    ///
    /// @return the type (e.g., "cunnane", "identity")
    String getMapperType();

    /// Maps samples onto the fitted target distribution.
    ///
    /// @param samples the samples to map
    /// @return the mapped samples, same length and order as the input
    double[] transform(double[] samples);

    /// Checks that fields read back from JSON describe a usable mapper.
    ///
    /// Instances built by [QuantileMapper#fit] always pass.
    ///
    /// @throws IllegalArgumentException if a required field is missing or invalid
    default void requireComplete() {
    }
}
