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

/// Learns a monotonic mapping onto a target distribution.
///
/// ## Purpose
///
/// A QuantileMapper is the unfitted, configured form of a distribution-matching
/// transform. Fitting it on one sample set (the target) yields an immutable
/// [FittedQuantileMapper] that maps new data of the same variable onto the
/// target's empirical distribution.
///
/// ## Fitting Process
///
/// ```
/// Target samples ──► QuantileMapper.fit ──► FittedQuantileMapper
///                                                │
/// Input samples ─────────────────────────────────┴──► transform ──► mapped samples
/// ```
///
/// Implementations must be stateless apart from their configuration, so one
/// instance can fit many independent groups.
///
/// @see FittedQuantileMapper
/// @see QuantileMappers
public interface QuantileMapper {

    /// Returns the mapper type identifier.
    ///
    /// @return the type (e.g., "cunnane", "identity")
    String getMapperType();

    /// Fits this mapper to a target sample set.
    ///
    /// @param targetSamples the target samples, at least one, all finite
    /// @return the fitted mapper
    /// @throws IllegalArgumentException if the samples are empty or non-finite
    FittedQuantileMapper fit(double[] targetSamples);
}
