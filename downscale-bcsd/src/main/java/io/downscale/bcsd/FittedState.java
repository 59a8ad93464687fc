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

import io.downscale.series.Climatology;

import java.util.Objects;

/// The learned state of a BCSD model.
///
/// @param trainingClimatology climatology of the training input, or null when the
///     variable does not use it
/// @param targetClimatology climatology of the target
/// @param mapping the fitted per-period quantile mappers
record FittedState(Climatology trainingClimatology, Climatology targetClimatology, GroupedQuantileMapping mapping) {

    FittedState {
        Objects.requireNonNull(targetClimatology, "targetClimatology cannot be null");
        Objects.requireNonNull(mapping, "mapping cannot be null");
    }
}
