
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

/// Bias Correction and Spatial Disaggregation (BCSD), pointwise.
///
/// ## Contents
///
/// - [io.downscale.bcsd.BcsdModel] - fit/predict contract
/// - [io.downscale.bcsd.BcsdPrecipitation] - ratio correction against the target climatology
/// - [io.downscale.bcsd.BcsdTemperature] - shift-preserving anomaly correction
/// - [io.downscale.bcsd.GroupedQuantileMapping] - one quantile mapper per period group
/// - [io.downscale.bcsd.ShiftExtractor] - rolling-mean shift removal and restoration
/// - [io.downscale.bcsd.BcsdConfig] and [io.downscale.bcsd.BcsdModels] - JSON configuration
/// - [io.downscale.bcsd.BcsdStateCodec] - fitted state persistence
package io.downscale.bcsd;
