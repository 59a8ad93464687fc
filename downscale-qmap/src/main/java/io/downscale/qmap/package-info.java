
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

/// Quantile mapping: learning a monotonic map onto a target distribution.
///
/// ## Key Components
///
/// - [io.downscale.qmap.QuantileMapper]: unfitted, configured mapper
/// - [io.downscale.qmap.FittedQuantileMapper]: immutable fitted state with `transform`
/// - [io.downscale.qmap.CunnaneQuantileMapper]: empirical mapper on Cunnane plotting positions
/// - [io.downscale.qmap.IdentityQuantileMapper]: pass-through mapper
/// - [io.downscale.qmap.QuantileMappers]: registry resolving [io.downscale.qmap.QuantileMapperOptions]
/// - [io.downscale.qmap.QmapGsonConfig]: JSON form of fitted state
package io.downscale.qmap;
