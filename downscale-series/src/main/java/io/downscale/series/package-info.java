
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

/// Time series primitives for pointwise bias correction.
///
/// ## Contents
///
/// - [io.downscale.series.TimeSeries] - immutable date-indexed values
/// - [io.downscale.series.PeriodGrouper] - timestamp to period key
/// - [io.downscale.series.PeriodPartition] - split by key, apply, reassemble
/// - [io.downscale.series.Climatology] - per-period means and baseline removal
/// - [io.downscale.series.RollingWindow] - moving mean smoother
package io.downscale.series;
