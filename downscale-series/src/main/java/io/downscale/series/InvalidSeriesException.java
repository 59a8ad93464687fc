package io.downscale.series;

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

/// Thrown when a time series is malformed or unusable for the requested operation.
///
/// Covers non-finite values where finite values are required, empty period
/// groups at fit time, mismatched indexes between two series that must be
/// aligned, and duplicate or out-of-order timestamps.
public class InvalidSeriesException extends IllegalArgumentException {

    /// Creates a new InvalidSeriesException.
    /// @param message the error message
    public InvalidSeriesException(String message) {
        super(message);
    }
}
