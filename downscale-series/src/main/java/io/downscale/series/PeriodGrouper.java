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

import java.time.LocalDate;

/// Derives a period key from a timestamp.
///
/// ## Purpose
///
/// Every per-period statistic in this project (climatologies, quantile mappers,
/// climatology removal) is keyed by the value this function returns. Two series
/// grouped by the same grouper produce comparable keys.
///
/// ## Contract
///
/// - Pure: the same date always maps to the same key
/// - Total: every date maps to some key
///
/// Implementations may be lambdas; named instances live in [PeriodGroupers].
///
/// ```java
/// PeriodGrouper byMonth = PeriodGroupers.MONTH_OF_YEAR;
/// PeriodGrouper custom = PeriodGrouper.of("dekad", d -> (d.getDayOfMonth() - 1) / 10);
/// ```
///
/// @see PeriodGroupers
/// @see PeriodPartition
@FunctionalInterface
public interface PeriodGrouper {

    /// Returns the period key for the given date.
    ///
    /// @param date the timestamp
    /// @return the period key
    int keyOf(LocalDate date);

    /// Returns a name describing this grouping. Named groupers resolved from a
    /// frequency string return that frequency string.
    ///
    /// @return the grouper name
    default String name() {
        return "custom";
    }

    /// Wraps a key function with a name.
    ///
    /// @param name the grouper name
    /// @param keyFunction the key function
    /// @return a named grouper
    static PeriodGrouper of(String name, PeriodGrouper keyFunction) {
        return new PeriodGrouper() {
            @Override
            public int keyOf(LocalDate date) {
                return keyFunction.keyOf(date);
            }

            @Override
            public String name() {
                return name;
            }

            @Override
            public String toString() {
                return "PeriodGrouper[" + name + "]";
            }
        };
    }
}
