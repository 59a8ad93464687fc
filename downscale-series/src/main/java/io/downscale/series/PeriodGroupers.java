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
import java.util.Locale;

/// Named period groupers and frequency-string resolution.
///
/// | Frequency     | Key                                  |
/// |---------------|--------------------------------------|
/// | `month`       | month of year, 1..12                 |
/// | `dayofyear`   | day of year, 1..366                  |
/// | `season`      | DJF=1, MAM=2, JJA=3, SON=4           |
/// | `M`, `MS`     | calendar month bin, `year*100+month` |
/// | `A`, `Y`      | calendar year                        |
/// | `D`           | calendar day bin, `yyyymmdd`         |
///
/// Frequency strings are resolved once, when a model is configured.
public final class PeriodGroupers {

    public static final String DEFAULT_FREQUENCY = "month";

    public static final PeriodGrouper MONTH_OF_YEAR =
        PeriodGrouper.of("month", LocalDateKeys::monthOfYear);

    public static final PeriodGrouper DAY_OF_YEAR =
        PeriodGrouper.of("dayofyear", LocalDateKeys::dayOfYear);

    public static final PeriodGrouper SEASON =
        PeriodGrouper.of("season", LocalDateKeys::season);

    private PeriodGroupers() {
    }

    /// Resolves a frequency string to a grouper.
    ///
    /// @param frequency the frequency name, see the class table
    /// @return the grouper, whose [PeriodGrouper#name()] is the canonical frequency name
    /// @throws IllegalArgumentException if the frequency is unknown
    public static PeriodGrouper fromFrequency(String frequency) {
        if (frequency == null || frequency.isBlank()) {
            throw new IllegalArgumentException("frequency cannot be blank");
        }
        switch (frequency) {
            case "M":
            case "MS":
                return PeriodGrouper.of(frequency, d -> d.getYear() * 100 + d.getMonthValue());
            case "A":
            case "Y":
                return PeriodGrouper.of(frequency, LocalDate::getYear);
            case "D":
                return PeriodGrouper.of(frequency,
                    d -> d.getYear() * 10000 + d.getMonthValue() * 100 + d.getDayOfMonth());
            default:
                break;
        }
        switch (frequency.toLowerCase(Locale.ROOT)) {
            case "month":
                return MONTH_OF_YEAR;
            case "dayofyear":
            case "doy":
                return DAY_OF_YEAR;
            case "season":
                return SEASON;
            default:
                throw new IllegalArgumentException("Unknown period frequency: '" + frequency + "'");
        }
    }

    /// Key functions shared by the named groupers.
    private static final class LocalDateKeys {
        private LocalDateKeys() {
        }

        static int monthOfYear(LocalDate date) {
            return date.getMonthValue();
        }

        static int dayOfYear(LocalDate date) {
            return date.getDayOfYear();
        }

        static int season(LocalDate date) {
            // DJF=1, MAM=2, JJA=3, SON=4
            return (date.getMonthValue() % 12) / 3 + 1;
        }
    }
}
