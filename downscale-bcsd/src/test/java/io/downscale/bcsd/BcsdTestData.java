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

import io.downscale.series.TimeSeries;

import java.time.LocalDate;
import java.util.Random;

/// Synthetic series shared by the model tests.
final class BcsdTestData {

    private BcsdTestData() {
    }

    static TimeSeries daily(LocalDate start, double... values) {
        LocalDate[] index = new LocalDate[values.length];
        for (int i = 0; i < values.length; i++) {
            index[i] = start.plusDays(i);
        }
        return TimeSeries.of(index, values);
    }

    /// One value per month, on the first of the month.
    static TimeSeries monthly(LocalDate start, double... values) {
        LocalDate[] index = new LocalDate[values.length];
        for (int i = 0; i < values.length; i++) {
            index[i] = start.plusMonths(i);
        }
        return TimeSeries.of(index, values);
    }

    /// A daily seasonal cycle with a linear trend and gaussian noise.
    static TimeSeries seasonal(LocalDate start, int days, double mean, double amplitude,
                               double trendPerYear, double noise, long seed) {
        Random random = new Random(seed);
        double[] values = new double[days];
        for (int i = 0; i < days; i++) {
            double phase = 2 * Math.PI * start.plusDays(i).getDayOfYear() / 365.25;
            values[i] = mean - amplitude * Math.cos(phase) + trendPerYear * i / 365.25
                + noise * random.nextGaussian();
        }
        return daily(start, values);
    }

    /// Non-negative daily amounts with a seasonal mean.
    static TimeSeries precipitation(LocalDate start, int days, double scale, long seed) {
        Random random = new Random(seed);
        double[] values = new double[days];
        for (int i = 0; i < days; i++) {
            double phase = 2 * Math.PI * start.plusDays(i).getDayOfYear() / 365.25;
            double mean = scale * (1.5 + Math.sin(phase));
            values[i] = -mean * Math.log(1 - random.nextDouble());
        }
        return daily(start, values);
    }
}
