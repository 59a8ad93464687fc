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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class RollingWindowTest {

    private static final LocalDate START = LocalDate.of(2000, 1, 1);

    @Test
    void testShortSeriesHasNoMissingValues() {
        TimeSeries series = TimeSeriesTest.daily(START, 1.0, 2.0, 6.0);

        TimeSeries smoothed = RollingWindow.centered9().apply(series);

        assertEquals(3, smoothed.size());
        assertTrue(smoothed.isAllFinite());
        assertArrayEquals(new double[] {3.0, 3.0, 3.0}, smoothed.values(), 1e-12);
    }

    @Test
    void testCenteredOddWindow() {
        TimeSeries series = TimeSeriesTest.daily(START, 1, 2, 3, 4, 5, 6, 7);

        TimeSeries smoothed = new RollingWindow(3, true, 1).apply(series);

        assertArrayEquals(new double[] {1.5, 2, 3, 4, 5, 6, 6.5}, smoothed.values(), 1e-12);
    }

    @Test
    void testCenteredEvenWindowLeansBackward() {
        TimeSeries series = TimeSeriesTest.daily(START, 0, 10, 20, 30, 40);

        // span of i is [i-2, i+1]
        TimeSeries smoothed = new RollingWindow(4, true, 1).apply(series);

        assertArrayEquals(new double[] {5, 10, 15, 25, 30}, smoothed.values(), 1e-12);
    }

    @Test
    void testTrailingWindow() {
        TimeSeries series = TimeSeriesTest.daily(START, 2, 4, 6, 8);

        TimeSeries smoothed = new RollingWindow(2, false, 1).apply(series);

        assertArrayEquals(new double[] {2, 3, 5, 7}, smoothed.values(), 1e-12);
    }

    @Test
    void testMinPeriodsProducesNaN() {
        TimeSeries series = TimeSeriesTest.daily(START, 1, 2, 3, 4, 5);

        TimeSeries smoothed = new RollingWindow(5, true, 4).apply(series);

        assertTrue(Double.isNaN(smoothed.value(0)));
        assertEquals(2.5, smoothed.value(1), 1e-12);
        assertEquals(3.0, smoothed.value(2), 1e-12);
        assertEquals(3.5, smoothed.value(3), 1e-12);
        assertTrue(Double.isNaN(smoothed.value(4)));
    }

    @Test
    void testNaNSamplesSkipped() {
        TimeSeries series = TimeSeriesTest.daily(START, 1, Double.NaN, 3);

        TimeSeries smoothed = new RollingWindow(3, true, 1).apply(series);

        assertArrayEquals(new double[] {1, 2, 3}, smoothed.values(), 1e-12);
    }

    @Test
    void testByPeriodSmoothsWithinEachMonth() {
        // January is 0 + year, July is 100 + year, over 5 years
        LocalDate[] index = new LocalDate[10];
        double[] values = new double[10];
        for (int y = 0; y < 5; y++) {
            index[2 * y] = LocalDate.of(2000 + y, 1, 1);
            values[2 * y] = y;
            index[2 * y + 1] = LocalDate.of(2000 + y, 7, 1);
            values[2 * y + 1] = 100 + y;
        }
        TimeSeries series = TimeSeries.of(index, values);

        TimeSeries smoothed = new RollingWindow(3, true, 1)
            .applyByPeriod(series, PeriodGroupers.MONTH_OF_YEAR);

        assertArrayEquals(
            new double[] {0.5, 100.5, 1, 101, 2, 102, 3, 103, 3.5, 103.5},
            smoothed.values(), 1e-12);
    }

    @Test
    void testInvalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> new RollingWindow(0, true, 1));
        assertThrows(IllegalArgumentException.class, () -> new RollingWindow(3, true, 0));
        assertThrows(IllegalArgumentException.class, () -> new RollingWindow(3, true, 4));
    }
}
