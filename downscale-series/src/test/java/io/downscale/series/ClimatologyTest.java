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
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class ClimatologyTest {

    private static final PeriodGrouper MONTH = PeriodGroupers.MONTH_OF_YEAR;

    private static TimeSeries monthStarts(int years, double... monthValues) {
        LocalDate[] index = new LocalDate[years * 12];
        double[] values = new double[years * 12];
        for (int i = 0; i < index.length; i++) {
            index[i] = LocalDate.of(1990, 1, 1).plusMonths(i);
            values[i] = monthValues[i % 12] + (i / 12);
        }
        return TimeSeries.of(index, values);
    }

    @Test
    void testMeansPerMonth() {
        double[] base = {10, 12, 14, 16, 18, 20, 22, 24, 26, 28, 30, 32};
        // each year adds 0, 1, 2 -> mean offset 1
        Climatology climo = Climatology.of(monthStarts(3, base), MONTH);

        assertEquals(12, climo.keys().size());
        for (int m = 1; m <= 12; m++) {
            assertEquals(base[m - 1] + 1.0, climo.get(m), 1e-12);
        }
        assertEquals(11.0, climo.min(), 1e-12);
        assertEquals(1, climo.argMin());
    }

    @Test
    void testMinimumReportsNaNPeriod() {
        Map<Integer, Double> means = new TreeMap<>();
        means.put(1, 4.0);
        means.put(2, 0.5);
        means.put(3, Double.NaN);
        Climatology climo = Climatology.fromMap(means);

        assertTrue(Double.isNaN(climo.min()));
        assertEquals(3, climo.argMin());

        means.remove(3);
        Climatology finite = Climatology.fromMap(means);
        assertEquals(0.5, finite.min(), 0.0);
        assertEquals(2, finite.argMin());
    }

    @Test
    void testRemoveThenBroadcastRestoresSeries() {
        Random random = new Random(42);
        LocalDate[] index = new LocalDate[1000];
        double[] values = new double[1000];
        for (int i = 0; i < index.length; i++) {
            index[i] = LocalDate.of(2010, 3, 3).plusDays(i);
            values[i] = 15 + 10 * random.nextGaussian();
        }
        TimeSeries series = TimeSeries.of(index, values);
        Climatology climo = Climatology.of(series, MONTH);

        TimeSeries anomaly = climo.removeFrom(series, MONTH);
        TimeSeries restored = anomaly.plus(climo.broadcast(series, MONTH));

        assertTrue(restored.sameIndex(series));
        assertArrayEquals(series.values(), restored.values(), 1e-9);
        assertArrayEquals(series.values(), climo.restoreTo(anomaly, MONTH).values(), 1e-9);
    }

    @Test
    void testAnomalyOfClimatologyInputHasZeroMeanPerGroup() {
        double[] base = {1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12};
        TimeSeries series = monthStarts(4, base);
        Climatology climo = Climatology.of(series, MONTH);

        Climatology anomalyClimo = Climatology.of(climo.removeFrom(series, MONTH), MONTH);

        for (double mean : anomalyClimo.asMap().values()) {
            assertEquals(0.0, mean, 1e-12);
        }
    }

    @Test
    void testDivideByPeriodMean() {
        Climatology climo = Climatology.fromMap(Map.of(1, 10.0, 2, 12.0));
        TimeSeries series = TimeSeries.of(
            new LocalDate[] {LocalDate.of(2000, 1, 5), LocalDate.of(2000, 2, 5)},
            new double[] {5.0, 6.0});

        assertArrayEquals(new double[] {0.5, 0.5}, climo.divide(series, MONTH).values(), 1e-12);
    }

    @Test
    void testMissingKeyIsUnseenPeriod() {
        Climatology climo = Climatology.fromMap(Map.of(1, 10.0));
        TimeSeries march = TimeSeries.of(new LocalDate[] {LocalDate.of(2000, 3, 1)}, new double[] {1.0});

        UnseenPeriodException e = assertThrows(UnseenPeriodException.class,
            () -> climo.removeFrom(march, MONTH));
        assertEquals(3, e.getPeriodKey());
    }

    @Test
    void testNonFiniteInputRejected() {
        TimeSeries series = TimeSeries.of(
            new LocalDate[] {LocalDate.of(2000, 1, 1), LocalDate.of(2000, 1, 2)},
            new double[] {1.0, Double.POSITIVE_INFINITY});
        assertThrows(InvalidSeriesException.class, () -> Climatology.of(series, MONTH));
        assertThrows(InvalidSeriesException.class, () -> Climatology.of(TimeSeries.empty(), MONTH));
    }
}
