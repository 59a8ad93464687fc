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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class PeriodPartitionTest {

    private static TimeSeries randomDaily(LocalDate start, int days, long seed) {
        Random random = new Random(seed);
        double[] values = new double[days];
        for (int i = 0; i < days; i++) {
            values[i] = random.nextGaussian();
        }
        return TimeSeriesTest.daily(start, values);
    }

    @Test
    void testPartitionCoversSeries() {
        TimeSeries series = randomDaily(LocalDate.of(2001, 1, 1), 730, 1L);
        PeriodPartition partition = series.groupBy(PeriodGroupers.MONTH_OF_YEAR);

        assertEquals(12, partition.size());
        assertEquals(List.of(1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12), partition.keys());

        int total = 0;
        for (Map.Entry<Integer, TimeSeries> entry : partition.groups().entrySet()) {
            TimeSeries group = entry.getValue();
            for (int i = 0; i < group.size(); i++) {
                assertEquals(entry.getKey().intValue(), group.timestamp(i).getMonthValue());
            }
            total += group.size();
        }
        assertEquals(series.size(), total);
        assertEquals(31 * 2, partition.group(1).size());
        assertEquals(28 * 2, partition.group(2).size());
        assertTrue(partition.group(13).isEmpty());
    }

    @ParameterizedTest
    @ValueSource(strings = {"month", "dayofyear", "season", "M", "Y"})
    void testIdentityMapPreservesIndexAndOrder(String frequency) {
        TimeSeries series = randomDaily(LocalDate.of(1999, 11, 15), 500, 7L);
        PeriodPartition partition = series.groupBy(PeriodGroupers.fromFrequency(frequency));

        TimeSeries mapped = partition.mapGroups((key, group) -> group);

        assertEquals(series, mapped);
        assertEquals(series, partition.merge());
    }

    @Test
    void testMapGroupsRejectsResizedGroup() {
        TimeSeries series = randomDaily(LocalDate.of(2000, 1, 20), 30, 3L);
        PeriodPartition partition = series.groupBy(PeriodGroupers.MONTH_OF_YEAR);

        assertThrows(InvalidSeriesException.class,
            () -> partition.mapGroups((key, group) -> key == 2 ? TimeSeries.empty() : group));
    }

    @Test
    void testReassembleRejectsMissingGroup() {
        TimeSeries series = randomDaily(LocalDate.of(2000, 1, 20), 30, 3L);
        PeriodPartition partition = series.groupBy(PeriodGroupers.MONTH_OF_YEAR);

        assertThrows(InvalidSeriesException.class,
            () -> partition.reassemble(Map.of(1, partition.group(1))));
    }

    @Test
    void testDayOfYearSeparatesDecemberAndJanuary() {
        TimeSeries series = randomDaily(LocalDate.of(2000, 12, 30), 4, 5L);
        PeriodPartition partition = series.groupBy(PeriodGroupers.DAY_OF_YEAR);

        // 2000 is a leap year: Dec 30 = 365, Dec 31 = 366
        assertEquals(List.of(1, 2, 365, 366), partition.keys());
        for (TimeSeries group : partition.groups().values()) {
            assertEquals(1, group.size());
        }
    }

    @Test
    void testCustomGrouperAcrossYearBoundary() {
        // winter of each year keyed by the year the winter starts in
        PeriodGrouper winterYear = PeriodGrouper.of("winter-year",
            d -> d.getMonthValue() >= 7 ? d.getYear() : d.getYear() - 1);
        TimeSeries series = randomDaily(LocalDate.of(2000, 12, 1), 90, 9L);

        PeriodPartition partition = series.groupBy(winterYear);

        assertEquals(List.of(2000), partition.keys());
        assertEquals("winter-year", partition.grouper().name());
    }
}
