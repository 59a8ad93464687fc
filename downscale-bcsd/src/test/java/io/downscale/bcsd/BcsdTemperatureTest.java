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

import io.downscale.qmap.QuantileMapperOptions;
import io.downscale.series.Climatology;
import io.downscale.series.PeriodGroupers;
import io.downscale.series.RollingWindow;
import io.downscale.series.TimeSeries;
import io.downscale.series.UnseenPeriodException;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.LocalDate;
import java.util.Arrays;

import static io.downscale.bcsd.BcsdTestData.daily;
import static io.downscale.bcsd.BcsdTestData.seasonal;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class BcsdTemperatureTest {

    private static final LocalDate START = LocalDate.of(1990, 1, 1);

    @ParameterizedTest
    @EnumSource(RollingScope.class)
    void testIdentityMapperOnTrainingInputGivesTargetAnomaly(RollingScope scope) {
        TimeSeries training = seasonal(START, 4 * 365, 12, 9, 0.3, 2, 1L);
        TimeSeries target = seasonal(START, 4 * 365, 14, 11, 0, 1.5, 2L);
        BcsdTemperature model = new BcsdTemperature(PeriodGroupers.MONTH_OF_YEAR,
            QuantileMapperOptions.ofType("identity"), RollingWindow.centered9(), scope, false);

        TimeSeries predicted = model.fit(training, target).predict(training);

        Climatology targetClimatology = Climatology.of(target, PeriodGroupers.MONTH_OF_YEAR);
        TimeSeries expected = training.minus(targetClimatology.broadcast(training, PeriodGroupers.MONTH_OF_YEAR));
        assertArrayEquals(expected.values(), predicted.values(), 1e-9);
        assertArrayEquals(training.index(), predicted.index());
    }

    @Test
    void testConstantBaselineHasNoShift() {
        double[] flat = new double[120];
        Arrays.fill(flat, 5.0);
        TimeSeries training = daily(START, flat);
        ShiftExtractor extractor = new ShiftExtractor(
            RollingWindow.centered9(), RollingScope.SERIES, PeriodGroupers.MONTH_OF_YEAR);

        TimeSeries shift = extractor.shift(training, Climatology.of(training, PeriodGroupers.MONTH_OF_YEAR));

        for (double v : shift.values()) {
            assertEquals(0.0, v, 0.0);
        }
        assertEquals(training, extractor.restore(extractor.deshift(training, shift), shift));
    }

    @Test
    void testCorrectionRemovesBiasAndKeepsTrend() {
        int days = 30 * 365;
        // input is 3 degrees too warm over a flat historical period
        TimeSeries target = seasonal(START, days, 10, 8, 0, 2, 3L);
        TimeSeries training = seasonal(START, days, 13, 8, 0, 2, 4L);
        BcsdTemperature model = new BcsdTemperature();
        model.fit(training, target);

        // the future warms by a further 2 degrees per decade
        LocalDate futureStart = START.plusDays(days);
        TimeSeries future = seasonal(futureStart, days, 13, 8, 0.2, 2, 5L);
        TimeSeries anomaly = model.predict(future);

        double early = mean(anomaly.values(), 0, 5 * 365);
        double late = mean(anomaly.values(), days - 5 * 365, days);
        // first five years sit at about 0.5 above the target climatology, last five at about 5.5
        assertEquals(0.5, early, 0.4);
        assertEquals(5.5, late, 0.4);
    }

    @Test
    void testUnseenPeriodAtPredict() {
        TimeSeries january = seasonal(START, 31, 0, 0, 0, 1, 6L);
        BcsdTemperature model = new BcsdTemperature();
        model.fit(january, january);

        UnseenPeriodException e = assertThrows(UnseenPeriodException.class,
            () -> model.predict(daily(LocalDate.of(2000, 1, 30), 1, 2, 3)));
        assertEquals(2, e.getPeriodKey());
    }

    @Test
    void testPredictBeforeFit() {
        assertThrows(ModelNotFittedException.class, () -> new BcsdTemperature().predict(daily(START, 1)));
        assertFalse(new BcsdTemperature().isFitted());
    }

    @Test
    void testNoPositivityConstraint() {
        TimeSeries cold = seasonal(START, 2 * 365, -20, 5, 0, 1, 7L);
        BcsdTemperature model = new BcsdTemperature();

        assertDoesNotThrow(() -> model.fit(cold, cold));
        assertTrue(model.isFitted());
    }

    @Test
    void testParallelGroupsMatchSequential() {
        TimeSeries training = seasonal(START, 5 * 365, 12, 9, 0.1, 2, 8L);
        TimeSeries target = seasonal(START, 5 * 365, 10, 10, 0, 2, 9L);
        TimeSeries future = seasonal(START.plusYears(5), 3 * 365, 14, 9, 0.2, 2, 10L);

        BcsdTemperature sequential = new BcsdTemperature(PeriodGroupers.MONTH_OF_YEAR,
            QuantileMapperOptions.defaults(), RollingWindow.centered9(), RollingScope.SERIES, false);
        BcsdTemperature parallel = new BcsdTemperature(PeriodGroupers.MONTH_OF_YEAR,
            QuantileMapperOptions.defaults(), RollingWindow.centered9(), RollingScope.SERIES, true);

        assertEquals(sequential.fit(training, target).predict(future),
            parallel.fit(training, target).predict(future));
    }

    private static double mean(double[] values, int from, int to) {
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += values[i];
        }
        return sum / (to - from);
    }
}
