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

import io.downscale.series.Climatology;
import io.downscale.series.PeriodGrouper;
import io.downscale.series.RollingWindow;
import io.downscale.series.TimeSeries;

import java.util.Objects;

/**
 * Extracts the slowly varying shift of a series relative to a climatology.
 *
 * <pre>{@code
 *   shift    = rollingMean(x) - climatology[period]
 *   deshift  = x - shift
 *   restore  = y + shift
 * }</pre>
 *
 * <p>The shift carries the long-term trend of the input, so that quantile
 * mapping sees a stationary series and the trend survives the correction.
 */
public final class ShiftExtractor {

    private final RollingWindow window;
    private final RollingScope scope;
    private final PeriodGrouper grouper;

    public ShiftExtractor(RollingWindow window, RollingScope scope, PeriodGrouper grouper) {
        this.window = Objects.requireNonNull(window, "window cannot be null");
        this.scope = Objects.requireNonNull(scope, "scope cannot be null");
        this.grouper = Objects.requireNonNull(grouper, "grouper cannot be null");
    }

    /// Smooths a series with the configured window and scope.
    public TimeSeries rollingMean(TimeSeries series) {
        return scope == RollingScope.PERIOD ? window.applyByPeriod(series, grouper) : window.apply(series);
    }

    /**
     * Computes the shift of a series.
     *
     * @param series the series
     * @param climatology the climatology the shift is measured against
     * @return the shift, on the input index
     * @throws io.downscale.series.UnseenPeriodException if the series has a period missing from the climatology
     */
    public TimeSeries shift(TimeSeries series, Climatology climatology) {
        return climatology.removeFrom(rollingMean(series), grouper);
    }

    public TimeSeries deshift(TimeSeries series, TimeSeries shift) {
        return series.minus(shift);
    }

    public TimeSeries restore(TimeSeries series, TimeSeries shift) {
        return series.plus(shift);
    }

    public RollingWindow window() {
        return window;
    }

    public RollingScope scope() {
        return scope;
    }

    @Override
    public String toString() {
        return "ShiftExtractor[" + window + ", scope=" + scope + "]";
    }
}
