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

import java.util.Objects;

/// Moving-mean smoother over consecutive samples.
///
/// ## Window Placement
///
/// For a window of `w` samples, sample `i` is averaged over:
///
/// ```
///  centered:  [i - w/2, i - w/2 + w - 1]      e.g. w=9 -> [i-4, i+4]
///  trailing:  [i - w + 1, i]
/// ```
///
/// Spans are clipped at the ends of the series. Non-finite samples inside a
/// span are skipped. If fewer than `minPeriods` finite samples remain, the
/// output at `i` is NaN; with `minPeriods = 1` and finite input every output
/// is defined, even when the series is shorter than the window.
///
/// ## Scope
///
/// [#apply] runs the window over the series in timestamp order.
/// [#applyByPeriod] runs it over each period group separately (for monthly
/// groups of daily data, a running mean of "the same month" across years) and
/// reassembles the groups on the source index.
public final class RollingWindow {

    public static final int DEFAULT_WINDOW = 9;

    private final int window;
    private final boolean centered;
    private final int minPeriods;

    /// Creates a rolling window.
    ///
    /// @param window number of samples in the window, at least 1
    /// @param centered whether the window is centered on each sample
    /// @param minPeriods minimum finite samples for a defined output, in [1, window]
    public RollingWindow(int window, boolean centered, int minPeriods) {
        if (window < 1) {
            throw new IllegalArgumentException("window must be at least 1, got " + window);
        }
        if (minPeriods < 1 || minPeriods > window) {
            throw new IllegalArgumentException(
                "minPeriods must be in [1, " + window + "], got " + minPeriods);
        }
        this.window = window;
        this.centered = centered;
        this.minPeriods = minPeriods;
    }

    /// The window used for temperature shift extraction: 9 samples, centered,
    /// at least one sample.
    /// @return the default window
    public static RollingWindow centered9() {
        return new RollingWindow(DEFAULT_WINDOW, true, 1);
    }

    public int window() {
        return window;
    }

    public boolean centered() {
        return centered;
    }

    public int minPeriods() {
        return minPeriods;
    }

    /// Computes the moving mean in timestamp order.
    ///
    /// @param series the series
    /// @return the smoothed series, on the same index
    public TimeSeries apply(TimeSeries series) {
        Objects.requireNonNull(series, "series cannot be null");
        return series.withValues(mean(series.valueArray()));
    }

    /// Computes the moving mean within each period group.
    ///
    /// @param series the series
    /// @param grouper the grouper
    /// @return the smoothed series, on the same index
    public TimeSeries applyByPeriod(TimeSeries series, PeriodGrouper grouper) {
        Objects.requireNonNull(series, "series cannot be null");
        return series.groupBy(grouper).mapGroups((key, group) -> apply(group));
    }

    private double[] mean(double[] values) {
        int n = values.length;
        double[] out = new double[n];
        int before = centered ? window / 2 : window - 1;
        for (int i = 0; i < n; i++) {
            int start = Math.max(0, i - before);
            int end = Math.min(n - 1, i - before + window - 1);
            double sum = 0;
            int count = 0;
            for (int j = start; j <= end; j++) {
                if (Double.isFinite(values[j])) {
                    sum += values[j];
                    count++;
                }
            }
            out[i] = count >= minPeriods ? sum / count : Double.NaN;
        }
        return out;
    }

    @Override
    public String toString() {
        return "RollingWindow[window=" + window + ", centered=" + centered + ", minPeriods=" + minPeriods + "]";
    }
}
