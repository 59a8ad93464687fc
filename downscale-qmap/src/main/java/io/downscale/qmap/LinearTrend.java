package io.downscale.qmap;

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

import org.apache.commons.math3.stat.regression.SimpleRegression;

/// Least-squares line through a sample sequence.
///
/// Used to remove and restore a linear trend over sample order, and to extend
/// an empirical quantile function beyond its fitted range.
final class LinearTrend {

    private final double slope;
    private final double intercept;

    LinearTrend(double slope, double intercept) {
        this.slope = slope;
        this.intercept = intercept;
    }

    /// Fits `y ~ x` by ordinary least squares.
    ///
    /// @param x the abscissae
    /// @param y the ordinates
    /// @param from first index, inclusive
    /// @param to last index, exclusive
    /// @return the fitted line, flat through the mean when fewer than two points are given
    static LinearTrend fit(double[] x, double[] y, int from, int to) {
        double sum = 0;
        for (int i = from; i < to; i++) {
            sum += y[i];
        }
        LinearTrend flat = new LinearTrend(0.0, to > from ? sum / (to - from) : 0.0);
        if (to - from < 2) {
            return flat;
        }
        SimpleRegression regression = new SimpleRegression(true);
        for (int i = from; i < to; i++) {
            regression.addData(x[i], y[i]);
        }
        double slope = regression.getSlope();
        if (!Double.isFinite(slope)) {
            // all x equal
            return flat;
        }
        return new LinearTrend(slope, regression.getIntercept());
    }

    /// Fits a line over sample order `0..n-1`.
    ///
    /// @param values the samples
    /// @return the fitted line
    static LinearTrend overOrder(double[] values) {
        double[] order = new double[values.length];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        return fit(order, values, 0, values.length);
    }

    double slope() {
        return slope;
    }

    double intercept() {
        return intercept;
    }

    double at(double x) {
        return intercept + slope * x;
    }

    /// Removes the sloped part of the trend, keeping the level of the series.
    ///
    /// @param values samples in order
    /// @return values minus `slope * (i - center)`
    double[] removeSlope(double[] values) {
        double center = (values.length - 1) / 2.0;
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] - slope * (i - center);
        }
        return out;
    }

    /// Inverse of [#removeSlope].
    ///
    /// @param values samples in order
    /// @return values plus `slope * (i - center)`
    double[] restoreSlope(double[] values) {
        double center = (values.length - 1) / 2.0;
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i] + slope * (i - center);
        }
        return out;
    }
}
