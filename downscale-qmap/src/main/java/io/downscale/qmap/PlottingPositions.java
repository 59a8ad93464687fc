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

import java.util.Arrays;

/// Plotting positions and piecewise-linear interpolation for empirical CDFs.
///
/// ## Plotting Positions
///
/// The non-exceedance probability assigned to the `i`-th smallest of `n`
/// samples (1-based) is
///
/// ```
///   p_i = (i - alpha) / (n + 1 - alpha - beta)
/// ```
///
/// With `alpha = beta = 0.4` these are Cunnane positions, approximately
/// quantile-unbiased for a wide range of distributions. Positions always lie
/// strictly inside (0, 1) for `0 <= alpha, beta < 1`.
final class PlottingPositions {

    private PlottingPositions() {
    }

    /// Returns the positions of ranks 1..n.
    ///
    /// @param n the sample count
    /// @param alpha the alpha parameter
    /// @param beta the beta parameter
    /// @return n strictly increasing positions
    static double[] positions(int n, double alpha, double beta) {
        double[] p = new double[n];
        for (int i = 0; i < n; i++) {
            p[i] = position(i + 1, n, alpha, beta);
        }
        return p;
    }

    static double position(double rank, int n, double alpha, double beta) {
        return (rank - alpha) / (n + 1.0 - alpha - beta);
    }

    /// Returns the position of each sample within its own sample set.
    ///
    /// Tied samples share the mean rank of their block, so equal inputs always
    /// map to equal outputs.
    ///
    /// @param values the samples, finite
    /// @param alpha the alpha parameter
    /// @param beta the beta parameter
    /// @return positions aligned with the input order
    static double[] rankPositions(double[] values, double alpha, double beta) {
        int n = values.length;
        Integer[] order = new Integer[n];
        for (int i = 0; i < n; i++) {
            order[i] = i;
        }
        Arrays.sort(order, (a, b) -> Double.compare(values[a], values[b]));

        double[] p = new double[n];
        int start = 0;
        while (start < n) {
            int end = start;
            while (end + 1 < n && values[order[end + 1]] == values[order[start]]) {
                end++;
            }
            // 1-based ranks start+1 .. end+1
            double rank = (start + end) / 2.0 + 1.0;
            double position = position(rank, n, alpha, beta);
            for (int k = start; k <= end; k++) {
                p[order[k]] = position;
            }
            start = end + 1;
        }
        return p;
    }

    /// Piecewise-linear interpolation of `fp` over increasing `xp`, clamped to
    /// the end values outside the range of `xp`.
    ///
    /// @param x the point to evaluate
    /// @param xp the increasing abscissae
    /// @param fp the ordinates, same length as xp
    /// @return the interpolated value
    static double interpolate(double x, double[] xp, double[] fp) {
        int n = xp.length;
        if (x <= xp[0]) {
            return fp[0];
        }
        if (x >= xp[n - 1]) {
            return fp[n - 1];
        }
        int hit = Arrays.binarySearch(xp, x);
        if (hit >= 0) {
            return fp[hit];
        }
        int hi = -hit - 1;
        int lo = hi - 1;
        double t = (x - xp[lo]) / (xp[hi] - xp[lo]);
        return fp[lo] + t * (fp[hi] - fp[lo]);
    }
}
