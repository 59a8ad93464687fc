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

import com.google.gson.annotations.SerializedName;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

/**
 * Fitted empirical quantile function of a target sample set.
 *
 * <h2>Algorithm</h2>
 *
 * <p>The model stores the sorted target samples together with their plotting
 * positions. Mapping an input sample set works in two steps:
 * <ol>
 *   <li>Each input value gets the plotting position of its rank within the
 *       input set itself (ties share their mean rank)</li>
 *   <li>That probability is converted back to a value by linear interpolation
 *       of the target's quantile function</li>
 * </ol>
 *
 * <pre>{@code
 *  input x ──rank──► p = (r - α)/(n + 1 - α - β) ──Q_target(p)──► mapped x
 * }</pre>
 *
 * <p>Probabilities beyond the target's first or last plotting position are
 * clamped, or extended along a least-squares line through the tail points
 * when {@link Extrapolation#LINEAR} was requested at fit time.
 *
 * <p>With detrending enabled, the sloped part of a linear trend over sample
 * order is removed from the input before mapping and added back afterwards.
 * The target was detrended the same way at fit time.
 *
 * <p>Mapping the target samples themselves returns them unchanged.
 *
 * @see CunnaneQuantileMapper
 */
@MapperType(CunnaneQuantileMapper.MAPPER_TYPE)
public final class EmpiricalQuantileModel implements FittedQuantileMapper {

    @SerializedName("values")
    private final double[] sortedValues;

    @SerializedName("alpha")
    private final double alpha;

    @SerializedName("beta")
    private final double beta;

    @SerializedName("detrend")
    private final boolean detrend;

    @SerializedName("extrapolate")
    private final Extrapolation extrapolation;

    @SerializedName("lower_slope")
    private final double lowerSlope;

    @SerializedName("lower_intercept")
    private final double lowerIntercept;

    @SerializedName("upper_slope")
    private final double upperSlope;

    @SerializedName("upper_intercept")
    private final double upperIntercept;

    /// Computed from values, alpha and beta - transient to keep JSON compact.
    private transient volatile double[] positions;

    EmpiricalQuantileModel(double[] sortedValues, double alpha, double beta, boolean detrend,
                           Extrapolation extrapolation, LinearTrend lowerTail, LinearTrend upperTail) {
        Objects.requireNonNull(sortedValues, "sortedValues cannot be null");
        if (sortedValues.length == 0) {
            throw new IllegalArgumentException("need at least one fitted value");
        }
        this.sortedValues = Arrays.copyOf(sortedValues, sortedValues.length);
        this.alpha = alpha;
        this.beta = beta;
        this.detrend = detrend;
        this.extrapolation = Objects.requireNonNull(extrapolation, "extrapolation cannot be null");
        this.lowerSlope = lowerTail.slope();
        this.lowerIntercept = lowerTail.intercept();
        this.upperSlope = upperTail.slope();
        this.upperIntercept = upperTail.intercept();
        this.positions = PlottingPositions.positions(sortedValues.length, alpha, beta);
    }

    @Override
    public String getMapperType() {
        return CunnaneQuantileMapper.MAPPER_TYPE;
    }

    @Override
    public double[] transform(double[] samples) {
        Objects.requireNonNull(samples, "samples cannot be null");
        if (samples.length == 0) {
            return new double[0];
        }
        for (double v : samples) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("cannot quantile-map non-finite value " + v);
            }
        }

        LinearTrend trend = null;
        double[] input = samples;
        if (detrend) {
            trend = LinearTrend.overOrder(samples);
            input = trend.removeSlope(samples);
        }

        double[] p = PlottingPositions.rankPositions(input, alpha, beta);
        double[] mapped = new double[p.length];
        for (int i = 0; i < p.length; i++) {
            mapped[i] = quantile(p[i]);
        }

        return trend != null ? trend.restoreSlope(mapped) : mapped;
    }

    /**
     * Evaluates the fitted quantile function.
     *
     * @param p a non-exceedance probability
     * @return the target value at that probability
     */
    public double quantile(double p) {
        double[] xp = positions();
        int n = xp.length;
        if (extrapolation == Extrapolation.LINEAR && n > 1) {
            if (p < xp[0]) {
                return lowerIntercept + lowerSlope * p;
            }
            if (p > xp[n - 1]) {
                return upperIntercept + upperSlope * p;
            }
        }
        return PlottingPositions.interpolate(p, xp, sortedValues);
    }

    /**
     * Evaluates the fitted cumulative distribution function, clamped to the
     * first and last plotting positions.
     *
     * @param x a value
     * @return the interpolated non-exceedance probability
     */
    public double cdf(double x) {
        double[] xp = positions();
        if (x <= sortedValues[0]) {
            return xp[0];
        }
        if (x >= sortedValues[sortedValues.length - 1]) {
            return xp[xp.length - 1];
        }
        // first index with value > x
        int hi = 0;
        while (sortedValues[hi] <= x) {
            hi++;
        }
        int lo = hi - 1;
        if (sortedValues[lo] == x) {
            return xp[lo];
        }
        double t = (x - sortedValues[lo]) / (sortedValues[hi] - sortedValues[lo]);
        return xp[lo] + t * (xp[hi] - xp[lo]);
    }

    private double[] positions() {
        if (positions == null) {
            positions = PlottingPositions.positions(sortedValues.length, alpha, beta);
        }
        return positions;
    }

    @Override
    public void requireComplete() {
        if (sortedValues == null || sortedValues.length == 0) {
            throw new IllegalArgumentException("cunnane mapper has no fitted values");
        }
        if (extrapolation == null) {
            throw new IllegalArgumentException("cunnane mapper has no extrapolation mode");
        }
        for (int i = 0; i < sortedValues.length; i++) {
            if (!Double.isFinite(sortedValues[i])) {
                throw new IllegalArgumentException(
                    "cunnane mapper has a non-finite fitted value at index " + i);
            }
            if (i > 0 && sortedValues[i] < sortedValues[i - 1]) {
                throw new IllegalArgumentException(
                    "cunnane mapper values are not sorted at index " + i);
            }
        }
    }

    public int getSampleCount() {
        return sortedValues.length;
    }

    /**
     * Returns the sorted fitted values.
     * @return a copy of the fitted values
     */
    public double[] getSortedValues() {
        return Arrays.copyOf(sortedValues, sortedValues.length);
    }

    public double getAlpha() {
        return alpha;
    }

    public double getBeta() {
        return beta;
    }

    public boolean isDetrend() {
        return detrend;
    }

    public Extrapolation getExtrapolation() {
        return extrapolation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmpiricalQuantileModel)) return false;
        EmpiricalQuantileModel that = (EmpiricalQuantileModel) o;
        return Double.compare(alpha, that.alpha) == 0
            && Double.compare(beta, that.beta) == 0
            && detrend == that.detrend
            && extrapolation == that.extrapolation
            && Double.compare(lowerSlope, that.lowerSlope) == 0
            && Double.compare(lowerIntercept, that.lowerIntercept) == 0
            && Double.compare(upperSlope, that.upperSlope) == 0
            && Double.compare(upperIntercept, that.upperIntercept) == 0
            && Arrays.equals(sortedValues, that.sortedValues);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(sortedValues);
        result = 31 * result + Objects.hash(alpha, beta, detrend, extrapolation);
        return result;
    }

    @Override
    public String toString() {
        return "EmpiricalQuantileModel[n=" + sortedValues.length + ", range=[" + sortedValues[0] + ", "
            + sortedValues[sortedValues.length - 1] + "], extrapolate=" + extrapolation.name().toLowerCase(Locale.ROOT)
            + (detrend ? ", detrend" : "") + "]";
    }
}
