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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Objects;
import java.util.Set;

/**
 * Empirical quantile mapper using Cunnane plotting positions.
 *
 * <h2>Algorithm</h2>
 *
 * <p>Fitting sorts the target samples and assigns each the plotting position
 * {@code (i - alpha) / (n + 1 - alpha - beta)}. The fitted
 * {@link EmpiricalQuantileModel} then maps any input sample set by rank onto
 * that quantile function.
 *
 * <h2>Options</h2>
 *
 * <table>
 *   <caption>Options read from {@link QuantileMapperOptions}</caption>
 *   <tr><th>Name</th><th>Default</th><th>Meaning</th></tr>
 *   <tr><td>alpha</td><td>0.4</td><td>plotting position alpha, in [0, 1)</td></tr>
 *   <tr><td>beta</td><td>0.4</td><td>plotting position beta, in [0, 1)</td></tr>
 *   <tr><td>extrapolate</td><td>constant</td><td>tail handling, constant or linear</td></tr>
 *   <tr><td>n_endpoints</td><td>10</td><td>tail points used by linear extrapolation, at least 2</td></tr>
 *   <tr><td>detrend</td><td>false</td><td>remove a linear trend over sample order before mapping</td></tr>
 * </table>
 *
 * @see EmpiricalQuantileModel
 */
public final class CunnaneQuantileMapper implements QuantileMapper {

    private static final Logger logger = LogManager.getLogger(CunnaneQuantileMapper.class);

    public static final String MAPPER_TYPE = "cunnane";

    public static final String ALPHA = "alpha";
    public static final String BETA = "beta";
    public static final String EXTRAPOLATE = "extrapolate";
    public static final String N_ENDPOINTS = "n_endpoints";
    public static final String DETREND = "detrend";

    static final Set<String> OPTION_NAMES = Set.of(ALPHA, BETA, EXTRAPOLATE, N_ENDPOINTS, DETREND);

    private static final double DEFAULT_ALPHA = 0.4;
    private static final double DEFAULT_BETA = 0.4;
    private static final int DEFAULT_N_ENDPOINTS = 10;

    private final double alpha;
    private final double beta;
    private final Extrapolation extrapolation;
    private final int nEndpoints;
    private final boolean detrend;

    /**
     * Creates a mapper with Cunnane positions, constant extrapolation and no detrending.
     */
    public CunnaneQuantileMapper() {
        this(DEFAULT_ALPHA, DEFAULT_BETA, Extrapolation.CONSTANT, DEFAULT_N_ENDPOINTS, false);
    }

    /**
     * Creates a mapper with explicit settings.
     *
     * @param alpha plotting position alpha, in [0, 1)
     * @param beta plotting position beta, in [0, 1)
     * @param extrapolation tail handling
     * @param nEndpoints tail points for linear extrapolation, at least 2
     * @param detrend whether to remove a linear trend before mapping
     */
    public CunnaneQuantileMapper(double alpha, double beta, Extrapolation extrapolation, int nEndpoints, boolean detrend) {
        if (!(alpha >= 0 && alpha < 1)) {
            throw new IllegalArgumentException("alpha must be in [0, 1), got " + alpha);
        }
        if (!(beta >= 0 && beta < 1)) {
            throw new IllegalArgumentException("beta must be in [0, 1), got " + beta);
        }
        if (nEndpoints < 2) {
            throw new IllegalArgumentException("n_endpoints must be at least 2, got " + nEndpoints);
        }
        this.alpha = alpha;
        this.beta = beta;
        this.extrapolation = Objects.requireNonNull(extrapolation, "extrapolation cannot be null");
        this.nEndpoints = nEndpoints;
        this.detrend = detrend;
    }

    /**
     * Creates a mapper from options.
     *
     * @param options the options; unknown names are rejected
     * @return the mapper
     */
    public static CunnaneQuantileMapper fromOptions(QuantileMapperOptions options) {
        options.requireKnown(OPTION_NAMES);
        return new CunnaneQuantileMapper(
            options.getDouble(ALPHA, DEFAULT_ALPHA),
            options.getDouble(BETA, DEFAULT_BETA),
            Extrapolation.fromName(options.getString(EXTRAPOLATE, "constant")),
            options.getInt(N_ENDPOINTS, DEFAULT_N_ENDPOINTS),
            options.getBoolean(DETREND, false));
    }

    @Override
    public String getMapperType() {
        return MAPPER_TYPE;
    }

    @Override
    public EmpiricalQuantileModel fit(double[] targetSamples) {
        Objects.requireNonNull(targetSamples, "targetSamples cannot be null");
        if (targetSamples.length == 0) {
            throw new IllegalArgumentException("targetSamples cannot be empty");
        }
        for (double v : targetSamples) {
            if (!Double.isFinite(v)) {
                throw new IllegalArgumentException("targetSamples contain non-finite value " + v);
            }
        }

        double[] values = detrend ? LinearTrend.overOrder(targetSamples).removeSlope(targetSamples) : targetSamples;
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        if (sorted[0] == sorted[sorted.length - 1]) {
            logger.warn("All {} target samples equal {}; mapped values will be constant", sorted.length, sorted[0]);
        }

        double[] positions = PlottingPositions.positions(sorted.length, alpha, beta);
        int tail = Math.min(nEndpoints, sorted.length);
        LinearTrend lowerTail = LinearTrend.fit(positions, sorted, 0, tail);
        LinearTrend upperTail = LinearTrend.fit(positions, sorted, sorted.length - tail, sorted.length);

        return new EmpiricalQuantileModel(sorted, alpha, beta, detrend, extrapolation, lowerTail, upperTail);
    }

    @Override
    public String toString() {
        return "CunnaneQuantileMapper[alpha=" + alpha + ", beta=" + beta + ", extrapolate=" + extrapolation
            + ", n_endpoints=" + nEndpoints + ", detrend=" + detrend + "]";
    }
}
