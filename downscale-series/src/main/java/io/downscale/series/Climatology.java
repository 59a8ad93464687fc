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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.DoubleBinaryOperator;

/**
 * Per-period mean of a time series.
 *
 * <h2>Purpose</h2>
 *
 * <p>A climatology is the long-run mean of a variable for each period key,
 * e.g. the mean of all January values. It is used as a baseline: values can be
 * expressed relative to it (subtracted or divided out) and restored from it.
 *
 * <h2>Operations</h2>
 *
 * <pre>{@code
 *   removeFrom(s)  : s[t] - climo[key(t)]
 *   restoreTo(s)   : s[t] + climo[key(t)]
 *   divide(s)      : s[t] / climo[key(t)]
 *   broadcast(s)   : climo[key(t)]        on the index of s
 * }</pre>
 *
 * <p>Each operation is applied group by group and reassembled onto the input
 * index. A period key without a climatology value is fatal and raises
 * {@link UnseenPeriodException}.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class Climatology {

    private final SortedMap<Integer, Double> means;

    private Climatology(SortedMap<Integer, Double> means) {
        this.means = Collections.unmodifiableSortedMap(means);
    }

    /**
     * Computes the climatology of a series.
     *
     * @param series the series, all values finite
     * @param grouper the grouper
     * @return the per-period means
     * @throws InvalidSeriesException if the series is empty or has non-finite values
     */
    public static Climatology of(TimeSeries series, PeriodGrouper grouper) {
        Objects.requireNonNull(series, "series cannot be null");
        if (series.isEmpty()) {
            throw new InvalidSeriesException("cannot compute climatology of an empty series");
        }
        series.requireFinite("climatology input");

        SortedMap<Integer, Double> means = new TreeMap<>();
        for (Map.Entry<Integer, TimeSeries> entry : series.groupBy(grouper).groups().entrySet()) {
            double[] values = entry.getValue().valueArray();
            double sum = 0;
            for (double v : values) {
                sum += v;
            }
            means.put(entry.getKey(), sum / values.length);
        }
        return new Climatology(means);
    }

    /**
     * Creates a climatology from precomputed means.
     *
     * @param means the mean for each period key
     * @return the climatology
     */
    public static Climatology fromMap(Map<Integer, Double> means) {
        Objects.requireNonNull(means, "means cannot be null");
        if (means.isEmpty()) {
            throw new IllegalArgumentException("climatology needs at least one period");
        }
        return new Climatology(new TreeMap<>(means));
    }

    /**
     * Returns the mean for a period.
     *
     * @param key the period key
     * @return the mean
     * @throws UnseenPeriodException if the key has no value
     */
    public double get(int key) {
        Double mean = means.get(key);
        if (mean == null) {
            throw new UnseenPeriodException(key, "the climatology");
        }
        return mean;
    }

    public boolean contains(int key) {
        return means.containsKey(key);
    }

    public Set<Integer> keys() {
        return means.keySet();
    }

    public SortedMap<Integer, Double> asMap() {
        return means;
    }

    /**
     * Returns the smallest period mean.
     * @return the minimum over all keys, NaN if any mean is NaN
     */
    public double min() {
        double min = Double.POSITIVE_INFINITY;
        for (double v : means.values()) {
            min = Math.min(min, v);
        }
        return min;
    }

    /**
     * Returns the period key holding the smallest mean.
     * @return the key of {@link #min()}, the first NaN key if any mean is NaN
     */
    public int argMin() {
        int key = means.firstKey();
        double min = Double.POSITIVE_INFINITY;
        for (Map.Entry<Integer, Double> entry : means.entrySet()) {
            if (Double.isNaN(entry.getValue())) {
                return entry.getKey();
            }
            if (entry.getValue() < min) {
                min = entry.getValue();
                key = entry.getKey();
            }
        }
        return key;
    }

    /**
     * Subtracts the period mean from every sample.
     *
     * @param series the series
     * @param grouper the grouper the climatology was computed with
     * @return the anomaly series, on the input index
     */
    public TimeSeries removeFrom(TimeSeries series, PeriodGrouper grouper) {
        return applyByGroup(series, grouper, (v, c) -> v - c);
    }

    /**
     * Adds the period mean to every sample.
     *
     * @param series the series
     * @param grouper the grouper the climatology was computed with
     * @return the restored series, on the input index
     */
    public TimeSeries restoreTo(TimeSeries series, PeriodGrouper grouper) {
        return applyByGroup(series, grouper, Double::sum);
    }

    /**
     * Divides every sample by its period mean.
     *
     * @param series the series
     * @param grouper the grouper the climatology was computed with
     * @return the ratio series, on the input index
     */
    public TimeSeries divide(TimeSeries series, PeriodGrouper grouper) {
        return applyByGroup(series, grouper, (v, c) -> v / c);
    }

    /**
     * Places the period mean at every timestamp of a series.
     *
     * @param series the series supplying the index
     * @param grouper the grouper the climatology was computed with
     * @return the climatology on the input index
     */
    public TimeSeries broadcast(TimeSeries series, PeriodGrouper grouper) {
        return applyByGroup(series, grouper, (v, c) -> c);
    }

    private TimeSeries applyByGroup(TimeSeries series, PeriodGrouper grouper, DoubleBinaryOperator op) {
        Objects.requireNonNull(series, "series cannot be null");
        return series.groupBy(grouper).mapGroups((key, group) -> {
            double c = get(key);
            return group.mapValues(v -> op.applyAsDouble(v, c));
        });
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Climatology)) return false;
        return means.equals(((Climatology) o).means);
    }

    @Override
    public int hashCode() {
        return means.hashCode();
    }

    @Override
    public String toString() {
        return "Climatology" + means;
    }
}
