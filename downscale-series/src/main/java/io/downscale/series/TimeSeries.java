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

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * Immutable single-variable time series with a strictly increasing date index.
 *
 * <h2>Representation</h2>
 *
 * <p>Samples are stored as two index-aligned arrays, one of timestamps and
 * one of values. The index is strictly increasing: duplicate timestamps are
 * rejected at construction, including when several series are merged back
 * together with {@link #merge(Collection)}.
 *
 * <pre>{@code
 *  index:  2000-01-01  2000-01-02  2000-01-03  ...
 *  values:       1.25        0.00        3.50  ...
 * }</pre>
 *
 * <h2>Finite values</h2>
 *
 * <p>Values may be NaN or infinite. Operations that cannot work with
 * such values (fitting, climatology) call {@link #requireFinite(String)}.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * TimeSeries tas = TimeSeries.of(dates, values);
 * PeriodPartition byMonth = tas.groupBy(PeriodGroupers.MONTH_OF_YEAR);
 * TimeSeries anomaly = tas.minus(baseline);
 * }</pre>
 *
 * @see PeriodPartition
 * @see Climatology
 */
public final class TimeSeries {

    private final LocalDate[] index;
    private final double[] values;

    private TimeSeries(LocalDate[] index, double[] values) {
        this.index = index;
        this.values = values;
    }

    /**
     * Creates a time series from an index and values, copying both arrays.
     *
     * @param index the timestamps, strictly increasing
     * @param values the values, same length as the index
     * @return the time series
     * @throws InvalidSeriesException if the arrays differ in length, a timestamp is
     *         null, or timestamps are not strictly increasing
     */
    public static TimeSeries of(LocalDate[] index, double[] values) {
        Objects.requireNonNull(index, "index cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        return checked(Arrays.copyOf(index, index.length), Arrays.copyOf(values, values.length));
    }

    /**
     * Creates a time series from a list of timestamps and values.
     *
     * @param index the timestamps, strictly increasing
     * @param values the values, same length as the index
     * @return the time series
     */
    public static TimeSeries of(List<LocalDate> index, double[] values) {
        Objects.requireNonNull(index, "index cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        return checked(index.toArray(new LocalDate[0]), Arrays.copyOf(values, values.length));
    }

    /**
     * Creates an empty time series.
     *
     * @return a series with no samples
     */
    public static TimeSeries empty() {
        return new TimeSeries(new LocalDate[0], new double[0]);
    }

    private static TimeSeries checked(LocalDate[] index, double[] values) {
        if (index.length != values.length) {
            throw new InvalidSeriesException(
                "index and values must have same length: " + index.length + " != " + values.length);
        }
        for (int i = 0; i < index.length; i++) {
            if (index[i] == null) {
                throw new InvalidSeriesException("null timestamp at position " + i);
            }
            if (i > 0 && !index[i].isAfter(index[i - 1])) {
                if (index[i].equals(index[i - 1])) {
                    throw new InvalidSeriesException("duplicate timestamp " + index[i]);
                }
                throw new InvalidSeriesException(
                    "timestamps not increasing at position " + i + ": " + index[i - 1] + " then " + index[i]);
            }
        }
        return new TimeSeries(index, values);
    }

    /**
     * Merges disjoint series into one series ordered by timestamp.
     *
     * <p>This is the reassembly step after a group-wise operation: the parts
     * are concatenated and sorted by timestamp. Any timestamp present in more
     * than one part is rejected.
     *
     * @param parts the series to merge
     * @return the merged series
     * @throws InvalidSeriesException if a timestamp appears more than once
     */
    public static TimeSeries merge(Collection<TimeSeries> parts) {
        Objects.requireNonNull(parts, "parts cannot be null");
        int total = 0;
        for (TimeSeries part : parts) {
            total += part.size();
        }

        List<Sample> samples = new ArrayList<>(total);
        for (TimeSeries part : parts) {
            for (int i = 0; i < part.size(); i++) {
                samples.add(new Sample(part.index[i], part.values[i]));
            }
        }
        samples.sort(Comparator.comparing(Sample::timestamp));

        LocalDate[] index = new LocalDate[total];
        double[] values = new double[total];
        for (int i = 0; i < total; i++) {
            Sample sample = samples.get(i);
            index[i] = sample.timestamp();
            values[i] = sample.value();
        }
        return checked(index, values);
    }

    private record Sample(LocalDate timestamp, double value) {
    }

    public int size() {
        return index.length;
    }

    public boolean isEmpty() {
        return index.length == 0;
    }

    public LocalDate timestamp(int position) {
        return index[position];
    }

    public double value(int position) {
        return values[position];
    }

    /**
     * Returns the timestamps.
     * @return a copy of the index
     */
    public LocalDate[] index() {
        return Arrays.copyOf(index, index.length);
    }

    /**
     * Returns the values.
     * @return a copy of the values
     */
    public double[] values() {
        return Arrays.copyOf(values, values.length);
    }

    /**
     * Returns a series on the same index with new values.
     *
     * @param newValues the values, same length as this series
     * @return a new series
     * @throws InvalidSeriesException if the length differs
     */
    public TimeSeries withValues(double[] newValues) {
        Objects.requireNonNull(newValues, "values cannot be null");
        if (newValues.length != index.length) {
            throw new InvalidSeriesException(
                "expected " + index.length + " values but got " + newValues.length);
        }
        return new TimeSeries(index, Arrays.copyOf(newValues, newValues.length));
    }

    /**
     * Applies a function to every value.
     *
     * @param op the function
     * @return a new series on the same index
     */
    public TimeSeries mapValues(DoubleUnaryOperator op) {
        double[] mapped = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            mapped[i] = op.applyAsDouble(values[i]);
        }
        return new TimeSeries(index, mapped);
    }

    /**
     * Adds another series elementwise.
     *
     * @param other a series on the same index
     * @return the sum
     * @throws InvalidSeriesException if the indexes differ
     */
    public TimeSeries plus(TimeSeries other) {
        return combine(other, Double::sum, "add");
    }

    /**
     * Subtracts another series elementwise.
     *
     * @param other a series on the same index
     * @return the difference
     * @throws InvalidSeriesException if the indexes differ
     */
    public TimeSeries minus(TimeSeries other) {
        return combine(other, (a, b) -> a - b, "subtract");
    }

    private TimeSeries combine(TimeSeries other, DoubleBinaryOperator op, String verb) {
        requireSameIndex(other, verb);
        double[] combined = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            combined[i] = op.applyAsDouble(values[i], other.values[i]);
        }
        return new TimeSeries(index, combined);
    }

    /**
     * Tests whether another series has exactly this series' index.
     *
     * @param other the other series
     * @return true if both indexes hold the same timestamps in the same order
     */
    public boolean sameIndex(TimeSeries other) {
        return other == this || index == other.index || Arrays.equals(index, other.index);
    }

    /**
     * Requires another series to share this series' index.
     *
     * @param other the other series
     * @param operation what the two series are aligned for, used in the message
     * @throws InvalidSeriesException if the indexes differ
     */
    public void requireSameIndex(TimeSeries other, String operation) {
        Objects.requireNonNull(other, "other series cannot be null");
        if (!sameIndex(other)) {
            throw new InvalidSeriesException(
                "cannot " + operation + " series with different indexes (" + describeIndex()
                    + " vs " + other.describeIndex() + ")");
        }
    }

    public boolean isAllFinite() {
        for (double v : values) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Requires every value to be finite.
     *
     * @param what a description of the series, used in the message
     * @return this series
     * @throws InvalidSeriesException naming the first non-finite sample
     */
    public TimeSeries requireFinite(String what) {
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i])) {
                throw new InvalidSeriesException(
                    what + " has non-finite value " + values[i] + " at " + index[i]);
            }
        }
        return this;
    }

    /**
     * Partitions this series by period key.
     *
     * @param grouper the grouper
     * @return the partition
     */
    public PeriodPartition groupBy(PeriodGrouper grouper) {
        return PeriodPartition.of(this, grouper);
    }

    /// Package-private view used by partitioning without copying.
    LocalDate[] indexArray() {
        return index;
    }

    /// Package-private view used by partitioning without copying.
    double[] valueArray() {
        return values;
    }

    static TimeSeries wrap(LocalDate[] index, double[] values) {
        return new TimeSeries(index, values);
    }

    private String describeIndex() {
        if (index.length == 0) {
            return "empty";
        }
        return index.length + " samples " + index[0] + ".." + index[index.length - 1];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeSeries)) return false;
        TimeSeries that = (TimeSeries) o;
        return Arrays.equals(index, that.index) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(index);
        result = 31 * result + Arrays.hashCode(values);
        return result;
    }

    @Override
    public String toString() {
        return "TimeSeries[" + describeIndex() + "]";
    }
}
