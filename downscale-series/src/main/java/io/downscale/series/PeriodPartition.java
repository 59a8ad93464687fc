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
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

/// A time series split into disjoint groups by period key.
///
/// ## Partition Invariant
///
/// Every sample of the source series belongs to exactly one group, groups are
/// disjoint, and their union is the source series. Each group keeps its samples
/// in source order.
///
/// ```
///  source:  Jan-1 Jan-2 ... Feb-1 ... Jan-1' Jan-2' ...
///              │                │          │
///              ▼                ▼          ▼
///  key 1:   Jan-1 Jan-2 ... Jan-1' Jan-2' ...
///  key 2:   Feb-1 ...
/// ```
///
/// ## Group-wise Apply
///
/// [#mapGroups] is an explicit map over the partition followed by an explicit
/// merge-by-timestamp. The merged result is checked against the source index,
/// so no sample can be gained, lost or reordered by a group-wise operation.
///
/// @see TimeSeries#groupBy(PeriodGrouper)
public final class PeriodPartition {

    private final TimeSeries source;
    private final PeriodGrouper grouper;
    private final SortedMap<Integer, TimeSeries> groups;

    private PeriodPartition(TimeSeries source, PeriodGrouper grouper, SortedMap<Integer, TimeSeries> groups) {
        this.source = source;
        this.grouper = grouper;
        this.groups = groups;
    }

    /// Partitions a series.
    ///
    /// @param series the source series
    /// @param grouper the grouper
    /// @return the partition, with groups ordered by key
    public static PeriodPartition of(TimeSeries series, PeriodGrouper grouper) {
        Objects.requireNonNull(series, "series cannot be null");
        Objects.requireNonNull(grouper, "grouper cannot be null");

        LocalDate[] index = series.indexArray();
        double[] values = series.valueArray();

        Map<Integer, List<Integer>> positions = new TreeMap<>();
        for (int i = 0; i < index.length; i++) {
            positions.computeIfAbsent(grouper.keyOf(index[i]), k -> new ArrayList<>()).add(i);
        }

        SortedMap<Integer, TimeSeries> groups = new TreeMap<>();
        for (Map.Entry<Integer, List<Integer>> entry : positions.entrySet()) {
            List<Integer> members = entry.getValue();
            LocalDate[] groupIndex = new LocalDate[members.size()];
            double[] groupValues = new double[members.size()];
            for (int j = 0; j < members.size(); j++) {
                int position = members.get(j);
                groupIndex[j] = index[position];
                groupValues[j] = values[position];
            }
            groups.put(entry.getKey(), TimeSeries.wrap(groupIndex, groupValues));
        }
        return new PeriodPartition(series, grouper, Collections.unmodifiableSortedMap(groups));
    }

    public TimeSeries source() {
        return source;
    }

    public PeriodGrouper grouper() {
        return grouper;
    }

    /// Returns the period keys in ascending order.
    /// @return the keys
    public List<Integer> keys() {
        return new ArrayList<>(groups.keySet());
    }

    /// Returns the group for a key.
    ///
    /// @param key the period key
    /// @return the group, or an empty series if no sample has this key
    public TimeSeries group(int key) {
        TimeSeries group = groups.get(key);
        return group != null ? group : TimeSeries.empty();
    }

    public SortedMap<Integer, TimeSeries> groups() {
        return groups;
    }

    public int size() {
        return groups.size();
    }

    /// Applies a function to each group and merges the results back into one series.
    ///
    /// The function must return a series with exactly the group's index.
    ///
    /// @param fn the per-group function, given the key and the group
    /// @return the merged series, on the source index
    /// @throws InvalidSeriesException if a result does not match its group's index
    public TimeSeries mapGroups(BiFunction<Integer, TimeSeries, TimeSeries> fn) {
        Map<Integer, TimeSeries> mapped = new TreeMap<>();
        for (Map.Entry<Integer, TimeSeries> entry : groups.entrySet()) {
            mapped.put(entry.getKey(), fn.apply(entry.getKey(), entry.getValue()));
        }
        return reassemble(mapped);
    }

    /// Merges per-group results into one series on the source index.
    ///
    /// @param results one series per key of this partition
    /// @return the merged series
    /// @throws InvalidSeriesException if keys are missing or a result does not match its group's index
    public TimeSeries reassemble(Map<Integer, TimeSeries> results) {
        if (!results.keySet().equals(groups.keySet())) {
            throw new InvalidSeriesException(
                "group results for keys " + results.keySet() + " do not match partition keys " + groups.keySet());
        }
        for (Map.Entry<Integer, TimeSeries> entry : results.entrySet()) {
            groups.get(entry.getKey()).requireSameIndex(entry.getValue(), "reassemble group " + entry.getKey() + " of");
        }
        TimeSeries merged = TimeSeries.merge(results.values());
        if (!Arrays.equals(merged.indexArray(), source.indexArray())) {
            throw new InvalidSeriesException("reassembled series does not match source index");
        }
        return merged;
    }

    /// Merges the groups back into the source series.
    /// @return a series equal to the source
    public TimeSeries merge() {
        return reassemble(groups);
    }

    @Override
    public String toString() {
        return "PeriodPartition[" + grouper.name() + ", "
            + groups.entrySet().stream()
                .map(e -> e.getKey() + ":" + e.getValue().size())
                .collect(Collectors.joining(", ", "{", "}"))
            + "]";
    }
}
