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

import io.downscale.qmap.FittedQuantileMapper;
import io.downscale.qmap.QuantileMapper;
import io.downscale.series.InvalidSeriesException;
import io.downscale.series.PeriodGrouper;
import io.downscale.series.PeriodPartition;
import io.downscale.series.TimeSeries;
import io.downscale.series.UnseenPeriodException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

/**
 * One fitted quantile mapper per period group.
 *
 * <h2>Fit</h2>
 *
 * <pre>{@code
 *   target ──groupBy──► {k1: y1, k2: y2, ...}
 *                         │      │
 *                       fit(y1) fit(y2)   ──► {k1: m1, k2: m2, ...}
 * }</pre>
 *
 * <h2>Transform</h2>
 *
 * <pre>{@code
 *   input ──groupBy──► {k1: x1, k2: x2, ...}
 *                        │         │
 *                     m1(x1)    m2(x2)   ──merge by timestamp──► output
 * }</pre>
 *
 * <p>Groups are independent, so fit and transform may run them on a parallel
 * stream. Results are collected per key and reassembled on the input index, so
 * the output does not depend on the order in which groups complete.
 *
 * <p>Instances are immutable and safe to share between threads.
 */
public final class GroupedQuantileMapping {

    private static final Logger logger = LogManager.getLogger(GroupedQuantileMapping.class);

    private final PeriodGrouper grouper;
    private final SortedMap<Integer, FittedQuantileMapper> mappers;

    private GroupedQuantileMapping(PeriodGrouper grouper, SortedMap<Integer, FittedQuantileMapper> mappers) {
        this.grouper = grouper;
        this.mappers = Collections.unmodifiableSortedMap(mappers);
    }

    /**
     * Fits one mapper per period group of the target series.
     *
     * @param target the target (observed) series
     * @param grouper the period grouper
     * @param mapper the unfitted mapper, fitted once per group
     * @param parallel whether to fit groups concurrently
     * @return the fitted mapping
     * @throws InvalidSeriesException if the target is empty or has non-finite values
     */
    public static GroupedQuantileMapping fit(
        TimeSeries target, PeriodGrouper grouper, QuantileMapper mapper, boolean parallel) {
        Objects.requireNonNull(target, "target cannot be null");
        Objects.requireNonNull(grouper, "grouper cannot be null");
        Objects.requireNonNull(mapper, "mapper cannot be null");
        if (target.isEmpty()) {
            throw new InvalidSeriesException("cannot fit quantile mapping on an empty target series");
        }
        target.requireFinite("quantile mapping target");

        PeriodPartition partition = target.groupBy(grouper);
        Map<Integer, FittedQuantileMapper> fitted = forEachGroup(partition, parallel, (key, group) -> {
            if (group.isEmpty()) {
                throw new InvalidSeriesException("period " + key + " has no target samples");
            }
            logger.debug("Fitting {} mapper for period {} on {} samples",
                mapper.getMapperType(), key, group.size());
            return mapper.fit(group.values());
        });
        return new GroupedQuantileMapping(grouper, new TreeMap<>(fitted));
    }

    /**
     * Rebuilds a mapping from previously fitted mappers.
     *
     * @param grouper the grouper the mappers were fitted with
     * @param mappers the fitted mapper for each period key
     * @return the mapping
     */
    public static GroupedQuantileMapping of(PeriodGrouper grouper, Map<Integer, FittedQuantileMapper> mappers) {
        Objects.requireNonNull(grouper, "grouper cannot be null");
        Objects.requireNonNull(mappers, "mappers cannot be null");
        if (mappers.isEmpty()) {
            throw new IllegalArgumentException("a quantile mapping needs at least one period");
        }
        SortedMap<Integer, FittedQuantileMapper> copy = new TreeMap<>();
        for (Map.Entry<Integer, FittedQuantileMapper> entry : mappers.entrySet()) {
            copy.put(entry.getKey(), Objects.requireNonNull(entry.getValue(),
                "mapper for period " + entry.getKey() + " cannot be null"));
        }
        return new GroupedQuantileMapping(grouper, copy);
    }

    /**
     * Maps every sample through the mapper of its period group.
     *
     * @param input the series to transform
     * @param parallel whether to transform groups concurrently
     * @return the mapped series, on the input index
     * @throws UnseenPeriodException if the input has a period with no fitted mapper
     * @throws InvalidSeriesException if the input has non-finite values
     */
    public TimeSeries transform(TimeSeries input, boolean parallel) {
        Objects.requireNonNull(input, "input cannot be null");
        if (input.isEmpty()) {
            return input;
        }
        input.requireFinite("quantile mapping input");

        PeriodPartition partition = input.groupBy(grouper);
        for (Integer key : partition.keys()) {
            mapperFor(key);
        }
        Map<Integer, TimeSeries> mapped = forEachGroup(partition, parallel, (key, group) -> {
            logger.debug("Mapping {} samples of period {}", group.size(), key);
            return group.withValues(mappers.get(key).transform(group.values()));
        });
        return partition.reassemble(mapped);
    }

    /**
     * Returns the fitted mapper of a period.
     *
     * @param key the period key
     * @return the mapper
     * @throws UnseenPeriodException if no mapper was fitted for the key
     */
    public FittedQuantileMapper mapperFor(int key) {
        FittedQuantileMapper mapper = mappers.get(key);
        if (mapper == null) {
            throw new UnseenPeriodException(key, "the quantile mapping");
        }
        return mapper;
    }

    public PeriodGrouper grouper() {
        return grouper;
    }

    public Set<Integer> keys() {
        return mappers.keySet();
    }

    /// @return an unmodifiable view of the fitted mappers by period key
    public SortedMap<Integer, FittedQuantileMapper> mappers() {
        return mappers;
    }

    private static <R> Map<Integer, R> forEachGroup(
        PeriodPartition partition, boolean parallel, BiFunction<Integer, TimeSeries, R> fn) {
        Set<Map.Entry<Integer, TimeSeries>> groups = partition.groups().entrySet();
        if (parallel) {
            return groups.parallelStream().collect(Collectors.toMap(
                Map.Entry::getKey, e -> fn.apply(e.getKey(), e.getValue()), (a, b) -> a, ConcurrentHashMap::new));
        }
        Map<Integer, R> results = new TreeMap<>();
        for (Map.Entry<Integer, TimeSeries> entry : groups) {
            results.put(entry.getKey(), fn.apply(entry.getKey(), entry.getValue()));
        }
        return results;
    }

    @Override
    public String toString() {
        return "GroupedQuantileMapping[" + grouper.name() + ", periods=" + mappers.keySet() + "]";
    }
}
