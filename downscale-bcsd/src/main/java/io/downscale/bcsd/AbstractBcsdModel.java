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

import io.downscale.qmap.QuantileMapper;
import io.downscale.qmap.QuantileMapperOptions;
import io.downscale.qmap.QuantileMappers;
import io.downscale.series.InvalidSeriesException;
import io.downscale.series.PeriodGrouper;
import io.downscale.series.TimeSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/// Shared fit/predict lifecycle of the BCSD variants.
///
/// Subclasses compute a complete [FittedState] from validated input in
/// [#fitState], and apply it in [#predict(FittedState, TimeSeries)]. The state
/// is published with a single volatile write, so a fit that throws leaves the
/// previous state in place.
public abstract class AbstractBcsdModel implements BcsdModel {

    private static final Logger logger = LogManager.getLogger(AbstractBcsdModel.class);

    private final PeriodGrouper grouper;
    private final QuantileMapperOptions mapperOptions;
    private final QuantileMapper mapper;
    private final boolean parallelGroups;

    private volatile FittedState state;

    protected AbstractBcsdModel(PeriodGrouper grouper, QuantileMapperOptions mapperOptions, boolean parallelGroups) {
        this.grouper = Objects.requireNonNull(grouper, "grouper cannot be null");
        this.mapperOptions = Objects.requireNonNull(mapperOptions, "mapperOptions cannot be null");
        this.mapper = QuantileMappers.create(mapperOptions);
        this.parallelGroups = parallelGroups;
    }

    @Override
    public final BcsdModel fit(TimeSeries trainingInput, TimeSeries target) {
        Objects.requireNonNull(trainingInput, "trainingInput cannot be null");
        Objects.requireNonNull(target, "target cannot be null");
        if (target.isEmpty()) {
            throw new InvalidSeriesException("cannot fit " + modelName() + " on an empty series");
        }
        trainingInput.requireSameIndex(target, "fit");
        trainingInput.requireFinite("training input");
        target.requireFinite("target");

        FittedState fitted = fitState(trainingInput, target);
        this.state = fitted;
        logger.info("Fitted {} on {} samples over {} {} periods",
            modelName(), target.size(), fitted.mapping().keys().size(), grouper.name());
        return this;
    }

    @Override
    public final TimeSeries predict(TimeSeries input) {
        Objects.requireNonNull(input, "input cannot be null");
        FittedState fitted = requireFitted();
        if (input.isEmpty()) {
            return input;
        }
        return predict(fitted, input);
    }

    /// Computes the learned state from validated, index-aligned, finite series.
    protected abstract FittedState fitState(TimeSeries trainingInput, TimeSeries target);

    /// Applies a learned state to a non-empty input.
    protected abstract TimeSeries predict(FittedState fitted, TimeSeries input);

    /// Checks a restored state against this model's variable.
    protected abstract void validateState(FittedState fitted);

    protected GroupedQuantileMapping fitMapping(TimeSeries target) {
        return GroupedQuantileMapping.fit(target, grouper, mapper, parallelGroups);
    }

    protected TimeSeries mapByGroup(FittedState fitted, TimeSeries input) {
        return fitted.mapping().transform(input, parallelGroups);
    }

    FittedState requireFitted() {
        FittedState fitted = state;
        if (fitted == null) {
            throw new ModelNotFittedException(modelName());
        }
        return fitted;
    }

    void restoreState(FittedState fitted) {
        Objects.requireNonNull(fitted, "fitted state cannot be null");
        validateState(fitted);
        this.state = fitted;
        logger.debug("Restored {} state for periods {}", modelName(), fitted.mapping().keys());
    }

    @Override
    public boolean isFitted() {
        return state != null;
    }

    @Override
    public PeriodGrouper grouper() {
        return grouper;
    }

    public QuantileMapperOptions mapperOptions() {
        return mapperOptions;
    }

    public boolean isParallelGroups() {
        return parallelGroups;
    }

    protected String modelName() {
        return getClass().getSimpleName();
    }

    @Override
    public String toString() {
        return modelName() + "[grouper=" + grouper.name() + ", mapper=" + mapperOptions
            + ", fitted=" + isFitted() + "]";
    }
}
