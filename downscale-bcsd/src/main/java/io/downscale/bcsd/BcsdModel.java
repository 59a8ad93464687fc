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

import io.downscale.series.PeriodGrouper;
import io.downscale.series.TimeSeries;

/**
 * A pointwise bias-correction model in the BCSD family.
 *
 * <p>A model learns, from a training input series {@code X} (e.g. a coarse
 * simulation) and a target series {@code y} (e.g. observations) on the same
 * timestamps, how to map new input onto the target distribution, one period
 * group at a time.
 *
 * <pre>{@code
 *   BcsdModel model = BcsdModels.create(config);
 *   model.fit(trainingInput, observations);
 *   TimeSeries corrected = model.predict(futureInput);
 * }</pre>
 *
 * <p>Fitted state is immutable and replaced atomically by each successful
 * {@link #fit}; {@link #predict} may be called from several threads.
 */
public interface BcsdModel {

    /**
     * Learns the correction from a training input and target.
     *
     * @param trainingInput the training input series X
     * @param target the target series y, on the same timestamps as X
     * @return this model
     * @throws io.downscale.series.InvalidSeriesException if either series is empty,
     *     has non-finite values, or the indexes differ
     * @throws InvalidClimatologyException if the target climatology is unusable for this variable
     */
    BcsdModel fit(TimeSeries trainingInput, TimeSeries target);

    /**
     * Corrects an input series.
     *
     * @param input the input series
     * @return the corrected series, on the input index
     * @throws ModelNotFittedException if {@link #fit} has not succeeded
     * @throws io.downscale.series.UnseenPeriodException if the input has a period not seen at fit time
     */
    TimeSeries predict(TimeSeries input);

    boolean isFitted();

    Variable variable();

    PeriodGrouper grouper();

    /// @return a configuration that recreates this model, unfitted
    BcsdConfig toConfig();
}
