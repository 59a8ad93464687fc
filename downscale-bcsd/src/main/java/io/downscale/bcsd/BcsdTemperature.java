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

import io.downscale.qmap.QuantileMapperOptions;
import io.downscale.series.Climatology;
import io.downscale.series.PeriodGrouper;
import io.downscale.series.PeriodGroupers;
import io.downscale.series.RollingWindow;
import io.downscale.series.TimeSeries;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * BCSD for temperature.
 *
 * <h2>Fit</h2>
 * Computes the climatology of the training input and of the target, and fits
 * one quantile mapper per period on the target samples.
 *
 * <h2>Predict</h2>
 * <pre>{@code
 *   rolling   = rollingMean(X)
 *   shift     = rolling - trainingClimatology[period]
 *   deshifted = X - shift
 *   qm        = quantile map deshifted by period
 *   reshifted = qm + shift
 *   result    = reshifted - targetClimatology[period]
 * }</pre>
 *
 * <p>The result is an anomaly relative to the target climatology. The rolling
 * mean keeps the slow trend of the input out of quantile mapping and puts it
 * back afterwards.
 */
public class BcsdTemperature extends AbstractBcsdModel {

    private static final Logger logger = LogManager.getLogger(BcsdTemperature.class);

    private final ShiftExtractor shiftExtractor;

    public BcsdTemperature() {
        this(PeriodGroupers.MONTH_OF_YEAR, QuantileMapperOptions.defaults());
    }

    public BcsdTemperature(PeriodGrouper grouper, QuantileMapperOptions mapperOptions) {
        this(grouper, mapperOptions, RollingWindow.centered9(), RollingScope.SERIES, false);
    }

    public BcsdTemperature(PeriodGrouper grouper, QuantileMapperOptions mapperOptions,
                           RollingWindow window, RollingScope scope, boolean parallelGroups) {
        super(grouper, mapperOptions, parallelGroups);
        this.shiftExtractor = new ShiftExtractor(window, scope, grouper);
    }

    @Override
    protected FittedState fitState(TimeSeries trainingInput, TimeSeries target) {
        Climatology trainingClimatology = Climatology.of(trainingInput, grouper());
        Climatology targetClimatology = Climatology.of(target, grouper());
        return new FittedState(trainingClimatology, targetClimatology, fitMapping(target));
    }

    @Override
    protected TimeSeries predict(FittedState fitted, TimeSeries input) {
        TimeSeries shift = shiftExtractor.shift(input, fitted.trainingClimatology());
        TimeSeries deshifted = shiftExtractor.deshift(input, shift);
        logger.debug("Removed rolling shift from {} samples with {}", input.size(), shiftExtractor);
        TimeSeries mapped = mapByGroup(fitted, deshifted);
        TimeSeries reshifted = shiftExtractor.restore(mapped, shift);
        return fitted.targetClimatology().removeFrom(reshifted, grouper());
    }

    @Override
    protected void validateState(FittedState fitted) {
        Objects.requireNonNull(fitted.trainingClimatology(),
            "temperature state needs a training climatology");
    }

    public ShiftExtractor shiftExtractor() {
        return shiftExtractor;
    }

    @Override
    public Variable variable() {
        return Variable.TEMPERATURE;
    }

    @Override
    public BcsdConfig toConfig() {
        RollingWindow window = shiftExtractor.window();
        return new BcsdConfig()
            .setVariable(variable().configName())
            .setGrouper(grouper().name())
            .setQuantileMapper(mapperOptions().asMap())
            .setRollingWindow(window.window())
            .setRollingMinPeriods(window.minPeriods())
            .setRollingCentered(window.centered())
            .setRollingScope(shiftExtractor.scope().configName())
            .setParallelGroups(isParallelGroups());
    }
}
