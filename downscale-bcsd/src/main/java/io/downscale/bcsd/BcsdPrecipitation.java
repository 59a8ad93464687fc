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
import io.downscale.series.TimeSeries;

/**
 * BCSD for precipitation.
 *
 * <h2>Fit</h2>
 * The target climatology is computed per period, and must be strictly
 * positive in every period. One quantile mapper is fitted per period on the
 * target samples.
 *
 * <h2>Predict</h2>
 * <pre>{@code
 *   X ──quantile map by period──► qm ──÷ targetClimatology[period]──► ratio
 * }</pre>
 *
 * <p>The output is a ratio to the target climatology, not an amount; callers
 * multiply by a fine-scale climatology to recover amounts.
 */
public class BcsdPrecipitation extends AbstractBcsdModel {

    public BcsdPrecipitation() {
        this(PeriodGroupers.MONTH_OF_YEAR, QuantileMapperOptions.defaults());
    }

    public BcsdPrecipitation(PeriodGrouper grouper, QuantileMapperOptions mapperOptions) {
        this(grouper, mapperOptions, false);
    }

    public BcsdPrecipitation(PeriodGrouper grouper, QuantileMapperOptions mapperOptions, boolean parallelGroups) {
        super(grouper, mapperOptions, parallelGroups);
    }

    @Override
    protected FittedState fitState(TimeSeries trainingInput, TimeSeries target) {
        Climatology targetClimatology = Climatology.of(target, grouper());
        requirePositive(targetClimatology);
        return new FittedState(null, targetClimatology, fitMapping(target));
    }

    @Override
    protected TimeSeries predict(FittedState fitted, TimeSeries input) {
        TimeSeries mapped = mapByGroup(fitted, input);
        return fitted.targetClimatology().divide(mapped, grouper());
    }

    @Override
    protected void validateState(FittedState fitted) {
        requirePositive(fitted.targetClimatology());
    }

    private static void requirePositive(Climatology climatology) {
        double min = climatology.min();
        if (!(min > 0)) {
            throw new InvalidClimatologyException(climatology.argMin(), min,
                "precipitation climatology must be strictly positive in every period");
        }
    }

    @Override
    public Variable variable() {
        return Variable.PRECIPITATION;
    }

    @Override
    public BcsdConfig toConfig() {
        return new BcsdConfig()
            .setVariable(variable().configName())
            .setGrouper(grouper().name())
            .setQuantileMapper(mapperOptions().asMap())
            .setParallelGroups(isParallelGroups());
    }
}
