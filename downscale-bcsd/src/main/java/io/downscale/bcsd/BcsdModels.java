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
import io.downscale.series.PeriodGrouper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/// Builds unfitted BCSD models from configuration.
public final class BcsdModels {

    private static final Logger logger = LogManager.getLogger(BcsdModels.class);

    private BcsdModels() {
    }

    /**
     * Creates the model a configuration describes.
     *
     * @param config the configuration
     * @return an unfitted model
     * @throws IllegalArgumentException if any configured value is invalid
     */
    public static BcsdModel create(BcsdConfig config) {
        Objects.requireNonNull(config, "config cannot be null");
        config.validate();
        return create(config, config.resolveGrouper());
    }

    /**
     * Creates the model a configuration describes, with a caller-supplied
     * grouper in place of the configured frequency.
     *
     * @param config the configuration, whose {@code grouper} key is ignored
     * @param grouper the period grouper
     * @return an unfitted model
     * @throws IllegalArgumentException if any other configured value is invalid
     */
    public static BcsdModel create(BcsdConfig config, PeriodGrouper grouper) {
        Objects.requireNonNull(config, "config cannot be null");
        Objects.requireNonNull(grouper, "grouper cannot be null");
        Variable variable = config.resolveVariable();
        QuantileMapperOptions options = config.resolveMapperOptions();
        BcsdModel model;
        switch (variable) {
            case PRECIPITATION:
                model = new BcsdPrecipitation(grouper, options, config.isParallelGroups());
                break;
            case TEMPERATURE:
                model = new BcsdTemperature(grouper, options, config.resolveRollingWindow(),
                    config.resolveRollingScope(), config.isParallelGroups());
                break;
            default:
                throw new IllegalArgumentException("Unsupported variable: " + variable);
        }
        logger.debug("Created {}", model);
        return model;
    }
}
