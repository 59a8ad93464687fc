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

import java.util.Arrays;
import java.util.Objects;

/// Quantile mapper whose fitted form returns its input unchanged.
///
/// Useful as a control when checking what the surrounding correction pipeline
/// does on its own: with this mapper, bias correction reduces to the
/// climatology and shift arithmetic.
public final class IdentityQuantileMapper implements QuantileMapper {

    public static final String MAPPER_TYPE = "identity";

    @Override
    public String getMapperType() {
        return MAPPER_TYPE;
    }

    @Override
    public FittedQuantileMapper fit(double[] targetSamples) {
        Objects.requireNonNull(targetSamples, "targetSamples cannot be null");
        if (targetSamples.length == 0) {
            throw new IllegalArgumentException("targetSamples cannot be empty");
        }
        return new Fitted();
    }

    @Override
    public String toString() {
        return "IdentityQuantileMapper";
    }

    /// Fitted identity state; carries no parameters.
    @MapperType(MAPPER_TYPE)
    public static final class Fitted implements FittedQuantileMapper {

        @Override
        public String getMapperType() {
            return MAPPER_TYPE;
        }

        @Override
        public double[] transform(double[] samples) {
            return Arrays.copyOf(samples, samples.length);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Fitted;
        }

        @Override
        public int hashCode() {
            return MAPPER_TYPE.hashCode();
        }

        @Override
        public String toString() {
            return "IdentityQuantileMapper.Fitted";
        }
    }
}
