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

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the serialization type name for a {@link FittedQuantileMapper} implementation.
 *
 * <p>The name is written as the "type" field of the mapper's JSON form and is
 * used to pick the concrete class when reading it back.
 *
 * <pre>{@code
 * @MapperType("cunnane")
 * public final class EmpiricalQuantileModel implements FittedQuantileMapper {
 *     // sorted target values, plotting positions, tail parameters
 * }
 * }</pre>
 *
 * @see FittedMapperTypeAdapterFactory
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface MapperType {
    /**
     * The type name used in JSON serialization, lowercase
     * (e.g., "cunnane", "identity").
     *
     * @return the type discriminator string
     */
    String value();
}
