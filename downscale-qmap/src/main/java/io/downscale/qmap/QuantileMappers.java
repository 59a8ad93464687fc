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

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/// Registry of quantile mapper implementations, keyed by type name.
///
/// | Type       | Implementation              |
/// |------------|-----------------------------|
/// | `cunnane`  | [CunnaneQuantileMapper] (default) |
/// | `identity` | [IdentityQuantileMapper]    |
///
/// Additional implementations can be registered under new type names; their
/// fitted classes must also be registered with [FittedMapperTypeAdapterFactory]
/// to be serializable.
public final class QuantileMappers {

    private static final Map<String, Function<QuantileMapperOptions, QuantileMapper>> REGISTRY =
        new ConcurrentHashMap<>();

    static {
        register(CunnaneQuantileMapper.MAPPER_TYPE, CunnaneQuantileMapper::fromOptions);
        register(IdentityQuantileMapper.MAPPER_TYPE, options -> {
            options.requireKnown(Set.of());
            return new IdentityQuantileMapper();
        });
    }

    private QuantileMappers() {
    }

    /// Registers a mapper type.
    ///
    /// @param type the type name, lowercase
    /// @param factory builds a mapper from options
    /// @throws IllegalArgumentException if the type is already registered
    public static void register(String type, Function<QuantileMapperOptions, QuantileMapper> factory) {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(factory, "factory cannot be null");
        if (REGISTRY.putIfAbsent(type, factory) != null) {
            throw new IllegalArgumentException("Quantile mapper type '" + type + "' is already registered");
        }
    }

    /// Creates the mapper selected by the options' type.
    ///
    /// @param options the mapper options
    /// @return a configured, unfitted mapper
    /// @throws IllegalArgumentException for an unknown type or invalid option values
    public static QuantileMapper create(QuantileMapperOptions options) {
        Objects.requireNonNull(options, "options cannot be null");
        Function<QuantileMapperOptions, QuantileMapper> factory = REGISTRY.get(options.type());
        if (factory == null) {
            throw new IllegalArgumentException(
                "Unknown quantile mapper type: '" + options.type() + "'. Known types: " + new TreeSet<>(REGISTRY.keySet()));
        }
        return factory.apply(options);
    }

    /// Creates the default mapper with default settings.
    /// @return a Cunnane quantile mapper
    public static QuantileMapper createDefault() {
        return create(QuantileMapperOptions.defaults());
    }
}
