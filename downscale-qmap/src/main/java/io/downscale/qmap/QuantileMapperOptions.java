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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Named options for constructing a {@link QuantileMapper}.
 *
 * <p>Models carry these options without interpreting them; only the mapper
 * implementation selected by {@link #type()} reads them. All values are held
 * as strings and parsed strictly on access.
 *
 * <pre>{@code
 * QuantileMapperOptions options = QuantileMapperOptions.of(Map.of(
 *     "type", "cunnane",
 *     "alpha", "0.4",
 *     "extrapolate", "linear"));
 * QuantileMapper mapper = QuantileMappers.create(options);
 * }</pre>
 */
public final class QuantileMapperOptions {

    public static final String TYPE = "type";
    public static final String DEFAULT_TYPE = CunnaneQuantileMapper.MAPPER_TYPE;

    private final Map<String, String> options;

    private QuantileMapperOptions(Map<String, String> options) {
        this.options = Collections.unmodifiableMap(options);
    }

    /**
     * Returns options selecting the default mapper with default settings.
     * @return the default options
     */
    public static QuantileMapperOptions defaults() {
        return new QuantileMapperOptions(new LinkedHashMap<>());
    }

    /**
     * Creates options from a map.
     *
     * @param options option names and values; null values are not allowed
     * @return the options
     */
    public static QuantileMapperOptions of(Map<String, String> options) {
        Objects.requireNonNull(options, "options cannot be null");
        Map<String, String> copy = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : options.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new IllegalArgumentException("option names and values cannot be null: " + options);
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        return new QuantileMapperOptions(copy);
    }

    /**
     * Returns options selecting a mapper type with default settings.
     *
     * @param type the mapper type
     * @return the options
     */
    public static QuantileMapperOptions ofType(String type) {
        return defaults().with(TYPE, type);
    }

    /**
     * Returns a copy with one option set.
     *
     * @param name the option name
     * @param value the option value
     * @return new options
     */
    public QuantileMapperOptions with(String name, String value) {
        Map<String, String> copy = new LinkedHashMap<>(options);
        copy.put(Objects.requireNonNull(name), Objects.requireNonNull(value));
        return new QuantileMapperOptions(copy);
    }

    public String type() {
        return options.getOrDefault(TYPE, DEFAULT_TYPE).toLowerCase(Locale.ROOT);
    }

    public boolean has(String name) {
        return options.containsKey(name);
    }

    public String getString(String name, String defaultValue) {
        return options.getOrDefault(name, defaultValue);
    }

    public double getDouble(String name, double defaultValue) {
        String value = options.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("option '" + name + "' must be a number, got '" + value + "'", e);
        }
    }

    public int getInt(String name, int defaultValue) {
        String value = options.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("option '" + name + "' must be an integer, got '" + value + "'", e);
        }
    }

    public boolean getBoolean(String name, boolean defaultValue) {
        String value = options.get(name);
        if (value == null) {
            return defaultValue;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "true":
                return true;
            case "false":
                return false;
            default:
                throw new IllegalArgumentException("option '" + name + "' must be true or false, got '" + value + "'");
        }
    }

    /**
     * Rejects options a mapper does not understand.
     *
     * @param known the option names the mapper reads, besides {@link #TYPE}
     * @throws IllegalArgumentException naming the unknown options
     */
    public void requireKnown(Set<String> known) {
        Set<String> unknown = new TreeSet<>(options.keySet());
        unknown.remove(TYPE);
        unknown.removeAll(known);
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException(
                "Unknown options for quantile mapper '" + type() + "': " + unknown + ". Known options: " + new TreeSet<>(known));
        }
    }

    public Map<String, String> asMap() {
        return options;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof QuantileMapperOptions)) return false;
        return options.equals(((QuantileMapperOptions) o).options);
    }

    @Override
    public int hashCode() {
        return options.hashCode();
    }

    @Override
    public String toString() {
        return "QuantileMapperOptions" + options;
    }
}
