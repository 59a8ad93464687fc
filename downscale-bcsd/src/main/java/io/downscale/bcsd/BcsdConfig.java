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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.downscale.qmap.QuantileMapperOptions;
import io.downscale.qmap.QuantileMappers;
import io.downscale.series.PeriodGrouper;
import io.downscale.series.PeriodGroupers;
import io.downscale.series.RollingWindow;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * JSON configuration of a BCSD model.
 *
 * <pre>{@code
 * {
 *   "variable": "temperature",
 *   "grouper": "month",
 *   "quantile_mapper": {"type": "cunnane", "alpha": "0.4"},
 *   "rolling_window": 9,
 *   "rolling_min_periods": 1,
 *   "rolling_centered": true,
 *   "rolling_scope": "series",
 *   "parallel_groups": false
 * }
 * }</pre>
 *
 * <p>Every key is optional; an absent key takes the default shown. The
 * {@code rolling_*} keys only apply to temperature. Values are checked by
 * {@link #validate()}, which {@link BcsdModels#create(BcsdConfig)} calls.
 */
public class BcsdConfig {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();

    @SerializedName("variable")
    private String variable;

    /** Frequency name of the period grouper, see {@link PeriodGroupers}. */
    @SerializedName("grouper")
    private String grouper;

    /** Options forwarded unchanged to the quantile mapper. */
    @SerializedName("quantile_mapper")
    private Map<String, String> quantileMapper;

    @SerializedName("rolling_window")
    private Integer rollingWindow;

    @SerializedName("rolling_min_periods")
    private Integer rollingMinPeriods;

    @SerializedName("rolling_centered")
    private Boolean rollingCentered;

    /** {@code series} or {@code period}. */
    @SerializedName("rolling_scope")
    private String rollingScope;

    @SerializedName("parallel_groups")
    private Boolean parallelGroups;

    public BcsdConfig() {
    }

    public String getVariable() {
        return variable;
    }

    public BcsdConfig setVariable(String variable) {
        this.variable = variable;
        return this;
    }

    public String getGrouper() {
        return grouper;
    }

    public BcsdConfig setGrouper(String grouper) {
        this.grouper = grouper;
        return this;
    }

    public Map<String, String> getQuantileMapper() {
        return quantileMapper;
    }

    public BcsdConfig setQuantileMapper(Map<String, String> quantileMapper) {
        this.quantileMapper = quantileMapper == null ? null : new LinkedHashMap<>(quantileMapper);
        return this;
    }

    public Integer getRollingWindow() {
        return rollingWindow;
    }

    public BcsdConfig setRollingWindow(Integer rollingWindow) {
        this.rollingWindow = rollingWindow;
        return this;
    }

    public Integer getRollingMinPeriods() {
        return rollingMinPeriods;
    }

    public BcsdConfig setRollingMinPeriods(Integer rollingMinPeriods) {
        this.rollingMinPeriods = rollingMinPeriods;
        return this;
    }

    public Boolean getRollingCentered() {
        return rollingCentered;
    }

    public BcsdConfig setRollingCentered(Boolean rollingCentered) {
        this.rollingCentered = rollingCentered;
        return this;
    }

    public String getRollingScope() {
        return rollingScope;
    }

    public BcsdConfig setRollingScope(String rollingScope) {
        this.rollingScope = rollingScope;
        return this;
    }

    public Boolean getParallelGroups() {
        return parallelGroups;
    }

    public BcsdConfig setParallelGroups(Boolean parallelGroups) {
        this.parallelGroups = parallelGroups;
        return this;
    }

    /// @return the configured variable, temperature when absent
    public Variable resolveVariable() {
        return variable == null ? Variable.TEMPERATURE : Variable.fromName(variable);
    }

    /// @return the configured grouper, month of year when absent
    public PeriodGrouper resolveGrouper() {
        return PeriodGroupers.fromFrequency(grouper == null ? PeriodGroupers.DEFAULT_FREQUENCY : grouper);
    }

    public QuantileMapperOptions resolveMapperOptions() {
        return quantileMapper == null ? QuantileMapperOptions.defaults() : QuantileMapperOptions.of(quantileMapper);
    }

    /**
     * Builds the rolling window from the {@code rolling_*} keys.
     *
     * @return the window
     * @throws IllegalArgumentException if the window is less than 1, or the
     *     minimum periods are outside {@code [1, window]}
     */
    public RollingWindow resolveRollingWindow() {
        int window = rollingWindow != null ? rollingWindow : RollingWindow.DEFAULT_WINDOW;
        int minPeriods = rollingMinPeriods != null ? rollingMinPeriods : 1;
        boolean centered = rollingCentered == null || rollingCentered;
        return new RollingWindow(window, centered, minPeriods);
    }

    public RollingScope resolveRollingScope() {
        return rollingScope == null ? RollingScope.SERIES : RollingScope.fromName(rollingScope);
    }

    public boolean isParallelGroups() {
        return parallelGroups != null && parallelGroups;
    }

    /**
     * Checks every value without building a model.
     *
     * @throws IllegalArgumentException naming the first invalid value
     */
    public void validate() {
        resolveVariable();
        resolveGrouper();
        QuantileMappers.create(resolveMapperOptions());
        resolveRollingWindow();
        resolveRollingScope();
    }

    /**
     * Loads a configuration from JSON.
     *
     * @param json the JSON string
     * @return the parsed configuration
     * @throws IllegalArgumentException if the JSON is malformed or not an object
     */
    public static BcsdConfig fromJson(String json) {
        Objects.requireNonNull(json, "json cannot be null");
        return parsed(() -> GSON.fromJson(json, BcsdConfig.class));
    }

    /**
     * Loads a configuration from a Reader.
     *
     * @param reader the reader providing JSON
     * @return the parsed configuration
     * @throws IllegalArgumentException if the JSON is malformed or not an object
     */
    public static BcsdConfig fromJson(Reader reader) {
        Objects.requireNonNull(reader, "reader cannot be null");
        return parsed(() -> GSON.fromJson(reader, BcsdConfig.class));
    }

    /**
     * Loads a configuration from a JSON file.
     *
     * @param path the file path
     * @return the parsed configuration
     * @throws IOException if the file cannot be read
     */
    public static BcsdConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        }
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public void toJson(Writer writer) {
        GSON.toJson(this, writer);
    }

    public void save(Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            toJson(writer);
        }
    }

    private static BcsdConfig parsed(Supplier<BcsdConfig> parse) {
        BcsdConfig config;
        try {
            config = parse.get();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Malformed BCSD configuration: " + e.getMessage(), e);
        }
        return config != null ? config : new BcsdConfig();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BcsdConfig)) return false;
        BcsdConfig that = (BcsdConfig) o;
        return Objects.equals(variable, that.variable)
            && Objects.equals(grouper, that.grouper)
            && Objects.equals(quantileMapper, that.quantileMapper)
            && Objects.equals(rollingWindow, that.rollingWindow)
            && Objects.equals(rollingMinPeriods, that.rollingMinPeriods)
            && Objects.equals(rollingCentered, that.rollingCentered)
            && Objects.equals(rollingScope, that.rollingScope)
            && Objects.equals(parallelGroups, that.parallelGroups);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, grouper, quantileMapper, rollingWindow, rollingMinPeriods,
            rollingCentered, rollingScope, parallelGroups);
    }

    @Override
    public String toString() {
        return "BcsdConfig" + toJson();
    }
}
