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
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.downscale.qmap.FittedQuantileMapper;
import io.downscale.qmap.QmapGsonConfig;
import io.downscale.series.Climatology;
import io.downscale.series.PeriodGrouper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Saves and restores the learned state of fitted BCSD models.
///
/// ## Format
///
/// ```json
/// {
///   "version": 1,
///   "config": { "variable": "precipitation", "grouper": "month", ... },
///   "training_climatology": { "1": 2.5, ... },
///   "target_climatology": { "1": 3.1, ... },
///   "mappers": {
///     "1": { "type": "cunnane", "values": [ ... ], ... },
///     ...
///   }
/// }
/// ```
///
/// The `config` block recreates the unfitted model, and the remaining blocks
/// restore its fitted state, so a restored model predicts exactly as the saved
/// one did. Fitted mappers are written with their `type` discriminator, see
/// [QmapGsonConfig].
///
/// ## Groupers
///
/// Only the grouper's frequency name is stored. A model fitted with a custom
/// grouper is restored by passing the same grouper to [#read(Reader, PeriodGrouper)].
///
/// ## Usage
///
/// ```java
/// BcsdStateCodec.save(Path.of("tas-model.json"), model);
/// BcsdModel restored = BcsdStateCodec.load(Path.of("tas-model.json"));
/// ```
public final class BcsdStateCodec {

    private static final Logger logger = LogManager.getLogger(BcsdStateCodec.class);

    static final int CURRENT_VERSION = 1;
    private static final String TEMP_SUFFIX = ".tmp";

    private static final Gson GSON = QmapGsonConfig.builder().create();

    private BcsdStateCodec() {
    }

    /// Serializes a fitted model.
    ///
    /// @param model the fitted model
    /// @return the JSON state
    /// @throws ModelNotFittedException if the model has not been fitted
    public static String toJson(BcsdModel model) {
        return GSON.toJson(capture(model));
    }

    /// Writes a fitted model's state to a writer.
    ///
    /// @param model the fitted model
    /// @param writer the destination
    /// @throws ModelNotFittedException if the model has not been fitted
    public static void write(BcsdModel model, Writer writer) {
        Objects.requireNonNull(writer, "writer cannot be null");
        GSON.toJson(capture(model), writer);
    }

    /// Saves a fitted model's state to a file, replacing it atomically.
    ///
    /// @param path the file to write
    /// @param model the fitted model
    /// @throws IOException if writing fails
    /// @throws ModelNotFittedException if the model has not been fitted
    public static void save(Path path, BcsdModel model) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        String json = toJson(model);
        Path tempPath = path.resolveSibling(path.getFileName() + TEMP_SUFFIX);
        try (Writer writer = Files.newBufferedWriter(tempPath, StandardCharsets.UTF_8)) {
            writer.write(json);
        }
        Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        logger.info("Saved {} state to {}", model.variable().configName(), path);
    }

    public static BcsdModel fromJson(String json) {
        return read(new StringReader(Objects.requireNonNull(json, "json cannot be null")), null);
    }

    public static BcsdModel read(Reader reader) {
        return read(reader, null);
    }

    /// Restores a fitted model.
    ///
    /// @param reader the JSON state
    /// @param grouper the grouper to use, or null to resolve the stored frequency name
    /// @return a fitted model
    /// @throws InvalidStateException if the state is malformed, of another version, or
    ///     inconsistent, or names a custom grouper that was not supplied
    /// @throws InvalidClimatologyException if a precipitation climatology is not positive
    /// @throws ModelNotFittedException if the state holds no fitted mappers
    public static BcsdModel read(Reader reader, PeriodGrouper grouper) {
        Objects.requireNonNull(reader, "reader cannot be null");
        State state;
        try {
            state = GSON.fromJson(reader, State.class);
        } catch (JsonParseException e) {
            throw new InvalidStateException("Invalid model state JSON: " + e.getMessage(), e);
        }
        if (state == null) {
            throw new InvalidStateException("Model state is empty");
        }
        if (state.version != CURRENT_VERSION) {
            throw new InvalidStateException(
                "Unsupported model state version: " + state.version + " (expected: " + CURRENT_VERSION + ")");
        }
        if (state.config == null) {
            throw new InvalidStateException("Model state has no config");
        }
        return restore(state, grouper);
    }

    public static BcsdModel load(Path path) throws IOException {
        return load(path, null);
    }

    public static BcsdModel load(Path path, PeriodGrouper grouper) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, grouper);
        }
    }

    private static State capture(BcsdModel model) {
        Objects.requireNonNull(model, "model cannot be null");
        if (!(model instanceof AbstractBcsdModel)) {
            throw new IllegalArgumentException("Cannot capture state of " + model.getClass().getName());
        }
        FittedState fitted = ((AbstractBcsdModel) model).requireFitted();
        State state = new State();
        state.version = CURRENT_VERSION;
        state.config = model.toConfig();
        state.trainingClimatology = fitted.trainingClimatology() == null
            ? null : fitted.trainingClimatology().asMap();
        state.targetClimatology = fitted.targetClimatology().asMap();
        state.mappers = fitted.mapping().mappers();
        return state;
    }

    private static BcsdModel restore(State state, PeriodGrouper grouper) {
        BcsdModel model;
        PeriodGrouper resolved;
        try {
            resolved = grouper != null ? grouper : state.config.resolveGrouper();
            model = BcsdModels.create(state.config, resolved);
        } catch (IllegalArgumentException e) {
            throw new InvalidStateException("Invalid model config: " + e.getMessage(), e);
        }
        if (state.mappers == null || state.mappers.isEmpty() || state.targetClimatology == null) {
            throw new ModelNotFittedException(model.getClass().getSimpleName() + " state");
        }
        try {
            for (Map.Entry<Integer, FittedQuantileMapper> entry : state.mappers.entrySet()) {
                Objects.requireNonNull(entry.getValue(), "mapper for period " + entry.getKey() + " is null")
                    .requireComplete();
            }
            Climatology training = state.trainingClimatology == null
                ? null : Climatology.fromMap(state.trainingClimatology);
            Climatology target = Climatology.fromMap(state.targetClimatology);
            GroupedQuantileMapping mapping = GroupedQuantileMapping.of(resolved, state.mappers);
            requireSameKeys(mapping.keys(), target.keys(), "target_climatology");
            if (training != null) {
                requireSameKeys(mapping.keys(), training.keys(), "training_climatology");
            }
            ((AbstractBcsdModel) model).restoreState(new FittedState(training, target, mapping));
        } catch (NullPointerException | IllegalArgumentException e) {
            throw new InvalidStateException("Incomplete model state: " + e.getMessage(), e);
        }
        return model;
    }

    private static void requireSameKeys(Set<Integer> mapperKeys, Set<Integer> keys, String block) {
        if (!mapperKeys.equals(keys)) {
            throw new InvalidStateException(
                "Periods of " + block + " " + keys + " do not match the mapper periods " + mapperKeys);
        }
    }

    /// Serialized form; field names are the JSON keys.
    static final class State {
        @SerializedName("version")
        int version;

        @SerializedName("config")
        BcsdConfig config;

        @SerializedName("training_climatology")
        Map<Integer, Double> trainingClimatology;

        @SerializedName("target_climatology")
        Map<Integer, Double> targetClimatology;

        @SerializedName("mappers")
        Map<Integer, FittedQuantileMapper> mappers;
    }

    /// Thrown when stored model state cannot be read back.
    public static class InvalidStateException extends RuntimeException {
        public InvalidStateException(String message) {
            super(message);
        }

        public InvalidStateException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
