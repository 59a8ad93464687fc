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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/// Centralized Gson configuration for quantile mapper state.
///
/// ## Usage
///
/// ```java
/// Gson gson = QmapGsonConfig.gson();
///
/// FittedQuantileMapper fitted = new CunnaneQuantileMapper().fit(target);
/// String json = gson.toJson(fitted, FittedQuantileMapper.class);
/// // {"type":"cunnane","values":[...],"alpha":0.4,...}
///
/// FittedQuantileMapper restored = gson.fromJson(json, FittedQuantileMapper.class);
/// ```
///
/// ## Configuration
///
/// | Feature | Setting |
/// |---------|---------|
/// | Pretty printing | Enabled |
/// | HTML escaping | Disabled |
/// | Special floating point values | Allowed |
/// | FittedQuantileMapper adapter | Registered |
///
/// The shared [Gson] instance is thread-safe.
public final class QmapGsonConfig {

    private static final Gson INSTANCE = builder().create();

    private QmapGsonConfig() {
    }

    /// Returns the configured Gson instance.
    /// @return the shared Gson instance
    public static Gson gson() {
        return INSTANCE;
    }

    /// Creates a new GsonBuilder with the quantile mapper adapters registered,
    /// for callers that need to add their own adapters.
    ///
    /// @return a new GsonBuilder
    public static GsonBuilder builder() {
        return new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .serializeSpecialFloatingPointValues()
            .registerTypeAdapterFactory(FittedMapperTypeAdapterFactory.create());
    }
}
