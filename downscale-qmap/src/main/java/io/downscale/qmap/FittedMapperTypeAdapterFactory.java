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
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.internal.Streams;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * GSON TypeAdapterFactory for polymorphic {@link FittedQuantileMapper} serialization.
 *
 * <pre>{@code
 *  SERIALIZE                              DESERIALIZE
 *  ─────────                              ───────────
 *  EmpiricalQuantileModel                 { "type": "cunnane", ... }
 *        │                                         │
 *        ▼                                         ▼
 *  1. Get @MapperType("cunnane")          1. Read "type" field
 *  2. Serialize type-specific fields      2. Lookup registered class
 *  3. Put "type" field first              3. Deserialize with delegate
 *        │                                         │
 *        ▼                                         ▼
 *  { "type": "cunnane",                   EmpiricalQuantileModel
 *    "values": [...], ... }
 * }</pre>
 *
 * <p>Fitted mapper classes are registered with {@link #registerType}; each
 * needs a unique {@link MapperType} name.
 *
 * @see QmapGsonConfig
 */
public final class FittedMapperTypeAdapterFactory implements TypeAdapterFactory {

    private static final String TYPE_FIELD = "type";

    private final Map<String, Class<? extends FittedQuantileMapper>> typeToClass = new HashMap<>();
    private final Map<Class<? extends FittedQuantileMapper>, String> classToType = new HashMap<>();

    private FittedMapperTypeAdapterFactory() {
    }

    /**
     * Creates a new factory with the built-in fitted mapper types registered.
     *
     * @return a configured factory
     */
    public static FittedMapperTypeAdapterFactory create() {
        FittedMapperTypeAdapterFactory factory = new FittedMapperTypeAdapterFactory();
        factory.registerType(EmpiricalQuantileModel.class);
        factory.registerType(IdentityQuantileMapper.Fitted.class);
        return factory;
    }

    /**
     * Registers a fitted mapper implementation type.
     *
     * @param mapperClass the class, annotated with {@link MapperType}
     * @throws IllegalArgumentException if the class has no annotation or the
     *         type name is already registered
     */
    public void registerType(Class<? extends FittedQuantileMapper> mapperClass) {
        MapperType annotation = mapperClass.getAnnotation(MapperType.class);
        if (annotation == null) {
            throw new IllegalArgumentException(
                "Class " + mapperClass.getName() + " has no @MapperType annotation");
        }
        String typeName = annotation.value();
        if (typeToClass.containsKey(typeName)) {
            throw new IllegalArgumentException(
                "Type '" + typeName + "' is already registered to " + typeToClass.get(typeName).getName());
        }
        typeToClass.put(typeName, mapperClass);
        classToType.put(mapperClass, typeName);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
        if (!FittedQuantileMapper.class.isAssignableFrom(type.getRawType())) {
            return null;
        }

        return new TypeAdapter<T>() {
            @Override
            public void write(JsonWriter out, T value) throws IOException {
                if (value == null) {
                    out.nullValue();
                    return;
                }

                String typeName = classToType.get(value.getClass());
                if (typeName == null) {
                    typeName = ((FittedQuantileMapper) value).getMapperType();
                }

                TypeAdapter<T> concreteDelegate = (TypeAdapter<T>) gson.getDelegateAdapter(
                    FittedMapperTypeAdapterFactory.this,
                    TypeToken.get(value.getClass()));
                JsonElement tree = concreteDelegate.toJsonTree(value);

                JsonObject result = new JsonObject();
                result.addProperty(TYPE_FIELD, typeName);
                if (tree.isJsonObject()) {
                    for (Map.Entry<String, JsonElement> entry : tree.getAsJsonObject().entrySet()) {
                        if (!TYPE_FIELD.equals(entry.getKey())) {
                            result.add(entry.getKey(), entry.getValue());
                        }
                    }
                }
                Streams.write(result, out);
            }

            @Override
            public T read(JsonReader in) throws IOException {
                JsonElement element = JsonParser.parseReader(in);
                if (element.isJsonNull()) {
                    return null;
                }
                if (!element.isJsonObject()) {
                    throw new JsonParseException("Expected a fitted quantile mapper object but got: " + element);
                }

                JsonObject obj = element.getAsJsonObject();
                if (!obj.has(TYPE_FIELD)) {
                    throw new JsonParseException("Missing '" + TYPE_FIELD + "' field in JSON: " + obj);
                }

                String typeName = obj.get(TYPE_FIELD).getAsString();
                Class<? extends FittedQuantileMapper> targetClass = typeToClass.get(typeName);
                if (targetClass == null) {
                    throw new JsonParseException(
                        "Unknown quantile mapper type: '" + typeName + "'. Known types: " + typeToClass.keySet());
                }

                TypeAdapter<? extends FittedQuantileMapper> targetAdapter =
                    gson.getDelegateAdapter(FittedMapperTypeAdapterFactory.this, TypeToken.get(targetClass));
                return (T) targetAdapter.fromJsonTree(obj);
            }
        };
    }

    /**
     * Returns the model class for a given type name.
     *
     * @param typeName the type name
     * @return the class, or null if not registered
     */
    public Class<? extends FittedQuantileMapper> getMapperClass(String typeName) {
        return typeToClass.get(typeName);
    }
}
