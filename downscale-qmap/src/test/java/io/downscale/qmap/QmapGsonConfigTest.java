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
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class QmapGsonConfigTest {

    private final Gson gson = QmapGsonConfig.gson();

    @Test
    void testEmpiricalModelJsonHasTypeFirst() {
        FittedQuantileMapper fitted = new CunnaneQuantileMapper(0.4, 0.4, Extrapolation.LINEAR, 3, false)
            .fit(new double[] {3, 1, 2, 5});

        String json = gson.toJson(fitted, FittedQuantileMapper.class);
        JsonObject obj = JsonParser.parseString(json).getAsJsonObject();

        assertEquals("type", obj.keySet().iterator().next());
        assertEquals("cunnane", obj.get("type").getAsString());
        assertEquals("linear", obj.get("extrapolate").getAsString());
        assertEquals(4, obj.getAsJsonArray("values").size());
        assertFalse(obj.has("positions"));
    }

    @Test
    void testRestoredModelMapsIdentically() {
        Random random = new Random(21L);
        double[] target = new double[300];
        double[] input = new double[120];
        for (int i = 0; i < target.length; i++) {
            target[i] = random.nextGaussian();
        }
        for (int i = 0; i < input.length; i++) {
            input[i] = 3 + 2 * random.nextGaussian() + 0.01 * i;
        }
        FittedQuantileMapper fitted = new CunnaneQuantileMapper(0.4, 0.4, Extrapolation.LINEAR, 10, true).fit(target);

        FittedQuantileMapper restored = gson.fromJson(gson.toJson(fitted, FittedQuantileMapper.class),
            FittedQuantileMapper.class);

        assertInstanceOf(EmpiricalQuantileModel.class, restored);
        assertEquals(fitted, restored);
        assertArrayEquals(fitted.transform(input), restored.transform(input), 0.0);
    }

    @Test
    void testIdentityRoundTrip() {
        FittedQuantileMapper fitted = new IdentityQuantileMapper().fit(new double[] {1});

        String json = gson.toJson(fitted, FittedQuantileMapper.class);

        assertEquals(fitted, gson.fromJson(json, FittedQuantileMapper.class));
    }

    @Test
    void testUnknownOrMissingTypeRejected() {
        assertThrows(JsonParseException.class,
            () -> gson.fromJson("{\"type\":\"gaussian\"}", FittedQuantileMapper.class));
        assertThrows(JsonParseException.class,
            () -> gson.fromJson("{\"values\":[1.0]}", FittedQuantileMapper.class));
    }

    @Test
    void testIncompleteEmpiricalModelDetected() {
        FittedQuantileMapper noValues = gson.fromJson(
            "{\"type\":\"cunnane\",\"extrapolate\":\"constant\"}", FittedQuantileMapper.class);
        FittedQuantileMapper noExtrapolation = gson.fromJson(
            "{\"type\":\"cunnane\",\"values\":[1.0,2.0]}", FittedQuantileMapper.class);
        FittedQuantileMapper unsorted = gson.fromJson(
            "{\"type\":\"cunnane\",\"values\":[2.0,1.0],\"extrapolate\":\"constant\"}",
            FittedQuantileMapper.class);

        assertThrows(IllegalArgumentException.class, noValues::requireComplete);
        assertThrows(IllegalArgumentException.class, noExtrapolation::requireComplete);
        assertThrows(IllegalArgumentException.class, unsorted::requireComplete);

        new CunnaneQuantileMapper().fit(new double[] {3, 1, 2}).requireComplete();
        new IdentityQuantileMapper().fit(new double[] {1}).requireComplete();
    }

    @Test
    void testRegisteredClasses() {
        FittedMapperTypeAdapterFactory factory = FittedMapperTypeAdapterFactory.create();

        assertEquals(EmpiricalQuantileModel.class, factory.getMapperClass("cunnane"));
        assertEquals(IdentityQuantileMapper.Fitted.class, factory.getMapperClass("identity"));
        assertThrows(IllegalArgumentException.class, () -> factory.registerType(EmpiricalQuantileModel.class));
    }
}
