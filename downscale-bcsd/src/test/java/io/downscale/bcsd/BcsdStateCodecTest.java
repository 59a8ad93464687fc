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

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.downscale.qmap.QuantileMapperOptions;
import io.downscale.series.PeriodGrouper;
import io.downscale.series.PeriodGroupers;
import io.downscale.series.RollingWindow;
import io.downscale.series.TimeSeries;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;

import static io.downscale.bcsd.BcsdTestData.precipitation;
import static io.downscale.bcsd.BcsdTestData.seasonal;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class BcsdStateCodecTest {

    private static final LocalDate START = LocalDate.of(1980, 1, 1);

    @Test
    void testTemperatureRoundTrip() {
        TimeSeries training = seasonal(START, 6 * 365, 12, 9, 0.1, 2, 21L);
        TimeSeries target = seasonal(START, 6 * 365, 10, 10, 0, 2, 22L);
        TimeSeries future = seasonal(START.plusYears(6), 2 * 365, 15, 9, 0.2, 2, 23L);
        BcsdModel model = new BcsdTemperature(PeriodGroupers.MONTH_OF_YEAR,
            QuantileMapperOptions.defaults().with("extrapolate", "linear"),
            new RollingWindow(15, true, 3), RollingScope.PERIOD, false);
        model.fit(training, target);

        BcsdModel restored = BcsdStateCodec.fromJson(BcsdStateCodec.toJson(model));

        assertInstanceOf(BcsdTemperature.class, restored);
        assertTrue(restored.isFitted());
        assertEquals(model.predict(future), restored.predict(future));
        assertEquals(RollingScope.PERIOD, ((BcsdTemperature) restored).shiftExtractor().scope());
    }

    @Test
    void testPrecipitationRoundTripThroughFile(@TempDir Path dir) throws IOException {
        TimeSeries training = precipitation(START, 4 * 365, 3.0, 31L);
        TimeSeries target = precipitation(START, 4 * 365, 2.0, 32L);
        BcsdModel model = new BcsdPrecipitation().fit(training, target);
        Path path = dir.resolve("pr-state.json");

        BcsdStateCodec.save(path, model);
        BcsdModel restored = BcsdStateCodec.load(path);

        assertInstanceOf(BcsdPrecipitation.class, restored);
        assertEquals(model.predict(training), restored.predict(training));
        assertFalse(Files.exists(dir.resolve("pr-state.json.tmp")));
    }

    @Test
    void testStateLayout() {
        TimeSeries series = precipitation(START, 365, 2.0, 41L);
        BcsdModel model = new BcsdPrecipitation().fit(series, series);

        JsonObject json = JsonParser.parseString(BcsdStateCodec.toJson(model)).getAsJsonObject();

        assertEquals(BcsdStateCodec.CURRENT_VERSION, json.get("version").getAsInt());
        assertEquals("precipitation", json.getAsJsonObject("config").get("variable").getAsString());
        assertEquals(12, json.getAsJsonObject("target_climatology").size());
        assertFalse(json.has("training_climatology"));
        assertEquals("cunnane", json.getAsJsonObject("mappers").getAsJsonObject("1").get("type").getAsString());
    }

    @Test
    void testUnfittedModelHasNoState() {
        assertThrows(ModelNotFittedException.class, () -> BcsdStateCodec.toJson(new BcsdTemperature()));
    }

    @Test
    void testStateWithoutMappersIsNotFitted() {
        String json = "{\"version\": 1, \"config\": {\"variable\": \"temperature\"}}";

        assertThrows(ModelNotFittedException.class, () -> BcsdStateCodec.fromJson(json));
    }

    @Test
    void testCustomGrouperMustBeSupplied() {
        PeriodGrouper halfYear = PeriodGrouper.of("halfyear", d -> d.getMonthValue() <= 6 ? 1 : 2);
        TimeSeries training = seasonal(START, 3 * 365, 12, 9, 0, 2, 51L);
        TimeSeries target = seasonal(START, 3 * 365, 10, 9, 0, 2, 52L);
        BcsdModel model = new BcsdTemperature(halfYear, QuantileMapperOptions.defaults()).fit(training, target);
        String json = BcsdStateCodec.toJson(model);

        assertThrows(BcsdStateCodec.InvalidStateException.class, () -> BcsdStateCodec.fromJson(json));

        BcsdModel restored = BcsdStateCodec.read(new StringReader(json), halfYear);
        assertSame(halfYear, restored.grouper());
        assertEquals(model.predict(training), restored.predict(training));
    }

    @Test
    void testInvalidStateRejected() {
        assertThrows(BcsdStateCodec.InvalidStateException.class,
            () -> BcsdStateCodec.fromJson("{\"version\": 99, \"config\": {}}"));
        assertThrows(BcsdStateCodec.InvalidStateException.class,
            () -> BcsdStateCodec.fromJson("{\"version\": 1}"));
        assertThrows(BcsdStateCodec.InvalidStateException.class,
            () -> BcsdStateCodec.fromJson("{\"version\": 1, \"config\": "));
        assertThrows(BcsdStateCodec.InvalidStateException.class, () -> BcsdStateCodec.fromJson(""));
        assertThrows(BcsdStateCodec.InvalidStateException.class, () -> BcsdStateCodec.fromJson(
            "{\"version\": 1, \"config\": {\"variable\": \"precipitation\", \"quantile_mapper\": {\"type\": \"gaussian\"}},"
                + " \"target_climatology\": {\"1\": 5.0},"
                + " \"mappers\": {\"1\": {\"type\": \"identity\"}}}"));
    }

    @Test
    void testMapperWithoutValuesRejected() {
        String json = "{\"version\": 1, \"config\": {\"variable\": \"precipitation\"},"
            + " \"target_climatology\": {\"1\": 5.0},"
            + " \"mappers\": {\"1\": {\"type\": \"cunnane\", \"extrapolate\": \"constant\"}}}";

        assertThrows(BcsdStateCodec.InvalidStateException.class, () -> BcsdStateCodec.fromJson(json));
    }

    @Test
    void testMismatchedPeriodsRejected() {
        String precipitation = "{\"version\": 1, \"config\": {\"variable\": \"precipitation\"},"
            + " \"target_climatology\": {\"2\": 5.0},"
            + " \"mappers\": {\"1\": {\"type\": \"identity\"}}}";
        String temperature = "{\"version\": 1, \"config\": {\"variable\": \"temperature\"},"
            + " \"training_climatology\": {\"1\": 4.0, \"2\": 6.0},"
            + " \"target_climatology\": {\"1\": 5.0},"
            + " \"mappers\": {\"1\": {\"type\": \"identity\"}}}";
        String noTraining = "{\"version\": 1, \"config\": {\"variable\": \"temperature\"},"
            + " \"target_climatology\": {\"1\": 5.0},"
            + " \"mappers\": {\"1\": {\"type\": \"identity\"}}}";

        assertThrows(BcsdStateCodec.InvalidStateException.class, () -> BcsdStateCodec.fromJson(precipitation));
        assertThrows(BcsdStateCodec.InvalidStateException.class, () -> BcsdStateCodec.fromJson(temperature));
        assertThrows(BcsdStateCodec.InvalidStateException.class, () -> BcsdStateCodec.fromJson(noTraining));
    }

    @Test
    void testRestoredPrecipitationStateIsChecked() {
        String json = "{\"version\": 1, \"config\": {\"variable\": \"precipitation\"},"
            + " \"target_climatology\": {\"1\": 0.0},"
            + " \"mappers\": {\"1\": {\"type\": \"identity\"}}}";

        assertThrows(InvalidClimatologyException.class, () -> BcsdStateCodec.fromJson(json));
    }
}
