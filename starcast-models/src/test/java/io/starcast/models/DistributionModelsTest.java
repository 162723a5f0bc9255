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


package io.starcast.models;

import com.google.gson.JsonParseException;
import io.starcast.models.beta.BetaRegressionModel;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link DistributionModels} JSON persistence.
 */
@Tag("unit")
class DistributionModelsTest {

    private static BetaRegressionModel model(String measure) {
        return new BetaRegressionModel(measure, List.of(measure + "_lag1", measure + "_lag1_missing"),
            new double[] {71.5, 0.1}, new double[] {9.25, 0.3},
            new double[] {0.8, 0.45, -0.1}, new double[] {3.2, 0.05, 0.0}, 412, 318.625);
    }

    @Test
    void savedModelsReloadWithIdenticalPredictions(@TempDir Path dir) throws IOException {
        Map<String, DistributionModel> models = new LinkedHashMap<>();
        models.put("C: A", model("C: A"));
        models.put("C: B", model("C: B"));
        Path file = dir.resolve("models.json");

        DistributionModels.save(models, file);
        Map<String, DistributionModel> restored = DistributionModels.load(file);

        assertEquals(List.of("C: A", "C: B"), List.copyOf(restored.keySet()));
        assertEquals(models.get("C: A"), restored.get("C: A"));
        double[] features = {80.0, 0.0};
        assertEquals(models.get("C: B").conditional(features), restored.get("C: B").conditional(features));
    }

    @Test
    void documentUsesSnakeCaseFields() {
        String json = DistributionModels.toJson(Map.of("C: A", model("C: A")));

        assertTrue(json.contains("\"measure_key\""), json);
        assertTrue(json.contains("\"precision_coefficients\""), json);
        assertTrue(json.contains("\"beta_regression\""), json);
    }

    @Test
    void rejectsUnknownTypesAndDuplicates() {
        assertThrows(JsonParseException.class,
            () -> DistributionModels.fromJson("{\"models\": [{\"type\": \"gaussian\", \"measure_key\": \"C: A\"}]}"));

        String one = DistributionModels.toJson(Map.of("C: A", model("C: A")));
        String entry = one.substring(one.indexOf('{', 1), one.lastIndexOf('}', one.lastIndexOf(']')) + 1);
        String duplicated = "{\"models\": [" + entry + "," + entry + "]}";
        assertThrows(JsonParseException.class, () -> DistributionModels.fromJson(duplicated));
    }

    @Test
    void rejectsInconsistentCoefficients() {
        String json = "{\"models\": [{\"type\": \"beta_regression\", \"measure_key\": \"C: A\","
            + " \"feature_names\": [\"C: A_lag1\"], \"feature_center\": [0], \"feature_scale\": [1],"
            + " \"mean_coefficients\": [0.1], \"precision_coefficients\": [1.0, 0.0],"
            + " \"observation_count\": 10, \"log_likelihood\": 1.0}]}";

        assertThrows(JsonParseException.class, () -> DistributionModels.fromJson(json));
    }
}
