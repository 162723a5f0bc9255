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

package io.starcast.ratings.aggregate;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import io.starcast.ratings.UnknownMeasureException;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/// Immutable measure weights for the composite rating.
///
/// Weights must be finite and non-negative; zero weights and ties are legal.
/// The JSON form is a flat object of measure key to weight:
///
/// ```json
/// { "C: Breast Cancer Screening": 1, "C: Annual Flu Vaccine": 1, "C: Plan All-Cause Readmissions": 3 }
/// ```
public final class MeasureWeights {

    private static final Gson GSON = new Gson();
    private static final Type MAP_TYPE = new TypeToken<LinkedHashMap<String, Double>>() {}.getType();

    private final Map<String, Double> weights;

    private MeasureWeights(Map<String, Double> weights) {
        Map<String, Double> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : weights.entrySet()) {
            String measure = Objects.requireNonNull(entry.getKey(), "measure key cannot be null");
            Double weight = entry.getValue();
            if (weight == null || !Double.isFinite(weight) || weight < 0) {
                throw new IllegalArgumentException("Weight for " + measure + " must be finite and non-negative, got: " + weight);
            }
            copy.put(measure, weight);
        }
        this.weights = Collections.unmodifiableMap(copy);
    }

    public static MeasureWeights of(Map<String, Double> weights) {
        Objects.requireNonNull(weights, "weights cannot be null");
        return new MeasureWeights(weights);
    }

    /// Gives every listed measure the same weight.
    public static MeasureWeights equal(double weight, String... measureKeys) {
        Map<String, Double> map = new LinkedHashMap<>();
        for (String key : measureKeys) {
            map.put(key, weight);
        }
        return new MeasureWeights(map);
    }

    public static MeasureWeights fromJson(String json) {
        return fromMap(GSON.fromJson(json, MAP_TYPE));
    }

    public static MeasureWeights fromJson(Reader reader) {
        return fromMap(GSON.fromJson(reader, MAP_TYPE));
    }

    public static MeasureWeights load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        }
    }

    private static MeasureWeights fromMap(Map<String, Double> map) {
        if (map == null) {
            throw new JsonParseException("Empty measure weight document");
        }
        return new MeasureWeights(map);
    }

    public OptionalDouble weight(String measureKey) {
        Double weight = weights.get(measureKey);
        return weight != null ? OptionalDouble.of(weight) : OptionalDouble.empty();
    }

    /// Returns the weight of a measure.
    ///
    /// @throws UnknownMeasureException if the measure has no weight
    public double require(String measureKey) {
        Double weight = weights.get(measureKey);
        if (weight == null) {
            throw new UnknownMeasureException(measureKey);
        }
        return weight;
    }

    public boolean contains(String measureKey) {
        return weights.containsKey(measureKey);
    }

    public Set<String> measureKeys() {
        return weights.keySet();
    }

    public Map<String, Double> asMap() {
        return weights;
    }

    public int size() {
        return weights.size();
    }

    public String toJson() {
        return GSON.toJson(weights, MAP_TYPE);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MeasureWeights)) return false;
        return weights.equals(((MeasureWeights) o).weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return "MeasureWeights" + weights;
    }
}
