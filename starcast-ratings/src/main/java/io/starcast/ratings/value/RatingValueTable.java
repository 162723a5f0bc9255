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


package io.starcast.ratings.value;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import io.starcast.ratings.thresholds.ThresholdTable;

import java.io.IOException;
import java.io.Reader;
import java.lang.reflect.Type;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/// Dollar value of each star level.
///
/// Levels absent from the table are worth 0. JSON keys may be written as
/// integers or as whole-number decimals:
///
/// ```json
/// { "3.0": 0, "3.5": 0, "4": 1000000, "5": 2500000 }
/// ```
///
/// Half-star keys are accepted in the document but ignored, since the
/// forecast distribution is over whole-star levels.
public final class RatingValueTable {

    private static final Gson GSON = new Gson();
    private static final Type MAP_TYPE = new TypeToken<LinkedHashMap<String, Double>>() {}.getType();

    private final Map<Integer, Double> values;

    private RatingValueTable(Map<Integer, Double> values) {
        Map<Integer, Double> copy = new TreeMap<>();
        for (Map.Entry<Integer, Double> entry : values.entrySet()) {
            int level = Objects.requireNonNull(entry.getKey(), "level cannot be null");
            Double value = entry.getValue();
            if (level < ThresholdTable.MIN_LEVEL || level > ThresholdTable.MAX_LEVEL) {
                throw new IllegalArgumentException("Level must be in [1, 5], got: " + level);
            }
            if (value == null || !Double.isFinite(value) || value < 0) {
                throw new IllegalArgumentException("Value for level " + level + " must be finite and non-negative, got: " + value);
            }
            copy.put(level, value);
        }
        this.values = Collections.unmodifiableMap(copy);
    }

    public static RatingValueTable of(Map<Integer, Double> values) {
        return new RatingValueTable(Objects.requireNonNull(values, "values cannot be null"));
    }

    public static RatingValueTable fromJson(String json) {
        return fromKeyed(GSON.fromJson(json, MAP_TYPE));
    }

    public static RatingValueTable fromJson(Reader reader) {
        return fromKeyed(GSON.fromJson(reader, MAP_TYPE));
    }

    public static RatingValueTable load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        }
    }

    private static RatingValueTable fromKeyed(Map<String, Double> keyed) {
        if (keyed == null) {
            throw new JsonParseException("Empty rating value document");
        }
        Map<Integer, Double> byLevel = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : keyed.entrySet()) {
            double key;
            try {
                key = Double.parseDouble(entry.getKey().trim());
            } catch (NumberFormatException e) {
                throw new JsonParseException("Rating level key is not numeric: " + entry.getKey(), e);
            }
            if (key != Math.rint(key)) {
                continue;
            }
            byLevel.put((int) key, entry.getValue());
        }
        return new RatingValueTable(byLevel);
    }

    /// Value of a level, 0 when the level is absent.
    public double value(int level) {
        return values.getOrDefault(level, 0.0);
    }

    public Map<Integer, Double> asMap() {
        return values;
    }

    public String toJson() {
        Map<String, Double> keyed = new LinkedHashMap<>();
        values.forEach((level, value) -> keyed.put(String.valueOf(level), value));
        return GSON.toJson(keyed, MAP_TYPE);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RatingValueTable)) return false;
        return values.equals(((RatingValueTable) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "RatingValueTable" + values;
    }
}
