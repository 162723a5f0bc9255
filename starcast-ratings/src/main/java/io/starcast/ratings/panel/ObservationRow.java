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

package io.starcast.ratings.panel;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/// One organization-year of measure scores.
///
/// Every declared measure maps to an [OptionalDouble]; a missing score is an
/// empty optional and never zero. Non-finite inputs are normalized to missing
/// at construction so downstream code never sees NaN as a value.
public final class ObservationRow {

    private final PanelKey key;
    private final Map<String, OptionalDouble> values;

    private ObservationRow(PanelKey key, Map<String, OptionalDouble> values) {
        this.key = key;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static Builder builder(String organizationId, int year) {
        return new Builder(PanelKey.of(organizationId, year));
    }

    public static Builder builder(PanelKey key) {
        return new Builder(key);
    }

    public PanelKey key() {
        return key;
    }

    public String organizationId() {
        return key.organizationId();
    }

    public int year() {
        return key.year();
    }

    /// Returns the score for a measure, empty when missing or undeclared.
    public OptionalDouble value(String measureKey) {
        OptionalDouble value = values.get(measureKey);
        return value != null ? value : OptionalDouble.empty();
    }

    public boolean hasValue(String measureKey) {
        return value(measureKey).isPresent();
    }

    /// Returns every declared measure key, including those whose score is missing.
    public Set<String> measureKeys() {
        return values.keySet();
    }

    public Map<String, OptionalDouble> values() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObservationRow)) return false;
        ObservationRow that = (ObservationRow) o;
        return key.equals(that.key) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, values);
    }

    @Override
    public String toString() {
        return "ObservationRow[" + key + ", measures=" + values.size() + "]";
    }

    public static final class Builder {
        private final PanelKey key;
        private final Map<String, OptionalDouble> values = new LinkedHashMap<>();

        private Builder(PanelKey key) {
            this.key = Objects.requireNonNull(key, "key cannot be null");
        }

        public Builder value(String measureKey, double value) {
            Objects.requireNonNull(measureKey, "measureKey cannot be null");
            values.put(measureKey, Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty());
            return this;
        }

        public Builder value(String measureKey, OptionalDouble value) {
            Objects.requireNonNull(measureKey, "measureKey cannot be null");
            Objects.requireNonNull(value, "value cannot be null");
            if (value.isPresent()) {
                return value(measureKey, value.getAsDouble());
            }
            return missing(measureKey);
        }

        /// Records a raw cell, parsed with [MeasureKeys#parseValue(String)].
        public Builder raw(String measureKey, String rawValue) {
            return value(measureKey, MeasureKeys.parseValue(rawValue));
        }

        public Builder missing(String measureKey) {
            Objects.requireNonNull(measureKey, "measureKey cannot be null");
            values.put(measureKey, OptionalDouble.empty());
            return this;
        }

        public ObservationRow build() {
            return new ObservationRow(key, values);
        }
    }
}
