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

package io.starcast.ratings.thresholds;

import io.starcast.ratings.UnknownMeasureException;
import io.starcast.ratings.panel.MeasureKeys;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/// Immutable threshold tables keyed by measure.
public final class ThresholdTables {

    private final Map<String, ThresholdTable> tables;

    private ThresholdTables(Map<String, ThresholdTable> tables) {
        this.tables = Collections.unmodifiableMap(new LinkedHashMap<>(tables));
    }

    public static ThresholdTables of(Collection<ThresholdTable> tables) {
        Map<String, ThresholdTable> byKey = new LinkedHashMap<>();
        for (ThresholdTable table : tables) {
            if (byKey.putIfAbsent(table.measureKey(), table) != null) {
                throw new IllegalArgumentException("Duplicate threshold table for " + table.measureKey());
            }
        }
        return new ThresholdTables(byKey);
    }

    public static ThresholdTables of(ThresholdTable... tables) {
        return of(List.of(tables));
    }

    public static ThresholdTables empty() {
        return new ThresholdTables(Map.of());
    }

    /// Returns the table for a measure.
    ///
    /// @throws UnknownMeasureException if the measure has no table
    public ThresholdTable table(String measureKey) {
        ThresholdTable table = tables.get(measureKey);
        if (table == null) {
            throw new UnknownMeasureException(measureKey);
        }
        return table;
    }

    public Optional<ThresholdTable> find(String measureKey) {
        return Optional.ofNullable(tables.get(measureKey));
    }

    public boolean contains(String measureKey) {
        return tables.containsKey(measureKey);
    }

    public Set<String> measureKeys() {
        return tables.keySet();
    }

    public Collection<ThresholdTable> tables() {
        return tables.values();
    }

    public int size() {
        return tables.size();
    }

    /// Re-keys every table with [MeasureKeys#collapse(String)] so that
    /// cut-point identifiers match panel column names.
    public ThresholdTables collapseKeys() {
        Map<String, ThresholdTable> collapsed = new LinkedHashMap<>();
        for (ThresholdTable table : tables.values()) {
            String key = MeasureKeys.collapse(table.measureKey());
            if (collapsed.putIfAbsent(key, new ThresholdTable(key, table.bands())) != null) {
                throw new IllegalArgumentException("Collapsed measure key collides: " + key);
            }
        }
        return new ThresholdTables(collapsed);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ThresholdTables)) return false;
        return tables.equals(((ThresholdTables) o).tables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tables);
    }

    @Override
    public String toString() {
        return "ThresholdTables[" + tables.size() + " measures]";
    }
}
