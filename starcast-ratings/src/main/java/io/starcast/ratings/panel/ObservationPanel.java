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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/// Immutable panel of organization-year rows.
///
/// ## Layout
///
/// ```text
///   organization ─┬─ year 2021 ─ {measure → score?}
///                 ├─ year 2022 ─ {measure → score?}
///                 └─ year 2023 ─ {measure → score?}
/// ```
///
/// Rows are unique per [PanelKey] and kept in key order, so each
/// organization's history is year-ordered. The panel carries a content
/// [#fingerprint()] that changes whenever any row or value changes; fitted
/// models are cached against it.
public final class ObservationPanel {

    private final TreeMap<PanelKey, ObservationRow> rows;
    private final Map<String, List<ObservationRow>> histories;
    private final List<String> measureKeys;
    private final long fingerprint;

    private ObservationPanel(TreeMap<PanelKey, ObservationRow> rows) {
        this.rows = rows;

        Map<String, List<ObservationRow>> byOrganization = new LinkedHashMap<>();
        Set<String> measures = new TreeSet<>();
        for (ObservationRow row : rows.values()) {
            byOrganization.computeIfAbsent(row.organizationId(), k -> new ArrayList<>()).add(row);
            measures.addAll(row.measureKeys());
        }
        Map<String, List<ObservationRow>> frozen = new LinkedHashMap<>();
        byOrganization.forEach((org, history) -> frozen.put(org, Collections.unmodifiableList(history)));
        this.histories = Collections.unmodifiableMap(frozen);
        this.measureKeys = List.copyOf(measures);
        this.fingerprint = computeFingerprint(rows.values());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ObservationPanel of(Collection<ObservationRow> rows) {
        Builder builder = builder();
        rows.forEach(builder::add);
        return builder.build();
    }

    public Optional<ObservationRow> row(PanelKey key) {
        return Optional.ofNullable(rows.get(key));
    }

    public Optional<ObservationRow> row(String organizationId, int year) {
        return row(PanelKey.of(organizationId, year));
    }

    public Collection<ObservationRow> rows() {
        return Collections.unmodifiableCollection(rows.values());
    }

    /// Returns the year-ordered history of one organization, empty if unknown.
    public List<ObservationRow> history(String organizationId) {
        return histories.getOrDefault(organizationId, List.of());
    }

    public Set<String> organizations() {
        return histories.keySet();
    }

    /// Returns the sorted union of measure keys declared by any row.
    public List<String> measureKeys() {
        return measureKeys;
    }

    /// Counts the rows in which a measure has a score.
    public int countObserved(String measureKey) {
        int count = 0;
        for (ObservationRow row : rows.values()) {
            if (row.hasValue(measureKey)) {
                count++;
            }
        }
        return count;
    }

    public int size() {
        return rows.size();
    }

    /// Content fingerprint of the panel, used as its version.
    public long fingerprint() {
        return fingerprint;
    }

    private static long computeFingerprint(Collection<ObservationRow> rows) {
        long hash = 0xcbf29ce484222325L;
        for (ObservationRow row : rows) {
            hash = mix(hash, row.organizationId().hashCode());
            hash = mix(hash, row.year());
            for (Map.Entry<String, OptionalDouble> entry : row.values().entrySet()) {
                hash = mix(hash, entry.getKey().hashCode());
                OptionalDouble value = entry.getValue();
                hash = mix(hash, value.isPresent() ? Double.doubleToLongBits(value.getAsDouble()) : 0x7ff8dead);
            }
        }
        return hash;
    }

    private static long mix(long hash, long value) {
        long h = (hash ^ value) * 0x100000001b3L;
        return h ^ (h >>> 29);
    }

    /// Panels are equal when they hold the same rows with the same values.
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ObservationPanel)) return false;
        ObservationPanel that = (ObservationPanel) o;
        return fingerprint == that.fingerprint && rows.equals(that.rows);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(fingerprint);
    }

    @Override
    public String toString() {
        return "ObservationPanel[rows=" + rows.size() + ", organizations=" + histories.size()
            + ", measures=" + measureKeys.size() + "]";
    }

    public static final class Builder {
        private final TreeMap<PanelKey, ObservationRow> rows = new TreeMap<>();

        private Builder() {
        }

        public Builder add(ObservationRow row) {
            Objects.requireNonNull(row, "row cannot be null");
            if (rows.putIfAbsent(row.key(), row) != null) {
                throw new IllegalArgumentException("Duplicate panel row for " + row.key());
            }
            return this;
        }

        public ObservationPanel build() {
            return new ObservationPanel(new TreeMap<>(rows));
        }
    }
}
