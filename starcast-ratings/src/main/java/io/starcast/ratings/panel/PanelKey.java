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

import java.util.Comparator;
import java.util.Objects;

/// Identifies one row of an observation panel: an organization in a given year.
///
/// Keys order by organization first, then by year, which is the order in which
/// per-organization histories are read when deriving trend features.
///
/// @param organizationId the organization (contract) identifier
/// @param year the rating year
public record PanelKey(String organizationId, int year) implements Comparable<PanelKey> {

    private static final Comparator<PanelKey> ORDER =
        Comparator.comparing(PanelKey::organizationId).thenComparingInt(PanelKey::year);

    public PanelKey {
        Objects.requireNonNull(organizationId, "organizationId cannot be null");
        if (organizationId.isBlank()) {
            throw new IllegalArgumentException("organizationId cannot be blank");
        }
    }

    public static PanelKey of(String organizationId, int year) {
        return new PanelKey(organizationId, year);
    }

    @Override
    public int compareTo(PanelKey other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return organizationId + "/" + year;
    }
}
