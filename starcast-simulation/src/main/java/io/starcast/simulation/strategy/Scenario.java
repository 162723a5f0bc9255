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


package io.starcast.simulation.strategy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A named set of measure improvements.
///
/// @param name display name
/// @param improvements points to add per measure
public record Scenario(String name, Map<String, Double> improvements) {

    public Scenario {
        Objects.requireNonNull(name, "name cannot be null");
        if (improvements.isEmpty()) {
            throw new IllegalArgumentException("Scenario " + name + " improves no measure");
        }
        improvements = Collections.unmodifiableMap(new LinkedHashMap<>(improvements));
    }

    /// Total improvement points, the basis of the scenario's cost.
    public double totalPoints() {
        double total = 0.0;
        for (double points : improvements.values()) {
            total += points;
        }
        return total;
    }
}
