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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Baseline and improved expected values of two rating distributions.
///
/// @param baselineValue expected value under the baseline distribution
/// @param improvedValue expected value under the improved distribution
/// @param netChange `improvedValue - baselineValue`
/// @param probabilityChanges per-level `improved - baseline` probability
public record Valuation(
    double baselineValue,
    double improvedValue,
    double netChange,
    Map<Integer, Double> probabilityChanges
) {

    public Valuation {
        probabilityChanges = Collections.unmodifiableMap(new LinkedHashMap<>(probabilityChanges));
    }

    /// Return on an intervention cost.
    ///
    /// @return `netChange / cost`, or positive infinity when the cost is 0
    /// @throws IllegalArgumentException for a negative or NaN cost
    public double roi(double cost) {
        if (!(cost >= 0.0)) {
            throw new IllegalArgumentException("Cost must be non-negative, got: " + cost);
        }
        if (cost == 0.0) {
            return Double.POSITIVE_INFINITY;
        }
        return netChange / cost;
    }
}
