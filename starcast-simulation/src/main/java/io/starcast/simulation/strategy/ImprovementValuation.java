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

import io.starcast.ratings.value.Valuation;
import io.starcast.simulation.SimulationResult;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Baseline and improved runs of one set of measure improvements, with their valuation.
///
/// @param improvements points added to each improved measure
/// @param baseline the run without the improvements
/// @param improved the run with the improvements, same seed as the baseline
/// @param valuation expected values of both runs and the per-level probability shift
public record ImprovementValuation(
    Map<String, Double> improvements,
    SimulationResult baseline,
    SimulationResult improved,
    Valuation valuation
) {

    public ImprovementValuation {
        improvements = Collections.unmodifiableMap(new LinkedHashMap<>(improvements));
    }

    public double expectedRatingChange() {
        return improved.expectedRating() - baseline.expectedRating();
    }

    public double netValueChange() {
        return valuation.netChange();
    }
}
