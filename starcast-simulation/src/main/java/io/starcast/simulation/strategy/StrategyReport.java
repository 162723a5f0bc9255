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

import io.starcast.simulation.SimulationResult;

import java.util.List;
import java.util.Optional;

/// Ranked scenario outcomes.
///
/// @param baseline the run every scenario was compared against
/// @param results evaluated scenarios, highest ROI first
/// @param failures scenarios that could not be evaluated
public record StrategyReport(
    SimulationResult baseline,
    List<ScenarioResult> results,
    List<ScenarioFailure> failures
) {

    public StrategyReport {
        results = List.copyOf(results);
        failures = List.copyOf(failures);
    }

    public Optional<ScenarioResult> best() {
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }
}
