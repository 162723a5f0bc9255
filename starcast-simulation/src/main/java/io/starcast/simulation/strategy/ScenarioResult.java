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

/// Outcome of one evaluated scenario.
///
/// @param scenario the scenario
/// @param baselineRating expected composite rating without the improvements
/// @param improvedRating expected composite rating with them
/// @param valueChange change in expected dollar value
/// @param cost total improvement points times the cost per point
/// @param roi `valueChange / cost`
public record ScenarioResult(
    Scenario scenario,
    double baselineRating,
    double improvedRating,
    double valueChange,
    double cost,
    double roi
) {

    public double ratingChange() {
        return improvedRating - baselineRating;
    }
}
