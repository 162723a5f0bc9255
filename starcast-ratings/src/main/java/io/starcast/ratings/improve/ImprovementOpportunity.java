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


package io.starcast.ratings.improve;

/// One eligible measure in an improvement path.
///
/// @param measureKey the measure
/// @param currentLevel current star level, 1 to 4
/// @param distance score change needed to reach the next level
/// @param weight measure weight
/// @param efficiency `|distance| / weight`, lower is cheaper
/// @param impact projected change of the composite rating from one level up, `weight / totalWeight`
/// @param cumulativeWeight running weight up to and including this measure
/// @param cumulativeRating projected composite rating after improving this measure and all before it
public record ImprovementOpportunity(
    String measureKey,
    int currentLevel,
    double distance,
    double weight,
    double efficiency,
    double impact,
    double cumulativeWeight,
    double cumulativeRating
) {
}
