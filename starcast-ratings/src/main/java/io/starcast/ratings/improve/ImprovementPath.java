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

import java.util.List;
import java.util.Objects;

/// Ordered improvement opportunities and how many of them reach the target.
///
/// When the target is reachable, the first [#stepsToTarget()] opportunities
/// form the minimal prefix whose cumulative projected rating meets it. When
/// it is not, `stepsToTarget` equals the full list size and
/// [#targetUnreachable()] is set.
public final class ImprovementPath {

    private final List<ImprovementOpportunity> opportunities;
    private final int stepsToTarget;
    private final double currentRating;
    private final double targetRating;
    private final boolean targetUnreachable;

    ImprovementPath(List<ImprovementOpportunity> opportunities, int stepsToTarget,
                    double currentRating, double targetRating, boolean targetUnreachable) {
        this.opportunities = List.copyOf(Objects.requireNonNull(opportunities, "opportunities cannot be null"));
        if (stepsToTarget < 0 || stepsToTarget > opportunities.size()) {
            throw new IllegalArgumentException("stepsToTarget out of range: " + stepsToTarget);
        }
        this.stepsToTarget = stepsToTarget;
        this.currentRating = currentRating;
        this.targetRating = targetRating;
        this.targetUnreachable = targetUnreachable;
    }

    /// Every eligible opportunity, most efficient first.
    public List<ImprovementOpportunity> opportunities() {
        return opportunities;
    }

    /// The minimal prefix reaching the target, or every opportunity if the target is unreachable.
    public List<ImprovementOpportunity> requiredSteps() {
        return opportunities.subList(0, stepsToTarget);
    }

    public int stepsToTarget() {
        return stepsToTarget;
    }

    public double currentRating() {
        return currentRating;
    }

    public double targetRating() {
        return targetRating;
    }

    public boolean targetUnreachable() {
        return targetUnreachable;
    }

    /// Projected composite rating after the required steps.
    public double projectedRating() {
        return stepsToTarget == 0 ? currentRating : opportunities.get(stepsToTarget - 1).cumulativeRating();
    }

    @Override
    public String toString() {
        return String.format("ImprovementPath[current=%.3f, target=%.3f, steps=%d/%d%s]",
            currentRating, targetRating, stepsToTarget, opportunities.size(),
            targetUnreachable ? ", unreachable" : "");
    }
}
