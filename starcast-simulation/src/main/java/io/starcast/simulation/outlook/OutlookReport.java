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


package io.starcast.simulation.outlook;

import io.starcast.ratings.classify.MeasureRating;
import io.starcast.ratings.improve.ImprovementPath;
import io.starcast.ratings.improve.NextCutoff;
import io.starcast.simulation.SimulationResult;
import io.starcast.simulation.strategy.StrategyReport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/// Current standing, improvement path, forecast and strategy ranking of one organization and year.
public final class OutlookReport {

    private final String organizationId;
    private final int year;
    private final Map<String, MeasureRating> currentRatings;
    private final OptionalDouble currentRating;
    private final NextCutoff nextCutoff;
    private final ImprovementPath improvementPath;
    private final SimulationResult baseline;
    private final StrategyReport strategies;

    OutlookReport(String organizationId, int year, Map<String, MeasureRating> currentRatings,
                  OptionalDouble currentRating, NextCutoff nextCutoff, ImprovementPath improvementPath,
                  SimulationResult baseline, StrategyReport strategies) {
        this.organizationId = organizationId;
        this.year = year;
        this.currentRatings = Collections.unmodifiableMap(new LinkedHashMap<>(currentRatings));
        this.currentRating = currentRating;
        this.nextCutoff = nextCutoff;
        this.improvementPath = improvementPath;
        this.baseline = baseline;
        this.strategies = strategies;
    }

    public String organizationId() {
        return organizationId;
    }

    public int year() {
        return year;
    }

    /// Classification of the observed row, per weighted measure.
    public Map<String, MeasureRating> currentRatings() {
        return currentRatings;
    }

    /// The observed composite rating; empty when no weighted measure is rated.
    public OptionalDouble currentRating() {
        return currentRating;
    }

    /// The next composite cutoff above the current rating; empty at the top or when undefined.
    public Optional<NextCutoff> nextCutoff() {
        return Optional.ofNullable(nextCutoff);
    }

    /// Composite points between the current rating and the next cutoff, 0 when there is none.
    public double pointsNeeded() {
        return nextCutoff != null ? nextCutoff.pointsNeeded() : 0.0;
    }

    /// Path toward the next cutoff; present exactly when [#nextCutoff()] is.
    public Optional<ImprovementPath> improvementPath() {
        return Optional.ofNullable(improvementPath);
    }

    public SimulationResult baseline() {
        return baseline;
    }

    public StrategyReport strategies() {
        return strategies;
    }

    @Override
    public String toString() {
        return "OutlookReport[" + organizationId + "/" + year + ", current=" + currentRating
            + ", next=" + nextCutoff + ", expected=" + baseline.expectedRating()
            + ", scenarios=" + strategies.results().size() + "]";
    }
}
