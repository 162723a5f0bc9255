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


package io.starcast.simulation;

import io.starcast.ratings.distribution.RatingProbabilityDistribution;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Summary of a simulation run.
///
/// A run that was cancelled or ran out of time still produces a valid
/// result over the draws it completed; [#cancelled()] tells the two apart.
/// Draws are reported in index order.
public final class SimulationResult {

    private final String organizationId;
    private final int year;
    private final long seed;
    private final int requestedDraws;
    private final List<SimulationDraw> draws;
    private final double[] ratings;
    private final int undefinedDraws;
    private final RatingProbabilityDistribution distribution;
    private final double expectedRating;
    private final double stdDev;
    private final Map<String, double[]> measureValues;
    private final Map<String, OutcomeCounts> outcomeCounts;

    SimulationResult(String organizationId, int year, long seed, int requestedDraws,
                     List<SimulationDraw> draws, double[] ratings, int undefinedDraws,
                     RatingProbabilityDistribution distribution, double expectedRating, double stdDev,
                     Map<String, double[]> measureValues, Map<String, OutcomeCounts> outcomeCounts) {
        this.organizationId = organizationId;
        this.year = year;
        this.seed = seed;
        this.requestedDraws = requestedDraws;
        this.draws = List.copyOf(draws);
        this.ratings = ratings;
        this.undefinedDraws = undefinedDraws;
        this.distribution = distribution;
        this.expectedRating = expectedRating;
        this.stdDev = stdDev;
        this.measureValues = Collections.unmodifiableMap(new LinkedHashMap<>(measureValues));
        this.outcomeCounts = Collections.unmodifiableMap(new LinkedHashMap<>(outcomeCounts));
    }

    public String organizationId() {
        return organizationId;
    }

    public int year() {
        return year;
    }

    public long seed() {
        return seed;
    }

    public int requestedDraws() {
        return requestedDraws;
    }

    public int completedDraws() {
        return draws.size();
    }

    /// Draws with a defined composite rating.
    public int definedDraws() {
        return draws.size() - undefinedDraws;
    }

    public int undefinedDraws() {
        return undefinedDraws;
    }

    public boolean cancelled() {
        return draws.size() < requestedDraws;
    }

    public List<SimulationDraw> draws() {
        return draws;
    }

    /// Composite rating of every completed draw, NaN where undefined.
    public double[] ratings() {
        return ratings.clone();
    }

    public RatingProbabilityDistribution distribution() {
        return distribution;
    }

    /// Mean composite rating over defined draws; NaN when there are none.
    public double expectedRating() {
        return expectedRating;
    }

    /// Population standard deviation of the defined draws; NaN when there are none.
    public double stdDev() {
        return stdDev;
    }

    /// Drawn values of one measure per completed draw, NaN where unavailable.
    public double[] measureValues(String measureKey) {
        double[] values = measureValues.get(measureKey);
        return values != null ? values.clone() : new double[0];
    }

    public Map<String, OutcomeCounts> outcomeCounts() {
        return outcomeCounts;
    }

    public OutcomeCounts outcomeCounts(String measureKey) {
        return outcomeCounts.getOrDefault(measureKey, OutcomeCounts.NONE);
    }

    @Override
    public String toString() {
        return String.format("SimulationResult[%s/%d, draws=%d/%d, undefined=%d, expected=%.4f, sd=%.4f%s, %s]",
            organizationId, year, completedDraws(), requestedDraws, undefinedDraws, expectedRating, stdDev,
            cancelled() ? ", cancelled" : "", distribution);
    }
}
