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

import io.starcast.ratings.aggregate.MeasureWeights;
import io.starcast.ratings.classify.MeasureRating;
import io.starcast.ratings.distribution.RatingBins;
import io.starcast.ratings.thresholds.ThresholdTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/// Greedy ordering of single-level measure improvements toward a target composite rating.
///
/// # Algorithm
///
/// ```text
///   rated, weighted measures
///        │
///        ├──► total weight (includes level-5 measures)
///        │
///        ▼
///   drop level 5, undefined distance, zero weight
///        │
///        ▼
///   sort by |distance| / weight ascending
///        │
///        ▼
///   impact_i = weight_i / total ; cumulative_i = current + Σ impact
///        │
///        ▼
///   first i with cumulative_i ≥ target ──► prefix [0, i]
///        │ none
///        ▼
///   full list, target unreachable
/// ```
///
/// Each step is treated as an independent one-level gain whose effect on the
/// composite is linear in the measure's share of weight. The projected
/// ratings are a first-order approximation of [io.starcast.ratings.aggregate.AggregateRating];
/// the ordering is what callers act on.
public final class ImprovementPathOptimizer {

    private static final Logger logger = LogManager.getLogger(ImprovementPathOptimizer.class);

    /// Slack allowed when comparing a projected rating with the target
    static final double TARGET_TOLERANCE = 1e-9;

    private ImprovementPathOptimizer() {
    }

    /// Computes the improvement path from classifier output.
    ///
    /// @param ratings per-measure ratings; undefined ratings are skipped
    /// @param weights measure weights; unweighted measures are skipped
    /// @param currentAggregate the current composite rating
    /// @param targetAggregate the composite rating to reach
    public static ImprovementPath computePath(Map<String, MeasureRating> ratings,
                                              MeasureWeights weights,
                                              double currentAggregate,
                                              double targetAggregate) {
        Objects.requireNonNull(ratings, "ratings cannot be null");
        Map<String, Integer> levels = new LinkedHashMap<>();
        Map<String, Double> distances = new LinkedHashMap<>();
        for (Map.Entry<String, MeasureRating> entry : ratings.entrySet()) {
            MeasureRating rating = entry.getValue();
            if (!rating.isDefined()) {
                continue;
            }
            levels.put(entry.getKey(), rating.level().getAsInt());
            OptionalDouble distance = rating.distanceToNext();
            distances.put(entry.getKey(), distance.isPresent() ? distance.getAsDouble() : Double.NaN);
        }
        return computePath(levels, distances, weights, currentAggregate, targetAggregate);
    }

    /// Computes the improvement path from parallel level and distance maps.
    ///
    /// @param currentRatings measure to current level; absent or null means undefined
    /// @param currentDistances measure to distance to next level; absent or NaN means undefined
    /// @param weights measure weights
    /// @param currentAggregate the current composite rating
    /// @param targetAggregate the composite rating to reach
    /// @throws IllegalArgumentException if either rating is NaN
    public static ImprovementPath computePath(Map<String, Integer> currentRatings,
                                              Map<String, Double> currentDistances,
                                              MeasureWeights weights,
                                              double currentAggregate,
                                              double targetAggregate) {
        Objects.requireNonNull(currentRatings, "currentRatings cannot be null");
        Objects.requireNonNull(currentDistances, "currentDistances cannot be null");
        Objects.requireNonNull(weights, "weights cannot be null");
        if (Double.isNaN(currentAggregate) || Double.isNaN(targetAggregate)) {
            throw new IllegalArgumentException(String.format(
                "Current and target ratings must be defined, got current=%s target=%s",
                currentAggregate, targetAggregate));
        }

        double totalWeight = 0.0;
        List<Candidate> candidates = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : currentRatings.entrySet()) {
            String measure = entry.getKey();
            Integer level = entry.getValue();
            OptionalDouble weight = weights.weight(measure);
            if (level == null || weight.isEmpty()) {
                continue;
            }
            totalWeight += weight.getAsDouble();
            if (level >= ThresholdTable.MAX_LEVEL || weight.getAsDouble() <= 0.0) {
                continue;
            }
            Double distance = currentDistances.get(measure);
            if (distance == null || Double.isNaN(distance)) {
                continue;
            }
            candidates.add(new Candidate(measure, level, distance, weight.getAsDouble()));
        }

        boolean alreadyThere = currentAggregate >= targetAggregate - TARGET_TOLERANCE;
        if (totalWeight <= 0.0) {
            return new ImprovementPath(List.of(), 0, currentAggregate, targetAggregate, !alreadyThere);
        }

        candidates.sort(Comparator.comparingDouble(Candidate::efficiency).thenComparing(Candidate::measure));

        List<ImprovementOpportunity> path = new ArrayList<>(candidates.size());
        double cumulativeWeight = 0.0;
        double cumulativeRating = currentAggregate;
        int steps = alreadyThere ? 0 : -1;
        for (Candidate candidate : candidates) {
            double impact = candidate.weight / totalWeight;
            cumulativeWeight += candidate.weight;
            cumulativeRating += impact;
            path.add(new ImprovementOpportunity(candidate.measure, candidate.level, candidate.distance,
                candidate.weight, candidate.efficiency(), impact, cumulativeWeight, cumulativeRating));
            if (steps < 0 && cumulativeRating >= targetAggregate - TARGET_TOLERANCE) {
                steps = path.size();
            }
        }

        boolean unreachable = steps < 0;
        if (unreachable) {
            steps = path.size();
            logger.debug("Target {} unreachable from {}: best projection {}",
                targetAggregate, currentAggregate, cumulativeRating);
        }
        return new ImprovementPath(path, steps, currentAggregate, targetAggregate, unreachable);
    }

    /// Finds the smallest composite rating cutoff strictly above the current rating.
    ///
    /// @return the cutoff, or empty when the rating is at or above the highest cutoff
    public static Optional<NextCutoff> nextCutoff(double currentRating, RatingBins bins) {
        if (Double.isNaN(currentRating)) {
            return Optional.empty();
        }
        OptionalDouble cutoff = bins.nextCutoffAbove(currentRating);
        return cutoff.isPresent()
            ? Optional.of(new NextCutoff(currentRating, cutoff.getAsDouble()))
            : Optional.empty();
    }

    public static Optional<NextCutoff> nextCutoff(double currentRating) {
        return nextCutoff(currentRating, RatingBins.defaults());
    }

    private static final class Candidate {
        private final String measure;
        private final int level;
        private final double distance;
        private final double weight;

        private Candidate(String measure, int level, double distance, double weight) {
            this.measure = measure;
            this.level = level;
            this.distance = distance;
            this.weight = weight;
        }

        String measure() {
            return measure;
        }

        double efficiency() {
            return Math.abs(distance) / weight;
        }
    }
}
