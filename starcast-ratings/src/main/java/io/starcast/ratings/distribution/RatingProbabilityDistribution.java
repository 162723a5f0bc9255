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

package io.starcast.ratings.distribution;

import io.starcast.ratings.thresholds.ThresholdTable;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalInt;

/// Probability mass over the five star levels.
///
/// A distribution built from a non-empty draw set sums to 1 over exactly the
/// five levels. An empty distribution, from a run with no defined draws, has
/// zero mass everywhere and reports [#isEmpty()].
public final class RatingProbabilityDistribution {

    private static final RatingProbabilityDistribution EMPTY =
        new RatingProbabilityDistribution(new double[ThresholdTable.MAX_LEVEL + 1], 0);

    /// Indexed by level; slot 0 unused
    private final double[] probabilities;
    private final long sampleCount;

    private RatingProbabilityDistribution(double[] probabilities, long sampleCount) {
        this.probabilities = probabilities;
        this.sampleCount = sampleCount;
    }

    /// Builds a distribution from per-level counts.
    ///
    /// @param counts counts indexed by level, at least 6 slots, slot 0 ignored
    /// @param total the number of counted draws
    public static RatingProbabilityDistribution fromCounts(long[] counts, long total) {
        if (total <= 0) {
            return EMPTY;
        }
        double[] probabilities = new double[ThresholdTable.MAX_LEVEL + 1];
        for (int level = ThresholdTable.MIN_LEVEL; level <= ThresholdTable.MAX_LEVEL; level++) {
            probabilities[level] = (double) counts[level] / total;
        }
        return new RatingProbabilityDistribution(probabilities, total);
    }

    /// Builds a distribution from explicit probabilities; absent levels have zero mass.
    ///
    /// @throws IllegalArgumentException for levels outside 1–5 or negative probabilities
    public static RatingProbabilityDistribution of(Map<Integer, Double> probabilitiesByLevel) {
        double[] probabilities = new double[ThresholdTable.MAX_LEVEL + 1];
        for (Map.Entry<Integer, Double> entry : probabilitiesByLevel.entrySet()) {
            int level = entry.getKey();
            double p = entry.getValue();
            if (level < ThresholdTable.MIN_LEVEL || level > ThresholdTable.MAX_LEVEL) {
                throw new IllegalArgumentException("Level must be in [1, 5], got: " + level);
            }
            if (!(p >= 0.0) || p > 1.0) {
                throw new IllegalArgumentException("Probability must be in [0, 1], got: " + p);
            }
            probabilities[level] = p;
        }
        return new RatingProbabilityDistribution(probabilities, 0);
    }

    public static RatingProbabilityDistribution empty() {
        return EMPTY;
    }

    public double probability(int level) {
        if (level < ThresholdTable.MIN_LEVEL || level > ThresholdTable.MAX_LEVEL) {
            return 0.0;
        }
        return probabilities[level];
    }

    /// Level to probability for all five levels, ascending.
    public Map<Integer, Double> asMap() {
        Map<Integer, Double> map = new LinkedHashMap<>();
        for (int level = ThresholdTable.MIN_LEVEL; level <= ThresholdTable.MAX_LEVEL; level++) {
            map.put(level, probabilities[level]);
        }
        return Collections.unmodifiableMap(map);
    }

    public double sum() {
        double sum = 0.0;
        for (int level = ThresholdTable.MIN_LEVEL; level <= ThresholdTable.MAX_LEVEL; level++) {
            sum += probabilities[level];
        }
        return sum;
    }

    /// Probability of reaching at least the given level.
    public double probabilityAtLeast(int level) {
        double sum = 0.0;
        for (int l = Math.max(level, ThresholdTable.MIN_LEVEL); l <= ThresholdTable.MAX_LEVEL; l++) {
            sum += probabilities[l];
        }
        return sum;
    }

    public OptionalInt mostLikelyLevel() {
        if (isEmpty()) {
            return OptionalInt.empty();
        }
        int best = ThresholdTable.MIN_LEVEL;
        for (int level = ThresholdTable.MIN_LEVEL + 1; level <= ThresholdTable.MAX_LEVEL; level++) {
            if (probabilities[level] > probabilities[best]) {
                best = level;
            }
        }
        return OptionalInt.of(best);
    }

    /// Number of draws behind the distribution; 0 when built from explicit probabilities.
    public long sampleCount() {
        return sampleCount;
    }

    public boolean isEmpty() {
        return sum() == 0.0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RatingProbabilityDistribution)) return false;
        RatingProbabilityDistribution that = (RatingProbabilityDistribution) o;
        return sampleCount == that.sampleCount && Arrays.equals(probabilities, that.probabilities);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(probabilities) + Long.hashCode(sampleCount);
    }

    @Override
    public String toString() {
        return "RatingProbabilityDistribution" + asMap();
    }
}
