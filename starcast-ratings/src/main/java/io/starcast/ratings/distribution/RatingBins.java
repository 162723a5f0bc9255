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
import java.util.Objects;
import java.util.OptionalDouble;

/// Bins composite ratings into the five star levels.
///
/// # Default layout
///
/// ```text
///   cutoffs:      1.75    2.75    3.25    3.75    4.25    4.75
///   ───────────────┼───────┼───────┼───────┼───────┼───────┼──────────
///   level:     1   │   2   │   3   │   3   │   4   │   4   │   5
/// ```
///
/// The cutoffs are the half-star rounding points of the composite rating.
/// Each interval maps to the whole-star level of its half-star value, so
/// level 1 is below 1.75, level 5 is at or above 4.75, and every rating lands
/// in exactly one of the five levels. Intervals are half-open `[lo, hi)`.
public final class RatingBins {

    /// Program-wide composite rating cutoffs
    public static final double[] DEFAULT_CUTOFFS = {1.75, 2.75, 3.25, 3.75, 4.25, 4.75};

    /// Star level for each interval delimited by [#DEFAULT_CUTOFFS]
    public static final int[] DEFAULT_INTERVAL_LEVELS = {1, 2, 3, 3, 4, 4, 5};

    private static final RatingBins DEFAULT = new RatingBins(DEFAULT_CUTOFFS, DEFAULT_INTERVAL_LEVELS);

    private final double[] cutoffs;
    private final int[] intervalLevels;

    /// Creates bins from ascending cutoffs and the level of each interval.
    ///
    /// @param cutoffs strictly ascending finite cutoffs
    /// @param intervalLevels one level per interval, `cutoffs.length + 1` entries,
    ///                       non-decreasing, each in [1, 5]
    public RatingBins(double[] cutoffs, int[] intervalLevels) {
        Objects.requireNonNull(cutoffs, "cutoffs cannot be null");
        Objects.requireNonNull(intervalLevels, "intervalLevels cannot be null");
        if (intervalLevels.length != cutoffs.length + 1) {
            throw new IllegalArgumentException(
                "Expected " + (cutoffs.length + 1) + " interval levels, got: " + intervalLevels.length);
        }
        for (int i = 0; i < cutoffs.length; i++) {
            if (!Double.isFinite(cutoffs[i])) {
                throw new IllegalArgumentException("Cutoffs must be finite: " + Arrays.toString(cutoffs));
            }
            if (i > 0 && cutoffs[i] <= cutoffs[i - 1]) {
                throw new IllegalArgumentException("Cutoffs must be strictly ascending: " + Arrays.toString(cutoffs));
            }
        }
        for (int i = 0; i < intervalLevels.length; i++) {
            int level = intervalLevels[i];
            if (level < ThresholdTable.MIN_LEVEL || level > ThresholdTable.MAX_LEVEL) {
                throw new IllegalArgumentException("Interval level must be in [1, 5], got: " + level);
            }
            if (i > 0 && level < intervalLevels[i - 1]) {
                throw new IllegalArgumentException("Interval levels must be non-decreasing: " + Arrays.toString(intervalLevels));
            }
        }
        this.cutoffs = cutoffs.clone();
        this.intervalLevels = intervalLevels.clone();
    }

    public static RatingBins defaults() {
        return DEFAULT;
    }

    /// Returns the star level whose bin contains the rating.
    public int levelFor(double rating) {
        if (Double.isNaN(rating)) {
            throw new IllegalArgumentException("Cannot bin an undefined rating");
        }
        int interval = 0;
        while (interval < cutoffs.length && rating >= cutoffs[interval]) {
            interval++;
        }
        return intervalLevels[interval];
    }

    /// Builds the empirical level distribution of a set of composite ratings.
    ///
    /// NaN entries are undefined draws and are left out of both the counts
    /// and the total.
    public RatingProbabilityDistribution distribution(double[] ratings) {
        long[] counts = new long[ThresholdTable.MAX_LEVEL + 1];
        long total = 0;
        for (double rating : ratings) {
            if (Double.isNaN(rating)) {
                continue;
            }
            counts[levelFor(rating)]++;
            total++;
        }
        return RatingProbabilityDistribution.fromCounts(counts, total);
    }

    /// Returns the smallest cutoff strictly above the rating.
    public OptionalDouble nextCutoffAbove(double rating) {
        for (double cutoff : cutoffs) {
            if (cutoff > rating) {
                return OptionalDouble.of(cutoff);
            }
        }
        return OptionalDouble.empty();
    }

    public double[] cutoffs() {
        return cutoffs.clone();
    }

    public int[] intervalLevels() {
        return intervalLevels.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RatingBins)) return false;
        RatingBins that = (RatingBins) o;
        return Arrays.equals(cutoffs, that.cutoffs) && Arrays.equals(intervalLevels, that.intervalLevels);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(cutoffs) + Arrays.hashCode(intervalLevels);
    }

    @Override
    public String toString() {
        return "RatingBins[cutoffs=" + Arrays.toString(cutoffs) + ", levels=" + Arrays.toString(intervalLevels) + "]";
    }
}
