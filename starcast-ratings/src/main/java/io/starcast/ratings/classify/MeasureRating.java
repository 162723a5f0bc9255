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

package io.starcast.ratings.classify;

import io.starcast.ratings.thresholds.ThresholdTable;

import java.util.Objects;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/// The star level of one measure score and its distance to the next level.
///
/// A rating is either defined, with a level and usually a distance, or
/// undefined because the score was missing or could not be classified.
/// Undefined ratings are excluded from aggregation and improvement paths.
public final class MeasureRating {

    private static final MeasureRating UNDEFINED = new MeasureRating(0, Double.NaN);

    private final int level;
    private final double distanceToNext;

    private MeasureRating(int level, double distanceToNext) {
        this.level = level;
        this.distanceToNext = distanceToNext;
    }

    /// Creates a defined rating.
    ///
    /// @param level the star level, 1 through 5
    /// @param distanceToNext the score gap to the next level; NaN when unknown
    public static MeasureRating of(int level, double distanceToNext) {
        if (level < ThresholdTable.MIN_LEVEL || level > ThresholdTable.MAX_LEVEL) {
            throw new IllegalArgumentException("Level must be in [1, 5], got: " + level);
        }
        return new MeasureRating(level, distanceToNext);
    }

    public static MeasureRating undefined() {
        return UNDEFINED;
    }

    public boolean isDefined() {
        return level != 0;
    }

    public OptionalInt level() {
        return isDefined() ? OptionalInt.of(level) : OptionalInt.empty();
    }

    public OptionalDouble distanceToNext() {
        return isDefined() && Double.isFinite(distanceToNext)
            ? OptionalDouble.of(distanceToNext)
            : OptionalDouble.empty();
    }

    public boolean isAtCeiling() {
        return level == ThresholdTable.MAX_LEVEL;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MeasureRating)) return false;
        MeasureRating that = (MeasureRating) o;
        return level == that.level && Double.compare(that.distanceToNext, distanceToNext) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(level, distanceToNext);
    }

    @Override
    public String toString() {
        if (!isDefined()) {
            return "MeasureRating[undefined]";
        }
        return "MeasureRating[level=" + level + ", distanceToNext=" + distanceToNext + "]";
    }
}
