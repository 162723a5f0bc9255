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

package io.starcast.ratings.thresholds;

/// A half-open score interval `[lower, upper)` mapped to a star level.
///
/// Open-ended bands use infinite bounds.
///
/// @param lower inclusive lower bound, may be negative infinity
/// @param upper exclusive upper bound, may be positive infinity
/// @param level the star level, 1 through 5
public record ThresholdBand(double lower, double upper, int level) {

    public ThresholdBand {
        if (Double.isNaN(lower) || Double.isNaN(upper)) {
            throw new IllegalArgumentException("Band bounds cannot be NaN");
        }
        if (lower > upper) {
            throw new IllegalArgumentException("Lower must not exceed upper: " + lower + " > " + upper);
        }
        if (level < ThresholdTable.MIN_LEVEL || level > ThresholdTable.MAX_LEVEL) {
            throw new IllegalArgumentException("Level must be in [1, 5], got: " + level);
        }
    }

    public static ThresholdBand of(double lower, double upper, int level) {
        return new ThresholdBand(lower, upper, level);
    }

    public boolean contains(double score) {
        return lower <= score && score < upper;
    }

    /// A degenerate band such as `[100, 100)` contains no score.
    public boolean isEmpty() {
        return lower == upper;
    }

    @Override
    public String toString() {
        return "[" + lower + ", " + upper + ")→" + level;
    }
}
