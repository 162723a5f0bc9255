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


package io.starcast.ratings.value;

import io.starcast.ratings.distribution.RatingProbabilityDistribution;
import io.starcast.ratings.thresholds.ThresholdTable;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Converts rating distributions into expected dollar values.
///
/// ```text
///   E[value] = Σ over levels  P(level) × value(level)
/// ```
public final class ValuationLayer {

    private ValuationLayer() {
    }

    public static double expectedValue(RatingProbabilityDistribution distribution, RatingValueTable valueTable) {
        Objects.requireNonNull(distribution, "distribution cannot be null");
        Objects.requireNonNull(valueTable, "valueTable cannot be null");
        double expected = 0.0;
        for (int level = ThresholdTable.MIN_LEVEL; level <= ThresholdTable.MAX_LEVEL; level++) {
            expected += distribution.probability(level) * valueTable.value(level);
        }
        return expected;
    }

    /// Compares an improved scenario against the baseline.
    public static Valuation valuate(RatingProbabilityDistribution baseline,
                                    RatingProbabilityDistribution improved,
                                    RatingValueTable valueTable) {
        double baselineValue = expectedValue(baseline, valueTable);
        double improvedValue = expectedValue(improved, valueTable);
        Map<Integer, Double> changes = new LinkedHashMap<>();
        for (int level = ThresholdTable.MIN_LEVEL; level <= ThresholdTable.MAX_LEVEL; level++) {
            changes.put(level, improved.probability(level) - baseline.probability(level));
        }
        return new Valuation(baselineValue, improvedValue, improvedValue - baselineValue, changes);
    }
}
