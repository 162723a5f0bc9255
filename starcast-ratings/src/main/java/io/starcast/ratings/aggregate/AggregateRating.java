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

package io.starcast.ratings.aggregate;

import io.starcast.ratings.classify.MeasureRating;

import java.util.Map;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/// Weighted-average composite star rating.
///
/// Only measures that are both rated and weighted enter the numerator and
/// the denominator. When no weight remains the result is empty, which is
/// distinct from a legitimate average. The mean is returned unclamped since
/// downstream binning depends on its exact value.
public final class AggregateRating {

    private AggregateRating() {
    }

    public static OptionalDouble aggregate(Map<String, MeasureRating> ratings, MeasureWeights weights) {
        double totalScore = 0.0;
        double totalWeight = 0.0;
        for (Map.Entry<String, Double> entry : weights.asMap().entrySet()) {
            MeasureRating rating = ratings.get(entry.getKey());
            if (rating == null) {
                continue;
            }
            OptionalInt level = rating.level();
            if (level.isEmpty()) {
                continue;
            }
            totalScore += level.getAsInt() * entry.getValue();
            totalWeight += entry.getValue();
        }
        return totalWeight > 0 ? OptionalDouble.of(totalScore / totalWeight) : OptionalDouble.empty();
    }

    /// Aggregates bare star levels keyed by measure.
    public static OptionalDouble aggregateLevels(Map<String, Integer> levels, MeasureWeights weights) {
        double totalScore = 0.0;
        double totalWeight = 0.0;
        for (Map.Entry<String, Double> entry : weights.asMap().entrySet()) {
            Integer level = levels.get(entry.getKey());
            if (level == null) {
                continue;
            }
            totalScore += level * entry.getValue();
            totalWeight += entry.getValue();
        }
        return totalWeight > 0 ? OptionalDouble.of(totalScore / totalWeight) : OptionalDouble.empty();
    }

    /// Sums the weight of the measures that would enter the aggregate.
    public static double includedWeight(Map<String, MeasureRating> ratings, MeasureWeights weights) {
        double total = 0.0;
        for (Map.Entry<String, MeasureRating> entry : ratings.entrySet()) {
            if (entry.getValue().isDefined()) {
                total += weights.weight(entry.getKey()).orElse(0.0);
            }
        }
        return total;
    }
}
