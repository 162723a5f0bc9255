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

import io.starcast.ratings.UnknownMeasureException;
import io.starcast.ratings.classify.MeasureRating;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class AggregateRatingTest {

    @Test
    void weightedMeanOfTwoMeasures() {
        MeasureWeights weights = MeasureWeights.of(Map.of("A", 1.0, "B", 3.0));
        Map<String, MeasureRating> ratings = Map.of(
            "A", MeasureRating.of(3, 1.0),
            "B", MeasureRating.of(5, 0.0));

        assertThat(AggregateRating.aggregate(ratings, weights).getAsDouble()).isCloseTo(4.5, within(1e-12));
    }

    @Test
    void equalWeightsGiveThePlainMean() {
        MeasureWeights weights = MeasureWeights.equal(2.0, "A", "B", "C");
        Map<String, Integer> levels = Map.of("A", 2, "B", 3, "C", 5);

        assertThat(AggregateRating.aggregateLevels(levels, weights).getAsDouble())
            .isCloseTo(10.0 / 3.0, within(1e-12));
    }

    @Test
    void zeroWeightMeasuresDoNotMoveTheAggregate() {
        Map<String, MeasureRating> ratings = new LinkedHashMap<>();
        ratings.put("A", MeasureRating.of(2, 1.0));
        ratings.put("B", MeasureRating.of(4, 1.0));
        ratings.put("Z", MeasureRating.of(1, 1.0));
        MeasureWeights withZero = MeasureWeights.of(Map.of("A", 1.0, "B", 1.0, "Z", 0.0));
        MeasureWeights without = MeasureWeights.of(Map.of("A", 1.0, "B", 1.0));

        assertThat(AggregateRating.aggregate(ratings, withZero))
            .isEqualTo(AggregateRating.aggregate(ratings, without));
    }

    @Test
    void undefinedAndUnweightedMeasuresAreExcluded() {
        Map<String, MeasureRating> ratings = new LinkedHashMap<>();
        ratings.put("A", MeasureRating.of(4, 1.0));
        ratings.put("B", MeasureRating.undefined());
        ratings.put("C", MeasureRating.of(1, 1.0));
        MeasureWeights weights = MeasureWeights.of(Map.of("A", 1.0, "B", 5.0));

        assertThat(AggregateRating.aggregate(ratings, weights)).hasValue(4.0);
        assertThat(AggregateRating.includedWeight(ratings, weights)).isEqualTo(1.0);
    }

    @Test
    void noIncludedWeightIsUndefinedRatherThanZero() {
        Map<String, MeasureRating> ratings = Map.of("A", MeasureRating.undefined());
        MeasureWeights weights = MeasureWeights.of(Map.of("A", 1.0));

        assertThat(AggregateRating.aggregate(ratings, weights)).isEqualTo(OptionalDouble.empty());
        assertThat(AggregateRating.aggregate(Map.of("A", MeasureRating.of(3, 0.0)),
            MeasureWeights.of(Map.of("A", 0.0)))).isEmpty();
    }

    @Test
    void weightsLoadFromJsonAndRejectNegatives() {
        MeasureWeights weights = MeasureWeights.fromJson("{\"C: A\": 1, \"C: B\": 3.5}");

        assertThat(weights.require("C: B")).isEqualTo(3.5);
        assertThat(weights.weight("C: Missing")).isEmpty();
        assertThat(MeasureWeights.fromJson(weights.toJson())).isEqualTo(weights);
        assertThatThrownBy(() -> weights.require("C: Missing")).isInstanceOf(UnknownMeasureException.class);
        assertThatThrownBy(() -> MeasureWeights.fromJson("{\"C: A\": -1}"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
