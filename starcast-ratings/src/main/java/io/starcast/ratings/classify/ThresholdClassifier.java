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

import io.starcast.ratings.ScoreOutOfRangeException;
import io.starcast.ratings.UnknownMeasureException;
import io.starcast.ratings.aggregate.MeasureWeights;
import io.starcast.ratings.thresholds.ThresholdBand;
import io.starcast.ratings.thresholds.ThresholdTable;
import io.starcast.ratings.thresholds.ThresholdTables;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/// Maps measure scores to star levels using per-measure threshold bands.
///
/// # Classification
///
/// ```text
///   score ──► scan bands by ascending level ──► first band with lower ≤ score < upper
///                    │ none
///                    ▼
///             score ≥ lower of highest band? ──yes──► highest level
///                    │ no
///                    ▼
///             ScoreOutOfRangeException
/// ```
///
/// The second step catches scores that sit exactly on the open upper edge of
/// the top band.
///
/// # Distance to next level
///
/// Levels 1–4 report `|lower(next band) - score|`, also for lower-is-better
/// tables where the score sits above the next band. A next band open below
/// gives an infinite gap, which the rating reports as undefined. Level 5
/// reports 0.
public final class ThresholdClassifier {

    private static final Logger logger = LogManager.getLogger(ThresholdClassifier.class);

    private ThresholdClassifier() {
    }

    /// Classifies a score.
    ///
    /// @param measureKey the measure key
    /// @param score the score; NaN means missing
    /// @param tables the threshold tables
    /// @return the rating, undefined for a missing score
    /// @throws UnknownMeasureException if the measure has no table
    /// @throws ScoreOutOfRangeException if no band matches
    public static MeasureRating classify(String measureKey, double score, ThresholdTables tables) {
        ThresholdTable table = tables.table(measureKey);
        if (Double.isNaN(score)) {
            return MeasureRating.undefined();
        }
        int level = level(table, score);
        return MeasureRating.of(level, distanceToNext(table, level, score));
    }

    public static MeasureRating classify(String measureKey, OptionalDouble score, ThresholdTables tables) {
        return classify(measureKey, score.isPresent() ? score.getAsDouble() : Double.NaN, tables);
    }

    /// Returns the star level of a score within one table.
    ///
    /// @throws ScoreOutOfRangeException if no band matches
    public static int level(ThresholdTable table, double score) {
        for (ThresholdBand band : table.bands()) {
            if (band.contains(score)) {
                return band.level();
            }
        }
        ThresholdBand highest = table.highestBand();
        if (score >= highest.lower()) {
            return highest.level();
        }
        throw new ScoreOutOfRangeException(table.measureKey(), score);
    }

    static double distanceToNext(ThresholdTable table, int level, double score) {
        if (level >= ThresholdTable.MAX_LEVEL) {
            return 0.0;
        }
        Optional<ThresholdBand> next = table.band(level + 1);
        if (next.isEmpty()) {
            return Double.NaN;
        }
        // infinite when the next band is open below; MeasureRating reports that as undefined
        return Math.abs(next.get().lower() - score);
    }

    /// Classifies every weighted measure of a row.
    ///
    /// Measures without a weight are skipped. A measure whose lookup or
    /// classification fails is recorded as undefined; the other measures are
    /// unaffected.
    ///
    /// @param scores measure key to score
    /// @param tables the threshold tables
    /// @param weights the measure weights
    /// @return ratings for the weighted measures present in `scores`, in score order
    public static Map<String, MeasureRating> classifyAll(Map<String, OptionalDouble> scores,
                                                         ThresholdTables tables,
                                                         MeasureWeights weights) {
        Map<String, MeasureRating> ratings = new LinkedHashMap<>();
        for (Map.Entry<String, OptionalDouble> entry : scores.entrySet()) {
            String measure = entry.getKey();
            if (!weights.contains(measure)) {
                continue;
            }
            ratings.put(measure, classifyLenient(measure, entry.getValue(), tables));
        }
        return ratings;
    }

    /// Classifies a score, turning lookup and range failures into an undefined rating.
    public static MeasureRating classifyLenient(String measureKey, OptionalDouble score, ThresholdTables tables) {
        try {
            return classify(measureKey, score, tables);
        } catch (UnknownMeasureException | ScoreOutOfRangeException e) {
            logger.debug("Excluding {}: {}", measureKey, e.getMessage());
            return MeasureRating.undefined();
        }
    }
}
