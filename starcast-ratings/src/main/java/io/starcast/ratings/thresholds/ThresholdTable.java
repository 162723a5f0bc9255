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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable star-level bands for one measure.
 *
 * <p>Bands are held in ascending level order. Construction rejects tables that
 * could classify a score two ways:
 * <ul>
 *   <li>empty band lists and duplicate levels</li>
 *   <li>overlapping intervals</li>
 *   <li>levels that are not monotonic in score (either direction is allowed,
 *       since some measures rate lower scores higher)</li>
 * </ul>
 *
 * <p>Gaps are legal at construction; {@link #isContiguous()} and
 * {@link #coversFullDomain()} report them. Degenerate bands such as
 * {@code [100, 100)} are kept but ignored by the ordering checks.
 */
public final class ThresholdTable {

    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 5;

    private final String measureKey;
    private final List<ThresholdBand> bands;
    private final List<ThresholdBand> byScore;

    public ThresholdTable(String measureKey, List<ThresholdBand> bands) {
        this.measureKey = Objects.requireNonNull(measureKey, "measureKey cannot be null");
        Objects.requireNonNull(bands, "bands cannot be null");
        if (bands.isEmpty()) {
            throw new IllegalArgumentException("No bands for measure " + measureKey);
        }

        List<ThresholdBand> sorted = new ArrayList<>(bands);
        sorted.sort(Comparator.comparingInt(ThresholdBand::level));
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).level() == sorted.get(i - 1).level()) {
                throw new IllegalArgumentException(
                    "Duplicate level " + sorted.get(i).level() + " for measure " + measureKey);
            }
        }

        List<ThresholdBand> scoreOrder = new ArrayList<>();
        for (ThresholdBand band : sorted) {
            if (!band.isEmpty()) {
                scoreOrder.add(band);
            }
        }
        scoreOrder.sort(Comparator.comparingDouble(ThresholdBand::lower));
        int direction = 0;
        for (int i = 1; i < scoreOrder.size(); i++) {
            ThresholdBand previous = scoreOrder.get(i - 1);
            ThresholdBand current = scoreOrder.get(i);
            if (previous.upper() > current.lower()) {
                throw new IllegalArgumentException(
                    "Overlapping bands " + previous + " and " + current + " for measure " + measureKey);
            }
            int step = Integer.signum(current.level() - previous.level());
            if (direction == 0) {
                direction = step;
            } else if (step != direction) {
                throw new IllegalArgumentException("Levels are not monotonic in score for measure " + measureKey);
            }
        }

        this.bands = List.copyOf(sorted);
        this.byScore = List.copyOf(scoreOrder);
    }

    public static ThresholdTable of(String measureKey, ThresholdBand... bands) {
        return new ThresholdTable(measureKey, List.of(bands));
    }

    public String measureKey() {
        return measureKey;
    }

    /// Bands in ascending level order.
    public List<ThresholdBand> bands() {
        return bands;
    }

    public Optional<ThresholdBand> band(int level) {
        for (ThresholdBand band : bands) {
            if (band.level() == level) {
                return Optional.of(band);
            }
        }
        return Optional.empty();
    }

    public ThresholdBand highestBand() {
        return bands.get(bands.size() - 1);
    }

    public ThresholdBand lowestBand() {
        return bands.get(0);
    }

    /// True when higher levels sit at higher scores.
    public boolean isAscending() {
        if (byScore.size() < 2) {
            return true;
        }
        return byScore.get(byScore.size() - 1).level() > byScore.get(0).level();
    }

    /// True when every non-empty band ends exactly where the next one starts.
    public boolean isContiguous() {
        for (int i = 1; i < byScore.size(); i++) {
            if (byScore.get(i - 1).upper() != byScore.get(i).lower()) {
                return false;
            }
        }
        return true;
    }

    /// True when the bands partition the whole real line.
    public boolean coversFullDomain() {
        if (byScore.isEmpty() || !isContiguous()) {
            return false;
        }
        return byScore.get(0).lower() == Double.NEGATIVE_INFINITY
            && byScore.get(byScore.size() - 1).upper() == Double.POSITIVE_INFINITY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ThresholdTable)) return false;
        ThresholdTable that = (ThresholdTable) o;
        return measureKey.equals(that.measureKey) && bands.equals(that.bands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(measureKey, bands);
    }

    @Override
    public String toString() {
        return "ThresholdTable[" + measureKey + ", " + bands + "]";
    }
}
