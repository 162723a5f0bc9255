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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Cut-point cells as they appear in the published star-ratings sheets.
@Tag("unit")
class CutPointParserTest {

    @Test
    void parsesEveryCellShape() {
        assertThat(CutPointParser.parseBand("< 53 %", 1))
            .contains(new ThresholdBand(Double.NEGATIVE_INFINITY, 53, 1));
        assertThat(CutPointParser.parseBand(">= 53 % to < 67 %", 2))
            .contains(new ThresholdBand(53, 67, 2));
        assertThat(CutPointParser.parseBand(">= -0.179809 to < 0", 3))
            .contains(new ThresholdBand(-0.179809, 0, 3));
        assertThat(CutPointParser.parseBand(">= 85 %", 5))
            .contains(new ThresholdBand(85, Double.POSITIVE_INFINITY, 5));
        assertThat(CutPointParser.parseBand("> -0.5", 4))
            .contains(new ThresholdBand(-0.5, Double.POSITIVE_INFINITY, 4));
        assertThat(CutPointParser.parseBand("100 %", 5))
            .contains(new ThresholdBand(100, 100, 5));
    }

    @Test
    void blankCellsAreEmpty() {
        assertThat(CutPointParser.parseBand("  ", 1)).isEmpty();
        assertThat(CutPointParser.parseBand(null, 1)).isEmpty();
    }

    @Test
    void unrecognizedCellIsRejected() {
        assertThatThrownBy(() -> CutPointParser.parseBand("Not applicable", 1))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Not applicable");
    }

    @Test
    void parsesStarLabels() {
        assertThat(CutPointParser.parseLevel("1star")).contains(1);
        assertThat(CutPointParser.parseLevel("4 Stars")).contains(4);
        assertThat(CutPointParser.parseLevel("6star")).isEmpty();
        assertThat(CutPointParser.parseLevel("Measure ID")).isEmpty();
    }

    @Test
    void badCellsAreSkippedWithoutLosingTheRestOfTheSheet() {
        Map<String, String> oneStar = new LinkedHashMap<>();
        oneStar.put("C: A", "< 50");
        oneStar.put("C: B", "garbage");
        Map<String, String> twoStar = new LinkedHashMap<>();
        twoStar.put("C: A", ">= 50");
        twoStar.put("C: B", ">= 10");

        ThresholdTables tables = CutPointParser.parse(List.of(
            new CutPointRow("Measure", Map.of("C: A", "header text")),
            new CutPointRow("1star", oneStar),
            new CutPointRow("2star", twoStar)));

        assertThat(tables.table("C: A").bands()).hasSize(2);
        assertThat(tables.table("C: B").bands())
            .containsExactly(new ThresholdBand(10, Double.POSITIVE_INFINITY, 2));
    }

    @Test
    void measuresWithOverlappingBandsAreDropped() {
        ThresholdTables tables = CutPointParser.parse(List.of(
            new CutPointRow("1star", Map.of("C: A", "< 60", "C: B", "< 50")),
            new CutPointRow("2star", Map.of("C: A", ">= 50", "C: B", ">= 50"))));

        assertThat(tables.contains("C: A")).isFalse();
        assertThat(tables.contains("C: B")).isTrue();
    }
}
