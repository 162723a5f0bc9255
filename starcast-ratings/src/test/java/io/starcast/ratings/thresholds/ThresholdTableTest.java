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

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ThresholdTableTest {

    @Test
    void bandsAreOrderedByLevelRegardlessOfInputOrder() {
        ThresholdTable table = ThresholdTable.of("C: X",
            ThresholdBand.of(70, Double.POSITIVE_INFINITY, 3),
            ThresholdBand.of(Double.NEGATIVE_INFINITY, 50, 1),
            ThresholdBand.of(50, 70, 2));

        assertThat(table.bands()).extracting(ThresholdBand::level).containsExactly(1, 2, 3);
        assertThat(table.highestBand().level()).isEqualTo(3);
        assertThat(table.isAscending()).isTrue();
        assertThat(table.isContiguous()).isTrue();
        assertThat(table.coversFullDomain()).isTrue();
    }

    @Test
    void gapsAreAllowedButReported() {
        ThresholdTable table = ThresholdTable.of("C: X",
            ThresholdBand.of(0, 50, 1),
            ThresholdBand.of(60, 100, 2));

        assertThat(table.isContiguous()).isFalse();
        assertThat(table.coversFullDomain()).isFalse();
    }

    @Test
    void rejectsOverlappingBands() {
        assertThatThrownBy(() -> ThresholdTable.of("C: X",
            ThresholdBand.of(0, 60, 1),
            ThresholdBand.of(50, 100, 2)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Overlapping");
    }

    @Test
    void rejectsDuplicateLevels() {
        assertThatThrownBy(() -> ThresholdTable.of("C: X",
            ThresholdBand.of(0, 50, 2),
            ThresholdBand.of(50, 100, 2)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Duplicate level");
    }

    @Test
    void rejectsLevelsThatAreNotMonotonicInScore() {
        assertThatThrownBy(() -> ThresholdTable.of("C: X",
            ThresholdBand.of(0, 30, 1),
            ThresholdBand.of(30, 60, 3),
            ThresholdBand.of(60, 100, 2)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("monotonic");
    }

    @Test
    void rejectsEmptyBandList() {
        assertThatThrownBy(() -> new ThresholdTable("C: X", List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void bandRejectsInvertedBoundsAndBadLevels() {
        assertThatThrownBy(() -> ThresholdBand.of(10, 5, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ThresholdBand.of(0, 5, 6)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ThresholdBand.of(Double.NaN, 5, 1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void collapsedKeysMatchRowConvention() {
        ThresholdTables tables = ThresholdTables.of(
            ThresholdTable.of("C01: Breast Cancer Screening", ThresholdBand.of(0, 100, 1)));

        ThresholdTables collapsed = tables.collapseKeys();

        assertThat(collapsed.measureKeys()).containsExactly("C: Breast Cancer Screening");
        assertThat(collapsed.table("C: Breast Cancer Screening").bands()).hasSize(1);
    }

    @Test
    void parsedSheetsCoverTheWholeRealLine() {
        ThresholdTables tables = CutPointParser.parse(List.of(
            new CutPointRow("1star", Map.of("C: X", "< 53 %")),
            new CutPointRow("2star", Map.of("C: X", ">= 53 % to < 67 %")),
            new CutPointRow("3star", Map.of("C: X", ">= 67 % to < 75 %")),
            new CutPointRow("4star", Map.of("C: X", ">= 75 % to < 85 %")),
            new CutPointRow("5star", Map.of("C: X", ">= 85 %"))));

        assertThat(tables.table("C: X").coversFullDomain()).isTrue();
    }
}
