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


package io.starcast.ratings.panel;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ObservationPanelTest {

    @Test
    void historiesAreYearOrderedPerOrganization() {
        ObservationPanel panel = ObservationPanel.of(List.of(
            ObservationRow.builder("H1", 2022).value("C: A", 70).build(),
            ObservationRow.builder("H1", 2020).value("C: A", 60).build(),
            ObservationRow.builder("H2", 2021).raw("C: A", "Not enough data available").build(),
            ObservationRow.builder("H1", 2021).raw("C: A", "65%").build()));

        assertThat(panel.history("H1")).extracting(ObservationRow::year).containsExactly(2020, 2021, 2022);
        assertThat(panel.history("H1").get(1).value("C: A")).hasValue(65.0);
        assertThat(panel.row("H2", 2021).orElseThrow().value("C: A")).isEmpty();
        assertThat(panel.countObserved("C: A")).isEqualTo(3);
        assertThat(panel.history("H9")).isEmpty();
    }

    @Test
    void duplicateRowsAreRejected() {
        assertThatThrownBy(() -> ObservationPanel.of(List.of(
            ObservationRow.builder("H1", 2020).build(),
            ObservationRow.builder("H1", 2020).build())))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fingerprintTracksContent() {
        ObservationPanel a = ObservationPanel.of(List.of(ObservationRow.builder("H1", 2020).value("C: A", 60).build()));
        ObservationPanel same = ObservationPanel.of(List.of(ObservationRow.builder("H1", 2020).value("C: A", 60).build()));
        ObservationPanel changed = ObservationPanel.of(List.of(ObservationRow.builder("H1", 2020).value("C: A", 61).build()));

        assertThat(a.fingerprint()).isEqualTo(same.fingerprint());
        assertThat(a.fingerprint()).isNotEqualTo(changed.fingerprint());
    }

    @Test
    void panelsWithTheSameRowsAreEqual() {
        ObservationPanel a = ObservationPanel.of(List.of(ObservationRow.builder("H1", 2020).value("C: A", 60).build()));
        ObservationPanel same = ObservationPanel.of(List.of(ObservationRow.builder("H1", 2020).value("C: A", 60).build()));
        ObservationPanel otherYear = ObservationPanel.of(List.of(ObservationRow.builder("H1", 2021).value("C: A", 60).build()));

        assertThat(a).isEqualTo(same).hasSameHashCodeAs(same);
        assertThat(a).isNotEqualTo(otherYear);
    }

    @Test
    void measureKeysCollapseAndValuesParse() {
        assertThat(MeasureKeys.collapse("C01: Breast Cancer Screening")).isEqualTo("C: Breast Cancer Screening");
        assertThat(MeasureKeys.isPartCMeasure("C: Breast Cancer Screening")).isTrue();
        assertThat(MeasureKeys.parseValue(" 82 % ")).hasValue(82.0);
        assertThat(MeasureKeys.parseValue("Plan too new to be measured")).isEmpty();
    }
}
