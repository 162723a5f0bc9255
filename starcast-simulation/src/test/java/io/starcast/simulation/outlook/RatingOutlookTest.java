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


package io.starcast.simulation.outlook;

import io.starcast.ratings.improve.ImprovementPath;
import io.starcast.simulation.NoDataForContractYearException;
import io.starcast.simulation.SimulationEngine;
import io.starcast.simulation.SimulationFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static io.starcast.simulation.SimulationFixtures.COMPLAINTS;
import static io.starcast.simulation.SimulationFixtures.EMPTY_ORG;
import static io.starcast.simulation.SimulationFixtures.EYE_EXAM;
import static io.starcast.simulation.SimulationFixtures.SCREENING;
import static io.starcast.simulation.SimulationFixtures.YEAR;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class RatingOutlookTest {

    private SimulationEngine engine;
    private RatingOutlook outlook;

    @BeforeEach
    void setUp() {
        engine = SimulationEngine.builder().parallelism(2).build();
        outlook = new RatingOutlook(engine);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    void reportsCurrentStandingAndPathToNextCutoff() {
        OutlookReport report = outlook.analyze(SimulationFixtures.request().draws(500).build(),
            SimulationFixtures.valueTable());

        assertThat(report.currentRatings().get(SCREENING).level()).hasValue(3);
        assertThat(report.currentRatings().get(SCREENING).distanceToNext()).hasValue(11.0);
        assertThat(report.currentRatings().get(EYE_EXAM).level()).hasValue(3);
        assertThat(report.currentRatings().get(COMPLAINTS).level()).hasValue(4);
        // (3*1 + 3*3 + 4*1) / 5
        assertThat(report.currentRating().getAsDouble()).isCloseTo(3.2, within(1e-12));
        assertThat(report.nextCutoff()).hasValueSatisfying(next ->
            assertThat(next.cutoff()).isEqualTo(3.25));
        assertThat(report.pointsNeeded()).isCloseTo(0.05, within(1e-9));

        ImprovementPath path = report.improvementPath().orElseThrow();
        assertThat(path.opportunities().get(0).measureKey()).isEqualTo(EYE_EXAM);
        assertThat(path.stepsToTarget()).isEqualTo(1);
        assertThat(path.targetUnreachable()).isFalse();
    }

    @Test
    void includesBaselineForecastAndStrategyRanking() {
        OutlookReport report = outlook.analyze(SimulationFixtures.request().draws(400).build(),
            SimulationFixtures.valueTable());

        assertThat(report.baseline().completedDraws()).isEqualTo(400);
        assertThat(report.baseline().distribution().sum()).isCloseTo(1.0, within(1e-12));
        assertThat(report.strategies().baseline()).isSameAs(report.baseline());
        assertThat(report.strategies().results()).hasSize(3);
    }

    @Test
    void undefinedCurrentRatingHasNoPath() {
        OutlookReport report = outlook.analyze(SimulationFixtures.request().target(EMPTY_ORG, YEAR).draws(200).build(),
            SimulationFixtures.valueTable());

        assertThat(report.currentRating()).isEmpty();
        assertThat(report.nextCutoff()).isEmpty();
        assertThat(report.improvementPath()).isEmpty();
        assertThat(report.pointsNeeded()).isZero();
        // modeled measures still produce a forecast
        assertThat(report.baseline().definedDraws()).isEqualTo(200);
    }

    @Test
    void missingRowIsReported() {
        assertThatThrownBy(() -> outlook.analyze(SimulationFixtures.request().target("H0000", YEAR).build(),
            SimulationFixtures.valueTable()))
            .isInstanceOf(NoDataForContractYearException.class);
    }
}
