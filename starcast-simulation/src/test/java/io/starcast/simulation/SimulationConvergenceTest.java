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


package io.starcast.simulation;

import io.starcast.ratings.thresholds.ThresholdBand;
import io.starcast.ratings.thresholds.ThresholdTable;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static io.starcast.simulation.SimulationFixtures.EYE_EXAM_MEAN;
import static io.starcast.simulation.SimulationFixtures.EYE_EXAM_PRECISION;
import static io.starcast.simulation.SimulationFixtures.SCREENING_MEAN;
import static io.starcast.simulation.SimulationFixtures.SCREENING_PRECISION;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/// Monte Carlo estimates against the closed-form expectation of the fixture.
///
/// The fixture's modeled measures are independent and feature-free, so the
/// expected composite is the weighted mean of each measure's expected star
/// level, computed exactly from the beta CDF at the band edges.
@Tag("accuracy")
class SimulationConvergenceTest {

    private static final int DRAWS = 10_000;

    private static SimulationEngine engine;
    private static SimulationResult reference;

    @BeforeAll
    static void setUp() {
        engine = SimulationEngine.builder().build();
        reference = engine.simulate(SimulationFixtures.request().draws(DRAWS).seed(1L).build());
    }

    @AfterAll
    static void tearDown() {
        engine.close();
    }

    @ParameterizedTest
    @ValueSource(longs = {2L, 99L, 12345L, -7L})
    void expectedRatingIsStableAcrossSeeds(long seed) {
        SimulationResult result = engine.simulate(SimulationFixtures.request().draws(DRAWS).seed(seed).build());

        assertThat(result.expectedRating()).isCloseTo(reference.expectedRating(), within(0.05));
        for (int level = 1; level <= 5; level++) {
            assertThat(result.distribution().probability(level))
                .isCloseTo(reference.distribution().probability(level), within(0.05));
        }
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 42L, 2024L})
    void expectedRatingConvergesToClosedForm(long seed) {
        SimulationResult result = engine.simulate(SimulationFixtures.request().draws(DRAWS).seed(seed).build());

        double screening = expectedLevel(SCREENING_MEAN, SCREENING_PRECISION);
        double eyeExam = expectedLevel(EYE_EXAM_MEAN, EYE_EXAM_PRECISION);
        // complaints is observed at 88, level 4
        double expected = (1.0 * screening + 3.0 * eyeExam + 1.0 * 4) / 5.0;

        assertThat(result.expectedRating()).isCloseTo(expected, within(0.03));
    }

    private static double expectedLevel(double mean, double precision) {
        BetaDistribution beta = new BetaDistribution(mean * precision, (1.0 - mean) * precision);
        ThresholdTable table = SimulationFixtures.table("any");
        double expected = 0.0;
        for (ThresholdBand band : table.bands()) {
            double lo = Math.min(1.0, band.lower() / 100.0);
            double hi = Math.min(1.0, band.upper() / 100.0);
            expected += band.level() * (beta.cumulativeProbability(hi) - beta.cumulativeProbability(lo));
        }
        return expected;
    }
}
