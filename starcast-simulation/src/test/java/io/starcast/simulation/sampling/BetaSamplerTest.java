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


package io.starcast.simulation.sampling;

import io.starcast.models.ConditionalBeta;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.rng.UniformRandomProvider;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class BetaSamplerTest {

    private static final double[] QUANTILES = {0.001, 0.01, 0.1, 0.25, 0.5, 0.75, 0.9, 0.99, 0.999};

    @ParameterizedTest
    @CsvSource({
        "2.0, 5.0",
        "46.8, 13.2",
        "0.5, 0.5",
        "0.3, 4.0",
        "8.0, 0.7",
        "1.0, 1.0"
    })
    void inverseCdfMatchesReferenceQuantiles(double alpha, double beta) {
        BetaSampler sampler = new BetaSampler(alpha, beta);
        BetaDistribution reference = new BetaDistribution(alpha, beta);

        for (double u : QUANTILES) {
            double x = sampler.sample(u);
            assertThat(sampler.cdf(x)).as("cdf at quantile %s", u).isCloseTo(u, within(1e-7));
            assertThat(x).as("quantile %s", u).isCloseTo(reference.inverseCumulativeProbability(u), within(1e-5));
        }
    }

    @Test
    void samplesAreMonotoneInUniformVariate() {
        BetaSampler sampler = new BetaSampler(new ConditionalBeta(0.8, 40.0));
        double previous = -1.0;
        for (int i = 0; i <= 100; i++) {
            double x = sampler.sample(i / 100.0);
            assertThat(x).isGreaterThanOrEqualTo(previous);
            previous = x;
        }
    }

    @Test
    void endpointVariatesAreClampedIntoUnitInterval() {
        BetaSampler sampler = new BetaSampler(0.5, 0.5);

        assertThat(sampler.sample(0.0)).isBetween(0.0, 1.0);
        assertThat(sampler.sample(1.0)).isBetween(0.0, 1.0);
        assertThat(sampler.sample(0.0)).isLessThan(sampler.sample(1.0));
    }

    @Test
    void sampleMeanMatchesConditionalMean() {
        ConditionalBeta conditional = new ConditionalBeta(0.72, 25.0);
        BetaSampler sampler = new BetaSampler(conditional);
        UniformRandomProvider rng = RandomStreams.forDraw(5L, 0L);

        int n = 20_000;
        double sum = 0.0;
        double squares = 0.0;
        for (int i = 0; i < n; i++) {
            double x = sampler.sample(rng.nextDouble());
            sum += x;
            squares += x * x;
        }
        double mean = sum / n;
        double variance = squares / n - mean * mean;

        assertThat(mean).isCloseTo(conditional.mean(), within(0.005));
        assertThat(variance).isCloseTo(conditional.variance(), within(0.001));
    }

    @Test
    void shapesFromConditionalBeta() {
        BetaSampler sampler = new BetaSampler(new ConditionalBeta(0.25, 8.0));

        assertThat(sampler.alpha()).isCloseTo(2.0, within(1e-12));
        assertThat(sampler.beta()).isCloseTo(6.0, within(1e-12));
    }

    @Test
    void rejectsInvalidShapes() {
        assertThatThrownBy(() -> new BetaSampler(0.0, 1.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BetaSampler(1.0, Double.NaN)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new BetaSampler(Double.POSITIVE_INFINITY, 1.0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
