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


package io.starcast.models.beta;

import io.starcast.models.ConditionalBeta;
import io.starcast.models.DistributionModel;
import io.starcast.models.FitBatchResult;
import io.starcast.models.MalformedFeatureException;
import io.starcast.models.ModelFitException;
import io.starcast.ratings.config.ForecastPolicy;
import io.starcast.ratings.panel.ObservationPanel;
import io.starcast.ratings.panel.ObservationRow;
import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.random.Well19937c;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class BetaRegressionFitterTest {

    private static final String SCREENING = "C: Breast Cancer Screening";
    private static final String SPARSE = "C: Sparse Measure";
    private static final String BROKEN = "C: Broken Measure";

    private BetaRegressionFitter fitter;

    @BeforeEach
    void setUp() {
        fitter = BetaRegressionFitter.builder()
            .policy(ForecastPolicy.builder().seed(3).build())
            .parallelism(2)
            .build();
    }

    @AfterEach
    void tearDown() {
        fitter.close();
    }

    @Test
    void recoversMeanAndPrecisionOfStationarySeries() {
        BetaDistribution source = new BetaDistribution(new Well19937c(17), 21.0, 9.0);
        List<ObservationRow> rows = new ArrayList<>();
        for (int org = 0; org < 40; org++) {
            for (int year = 2018; year < 2024; year++) {
                rows.add(ObservationRow.builder("H" + org, year).value(SCREENING, 100.0 * source.sample()).build());
            }
        }

        FitBatchResult result = fitter.fitModels(ObservationPanel.of(rows), List.of(SCREENING), List.of());

        assertThat(result.failures()).isEmpty();
        BetaRegressionModel model = (BetaRegressionModel) result.model(SCREENING).orElseThrow();
        assertThat(model.observationCount()).isEqualTo(240);
        assertThat(model.featureNames()).hasSize(6);
        ConditionalBeta atCenter = model.conditional(model.center());
        assertThat(atCenter.mean()).isCloseTo(0.7, within(0.03));
        assertThat(Math.log(atCenter.precision())).isCloseTo(Math.log(30.0), within(0.5));
    }

    @Test
    void meanFollowsThePredictor() {
        Well19937c random = new Well19937c(5);
        int n = 300;
        double[][] features = new double[n][1];
        double[] values = new double[n];
        for (int i = 0; i < n; i++) {
            double lag = 30.0 + 60.0 * random.nextDouble();
            double mu = 0.1 + 0.8 * lag / 100.0;
            double phi = 60.0;
            features[i][0] = lag;
            values[i] = 100.0 * new BetaDistribution(random, mu * phi, (1 - mu) * phi).sample();
        }

        BetaRegressionModel model = fitter.fit(SCREENING, List.of(SCREENING + "_lag1"), features, values);

        double low = model.conditional(new double[] {40.0}).mean();
        double high = model.conditional(new double[] {85.0}).mean();
        assertThat(low).isCloseTo(0.42, within(0.06));
        assertThat(high).isCloseTo(0.78, within(0.06));
        assertThat(model.meanCoefficients()[1]).isPositive();
    }

    @Test
    void batchSeparatesFittedSkippedAndFailedMeasures() {
        BetaDistribution source = new BetaDistribution(new Well19937c(23), 8.0, 4.0);
        List<ObservationRow> rows = new ArrayList<>();
        for (int org = 0; org < 10; org++) {
            for (int year = 2020; year < 2024; year++) {
                ObservationRow.Builder row = ObservationRow.builder("H" + org, year)
                    .value(SCREENING, 100.0 * source.sample())
                    .value(BROKEN, org == 3 && year == 2021 ? 140.0 : 100.0 * source.sample());
                if (org < 2) {
                    row.value(SPARSE, 100.0 * source.sample());
                }
                rows.add(row.build());
            }
        }

        FitBatchResult result = fitter.fitModels(ObservationPanel.of(rows), List.of(SCREENING, SPARSE, BROKEN), List.of());

        assertThat(result.models()).containsOnlyKeys(SCREENING);
        assertThat(result.skipped()).singleElement().satisfies(skip -> {
            assertThat(skip.measureKey()).isEqualTo(SPARSE);
            assertThat(skip.observations()).isEqualTo(8);
            assertThat(skip.required()).isEqualTo(10);
        });
        assertThat(result.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.measureKey()).isEqualTo(BROKEN);
            assertThat(failure.cause()).isInstanceOf(ModelFitException.class);
        });
    }

    @Test
    void unresolvableFeatureKeysFailEachMeasure() {
        List<ObservationRow> rows = new ArrayList<>();
        for (int year = 2000; year < 2015; year++) {
            rows.add(ObservationRow.builder("H1", year).value(SCREENING, 50.0 + year % 7).build());
        }

        FitBatchResult result = fitter.fitModels(ObservationPanel.of(rows), List.of(SCREENING), List.of("not a feature"));

        assertThat(result.models()).isEmpty();
        assertThat(result.failures()).singleElement()
            .satisfies(failure -> assertThat(failure.cause()).isInstanceOf(MalformedFeatureException.class));
    }

    @Test
    void conditionalRejectsVectorsOfTheWrongShape() {
        DistributionModel model = new BetaRegressionModel(SCREENING, List.of(SCREENING + "_lag1"),
            new double[] {50.0}, new double[] {10.0}, new double[] {0.5, 0.2}, new double[] {3.0, 0.0}, 20, -4.0);

        assertThatThrownBy(() -> model.conditional(new double[] {1.0, 2.0}))
            .isInstanceOf(MalformedFeatureException.class);
        assertThatThrownBy(() -> model.conditional(new double[] {Double.NaN}))
            .isInstanceOf(MalformedFeatureException.class)
            .hasMessageContaining("_lag1");
        assertThat(model.conditional(new double[] {50.0}).mean())
            .isCloseTo(1.0 / (1.0 + Math.exp(-0.5)), within(1e-12));
    }

    @Test
    void fitRejectsTooFewObservations() {
        assertThatThrownBy(() -> fitter.fit(SCREENING, List.of(), new double[3][0], new double[] {10, 20, 30}))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
