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

import io.starcast.models.DistributionModel;
import io.starcast.models.beta.BetaRegressionModel;
import io.starcast.ratings.aggregate.MeasureWeights;
import io.starcast.ratings.panel.ObservationPanel;
import io.starcast.ratings.panel.ObservationRow;
import io.starcast.ratings.thresholds.ThresholdBand;
import io.starcast.ratings.thresholds.ThresholdTable;
import io.starcast.ratings.thresholds.ThresholdTables;
import io.starcast.ratings.value.RatingValueTable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Shared panel, thresholds, weights and models for simulation tests.
public final class SimulationFixtures {

    public static final String SCREENING = "C: Breast Cancer Screening";
    public static final String EYE_EXAM = "C: Diabetes Care - Eye Exam";
    public static final String COMPLAINTS = "C: Complaints about the Health Plan";
    public static final String ORG = "H1234";
    public static final String EMPTY_ORG = "H5555";
    public static final int YEAR = 2024;

    public static final double SCREENING_MEAN = 0.78;
    public static final double SCREENING_PRECISION = 60.0;
    public static final double EYE_EXAM_MEAN = 0.84;
    public static final double EYE_EXAM_PRECISION = 80.0;

    private SimulationFixtures() {
    }

    public static ThresholdTable table(String measureKey) {
        return ThresholdTable.of(measureKey,
            ThresholdBand.of(0, 55, 1),
            ThresholdBand.of(55, 70, 2),
            ThresholdBand.of(70, 85, 3),
            ThresholdBand.of(85, 95, 4),
            ThresholdBand.of(95, 101, 5));
    }

    public static ThresholdTables tables() {
        return ThresholdTables.of(table(SCREENING), table(EYE_EXAM), table(COMPLAINTS));
    }

    public static MeasureWeights weights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put(SCREENING, 1.0);
        weights.put(EYE_EXAM, 3.0);
        weights.put(COMPLAINTS, 1.0);
        return MeasureWeights.of(weights);
    }

    /// Observed 2024 row: screening 74 (level 3), eye exam 81 (level 3), complaints 88 (level 4).
    public static ObservationPanel panel() {
        return ObservationPanel.of(List.of(
            ObservationRow.builder(ORG, 2021).value(SCREENING, 70).value(EYE_EXAM, 77).value(COMPLAINTS, 85).build(),
            ObservationRow.builder(ORG, 2022).value(SCREENING, 72).value(EYE_EXAM, 79).missing(COMPLAINTS).build(),
            ObservationRow.builder(ORG, 2023).value(SCREENING, 73).value(EYE_EXAM, 80).value(COMPLAINTS, 87).build(),
            ObservationRow.builder(ORG, YEAR).value(SCREENING, 74).value(EYE_EXAM, 81).value(COMPLAINTS, 88).build(),
            ObservationRow.builder(EMPTY_ORG, YEAR).missing(SCREENING).missing(EYE_EXAM).missing(COMPLAINTS).build()));
    }

    /// A model without features: the same beta distribution for every row.
    public static DistributionModel interceptModel(String measureKey, double mean, double precision) {
        return new BetaRegressionModel(measureKey, List.of(), new double[0], new double[0],
            new double[]{Math.log(mean / (1.0 - mean))}, new double[]{Math.log(precision)}, 100, 0.0);
    }

    /// Screening and eye exam are modeled; complaints is not.
    public static Map<String, DistributionModel> models() {
        Map<String, DistributionModel> models = new LinkedHashMap<>();
        models.put(SCREENING, interceptModel(SCREENING, SCREENING_MEAN, SCREENING_PRECISION));
        models.put(EYE_EXAM, interceptModel(EYE_EXAM, EYE_EXAM_MEAN, EYE_EXAM_PRECISION));
        return models;
    }

    public static RatingValueTable valueTable() {
        return RatingValueTable.of(Map.of(3, 1_000_000.0, 4, 2_500_000.0, 5, 4_000_000.0));
    }

    public static SimulationRequest.Builder request() {
        return SimulationRequest.builder()
            .panel(panel())
            .target(ORG, YEAR)
            .models(models())
            .thresholds(tables())
            .weights(weights())
            .draws(2000)
            .seed(7L);
    }
}
