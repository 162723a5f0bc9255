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


package io.starcast.models;

import io.starcast.models.beta.BetaRegressionModel;
import io.starcast.ratings.panel.ObservationPanel;
import io.starcast.ratings.panel.ObservationRow;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class ModelCacheTest {

    private static final String MEASURE = "C: A";

    private final AtomicInteger fits = new AtomicInteger();

    private final ModelFitter countingFitter = (panel, measures, features) -> {
        fits.incrementAndGet();
        DistributionModel model = new BetaRegressionModel(MEASURE, List.of(), new double[0], new double[0],
            new double[] {0.0}, new double[] {2.0}, panel.size(), 0.0);
        return FitBatchResult.of(Map.of(MEASURE, model));
    };

    private static ObservationPanel panel(double value) {
        return ObservationPanel.of(List.of(ObservationRow.builder("H1", 2020).value(MEASURE, value).build()));
    }

    @Test
    void samePanelIsFittedOnce() {
        ModelCache cache = new ModelCache(countingFitter);

        FitBatchResult first = cache.getOrFit(panel(60), List.of(MEASURE), List.of());
        FitBatchResult second = cache.getOrFit(panel(60), List.of(MEASURE), List.of());

        assertThat(second).isSameAs(first);
        assertThat(fits.get()).isEqualTo(1);
        assertThat(cache.hits()).isEqualTo(1);
        assertThat(cache.misses()).isEqualTo(1);
    }

    @Test
    void changedPanelOrRequestRefits() {
        ModelCache cache = new ModelCache(countingFitter);

        cache.getOrFit(panel(60), List.of(MEASURE), List.of());
        cache.getOrFit(panel(61), List.of(MEASURE), List.of());
        cache.getOrFit(panel(60), List.of(MEASURE), List.of(MEASURE + "_lag1"));

        assertThat(fits.get()).isEqualTo(3);
        assertThat(cache.size()).isEqualTo(2);

        cache.invalidate();
        cache.getOrFit(panel(60), List.of(MEASURE), List.of());
        assertThat(fits.get()).isEqualTo(4);
    }

    @Test
    void newerPanelReplacesTheOlderEntry() {
        ModelCache cache = new ModelCache(countingFitter);

        cache.getOrFit(panel(60), List.of(MEASURE), List.of());
        cache.getOrFit(panel(61), List.of(MEASURE), List.of());
        cache.getOrFit(panel(60), List.of(MEASURE), List.of());

        assertThat(fits.get()).isEqualTo(3);
        assertThat(cache.size()).isEqualTo(1);
        assertThat(cache.hits()).isZero();
    }

    @Test
    void collidingFingerprintsDoNotShareModels() {
        ModelCache cache = new ModelCache(countingFitter, panel -> 42L);

        FitBatchResult first = cache.getOrFit(panel(60), List.of(MEASURE), List.of());
        FitBatchResult other = cache.getOrFit(panel(75), List.of(MEASURE), List.of());
        FitBatchResult again = cache.getOrFit(panel(75), List.of(MEASURE), List.of());

        assertThat(other).isNotSameAs(first);
        assertThat(again).isSameAs(other);
        assertThat(fits.get()).isEqualTo(2);
        assertThat(cache.hits()).isEqualTo(1);
    }
}
