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
import io.starcast.models.FitBatchResult;
import io.starcast.ratings.aggregate.MeasureWeights;
import io.starcast.ratings.config.ForecastPolicy;
import io.starcast.ratings.panel.ObservationPanel;
import io.starcast.ratings.thresholds.ThresholdTables;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Everything one simulation run needs.
///
/// Requests are immutable. [#withAdjustments(Map)] and [#toBuilder()]
/// derive variants, which is how baseline and improved runs share a seed.
///
/// ## Adjustments
///
/// An adjustment is added to a measure's sampled value before clipping to
/// the measure domain. It only applies to modeled measures; observed
/// fallback values are never adjusted.
public final class SimulationRequest {

    private final ObservationPanel panel;
    private final String organizationId;
    private final int year;
    private final Map<String, DistributionModel> models;
    private final ThresholdTables thresholds;
    private final MeasureWeights weights;
    private final int draws;
    private final long seed;
    private final Map<String, Double> adjustments;
    private final CancellationToken cancellationToken;
    private final Duration timeBudget;

    private SimulationRequest(Builder builder) {
        this.panel = Objects.requireNonNull(builder.panel, "panel cannot be null");
        this.organizationId = Objects.requireNonNull(builder.organizationId, "organizationId cannot be null");
        this.year = builder.year;
        this.models = Collections.unmodifiableMap(new LinkedHashMap<>(builder.models));
        this.thresholds = Objects.requireNonNull(builder.thresholds, "thresholds cannot be null");
        this.weights = Objects.requireNonNull(builder.weights, "weights cannot be null");
        this.draws = builder.draws != null ? builder.draws : builder.policy.defaultDraws();
        this.seed = builder.seed != null ? builder.seed : builder.policy.seed();
        this.adjustments = Collections.unmodifiableMap(new LinkedHashMap<>(builder.adjustments));
        this.cancellationToken = builder.cancellationToken;
        this.timeBudget = builder.timeBudget;
        if (draws <= 0) {
            throw new IllegalArgumentException("Draw count must be positive, got: " + draws);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public ObservationPanel panel() {
        return panel;
    }

    public String organizationId() {
        return organizationId;
    }

    public int year() {
        return year;
    }

    public Map<String, DistributionModel> models() {
        return models;
    }

    public ThresholdTables thresholds() {
        return thresholds;
    }

    public MeasureWeights weights() {
        return weights;
    }

    public int draws() {
        return draws;
    }

    public long seed() {
        return seed;
    }

    public Map<String, Double> adjustments() {
        return adjustments;
    }

    public double adjustment(String measureKey) {
        return adjustments.getOrDefault(measureKey, 0.0);
    }

    public Optional<CancellationToken> cancellationToken() {
        return Optional.ofNullable(cancellationToken);
    }

    public Optional<Duration> timeBudget() {
        return Optional.ofNullable(timeBudget);
    }

    /// Same request with the adjustments replaced.
    public SimulationRequest withAdjustments(Map<String, Double> adjustments) {
        return toBuilder().adjustments(adjustments).build();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.panel = panel;
        builder.organizationId = organizationId;
        builder.year = year;
        builder.models.putAll(models);
        builder.thresholds = thresholds;
        builder.weights = weights;
        builder.draws = draws;
        builder.seed = seed;
        builder.adjustments.putAll(adjustments);
        builder.cancellationToken = cancellationToken;
        builder.timeBudget = timeBudget;
        return builder;
    }

    @Override
    public String toString() {
        return "SimulationRequest[" + organizationId + "/" + year + ", draws=" + draws + ", seed=" + seed
            + ", models=" + models.size() + ", adjustments=" + adjustments + "]";
    }

    /**
     * Builder for simulation requests. Draw count and seed default to the
     * policy's values when not set explicitly.
     */
    public static final class Builder {
        private ForecastPolicy policy = ForecastPolicy.defaults();
        private ObservationPanel panel;
        private String organizationId;
        private int year;
        private final Map<String, DistributionModel> models = new LinkedHashMap<>();
        private ThresholdTables thresholds;
        private MeasureWeights weights;
        private Integer draws;
        private Long seed;
        private final Map<String, Double> adjustments = new LinkedHashMap<>();
        private CancellationToken cancellationToken;
        private Duration timeBudget;

        private Builder() {}

        /// Supplies the default draw count and seed.
        public Builder policy(ForecastPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy cannot be null");
            return this;
        }

        public Builder panel(ObservationPanel panel) {
            this.panel = panel;
            return this;
        }

        public Builder target(String organizationId, int year) {
            this.organizationId = organizationId;
            this.year = year;
            return this;
        }

        public Builder models(Map<String, DistributionModel> models) {
            this.models.clear();
            this.models.putAll(models);
            return this;
        }

        public Builder models(FitBatchResult fitted) {
            return models(fitted.models());
        }

        public Builder thresholds(ThresholdTables thresholds) {
            this.thresholds = thresholds;
            return this;
        }

        public Builder weights(MeasureWeights weights) {
            this.weights = weights;
            return this;
        }

        public Builder draws(int draws) {
            this.draws = draws;
            return this;
        }

        public Builder seed(long seed) {
            this.seed = seed;
            return this;
        }

        public Builder adjustments(Map<String, Double> adjustments) {
            this.adjustments.clear();
            adjustments.forEach(this::adjustment);
            return this;
        }

        public Builder adjustment(String measureKey, double points) {
            Objects.requireNonNull(measureKey, "measureKey cannot be null");
            if (!Double.isFinite(points)) {
                throw new IllegalArgumentException("Adjustment for " + measureKey + " must be finite, got: " + points);
            }
            this.adjustments.put(measureKey, points);
            return this;
        }

        public Builder cancellationToken(CancellationToken token) {
            this.cancellationToken = token;
            return this;
        }

        /// Wall-clock budget after which no new draws start.
        public Builder timeBudget(Duration budget) {
            if (budget != null && (budget.isNegative() || budget.isZero())) {
                throw new IllegalArgumentException("Time budget must be positive, got: " + budget);
            }
            this.timeBudget = budget;
            return this;
        }

        public SimulationRequest build() {
            return new SimulationRequest(this);
        }
    }
}
