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

import io.starcast.ratings.aggregate.AggregateRating;
import io.starcast.ratings.classify.MeasureRating;
import io.starcast.ratings.classify.ThresholdClassifier;
import io.starcast.ratings.config.ForecastPolicy;
import io.starcast.ratings.improve.ImprovementPath;
import io.starcast.ratings.improve.ImprovementPathOptimizer;
import io.starcast.ratings.improve.NextCutoff;
import io.starcast.ratings.panel.ObservationRow;
import io.starcast.ratings.value.RatingValueTable;
import io.starcast.simulation.NoDataForContractYearException;
import io.starcast.simulation.SimulationEngine;
import io.starcast.simulation.SimulationRequest;
import io.starcast.simulation.SimulationResult;
import io.starcast.simulation.strategy.StrategyAnalyzer;
import io.starcast.simulation.strategy.StrategyReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/// End-to-end rating analysis for one organization and year.
///
/// ```text
///   observed row ─► classify ─► composite ─► next cutoff ─► improvement path
///        │
///        └──────► baseline simulation ─► strategy ranking
/// ```
///
/// The request supplies the fitted models, thresholds and weights; the
/// engine's policy supplies the rating cutoffs and scenario costs.
public final class RatingOutlook {

    private static final Logger logger = LogManager.getLogger(RatingOutlook.class);

    private final SimulationEngine engine;
    private final StrategyAnalyzer analyzer;
    private final ForecastPolicy policy;

    public RatingOutlook(SimulationEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
        this.policy = engine.policy();
        this.analyzer = new StrategyAnalyzer(engine, policy);
    }

    /// Builds the outlook.
    ///
    /// @throws NoDataForContractYearException if the panel has no row for the request's target
    public OutlookReport analyze(SimulationRequest request, RatingValueTable valueTable) {
        Objects.requireNonNull(request, "request cannot be null");
        Objects.requireNonNull(valueTable, "valueTable cannot be null");
        ObservationRow row = request.panel().row(request.organizationId(), request.year())
            .orElseThrow(() -> new NoDataForContractYearException(request.organizationId(), request.year()));

        Map<String, MeasureRating> ratings =
            ThresholdClassifier.classifyAll(row.values(), request.thresholds(), request.weights());
        OptionalDouble current = AggregateRating.aggregate(ratings, request.weights());

        NextCutoff nextCutoff = null;
        ImprovementPath path = null;
        if (current.isPresent()) {
            Optional<NextCutoff> next = ImprovementPathOptimizer.nextCutoff(current.getAsDouble(), policy.ratingBins());
            if (next.isPresent()) {
                nextCutoff = next.get();
                path = ImprovementPathOptimizer.computePath(ratings, request.weights(),
                    current.getAsDouble(), nextCutoff.cutoff());
            }
        } else {
            logger.info("No composite rating for {}/{}: no weighted measure could be rated",
                request.organizationId(), request.year());
        }

        SimulationResult baseline = engine.simulate(request);
        StrategyReport strategies = analyzer.analyze(baseline, request, valueTable);
        return new OutlookReport(request.organizationId(), request.year(), ratings, current,
            nextCutoff, path, baseline, strategies);
    }
}
