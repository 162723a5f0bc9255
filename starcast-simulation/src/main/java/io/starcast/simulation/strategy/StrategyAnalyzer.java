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


package io.starcast.simulation.strategy;

import io.starcast.ratings.aggregate.MeasureWeights;
import io.starcast.ratings.config.ForecastPolicy;
import io.starcast.ratings.value.RatingValueTable;
import io.starcast.simulation.SimulationEngine;
import io.starcast.simulation.SimulationRequest;
import io.starcast.simulation.SimulationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ranks improvement scenarios by return on investment.
 *
 * <p>The scenarios are:
 * <ul>
 *   <li>each modeled measure improved on its own by the policy's improvement points;</li>
 *   <li>every modeled measure whose weight reaches the policy's high-weight
 *       threshold improved together, when there is at least one.</li>
 * </ul>
 *
 * <p>A scenario costs its total improvement points times the policy's cost
 * per point. All scenarios are compared against one shared baseline run.
 * A scenario that fails is recorded in the report and the others still run.
 */
public final class StrategyAnalyzer {

    private static final Logger logger = LogManager.getLogger(StrategyAnalyzer.class);

    static final String HIGH_WEIGHT_SCENARIO = "Improve all high-weight measures";

    private final SimulationEngine engine;
    private final ImprovementValuator valuator;
    private final ForecastPolicy policy;

    /// Creates an analyzer using the engine's policy.
    public StrategyAnalyzer(SimulationEngine engine) {
        this(engine, engine.policy());
    }

    public StrategyAnalyzer(SimulationEngine engine, ForecastPolicy policy) {
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
        this.policy = Objects.requireNonNull(policy, "policy cannot be null");
        this.valuator = new ImprovementValuator(engine);
    }

    /// Builds the scenarios for a set of modeled measures.
    ///
    /// @param modeledMeasures measures with a fitted model, in scenario order
    /// @param weights measure weights, used to pick the high-weight measures
    public List<Scenario> scenarios(Set<String> modeledMeasures, MeasureWeights weights) {
        double points = policy.improvementPoints();
        List<Scenario> scenarios = new ArrayList<>();
        for (String measure : modeledMeasures) {
            scenarios.add(new Scenario(
                String.format("Improve %s by %s", measure, formatPoints(points)), Map.of(measure, points)));
        }

        Map<String, Double> highWeight = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : weights.asMap().entrySet()) {
            if (entry.getValue() >= policy.highWeightThreshold() && modeledMeasures.contains(entry.getKey())) {
                highWeight.put(entry.getKey(), points);
            }
        }
        if (!highWeight.isEmpty()) {
            scenarios.add(new Scenario(HIGH_WEIGHT_SCENARIO + " by " + formatPoints(points), highWeight));
        }
        return scenarios;
    }

    /// Simulates the baseline, then evaluates and ranks the default scenarios.
    public StrategyReport analyze(SimulationRequest request, RatingValueTable valueTable) {
        Objects.requireNonNull(request, "request cannot be null");
        return analyze(engine.simulate(request), request, valueTable);
    }

    /// Evaluates and ranks the default scenarios against an existing baseline.
    public StrategyReport analyze(SimulationResult baseline, SimulationRequest request, RatingValueTable valueTable) {
        Objects.requireNonNull(request, "request cannot be null");
        return analyze(baseline, request, scenarios(request.models().keySet(), request.weights()), valueTable);
    }

    /// Evaluates and ranks explicit scenarios against an existing baseline.
    public StrategyReport analyze(SimulationResult baseline, SimulationRequest request,
                                  List<Scenario> scenarios, RatingValueTable valueTable) {
        Objects.requireNonNull(baseline, "baseline cannot be null");
        Objects.requireNonNull(scenarios, "scenarios cannot be null");
        Objects.requireNonNull(valueTable, "valueTable cannot be null");

        List<ScenarioResult> results = new ArrayList<>(scenarios.size());
        List<ScenarioFailure> failures = new ArrayList<>();
        for (Scenario scenario : scenarios) {
            try {
                ImprovementValuation valuation =
                    valuator.evaluate(baseline, request, scenario.improvements(), valueTable);
                double cost = scenario.totalPoints() * policy.costPerPoint();
                results.add(new ScenarioResult(scenario, baseline.expectedRating(),
                    valuation.improved().expectedRating(), valuation.netValueChange(), cost,
                    valuation.valuation().roi(cost)));
            } catch (RuntimeException e) {
                logger.warn("Error evaluating scenario '{}': {}", scenario.name(), e.getMessage());
                failures.add(ScenarioFailure.of(scenario, e));
            }
        }

        results.sort(Comparator.comparingDouble(ScenarioResult::roi).reversed());
        logger.info("Evaluated {} scenarios for {}/{} ({} failed)", results.size(),
            request.organizationId(), request.year(), failures.size());
        return new StrategyReport(baseline, results, failures);
    }

    private static String formatPoints(double points) {
        return (points == Math.rint(points) ? String.valueOf((long) points) : String.valueOf(points))
            + (points == 1.0 ? " point" : " points");
    }
}
