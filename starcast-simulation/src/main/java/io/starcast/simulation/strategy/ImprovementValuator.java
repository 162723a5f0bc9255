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

import io.starcast.ratings.value.RatingValueTable;
import io.starcast.ratings.value.Valuation;
import io.starcast.ratings.value.ValuationLayer;
import io.starcast.simulation.SimulationEngine;
import io.starcast.simulation.SimulationRequest;
import io.starcast.simulation.SimulationResult;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Values a set of measure improvements by simulating with and without them.
///
/// The improved run reuses the request's seed, so draw `i` of both runs
/// reads the same random stream and the difference between the runs comes
/// from the improvements alone. Improvements add to any adjustments the
/// request already carries.
public final class ImprovementValuator {

    private static final Logger logger = LogManager.getLogger(ImprovementValuator.class);

    private final SimulationEngine engine;

    public ImprovementValuator(SimulationEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
    }

    /// Runs the baseline and the improved simulation and values both.
    ///
    /// @param request the baseline request
    /// @param improvements points to add per measure
    /// @param valueTable dollar value per star level
    public ImprovementValuation evaluate(SimulationRequest request, Map<String, Double> improvements,
                                         RatingValueTable valueTable) {
        Objects.requireNonNull(request, "request cannot be null");
        return evaluate(engine.simulate(request), request, improvements, valueTable);
    }

    /// Values improvements against a baseline that was already simulated from `request`.
    public ImprovementValuation evaluate(SimulationResult baseline, SimulationRequest request,
                                         Map<String, Double> improvements, RatingValueTable valueTable) {
        Objects.requireNonNull(baseline, "baseline cannot be null");
        Objects.requireNonNull(request, "request cannot be null");
        Objects.requireNonNull(improvements, "improvements cannot be null");
        Objects.requireNonNull(valueTable, "valueTable cannot be null");

        SimulationResult improved = engine.simulate(request.withAdjustments(combine(request.adjustments(), improvements)));
        Valuation valuation = ValuationLayer.valuate(baseline.distribution(), improved.distribution(), valueTable);
        logger.debug("Improvements {} for {}/{}: value {} -> {}", improvements, request.organizationId(),
            request.year(), valuation.baselineValue(), valuation.improvedValue());
        return new ImprovementValuation(improvements, baseline, improved, valuation);
    }

    static Map<String, Double> combine(Map<String, Double> adjustments, Map<String, Double> improvements) {
        Map<String, Double> combined = new LinkedHashMap<>(adjustments);
        improvements.forEach((measure, points) -> combined.merge(measure, points, Double::sum));
        return combined;
    }
}
