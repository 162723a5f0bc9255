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

import io.starcast.ratings.classify.MeasureRating;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

/// One Monte Carlo sample of an organization's measures.
///
/// @param index zero-based draw index; it selects the draw's random stream
/// @param measures outcome of every simulated measure
/// @param ratings classification of the drawn scores
/// @param aggregate the composite rating, empty when no weighted measure was rated
public record SimulationDraw(
    int index,
    Map<String, MeasureDraw> measures,
    Map<String, MeasureRating> ratings,
    OptionalDouble aggregate
) {

    public SimulationDraw {
        measures = Collections.unmodifiableMap(new LinkedHashMap<>(measures));
        ratings = Collections.unmodifiableMap(new LinkedHashMap<>(ratings));
    }

    public boolean isDefined() {
        return aggregate.isPresent();
    }
}
