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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Outcome of fitting a batch of measures.
///
/// Every requested measure appears in exactly one of [#models()],
/// [#skipped()] or [#failures()].
///
/// @param models fitted models keyed by measure, in request order
/// @param skipped measures with too little history
/// @param failures measures whose fit failed
public record FitBatchResult(
    Map<String, DistributionModel> models,
    List<InsufficientHistory> skipped,
    List<FitFailure> failures
) {

    public FitBatchResult {
        models = Collections.unmodifiableMap(new LinkedHashMap<>(models));
        skipped = List.copyOf(skipped);
        failures = List.copyOf(failures);
    }

    public static FitBatchResult of(Map<String, DistributionModel> models) {
        return new FitBatchResult(models, List.of(), List.of());
    }

    public Optional<DistributionModel> model(String measureKey) {
        return Optional.ofNullable(models.get(measureKey));
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
