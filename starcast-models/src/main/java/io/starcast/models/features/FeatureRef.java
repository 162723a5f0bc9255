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


package io.starcast.models.features;

import io.starcast.models.MalformedFeatureException;

import java.util.Objects;

/// A parsed feature name: the source measure and the trend feature taken from it.
///
/// @param measureKey the measure the feature reads
/// @param feature the trend feature
public record FeatureRef(String measureKey, TrendFeature feature) {

    public FeatureRef {
        Objects.requireNonNull(measureKey, "measureKey cannot be null");
        Objects.requireNonNull(feature, "feature cannot be null");
    }

    /// Parses a feature name such as `C: Annual Flu Vaccine_diff1`.
    ///
    /// @param owner the measure being modeled, for error context
    /// @throws MalformedFeatureException if the name has no recognized suffix
    public static FeatureRef parse(String owner, String featureName) {
        Objects.requireNonNull(featureName, "featureName cannot be null");
        TrendFeature feature = TrendFeature.forName(featureName).orElseThrow(() ->
            new MalformedFeatureException(owner, featureName, "unrecognized trend feature suffix"));
        String measure = featureName.substring(0, featureName.length() - feature.suffix().length() - 1);
        return new FeatureRef(measure, feature);
    }

    public String name() {
        return feature.nameFor(measureKey);
    }
}
