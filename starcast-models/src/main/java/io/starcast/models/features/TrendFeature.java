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

import java.util.Optional;

/// Trend features derived from a measure's year-ordered history.
///
/// With `x[t]` the measure value in the row being predicted:
///
/// | feature        | value                  |
/// |----------------|------------------------|
/// | `lag1`         | `x[t-1]`               |
/// | `diff1`        | `x[t-1] - x[t-2]`      |
/// | `diff2`        | `x[t-1] - x[t-3]`      |
/// | `*_missing`    | 1 when the base feature is missing, else 0 |
///
/// Missing base features are imputed as 0.
public enum TrendFeature {
    LAG1("lag1"),
    DIFF1("diff1"),
    DIFF2("diff2"),
    LAG1_MISSING("lag1_missing"),
    DIFF1_MISSING("diff1_missing"),
    DIFF2_MISSING("diff2_missing");

    private final String suffix;

    TrendFeature(String suffix) {
        this.suffix = suffix;
    }

    public String suffix() {
        return suffix;
    }

    /// Feature name for a measure, such as `C: Breast Cancer Screening_lag1`.
    public String nameFor(String measureKey) {
        return measureKey + "_" + suffix;
    }

    public boolean isIndicator() {
        return this == LAG1_MISSING || this == DIFF1_MISSING || this == DIFF2_MISSING;
    }

    /// Earliest history offset the feature reads, 1 for `x[t-1]`.
    int depth() {
        switch (this) {
            case LAG1:
            case LAG1_MISSING:
                return 1;
            case DIFF1:
            case DIFF1_MISSING:
                return 2;
            default:
                return 3;
        }
    }

    /// Matches the longest suffix so `lag1_missing` is not read as `lag1`.
    static Optional<TrendFeature> forName(String featureName) {
        TrendFeature match = null;
        for (TrendFeature feature : values()) {
            if (featureName.endsWith("_" + feature.suffix)
                && featureName.length() > feature.suffix.length() + 1
                && (match == null || feature.suffix.length() > match.suffix.length())) {
                match = feature;
            }
        }
        return Optional.ofNullable(match);
    }
}
