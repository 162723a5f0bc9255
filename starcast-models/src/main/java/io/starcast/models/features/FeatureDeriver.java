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
import io.starcast.ratings.panel.ObservationPanel;
import io.starcast.ratings.panel.ObservationRow;
import io.starcast.ratings.panel.PanelKey;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/// Derives trend feature vectors from an [ObservationPanel].
///
/// Features for a row are computed from the rows that precede it in the
/// organization's year order, so the row's own values never leak into its
/// features. A row with no predecessor has every base feature missing.
public final class FeatureDeriver {

    private FeatureDeriver() {
    }

    /// The six trend feature names of a measure, base features first.
    public static List<String> trendFeatureNames(String measureKey) {
        List<String> names = new ArrayList<>(TrendFeature.values().length);
        for (TrendFeature feature : TrendFeature.values()) {
            names.add(feature.nameFor(measureKey));
        }
        return List.copyOf(names);
    }

    /// Resolves feature names into references.
    ///
    /// @param owner the measure being modeled
    /// @param featureNames names to resolve
    /// @throws MalformedFeatureException if a name cannot be parsed
    public static List<FeatureRef> resolve(String owner, List<String> featureNames) {
        List<FeatureRef> refs = new ArrayList<>(featureNames.size());
        for (String name : featureNames) {
            refs.add(FeatureRef.parse(owner, name));
        }
        return List.copyOf(refs);
    }

    /// Computes the feature vector of one panel row.
    ///
    /// @param panel the panel holding the organization's history
    /// @param key the row to compute features for; it must exist in the panel
    /// @param features resolved features, in output order
    /// @return raw feature values, missing base values imputed as 0
    /// @throws IllegalArgumentException if the row is not in the panel
    public static double[] featureVector(ObservationPanel panel, PanelKey key, List<FeatureRef> features) {
        Objects.requireNonNull(panel, "panel cannot be null");
        Objects.requireNonNull(key, "key cannot be null");
        List<ObservationRow> history = panel.history(key.organizationId());
        int index = indexOf(history, key.year());
        if (index < 0) {
            throw new IllegalArgumentException("Row " + key + " is not in the panel");
        }
        return featureVector(history, index, features);
    }

    /// Computes the feature vector at a position in a year-ordered history.
    public static double[] featureVector(List<ObservationRow> history, int index, List<FeatureRef> features) {
        double[] vector = new double[features.size()];
        for (int i = 0; i < features.size(); i++) {
            FeatureRef ref = features.get(i);
            OptionalDouble base = baseValue(history, index, ref);
            if (ref.feature().isIndicator()) {
                vector[i] = base.isPresent() ? 0.0 : 1.0;
            } else {
                vector[i] = base.orElse(0.0);
            }
        }
        return vector;
    }

    private static OptionalDouble baseValue(List<ObservationRow> history, int index, FeatureRef ref) {
        OptionalDouble previous = valueAt(history, index - 1, ref.measureKey());
        switch (ref.feature()) {
            case LAG1:
            case LAG1_MISSING:
                return previous;
            default:
                break;
        }
        int back = ref.feature().depth();
        OptionalDouble earlier = valueAt(history, index - back, ref.measureKey());
        if (previous.isEmpty() || earlier.isEmpty()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(previous.getAsDouble() - earlier.getAsDouble());
    }

    private static OptionalDouble valueAt(List<ObservationRow> history, int index, String measureKey) {
        if (index < 0 || index >= history.size()) {
            return OptionalDouble.empty();
        }
        return history.get(index).value(measureKey);
    }

    private static int indexOf(List<ObservationRow> history, int year) {
        int lo = 0;
        int hi = history.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            int midYear = history.get(mid).year();
            if (midYear < year) {
                lo = mid + 1;
            } else if (midYear > year) {
                hi = mid - 1;
            } else {
                return mid;
            }
        }
        return -1;
    }
}
