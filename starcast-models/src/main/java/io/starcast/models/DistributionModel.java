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

import java.util.List;

/// A fitted per-measure model mapping a feature vector to a conditional
/// distribution of the measure's next value, rescaled to [0, 1].
///
/// Implementations are immutable and safe to share across simulation threads.
public interface DistributionModel {

    String measureKey();

    /// Feature names in the order [#conditional(double[])] expects them.
    List<String> featureNames();

    /// Number of observations the model was fitted on.
    int observationCount();

    /// Returns the conditional distribution for one feature vector.
    ///
    /// @param features raw feature values in [#featureNames()] order
    /// @throws MalformedFeatureException if the vector has the wrong length or a non-finite entry
    ConditionalBeta conditional(double[] features);
}
