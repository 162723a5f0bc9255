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

/// Thrown when a feature vector does not match what a model expects, or a
/// feature name cannot be resolved against the panel.
public class MalformedFeatureException extends RuntimeException {

    private final String measureKey;
    private final String featureName;

    public MalformedFeatureException(String measureKey, String featureName, String detail) {
        super(String.format("Malformed feature '%s' for measure '%s': %s", featureName, measureKey, detail));
        this.measureKey = measureKey;
        this.featureName = featureName;
    }

    public String getMeasureKey() {
        return measureKey;
    }

    /// The offending feature, or null when the vector as a whole is malformed.
    public String getFeatureName() {
        return featureName;
    }
}
