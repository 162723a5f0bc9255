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

/// Thrown when fitting a single measure's model fails.
public class ModelFitException extends RuntimeException {

    private final String measureKey;

    public ModelFitException(String measureKey, String message) {
        super(String.format("Fit failed for '%s': %s", measureKey, message));
        this.measureKey = measureKey;
    }

    public ModelFitException(String measureKey, String message, Throwable cause) {
        super(String.format("Fit failed for '%s': %s", measureKey, message), cause);
        this.measureKey = measureKey;
    }

    public String getMeasureKey() {
        return measureKey;
    }
}
