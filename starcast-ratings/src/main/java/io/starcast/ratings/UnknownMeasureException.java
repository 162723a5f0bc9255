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

package io.starcast.ratings;

/// Thrown when a threshold or weight lookup names a measure the reference
/// table does not know. Fatal to that one measure's computation only.
public class UnknownMeasureException extends RuntimeException {

    private final String measureKey;

    public UnknownMeasureException(String measureKey) {
        super(String.format("Unknown measure: '%s'", measureKey));
        this.measureKey = measureKey;
    }

    public String getMeasureKey() {
        return measureKey;
    }
}
