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

/// A measure whose fit failed; the rest of the batch is unaffected.
///
/// @param measureKey the measure
/// @param reason a readable description of the failure
/// @param cause the underlying exception
public record FitFailure(String measureKey, String reason, Throwable cause) {

    public static FitFailure of(String measureKey, Throwable cause) {
        return new FitFailure(measureKey, cause.getMessage(), cause);
    }
}
