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


package io.starcast.ratings.improve;

/// The nearest composite rating cutoff above a current rating.
///
/// @param currentRating the composite rating
/// @param cutoff the smallest cutoff strictly above it
public record NextCutoff(double currentRating, double cutoff) {

    /// Composite rating points still needed to reach the cutoff.
    public double pointsNeeded() {
        return cutoff - currentRating;
    }
}
