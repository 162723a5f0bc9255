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

/// Thrown when a score falls into none of a measure's bands and the
/// top-band rescue rule does not apply.
public class ScoreOutOfRangeException extends RuntimeException {

    private final String measureKey;
    private final double score;

    public ScoreOutOfRangeException(String measureKey, double score) {
        super(String.format("Score %s does not fall into any defined range for measure '%s'", score, measureKey));
        this.measureKey = measureKey;
        this.score = score;
    }

    public String getMeasureKey() {
        return measureKey;
    }

    public double getScore() {
        return score;
    }
}
