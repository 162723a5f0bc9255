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


package io.starcast.simulation;

import java.util.OptionalDouble;

/// Outcome of one measure in one simulation draw.
///
/// ```text
///   Sampled      drawn from the measure's model, adjusted and clipped
///   Fallback     the observed value, used when there is no model or sampling failed
///   Unavailable  no model and no observed value; the measure is left out of the draw
/// ```
public sealed interface MeasureDraw permits MeasureDraw.Sampled, MeasureDraw.Fallback, MeasureDraw.Unavailable {

    enum Outcome {
        SAMPLED,
        FALLBACK,
        UNAVAILABLE
    }

    Outcome outcome();

    /// The score the draw contributes, empty when unavailable.
    OptionalDouble value();

    static MeasureDraw sampled(double score) {
        return new Sampled(score);
    }

    static MeasureDraw fallback(OptionalDouble observed) {
        return observed.isPresent() ? new Fallback(observed.getAsDouble()) : Unavailable.INSTANCE;
    }

    static MeasureDraw unavailable() {
        return Unavailable.INSTANCE;
    }

    record Sampled(double score) implements MeasureDraw {
        @Override
        public Outcome outcome() {
            return Outcome.SAMPLED;
        }

        @Override
        public OptionalDouble value() {
            return OptionalDouble.of(score);
        }
    }

    record Fallback(double score) implements MeasureDraw {
        @Override
        public Outcome outcome() {
            return Outcome.FALLBACK;
        }

        @Override
        public OptionalDouble value() {
            return OptionalDouble.of(score);
        }
    }

    record Unavailable() implements MeasureDraw {
        static final Unavailable INSTANCE = new Unavailable();

        @Override
        public Outcome outcome() {
            return Outcome.UNAVAILABLE;
        }

        @Override
        public OptionalDouble value() {
            return OptionalDouble.empty();
        }
    }
}
