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

/// A beta distribution on [0, 1] in mean/precision form.
///
/// ```text
///   α = μφ        β = (1 − μ)φ
///   E[Y] = μ      Var[Y] = μ(1 − μ) / (1 + φ)
/// ```
///
/// @param mean the mean μ, strictly inside (0, 1)
/// @param precision the precision φ, positive
public record ConditionalBeta(double mean, double precision) {

    public ConditionalBeta {
        if (!(mean > 0.0 && mean < 1.0)) {
            throw new IllegalArgumentException("Mean must be in (0, 1), got: " + mean);
        }
        if (!(precision > 0.0) || Double.isInfinite(precision)) {
            throw new IllegalArgumentException("Precision must be finite and positive, got: " + precision);
        }
    }

    public double alpha() {
        return mean * precision;
    }

    public double beta() {
        return (1.0 - mean) * precision;
    }

    public double variance() {
        return mean * (1.0 - mean) / (1.0 + precision);
    }
}
