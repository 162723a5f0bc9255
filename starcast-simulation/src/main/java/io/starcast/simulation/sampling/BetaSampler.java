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


package io.starcast.simulation.sampling;

import io.starcast.models.ConditionalBeta;
import org.apache.commons.math3.special.Beta;
import org.apache.commons.math3.special.Erf;

/**
 * Sampler for Beta distributions using inverse CDF transform.
 *
 * <p>Newton-Raphson iteration inverts the regularized incomplete beta
 * function. Each iterate is kept inside a bracket that shrinks around the
 * root; a Newton step leaving the bracket is replaced by bisection, so
 * strongly skewed shapes still converge.
 */
public final class BetaSampler {

    static final double U_EPSILON = 1e-10;
    private static final int MAX_ITERATIONS = 100;
    private static final double CDF_TOLERANCE = 1e-12;
    private static final double BRACKET_TOLERANCE = 1e-15;

    private final double alpha;
    private final double beta;

    // Pre-computed for efficiency
    private final double logBeta;

    /**
     * Creates a sampler for the given conditional distribution.
     *
     * @param distribution the conditional beta distribution on [0, 1]
     */
    public BetaSampler(ConditionalBeta distribution) {
        this(distribution.alpha(), distribution.beta());
    }

    /**
     * Creates a sampler from shape parameters.
     *
     * @throws IllegalArgumentException if a shape is not positive and finite
     */
    public BetaSampler(double alpha, double beta) {
        if (!(alpha > 0) || !(beta > 0) || Double.isInfinite(alpha) || Double.isInfinite(beta)) {
            throw new IllegalArgumentException(
                String.format("Beta shapes must be positive and finite, got alpha=%s beta=%s", alpha, beta));
        }
        this.alpha = alpha;
        this.beta = beta;
        this.logBeta = Beta.logBeta(alpha, beta);
    }

    /**
     * Maps a uniform variate to a Beta variate on [0, 1].
     *
     * @param u uniform variate, clamped away from 0 and 1
     * @throws ArithmeticException if the CDF cannot be evaluated for these shapes
     */
    public double sample(double u) {
        u = Math.max(U_EPSILON, Math.min(1 - U_EPSILON, u));
        return inverseCdf(u);
    }

    /** Regularized incomplete beta function I_x(α, β). */
    public double cdf(double x) {
        if (x <= 0) return 0;
        if (x >= 1) return 1;
        return Beta.regularizedBeta(x, alpha, beta);
    }

    /**
     * Beta PDF: f(x) = x^(α-1) * (1-x)^(β-1) / B(α,β)
     */
    double pdf(double x) {
        if (x <= 0 || x >= 1) return 0;
        return Math.exp((alpha - 1) * Math.log(x) + (beta - 1) * Math.log1p(-x) - logBeta);
    }

    public double alpha() {
        return alpha;
    }

    public double beta() {
        return beta;
    }

    private double inverseCdf(double p) {
        double lo = 0.0;
        double hi = 1.0;
        double x = initialGuess(p);

        for (int i = 0; i < MAX_ITERATIONS; i++) {
            double cdf = cdf(x);
            if (Double.isNaN(cdf)) {
                throw new ArithmeticException(
                    String.format("Beta CDF undefined at x=%s for alpha=%s beta=%s", x, alpha, beta));
            }
            double error = cdf - p;
            if (Math.abs(error) < CDF_TOLERANCE) {
                break;
            }
            if (error > 0) {
                hi = x;
            } else {
                lo = x;
            }
            if (hi - lo < BRACKET_TOLERANCE) {
                break;
            }

            double pdf = pdf(x);
            double next = pdf > 1e-100 ? x - error / pdf : Double.NaN;
            if (!(next > lo && next < hi)) {
                next = 0.5 * (lo + hi);
            }
            x = next;
        }
        return Math.max(0.0, Math.min(1.0, x));
    }

    /**
     * Initial guess for Newton-Raphson using normal approximation.
     */
    private double initialGuess(double p) {
        if (alpha >= 1 && beta >= 1) {
            double mean = alpha / (alpha + beta);
            double var = (alpha * beta) / ((alpha + beta) * (alpha + beta) * (alpha + beta + 1));
            double z = Math.sqrt(2.0) * Erf.erfInv(2.0 * p - 1.0);
            double guess = mean + z * Math.sqrt(var);
            return Math.max(0.01, Math.min(0.99, guess));
        }
        // For extreme shapes, use p directly
        return Math.max(0.01, Math.min(0.99, p));
    }

    @Override
    public String toString() {
        return "BetaSampler[alpha=" + alpha + ", beta=" + beta + "]";
    }
}
