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


package io.starcast.models.beta;

import org.apache.commons.math3.special.Gamma;

/// Mean log-likelihood of a beta regression and its analytic gradient.
///
/// Parameters are packed as `[b_0 .. b_p, g_0 .. g_p]`. With
/// `y* = logit(y)` and `μ* = ψ(μφ) − ψ((1 − μ)φ)`, per observation:
///
/// ```text
///   ∂ℓ/∂b_j = φ (y* − μ*) μ(1 − μ) z_j
///   ∂ℓ/∂g_j = φ [ μ(y* − μ*) + log(1 − y) − ψ((1 − μ)φ) + ψ(φ) ] z_j
/// ```
///
/// with `z_0 = 1`.
final class BetaLikelihood {

    private final double[][] z;
    private final double[] logY;
    private final double[] log1mY;
    private final int n;
    private final int p;

    /// @param z standardized features, one row per observation
    /// @param y targets strictly inside (0, 1)
    BetaLikelihood(double[][] z, double[] y) {
        this.z = z;
        this.n = y.length;
        this.p = n == 0 ? 0 : z[0].length;
        this.logY = new double[n];
        this.log1mY = new double[n];
        for (int i = 0; i < n; i++) {
            logY[i] = Math.log(y[i]);
            log1mY[i] = Math.log1p(-y[i]);
        }
    }

    int parameterCount() {
        return 2 * (p + 1);
    }

    double value(double[] theta) {
        double sum = 0.0;
        for (int i = 0; i < n; i++) {
            double mu = BetaRegressionModel.mean(predictor(theta, 0, i));
            double phi = BetaRegressionModel.precision(predictor(theta, p + 1, i));
            double a = mu * phi;
            double b = (1.0 - mu) * phi;
            sum += Gamma.logGamma(phi) - Gamma.logGamma(a) - Gamma.logGamma(b)
                + (a - 1.0) * logY[i] + (b - 1.0) * log1mY[i];
        }
        return sum / n;
    }

    double[] gradient(double[] theta) {
        double[] grad = new double[parameterCount()];
        for (int i = 0; i < n; i++) {
            double mu = BetaRegressionModel.mean(predictor(theta, 0, i));
            double phi = BetaRegressionModel.precision(predictor(theta, p + 1, i));
            double digammaA = Gamma.digamma(mu * phi);
            double digammaB = Gamma.digamma((1.0 - mu) * phi);
            double yStar = logY[i] - log1mY[i];
            double muStar = digammaA - digammaB;

            double dEta = phi * (yStar - muStar) * mu * (1.0 - mu);
            double dZeta = phi * (mu * (yStar - muStar) + log1mY[i] - digammaB + Gamma.digamma(phi));

            grad[0] += dEta;
            grad[p + 1] += dZeta;
            double[] row = z[i];
            for (int j = 0; j < p; j++) {
                grad[j + 1] += dEta * row[j];
                grad[p + 2 + j] += dZeta * row[j];
            }
        }
        for (int k = 0; k < grad.length; k++) {
            grad[k] /= n;
        }
        return grad;
    }

    private double predictor(double[] theta, int offset, int i) {
        double sum = theta[offset];
        double[] row = z[i];
        for (int j = 0; j < p; j++) {
            sum += theta[offset + 1 + j] * row[j];
        }
        return sum;
    }
}
