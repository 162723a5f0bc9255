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

import io.starcast.models.ConditionalBeta;
import io.starcast.models.DistributionModel;
import io.starcast.models.MalformedFeatureException;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// Beta regression with a logit link for the mean and a log link for the precision.
///
/// ```text
///   z_j = (x_j − center_j) / scale_j
///   μ   = logistic(b_0 + Σ b_j z_j)
///   φ   = exp(g_0 + Σ g_j z_j)
/// ```
///
/// Linear predictors are clamped so μ stays strictly inside (0, 1) and φ
/// stays finite for any feature vector.
public final class BetaRegressionModel implements DistributionModel {

    public static final String MODEL_TYPE = "beta_regression";

    static final double MEAN_PREDICTOR_LIMIT = 30.0;
    static final double LOG_PRECISION_MIN = -10.0;
    static final double LOG_PRECISION_MAX = 15.0;
    static final double MEAN_EPSILON = 1e-9;

    private final String measureKey;
    private final List<String> featureNames;
    private final double[] center;
    private final double[] scale;
    private final double[] meanCoefficients;
    private final double[] precisionCoefficients;
    private final int observationCount;
    private final double logLikelihood;

    /// @param meanCoefficients intercept first, then one per feature
    /// @param precisionCoefficients intercept first, then one per feature
    public BetaRegressionModel(String measureKey, List<String> featureNames,
                               double[] center, double[] scale,
                               double[] meanCoefficients, double[] precisionCoefficients,
                               int observationCount, double logLikelihood) {
        this.measureKey = Objects.requireNonNull(measureKey, "measureKey cannot be null");
        this.featureNames = List.copyOf(featureNames);
        int p = this.featureNames.size();
        if (center.length != p || scale.length != p) {
            throw new IllegalArgumentException(String.format(
                "Expected %d standardization entries, got center=%d scale=%d", p, center.length, scale.length));
        }
        if (meanCoefficients.length != p + 1 || precisionCoefficients.length != p + 1) {
            throw new IllegalArgumentException(String.format(
                "Expected %d coefficients per link, got mean=%d precision=%d",
                p + 1, meanCoefficients.length, precisionCoefficients.length));
        }
        for (int j = 0; j < p; j++) {
            if (!Double.isFinite(center[j]) || !(scale[j] > 0.0) || Double.isInfinite(scale[j])) {
                throw new IllegalArgumentException("Invalid standardization for feature " + this.featureNames.get(j));
            }
        }
        requireFinite(meanCoefficients, "mean");
        requireFinite(precisionCoefficients, "precision");
        if (observationCount < 0) {
            throw new IllegalArgumentException("observationCount cannot be negative: " + observationCount);
        }
        this.center = center.clone();
        this.scale = scale.clone();
        this.meanCoefficients = meanCoefficients.clone();
        this.precisionCoefficients = precisionCoefficients.clone();
        this.observationCount = observationCount;
        this.logLikelihood = logLikelihood;
    }

    private static void requireFinite(double[] coefficients, String link) {
        for (double c : coefficients) {
            if (!Double.isFinite(c)) {
                throw new IllegalArgumentException("Non-finite " + link + " coefficient: " + Arrays.toString(coefficients));
            }
        }
    }

    @Override
    public String measureKey() {
        return measureKey;
    }

    @Override
    public List<String> featureNames() {
        return featureNames;
    }

    @Override
    public int observationCount() {
        return observationCount;
    }

    @Override
    public ConditionalBeta conditional(double[] features) {
        if (features == null || features.length != featureNames.size()) {
            throw new MalformedFeatureException(measureKey, null, String.format(
                "expected %d features, got %s", featureNames.size(),
                features == null ? "null" : String.valueOf(features.length)));
        }
        double eta = meanCoefficients[0];
        double zeta = precisionCoefficients[0];
        for (int j = 0; j < features.length; j++) {
            double x = features[j];
            if (!Double.isFinite(x)) {
                throw new MalformedFeatureException(measureKey, featureNames.get(j), "non-finite value " + x);
            }
            double z = (x - center[j]) / scale[j];
            eta += meanCoefficients[j + 1] * z;
            zeta += precisionCoefficients[j + 1] * z;
        }
        return new ConditionalBeta(mean(eta), precision(zeta));
    }

    static double mean(double eta) {
        double clamped = Math.max(-MEAN_PREDICTOR_LIMIT, Math.min(MEAN_PREDICTOR_LIMIT, eta));
        double mu = 1.0 / (1.0 + Math.exp(-clamped));
        return Math.max(MEAN_EPSILON, Math.min(1.0 - MEAN_EPSILON, mu));
    }

    static double precision(double zeta) {
        return Math.exp(Math.max(LOG_PRECISION_MIN, Math.min(LOG_PRECISION_MAX, zeta)));
    }

    public double[] center() {
        return center.clone();
    }

    public double[] scale() {
        return scale.clone();
    }

    public double[] meanCoefficients() {
        return meanCoefficients.clone();
    }

    public double[] precisionCoefficients() {
        return precisionCoefficients.clone();
    }

    /// Maximized log-likelihood over the training observations.
    public double logLikelihood() {
        return logLikelihood;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BetaRegressionModel)) return false;
        BetaRegressionModel that = (BetaRegressionModel) o;
        return observationCount == that.observationCount
            && Double.compare(logLikelihood, that.logLikelihood) == 0
            && measureKey.equals(that.measureKey)
            && featureNames.equals(that.featureNames)
            && Arrays.equals(center, that.center)
            && Arrays.equals(scale, that.scale)
            && Arrays.equals(meanCoefficients, that.meanCoefficients)
            && Arrays.equals(precisionCoefficients, that.precisionCoefficients);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(measureKey, featureNames, observationCount);
        result = 31 * result + Arrays.hashCode(meanCoefficients);
        result = 31 * result + Arrays.hashCode(precisionCoefficients);
        return result;
    }

    @Override
    public String toString() {
        return String.format("BetaRegressionModel[%s, features=%d, n=%d, logLik=%.4f]",
            measureKey, featureNames.size(), observationCount, logLikelihood);
    }
}
