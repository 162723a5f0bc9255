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

import io.starcast.models.DistributionModel;
import io.starcast.models.FitBatchResult;
import io.starcast.models.FitFailure;
import io.starcast.models.InsufficientHistory;
import io.starcast.models.MalformedFeatureException;
import io.starcast.models.ModelFitException;
import io.starcast.models.ModelFitter;
import io.starcast.models.features.FeatureDeriver;
import io.starcast.models.features.FeatureRef;
import io.starcast.ratings.config.ForecastPolicy;
import io.starcast.ratings.panel.ObservationPanel;
import io.starcast.ratings.panel.ObservationRow;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.optim.InitialGuess;
import org.apache.commons.math3.optim.MaxEval;
import org.apache.commons.math3.optim.PointValuePair;
import org.apache.commons.math3.optim.SimpleValueChecker;
import org.apache.commons.math3.optim.nonlinear.scalar.GoalType;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunction;
import org.apache.commons.math3.optim.nonlinear.scalar.ObjectiveFunctionGradient;
import org.apache.commons.math3.optim.nonlinear.scalar.gradient.NonLinearConjugateGradientOptimizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;

/**
 * Fits per-measure beta regression models by maximum likelihood.
 *
 * <h2>Pipeline</h2>
 *
 * <pre>
 * ┌─────────────────────────────────────────────────────────────────────┐
 * │ per measure (parallel on a ForkJoinPool)                            │
 * │                                                                     │
 * │  rows with an observed target ──► trend feature vectors             │
 * │        │                                                            │
 * │        ├── fewer than min_observations ──► InsufficientHistory      │
 * │        │                                                            │
 * │        ▼                                                            │
 * │  y = (value − lower) / (upper − lower), clamped to [ε, 1 − ε]       │
 * │  standardize features (zero variance keeps scale 1)                 │
 * │        │                                                            │
 * │        ▼                                                            │
 * │  maximize mean log-likelihood, Polak-Ribière conjugate gradient     │
 * │        │                                                            │
 * │        ├── out-of-domain target / no convergence ──► FitFailure     │
 * │        ▼                                                            │
 * │  BetaRegressionModel                                                │
 * └─────────────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <p>The starting point puts the mean intercept at {@code logit(ȳ)}, the
 * precision intercept at the log of the method-of-moments precision, and
 * every slope at zero.
 */
public final class BetaRegressionFitter implements ModelFitter, AutoCloseable {

    private static final Logger logger = LogManager.getLogger(BetaRegressionFitter.class);

    private static final double RELATIVE_TOLERANCE = 1e-10;
    private static final double ABSOLUTE_TOLERANCE = 1e-12;
    private static final double MIN_INITIAL_PRECISION = 1.0;
    private static final double MAX_INITIAL_PRECISION = 1e4;

    private final ForecastPolicy policy;
    private final ForkJoinPool pool;
    private final boolean ownsPool;

    private BetaRegressionFitter(ForecastPolicy policy, ForkJoinPool pool, boolean ownsPool) {
        this.policy = policy;
        this.pool = pool;
        this.ownsPool = ownsPool;
    }

    /** Creates a fitter with the default policy. */
    public BetaRegressionFitter() {
        this(ForecastPolicy.defaults(), new ForkJoinPool(ForecastPolicy.defaults().parallelism()), true);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ForecastPolicy policy() {
        return policy;
    }

    @Override
    public FitBatchResult fitModels(ObservationPanel panel, List<String> measureKeys, List<String> featureKeys) {
        Objects.requireNonNull(panel, "panel cannot be null");
        Objects.requireNonNull(measureKeys, "measureKeys cannot be null");
        Objects.requireNonNull(featureKeys, "featureKeys cannot be null");

        long start = System.nanoTime();
        List<ForkJoinTask<MeasureOutcome>> tasks = new ArrayList<>(measureKeys.size());
        for (String measure : measureKeys) {
            tasks.add(pool.submit(() -> fitMeasure(panel, measure, featureKeys)));
        }

        Map<String, DistributionModel> models = new LinkedHashMap<>();
        List<InsufficientHistory> skipped = new ArrayList<>();
        List<FitFailure> failures = new ArrayList<>();
        for (ForkJoinTask<MeasureOutcome> task : tasks) {
            MeasureOutcome outcome = task.join();
            if (outcome.model != null) {
                models.put(outcome.model.measureKey(), outcome.model);
            } else if (outcome.skipped != null) {
                skipped.add(outcome.skipped);
            } else {
                failures.add(outcome.failure);
            }
        }

        logger.info("Fitted {} of {} measures in {} ms ({} skipped, {} failed)",
            models.size(), measureKeys.size(), (System.nanoTime() - start) / 1_000_000,
            skipped.size(), failures.size());
        return new FitBatchResult(models, skipped, failures);
    }

    private MeasureOutcome fitMeasure(ObservationPanel panel, String measure, List<String> featureKeys) {
        try {
            List<String> featureNames = featureKeys.isEmpty()
                ? FeatureDeriver.trendFeatureNames(measure)
                : featureKeys;
            List<FeatureRef> refs = FeatureDeriver.resolve(measure, featureNames);

            List<double[]> rows = new ArrayList<>();
            List<Double> targets = new ArrayList<>();
            for (String organization : panel.organizations()) {
                List<ObservationRow> history = panel.history(organization);
                for (int t = 0; t < history.size(); t++) {
                    OptionalDouble value = history.get(t).value(measure);
                    if (value.isPresent()) {
                        rows.add(FeatureDeriver.featureVector(history, t, refs));
                        targets.add(value.getAsDouble());
                    }
                }
            }

            if (targets.size() < policy.minObservations()) {
                logger.debug("Skipping {}: {} observations, need {}", measure, targets.size(), policy.minObservations());
                return MeasureOutcome.skipped(new InsufficientHistory(measure, targets.size(), policy.minObservations()));
            }

            double[][] features = rows.toArray(new double[0][]);
            double[] values = new double[targets.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = targets.get(i);
            }
            return MeasureOutcome.fitted(fit(measure, featureNames, features, values));
        } catch (ModelFitException | MalformedFeatureException e) {
            logger.warn("Could not fit {}: {}", measure, e.getMessage());
            return MeasureOutcome.failed(FitFailure.of(measure, e));
        } catch (RuntimeException e) {
            logger.warn("Unexpected error fitting {}", measure, e);
            return MeasureOutcome.failed(FitFailure.of(measure, e));
        }
    }

    /**
     * Fits one measure from an explicit design matrix.
     *
     * @param measureKey the measure
     * @param featureNames names of the feature columns
     * @param features one row of raw feature values per observation
     * @param values observed measure values on the policy's measure scale
     * @return the fitted model
     * @throws IllegalArgumentException if the inputs are inconsistent or too short
     * @throws ModelFitException if a value is outside the measure domain or the optimizer fails
     */
    public BetaRegressionModel fit(String measureKey, List<String> featureNames, double[][] features, double[] values) {
        Objects.requireNonNull(measureKey, "measureKey cannot be null");
        int n = values.length;
        int p = featureNames.size();
        if (features.length != n) {
            throw new IllegalArgumentException(String.format(
                "Got %d feature rows for %d values", features.length, n));
        }
        if (n < policy.minObservations()) {
            throw new IllegalArgumentException(String.format(
                "Need at least %d observations for %s, got %d", policy.minObservations(), measureKey, n));
        }

        double lower = policy.measureLower();
        double range = policy.measureUpper() - lower;
        double eps = policy.boundaryEpsilon();
        double[] y = new double[n];
        double sumY = 0.0;
        for (int i = 0; i < n; i++) {
            double v = values[i];
            if (!(v >= lower && v <= policy.measureUpper())) {
                throw new ModelFitException(measureKey, String.format(
                    "value %s outside [%s, %s]", v, lower, policy.measureUpper()));
            }
            y[i] = Math.max(eps, Math.min(1.0 - eps, (v - lower) / range));
            sumY += y[i];
        }

        double[] center = new double[p];
        double[] scale = new double[p];
        double[][] z = standardize(measureKey, featureNames, features, center, scale);

        double meanY = sumY / n;
        double varY = 0.0;
        for (double v : y) {
            varY += (v - meanY) * (v - meanY);
        }
        varY = Math.max(varY / n, 1e-12);
        double initialPrecision = meanY * (1.0 - meanY) / varY - 1.0;
        initialPrecision = Math.max(MIN_INITIAL_PRECISION, Math.min(MAX_INITIAL_PRECISION, initialPrecision));

        BetaLikelihood likelihood = new BetaLikelihood(z, y);
        double[] start = new double[likelihood.parameterCount()];
        start[0] = Math.log(meanY / (1.0 - meanY));
        start[p + 1] = Math.log(initialPrecision);

        PointValuePair optimum;
        try {
            NonLinearConjugateGradientOptimizer optimizer = new NonLinearConjugateGradientOptimizer(
                NonLinearConjugateGradientOptimizer.Formula.POLAK_RIBIERE,
                new SimpleValueChecker(RELATIVE_TOLERANCE, ABSOLUTE_TOLERANCE));
            optimum = optimizer.optimize(
                new MaxEval(policy.maxFitEvaluations()),
                new ObjectiveFunction(likelihood::value),
                new ObjectiveFunctionGradient(likelihood::gradient),
                GoalType.MAXIMIZE,
                new InitialGuess(start));
        } catch (MathIllegalStateException e) {
            throw new ModelFitException(measureKey, "optimizer did not converge: " + e.getMessage(), e);
        }

        double[] theta = optimum.getPoint();
        double meanLogLik = optimum.getValue();
        for (double t : theta) {
            if (!Double.isFinite(t)) {
                throw new ModelFitException(measureKey, "non-finite coefficients");
            }
        }
        if (!Double.isFinite(meanLogLik)) {
            throw new ModelFitException(measureKey, "non-finite log-likelihood");
        }

        double[] meanCoefficients = new double[p + 1];
        double[] precisionCoefficients = new double[p + 1];
        System.arraycopy(theta, 0, meanCoefficients, 0, p + 1);
        System.arraycopy(theta, p + 1, precisionCoefficients, 0, p + 1);

        BetaRegressionModel model = new BetaRegressionModel(measureKey, featureNames, center, scale,
            meanCoefficients, precisionCoefficients, n, meanLogLik * n);
        logger.debug("Fitted {}", model);
        return model;
    }

    private static double[][] standardize(String measureKey, List<String> featureNames, double[][] features,
                                          double[] center, double[] scale) {
        int n = features.length;
        int p = center.length;
        for (int i = 0; i < n; i++) {
            if (features[i].length != p) {
                throw new IllegalArgumentException(String.format(
                    "Feature row %d has %d columns, expected %d", i, features[i].length, p));
            }
            for (int j = 0; j < p; j++) {
                if (!Double.isFinite(features[i][j])) {
                    throw new MalformedFeatureException(measureKey, featureNames.get(j),
                        "non-finite value in row " + i);
                }
                center[j] += features[i][j];
            }
        }
        for (int j = 0; j < p; j++) {
            center[j] /= n;
            double ss = 0.0;
            for (int i = 0; i < n; i++) {
                double d = features[i][j] - center[j];
                ss += d * d;
            }
            double sd = Math.sqrt(ss / n);
            scale[j] = sd > 1e-12 ? sd : 1.0;
        }
        double[][] z = new double[n][p];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < p; j++) {
                z[i][j] = (features[i][j] - center[j]) / scale[j];
            }
        }
        return z;
    }

    /** Shuts down the pool if this fitter owns it. */
    @Override
    public void close() {
        if (ownsPool && !pool.isShutdown()) {
            pool.shutdown();
        }
    }

    private static final class MeasureOutcome {
        private final DistributionModel model;
        private final InsufficientHistory skipped;
        private final FitFailure failure;

        private MeasureOutcome(DistributionModel model, InsufficientHistory skipped, FitFailure failure) {
            this.model = model;
            this.skipped = skipped;
            this.failure = failure;
        }

        static MeasureOutcome fitted(DistributionModel model) {
            return new MeasureOutcome(model, null, null);
        }

        static MeasureOutcome skipped(InsufficientHistory skipped) {
            return new MeasureOutcome(null, skipped, null);
        }

        static MeasureOutcome failed(FitFailure failure) {
            return new MeasureOutcome(null, null, failure);
        }
    }

    /**
     * Builder for fitter configuration.
     */
    public static final class Builder {
        private ForecastPolicy policy = ForecastPolicy.defaults();
        private ForkJoinPool pool = null;
        private Integer parallelism = null;

        private Builder() {}

        public Builder policy(ForecastPolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy cannot be null");
            return this;
        }

        /**
         * Sets the number of worker threads, overriding the policy.
         */
        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        /**
         * Uses an existing ForkJoinPool, which the fitter will not shut down.
         */
        public Builder pool(ForkJoinPool pool) {
            this.pool = pool;
            return this;
        }

        public BetaRegressionFitter build() {
            if (pool != null) {
                return new BetaRegressionFitter(policy, pool, false);
            }
            int threads = parallelism != null ? parallelism : policy.parallelism();
            return new BetaRegressionFitter(policy, new ForkJoinPool(threads), true);
        }
    }
}
