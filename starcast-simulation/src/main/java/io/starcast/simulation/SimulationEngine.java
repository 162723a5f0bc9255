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

import io.starcast.models.ConditionalBeta;
import io.starcast.models.DistributionModel;
import io.starcast.models.MalformedFeatureException;
import io.starcast.models.features.FeatureDeriver;
import io.starcast.models.features.FeatureRef;
import io.starcast.ratings.aggregate.AggregateRating;
import io.starcast.ratings.classify.MeasureRating;
import io.starcast.ratings.classify.ThresholdClassifier;
import io.starcast.ratings.config.ForecastPolicy;
import io.starcast.ratings.panel.ObservationRow;
import io.starcast.ratings.panel.PanelKey;
import io.starcast.simulation.sampling.BetaSampler;
import io.starcast.simulation.sampling.RandomStreams;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RecursiveAction;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Monte Carlo simulator propagating per-measure uncertainty into a
 * distribution over the composite star rating.
 *
 * <h2>Run Structure</h2>
 *
 * <pre>
 * ┌─────────────────────────────────────────────────────────────────────────┐
 * │ PHASE 1: Plan (once per run)                                            │
 * │   row lookup ─► per measure: conditional beta from the model's features │
 * │                 or the observed value when there is no usable model     │
 * └─────────────────────────────────────────────────────────────────────────┘
 *                                   │
 *                                   ▼
 * ┌─────────────────────────────────────────────────────────────────────────┐
 * │ PHASE 2: Draws (ForkJoinPool, ranges of draw indices)                   │
 * │   draw i: stream(seed, i) ─► sample ─► adjust ─► clip ─► classify       │
 * │           ─► aggregate                                                  │
 * └─────────────────────────────────────────────────────────────────────────┘
 *                                   │
 *                                   ▼
 * ┌─────────────────────────────────────────────────────────────────────────┐
 * │ PHASE 3: Reduce (caller thread, index order)                            │
 * │   level distribution, expected rating, std dev, per-measure arrays      │
 * └─────────────────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <p>Each draw reads only its own random stream and shared immutable state,
 * so a run is reproducible from its seed regardless of scheduling. Only the
 * measures carrying a weight are simulated; the others cannot move the
 * composite rating.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * try (SimulationEngine engine = SimulationEngine.builder().policy(policy).build()) {
 *     SimulationResult result = engine.simulate(request);
 *     double p4 = result.distribution().probabilityAtLeast(4);
 * }
 * }</pre>
 */
public final class SimulationEngine implements AutoCloseable {

    private static final Logger logger = LogManager.getLogger(SimulationEngine.class);

    /// Draws per leaf task
    static final int DRAW_BATCH_SIZE = 64;

    private final ForecastPolicy policy;
    private final ForkJoinPool pool;
    private final boolean ownsPool;

    private SimulationEngine(ForecastPolicy policy, ForkJoinPool pool, boolean ownsPool) {
        this.policy = policy;
        this.pool = pool;
        this.ownsPool = ownsPool;
    }

    /** Creates an engine with the default policy. */
    public SimulationEngine() {
        this(ForecastPolicy.defaults(), new ForkJoinPool(ForecastPolicy.defaults().parallelism()), true);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ForecastPolicy policy() {
        return policy;
    }

    /**
     * Runs a simulation.
     *
     * @param request the run parameters
     * @return the result over all completed draws
     * @throws NoDataForContractYearException if the panel has no row for the requested organization and year
     */
    public SimulationResult simulate(SimulationRequest request) {
        Objects.requireNonNull(request, "request cannot be null");
        PanelKey key = PanelKey.of(request.organizationId(), request.year());
        ObservationRow row = request.panel().row(key)
            .orElseThrow(() -> new NoDataForContractYearException(key.organizationId(), key.year()));

        long start = System.nanoTime();
        List<MeasurePlan> plans = plan(request, key, row);
        SimulationDraw[] completed = new SimulationDraw[request.draws()];
        StopCondition stop = new StopCondition(request, start);
        pool.invoke(new DrawRangeTask(request, plans, completed, stop, 0, completed.length));

        SimulationResult result = summarize(request, plans, completed);
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        if (result.cancelled()) {
            logger.info("Simulation for {} stopped after {} of {} draws in {} ms",
                key, result.completedDraws(), result.requestedDraws(), elapsedMs);
        } else {
            logger.info("Simulated {} draws for {} in {} ms: expected {} (sd {}), {} undefined",
                result.completedDraws(), key, elapsedMs, String.format("%.4f", result.expectedRating()),
                String.format("%.4f", result.stdDev()), result.undefinedDraws());
        }
        return result;
    }

    private List<MeasurePlan> plan(SimulationRequest request, PanelKey key, ObservationRow row) {
        double lower = policy.measureLower();
        double range = policy.measureUpper() - lower;
        List<MeasurePlan> plans = new ArrayList<>();
        for (String measure : request.weights().measureKeys()) {
            OptionalDouble observed = row.value(measure);
            DistributionModel model = request.models().get(measure);
            BetaSampler sampler = null;
            if (model != null) {
                try {
                    List<FeatureRef> refs = FeatureDeriver.resolve(measure, model.featureNames());
                    double[] features = FeatureDeriver.featureVector(request.panel(), key, refs);
                    ConditionalBeta conditional = model.conditional(features);
                    sampler = new BetaSampler(conditional);
                } catch (MalformedFeatureException | IllegalArgumentException e) {
                    logger.warn("Cannot sample {} for {}, using observed value: {}", measure, key, e.getMessage());
                }
            }
            plans.add(new MeasurePlan(measure, observed, sampler, request.adjustment(measure),
                lower, range, policy.measureUpper()));
        }
        return plans;
    }

    private SimulationDraw runDraw(SimulationRequest request, List<MeasurePlan> plans, int drawIndex) {
        UniformRandomProvider rng = RandomStreams.forDraw(request.seed(), drawIndex);
        Map<String, MeasureDraw> measures = new LinkedHashMap<>();
        Map<String, OptionalDouble> scores = new LinkedHashMap<>();
        for (MeasurePlan plan : plans) {
            MeasureDraw draw = plan.draw(rng, drawIndex);
            measures.put(plan.measureKey, draw);
            scores.put(plan.measureKey, draw.value());
        }
        Map<String, MeasureRating> ratings =
            ThresholdClassifier.classifyAll(scores, request.thresholds(), request.weights());
        OptionalDouble aggregate = AggregateRating.aggregate(ratings, request.weights());
        return new SimulationDraw(drawIndex, measures, ratings, aggregate);
    }

    private SimulationResult summarize(SimulationRequest request, List<MeasurePlan> plans,
                                       SimulationDraw[] completed) {
        List<SimulationDraw> draws = new ArrayList<>(completed.length);
        for (SimulationDraw draw : completed) {
            if (draw != null) {
                draws.add(draw);
            }
        }

        int n = draws.size();
        double[] ratings = new double[n];
        Map<String, double[]> values = new LinkedHashMap<>();
        long[][] counts = new long[plans.size()][MeasureDraw.Outcome.values().length];
        for (MeasurePlan plan : plans) {
            values.put(plan.measureKey, new double[n]);
        }

        int undefined = 0;
        double sum = 0.0;
        for (int k = 0; k < n; k++) {
            SimulationDraw draw = draws.get(k);
            if (draw.aggregate().isPresent()) {
                ratings[k] = draw.aggregate().getAsDouble();
                sum += ratings[k];
            } else {
                ratings[k] = Double.NaN;
                undefined++;
            }
            for (int m = 0; m < plans.size(); m++) {
                String measure = plans.get(m).measureKey;
                MeasureDraw measureDraw = draw.measures().get(measure);
                values.get(measure)[k] = measureDraw.value().orElse(Double.NaN);
                counts[m][measureDraw.outcome().ordinal()]++;
            }
        }

        int defined = n - undefined;
        double mean = defined > 0 ? sum / defined : Double.NaN;
        double stdDev = Double.NaN;
        if (defined > 0) {
            double squares = 0.0;
            for (double rating : ratings) {
                if (!Double.isNaN(rating)) {
                    squares += (rating - mean) * (rating - mean);
                }
            }
            stdDev = Math.sqrt(squares / defined);
        }

        Map<String, OutcomeCounts> outcomeCounts = new LinkedHashMap<>();
        for (int m = 0; m < plans.size(); m++) {
            long[] c = counts[m];
            outcomeCounts.put(plans.get(m).measureKey, new OutcomeCounts(
                c[MeasureDraw.Outcome.SAMPLED.ordinal()],
                c[MeasureDraw.Outcome.FALLBACK.ordinal()],
                c[MeasureDraw.Outcome.UNAVAILABLE.ordinal()]));
        }

        return new SimulationResult(request.organizationId(), request.year(), request.seed(), request.draws(),
            draws, ratings, undefined, policy.ratingBins().distribution(ratings), mean, stdDev,
            values, outcomeCounts);
    }

    /** Shuts down the pool if this engine owns it. */
    @Override
    public void close() {
        if (ownsPool && !pool.isShutdown()) {
            pool.shutdown();
        }
    }

    /// How one measure is produced in every draw of a run.
    private static final class MeasurePlan {
        private final String measureKey;
        private final OptionalDouble observed;
        private final BetaSampler sampler;
        private final double adjustment;
        private final double lower;
        private final double range;
        private final double upper;

        MeasurePlan(String measureKey, OptionalDouble observed, BetaSampler sampler, double adjustment,
                    double lower, double range, double upper) {
            this.measureKey = measureKey;
            this.observed = observed;
            this.sampler = sampler;
            this.adjustment = adjustment;
            this.lower = lower;
            this.range = range;
            this.upper = upper;
        }

        MeasureDraw draw(UniformRandomProvider rng, int drawIndex) {
            if (sampler == null) {
                return MeasureDraw.fallback(observed);
            }
            double u = rng.nextDouble();
            try {
                double value = lower + range * sampler.sample(u) + adjustment;
                return MeasureDraw.sampled(Math.max(lower, Math.min(upper, value)));
            } catch (ArithmeticException | MathIllegalStateException e) {
                logger.debug("Draw {}: sampling {} failed, falling back: {}", drawIndex, measureKey, e.getMessage());
                return MeasureDraw.fallback(observed);
            }
        }
    }

    private static final class StopCondition {
        private final CancellationToken token;
        private final long startNanos;
        private final long budgetNanos;
        private final AtomicBoolean stopped = new AtomicBoolean();

        StopCondition(SimulationRequest request, long startNanos) {
            this.token = request.cancellationToken().orElse(null);
            this.startNanos = startNanos;
            this.budgetNanos = request.timeBudget().map(Duration::toNanos).orElse(Long.MAX_VALUE);
        }

        boolean shouldStop() {
            if (stopped.get()) {
                return true;
            }
            boolean cancelled = token != null && token.isCancelled();
            if (cancelled || System.nanoTime() - startNanos >= budgetNanos) {
                stopped.set(true);
                return true;
            }
            return false;
        }
    }

    /**
     * Task for a contiguous range of draw indices.
     */
    private final class DrawRangeTask extends RecursiveAction {
        private final SimulationRequest request;
        private final List<MeasurePlan> plans;
        private final SimulationDraw[] completed;
        private final StopCondition stop;
        private final int from;
        private final int to;

        DrawRangeTask(SimulationRequest request, List<MeasurePlan> plans, SimulationDraw[] completed,
                      StopCondition stop, int from, int to) {
            this.request = request;
            this.plans = plans;
            this.completed = completed;
            this.stop = stop;
            this.from = from;
            this.to = to;
        }

        @Override
        protected void compute() {
            if (to - from <= DRAW_BATCH_SIZE) {
                for (int i = from; i < to; i++) {
                    if (stop.shouldStop()) {
                        return;
                    }
                    completed[i] = runDraw(request, plans, i);
                }
                return;
            }
            int mid = (from + to) >>> 1;
            invokeAll(new DrawRangeTask(request, plans, completed, stop, from, mid),
                new DrawRangeTask(request, plans, completed, stop, mid, to));
        }
    }

    /**
     * Builder for engine configuration.
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
         * Uses an existing ForkJoinPool, which the engine will not shut down.
         */
        public Builder pool(ForkJoinPool pool) {
            this.pool = pool;
            return this;
        }

        public SimulationEngine build() {
            if (pool != null) {
                return new SimulationEngine(policy, pool, false);
            }
            int threads = parallelism != null ? parallelism : policy.parallelism();
            return new SimulationEngine(policy, new ForkJoinPool(threads), true);
        }
    }
}
