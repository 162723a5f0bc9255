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

package io.starcast.ratings.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.starcast.ratings.distribution.RatingBins;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON-serializable forecasting policy.
 *
 * <h2>JSON Schema</h2>
 *
 * <p>Every field is optional; absent fields take the defaults shown.
 * <pre>{@code
 * {
 *   "rating_cutoffs": [1.75, 2.75, 3.25, 3.75, 4.25, 4.75],
 *   "rating_bins": [1, 2, 3, 3, 4, 4, 5],
 *   "min_observations": 10,
 *   "boundary_epsilon": 0.0001,
 *   "measure_lower": 0.0,
 *   "measure_upper": 100.0,
 *   "default_draws": 1000,
 *   "seed": 42,
 *   "parallelism": 0,             // 0 means available processors
 *   "max_fit_evaluations": 20000,
 *   "cost_per_point": 10000.0,
 *   "high_weight_threshold": 3.0,
 *   "improvement_points": 1.0
 * }
 * }</pre>
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * ForecastPolicy policy = ForecastPolicy.load(Path.of("policy.json"));
 * ForecastPolicy tuned = ForecastPolicy.builder().defaultDraws(10_000).seed(7).build();
 * }</pre>
 */
public final class ForecastPolicy {

    /** Bundled default policy resource */
    public static final String DEFAULT_RESOURCE = "/starcast-policy.json";

    public static final int DEFAULT_MIN_OBSERVATIONS = 10;
    public static final double DEFAULT_BOUNDARY_EPSILON = 1e-4;
    public static final double DEFAULT_MEASURE_LOWER = 0.0;
    public static final double DEFAULT_MEASURE_UPPER = 100.0;
    public static final int DEFAULT_DRAWS = 1000;
    public static final long DEFAULT_SEED = 42L;
    public static final int DEFAULT_MAX_FIT_EVALUATIONS = 20_000;
    public static final double DEFAULT_COST_PER_POINT = 10_000.0;
    public static final double DEFAULT_HIGH_WEIGHT_THRESHOLD = 3.0;
    public static final double DEFAULT_IMPROVEMENT_POINTS = 1.0;

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .create();

    @SerializedName("rating_cutoffs")
    private double[] ratingCutoffs;

    @SerializedName("rating_bins")
    private int[] ratingBins;

    @SerializedName("min_observations")
    private Integer minObservations;

    @SerializedName("boundary_epsilon")
    private Double boundaryEpsilon;

    @SerializedName("measure_lower")
    private Double measureLower;

    @SerializedName("measure_upper")
    private Double measureUpper;

    @SerializedName("default_draws")
    private Integer defaultDraws;

    @SerializedName("seed")
    private Long seed;

    /** Worker threads for fitting and simulation; 0 or absent means available processors */
    @SerializedName("parallelism")
    private Integer parallelism;

    @SerializedName("max_fit_evaluations")
    private Integer maxFitEvaluations;

    @SerializedName("cost_per_point")
    private Double costPerPoint;

    @SerializedName("high_weight_threshold")
    private Double highWeightThreshold;

    @SerializedName("improvement_points")
    private Double improvementPoints;

    private transient RatingBins bins;

    ForecastPolicy() {
    }

    /** Returns a policy with every field at its default. */
    public static ForecastPolicy defaults() {
        return new ForecastPolicy().validate();
    }

    /**
     * Loads the policy bundled on the classpath.
     *
     * @return the bundled policy
     * @throws UncheckedIOException if the resource cannot be read
     */
    public static ForecastPolicy bundled() {
        InputStream in = ForecastPolicy.class.getResourceAsStream(DEFAULT_RESOURCE);
        if (in == null) {
            throw new UncheckedIOException(new IOException("Missing classpath resource " + DEFAULT_RESOURCE));
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static ForecastPolicy fromJson(String json) {
        return fromParsed(GSON.fromJson(json, ForecastPolicy.class));
    }

    public static ForecastPolicy fromJson(Reader reader) {
        return fromParsed(GSON.fromJson(reader, ForecastPolicy.class));
    }

    public static ForecastPolicy load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        }
    }

    private static ForecastPolicy fromParsed(ForecastPolicy policy) {
        if (policy == null) {
            throw new JsonParseException("Empty forecast policy document");
        }
        return policy.validate();
    }

    public String toJson() {
        ForecastPolicy resolved = new ForecastPolicy();
        resolved.ratingCutoffs = bins.cutoffs();
        resolved.ratingBins = bins.intervalLevels();
        resolved.minObservations = minObservations();
        resolved.boundaryEpsilon = boundaryEpsilon();
        resolved.measureLower = measureLower();
        resolved.measureUpper = measureUpper();
        resolved.defaultDraws = defaultDraws();
        resolved.seed = seed();
        resolved.parallelism = parallelism;
        resolved.maxFitEvaluations = maxFitEvaluations();
        resolved.costPerPoint = costPerPoint();
        resolved.highWeightThreshold = highWeightThreshold();
        resolved.improvementPoints = improvementPoints();
        return GSON.toJson(resolved);
    }

    public void save(Path path) throws IOException {
        Files.writeString(path, toJson());
    }

    private ForecastPolicy validate() {
        double[] cutoffs = ratingCutoffs != null ? ratingCutoffs : RatingBins.DEFAULT_CUTOFFS;
        int[] levels = ratingBins != null ? ratingBins : RatingBins.DEFAULT_INTERVAL_LEVELS;
        this.bins = new RatingBins(cutoffs, levels);
        if (minObservations() < 1) {
            throw new IllegalArgumentException("min_observations must be positive, got: " + minObservations);
        }
        double eps = boundaryEpsilon();
        if (!(eps > 0.0) || eps >= 0.5) {
            throw new IllegalArgumentException("boundary_epsilon must be in (0, 0.5), got: " + eps);
        }
        if (!(measureLower() < measureUpper())) {
            throw new IllegalArgumentException(String.format(
                "measure_lower (%s) must be below measure_upper (%s)", measureLower(), measureUpper()));
        }
        if (defaultDraws() < 1) {
            throw new IllegalArgumentException("default_draws must be positive, got: " + defaultDraws);
        }
        if (parallelism != null && parallelism < 0) {
            throw new IllegalArgumentException("parallelism cannot be negative, got: " + parallelism);
        }
        if (maxFitEvaluations() < 1) {
            throw new IllegalArgumentException("max_fit_evaluations must be positive, got: " + maxFitEvaluations);
        }
        if (!(costPerPoint() >= 0.0) || Double.isInfinite(costPerPoint())) {
            throw new IllegalArgumentException("cost_per_point must be finite and non-negative, got: " + costPerPoint);
        }
        if (!(improvementPoints() > 0.0)) {
            throw new IllegalArgumentException("improvement_points must be positive, got: " + improvementPoints);
        }
        return this;
    }

    public RatingBins ratingBins() {
        return bins;
    }

    public int minObservations() {
        return minObservations != null ? minObservations : DEFAULT_MIN_OBSERVATIONS;
    }

    public double boundaryEpsilon() {
        return boundaryEpsilon != null ? boundaryEpsilon : DEFAULT_BOUNDARY_EPSILON;
    }

    public double measureLower() {
        return measureLower != null ? measureLower : DEFAULT_MEASURE_LOWER;
    }

    public double measureUpper() {
        return measureUpper != null ? measureUpper : DEFAULT_MEASURE_UPPER;
    }

    public int defaultDraws() {
        return defaultDraws != null ? defaultDraws : DEFAULT_DRAWS;
    }

    public long seed() {
        return seed != null ? seed : DEFAULT_SEED;
    }

    /** Resolved worker count, never below 1. */
    public int parallelism() {
        if (parallelism == null || parallelism == 0) {
            return Runtime.getRuntime().availableProcessors();
        }
        return parallelism;
    }

    public int maxFitEvaluations() {
        return maxFitEvaluations != null ? maxFitEvaluations : DEFAULT_MAX_FIT_EVALUATIONS;
    }

    public double costPerPoint() {
        return costPerPoint != null ? costPerPoint : DEFAULT_COST_PER_POINT;
    }

    public double highWeightThreshold() {
        return highWeightThreshold != null ? highWeightThreshold : DEFAULT_HIGH_WEIGHT_THRESHOLD;
    }

    public double improvementPoints() {
        return improvementPoints != null ? improvementPoints : DEFAULT_IMPROVEMENT_POINTS;
    }

    /** Returns a builder seeded with this policy's explicit settings. */
    public Builder toBuilder() {
        Builder builder = new Builder();
        copySettings(this, builder.policy);
        builder.policy.ratingCutoffs = bins.cutoffs();
        builder.policy.ratingBins = bins.intervalLevels();
        return builder;
    }

    private static void copySettings(ForecastPolicy from, ForecastPolicy to) {
        to.ratingCutoffs = from.ratingCutoffs;
        to.ratingBins = from.ratingBins;
        to.minObservations = from.minObservations;
        to.boundaryEpsilon = from.boundaryEpsilon;
        to.measureLower = from.measureLower;
        to.measureUpper = from.measureUpper;
        to.defaultDraws = from.defaultDraws;
        to.seed = from.seed;
        to.parallelism = from.parallelism;
        to.maxFitEvaluations = from.maxFitEvaluations;
        to.costPerPoint = from.costPerPoint;
        to.highWeightThreshold = from.highWeightThreshold;
        to.improvementPoints = from.improvementPoints;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ForecastPolicy{bins=" + bins
            + ", minObservations=" + minObservations()
            + ", draws=" + defaultDraws()
            + ", seed=" + seed()
            + ", costPerPoint=" + costPerPoint()
            + '}';
    }

    public static final class Builder {
        private final ForecastPolicy policy = new ForecastPolicy();

        private Builder() {
        }

        public Builder ratingBins(double[] cutoffs, int[] intervalLevels) {
            policy.ratingCutoffs = cutoffs.clone();
            policy.ratingBins = intervalLevels.clone();
            return this;
        }

        public Builder minObservations(int minObservations) {
            policy.minObservations = minObservations;
            return this;
        }

        public Builder boundaryEpsilon(double boundaryEpsilon) {
            policy.boundaryEpsilon = boundaryEpsilon;
            return this;
        }

        public Builder measureDomain(double lower, double upper) {
            policy.measureLower = lower;
            policy.measureUpper = upper;
            return this;
        }

        public Builder defaultDraws(int draws) {
            policy.defaultDraws = draws;
            return this;
        }

        public Builder seed(long seed) {
            policy.seed = seed;
            return this;
        }

        public Builder parallelism(int parallelism) {
            policy.parallelism = parallelism;
            return this;
        }

        public Builder maxFitEvaluations(int maxFitEvaluations) {
            policy.maxFitEvaluations = maxFitEvaluations;
            return this;
        }

        public Builder costPerPoint(double costPerPoint) {
            policy.costPerPoint = costPerPoint;
            return this;
        }

        public Builder highWeightThreshold(double threshold) {
            policy.highWeightThreshold = threshold;
            return this;
        }

        public Builder improvementPoints(double points) {
            policy.improvementPoints = points;
            return this;
        }

        /**
         * @throws IllegalArgumentException if a setting is out of range
         */
        public ForecastPolicy build() {
            ForecastPolicy built = new ForecastPolicy();
            copySettings(policy, built);
            return built.validate();
        }
    }
}
