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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.starcast.models.beta.BetaRegressionModel;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON persistence for fitted model sets.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "models": [
 *     {
 *       "type": "beta_regression",
 *       "measure_key": "C: Breast Cancer Screening",
 *       "feature_names": ["C: Breast Cancer Screening_lag1", ...],
 *       "feature_center": [71.2, ...],
 *       "feature_scale": [8.4, ...],
 *       "mean_coefficients": [0.91, 0.62, ...],
 *       "precision_coefficients": [3.1, 0.0, ...],
 *       "observation_count": 412,
 *       "log_likelihood": 318.6
 *     }
 *   ]
 * }
 * }</pre>
 */
public final class DistributionModels {

    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .create();

    @SerializedName("models")
    private List<ModelConfig> models = new ArrayList<>();

    private DistributionModels() {
    }

    /**
     * Configuration for a single fitted model.
     */
    static final class ModelConfig {
        @SerializedName("type")
        String type;

        @SerializedName("measure_key")
        String measureKey;

        @SerializedName("feature_names")
        List<String> featureNames;

        @SerializedName("feature_center")
        double[] featureCenter;

        @SerializedName("feature_scale")
        double[] featureScale;

        @SerializedName("mean_coefficients")
        double[] meanCoefficients;

        @SerializedName("precision_coefficients")
        double[] precisionCoefficients;

        @SerializedName("observation_count")
        int observationCount;

        @SerializedName("log_likelihood")
        double logLikelihood;

        static ModelConfig from(DistributionModel model) {
            if (!(model instanceof BetaRegressionModel)) {
                throw new IllegalArgumentException("Cannot serialize model type " + model.getClass().getName());
            }
            BetaRegressionModel beta = (BetaRegressionModel) model;
            ModelConfig config = new ModelConfig();
            config.type = BetaRegressionModel.MODEL_TYPE;
            config.measureKey = beta.measureKey();
            config.featureNames = beta.featureNames();
            config.featureCenter = beta.center();
            config.featureScale = beta.scale();
            config.meanCoefficients = beta.meanCoefficients();
            config.precisionCoefficients = beta.precisionCoefficients();
            config.observationCount = beta.observationCount();
            config.logLikelihood = beta.logLikelihood();
            return config;
        }

        DistributionModel toModel() {
            if (!BetaRegressionModel.MODEL_TYPE.equals(type)) {
                throw new JsonParseException("Unknown model type: " + type);
            }
            if (measureKey == null || featureNames == null || featureCenter == null || featureScale == null
                || meanCoefficients == null || precisionCoefficients == null) {
                throw new JsonParseException("Incomplete model entry for " + measureKey);
            }
            return new BetaRegressionModel(measureKey, featureNames, featureCenter, featureScale,
                meanCoefficients, precisionCoefficients, observationCount, logLikelihood);
        }
    }

    public static String toJson(Map<String, DistributionModel> models) {
        DistributionModels document = new DistributionModels();
        for (DistributionModel model : models.values()) {
            document.models.add(ModelConfig.from(model));
        }
        return GSON.toJson(document);
    }

    public static void write(Map<String, DistributionModel> models, Writer writer) throws IOException {
        writer.write(toJson(models));
        writer.flush();
    }

    public static void save(Map<String, DistributionModel> models, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path)) {
            write(models, writer);
        }
    }

    /**
     * Reads a model set.
     *
     * @return models keyed by measure, in document order
     * @throws JsonParseException if the document is malformed or names an unknown model type
     */
    public static Map<String, DistributionModel> fromJson(String json) {
        return toModels(GSON.fromJson(json, DistributionModels.class));
    }

    public static Map<String, DistributionModel> fromJson(Reader reader) {
        return toModels(GSON.fromJson(reader, DistributionModels.class));
    }

    public static Map<String, DistributionModel> load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        }
    }

    private static Map<String, DistributionModel> toModels(DistributionModels document) {
        if (document == null || document.models == null) {
            throw new JsonParseException("Empty model document");
        }
        Map<String, DistributionModel> models = new LinkedHashMap<>();
        for (ModelConfig config : document.models) {
            DistributionModel model;
            try {
                model = config.toModel();
            } catch (IllegalArgumentException e) {
                throw new JsonParseException("Invalid model entry for " + config.measureKey + ": " + e.getMessage(), e);
            }
            if (models.putIfAbsent(model.measureKey(), model) != null) {
                throw new JsonParseException("Duplicate model for " + model.measureKey());
            }
        }
        return models;
    }
}
