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

import io.starcast.ratings.panel.ObservationPanel;

import java.util.List;

/// Fits distribution models for a set of measures from a historical panel.
public interface ModelFitter {

    /// Fits one model per measure.
    ///
    /// @param panel the historical panel
    /// @param measureKeys measures to model
    /// @param featureKeys feature names shared by every model; empty to use each
    ///                    measure's own trend features
    /// @return models, skipped measures and per-measure failures
    FitBatchResult fitModels(ObservationPanel panel, List<String> measureKeys, List<String> featureKeys);
}
