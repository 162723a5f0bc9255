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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.ToLongFunction;

/// Memoizes fitted model sets per panel version.
///
/// One entry is kept per requested measure and feature list, holding the
/// latest panel it was fitted on. A lookup hits only when the panel has the
/// same fingerprint and the same rows as that panel; any other panel refits
/// and replaces the entry, so older panel versions are released.
public final class ModelCache {

    private static final Logger logger = LogManager.getLogger(ModelCache.class);

    private final ModelFitter fitter;
    private final ToLongFunction<ObservationPanel> versions;
    private final ConcurrentMap<Request, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public ModelCache(ModelFitter fitter) {
        this(fitter, ObservationPanel::fingerprint);
    }

    ModelCache(ModelFitter fitter, ToLongFunction<ObservationPanel> versions) {
        this.fitter = Objects.requireNonNull(fitter, "fitter cannot be null");
        this.versions = Objects.requireNonNull(versions, "versions cannot be null");
    }

    /// Returns cached models for the panel, fitting them when the panel differs
    /// from the one last fitted for this request.
    public FitBatchResult getOrFit(ObservationPanel panel, List<String> measureKeys, List<String> featureKeys) {
        Objects.requireNonNull(panel, "panel cannot be null");
        Request request = new Request(List.copyOf(measureKeys), List.copyOf(featureKeys));
        long version = versions.applyAsLong(panel);
        Entry cached = entries.get(request);
        if (cached != null && cached.matches(panel, version)) {
            hits.incrementAndGet();
            return cached.result;
        }
        return entries.compute(request, (r, existing) -> {
            if (existing != null && existing.matches(panel, version)) {
                hits.incrementAndGet();
                return existing;
            }
            misses.incrementAndGet();
            logger.debug("Fitting models for panel {} ({} measures)", Long.toHexString(version), r.measureKeys.size());
            return new Entry(panel, version, fitter.fitModels(panel, r.measureKeys, r.featureKeys));
        }).result;
    }

    public void invalidate() {
        entries.clear();
    }

    public int size() {
        return entries.size();
    }

    public long hits() {
        return hits.get();
    }

    public long misses() {
        return misses.get();
    }

    private record Request(List<String> measureKeys, List<String> featureKeys) {
    }

    private record Entry(ObservationPanel panel, long version, FitBatchResult result) {

        boolean matches(ObservationPanel candidate, long candidateVersion) {
            return version == candidateVersion && (panel == candidate || panel.equals(candidate));
        }
    }
}
