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

package io.starcast.ratings.thresholds;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// One row of a cut-point sheet: a label such as `3stars` and the cut-point
/// text for each measure column, e.g. `>= 53 % to < 67 %`.
///
/// @param label the row label from the first column
/// @param cells measure identifier to raw cut-point text, in column order
public record CutPointRow(String label, Map<String, String> cells) {

    public CutPointRow {
        Objects.requireNonNull(label, "label cannot be null");
        Objects.requireNonNull(cells, "cells cannot be null");
        cells = Collections.unmodifiableMap(new LinkedHashMap<>(cells));
    }
}
