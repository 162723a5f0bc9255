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

package io.starcast.ratings.panel;

import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Measure key conventions shared by data rows, weights and threshold tables.
///
/// Cut-point tables name measures with a numbered prefix such as
/// `C01: Breast Cancer Screening`, while panel columns use the collapsed
/// form `C: Breast Cancer Screening`. [#collapse(String)] maps the former
/// to the latter so lookups agree.
public final class MeasureKeys {

    /// Prefix used by Part C measure columns
    public static final String PART_C_PREFIX = "C:";

    private static final Pattern NUMERIC = Pattern.compile("^\\s*(-?\\d+(?:\\.\\d+)?)\\s*%?\\s*$");

    private MeasureKeys() {
    }

    /// Collapses a numbered measure identifier to its category-letter form.
    ///
    /// `C01: Breast Cancer Screening` becomes `C: Breast Cancer Screening`.
    /// Keys without a colon are returned trimmed.
    ///
    /// @param measureId the raw measure identifier
    /// @return the collapsed key
    public static String collapse(String measureId) {
        Objects.requireNonNull(measureId, "measureId cannot be null");
        String trimmed = measureId.trim();
        int colon = trimmed.indexOf(':');
        if (colon <= 0) {
            return trimmed;
        }
        String name = trimmed.substring(colon + 1);
        int nextColon = name.indexOf(':');
        if (nextColon >= 0) {
            name = name.substring(0, nextColon);
        }
        return trimmed.charAt(0) + ":" + name;
    }

    /// Returns true if the column name follows the Part C measure convention.
    public static boolean isPartCMeasure(String column) {
        return column != null && column.startsWith(PART_C_PREFIX);
    }

    /// Parses a raw cell into a measure value.
    ///
    /// Plain numbers and percentages parse; anything else (blank cells,
    /// "Not enough data available", "Plan too new to be measured") is missing.
    ///
    /// @param raw the raw cell text, may be null
    /// @return the parsed value, or empty when the cell carries no number
    public static OptionalDouble parseValue(String raw) {
        if (raw == null) {
            return OptionalDouble.empty();
        }
        Matcher matcher = NUMERIC.matcher(raw.toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            return OptionalDouble.empty();
        }
        double value = Double.parseDouble(matcher.group(1));
        return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
    }
}
