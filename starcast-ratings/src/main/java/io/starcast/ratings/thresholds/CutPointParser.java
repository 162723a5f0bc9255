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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Builds [ThresholdTables] from the textual cut points of a star-ratings sheet.
///
/// # Cell formats
///
/// ```text
///   "< 53 %"               → (-∞, 53)
///   ">= 53 % to < 67 %"    → [53, 67)
///   ">= -0.179809 to < 0"  → [-0.179809, 0)
///   ">= 85 %"              → [85, +∞)
///   "> -0.5"               → [-0.5, +∞)
///   "100 %"                → [100, 100)
/// ```
///
/// A cell that cannot be parsed is logged and skipped; the rest of the
/// measure and the rest of the sheet still load. A measure whose surviving
/// bands do not form a valid [ThresholdTable] is dropped with a warning.
public final class CutPointParser {

    private static final Logger logger = LogManager.getLogger(CutPointParser.class);

    private static final Pattern LOWER = Pattern.compile(">=?\\s*(-?\\d+\\.?\\d*)");
    private static final Pattern UPPER = Pattern.compile("<=?\\s*(-?\\d+\\.?\\d*)");
    private static final Pattern LEVEL_LABEL = Pattern.compile("^\\s*(\\d+)\\s*stars?\\s*$");

    private CutPointParser() {
    }

    /// Parses one cut-point cell into a band for the given level.
    ///
    /// @param cell the raw cell text, may be null or blank
    /// @param level the star level of the row the cell came from
    /// @return the band, or empty for a blank cell
    /// @throws IllegalArgumentException if the cell is not a recognized cut point
    public static Optional<ThresholdBand> parseBand(String cell, int level) {
        if (cell == null || cell.isBlank()) {
            return Optional.empty();
        }
        String text = cell.replace("%", "").trim();

        if (text.contains("to")) {
            String[] parts = text.split("to", 2);
            double lower = firstNumber(LOWER, parts[0], cell);
            double upper = firstNumber(UPPER, parts[1], cell);
            return Optional.of(new ThresholdBand(lower, upper, level));
        }
        if (text.startsWith("<")) {
            return Optional.of(new ThresholdBand(Double.NEGATIVE_INFINITY, firstNumber(UPPER, text, cell), level));
        }
        if (text.startsWith(">")) {
            return Optional.of(new ThresholdBand(firstNumber(LOWER, text, cell), Double.POSITIVE_INFINITY, level));
        }
        if (text.startsWith("100")) {
            return Optional.of(new ThresholdBand(100, 100, level));
        }
        throw new IllegalArgumentException("Unexpected threshold format: " + cell);
    }

    /// Parses the star level from a row label such as `1star` or `4 stars`.
    ///
    /// @return the level, or empty if the label is not a star row
    public static Optional<Integer> parseLevel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        Matcher matcher = LEVEL_LABEL.matcher(label.toLowerCase(Locale.ROOT));
        if (!matcher.matches()) {
            return Optional.empty();
        }
        int level = Integer.parseInt(matcher.group(1));
        if (level < ThresholdTable.MIN_LEVEL || level > ThresholdTable.MAX_LEVEL) {
            return Optional.empty();
        }
        return Optional.of(level);
    }

    /// Builds threshold tables from the star rows of a cut-point sheet.
    ///
    /// Rows whose label is not a star level are ignored.
    ///
    /// @param rows the sheet rows
    /// @return tables for every measure with at least one valid band
    public static ThresholdTables parse(List<CutPointRow> rows) {
        Map<String, List<ThresholdBand>> bandsByMeasure = new LinkedHashMap<>();
        for (CutPointRow row : rows) {
            Optional<Integer> level = parseLevel(row.label());
            if (level.isEmpty()) {
                continue;
            }
            for (Map.Entry<String, String> cell : row.cells().entrySet()) {
                String measure = cell.getKey();
                try {
                    parseBand(cell.getValue(), level.get()).ifPresent(band ->
                        bandsByMeasure.computeIfAbsent(measure, k -> new ArrayList<>()).add(band));
                } catch (IllegalArgumentException e) {
                    logger.warn("Could not parse threshold '{}' for {}: {}", cell.getValue(), measure, e.getMessage());
                }
            }
        }

        List<ThresholdTable> tables = new ArrayList<>();
        for (Map.Entry<String, List<ThresholdBand>> entry : bandsByMeasure.entrySet()) {
            try {
                ThresholdTable table = new ThresholdTable(entry.getKey(), entry.getValue());
                if (!table.isContiguous()) {
                    logger.warn("Threshold bands for {} leave gaps: {}", entry.getKey(), table.bands());
                }
                tables.add(table);
            } catch (IllegalArgumentException e) {
                logger.warn("Dropping thresholds for {}: {}", entry.getKey(), e.getMessage());
            }
        }
        logger.debug("Parsed thresholds for {} measures", tables.size());
        return ThresholdTables.of(tables);
    }

    private static double firstNumber(Pattern pattern, String text, String cell) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) {
            throw new IllegalArgumentException("Could not parse threshold: " + cell);
        }
        return Double.parseDouble(matcher.group(1));
    }
}
