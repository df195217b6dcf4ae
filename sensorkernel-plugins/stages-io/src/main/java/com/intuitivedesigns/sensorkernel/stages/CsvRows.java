/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.stages;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Delimited-text helpers shared by the CSV writer and exporter.
 */
public final class CsvRows {

    private CsvRows() {}

    /**
     * Joins cells with {@code delimiter}, quoting any cell that contains the delimiter, a quote or
     * a line break.
     */
    public static String join(List<?> cells, String delimiter) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) sb.append(delimiter);
            sb.append(escape(cells.get(i), delimiter));
        }
        return sb.toString();
    }

    public static String escape(Object value, String delimiter) {
        if (value == null) return "";
        String text = format(value);
        boolean quote = text.contains(delimiter) || text.indexOf('"') >= 0
                || text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0;
        if (!quote) return text;
        return '"' + text.replace("\"", "\"\"") + '"';
    }

    // Plain notation, so epoch seconds are not written as 1.7E9
    private static String format(Object value) {
        if (value instanceof Double d && Double.isFinite(d)) {
            return BigDecimal.valueOf(d).toPlainString();
        }
        return String.valueOf(value);
    }

    /**
     * Flattens nested maps into dotted keys ({@code values.temp}). Empty maps produce no key; lists
     * are kept as leaf values.
     */
    public static Map<String, Object> flatten(Map<String, ?> source) {
        Map<String, Object> out = new LinkedHashMap<>();
        flatten("", source, out);
        return out;
    }

    private static void flatten(String prefix, Map<?, ?> source, Map<String, Object> out) {
        for (Map.Entry<?, ?> e : source.entrySet()) {
            String key = prefix.isEmpty() ? String.valueOf(e.getKey()) : prefix + "." + e.getKey();
            if (e.getValue() instanceof Map<?, ?> nested) {
                flatten(key, nested, out);
            } else {
                out.put(key, e.getValue());
            }
        }
    }
}
