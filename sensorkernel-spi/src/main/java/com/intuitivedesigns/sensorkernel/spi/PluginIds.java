/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.sensorkernel.spi;

import java.util.Locale;

public final class PluginIds {
    private PluginIds() {}

    /**
     * Registry key form of a plugin name: trimmed and lower-cased.
     */
    public static String normalize(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * {@code csv_decoder}, {@code csv-decoder} and {@code csvDecoder} all become {@code CsvDecoder}.
     */
    public static String pascalCase(String s) {
        if (s == null) return "";
        StringBuilder out = new StringBuilder(s.length());
        boolean upperNext = true;
        for (char c : s.trim().toCharArray()) {
            if (c == '_' || c == '-' || c == ' ') {
                upperNext = true;
            } else if (upperNext) {
                out.append(Character.toUpperCase(c));
                upperNext = false;
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }
}
