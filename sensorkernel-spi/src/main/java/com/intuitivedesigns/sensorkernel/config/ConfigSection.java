/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Read-only view over one mapping of the configuration tree.
 *
 * <p>Keys are looked up literally first and then as dotted paths ({@code "system.max_pipelines"})
 * through nested mappings. Typed getters never throw on malformed values: a value that cannot be
 * converted yields the supplied default, the same contract the plain property getters had.</p>
 */
public final class ConfigSection {

    private static final ConfigSection EMPTY = new ConfigSection(Map.of());

    private final Map<String, Object> values;

    public ConfigSection(Map<String, ?> values) {
        this.values = values == null || values.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<String, Object>(values));
    }

    public static ConfigSection empty() {
        return EMPTY;
    }

    public static ConfigSection of(Map<String, ?> values) {
        return values == null || values.isEmpty() ? EMPTY : new ConfigSection(values);
    }

    // -------------------------------------------------------------------------
    // Raw access
    // -------------------------------------------------------------------------

    public Object get(String key) {
        if (key == null) return null;
        if (values.containsKey(key)) return values.get(key);

        int dot = key.indexOf('.');
        if (dot <= 0) return null;

        Object head = values.get(key.substring(0, dot));
        if (head instanceof Map<?, ?> nested) {
            return asSection(nested).get(key.substring(dot + 1));
        }
        return null;
    }

    public boolean hasPath(String key) {
        return get(key) != null;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    // -------------------------------------------------------------------------
    // Typed getters
    // -------------------------------------------------------------------------

    public String getString(String key, String defaultValue) {
        Object val = get(key);
        if (val == null || val instanceof Map || val instanceof List) return defaultValue;
        return String.valueOf(val);
    }

    public int getInt(String key, int defaultValue) {
        Object val = get(key);
        if (val instanceof Number n) return n.intValue();
        if (val == null) return defaultValue;
        try {
            return Integer.parseInt(val.toString().trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        Object val = get(key);
        if (val instanceof Number n) return n.longValue();
        if (val == null) return defaultValue;
        try {
            return Long.parseLong(val.toString().trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        Object val = get(key);
        if (val instanceof Number n) return n.doubleValue();
        if (val == null) return defaultValue;
        try {
            return Double.parseDouble(val.toString().trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object val = get(key);
        if (val instanceof Boolean b) return b;
        if (val == null) return defaultValue;
        String text = val.toString().trim().toLowerCase(Locale.ROOT);
        return switch (text) {
            case "true", "yes", "on", "1" -> true;
            case "false", "no", "off", "0" -> false;
            default -> defaultValue;
        };
    }

    /**
     * A scalar becomes a one-element list; null entries are skipped.
     */
    public List<String> getStringList(String key) {
        Object val = get(key);
        if (val == null) return List.of();
        if (val instanceof List<?> list) {
            List<String> out = new ArrayList<>(list.size());
            for (Object o : list) {
                if (o != null) out.add(String.valueOf(o));
            }
            return Collections.unmodifiableList(out);
        }
        return List.of(String.valueOf(val));
    }

    /**
     * Raw list value, or a one-element list for a scalar or mapping. Never null.
     */
    public List<Object> getList(String key) {
        Object val = get(key);
        if (val == null) return List.of();
        if (val instanceof List<?> list) {
            return Collections.unmodifiableList(new ArrayList<Object>(list));
        }
        return List.of(val);
    }

    // -------------------------------------------------------------------------
    // Nesting
    // -------------------------------------------------------------------------

    /**
     * Nested mapping under {@code key}; empty when absent or not a mapping.
     */
    public ConfigSection section(String key) {
        Object val = get(key);
        return val instanceof Map<?, ?> nested ? asSection(nested) : EMPTY;
    }

    /**
     * Returns a section where entries of {@code overrides} replace entries of this one.
     */
    public ConfigSection merge(ConfigSection overrides) {
        if (overrides == null || overrides.isEmpty()) return this;
        if (isEmpty()) return overrides;
        Map<String, Object> merged = new LinkedHashMap<>(values);
        merged.putAll(overrides.values);
        return new ConfigSection(merged);
    }

    public Map<String, Object> asMap() {
        return values;
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public static ConfigSection asSection(Map<?, ?> raw) {
        if (raw.isEmpty()) return EMPTY;
        Map<String, Object> copy = new LinkedHashMap<>();
        raw.forEach((k, v) -> copy.put(String.valueOf(k), v));
        return new ConfigSection(copy);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ConfigSection other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "ConfigSection" + values;
    }
}
