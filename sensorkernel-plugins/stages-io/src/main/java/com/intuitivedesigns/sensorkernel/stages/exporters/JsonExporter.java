/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.stages.exporters;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.SensorData;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Exports a batch as a JSON array of record maps.
 *
 * <p>Config keys (all overridable per call): {@code export_path}, {@code indent} (default 2; 0
 * writes compact output), {@code sort_keys} (default true), {@code wrap_with_timestamp} (default
 * false; wraps the array as {@code {"timestamp": ..., "data": [...]}}).</p>
 */
public final class JsonExporter extends AbstractFileExporter {

    public static final String CFG_INDENT = "indent";
    public static final String CFG_SORT_KEYS = "sort_keys";
    public static final String CFG_WRAP_WITH_TIMESTAMP = "wrap_with_timestamp";

    private final ObjectMapper mapper = new ObjectMapper();

    public JsonExporter(ConfigSection config) {
        super(config, ".json");
    }

    @Override
    protected void writeTo(Path target, List<SensorData> batch, ConfigSection settings) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>(batch.size());
        for (SensorData record : batch) {
            rows.add(jsonSafe(record.toMap()));
        }

        Object document = rows;
        if (settings.getBoolean(CFG_WRAP_WITH_TIMESTAMP, false)) {
            Map<String, Object> wrapped = new LinkedHashMap<>();
            wrapped.put("timestamp", Instant.now().toString());
            wrapped.put("data", rows);
            document = wrapped;
        }

        writer(settings).writeValue(target.toFile(), document);
    }

    // Leaves Jackson cannot serialize without extra modules (Instant, arrays...) become strings.
    private static Map<String, Object> jsonSafe(Map<?, ?> source) {
        Map<String, Object> out = new LinkedHashMap<>();
        source.forEach((k, v) -> out.put(String.valueOf(k), jsonValue(v)));
        return out;
    }

    private static Object jsonValue(Object v) {
        if (v == null || v instanceof Number || v instanceof CharSequence || v instanceof Boolean) return v;
        if (v instanceof Map<?, ?> m) return jsonSafe(m);
        if (v instanceof Collection<?> c) {
            List<Object> list = new ArrayList<>(c.size());
            for (Object o : c) list.add(jsonValue(o));
            return list;
        }
        return String.valueOf(v);
    }

    private ObjectWriter writer(ConfigSection settings) {
        ObjectWriter writer = mapper.writer();
        if (settings.getBoolean(CFG_SORT_KEYS, true)) {
            writer = writer.with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        }
        if (settings.getInt(CFG_INDENT, 2) > 0) {
            writer = writer.with(SerializationFeature.INDENT_OUTPUT);
        }
        return writer;
    }
}
