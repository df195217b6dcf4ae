/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.stages.exporters;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.SensorData;
import com.intuitivedesigns.sensorkernel.stages.CsvRows;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Exports a batch as delimited text. Each record is flattened to dotted columns
 * ({@code values.temp}, {@code metadata.anomaly}); the header is the union of columns in order of
 * first appearance.
 *
 * <p>Config keys: {@code export_path}, {@code delimiter} (default ","), {@code include_header}
 * (default true).</p>
 */
public final class CsvExporter extends AbstractFileExporter {

    public static final String CFG_DELIMITER = "delimiter";
    public static final String CFG_INCLUDE_HEADER = "include_header";

    public CsvExporter(ConfigSection config) {
        super(config, ".csv");
    }

    @Override
    protected void writeTo(Path target, List<SensorData> batch, ConfigSection settings) throws IOException {
        String delimiter = settings.getString(CFG_DELIMITER, ",");
        if (delimiter.isEmpty()) delimiter = ",";

        List<Map<String, Object>> rows = new ArrayList<>(batch.size());
        Set<String> columns = new LinkedHashSet<>();
        for (SensorData record : batch) {
            Map<String, Object> row = CsvRows.flatten(record.toMap());
            columns.addAll(row.keySet());
            rows.add(row);
        }

        try (BufferedWriter out = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            if (settings.getBoolean(CFG_INCLUDE_HEADER, true) && !columns.isEmpty()) {
                out.write(CsvRows.join(new ArrayList<>(columns), delimiter));
                out.write('\n');
            }
            for (Map<String, Object> row : rows) {
                List<Object> cells = new ArrayList<>(columns.size());
                for (String column : columns) {
                    cells.add(row.get(column));
                }
                out.write(CsvRows.join(cells, delimiter));
                out.write('\n');
            }
        }
    }
}
