/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.stages.writers;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.ConfigurationException;
import com.intuitivedesigns.sensorkernel.core.SensorData;
import com.intuitivedesigns.sensorkernel.core.StatusReporter;
import com.intuitivedesigns.sensorkernel.core.Writer;
import com.intuitivedesigns.sensorkernel.stages.CsvRows;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Appends records to a delimited text file.
 *
 * <p>The column layout is fixed by the first record: {@code timestamp}, {@code sensor_id},
 * {@code data_type}, then that record's value channels. Channels missing from a later record are
 * written empty; channels it adds are ignored. A header row is written when the file is new or
 * empty.</p>
 *
 * <p>Config keys: {@code output_path} (required), {@code append} (default true),
 * {@code delimiter} (default ","), {@code data_types} (only records of these data types are
 * written; default all).</p>
 */
public final class CsvFileWriter implements Writer, StatusReporter {

    private static final Logger log = LoggerFactory.getLogger(CsvFileWriter.class);

    public static final String CFG_OUTPUT_PATH = "output_path";
    public static final String CFG_APPEND = "append";
    public static final String CFG_DELIMITER = "delimiter";
    public static final String CFG_DATA_TYPES = "data_types";

    private static final List<String> FIXED_COLUMNS = List.of("timestamp", "sensor_id", "data_type");

    private final Path path;
    private final boolean append;
    private final String delimiter;
    private final Set<String> dataTypes;

    private BufferedWriter out;
    private List<String> channels;
    private boolean headerPending;
    private long rows;
    private long bytes;

    public CsvFileWriter(ConfigSection config) {
        String outputPath = config.getString(CFG_OUTPUT_PATH, "").trim();
        if (outputPath.isEmpty()) {
            throw new ConfigurationException("CSV writer requires '" + CFG_OUTPUT_PATH + "'");
        }
        this.path = Paths.get(outputPath);
        this.append = config.getBoolean(CFG_APPEND, true);
        String delim = config.getString(CFG_DELIMITER, ",");
        this.delimiter = delim.isEmpty() ? "," : delim;
        this.dataTypes = Set.copyOf(config.getStringList(CFG_DATA_TYPES));
    }

    @Override
    public synchronized void open() throws IOException {
        if (out != null) return;
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        boolean existing = append && Files.exists(path) && Files.size(path) > 0;
        out = append
                ? Files.newBufferedWriter(path, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND)
                : Files.newBufferedWriter(path, StandardCharsets.UTF_8);
        headerPending = !existing;
        log.info("Opened {} (append={})", path, append);
    }

    @Override
    public synchronized long write(SensorData record) throws IOException {
        if (!dataTypes.isEmpty() && !dataTypes.contains(record.dataType())) return 0L;
        if (out == null) open();

        if (channels == null) {
            channels = new ArrayList<>(record.values().keySet());
        }

        long written = 0;
        if (headerPending) {
            List<String> header = new ArrayList<>(FIXED_COLUMNS);
            header.addAll(channels);
            written += writeLine(CsvRows.join(header, delimiter));
            headerPending = false;
        }

        List<Object> cells = new ArrayList<>(FIXED_COLUMNS.size() + channels.size());
        cells.add(record.timestamp());
        cells.add(record.sensorId());
        cells.add(record.dataType());
        for (String channel : channels) {
            cells.add(record.values().get(channel));
        }
        written += writeLine(CsvRows.join(cells, delimiter));
        rows++;
        bytes += written;
        return written;
    }

    @Override
    public synchronized void flush() throws IOException {
        if (out != null) out.flush();
    }

    @Override
    public synchronized void close() throws IOException {
        if (out == null) return;
        try {
            out.flush();
        } finally {
            out.close();
            out = null;
            log.info("Closed {} after {} rows ({} bytes)", path, rows, bytes);
        }
    }

    @Override
    public synchronized Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("output_path", path.toString());
        status.put("rows", rows);
        status.put("bytes", bytes);
        status.put("open", out != null);
        return status;
    }

    private long writeLine(String line) throws IOException {
        out.write(line);
        out.write('\n');
        return line.getBytes(StandardCharsets.UTF_8).length + 1L;
    }
}
