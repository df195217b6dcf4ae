/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.stages.decoders;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.Decoder;
import com.intuitivedesigns.sensorkernel.core.SensorData;
import com.intuitivedesigns.sensorkernel.core.StatusReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.LongAdder;
import java.util.regex.Pattern;

/**
 * Decodes delimited text rows into {@link SensorData}.
 *
 * <p>Chunks may split a row (or a multi-byte character) anywhere; the undecoded tail is kept
 * until the next newline arrives. Column names come from {@code columns} or, with
 * {@code skip_header}, from the first line. Rows whose column count differs from the header are
 * skipped with a warning.</p>
 *
 * <p>The {@code timestamp_column} value becomes the record timestamp and is left out of
 * {@code values}. Columns listed in {@code numeric_columns} are converted to doubles; a cell that
 * does not parse keeps its text.</p>
 */
public final class CsvDecoder implements Decoder, StatusReporter {

    private static final Logger log = LoggerFactory.getLogger(CsvDecoder.class);

    public static final String CFG_SENSOR_ID = "sensor_id";
    public static final String CFG_DATA_TYPE = "data_type";
    public static final String CFG_DELIMITER = "delimiter";
    public static final String CFG_COLUMNS = "columns";
    public static final String CFG_TIMESTAMP_COLUMN = "timestamp_column";
    public static final String CFG_TIMESTAMP_FORMAT = "timestamp_format";
    public static final String CFG_UNITS = "units";
    public static final String CFG_NUMERIC_COLUMNS = "numeric_columns";
    public static final String CFG_SKIP_HEADER = "skip_header";

    private final String sensorId;
    private final String dataType;
    private final Pattern delimiter;
    private final List<String> configuredColumns;
    private final String timestampColumn;
    private final DateTimeFormatter timestampFormat;
    private final Map<String, String> units;
    private final Set<String> numericColumns;
    private final boolean skipHeader;

    private final ByteArrayOutputStream pending = new ByteArrayOutputStream();
    private List<String> header;

    private final LongAdder decoded = new LongAdder();
    private final LongAdder skipped = new LongAdder();

    public CsvDecoder(ConfigSection config) {
        this.sensorId = config.getString(CFG_SENSOR_ID, "csv_sensor");
        this.dataType = config.getString(CFG_DATA_TYPE, "csv");
        String delim = config.getString(CFG_DELIMITER, ",");
        this.delimiter = Pattern.compile(Pattern.quote(delim.isEmpty() ? "," : delim));
        this.configuredColumns = trimAll(config.getStringList(CFG_COLUMNS));
        this.timestampColumn = config.getString(CFG_TIMESTAMP_COLUMN, "timestamp");
        String format = config.getString(CFG_TIMESTAMP_FORMAT, "").trim();
        this.timestampFormat = format.isEmpty() ? null : DateTimeFormatter.ofPattern(format);
        this.numericColumns = new LinkedHashSet<>(config.getStringList(CFG_NUMERIC_COLUMNS));
        this.skipHeader = config.getBoolean(CFG_SKIP_HEADER, false);

        Map<String, String> u = new LinkedHashMap<>();
        config.section(CFG_UNITS).asMap().forEach((k, v) -> {
            if (v != null) u.put(k, String.valueOf(v));
        });
        this.units = Collections.unmodifiableMap(u);

        this.header = configuredColumns.isEmpty() ? null : configuredColumns;
        log.info("CsvDecoder initialized for sensor '{}', data_type '{}'", sensorId, dataType);
    }

    @Override
    public Iterable<SensorData> decode(byte[] chunk) {
        if (chunk == null || chunk.length == 0) return List.of();

        List<String> lines = completeLines(chunk);
        if (lines.isEmpty()) return List.of();

        int start = 0;
        if (skipHeader && configuredColumns.isEmpty() && header == null) {
            header = trimAll(List.of(delimiter.split(lines.get(0), -1)));
            start = 1;
            log.info("CsvDecoder header: {}", header);
        }

        List<SensorData> out = new ArrayList<>();
        for (int i = start; i < lines.size(); i++) {
            String line = lines.get(i).strip();
            if (line.isEmpty()) continue;

            SensorData record = decodeLine(line);
            if (record == null) {
                skipped.increment();
            } else {
                decoded.increment();
                out.add(record);
            }
        }
        return out;
    }

    /**
     * Forgets buffered partial input and any header learned from the data.
     */
    public void reset() {
        pending.reset();
        header = configuredColumns.isEmpty() ? null : configuredColumns;
    }

    @Override
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("sensor_id", sensorId);
        status.put("records_decoded", decoded.sum());
        status.put("lines_skipped", skipped.sum());
        return status;
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    // Splits on raw '\n' bytes so a UTF-8 sequence cut by the chunk boundary stays in the buffer.
    private List<String> completeLines(byte[] chunk) {
        pending.write(chunk, 0, chunk.length);
        byte[] buffered = pending.toByteArray();

        int lastNewline = -1;
        for (int i = buffered.length - 1; i >= 0; i--) {
            if (buffered[i] == '\n') {
                lastNewline = i;
                break;
            }
        }
        if (lastNewline < 0) return List.of();

        pending.reset();
        pending.write(buffered, lastNewline + 1, buffered.length - lastNewline - 1);

        String text = new String(buffered, 0, lastNewline, StandardCharsets.UTF_8);
        return List.of(text.split("\n", -1));
    }

    private SensorData decodeLine(String line) {
        if (header == null) {
            log.warn("No header defined and no columns specified; skipping line");
            return null;
        }

        String[] row = delimiter.split(line, -1);
        if (row.length != header.size()) {
            log.warn("Column count mismatch: expected {}, got {}; skipping line", header.size(), row.length);
            return null;
        }

        SensorData.Builder builder = SensorData.builder()
                .sensorId(sensorId)
                .dataType(dataType)
                .units(units);

        for (int i = 0; i < row.length; i++) {
            String column = header.get(i);
            String cell = row[i].strip();
            if (column.equals(timestampColumn)) {
                builder.timestamp(parseTimestamp(cell));
            } else {
                builder.value(column, numericColumns.contains(column) ? toNumber(column, cell) : cell);
            }
        }
        return builder.build();
    }

    private Object parseTimestamp(String cell) {
        if (timestampFormat == null || cell.isEmpty()) return cell;
        if (SensorData.coerceTimestamp(cell).isPresent()) return cell;
        try {
            return LocalDateTime.parse(cell, timestampFormat).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            log.warn("Failed to parse timestamp '{}' with format; using current time", cell);
            return cell;
        }
    }

    private static Object toNumber(String column, String cell) {
        try {
            return Double.parseDouble(cell);
        } catch (NumberFormatException e) {
            log.warn("Failed to convert column '{}' value '{}' to a number; keeping text", column, cell);
            return cell;
        }
    }

    private static List<String> trimAll(List<String> names) {
        List<String> out = new ArrayList<>(names.size());
        for (String n : names) out.add(n.strip());
        return Collections.unmodifiableList(out);
    }
}
