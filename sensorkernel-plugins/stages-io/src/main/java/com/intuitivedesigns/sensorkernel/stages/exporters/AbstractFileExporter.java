/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.stages.exporters;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.Exporter;
import com.intuitivedesigns.sensorkernel.core.SensorData;
import com.intuitivedesigns.sensorkernel.core.StatusReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Writes a batch to one file per call.
 *
 * <p>The target is {@code export_path} from the per-call overrides or the exporter's own
 * configuration; when neither sets it, {@code export_<yyyyMMdd_HHmmss><extension>} in the working
 * directory.</p>
 */
public abstract class AbstractFileExporter implements Exporter, StatusReporter {

    private static final Logger log = LoggerFactory.getLogger(AbstractFileExporter.class);

    public static final String CFG_EXPORT_PATH = "export_path";
    public static final String CFG_EXTENSION = "extension";

    private static final DateTimeFormatter FILE_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    protected final ConfigSection config;
    private final String defaultExtension;

    private final AtomicLong exports = new AtomicLong();
    private final AtomicReference<String> lastExport = new AtomicReference<>();

    protected AbstractFileExporter(ConfigSection config, String defaultExtension) {
        this.config = Objects.requireNonNull(config, "config");
        this.defaultExtension = defaultExtension;
    }

    @Override
    public final String export(List<SensorData> batch, ConfigSection overrides) throws IOException {
        ConfigSection effective = config.merge(overrides);
        Path target = target(effective);
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        List<SensorData> records = batch == null ? List.of() : batch;
        writeTo(target, records, effective);

        String id = target.toString();
        exports.incrementAndGet();
        lastExport.set(id);
        log.info("Exported {} records to {}", records.size(), id);
        return id;
    }

    /**
     * Writes {@code batch} to {@code target}, replacing any existing file.
     */
    protected abstract void writeTo(Path target, List<SensorData> batch, ConfigSection settings) throws IOException;

    @Override
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("exports", exports.get());
        status.put("last_export", lastExport.get());
        return status;
    }

    private Path target(ConfigSection settings) {
        String explicit = settings.getString(CFG_EXPORT_PATH, "").trim();
        if (!explicit.isEmpty()) return Paths.get(explicit);
        String extension = settings.getString(CFG_EXTENSION, defaultExtension);
        return Paths.get("export_" + LocalDateTime.now().format(FILE_STAMP) + extension);
    }
}
