/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.plugins;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.Writer;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.sensorkernel.spi.WriterPlugin;
import com.intuitivedesigns.sensorkernel.stages.writers.CsvFileWriter;

import java.util.Objects;

/**
 * ID: csv_file
 */
public final class CsvFileWriterPlugin implements WriterPlugin {

    public static final String ID = "csv_file";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Class<CsvFileWriter> stageType() {
        return CsvFileWriter.class;
    }

    @Override
    public Writer create(ConfigSection config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");
        return new CsvFileWriter(config);
    }
}
