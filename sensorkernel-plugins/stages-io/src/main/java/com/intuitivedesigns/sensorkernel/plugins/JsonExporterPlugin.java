/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.plugins;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.Exporter;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.sensorkernel.spi.ExporterPlugin;
import com.intuitivedesigns.sensorkernel.stages.exporters.JsonExporter;

import java.util.Objects;

/**
 * ID: json
 */
public final class JsonExporterPlugin implements ExporterPlugin {

    public static final String ID = "json";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Class<JsonExporter> stageType() {
        return JsonExporter.class;
    }

    @Override
    public Exporter create(ConfigSection config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");
        return new JsonExporter(config);
    }
}
