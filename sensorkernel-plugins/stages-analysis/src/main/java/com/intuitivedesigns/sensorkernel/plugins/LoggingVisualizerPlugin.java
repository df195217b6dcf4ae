/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.plugins;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.Visualizer;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.sensorkernel.spi.VisualizerPlugin;
import com.intuitivedesigns.sensorkernel.stages.visualizers.LoggingVisualizer;

import java.util.Objects;

public final class LoggingVisualizerPlugin implements VisualizerPlugin {

    public static final String ID = "logging";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Class<LoggingVisualizer> stageType() {
        return LoggingVisualizer.class;
    }

    @Override
    public Visualizer create(ConfigSection config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        return new LoggingVisualizer(config);
    }
}
