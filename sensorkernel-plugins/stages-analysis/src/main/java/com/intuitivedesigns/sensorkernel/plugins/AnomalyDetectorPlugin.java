/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.plugins;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.Analyzer;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.sensorkernel.spi.AnalyzerPlugin;
import com.intuitivedesigns.sensorkernel.stages.analyzers.AnomalyDetector;

import java.util.Objects;

/**
 * Rolling z-score detector; emits {@code anomaly} records.
 */
public final class AnomalyDetectorPlugin implements AnalyzerPlugin {

    public static final String ID = "anomaly_detector";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Class<AnomalyDetector> stageType() {
        return AnomalyDetector.class;
    }

    @Override
    public Analyzer create(ConfigSection config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        return new AnomalyDetector(config);
    }
}
