/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.spi;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.Analyzer;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;

public interface AnalyzerPlugin extends StagePlugin<Analyzer> {

    @Override
    default PluginKind kind() {
        return PluginKind.ANALYZER;
    }

    @Override
    Analyzer create(ConfigSection config, MetricsRuntime metrics) throws Exception;
}
