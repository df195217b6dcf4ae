/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.spi;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.Exporter;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;

public interface ExporterPlugin extends StagePlugin<Exporter> {

    @Override
    default PluginKind kind() {
        return PluginKind.EXPORTER;
    }

    @Override
    Exporter create(ConfigSection config, MetricsRuntime metrics) throws Exception;
}
