/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.spi;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.Visualizer;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;

public interface VisualizerPlugin extends StagePlugin<Visualizer> {

    @Override
    default PluginKind kind() {
        return PluginKind.VISUALIZER;
    }

    @Override
    Visualizer create(ConfigSection config, MetricsRuntime metrics) throws Exception;
}
