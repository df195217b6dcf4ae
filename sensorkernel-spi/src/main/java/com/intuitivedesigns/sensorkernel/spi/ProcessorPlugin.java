/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.spi;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.Processor;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;

public interface ProcessorPlugin extends StagePlugin<Processor> {

    @Override
    default PluginKind kind() {
        return PluginKind.PROCESSOR;
    }

    @Override
    Processor create(ConfigSection config, MetricsRuntime metrics) throws Exception;
}
