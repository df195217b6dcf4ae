/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.spi;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.Configurator;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;

public interface ConfiguratorPlugin extends StagePlugin<Configurator> {

    @Override
    default PluginKind kind() {
        return PluginKind.CONFIGURATOR;
    }

    @Override
    Configurator create(ConfigSection config, MetricsRuntime metrics) throws Exception;
}
