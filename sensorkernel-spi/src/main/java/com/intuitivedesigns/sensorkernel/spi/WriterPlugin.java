/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.spi;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.Writer;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;

public interface WriterPlugin extends StagePlugin<Writer> {

    @Override
    default PluginKind kind() {
        return PluginKind.WRITER;
    }

    @Override
    Writer create(ConfigSection config, MetricsRuntime metrics) throws Exception;
}
