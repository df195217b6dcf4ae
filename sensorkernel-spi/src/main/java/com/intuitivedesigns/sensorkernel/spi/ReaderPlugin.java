/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.spi;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.Reader;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;

public interface ReaderPlugin extends StagePlugin<Reader> {

    @Override
    default PluginKind kind() {
        return PluginKind.READER;
    }

    @Override
    Reader create(ConfigSection config, MetricsRuntime metrics) throws Exception;
}
