/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.spi;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.Decoder;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;

public interface DecoderPlugin extends StagePlugin<Decoder> {

    @Override
    default PluginKind kind() {
        return PluginKind.DECODER;
    }

    @Override
    Decoder create(ConfigSection config, MetricsRuntime metrics) throws Exception;
}
