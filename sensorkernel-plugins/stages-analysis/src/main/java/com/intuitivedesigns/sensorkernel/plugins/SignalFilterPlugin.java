/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.plugins;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.Processor;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.sensorkernel.spi.ProcessorPlugin;
import com.intuitivedesigns.sensorkernel.stages.processors.SignalFilter;

import java.util.Objects;

/**
 * Low-pass / high-pass RC filter.
 * <p>
 * ID: signal_filter
 */
public final class SignalFilterPlugin implements ProcessorPlugin {

    public static final String ID = "signal_filter";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Class<SignalFilter> stageType() {
        return SignalFilter.class;
    }

    @Override
    public Processor create(ConfigSection config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        return new SignalFilter(config);
    }
}
