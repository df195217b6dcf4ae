/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.plugins;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.Processor;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.sensorkernel.spi.ProcessorPlugin;
import com.intuitivedesigns.sensorkernel.stages.processors.MovingAverage;

import java.util.Objects;

public final class MovingAveragePlugin implements ProcessorPlugin {

    public static final String ID = "moving_average";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Class<MovingAverage> stageType() {
        return MovingAverage.class;
    }

    @Override
    public Processor create(ConfigSection config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        return new MovingAverage(config);
    }
}
