/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.plugins;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.Decoder;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.sensorkernel.spi.DecoderPlugin;
import com.intuitivedesigns.sensorkernel.stages.decoders.CsvDecoder;

import java.util.Objects;

/**
 * Delimited text decoder. Configure {@code columns} or {@code skip_header: true}; see
 * {@link CsvDecoder} for the full key list.
 */
public final class CsvDecoderPlugin implements DecoderPlugin {

    public static final String ID = "csv";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Class<CsvDecoder> stageType() {
        return CsvDecoder.class;
    }

    @Override
    public Decoder create(ConfigSection config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");
        return new CsvDecoder(config);
    }
}
