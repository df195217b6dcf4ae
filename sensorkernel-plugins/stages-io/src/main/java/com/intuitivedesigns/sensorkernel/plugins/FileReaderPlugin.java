/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.plugins;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.Reader;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.sensorkernel.spi.ReaderPlugin;
import com.intuitivedesigns.sensorkernel.stages.readers.FileChunkReader;

import java.util.Objects;

/**
 * Replays a capture file in fixed-size chunks.
 * <p>
 * ID: file
 */
public final class FileReaderPlugin implements ReaderPlugin {

    public static final String ID = "file";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Class<FileChunkReader> stageType() {
        return FileChunkReader.class;
    }

    @Override
    public Reader create(ConfigSection config, MetricsRuntime metrics) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(metrics, "metrics");
        return new FileChunkReader(config);
    }
}
