/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.testing;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.Decoder;
import com.intuitivedesigns.sensorkernel.core.Reader;
import com.intuitivedesigns.sensorkernel.core.Writer;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.sensorkernel.spi.DecoderPlugin;
import com.intuitivedesigns.sensorkernel.spi.ReaderPlugin;
import com.intuitivedesigns.sensorkernel.spi.WriterPlugin;

/**
 * Plugins listed in the test {@code META-INF/services} file, so discovery-driven tests can be
 * configured from YAML alone.
 */
public final class ServiceFixtures {

    private ServiceFixtures() {}

    /** ID {@code memory}; reads {@code count} (default 10) sequence numbers. */
    public static final class MemoryReaderPlugin implements ReaderPlugin {
        @Override
        public String id() {
            return "memory";
        }

        @Override
        public Class<MemoryReader> stageType() {
            return MemoryReader.class;
        }

        @Override
        public Reader create(ConfigSection config, MetricsRuntime metrics) {
            return MemoryReader.of(config.getInt("count", 10));
        }
    }

    /** ID {@code text}. */
    public static final class TextDecoderPlugin implements DecoderPlugin {
        @Override
        public String id() {
            return "text";
        }

        @Override
        public Class<TextDecoder> stageType() {
            return TextDecoder.class;
        }

        @Override
        public Decoder create(ConfigSection config, MetricsRuntime metrics) {
            return new TextDecoder();
        }
    }

    /** ID {@code memory}; {@code sink} names the shared {@link MemoryWriter}. */
    public static final class MemoryWriterPlugin implements WriterPlugin {
        @Override
        public String id() {
            return "memory";
        }

        @Override
        public Class<MemoryWriter> stageType() {
            return MemoryWriter.class;
        }

        @Override
        public Writer create(ConfigSection config, MetricsRuntime metrics) {
            return MemoryWriter.named(config.getString("sink", "default"));
        }
    }
}
