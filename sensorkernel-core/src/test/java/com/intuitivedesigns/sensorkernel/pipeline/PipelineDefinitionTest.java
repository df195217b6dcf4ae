/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.pipeline;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.config.KernelConfig;
import com.intuitivedesigns.sensorkernel.config.StageSpec;
import com.intuitivedesigns.sensorkernel.core.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PipelineDefinitionTest {

    private static ConfigSection firstPipeline(String... lines) {
        return KernelConfig.parse(String.join("\n", lines)).pipelineSections().get(0);
    }

    @Test
    void testParsesFullDefinition() {
        // Setup
        ConfigSection section = firstPipeline(
                "pipelines:",
                "  - id: imu_replay",
                "    use_threading: false",
                "    queue_size: 16",
                "    max_item_retries: 2",
                "    reader:",
                "      type: file",
                "      config:",
                "        file_path: data/imu.csv",
                "    decoder: csv",
                "    processors:",
                "      - type: signal_filter",
                "        config: {filter_type: lowpass}",
                "      - moving_average",
                "    analyzer: anomaly_detector",
                "    writers: [csv_file, csv_file]",
                "    exporter: {type: json}");

        // Act
        PipelineDefinition definition = PipelineDefinition.from(section);

        // Assert
        assertEquals("imu_replay", definition.id());
        assertTrue(definition.enabled());
        assertFalse(definition.useThreading());
        assertEquals("file", definition.reader().type());
        assertEquals("data/imu.csv", definition.reader().config().getString("file_path", null));
        assertEquals("csv", definition.decoder().type());
        assertEquals(List.of("signal_filter", "moving_average"), types(definition.processors()));
        assertEquals("lowpass", definition.processors().get(0).config().getString("filter_type", null));
        assertEquals(List.of("anomaly_detector"), types(definition.analyzers()));
        assertEquals(List.of("csv_file", "csv_file"), types(definition.writers()));
        assertEquals("json", definition.exporter().type());
        assertNull(definition.configurator());

        assertEquals(16, definition.settings().queueSize());
        assertEquals(2, definition.settings().maxItemRetries());
        assertEquals(ExecutionSettings.DEFAULT_PUSH_TIMEOUT_MS, definition.settings().pushTimeoutMs());
    }

    @Test
    void testMissingIdIsRejected() {
        ConfigSection section = ConfigSection.of(Map.of("reader", "file"));

        assertThrows(ConfigurationException.class, () -> PipelineDefinition.from(section));
    }

    @Test
    void testBuilderTrimsIdAndDefaultsCollections() {
        PipelineDefinition definition = PipelineDefinition.builder("  bench  ")
                .reader(StageSpec.of("file"))
                .decoder(StageSpec.of("csv"))
                .build();

        assertEquals("bench", definition.id());
        assertTrue(definition.processors().isEmpty());
        assertTrue(definition.writers().isEmpty());
        assertEquals(ExecutionSettings.defaults(), definition.settings());
    }

    @Test
    void testSettingsAreClamped() {
        ExecutionSettings settings = ExecutionSettings.from(ConfigSection.of(Map.of(
                "push_retries", -3,
                "poll_timeout_ms", 0,
                "reader_backoff_initial_ms", 500,
                "reader_backoff_max_ms", 100)));

        assertEquals(0, settings.pushRetries());
        assertEquals(1L, settings.pollTimeoutMs());
        assertEquals(500L, settings.readerBackoffMaxMs());
    }

    private static List<String> types(List<StageSpec> specs) {
        return specs.stream().map(StageSpec::type).collect(Collectors.toList());
    }
}
