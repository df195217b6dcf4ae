/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.app;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.sensorkernel.config.KernelConfig;
import com.intuitivedesigns.sensorkernel.config.StageSpec;
import com.intuitivedesigns.sensorkernel.engine.Engine;
import com.intuitivedesigns.sensorkernel.logging.LoggingContext;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.sensorkernel.pipeline.MetricsSnapshot;
import com.intuitivedesigns.sensorkernel.pipeline.PipelineDefinition;
import com.intuitivedesigns.sensorkernel.pipeline.PipelineState;
import com.intuitivedesigns.sensorkernel.pipeline.PipelineStatus;
import com.intuitivedesigns.sensorkernel.plugin.PluginRegistry;
import com.intuitivedesigns.sensorkernel.spi.PluginKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class SensorKernelAppTest {

    private static final int ROWS = 40;
    private static final int SPIKE_ROW = 30;

    @TempDir
    Path dir;

    @Test
    void testDescribeFormatsStatusLine() {
        MetricsSnapshot metrics = new MetricsSnapshot(
                Map.of(),
                Map.of("read", 1234L, "written", 1200L),
                Map.of("decoder", 2L, "writer-0", 1L),
                Map.of("writer-0.in", 4L),
                null,
                12.34);
        PipelineStatus status = new PipelineStatus("imu", PipelineState.RUNNING, true, true, metrics, null, null, null);

        String line = SensorKernelApp.describe(status);

        assertEquals("PIPELINE imu | RUNNING (paused) | READ: 1,234 | WRITTEN: 1,200 | SPEED: 12.3 rec/s"
                + " | ERRORS: 3 | DROPPED: 4", line);
    }

    @Test
    void testBundledConfigurationResolvesEveryStage() {
        // Setup
        KernelConfig config = KernelConfig.load();
        PluginRegistry registry = new PluginRegistry(LoggingContext.root("test"), MetricsRuntime.noop());
        registry.discoverPlugins(config.pluginSearchPaths());

        // Act
        List<PipelineDefinition> definitions = new ArrayList<>();
        config.pipelineSections().forEach(section -> definitions.add(PipelineDefinition.from(section)));

        // Assert
        assertEquals(1, definitions.size());
        PipelineDefinition definition = definitions.get(0);
        assertEquals("imu_replay", definition.id());
        assertNotNull(registry.getConstructor(PluginKind.READER, definition.reader().type()));
        assertNotNull(registry.getConstructor(PluginKind.DECODER, definition.decoder().type()));
        assertNotNull(registry.getConstructor(PluginKind.EXPORTER, definition.exporter().type()));
        for (StageSpec spec : definition.processors()) {
            assertNotNull(registry.getConstructor(PluginKind.PROCESSOR, spec.type()));
        }
        for (StageSpec spec : definition.analyzers()) {
            assertNotNull(registry.getConstructor(PluginKind.ANALYZER, spec.type()));
        }
        for (StageSpec spec : definition.visualizers()) {
            assertNotNull(registry.getConstructor(PluginKind.VISUALIZER, spec.type()));
        }
        for (StageSpec spec : definition.writers()) {
            assertNotNull(registry.getConstructor(PluginKind.WRITER, spec.type()));
        }
    }

    @Test
    void testCaptureFileReplaysThroughEveryStage() throws Exception {
        // Setup
        Path capture = dir.resolve("capture.csv");
        Files.write(capture, captureLines(), StandardCharsets.UTF_8);
        Path readings = dir.resolve("out/readings.csv");
        Path alerts = dir.resolve("out/anomalies.csv");
        Path history = dir.resolve("out/history.json");

        KernelConfig config = KernelConfig.parse(String.join("\n",
                "pipelines:",
                "  - id: replay",
                "    history_size: 1000",
                "    join_timeout_ms: 5000",
                "    reader:",
                "      type: file",
                "      config:",
                "        file_path: '" + capture + "'",
                "        chunk_size: 64",
                "    decoder:",
                "      type: csv",
                "      config:",
                "        sensor_id: imu_01",
                "        data_type: imu",
                "        skip_header: true",
                "        numeric_columns: [accel_x, accel_z]",
                "    processors:",
                "      - type: moving_average",
                "        config:",
                "          window_size: 1",
                "    analyzers:",
                "      - type: anomaly_detector",
                "        config:",
                "          fields: [accel_z]",
                "    visualizers:",
                "      - type: logging",
                "        config:",
                "          every_n: 100",
                "    writers:",
                "      - type: csv_file",
                "        config:",
                "          output_path: '" + readings + "'",
                "          append: false",
                "          data_types: [imu]",
                "      - type: csv_file",
                "        config:",
                "          output_path: '" + alerts + "'",
                "          append: false",
                "          data_types: [anomaly]",
                "    exporter:",
                "      type: json",
                "      config:",
                "        export_path: '" + history + "'"));
        Engine engine = new Engine(config, new PluginRegistry(LoggingContext.root("test"), MetricsRuntime.noop()),
                MetricsRuntime.noop(), LoggingContext.root("test"));

        // Act
        assertEquals(1, engine.setup());
        engine.start();
        long deadline = System.currentTimeMillis() + 10_000;
        while (!engine.isDrained() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        boolean drained = engine.isDrained();
        engine.stop();
        Optional<String> exported = engine.export("replay");

        // Assert
        assertTrue(drained);
        assertEquals(PipelineState.STOPPED, engine.getStatus().get("replay").state());

        List<String> written = Files.readAllLines(readings, StandardCharsets.UTF_8);
        assertEquals(ROWS + 1, written.size());
        assertEquals("timestamp,sensor_id,data_type,accel_x,accel_z", written.get(0));

        // The detector starts scoring at its tenth sample
        assertEquals(ROWS - 9 + 1, Files.readAllLines(alerts, StandardCharsets.UTF_8).size());

        assertEquals(Optional.of(history.toString()), exported);
        JsonNode records = new ObjectMapper().readTree(history.toFile());
        assertEquals(ROWS + ROWS - 9, records.size());
        int flagged = 0;
        for (JsonNode record : records) {
            if (record.path("metadata").path("anomaly").asBoolean(false)) flagged++;
        }
        assertEquals(1, flagged);
    }

    private static List<String> captureLines() {
        List<String> lines = new ArrayList<>();
        lines.add("timestamp,accel_x,accel_z");
        for (int i = 0; i < ROWS; i++) {
            double z = i == SPIKE_ROW ? 50.0 : (i % 2 == 0 ? 9.79 : 9.81);
            lines.add((1_700_000_000 + i) + "," + (i % 3) * 0.01 + "," + z);
        }
        return lines;
    }
}
