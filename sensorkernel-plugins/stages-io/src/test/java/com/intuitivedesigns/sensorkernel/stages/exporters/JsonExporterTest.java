/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.stages.exporters;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.SensorData;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonExporterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path dir;

    private static List<SensorData> batch() {
        return List.of(
                SensorData.of(1_700_000_000.0, "imu-1", "imu", Map.of("accel_x", 0.5)),
                SensorData.of(1_700_000_001.0, "imu-1", "anomaly", Map.of("score", 4.2))
                        .withMetadataEntry("detected_at", Instant.parse("2023-11-14T22:13:21Z")));
    }

    @Test
    void testExportsArrayOfRecords() throws Exception {
        // Setup
        Path target = dir.resolve("nested/out.json");
        JsonExporter exporter = new JsonExporter(ConfigSection.of(Map.of("export_path", target.toString())));

        // Act
        String id = exporter.export(batch(), ConfigSection.empty());

        // Assert
        assertEquals(target.toString(), id);
        JsonNode root = MAPPER.readTree(target.toFile());
        assertTrue(root.isArray());
        assertEquals(2, root.size());
        assertEquals("imu-1", root.get(0).get("sensor_id").asText());
        assertEquals(0.5, root.get(0).get("values").get("accel_x").asDouble());
        assertEquals("2023-11-14T22:13:21Z", root.get(1).get("metadata").get("detected_at").asText());
        assertEquals(1L, exporter.getStatus().get("exports"));
        assertEquals(id, exporter.getStatus().get("last_export"));
    }

    @Test
    void testKeysAreSortedByDefault() throws Exception {
        Path target = dir.resolve("sorted.json");
        JsonExporter exporter = new JsonExporter(ConfigSection.of(Map.of("export_path", target.toString())));

        exporter.export(batch(), ConfigSection.empty());

        List<String> keys = new ArrayList<>();
        Iterator<String> names = MAPPER.readTree(target.toFile()).get(0).fieldNames();
        names.forEachRemaining(keys::add);
        List<String> sorted = new ArrayList<>(keys);
        sorted.sort(null);
        assertEquals(sorted, keys);
    }

    @Test
    void testOverridesWrapWithTimestampAndCompactOutput() throws Exception {
        Path configured = dir.resolve("configured.json");
        Path overridden = dir.resolve("overridden.json");
        JsonExporter exporter = new JsonExporter(ConfigSection.of(Map.of("export_path", configured.toString())));

        String id = exporter.export(batch(), ConfigSection.of(Map.of(
                "export_path", overridden.toString(),
                "wrap_with_timestamp", true,
                "indent", 0)));

        assertEquals(overridden.toString(), id);
        assertFalse(Files.exists(configured));
        String text = Files.readString(overridden, StandardCharsets.UTF_8);
        assertFalse(text.contains("\n"));
        JsonNode root = MAPPER.readTree(text);
        assertTrue(root.has("timestamp"));
        assertEquals(2, root.get("data").size());
    }

    @Test
    void testEmptyBatchWritesEmptyArray() throws Exception {
        Path target = dir.resolve("empty.json");
        JsonExporter exporter = new JsonExporter(ConfigSection.of(Map.of("export_path", target.toString())));

        exporter.export(List.of(), ConfigSection.empty());

        assertEquals(0, MAPPER.readTree(target.toFile()).size());
    }
}
