/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.config;

import com.intuitivedesigns.sensorkernel.core.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class KernelConfigTest {

    @Test
    void testParsesSectionsAndDefaults() {
        KernelConfig config = KernelConfig.parse(String.join("\n",
                "system:",
                "  name: lab-bench",
                "plugins:",
                "  search_paths: [./plugins, /opt/sensorkernel/ext]",
                "metrics:",
                "  provider: PROMETHEUS",
                "pipelines:",
                "  - id: imu",
                "    reader: file",
                "  - not-a-mapping"));

        assertEquals("lab-bench", config.section("system").getString("name", null));
        assertEquals("PROMETHEUS", config.section("metrics").getString("provider", null));
        assertEquals(KernelConfig.DEFAULT_MAX_PIPELINES, config.maxPipelines());
        assertEquals(List.of(Paths.get("./plugins"), Paths.get("/opt/sensorkernel/ext")), config.pluginSearchPaths());

        List<ConfigSection> pipelines = config.pipelineSections();
        assertEquals(1, pipelines.size());
        assertEquals("imu", pipelines.get(0).getString("id", null));
    }

    @Test
    void testScalarSearchPathIsAccepted() {
        KernelConfig config = KernelConfig.parse("plugins:\n  search_paths: ./plugins\nsystem:\n  max_pipelines: 2\n");

        assertEquals(List.of(Paths.get("./plugins")), config.pluginSearchPaths());
        assertEquals(2, config.maxPipelines());
    }

    @Test
    void testEmptyDocumentIsEmptyConfig() {
        KernelConfig config = KernelConfig.parse("");

        assertTrue(config.root().isEmpty());
        assertTrue(config.pipelineSections().isEmpty());
    }

    @Test
    void testMalformedYamlIsConfigurationError() {
        assertThrows(ConfigurationException.class, () -> KernelConfig.parse("pipelines: [unclosed"));
    }

    @Test
    void testNonMappingRootIsConfigurationError() {
        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> KernelConfig.parse("- just\n- a list\n"));

        assertTrue(e.getMessage().contains("mapping"));
    }

    @Test
    void testLoadFromFile(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("kernel.yaml");
        Files.writeString(file, "system:\n  max_pipelines: 7\n", StandardCharsets.UTF_8);

        KernelConfig config = KernelConfig.load(file);

        assertEquals(7, config.maxPipelines());
    }
}
