/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ConfigSectionTest {

    private final ConfigSection section = ConfigSection.of(Map.of(
            "chunk_size", "2048",
            "threshold", 2.5,
            "append", "yes",
            "columns", List.of("timestamp", "accel_x"),
            "units", Map.of("accel_x", "m/s^2"),
            "metrics", Map.of("port", 9404, "tags", Map.of("site", "lab"))));

    @Test
    void testTypedGettersConvertStrings() {
        assertEquals(2048, section.getInt("chunk_size", 0));
        assertEquals(2048L, section.getLong("chunk_size", 0L));
        assertEquals(2.5, section.getDouble("threshold", 0.0));
        assertTrue(section.getBoolean("append", false));
    }

    @Test
    void testMalformedValuesYieldDefault() {
        ConfigSection bad = ConfigSection.of(Map.of("n", "many", "flag", "maybe"));

        assertEquals(7, bad.getInt("n", 7));
        assertEquals(1.5, bad.getDouble("n", 1.5));
        assertTrue(bad.getBoolean("flag", true));
        assertEquals("fallback", bad.getString("missing", "fallback"));
    }

    @Test
    void testDottedPathsReachNestedMappings() {
        assertEquals(9404, section.getInt("metrics.port", 0));
        assertEquals("lab", section.getString("metrics.tags.site", null));
        assertTrue(section.hasPath("metrics.tags"));
        assertFalse(section.hasPath("metrics.port.deeper"));
        assertEquals("lab", section.section("metrics").section("tags").getString("site", null));
    }

    @Test
    void testListsAndSections() {
        assertEquals(List.of("timestamp", "accel_x"), section.getStringList("columns"));
        assertEquals(List.of("2048"), section.getStringList("chunk_size"));
        assertTrue(section.getList("absent").isEmpty());
        assertTrue(section.section("columns").isEmpty());
        assertNull(section.getString("columns", null));
    }

    @Test
    void testMergeOverridesEntries() {
        ConfigSection base = ConfigSection.of(Map.of("indent", 2, "sort_keys", true));

        ConfigSection merged = base.merge(ConfigSection.of(Map.of("indent", 0)));

        assertEquals(0, merged.getInt("indent", -1));
        assertTrue(merged.getBoolean("sort_keys", false));
        assertSame(base, base.merge(ConfigSection.empty()));
    }

    @Test
    void testValuesAreImmutable() {
        assertThrows(UnsupportedOperationException.class, () -> section.asMap().put("x", 1));
    }

    @Test
    void testStageSpecShapes() {
        StageSpec bare = StageSpec.from("csv");
        StageSpec full = StageSpec.from(Map.of("type", " csv_file ", "config", Map.of("append", false)));

        assertEquals("csv", bare.type());
        assertTrue(bare.config().isEmpty());
        assertEquals("csv_file", full.type());
        assertFalse(full.config().getBoolean("append", true));
        assertNull(StageSpec.from(null));
        assertFalse(StageSpec.from(Map.of("config", Map.of())).hasType());
    }
}
