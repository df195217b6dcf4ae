/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.config;

import java.util.Map;

/**
 * Which plugin to instantiate for one stage, and the settings it receives.
 *
 * <p>Accepted YAML shapes: {@code {type: csv, config: {...}}} or a bare {@code csv}.</p>
 */
public record StageSpec(String type, ConfigSection config) {

    public StageSpec {
        type = type == null ? "" : type.trim();
        config = config == null ? ConfigSection.empty() : config;
    }

    public static StageSpec of(String type) {
        return new StageSpec(type, ConfigSection.empty());
    }

    /**
     * @return the parsed spec, or null when {@code node} is null
     */
    public static StageSpec from(Object node) {
        if (node == null) return null;
        if (node instanceof Map<?, ?> raw) {
            ConfigSection section = ConfigSection.asSection(raw);
            return new StageSpec(section.getString("type", ""), section.section("config"));
        }
        return new StageSpec(String.valueOf(node), ConfigSection.empty());
    }

    public boolean hasType() {
        return !type.isEmpty();
    }
}
