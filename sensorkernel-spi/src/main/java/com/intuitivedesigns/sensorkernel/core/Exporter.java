/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.sensorkernel.core;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;

import java.util.List;

/**
 * On-demand batch export of records already written by a pipeline.
 */
@FunctionalInterface
public interface Exporter {

    /**
     * @param batch     records to export, oldest first
     * @param overrides per-call settings layered over the exporter's own configuration
     * @return an identifier for the produced artifact (usually a path)
     */
    String export(List<SensorData> batch, ConfigSection overrides) throws Exception;
}
