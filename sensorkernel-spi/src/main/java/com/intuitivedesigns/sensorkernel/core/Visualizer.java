/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.sensorkernel.core;

/**
 * Side-effect only consumer of processed records. Must not block indefinitely.
 */
@FunctionalInterface
public interface Visualizer {

    void visualize(SensorData record) throws Exception;
}
