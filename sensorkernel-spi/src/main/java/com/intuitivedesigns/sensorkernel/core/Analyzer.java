/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.sensorkernel.core;

/**
 * Derives analysis results from processed records. Results use the analyzer's own
 * {@code dataType} and carry their flags in the metadata; they are merged into the writer stream.
 */
@FunctionalInterface
public interface Analyzer {

    Iterable<SensorData> analyze(SensorData record) throws Exception;
}
