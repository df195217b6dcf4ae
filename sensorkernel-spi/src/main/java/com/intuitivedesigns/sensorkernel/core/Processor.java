/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.sensorkernel.core;

/**
 * One link of the sequential processing chain. May emit zero, one or many records per input.
 */
@FunctionalInterface
public interface Processor {

    Iterable<SensorData> process(SensorData record) throws Exception;
}
