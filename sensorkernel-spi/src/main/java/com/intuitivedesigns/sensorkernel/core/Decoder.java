/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.sensorkernel.core;

/**
 * Turns raw chunks into canonical records.
 * Implementations keep incomplete fragments buffered until a later chunk completes them.
 */
@FunctionalInterface
public interface Decoder {

    Iterable<SensorData> decode(byte[] chunk) throws Exception;
}
