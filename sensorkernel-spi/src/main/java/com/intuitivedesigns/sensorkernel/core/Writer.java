/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.sensorkernel.core;

/**
 * Terminal persistence stage.
 *
 * <p>Receives the merged stream of processed records and analyzer results.
 * {@link #close()} flushes by default.</p>
 */
public interface Writer extends AutoCloseable {

    default void open() throws Exception {}

    /**
     * @return units written (bytes, rows...), implementation defined
     */
    long write(SensorData record) throws Exception;

    default void flush() throws Exception {}

    @Override
    default void close() throws Exception {
        flush();
    }
}
