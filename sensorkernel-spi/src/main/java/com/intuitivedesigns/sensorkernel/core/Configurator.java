/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.sensorkernel.core;

/**
 * Prepares an external device before a pipeline reads from it.
 */
public interface Configurator {

    boolean configure() throws Exception;

    default boolean reset() throws Exception {
        return true;
    }
}
