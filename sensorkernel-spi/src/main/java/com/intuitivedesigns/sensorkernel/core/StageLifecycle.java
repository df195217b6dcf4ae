/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.sensorkernel.core;

/**
 * Optional hooks for stages that hold resources beyond their constructor.
 * {@code setup()} runs right after instantiation, {@code teardown()} when the pipeline stops.
 */
public interface StageLifecycle {

    default void setup() throws Exception {}

    default void teardown() throws Exception {}
}
