/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.pipeline;

/**
 * Executor lifecycle: {@code CREATED -> SETUP -> RUNNING -> STOPPING -> STOPPED}, and
 * {@code STOPPED -> SETUP} for a restart.
 */
public enum PipelineState {
    CREATED,
    SETUP,
    RUNNING,
    STOPPING,
    STOPPED;

    public boolean canSetup() {
        return this == CREATED || this == STOPPED;
    }
}
