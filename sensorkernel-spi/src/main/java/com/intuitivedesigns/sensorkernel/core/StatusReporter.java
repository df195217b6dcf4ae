/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.sensorkernel.core;

import java.util.Map;

/**
 * Stages implementing this contribute their own entry to the pipeline status.
 * Called from the status thread, so implementations must be safe to read concurrently.
 */
public interface StatusReporter {

    Map<String, Object> getStatus();
}
