/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.metrics;

/**
 * Explicit "metrics off" choice: {@code metrics.provider: NOOP}.
 */
public final class NoopMetricsProvider implements MetricsProvider {

    public static final String ID = "NOOP";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public MetricsRuntime create(MetricsSettings settings) {
        if (settings == null || !matches(settings.providerId)) {
            return null;
        }
        return MetricsRuntime.noop();
    }
}
