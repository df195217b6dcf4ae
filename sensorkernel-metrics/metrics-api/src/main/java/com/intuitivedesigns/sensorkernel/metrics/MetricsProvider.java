/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.metrics;

/**
 * Service Provider Interface for metrics backends.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and registered in
 * {@code META-INF/services/com.intuitivedesigns.sensorkernel.metrics.MetricsProvider}.</p>
 */
public interface MetricsProvider {

    /**
     * Identifier matched against {@code metrics.provider} (e.g. "PROMETHEUS", "NOOP").
     */
    String id();

    /**
     * @return a runtime when this provider is the configured one, otherwise null
     */
    MetricsRuntime create(MetricsSettings settings);

    default boolean matches(String configuredId) {
        return configuredId != null && id().equalsIgnoreCase(configuredId.trim());
    }
}
