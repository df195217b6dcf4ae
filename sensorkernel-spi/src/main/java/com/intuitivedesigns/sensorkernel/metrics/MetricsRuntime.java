/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.metrics;

import java.util.Map;
import java.util.function.DoubleSupplier;

/**
 * Vendor-agnostic metrics contract used by the kernel and by stage plugins.
 *
 * <p>Every instrumentation method has a no-op default so the kernel runs unchanged when metrics
 * are disabled. Implementations must be safe to call from any worker thread.</p>
 */
public interface MetricsRuntime extends AutoCloseable {

    /**
     * Underlying registry (e.g. a Micrometer {@code MeterRegistry}).
     * Typed as Object so callers do not need the metrics library on their compile path.
     */
    Object registry();

    default boolean enabled() { return false; }

    /**
     * @return implementation identifier, e.g. "MICROMETER" or "NOOP"
     */
    default String type() { return "NOOP"; }

    // --- Instrumentation (no-op defaults) ---

    default void counter(String name) {}

    default void counter(String name, double increment) {}

    default void counter(String name, double increment, Map<String, String> tags) {
        counter(name, increment);
    }

    default void timer(String name, long durationMillis) {}

    default void gauge(String name, double value) {}

    default void gauge(String name, double value, Map<String, String> tags) {
        gauge(name, value);
    }

    /**
     * Binds a gauge to a live source polled by the backend at scrape time.
     * Binding the same name and tags again replaces the source.
     */
    default void gauge(String name, Map<String, String> tags, DoubleSupplier source) {}

    @Override
    default void close() {}

    static MetricsRuntime noop() {
        return Noop.INSTANCE;
    }

    /**
     * Records nothing. {@link #registry()} returns a sentinel rather than null.
     */
    final class Noop implements MetricsRuntime {
        private static final Noop INSTANCE = new Noop();
        private static final Object SENTINEL = new Object();

        private Noop() {}

        @Override
        public Object registry() {
            return SENTINEL;
        }
    }
}
