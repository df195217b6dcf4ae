/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.DoubleSupplier;

/**
 * Micrometer bridge.
 *
 * <p>Meters are registered on a composite registry so a backend (Prometheus) can be added next to
 * the in-memory {@link SimpleMeterRegistry}. Generic {@code gauge(name, value)} calls are mapped to
 * push-style state holders polled by Micrometer; supplier gauges are read directly at scrape time.</p>
 */
public final class MicrometerMetricsRuntime implements MetricsRuntime {

    private static final Logger log = LoggerFactory.getLogger(MicrometerMetricsRuntime.class);

    private final CompositeMeterRegistry registry;
    private final AutoCloseable onClose;

    // Push gauges keyed by name + sorted tags
    private final Map<String, AtomicDouble> gaugeState = new ConcurrentHashMap<>();
    // Polled gauges; the meter stays registered while the source can be rebound
    private final Map<String, AtomicReference<DoubleSupplier>> gaugeSources = new ConcurrentHashMap<>();

    public MicrometerMetricsRuntime() {
        this(new SimpleMeterRegistry(), null);
    }

    /**
     * @param backend registry that receives every meter
     * @param onClose extra resource released on {@link #close()} (e.g. a scrape endpoint), may be null
     */
    public MicrometerMetricsRuntime(MeterRegistry backend, AutoCloseable onClose) {
        this.registry = new CompositeMeterRegistry();
        this.registry.add(backend);
        this.onClose = onClose;
    }

    public void addRegistry(MeterRegistry specificRegistry) {
        registry.add(specificRegistry);
    }

    // --- Interface Implementation ---

    @Override
    public Object registry() {
        return registry;
    }

    @Override
    public boolean enabled() {
        return true;
    }

    @Override
    public String type() {
        return "MICROMETER";
    }

    @Override
    public void counter(String name) {
        registry.counter(name).increment();
    }

    @Override
    public void counter(String name, double increment) {
        if (increment > 0) {
            registry.counter(name).increment(increment);
        }
    }

    @Override
    public void counter(String name, double increment, Map<String, String> tags) {
        if (increment > 0) {
            registry.counter(name, toTags(tags)).increment(increment);
        }
    }

    @Override
    public void timer(String name, long durationMillis) {
        registry.timer(name).record(durationMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void gauge(String name, double value) {
        gauge(name, value, Map.of());
    }

    @Override
    public void gauge(String name, double value, Map<String, String> tags) {
        Map<String, String> safeTags = tags == null ? Map.of() : tags;
        String key = name + new TreeMap<>(safeTags);
        // computeIfAbsent registers each gauge exactly once
        AtomicDouble state = gaugeState.computeIfAbsent(key, k -> {
            AtomicDouble holder = new AtomicDouble(value);
            Gauge.builder(name, holder, AtomicDouble::get)
                    .tags(toTags(safeTags))
                    .register(registry);
            return holder;
        });
        state.set(value);
    }

    @Override
    public void gauge(String name, Map<String, String> tags, DoubleSupplier source) {
        if (source == null) return;
        Map<String, String> safeTags = tags == null ? Map.of() : tags;
        String key = name + new TreeMap<>(safeTags);
        AtomicReference<DoubleSupplier> binding = gaugeSources.computeIfAbsent(key, k -> {
            AtomicReference<DoubleSupplier> ref = new AtomicReference<>(source);
            Gauge.builder(name, ref, r -> r.get().getAsDouble())
                    .tags(toTags(safeTags))
                    .strongReference(true)
                    .register(registry);
            return ref;
        });
        binding.set(source);
    }

    @Override
    public void close() {
        registry.close();
        if (onClose != null) {
            try {
                onClose.close();
            } catch (Exception e) {
                log.warn("Error releasing metrics backend: {}", e.getMessage());
            }
        }
        log.info("Metrics Runtime Closed.");
    }

    private static Tags toTags(Map<String, String> tags) {
        if (tags == null || tags.isEmpty()) return Tags.empty();
        List<Tag> out = new ArrayList<>(tags.size());
        tags.forEach((k, v) -> {
            if (k != null && v != null) out.add(Tag.of(k, v));
        });
        return Tags.of(out);
    }

    /**
     * Mutable double exposed to Micrometer as a {@link Number}.
     */
    private static final class AtomicDouble extends Number {
        private final AtomicLong bits;

        AtomicDouble(double initialValue) {
            this.bits = new AtomicLong(Double.doubleToLongBits(initialValue));
        }

        void set(double newValue) {
            bits.set(Double.doubleToLongBits(newValue));
        }

        double get() {
            return Double.longBitsToDouble(bits.get());
        }

        @Override public int intValue() { return (int) get(); }
        @Override public long longValue() { return (long) get(); }
        @Override public float floatValue() { return (float) get(); }
        @Override public double doubleValue() { return get(); }
    }
}
