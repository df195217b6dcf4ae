/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.metrics;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable settings of the metrics backend, read from the {@code metrics} section.
 *
 * <pre>
 * metrics:
 *   provider: PROMETHEUS
 *   step_seconds: 10
 *   tags: { site: lab-2 }
 *   prometheus: { port: 9090, path: /metrics }
 * </pre>
 */
public final class MetricsSettings {

    // ---- Config keys (relative to the metrics section) ----
    private static final String KEY_PROVIDER = "provider";
    private static final String KEY_STEP_SECONDS = "step_seconds";
    private static final String KEY_TAGS = "tags";
    private static final String KEY_PROM_PORT = "prometheus.port";
    private static final String KEY_PROM_PATH = "prometheus.path";

    // ---- Defaults ----
    private static final String DEFAULT_PROVIDER = "NONE";
    private static final int DEFAULT_STEP_SECONDS = 10;
    private static final int DEFAULT_PROM_PORT = 9090;
    private static final String DEFAULT_PROM_PATH = "/metrics";

    // ---- Public Immutable Fields ----
    public final String providerId;
    public final Map<String, String> commonTags;
    public final Duration step;
    public final int prometheusPort;
    public final String prometheusPath;

    private MetricsSettings(String providerId,
                            Map<String, String> commonTags,
                            Duration step,
                            int prometheusPort,
                            String prometheusPath) {
        this.providerId = providerId;
        this.commonTags = commonTags;
        this.step = step;
        this.prometheusPort = prometheusPort;
        this.prometheusPath = prometheusPath;
    }

    /**
     * @param metrics the {@code metrics} section of the kernel configuration
     */
    public static MetricsSettings from(ConfigSection metrics) {
        Objects.requireNonNull(metrics, "metrics");

        final String provider = normalizeUpper(metrics.getString(KEY_PROVIDER, DEFAULT_PROVIDER));
        final int stepSec = clampInt(metrics.getInt(KEY_STEP_SECONDS, DEFAULT_STEP_SECONDS), 1, 3_600);

        final Map<String, String> tags = new LinkedHashMap<>();
        metrics.section(KEY_TAGS).asMap().forEach((k, v) -> {
            if (k == null || v == null) return;
            final String tagKey = k.trim();
            final String tagValue = String.valueOf(v).trim();
            if (!tagKey.isEmpty() && !tagValue.isEmpty()) {
                tags.put(tagKey, tagValue);
            }
        });

        // 0 asks the OS for a free port
        final int promPort = clampInt(metrics.getInt(KEY_PROM_PORT, DEFAULT_PROM_PORT), 0, 65_535);
        String promPath = normalize(metrics.getString(KEY_PROM_PATH, DEFAULT_PROM_PATH));
        if (promPath == null) promPath = DEFAULT_PROM_PATH;
        if (!promPath.startsWith("/")) promPath = "/" + promPath;

        return new MetricsSettings(
                provider == null ? DEFAULT_PROVIDER : provider,
                Collections.unmodifiableMap(tags),
                Duration.ofSeconds(stepSec),
                promPort,
                promPath
        );
    }

    /**
     * Common tags in Micrometer form, applied registry-wide by the providers.
     */
    public Tags meterTags() {
        final List<Tag> out = new ArrayList<>(commonTags.size());
        commonTags.forEach((k, v) -> out.add(Tag.of(k, v)));
        return out.isEmpty() ? Tags.empty() : Tags.of(out);
    }

    @Override
    public String toString() {
        return "MetricsSettings{" +
                "providerId='" + providerId + '\'' +
                ", commonTags=" + commonTags +
                ", step=" + step +
                ", prometheusPort=" + prometheusPort +
                ", prometheusPath='" + prometheusPath + '\'' +
                '}';
    }

    // --- Helpers ---

    private static String normalize(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static String normalizeUpper(String s) {
        String n = normalize(s);
        return (n != null) ? n.toUpperCase(Locale.ROOT) : null;
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }
}
