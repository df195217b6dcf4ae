/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.metrics;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PrometheusMetricsProviderTest {

    @Test
    void testIgnoresOtherProviders() {
        MetricsSettings settings = MetricsSettings.from(ConfigSection.of(Map.of("provider", "NOOP")));

        assertNull(new PrometheusMetricsProvider().create(settings));
    }

    @Test
    void testScrapeEndpointServesKernelMeters() throws Exception {
        // Setup
        PrometheusMeterRegistry registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
        PrometheusMetricsProvider.ServerHandle handle = PrometheusMetricsProvider.start(registry, 0, "/metrics");

        try (MicrometerMetricsRuntime runtime = new MicrometerMetricsRuntime(registry, handle)) {
            runtime.counter("sensorkernel.stage.items", 3.0, Map.of("pipeline", "imu", "stage", "decoder"));
            runtime.gauge("sensorkernel.channel.depth", 7, Map.of("pipeline", "imu", "channel", "decoder.in"));

            // Act
            HttpURLConnection conn = (HttpURLConnection)
                    new URL("http://127.0.0.1:" + handle.port() + "/metrics").openConnection();
            int status = conn.getResponseCode();
            String body;
            try (InputStream in = conn.getInputStream()) {
                body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } finally {
                conn.disconnect();
            }

            // Assert
            assertEquals(200, status);
            assertTrue(body.contains("sensorkernel_stage_items_total"), body);
            assertTrue(body.contains("stage=\"decoder\""), body);
            assertTrue(body.contains("sensorkernel_channel_depth"), body);
        }
    }

    @Test
    void testFactorySelectsPrometheus() {
        MetricsSettings settings = MetricsSettings.from(ConfigSection.of(Map.of(
                "provider", "PROMETHEUS",
                "tags", Map.of("site", "lab"),
                "prometheus", Map.of("port", 0))));

        MetricsRuntime runtime = MetricsFactory.init(settings);
        try {
            assertTrue(runtime.enabled());
            assertEquals("MICROMETER", runtime.type());

            runtime.counter("sensorkernel.stage.items", 1.0, Map.of("stage", "decoder"));
            String body = ((CompositeMeterRegistry) runtime.registry()).getRegistries().stream()
                    .filter(PrometheusMeterRegistry.class::isInstance)
                    .map(PrometheusMeterRegistry.class::cast)
                    .findFirst()
                    .orElseThrow()
                    .scrape();
            assertTrue(body.contains("site=\"lab\""), body);
        } finally {
            runtime.close();
        }
    }
}
