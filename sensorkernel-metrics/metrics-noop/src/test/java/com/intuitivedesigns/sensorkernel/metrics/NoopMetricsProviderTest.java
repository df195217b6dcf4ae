/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.metrics;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NoopMetricsProviderTest {

    private static MetricsSettings settings(String provider) {
        return MetricsSettings.from(ConfigSection.of(Map.of("provider", provider)));
    }

    @Test
    void testMatchesOnlyNoop() {
        NoopMetricsProvider provider = new NoopMetricsProvider();

        assertNotNull(provider.create(settings("noop")));
        assertNull(provider.create(settings("PROMETHEUS")));
        assertNull(provider.create(null));
    }

    @Test
    void testDiscoveredThroughFactory() {
        MetricsRuntime runtime = MetricsFactory.init(settings("NOOP"));

        assertSame(MetricsRuntime.noop(), runtime);
        // Instrumentation calls are accepted and ignored
        runtime.counter("sensorkernel.stage.items", 1.0, Map.of("stage", "decoder"));
        runtime.gauge("sensorkernel.channel.depth", 3);
        runtime.close();
    }
}
