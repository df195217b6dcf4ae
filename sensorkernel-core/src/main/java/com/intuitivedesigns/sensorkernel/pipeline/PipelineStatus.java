/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.pipeline;

import java.util.Map;

/**
 * Polled view of a pipeline, safe to hand to another thread.
 *
 * @param components per-stage details, including whatever a {@code StatusReporter} stage adds
 * @param queues     current depth per channel
 * @param workers    liveness per worker thread
 */
public record PipelineStatus(
        String id,
        PipelineState state,
        boolean running,
        boolean paused,
        MetricsSnapshot metrics,
        Map<String, Map<String, Object>> components,
        Map<String, Integer> queues,
        Map<String, Boolean> workers
) {

    public PipelineStatus {
        metrics = metrics == null ? MetricsSnapshot.empty() : metrics;
        components = components == null ? Map.of() : Map.copyOf(components);
        queues = queues == null ? Map.of() : Map.copyOf(queues);
        workers = workers == null ? Map.of() : Map.copyOf(workers);
    }

    public boolean anyWorkerAlive() {
        return workers.containsValue(Boolean.TRUE);
    }
}
