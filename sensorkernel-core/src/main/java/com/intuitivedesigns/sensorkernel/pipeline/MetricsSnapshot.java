/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.pipeline;

import com.intuitivedesigns.sensorkernel.spi.PluginKind;

import java.time.Instant;
import java.util.Map;

/**
 * Point-in-time copy of a pipeline's counters.
 *
 * @param stageCounts items handled per stage name ("reader", "processor-0"...)
 * @param kindCounts  the same summed per kind, keyed "read", "decoded", ..., "written"
 * @param errors      failed items per stage name
 * @param dropped     backpressure drops per channel name
 * @param startTime   first RUNNING transition since setup; null before it
 * @param throughput  written records per second since {@code startTime}
 */
public record MetricsSnapshot(
        Map<String, Long> stageCounts,
        Map<String, Long> kindCounts,
        Map<String, Long> errors,
        Map<String, Long> dropped,
        Instant startTime,
        double throughput
) {

    public MetricsSnapshot {
        stageCounts = stageCounts == null ? Map.of() : Map.copyOf(stageCounts);
        kindCounts = kindCounts == null ? Map.of() : Map.copyOf(kindCounts);
        errors = errors == null ? Map.of() : Map.copyOf(errors);
        dropped = dropped == null ? Map.of() : Map.copyOf(dropped);
    }

    public static MetricsSnapshot empty() {
        return new MetricsSnapshot(Map.of(), Map.of(), Map.of(), Map.of(), null, 0.0);
    }

    public long count(PluginKind kind) {
        return kindCounts.getOrDefault(kind.counterName(), 0L);
    }

    public long read() {
        return count(PluginKind.READER);
    }

    public long written() {
        return count(PluginKind.WRITER);
    }

    public long totalErrors() {
        return errors.values().stream().mapToLong(Long::longValue).sum();
    }

    public long totalDropped() {
        return dropped.values().stream().mapToLong(Long::longValue).sum();
    }
}
