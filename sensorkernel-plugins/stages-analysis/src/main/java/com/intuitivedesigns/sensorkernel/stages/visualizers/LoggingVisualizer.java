/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.stages.visualizers;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.SensorData;
import com.intuitivedesigns.sensorkernel.core.StatusReporter;
import com.intuitivedesigns.sensorkernel.core.Visualizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Prints every {@code every_n}-th record to the log at INFO ({@code level: debug} lowers it).
 */
public final class LoggingVisualizer implements Visualizer, StatusReporter {

    private static final Logger log = LoggerFactory.getLogger(LoggingVisualizer.class);

    public static final String CFG_EVERY_N = "every_n";
    public static final String CFG_LEVEL = "level";

    private final long everyN;
    private final boolean debug;

    private final AtomicLong seen = new AtomicLong();
    private final AtomicLong shown = new AtomicLong();

    public LoggingVisualizer(ConfigSection config) {
        this.everyN = Math.max(1L, config.getLong(CFG_EVERY_N, 1L));
        this.debug = "debug".equalsIgnoreCase(config.getString(CFG_LEVEL, "info").trim());
    }

    @Override
    public void visualize(SensorData record) {
        long n = seen.incrementAndGet();
        if ((n - 1) % everyN != 0) return;
        shown.incrementAndGet();

        if (debug) {
            log.debug("[{}] {} @ {}: {}", record.sensorId(), record.dataType(), record.timestamp(), record.values());
        } else {
            log.info("[{}] {} @ {}: {}", record.sensorId(), record.dataType(), record.timestamp(), record.values());
        }
    }

    @Override
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("seen", seen.get());
        status.put("shown", shown.get());
        status.put("every_n", everyN);
        return status;
    }
}
