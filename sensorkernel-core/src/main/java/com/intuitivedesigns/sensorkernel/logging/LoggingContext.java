/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Diagnostic context handed from the application into the engine, registry and executors.
 *
 * <p>A context is a set of MDC fields ({@code pipeline}, {@code stage}...) plus a logger factory.
 * It is built once at startup and narrowed with {@link #with(String, String)}; it only ever scopes
 * MDC values on the calling thread and never touches the logging backend configuration.</p>
 */
public final class LoggingContext {

    public static final String MDC_APPLICATION = "app";
    public static final String MDC_PIPELINE = "pipeline";
    public static final String MDC_STAGE = "stage";

    private final Map<String, String> fields;

    private LoggingContext(Map<String, String> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    public static LoggingContext root(String application) {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put(MDC_APPLICATION, Objects.requireNonNull(application, "application"));
        return new LoggingContext(fields);
    }

    public LoggingContext with(String key, String value) {
        Map<String, String> next = new LinkedHashMap<>(fields);
        next.put(Objects.requireNonNull(key, "key"), value == null ? "" : value);
        return new LoggingContext(next);
    }

    public LoggingContext forPipeline(String pipelineId) {
        return with(MDC_PIPELINE, pipelineId);
    }

    public LoggingContext forStage(String stage) {
        return with(MDC_STAGE, stage);
    }

    public Logger logger(Class<?> type) {
        return LoggerFactory.getLogger(type);
    }

    public Map<String, String> fields() {
        return fields;
    }

    /**
     * Puts this context's fields into the MDC until the returned scope is closed, then restores
     * whatever the thread had before.
     */
    public Scope open() {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        fields.forEach(MDC::put);
        return new Scope(previous);
    }

    /**
     * Wraps a task so it runs with this context in the MDC of whichever thread executes it.
     */
    public Runnable wrap(Runnable task) {
        Objects.requireNonNull(task, "task");
        return () -> {
            try (Scope ignored = open()) {
                task.run();
            }
        };
    }

    @Override
    public String toString() {
        return "LoggingContext" + fields;
    }

    public static final class Scope implements AutoCloseable {
        private final Map<String, String> previous;

        private Scope(Map<String, String> previous) {
            this.previous = previous;
        }

        @Override
        public void close() {
            if (previous == null) {
                MDC.clear();
            } else {
                MDC.setContextMap(previous);
            }
        }
    }
}
