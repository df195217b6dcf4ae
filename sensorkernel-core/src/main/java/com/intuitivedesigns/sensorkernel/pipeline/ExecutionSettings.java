/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.pipeline;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;

/**
 * Queueing, timeout and retry knobs of one pipeline.
 *
 * @param queueSize             capacity of every stage channel; {@code <= 0} means unbounded
 * @param pushTimeoutMs         how long a producer waits for room per attempt
 * @param pushRetries           extra attempts before an item is dropped
 * @param pollTimeoutMs         how long a consumer waits before re-checking the cancellation flag
 * @param joinTimeoutMs         how long {@code stop()} waits for each worker
 * @param pauseIntervalMs       sleep between checks while paused
 * @param maxItemRetries        retries of a failed item before it is dropped
 * @param historySize           written-stream records kept for export; 0 disables
 * @param readerBackoffInitialMs first wait after a reader failure
 * @param readerBackoffMaxMs    cap of the doubling reader backoff
 * @param readerFailFast        end the stream on the first reader failure instead of backing off
 */
public record ExecutionSettings(
        int queueSize,
        long pushTimeoutMs,
        int pushRetries,
        long pollTimeoutMs,
        long joinTimeoutMs,
        long pauseIntervalMs,
        int maxItemRetries,
        int historySize,
        long readerBackoffInitialMs,
        long readerBackoffMaxMs,
        boolean readerFailFast
) {

    public static final String CFG_QUEUE_SIZE = "queue_size";
    public static final String CFG_PUSH_TIMEOUT_MS = "push_timeout_ms";
    public static final String CFG_PUSH_RETRIES = "push_retries";
    public static final String CFG_POLL_TIMEOUT_MS = "poll_timeout_ms";
    public static final String CFG_JOIN_TIMEOUT_MS = "join_timeout_ms";
    public static final String CFG_PAUSE_INTERVAL_MS = "pause_interval_ms";
    public static final String CFG_MAX_ITEM_RETRIES = "max_item_retries";
    public static final String CFG_HISTORY_SIZE = "history_size";
    public static final String CFG_READER_BACKOFF_INITIAL_MS = "reader_backoff_initial_ms";
    public static final String CFG_READER_BACKOFF_MAX_MS = "reader_backoff_max_ms";
    public static final String CFG_READER_FAIL_FAST = "reader_fail_fast";

    public static final int DEFAULT_QUEUE_SIZE = 100;
    public static final long DEFAULT_PUSH_TIMEOUT_MS = 1_000L;
    public static final int DEFAULT_PUSH_RETRIES = 0;
    public static final long DEFAULT_POLL_TIMEOUT_MS = 100L;
    public static final long DEFAULT_JOIN_TIMEOUT_MS = 2_000L;
    public static final long DEFAULT_PAUSE_INTERVAL_MS = 10L;
    public static final int DEFAULT_MAX_ITEM_RETRIES = 0;
    public static final int DEFAULT_HISTORY_SIZE = 1_000;
    public static final long DEFAULT_READER_BACKOFF_INITIAL_MS = 250L;
    public static final long DEFAULT_READER_BACKOFF_MAX_MS = 5_000L;

    public ExecutionSettings {
        pushTimeoutMs = Math.max(0L, pushTimeoutMs);
        pushRetries = Math.max(0, pushRetries);
        pollTimeoutMs = Math.max(1L, pollTimeoutMs);
        joinTimeoutMs = Math.max(0L, joinTimeoutMs);
        pauseIntervalMs = Math.max(1L, pauseIntervalMs);
        maxItemRetries = Math.max(0, maxItemRetries);
        historySize = Math.max(0, historySize);
        readerBackoffInitialMs = Math.max(1L, readerBackoffInitialMs);
        readerBackoffMaxMs = Math.max(readerBackoffInitialMs, readerBackoffMaxMs);
    }

    public static ExecutionSettings defaults() {
        return from(ConfigSection.empty());
    }

    public static ExecutionSettings from(ConfigSection section) {
        return new ExecutionSettings(
                section.getInt(CFG_QUEUE_SIZE, DEFAULT_QUEUE_SIZE),
                section.getLong(CFG_PUSH_TIMEOUT_MS, DEFAULT_PUSH_TIMEOUT_MS),
                section.getInt(CFG_PUSH_RETRIES, DEFAULT_PUSH_RETRIES),
                section.getLong(CFG_POLL_TIMEOUT_MS, DEFAULT_POLL_TIMEOUT_MS),
                section.getLong(CFG_JOIN_TIMEOUT_MS, DEFAULT_JOIN_TIMEOUT_MS),
                section.getLong(CFG_PAUSE_INTERVAL_MS, DEFAULT_PAUSE_INTERVAL_MS),
                section.getInt(CFG_MAX_ITEM_RETRIES, DEFAULT_MAX_ITEM_RETRIES),
                section.getInt(CFG_HISTORY_SIZE, DEFAULT_HISTORY_SIZE),
                section.getLong(CFG_READER_BACKOFF_INITIAL_MS, DEFAULT_READER_BACKOFF_INITIAL_MS),
                section.getLong(CFG_READER_BACKOFF_MAX_MS, DEFAULT_READER_BACKOFF_MAX_MS),
                section.getBoolean(CFG_READER_FAIL_FAST, false)
        );
    }
}
