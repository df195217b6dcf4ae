/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.pipeline;

import com.intuitivedesigns.sensorkernel.core.Reader;
import com.intuitivedesigns.sensorkernel.core.StageRuntimeException;
import org.slf4j.Logger;

import java.util.Iterator;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pulls chunks from the reader until end of stream or cancellation. Shared by the concurrent
 * reader worker and the sequential driver; only the chunk sink differs.
 */
final class ReaderPump {

    @FunctionalInterface
    interface ChunkSink {
        void accept(byte[] chunk) throws InterruptedException;
    }

    private final StageNode node;
    private final ExecutionSettings settings;
    private final AtomicBoolean cancelled;
    private final AtomicBoolean paused;
    private final Logger log;

    ReaderPump(StageNode node, ExecutionSettings settings, AtomicBoolean cancelled, AtomicBoolean paused, Logger log) {
        this.node = node;
        this.settings = settings;
        this.cancelled = cancelled;
        this.paused = paused;
        this.log = log;
    }

    void pump(ChunkSink sink) throws InterruptedException {
        final Reader reader = (Reader) node.stage();
        final Iterator<byte[]> chunks;
        try {
            chunks = reader.read();
        } catch (Exception e) {
            node.recordFailure(new StageRuntimeException(node.name(), e), null);
            log.error("Reader '{}' could not start reading; ending stream", node.type(), e);
            return;
        }
        if (chunks == null) return;

        long backoffMs = settings.readerBackoffInitialMs();
        while (!cancelled.get()) {
            if (paused.get()) {
                Thread.sleep(settings.pauseIntervalMs());
                continue;
            }

            final byte[] chunk;
            try {
                if (!chunks.hasNext()) {
                    log.info("Reader '{}' reached end of stream after {} chunks", node.type(), node.items());
                    return;
                }
                chunk = chunks.next();
                backoffMs = settings.readerBackoffInitialMs();
            } catch (RuntimeException e) {
                node.recordFailure(new StageRuntimeException(node.name(), e), null);
                if (settings.readerFailFast()) {
                    log.error("Reader '{}' failed; fail-fast enabled, ending stream", node.type(), e);
                    return;
                }
                log.warn("Reader '{}' failed (retrying in {}ms): {}", node.type(), backoffMs, e.getMessage());
                Thread.sleep(backoffMs);
                backoffMs = Math.min(backoffMs * 2, settings.readerBackoffMaxMs());
                continue;
            }

            if (chunk == null) continue;
            node.recordSuccess();
            sink.accept(chunk);
        }
    }
}
