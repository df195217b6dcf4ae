/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.pipeline;

import org.slf4j.Logger;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-threaded mode: each chunk is pushed depth-first through the whole graph before the next
 * one is read. Channels stay empty; the graph edges are followed with direct calls.
 */
final class SequentialDriver implements Runnable {

    private final StageGraph graph;
    private final ExecutionSettings settings;
    private final AtomicBoolean cancelled;
    private final AtomicBoolean paused;
    private final Logger log;

    SequentialDriver(StageGraph graph, ExecutionSettings settings, AtomicBoolean cancelled, AtomicBoolean paused, Logger log) {
        this.graph = graph;
        this.settings = settings;
        this.cancelled = cancelled;
        this.paused = paused;
        this.log = log;
    }

    @Override
    public void run() {
        log.debug("Sequential driver started");
        final StageNode decoder = graph.decoderNode();
        try {
            new ReaderPump(graph.source(), settings, cancelled, paused, log)
                    .pump(chunk -> deliver(decoder, chunk));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Sequential driver interrupted");
        } catch (RuntimeException | Error e) {
            log.error("Sequential driver crashed", e);
        }
        log.debug("Sequential driver finished");
    }

    private void deliver(StageNode node, Object item) {
        if (node.escalated()) return;

        StageResult result = node.handle(item);
        if (!result.isSuccess() || result.outputs().isEmpty()) return;

        node.tap(result.outputs());
        for (Object out : result.outputs()) {
            for (StageNode next : node.downstream()) {
                deliver(next, out);
            }
        }
    }
}
