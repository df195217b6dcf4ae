/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.pipeline;

import org.slf4j.Logger;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Body of one stage thread in concurrent mode.
 *
 * <p>Whatever way the loop ends (end of stream, cancellation, escalation, crash), the worker
 * completes each of its output channels exactly once so downstream stages can finish.</p>
 */
final class StageWorker implements Runnable {

    private final StageNode node;
    private final ExecutionSettings settings;
    private final AtomicBoolean cancelled;
    private final AtomicBoolean paused;
    private final Logger log;

    StageWorker(StageNode node, ExecutionSettings settings, AtomicBoolean cancelled, AtomicBoolean paused, Logger log) {
        this.node = node;
        this.settings = settings;
        this.cancelled = cancelled;
        this.paused = paused;
        this.log = log;
    }

    @Override
    public void run() {
        log.debug("Worker '{}' started", node.name());
        try {
            if (node.input() == null) {
                new ReaderPump(node, settings, cancelled, paused, log)
                        .pump(chunk -> node.emit(List.<Object>of(chunk)));
            } else {
                consume();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Worker '{}' interrupted", node.name());
        } catch (RuntimeException | Error e) {
            log.error("Worker '{}' crashed", node.name(), e);
        } finally {
            node.completeOutputs();
            if (node.input() != null && !node.input().endObserved()) {
                node.input().abandon();
            }
            log.debug("Worker '{}' finished (items={}, errors={})", node.name(), node.items(), node.errors());
        }
    }

    private void consume() throws InterruptedException {
        final StageChannel<Object> input = node.input();
        while (!cancelled.get()) {
            if (paused.get()) {
                Thread.sleep(settings.pauseIntervalMs());
                continue;
            }

            Object item = input.poll(settings.pollTimeoutMs(), TimeUnit.MILLISECONDS);
            if (item == null) {
                if (input.endObserved()) break;
                continue;
            }

            StageResult result = node.handle(item);
            if (result.isSuccess()) {
                node.emit(result.outputs());
            } else if (node.escalated()) {
                break;
            }
        }
    }
}
