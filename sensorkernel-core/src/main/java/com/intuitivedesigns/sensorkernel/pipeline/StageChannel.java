/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.BooleanSupplier;

/**
 * Queue feeding one consumer stage from one or more producer stages.
 *
 * <p><b>Backpressure:</b> {@link #push} offers with a timeout and retries a bounded number of
 * times; after that the item is dropped and counted. Producers never block indefinitely.</p>
 *
 * <p><b>End of stream:</b> each registered producer calls {@link #complete(String)} once. The
 * channel enqueues a single private end marker only after every producer has completed, so a
 * fan-in consumer never stops while one of its producers is still emitting.</p>
 *
 * @param <T> item type
 */
public final class StageChannel<T> {

    private static final Logger log = LoggerFactory.getLogger(StageChannel.class);

    private static final Object END_OF_STREAM = new Object();

    private final String name;
    private final int capacity;
    private final BlockingQueue<Object> queue;
    private final long pushTimeoutMs;
    private final int pushRetries;
    private final BooleanSupplier cancelled;

    private final Set<String> producers = ConcurrentHashMap.newKeySet();
    private final Set<String> completed = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean endEnqueued = new AtomicBoolean(false);
    private volatile boolean endObserved;
    private volatile boolean abandoned;

    private final LongAdder accepted = new LongAdder();
    private final AtomicLong dropped = new AtomicLong();

    /**
     * @param capacity    queue bound; {@code <= 0} means unbounded
     * @param cancelled   pipeline cancellation flag, consulted while waiting
     */
    public StageChannel(String name, int capacity, long pushTimeoutMs, int pushRetries, BooleanSupplier cancelled) {
        this.name = Objects.requireNonNull(name, "name");
        this.capacity = Math.max(0, capacity);
        this.queue = capacity > 0 ? new ArrayBlockingQueue<>(capacity) : new LinkedBlockingQueue<>();
        this.pushTimeoutMs = Math.max(0L, pushTimeoutMs);
        this.pushRetries = Math.max(0, pushRetries);
        this.cancelled = cancelled == null ? () -> false : cancelled;
    }

    // -------------------------------------------------------------------------
    // Producer side
    // -------------------------------------------------------------------------

    public void addProducer(String producer) {
        producers.add(Objects.requireNonNull(producer, "producer"));
    }

    /**
     * Forgets a producer that will never run (e.g. a detached stage). May release the end marker.
     */
    public void removeProducer(String producer) {
        producers.remove(producer);
        completed.remove(producer);
        maybeEnd();
    }

    /**
     * @return true if the item was enqueued, false if it was dropped
     */
    public boolean push(T item) throws InterruptedException {
        Objects.requireNonNull(item, "item");
        if (abandoned) {
            dropped.incrementAndGet();
            return false;
        }

        for (int attempt = 0; attempt <= pushRetries; attempt++) {
            if (queue.offer(item, pushTimeoutMs, TimeUnit.MILLISECONDS)) {
                accepted.increment();
                return true;
            }
            if (cancelled.getAsBoolean() || abandoned) break;
        }

        long total = dropped.incrementAndGet();
        log.warn("Backpressure: dropped item on channel '{}' (capacity={}, dropped={})", name, capacity, total);
        return false;
    }

    /**
     * Marks {@code producer} finished. Idempotent; unknown producers are ignored.
     */
    public void complete(String producer) {
        if (!producers.contains(producer)) return;
        completed.add(producer);
        maybeEnd();
    }

    /**
     * Completes on behalf of every producer. Used by shutdown.
     */
    public void completeAll() {
        completed.addAll(producers);
        maybeEnd();
    }

    // -------------------------------------------------------------------------
    // Consumer side
    // -------------------------------------------------------------------------

    /**
     * @return the next item, or null on timeout or once the end marker has been taken
     */
    @SuppressWarnings("unchecked")
    public T poll(long timeout, TimeUnit unit) throws InterruptedException {
        if (endObserved) return null;
        Object next = queue.poll(timeout, unit);
        if (next == END_OF_STREAM) {
            endObserved = true;
            return null;
        }
        return (T) next;
    }

    public boolean endObserved() {
        return endObserved;
    }

    /**
     * Called when the consumer exits early. Pending and future items are discarded.
     */
    public void abandon() {
        abandoned = true;
        queue.clear();
    }

    // -------------------------------------------------------------------------
    // Introspection
    // -------------------------------------------------------------------------

    public String name() {
        return name;
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Items waiting, excluding the end marker.
     */
    public int size() {
        int size = queue.size();
        if (endEnqueued.get() && !endObserved && size > 0) size--;
        return size;
    }

    public long accepted() {
        return accepted.sum();
    }

    public long dropped() {
        return dropped.get();
    }

    public Set<String> producers() {
        return Set.copyOf(producers);
    }

    public boolean isComplete() {
        return endEnqueued.get();
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private void maybeEnd() {
        if (!completed.containsAll(producers)) return;
        if (endEnqueued.compareAndSet(false, true)) {
            enqueueEnd();
        }
    }

    // Waits for room like a normal push, but never gives up. Under cancellation the backlog is
    // discarded to make room for the marker.
    private void enqueueEnd() {
        boolean interrupted = false;
        while (true) {
            try {
                if (queue.offer(END_OF_STREAM, Math.max(1L, pushTimeoutMs), TimeUnit.MILLISECONDS)) break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
            if (interrupted || cancelled.getAsBoolean() || abandoned) {
                List<Object> discarded = new ArrayList<>();
                queue.drainTo(discarded);
                if (!discarded.isEmpty()) {
                    log.debug("Channel '{}' discarded {} pending items at shutdown", name, discarded.size());
                }
                if (queue.offer(END_OF_STREAM)) break;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public String toString() {
        return "StageChannel[" + name + ", size=" + size() + ", capacity=" + capacity + ", dropped=" + dropped() + "]";
    }
}
