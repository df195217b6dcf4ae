/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.testing;

import com.intuitivedesigns.sensorkernel.core.Reader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Emits the sequence numbers {@code 0..count-1} as UTF-8 chunks, or an endless sequence.
 */
public final class MemoryReader implements Reader {

    private final int count;
    private final long delayMs;
    private final boolean failOpen;

    public final AtomicBoolean opened = new AtomicBoolean();
    public final AtomicBoolean closed = new AtomicBoolean();
    public final AtomicInteger emitted = new AtomicInteger();

    private MemoryReader(int count, long delayMs, boolean failOpen) {
        this.count = count;
        this.delayMs = delayMs;
        this.failOpen = failOpen;
    }

    public static MemoryReader of(int count) {
        return new MemoryReader(count, 0L, false);
    }

    public static MemoryReader endless(long delayMs) {
        return new MemoryReader(-1, delayMs, false);
    }

    public static MemoryReader failingOpen() {
        return new MemoryReader(0, 0L, true);
    }

    @Override
    public void open() throws IOException {
        if (failOpen) throw new IOException("device unavailable");
        opened.set(true);
    }

    @Override
    public Iterator<byte[]> read() {
        return new Iterator<>() {
            private int next;

            @Override
            public boolean hasNext() {
                return count < 0 || next < count;
            }

            @Override
            public byte[] next() {
                if (!hasNext()) throw new NoSuchElementException();
                if (delayMs > 0) {
                    try {
                        Thread.sleep(delayMs);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                emitted.incrementAndGet();
                return Integer.toString(next++).getBytes(StandardCharsets.UTF_8);
            }
        };
    }

    @Override
    public void close() {
        closed.set(true);
    }
}
