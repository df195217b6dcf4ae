/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.testing;

import com.intuitivedesigns.sensorkernel.core.SensorData;
import com.intuitivedesigns.sensorkernel.core.Writer;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Collects written records in memory. Instances created by name through {@link #named(String)}
 * can be looked up again by tests that only see configuration.
 */
public final class MemoryWriter implements Writer {

    private static final Map<String, MemoryWriter> BY_NAME = new ConcurrentHashMap<>();

    private final List<SensorData> records = Collections.synchronizedList(new ArrayList<>());
    private final boolean failOpen;

    public final AtomicBoolean opened = new AtomicBoolean();
    public final AtomicBoolean closed = new AtomicBoolean();

    public MemoryWriter() {
        this(false);
    }

    private MemoryWriter(boolean failOpen) {
        this.failOpen = failOpen;
    }

    public static MemoryWriter failingOpen() {
        return new MemoryWriter(true);
    }

    public static MemoryWriter named(String name) {
        return BY_NAME.computeIfAbsent(name, n -> new MemoryWriter());
    }

    public static MemoryWriter lookup(String name) {
        return BY_NAME.get(name);
    }

    @Override
    public void open() throws IOException {
        if (failOpen) throw new IOException("disk full");
        opened.set(true);
    }

    @Override
    public long write(SensorData record) {
        records.add(record);
        return 1L;
    }

    @Override
    public void close() {
        closed.set(true);
    }

    public List<SensorData> records() {
        synchronized (records) {
            return new ArrayList<>(records);
        }
    }

    public List<SensorData> records(String dataType) {
        return records().stream().filter(r -> r.dataType().equals(dataType)).collect(Collectors.toList());
    }

    public int size() {
        return records.size();
    }
}
