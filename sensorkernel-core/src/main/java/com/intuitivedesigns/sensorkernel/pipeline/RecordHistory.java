/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.pipeline;

import com.intuitivedesigns.sensorkernel.core.SensorData;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Last {@code capacity} records of the writer stream, kept for on-demand export.
 */
final class RecordHistory {

    private final int capacity;
    private final ArrayDeque<SensorData> records;
    private final ReentrantLock lock = new ReentrantLock();

    RecordHistory(int capacity) {
        this.capacity = Math.max(0, capacity);
        this.records = new ArrayDeque<>(Math.min(this.capacity, 1024));
    }

    void add(SensorData record) {
        if (capacity == 0) return;
        lock.lock();
        try {
            if (records.size() == capacity) {
                records.pollFirst();
            }
            records.addLast(record);
        } finally {
            lock.unlock();
        }
    }

    List<SensorData> snapshot() {
        lock.lock();
        try {
            return List.copyOf(new ArrayList<>(records));
        } finally {
            lock.unlock();
        }
    }

    int size() {
        lock.lock();
        try {
            return records.size();
        } finally {
            lock.unlock();
        }
    }

    void clear() {
        lock.lock();
        try {
            records.clear();
        } finally {
            lock.unlock();
        }
    }
}
