/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.stages.processors;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.Processor;
import com.intuitivedesigns.sensorkernel.core.SensorData;
import com.intuitivedesigns.sensorkernel.core.StageLifecycle;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Replaces numeric channels with their mean over the last {@code window_size} records of the same
 * sensor. Non-numeric channels pass through unchanged.
 *
 * <p>Config keys: {@code window_size} (default 5), {@code channels} (default: every numeric
 * channel).</p>
 */
public final class MovingAverage implements Processor, StageLifecycle {

    public static final String CFG_WINDOW_SIZE = "window_size";
    public static final String CFG_CHANNELS = "channels";

    private static final int DEFAULT_WINDOW_SIZE = 5;

    private final int windowSize;
    private final Set<String> channels;

    // sensorId -> channel -> window
    private final Map<String, Map<String, Window>> windows = new HashMap<>();

    public MovingAverage(ConfigSection config) {
        this.windowSize = Math.max(1, config.getInt(CFG_WINDOW_SIZE, DEFAULT_WINDOW_SIZE));
        this.channels = new LinkedHashSet<>(config.getStringList(CFG_CHANNELS));
    }

    @Override
    public List<SensorData> process(SensorData record) {
        Map<String, Window> perSensor = windows.computeIfAbsent(record.sensorId(), k -> new HashMap<>());

        Map<String, Object> smoothed = new LinkedHashMap<>(record.values());
        for (Map.Entry<String, Object> e : record.values().entrySet()) {
            if (!NumericChannels.selected(channels, e.getKey())) continue;
            OptionalDouble value = NumericChannels.asDouble(e.getValue());
            if (value.isEmpty()) continue;

            Window window = perSensor.computeIfAbsent(e.getKey(), k -> new Window(windowSize));
            smoothed.put(e.getKey(), window.add(value.getAsDouble()));
        }

        return List.of(record.withValues(smoothed).withMetadataEntry("smoothing", "moving_average:" + windowSize));
    }

    @Override
    public void teardown() {
        windows.clear();
    }

    public int windowSize() {
        return windowSize;
    }

    private static final class Window {
        private final int capacity;
        private final ArrayDeque<Double> samples;
        private double sum;

        Window(int capacity) {
            this.capacity = capacity;
            this.samples = new ArrayDeque<>(capacity);
        }

        double add(double sample) {
            if (samples.size() == capacity) {
                sum -= samples.removeFirst();
            }
            samples.addLast(sample);
            sum += sample;
            return sum / samples.size();
        }
    }
}
