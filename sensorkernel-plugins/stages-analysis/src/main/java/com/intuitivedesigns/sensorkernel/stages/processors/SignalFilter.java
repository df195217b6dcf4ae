/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.stages.processors;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.ConfigurationException;
import com.intuitivedesigns.sensorkernel.core.Processor;
import com.intuitivedesigns.sensorkernel.core.SensorData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * First-order RC filter applied per sensor and channel.
 *
 * <ul>
 *   <li>{@code lowpass}: {@code y[n] = a * x[n] + (1 - a) * y[n-1]}</li>
 *   <li>{@code highpass}: {@code y[n] = a * (y[n-1] + x[n] - x[n-1])}</li>
 *   <li>{@code none}: records pass through</li>
 * </ul>
 *
 * <p>Low-pass uses {@code a = dt / (dt + rc)}, high-pass {@code a = rc / (rc + dt)}, with
 * {@code rc = 1 / (2 pi cutoff_freq)} and {@code dt = 1 / sample_rate}. The first sample of a
 * channel seeds the filter state.</p>
 */
public final class SignalFilter implements Processor {

    private static final Logger log = LoggerFactory.getLogger(SignalFilter.class);

    public static final String CFG_FILTER_TYPE = "filter_type";
    public static final String CFG_CUTOFF_FREQ = "cutoff_freq";
    public static final String CFG_SAMPLE_RATE = "sample_rate";
    public static final String CFG_CHANNELS = "channels";

    enum Mode { NONE, LOWPASS, HIGHPASS }

    private final Mode mode;
    private final double alpha;
    private final Set<String> channels;

    private final Map<String, double[]> state = new HashMap<>();

    public SignalFilter(ConfigSection config) {
        String type = config.getString(CFG_FILTER_TYPE, "none").trim().toUpperCase(Locale.ROOT);
        try {
            this.mode = Mode.valueOf(type);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown filter_type '" + type.toLowerCase(Locale.ROOT)
                    + "' (expected none, lowpass or highpass)");
        }

        double cutoff = config.getDouble(CFG_CUTOFF_FREQ, 10.0);
        double sampleRate = config.getDouble(CFG_SAMPLE_RATE, 100.0);
        if (cutoff <= 0 || sampleRate <= 0) {
            throw new ConfigurationException("cutoff_freq and sample_rate must be positive");
        }
        double rc = 1.0 / (2 * Math.PI * cutoff);
        double dt = 1.0 / sampleRate;
        this.alpha = mode == Mode.HIGHPASS ? rc / (rc + dt) : dt / (dt + rc);
        this.channels = new LinkedHashSet<>(config.getStringList(CFG_CHANNELS));

        log.info("Initialized {} filter with cutoff {}Hz, alpha {}", mode.name().toLowerCase(Locale.ROOT), cutoff, alpha);
    }

    @Override
    public List<SensorData> process(SensorData record) {
        if (mode == Mode.NONE) return List.of(record);

        Map<String, Object> filtered = new LinkedHashMap<>(record.values());
        for (Map.Entry<String, Object> e : record.values().entrySet()) {
            if (!NumericChannels.selected(channels, e.getKey())) continue;
            OptionalDouble value = NumericChannels.asDouble(e.getValue());
            if (value.isEmpty()) continue;
            filtered.put(e.getKey(), apply(record.sensorId() + '/' + e.getKey(), value.getAsDouble()));
        }
        return List.of(record.withValues(filtered).withMetadataEntry("filter", mode.name().toLowerCase(Locale.ROOT)));
    }

    // state: {previous input, previous output}
    private double apply(String key, double x) {
        double[] last = state.get(key);
        if (last == null) {
            double seed = mode == Mode.HIGHPASS ? 0.0 : x;
            state.put(key, new double[] {x, seed});
            return seed;
        }
        double y = mode == Mode.LOWPASS
                ? alpha * x + (1 - alpha) * last[1]
                : alpha * (last[1] + x - last[0]);
        last[0] = x;
        last[1] = y;
        return y;
    }

    double alpha() {
        return alpha;
    }
}
