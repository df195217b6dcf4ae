/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.sensorkernel.core;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Canonical sensor record passed between every stage of a pipeline.
 *
 * <p><b>Immutability:</b> the {@code values}, {@code units} and {@code metadata} maps are copied
 * into unmodifiable views on construction. Stages derive new records through the withers and never
 * mutate what they receive.</p>
 *
 * <p><b>Timestamps:</b> {@link #timestamp()} is seconds since the epoch. Records built through
 * {@link #builder()} coerce whatever the device produced; when that fails the wall clock is used
 * and {@link #META_TIMESTAMP_FALLBACK} is set in the metadata. The canonical constructor does the
 * same for a NaN or infinite timestamp.</p>
 *
 * @param timestamp    seconds since epoch
 * @param sensorId     producing sensor
 * @param dataType     record type (e.g. "accelerometer", or an analyzer's result type)
 * @param values       channel name to value
 * @param rawTimestamp device timestamp as received; diagnostic only, may be null
 * @param units        channel name to unit
 * @param metadata     free-form annotations
 */
public record SensorData(
        double timestamp,
        String sensorId,
        String dataType,
        Map<String, Object> values,
        Object rawTimestamp,
        Map<String, String> units,
        Map<String, Object> metadata
) {

    public static final String META_TIMESTAMP_FALLBACK = "timestamp_fallback";
    public static final String META_TIMESTAMP_FALLBACK_REASON = "timestamp_fallback_reason";

    public SensorData {
        sensorId = sensorId == null ? "unknown" : sensorId;
        dataType = dataType == null ? "unknown" : dataType;
        if (!Double.isFinite(timestamp)) {
            metadata = withFallback(metadata, "non-finite timestamp: " + timestamp);
            timestamp = wallClock();
        }
        values = freeze(values);
        units = freeze(units);
        metadata = freeze(metadata);
    }

    // -------------------------------------------------------------------------
    // Factories
    // -------------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builds a record from a raw device timestamp, falling back to the wall clock when it cannot
     * be coerced.
     */
    public static SensorData of(Object rawTimestamp, String sensorId, String dataType, Map<String, ?> values) {
        return builder()
                .timestamp(rawTimestamp)
                .sensorId(sensorId)
                .dataType(dataType)
                .values(values)
                .build();
    }

    /**
     * Attempts to turn a device timestamp into epoch seconds.
     * Accepts numbers, numeric strings and {@link Instant}. Non-finite values are rejected.
     */
    public static OptionalDouble coerceTimestamp(Object raw) {
        if (raw == null) return OptionalDouble.empty();

        double candidate;
        if (raw instanceof Number n) {
            candidate = n.doubleValue();
        } else if (raw instanceof Instant instant) {
            candidate = instant.getEpochSecond() + instant.getNano() / 1_000_000_000.0;
        } else if (raw instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            if (trimmed.isEmpty()) return OptionalDouble.empty();
            try {
                candidate = Double.parseDouble(trimmed);
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        } else {
            return OptionalDouble.empty();
        }
        return Double.isFinite(candidate) ? OptionalDouble.of(candidate) : OptionalDouble.empty();
    }

    // -------------------------------------------------------------------------
    // Withers
    // -------------------------------------------------------------------------

    public SensorData withValues(Map<String, ?> newValues) {
        return new SensorData(timestamp, sensorId, dataType, copy(newValues), rawTimestamp, units, metadata);
    }

    public SensorData withValue(String channel, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(values);
        next.put(channel, value);
        return new SensorData(timestamp, sensorId, dataType, next, rawTimestamp, units, metadata);
    }

    public SensorData withDataType(String newDataType) {
        return new SensorData(timestamp, sensorId, newDataType, values, rawTimestamp, units, metadata);
    }

    public SensorData withMetadata(Map<String, ?> newMetadata) {
        return new SensorData(timestamp, sensorId, dataType, values, rawTimestamp, units, copy(newMetadata));
    }

    public SensorData withMetadataEntry(String key, Object value) {
        Map<String, Object> next = new LinkedHashMap<>(metadata);
        next.put(key, value);
        return new SensorData(timestamp, sensorId, dataType, values, rawTimestamp, units, next);
    }

    /**
     * True when the timestamp came from the wall clock rather than the device.
     */
    public boolean timestampFallback() {
        return Boolean.TRUE.equals(metadata.get(META_TIMESTAMP_FALLBACK));
    }

    /**
     * Plain map view used by writers and exporters.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("timestamp", timestamp);
        out.put("sensor_id", sensorId);
        out.put("data_type", dataType);
        out.put("values", values);
        if (rawTimestamp != null) {
            out.put("raw_timestamp", rawTimestamp);
        }
        out.put("units", units);
        out.put("metadata", metadata);
        return out;
    }

    // -------------------------------------------------------------------------
    // Helpers
    // -------------------------------------------------------------------------

    // Tolerates null values inside the map, which Map.copyOf rejects.
    private static <V> Map<String, V> freeze(Map<String, V> source) {
        if (source == null || source.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    private static Map<String, Object> withFallback(Map<String, Object> source, String reason) {
        Map<String, Object> marked = source == null ? new LinkedHashMap<>() : new LinkedHashMap<>(source);
        marked.put(META_TIMESTAMP_FALLBACK, Boolean.TRUE);
        marked.put(META_TIMESTAMP_FALLBACK_REASON, reason);
        return marked;
    }

    private static double wallClock() {
        return System.currentTimeMillis() / 1000.0;
    }

    private static Map<String, Object> copy(Map<String, ?> source) {
        return source == null ? null : new LinkedHashMap<String, Object>(source);
    }

    public static final class Builder {
        private Object rawTimestamp;
        private String sensorId;
        private String dataType;
        private final Map<String, Object> values = new LinkedHashMap<>();
        private final Map<String, String> units = new LinkedHashMap<>();
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder() {}

        public Builder timestamp(Object raw) {
            this.rawTimestamp = raw;
            return this;
        }

        public Builder sensorId(String sensorId) {
            this.sensorId = sensorId;
            return this;
        }

        public Builder dataType(String dataType) {
            this.dataType = dataType;
            return this;
        }

        public Builder value(String channel, Object value) {
            values.put(Objects.requireNonNull(channel, "channel"), value);
            return this;
        }

        public Builder values(Map<String, ?> more) {
            if (more != null) values.putAll(more);
            return this;
        }

        public Builder unit(String channel, String unit) {
            units.put(Objects.requireNonNull(channel, "channel"), unit);
            return this;
        }

        public Builder units(Map<String, String> more) {
            if (more != null) units.putAll(more);
            return this;
        }

        public Builder metadata(String key, Object value) {
            metadata.put(Objects.requireNonNull(key, "key"), value);
            return this;
        }

        public Builder metadata(Map<String, ?> more) {
            if (more != null) metadata.putAll(more);
            return this;
        }

        public SensorData build() {
            OptionalDouble coerced = coerceTimestamp(rawTimestamp);
            if (coerced.isPresent()) {
                return new SensorData(coerced.getAsDouble(), sensorId, dataType, values, rawTimestamp, units, metadata);
            }
            // The builder may be reused, so the marker goes on a copy
            Map<String, Object> marked = withFallback(metadata, rawTimestamp == null
                    ? "missing timestamp"
                    : "unparseable timestamp: " + rawTimestamp);
            return new SensorData(wallClock(), sensorId, dataType, values, rawTimestamp, units, marked);
        }
    }
}
