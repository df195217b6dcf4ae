/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.stages.analyzers;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.Analyzer;
import com.intuitivedesigns.sensorkernel.core.SensorData;
import com.intuitivedesigns.sensorkernel.core.StatusReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Rolling z-score anomaly detector.
 *
 * <p>For each monitored field the detector keeps the last {@code window_size} samples (at least
 * 10) per sensor. Once a window holds {@code min_window_size} samples, the newest value is scored
 * as {@code z = |x - mean| / std} (population std; a flat window scores 0) and
 * {@code anomaly_score = min(z / threshold, 1)}. A field is anomalous when {@code z > threshold}.</p>
 *
 * <p>Each scored input yields one record of data type {@code anomaly} carrying the per-field
 * statistics in {@code values} and the verdict in {@code metadata}. Inputs with no scorable field
 * yield nothing.</p>
 *
 * <p>Config keys: {@code fields} (default: every numeric channel), {@code threshold} (default 3.0),
 * {@code window_size} (default 100), {@code min_window_size} (default 10).</p>
 */
public final class AnomalyDetector implements Analyzer, StatusReporter {

    private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

    public static final String DATA_TYPE = "anomaly";

    public static final String CFG_FIELDS = "fields";
    public static final String CFG_THRESHOLD = "threshold";
    public static final String CFG_WINDOW_SIZE = "window_size";
    public static final String CFG_MIN_WINDOW_SIZE = "min_window_size";

    public static final String META_ANOMALY = "anomaly";
    public static final String META_ANOMALY_SCORE = "anomaly_score";
    public static final String META_PREDICTION = "prediction";
    public static final String META_SOURCE_DATA_TYPE = "source_data_type";

    private static final double DEFAULT_THRESHOLD = 3.0;
    private static final int DEFAULT_WINDOW_SIZE = 100;
    private static final int MIN_WINDOW_SIZE = 10;
    private static final int DEFAULT_MIN_WINDOW_SIZE = 10;

    private final List<String> fields;
    private final double threshold;
    private final int windowSize;
    private final int minWindowSize;

    // sensorId/field -> samples
    private final Map<String, ArrayDeque<Double>> windows = new HashMap<>();

    private final AtomicLong analyzed = new AtomicLong();
    private final AtomicLong anomalies = new AtomicLong();

    public AnomalyDetector(ConfigSection config) {
        this.fields = config.getStringList(CFG_FIELDS);

        double t = config.getDouble(CFG_THRESHOLD, DEFAULT_THRESHOLD);
        if (t <= 0 || !Double.isFinite(t)) {
            log.warn("Threshold must be positive; using {}", DEFAULT_THRESHOLD);
            t = DEFAULT_THRESHOLD;
        }
        this.threshold = t;
        this.windowSize = Math.max(MIN_WINDOW_SIZE, config.getInt(CFG_WINDOW_SIZE, DEFAULT_WINDOW_SIZE));
        this.minWindowSize = Math.max(1, Math.min(windowSize, config.getInt(CFG_MIN_WINDOW_SIZE, DEFAULT_MIN_WINDOW_SIZE)));

        log.info("AnomalyDetector initialized: fields={}, threshold={}, window_size={}, min_window_size={}",
                fields.isEmpty() ? "<all numeric>" : fields, threshold, windowSize, minWindowSize);
    }

    @Override
    public List<SensorData> analyze(SensorData record) {
        Map<String, Object> scored = new LinkedHashMap<>();
        double maxScore = 0.0;
        boolean anomalous = false;

        for (String field : fieldsOf(record)) {
            Object raw = record.values().get(field);
            if (!(raw instanceof Number number) || !Double.isFinite(number.doubleValue())) continue;
            double value = number.doubleValue();

            ArrayDeque<Double> window = windows.computeIfAbsent(record.sensorId() + '/' + field,
                    k -> new ArrayDeque<>(windowSize));
            if (window.size() == windowSize) window.removeFirst();
            window.addLast(value);
            if (window.size() < minWindowSize) continue;

            double mean = 0.0;
            for (double s : window) mean += s;
            mean /= window.size();
            double variance = 0.0;
            for (double s : window) variance += (s - mean) * (s - mean);
            double std = Math.sqrt(variance / window.size());

            double z = std == 0.0 ? 0.0 : Math.abs(value - mean) / std;
            double score = Math.min(z / threshold, 1.0);
            boolean isAnomaly = z > threshold;

            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("value", value);
            stats.put("mean", mean);
            stats.put("std", std);
            stats.put("z_score", z);
            stats.put("anomaly_score", score);
            stats.put("is_anomaly", isAnomaly);
            scored.put(field, stats);

            maxScore = Math.max(maxScore, score);
            anomalous |= isAnomaly;
        }

        if (scored.isEmpty()) return List.of();

        analyzed.incrementAndGet();
        if (anomalous) {
            anomalies.incrementAndGet();
            log.debug("Anomaly on sensor '{}' at {}: score={}", record.sensorId(), record.timestamp(), maxScore);
        }

        SensorData result = new SensorData(
                record.timestamp(),
                record.sensorId(),
                DATA_TYPE,
                scored,
                record.rawTimestamp(),
                Map.of(),
                Map.of(
                        META_ANOMALY, anomalous,
                        META_ANOMALY_SCORE, maxScore,
                        META_PREDICTION, prediction(maxScore),
                        META_SOURCE_DATA_TYPE, record.dataType(),
                        CFG_THRESHOLD, threshold));
        return List.of(result);
    }

    @Override
    public Map<String, Object> getStatus() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("analyzed", analyzed.get());
        status.put("anomalies", anomalies.get());
        status.put("threshold", threshold);
        status.put("window_size", windowSize);
        return status;
    }

    static String prediction(double score) {
        if (score >= 1.0) return "Significant Anomaly";
        if (score > 0.5) return "Possible Anomaly";
        return "Normal";
    }

    private Iterable<String> fieldsOf(SensorData record) {
        return fields.isEmpty() ? record.values().keySet() : fields;
    }
}
