/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.stages.analyzers;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.SensorData;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AnomalyDetectorTest {

    private static SensorData reading(String sensor, double temp) {
        return SensorData.of(1_700_000_000.0, sensor, "env", Map.of("temp", temp, "room", "lab"));
    }

    private static void warmUp(AnomalyDetector detector, String sensor, int samples) {
        for (int i = 0; i < samples; i++) {
            detector.analyze(reading(sensor, i % 2 == 0 ? 9.0 : 11.0));
        }
    }

    @Test
    void testNoOutputUntilWindowIsFilled() {
        AnomalyDetector detector = new AnomalyDetector(ConfigSection.empty());

        for (int i = 0; i < 9; i++) {
            assertTrue(detector.analyze(reading("env-1", 20.0)).isEmpty());
        }
        List<SensorData> tenth = detector.analyze(reading("env-1", 20.0));

        assertEquals(1, tenth.size());
        SensorData result = tenth.get(0);
        assertEquals(AnomalyDetector.DATA_TYPE, result.dataType());
        assertEquals(false, result.metadata().get("anomaly"));
        assertEquals("Normal", result.metadata().get("prediction"));
        assertEquals("env", result.metadata().get("source_data_type"));
    }

    @Test
    void testSpikeIsFlagged() {
        // Setup
        AnomalyDetector detector = new AnomalyDetector(ConfigSection.empty());
        warmUp(detector, "env-1", 20);

        // Act
        SensorData result = detector.analyze(reading("env-1", 100.0)).get(0);

        // Assert
        assertEquals(true, result.metadata().get("anomaly"));
        assertEquals(1.0, result.metadata().get("anomaly_score"));
        assertEquals("Significant Anomaly", result.metadata().get("prediction"));
        Map<?, ?> stats = (Map<?, ?>) result.values().get("temp");
        assertEquals(100.0, stats.get("value"));
        assertTrue((Double) stats.get("z_score") > 3.0);
        assertFalse(result.values().containsKey("room"));
        assertEquals(1L, detector.getStatus().get("anomalies"));
        assertEquals(12L, detector.getStatus().get("analyzed"));
    }

    @Test
    void testSensorsHaveSeparateWindows() {
        AnomalyDetector detector = new AnomalyDetector(ConfigSection.empty());
        warmUp(detector, "env-1", 20);

        assertTrue(detector.analyze(reading("env-2", 100.0)).isEmpty());
    }

    @Test
    void testConfiguredFieldsOnly() {
        AnomalyDetector detector = new AnomalyDetector(ConfigSection.of(Map.of(
                "fields", List.of("humidity"),
                "min_window_size", 1)));

        assertTrue(detector.analyze(reading("env-1", 1.0)).isEmpty());
        SensorData result = detector.analyze(
                SensorData.of(1, "env-1", "env", Map.of("temp", 1.0, "humidity", 40.0))).get(0);

        assertEquals(1, result.values().size());
        assertTrue(result.values().containsKey("humidity"));
    }

    @Test
    void testSettingsAreClamped() {
        AnomalyDetector detector = new AnomalyDetector(ConfigSection.of(Map.of(
                "threshold", -1.0,
                "window_size", 3)));

        assertEquals(3.0, detector.getStatus().get("threshold"));
        assertEquals(10, detector.getStatus().get("window_size"));
    }

    @Test
    void testPredictionBands() {
        assertEquals("Normal", AnomalyDetector.prediction(0.5));
        assertEquals("Possible Anomaly", AnomalyDetector.prediction(0.51));
        assertEquals("Significant Anomaly", AnomalyDetector.prediction(1.0));
    }
}
