/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.stages.visualizers;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.SensorData;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LoggingVisualizerTest {

    private static List<ILoggingEvent> capture(LoggingVisualizer visualizer, int records) {
        Logger logger = (Logger) LoggerFactory.getLogger(LoggingVisualizer.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        Level originalLevel = logger.getLevel();
        logger.setLevel(Level.DEBUG);
        appender.start();
        logger.addAppender(appender);
        try {
            for (int i = 0; i < records; i++) {
                visualizer.visualize(SensorData.of(i, "imu-1", "imu", Map.of("accel_x", (double) i)));
            }
        } finally {
            logger.detachAppender(appender);
            logger.setLevel(originalLevel);
            appender.stop();
        }
        return appender.list;
    }

    @Test
    void testEveryNthRecordIsLogged() {
        LoggingVisualizer visualizer = new LoggingVisualizer(ConfigSection.of(Map.of("every_n", 2)));

        List<ILoggingEvent> events = capture(visualizer, 5);

        assertEquals(3, events.size());
        assertEquals(Level.INFO, events.get(0).getLevel());
        assertTrue(events.get(0).getFormattedMessage().startsWith("[imu-1] imu @ 0.0"));
        assertEquals(5L, visualizer.getStatus().get("seen"));
        assertEquals(3L, visualizer.getStatus().get("shown"));
    }

    @Test
    void testDebugLevel() {
        LoggingVisualizer visualizer = new LoggingVisualizer(ConfigSection.of(Map.of("level", "DEBUG")));

        List<ILoggingEvent> events = capture(visualizer, 1);

        assertEquals(1, events.size());
        assertEquals(Level.DEBUG, events.get(0).getLevel());
    }
}
