/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class LoggingContextTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    void testScopeRestoresPreviousMdc() {
        MDC.put("request", "r-1");
        LoggingContext context = LoggingContext.root("sensorkernel").forPipeline("imu");

        try (LoggingContext.Scope ignored = context.open()) {
            assertEquals("imu", MDC.get(LoggingContext.MDC_PIPELINE));
            assertEquals("sensorkernel", MDC.get(LoggingContext.MDC_APPLICATION));
            assertEquals("r-1", MDC.get("request"));
        }

        assertNull(MDC.get(LoggingContext.MDC_PIPELINE));
        assertEquals("r-1", MDC.get("request"));
    }

    @Test
    void testWrappedTaskSeesContextOnAnotherThread() throws Exception {
        LoggingContext context = LoggingContext.root("sensorkernel").forPipeline("imu").forStage("decoder");
        AtomicReference<String> seen = new AtomicReference<>();

        Thread t = new Thread(context.wrap(() -> seen.set(MDC.get("pipeline") + "/" + MDC.get("stage"))));
        t.start();
        t.join(5000);

        assertEquals("imu/decoder", seen.get());
        assertNull(MDC.get("stage"));
    }

    @Test
    void testNarrowingDoesNotModifyParent() {
        LoggingContext root = LoggingContext.root("sensorkernel");
        LoggingContext child = root.forPipeline("imu");

        assertFalse(root.fields().containsKey(LoggingContext.MDC_PIPELINE));
        assertEquals("imu", child.fields().get(LoggingContext.MDC_PIPELINE));
    }
}
