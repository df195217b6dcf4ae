/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.sensorkernel.core;

/**
 * Failure of a single stage while handling a single item.
 * Recovered by the owning worker; it never crosses into another stage.
 */
public class StageRuntimeException extends PipelineException {

    private final String stage;

    public StageRuntimeException(String stage, Throwable cause) {
        super("Stage '" + stage + "' failed: " + describe(cause), cause);
        this.stage = stage;
    }

    public String stage() {
        return stage;
    }

    private static String describe(Throwable t) {
        if (t == null) return "unknown error";
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }
}
