/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.pipeline;

import com.intuitivedesigns.sensorkernel.core.StageRuntimeException;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of one stage applied to one item: the emitted items, or the failure.
 *
 * @param input   the item the stage was given
 * @param outputs emitted items; empty on failure
 * @param error   null on success
 */
public record StageResult(Object input, List<Object> outputs, StageRuntimeException error) {

    public StageResult {
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
    }

    public static StageResult success(Object input, List<Object> outputs) {
        return new StageResult(input, outputs, null);
    }

    public static StageResult failure(Object input, StageRuntimeException error) {
        return new StageResult(input, List.of(), Objects.requireNonNull(error, "error"));
    }

    public boolean isSuccess() {
        return error == null;
    }
}
