/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.sensorkernel.spi;

import com.intuitivedesigns.sensorkernel.core.PipelineException;

import java.util.Arrays;

public class InvalidKindException extends PipelineException {

    public InvalidKindException(String kind) {
        super("Unknown plugin kind '" + kind + "'. Valid kinds: " + Arrays.toString(PluginKind.values()));
    }
}
