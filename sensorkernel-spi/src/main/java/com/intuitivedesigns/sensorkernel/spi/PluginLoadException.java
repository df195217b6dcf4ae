/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.sensorkernel.spi;

import com.intuitivedesigns.sensorkernel.core.PipelineException;

/**
 * A plugin was found but could not be turned into a working stage instance.
 */
public class PluginLoadException extends PipelineException {

    private final PluginKind kind;
    private final String name;

    public PluginLoadException(PluginKind kind, String name, Throwable cause) {
        super("Failed creating " + kind.label() + " [" + name + "]: " + describe(cause), cause);
        this.kind = kind;
        this.name = name;
    }

    public PluginLoadException(PluginKind kind, String name, String reason) {
        super("Failed creating " + kind.label() + " [" + name + "]: " + reason);
        this.kind = kind;
        this.name = name;
    }

    public PluginKind kind() {
        return kind;
    }

    public String name() {
        return name;
    }

    private static String describe(Throwable t) {
        return t.getMessage() == null ? t.getClass().getName() : t.getMessage();
    }
}
