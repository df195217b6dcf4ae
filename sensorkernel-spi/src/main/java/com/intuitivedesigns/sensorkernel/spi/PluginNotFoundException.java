/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.sensorkernel.spi;

import com.intuitivedesigns.sensorkernel.core.PipelineException;

import java.util.Collection;

/**
 * No factory is registered under the requested name, and none could be found by convention.
 */
public class PluginNotFoundException extends PipelineException {

    private final PluginKind kind;
    private final String name;

    public PluginNotFoundException(PluginKind kind, String name, Collection<String> available) {
        super("No " + kind.label() + " plugin found for '" + name + "'. Available options: " + available);
        this.kind = kind;
        this.name = name;
    }

    public PluginKind kind() {
        return kind;
    }

    public String name() {
        return name;
    }
}
