/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.testing;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.sensorkernel.spi.PluginKind;
import com.intuitivedesigns.sensorkernel.spi.StagePlugin;

import java.util.function.Function;

/**
 * Factory wired from test code.
 */
public final class TestPlugin<T> implements StagePlugin<T> {

    private final String id;
    private final PluginKind kind;
    private final Class<? extends T> type;
    private final Function<ConfigSection, ? extends T> factory;

    private TestPlugin(String id, PluginKind kind, Class<? extends T> type, Function<ConfigSection, ? extends T> factory) {
        this.id = id;
        this.kind = kind;
        this.type = type;
        this.factory = factory;
    }

    public static <T> TestPlugin<T> of(String id, PluginKind kind, Class<? extends T> type,
                                       Function<ConfigSection, ? extends T> factory) {
        return new TestPlugin<>(id, kind, type, factory);
    }

    /**
     * Always hands out {@code instance}.
     */
    @SuppressWarnings("unchecked")
    public static <T> TestPlugin<T> instance(String id, PluginKind kind, T instance) {
        return new TestPlugin<>(id, kind, (Class<? extends T>) instance.getClass(), config -> instance);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public PluginKind kind() {
        return kind;
    }

    @Override
    public Class<? extends T> stageType() {
        return type;
    }

    @Override
    public T create(ConfigSection config, MetricsRuntime metrics) {
        return factory.apply(config);
    }
}
