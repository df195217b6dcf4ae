/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.plugin;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.sensorkernel.spi.PluginKind;
import com.intuitivedesigns.sensorkernel.spi.StagePlugin;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Objects;

/**
 * Factory for a stage class found by naming convention rather than through a service file.
 * The class needs a public {@code (ConfigSection)} or no-arg constructor.
 */
final class ReflectiveStagePlugin implements StagePlugin<Object> {

    private final String id;
    private final PluginKind kind;
    private final Class<?> type;
    private final Constructor<?> constructor;
    private final boolean takesConfig;

    private ReflectiveStagePlugin(String id, PluginKind kind, Class<?> type, Constructor<?> constructor, boolean takesConfig) {
        this.id = id;
        this.kind = kind;
        this.type = type;
        this.constructor = constructor;
        this.takesConfig = takesConfig;
    }

    /**
     * @return the factory, or null when {@code type} has no usable public constructor
     */
    static ReflectiveStagePlugin forClass(String id, PluginKind kind, Class<?> type) {
        Objects.requireNonNull(type, "type");
        if (!Modifier.isPublic(type.getModifiers())) return null;

        Constructor<?> withConfig = publicConstructor(type, ConfigSection.class);
        if (withConfig != null) {
            return new ReflectiveStagePlugin(id, kind, type, withConfig, true);
        }
        Constructor<?> noArg = publicConstructor(type);
        return noArg == null ? null : new ReflectiveStagePlugin(id, kind, type, noArg, false);
    }

    private static Constructor<?> publicConstructor(Class<?> type, Class<?>... params) {
        try {
            return type.getConstructor(params);
        } catch (NoSuchMethodException e) {
            return null;
        }
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
    public Class<?> stageType() {
        return type;
    }

    @Override
    public Object create(ConfigSection config, MetricsRuntime metrics) throws Exception {
        try {
            return takesConfig ? constructor.newInstance(config) : constructor.newInstance();
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) throw ex;
            if (cause instanceof Error err) throw err;
            throw e;
        }
    }

    @Override
    public String toString() {
        return "ReflectiveStagePlugin[" + kind.label() + ":" + id + " -> " + type.getName() + "]";
    }
}
