/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.sensorkernel.spi;

import com.intuitivedesigns.sensorkernel.core.Analyzer;
import com.intuitivedesigns.sensorkernel.core.Configurator;
import com.intuitivedesigns.sensorkernel.core.Decoder;
import com.intuitivedesigns.sensorkernel.core.Exporter;
import com.intuitivedesigns.sensorkernel.core.Processor;
import com.intuitivedesigns.sensorkernel.core.Reader;
import com.intuitivedesigns.sensorkernel.core.Visualizer;
import com.intuitivedesigns.sensorkernel.core.Writer;

import java.util.Locale;

/**
 * Stage capabilities known to the registry.
 *
 * <p>Each kind names the contract its instances must implement, the package searched by the
 * conventional-path lookup, and the verb used for its per-kind counter.</p>
 */
public enum PluginKind {

    READER("readers", Reader.class, "read"),
    DECODER("decoders", Decoder.class, "decoded"),
    PROCESSOR("processors", Processor.class, "processed"),
    ANALYZER("analyzers", Analyzer.class, "analyzed"),
    VISUALIZER("visualizers", Visualizer.class, "visualized"),
    WRITER("writers", Writer.class, "written"),
    EXPORTER("exporters", Exporter.class, "exported"),
    CONFIGURATOR("configurators", Configurator.class, "configured");

    public static final String STAGES_PACKAGE = "com.intuitivedesigns.sensorkernel.stages";

    private final String plural;
    private final Class<?> contract;
    private final String counterName;

    PluginKind(String plural, Class<?> contract, String counterName) {
        this.plural = plural;
        this.contract = contract;
        this.counterName = counterName;
    }

    public String plural() {
        return plural;
    }

    public Class<?> contract() {
        return contract;
    }

    public String counterName() {
        return counterName;
    }

    /**
     * Package searched for classes named after an unregistered plugin, e.g.
     * {@code com.intuitivedesigns.sensorkernel.stages.decoders}.
     */
    public String defaultPackage() {
        return STAGES_PACKAGE + "." + plural;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Accepts the enum name or the plural form, case-insensitively ("reader", "READERS").
     *
     * @throws InvalidKindException for anything else
     */
    public static PluginKind fromString(String raw) {
        String key = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (PluginKind kind : values()) {
            if (kind.label().equals(key) || kind.plural.equals(key)) {
                return kind;
            }
        }
        throw new InvalidKindException(raw);
    }
}
