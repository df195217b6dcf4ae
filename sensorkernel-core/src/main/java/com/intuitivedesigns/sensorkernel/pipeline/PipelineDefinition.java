/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.pipeline;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.config.StageSpec;
import com.intuitivedesigns.sensorkernel.core.ConfigurationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarative description of one pipeline: which stages, in which roles, with which settings.
 *
 * <p>Reader and decoder are mandatory but only validated by {@link PipelineExecutor#setup()},
 * so a definition can be built and inspected before its plugins are available.</p>
 */
public record PipelineDefinition(
        String id,
        boolean enabled,
        boolean useThreading,
        StageSpec reader,
        StageSpec decoder,
        List<StageSpec> processors,
        List<StageSpec> analyzers,
        List<StageSpec> visualizers,
        List<StageSpec> writers,
        StageSpec exporter,
        StageSpec configurator,
        ExecutionSettings settings
) {

    public PipelineDefinition {
        if (id == null || id.isBlank()) {
            throw new ConfigurationException("Pipeline definition has no id");
        }
        id = id.trim();
        processors = processors == null ? List.of() : List.copyOf(processors);
        analyzers = analyzers == null ? List.of() : List.copyOf(analyzers);
        visualizers = visualizers == null ? List.of() : List.copyOf(visualizers);
        writers = writers == null ? List.of() : List.copyOf(writers);
        settings = settings == null ? ExecutionSettings.defaults() : settings;
    }

    /**
     * Parses one entry of the {@code pipelines} list. Plural keys ({@code processors}) and singular
     * keys ({@code processor}) are both accepted and concatenated in that order.
     *
     * @throws ConfigurationException when the entry has no id
     */
    public static PipelineDefinition from(ConfigSection section) {
        return new PipelineDefinition(
                section.getString("id", null),
                section.getBoolean("enabled", true),
                section.getBoolean("use_threading", true),
                StageSpec.from(section.get("reader")),
                StageSpec.from(section.get("decoder")),
                specs(section, "processors", "processor"),
                specs(section, "analyzers", "analyzer"),
                specs(section, "visualizers", "visualizer"),
                specs(section, "writers", "writer"),
                StageSpec.from(section.get("exporter")),
                StageSpec.from(section.get("configurator")),
                ExecutionSettings.from(section)
        );
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    private static List<StageSpec> specs(ConfigSection section, String plural, String singular) {
        List<StageSpec> out = new ArrayList<>();
        for (String key : List.of(plural, singular)) {
            for (Object node : section.getList(key)) {
                StageSpec spec = StageSpec.from(node);
                if (spec != null) out.add(spec);
            }
        }
        return out;
    }

    /**
     * Programmatic construction for embedders and tests.
     */
    public static final class Builder {
        private final String id;
        private boolean enabled = true;
        private boolean useThreading = true;
        private StageSpec reader;
        private StageSpec decoder;
        private final List<StageSpec> processors = new ArrayList<>();
        private final List<StageSpec> analyzers = new ArrayList<>();
        private final List<StageSpec> visualizers = new ArrayList<>();
        private final List<StageSpec> writers = new ArrayList<>();
        private StageSpec exporter;
        private StageSpec configurator;
        private ExecutionSettings settings;

        private Builder(String id) {
            this.id = id;
        }

        public Builder enabled(boolean enabled) { this.enabled = enabled; return this; }
        public Builder useThreading(boolean useThreading) { this.useThreading = useThreading; return this; }
        public Builder reader(StageSpec spec) { this.reader = spec; return this; }
        public Builder decoder(StageSpec spec) { this.decoder = spec; return this; }
        public Builder processor(StageSpec spec) { processors.add(spec); return this; }
        public Builder analyzer(StageSpec spec) { analyzers.add(spec); return this; }
        public Builder visualizer(StageSpec spec) { visualizers.add(spec); return this; }
        public Builder writer(StageSpec spec) { writers.add(spec); return this; }
        public Builder exporter(StageSpec spec) { this.exporter = spec; return this; }
        public Builder configurator(StageSpec spec) { this.configurator = spec; return this; }
        public Builder settings(ExecutionSettings settings) { this.settings = settings; return this; }

        public PipelineDefinition build() {
            return new PipelineDefinition(id, enabled, useThreading, reader, decoder,
                    processors, analyzers, visualizers, writers, exporter, configurator, settings);
        }
    }
}
