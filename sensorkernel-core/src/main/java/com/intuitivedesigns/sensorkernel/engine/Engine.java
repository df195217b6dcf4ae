/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.engine;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.config.KernelConfig;
import com.intuitivedesigns.sensorkernel.config.StageSpec;
import com.intuitivedesigns.sensorkernel.core.Configurator;
import com.intuitivedesigns.sensorkernel.core.StageLifecycle;
import com.intuitivedesigns.sensorkernel.logging.LoggingContext;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.sensorkernel.pipeline.PipelineDefinition;
import com.intuitivedesigns.sensorkernel.pipeline.PipelineExecutor;
import com.intuitivedesigns.sensorkernel.pipeline.PipelineStatus;
import com.intuitivedesigns.sensorkernel.plugin.PluginRegistry;
import com.intuitivedesigns.sensorkernel.spi.PluginKind;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Hosts every configured pipeline of a process.
 *
 * <p>Pipelines are isolated from one another: a definition that fails validation or setup is
 * logged and left out, and start/stop errors of one pipeline never prevent the others.</p>
 */
public final class Engine implements AutoCloseable {

    private final KernelConfig config;
    private final PluginRegistry registry;
    private final MetricsRuntime metrics;
    private final LoggingContext logging;
    private final Logger log;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, PipelineExecutor> pipelines = new LinkedHashMap<>();

    public Engine(KernelConfig config, PluginRegistry registry, MetricsRuntime metrics, LoggingContext logging) {
        this.config = Objects.requireNonNull(config, "config");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.logging = Objects.requireNonNull(logging, "logging");
        this.log = logging.logger(Engine.class);
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Discovers plugins and sets up every enabled pipeline.
     *
     * @return number of pipelines ready to start
     */
    public int setup() {
        lock.lock();
        try {
            registry.discoverPlugins(config.pluginSearchPaths());
            registry.logAvailablePlugins();

            final int maxPipelines = Math.max(0, config.maxPipelines());
            final List<ConfigSection> sections = config.pipelineSections();
            if (sections.isEmpty()) {
                log.warn("No pipelines configured");
            }

            for (ConfigSection section : sections) {
                final PipelineDefinition definition;
                try {
                    definition = PipelineDefinition.from(section);
                } catch (RuntimeException e) {
                    log.error("Skipping invalid pipeline definition: {}", e.getMessage());
                    continue;
                }

                if (!definition.enabled()) {
                    log.info("Pipeline '{}' is disabled; skipping", definition.id());
                    continue;
                }
                if (pipelines.containsKey(definition.id())) {
                    log.error("Duplicate pipeline id '{}'; keeping the first definition", definition.id());
                    continue;
                }
                if (pipelines.size() >= maxPipelines) {
                    log.warn("Maximum pipeline count ({}) reached; skipping '{}'", maxPipelines, definition.id());
                    continue;
                }

                addPipeline(definition);
            }

            log.info("Engine set up with {} pipeline(s): {}", pipelines.size(), pipelines.keySet());
            return pipelines.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs the definition's configurator, then creates and sets up its executor. Failures are
     * logged and the pipeline is left out.
     *
     * @return true when the pipeline was added
     */
    public boolean addPipeline(PipelineDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        lock.lock();
        try {
            if (pipelines.containsKey(definition.id())) {
                log.error("Duplicate pipeline id '{}'; keeping the first definition", definition.id());
                return false;
            }

            runConfigurator(definition);

            PipelineExecutor executor = new PipelineExecutor(definition, registry, metrics, logging);
            try {
                executor.setup();
            } catch (RuntimeException e) {
                log.error("Pipeline '{}' failed setup and will not run: {}", definition.id(), e.getMessage(), e);
                return false;
            }
            pipelines.put(definition.id(), executor);
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void start() {
        for (PipelineExecutor executor : snapshot()) {
            try {
                executor.start();
            } catch (RuntimeException e) {
                log.error("Pipeline '{}' failed to start: {}", executor.id(), e.getMessage(), e);
            }
        }
    }

    /**
     * Stops pipelines in reverse start order.
     */
    public void stop() {
        List<PipelineExecutor> executors = snapshot();
        Collections.reverse(executors);
        for (PipelineExecutor executor : executors) {
            try {
                executor.stop();
            } catch (RuntimeException e) {
                log.error("Pipeline '{}' failed to stop cleanly: {}", executor.id(), e.getMessage(), e);
            }
        }
    }

    public void startPipeline(String id) {
        require(id).start();
    }

    public void stopPipeline(String id) {
        require(id).stop();
    }

    @Override
    public void close() {
        stop();
    }

    // -------------------------------------------------------------------------
    // Introspection
    // -------------------------------------------------------------------------

    public Optional<PipelineExecutor> getPipeline(String id) {
        lock.lock();
        try {
            return Optional.ofNullable(pipelines.get(id));
        } finally {
            lock.unlock();
        }
    }

    public Set<String> pipelineIds() {
        lock.lock();
        try {
            return Set.copyOf(pipelines.keySet());
        } finally {
            lock.unlock();
        }
    }

    public Map<String, PipelineStatus> getStatus() {
        Map<String, PipelineStatus> status = new LinkedHashMap<>();
        for (PipelineExecutor executor : snapshot()) {
            status.put(executor.id(), executor.getStatus());
        }
        return Collections.unmodifiableMap(status);
    }

    /**
     * @throws NoSuchElementException for an unknown pipeline id
     */
    public Optional<String> export(String id) {
        return require(id).export();
    }

    /**
     * True when at least one pipeline ran and every running pipeline has drained its input.
     */
    public boolean isDrained() {
        List<PipelineExecutor> executors = snapshot();
        return !executors.isEmpty() && executors.stream().allMatch(PipelineExecutor::isDrained);
    }

    public PluginRegistry registry() {
        return registry;
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private void runConfigurator(PipelineDefinition definition) {
        StageSpec spec = definition.configurator();
        if (spec == null || !spec.hasType()) return;

        Configurator configurator = null;
        try {
            configurator = registry.createInstance(PluginKind.CONFIGURATOR, spec.type(), spec.config(), Configurator.class);
            if (configurator.configure()) {
                log.info("Pipeline '{}': configurator '{}' applied", definition.id(), spec.type());
            } else {
                log.warn("Pipeline '{}': configurator '{}' reported failure", definition.id(), spec.type());
            }
        } catch (Exception e) {
            log.error("Pipeline '{}': configurator '{}' failed: {}", definition.id(), spec.type(), e.getMessage(), e);
        } finally {
            if (configurator instanceof StageLifecycle lifecycle) {
                try {
                    lifecycle.teardown();
                } catch (Exception e) {
                    log.warn("Error tearing down configurator '{}': {}", spec.type(), e.getMessage());
                }
            }
        }
    }

    private PipelineExecutor require(String id) {
        return getPipeline(id).orElseThrow(() -> new NoSuchElementException("Unknown pipeline '" + id + "'"));
    }

    private List<PipelineExecutor> snapshot() {
        lock.lock();
        try {
            return new ArrayList<>(pipelines.values());
        } finally {
            lock.unlock();
        }
    }
}
