/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.pipeline;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.config.StageSpec;
import com.intuitivedesigns.sensorkernel.core.Analyzer;
import com.intuitivedesigns.sensorkernel.core.ConfigurationException;
import com.intuitivedesigns.sensorkernel.core.Decoder;
import com.intuitivedesigns.sensorkernel.core.Exporter;
import com.intuitivedesigns.sensorkernel.core.PipelineException;
import com.intuitivedesigns.sensorkernel.core.Processor;
import com.intuitivedesigns.sensorkernel.core.Reader;
import com.intuitivedesigns.sensorkernel.core.SensorData;
import com.intuitivedesigns.sensorkernel.core.StageLifecycle;
import com.intuitivedesigns.sensorkernel.core.StatusReporter;
import com.intuitivedesigns.sensorkernel.core.Visualizer;
import com.intuitivedesigns.sensorkernel.core.Writer;
import com.intuitivedesigns.sensorkernel.logging.LoggingContext;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.sensorkernel.plugin.PluginRegistry;
import com.intuitivedesigns.sensorkernel.spi.PluginKind;
import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs one pipeline: resolves its stages, wires them into a graph of bounded channels and drives
 * the graph either with one thread per stage or with a single sequential driver.
 *
 * <p><b>Lifecycle:</b> {@code CREATED -> SETUP -> RUNNING -> STOPPING -> STOPPED}, restartable
 * through {@link #setup()}. Transitions and snapshot composition happen under one lock; workers
 * never take it.</p>
 *
 * <p><b>Shutdown:</b> {@link #stop()} raises a shared cancellation flag, completes every channel
 * so blocked consumers wake up, joins each worker for at most {@code join_timeout_ms} and tears
 * the stages down. A worker that does not exit in time is reported, not failed.</p>
 *
 * <p><b>Failures:</b> a failing item is handled by the stage's {@link ItemErrorPolicy} and never
 * affects another stage. Only reader/decoder resolution and reader opening are fatal.</p>
 */
public final class PipelineExecutor {

    static final String METRIC_DROPPED = "sensorkernel.channel.dropped";
    static final String METRIC_QUEUE_DEPTH = "sensorkernel.channel.depth";

    private final PipelineDefinition definition;
    private final PluginRegistry registry;
    private final MetricsRuntime metrics;
    private final LoggingContext logging;
    private final ItemErrorPolicy errorPolicy;
    private final Logger log;

    private final ReentrantLock lock = new ReentrantLock();
    // One token per run; a worker that outlives stop() keeps the cancelled one
    private volatile AtomicBoolean cancelled = new AtomicBoolean(true);
    private final AtomicBoolean paused = new AtomicBoolean(false);
    private final RecordHistory history;
    private final Map<String, Thread> workers = new LinkedHashMap<>();

    private volatile PipelineState state = PipelineState.CREATED;
    private volatile Instant startTime;
    private StageGraph graph;
    private Exporter exporter;

    public PipelineExecutor(PipelineDefinition definition,
                            PluginRegistry registry,
                            MetricsRuntime metrics,
                            LoggingContext logging) {
        this(definition, registry, metrics, logging, null);
    }

    /**
     * @param errorPolicy applied to every stage; null selects retry-then-drop with
     *                    {@code max_item_retries}
     */
    public PipelineExecutor(PipelineDefinition definition,
                            PluginRegistry registry,
                            MetricsRuntime metrics,
                            LoggingContext logging,
                            ItemErrorPolicy errorPolicy) {
        this.definition = Objects.requireNonNull(definition, "definition");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.logging = Objects.requireNonNull(logging, "logging").forPipeline(definition.id());
        this.errorPolicy = errorPolicy != null
                ? errorPolicy
                : ItemErrorPolicy.retryThenDrop(definition.settings().maxItemRetries());
        this.log = this.logging.logger(PipelineExecutor.class);
        this.history = new RecordHistory(definition.settings().historySize());
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    /**
     * Resolves every configured stage and builds the graph. No thread is started.
     *
     * @throws ConfigurationException when reader or decoder has no type
     * @throws PipelineException      when reader or decoder cannot be resolved or created
     * @throws IllegalStateException  unless CREATED or STOPPED
     */
    public void setup() {
        lock.lock();
        try {
            if (!state.canSetup()) {
                throw new IllegalStateException("Cannot set up pipeline '" + id() + "' in state " + state);
            }
            requireType(definition.reader(), "reader");
            requireType(definition.decoder(), "decoder");

            final Reader reader = registry.createInstance(PluginKind.READER,
                    definition.reader().type(), definition.reader().config(), Reader.class);
            final Decoder decoder;
            try {
                decoder = registry.createInstance(PluginKind.DECODER,
                        definition.decoder().type(), definition.decoder().config(), Decoder.class);
            } catch (RuntimeException e) {
                release("reader", reader);
                throw e;
            }

            final AtomicBoolean run = new AtomicBoolean(false);
            final StageGraph g = new StageGraph(id(), definition.settings(), run::get, errorPolicy, metrics, log);
            g.reader(definition.reader().type(), reader);
            g.decoder(definition.decoder().type(), decoder);

            for (StageSpec spec : definition.processors()) {
                optional(PluginKind.PROCESSOR, spec, Processor.class).ifPresent(p -> g.processor(spec.type(), p));
            }
            for (StageSpec spec : definition.analyzers()) {
                optional(PluginKind.ANALYZER, spec, Analyzer.class).ifPresent(a -> g.analyzer(spec.type(), a));
            }
            for (StageSpec spec : definition.visualizers()) {
                optional(PluginKind.VISUALIZER, spec, Visualizer.class).ifPresent(v -> g.visualizer(spec.type(), v));
            }
            for (StageSpec spec : definition.writers()) {
                optional(PluginKind.WRITER, spec, Writer.class).ifPresent(w -> g.writer(spec.type(), w));
            }
            exporter = optional(PluginKind.EXPORTER, definition.exporter(), Exporter.class).orElse(null);

            g.wire(history::add);
            graph = g;
            bindChannelGauges(g);

            cancelled = run;
            paused.set(false);
            history.clear();
            workers.clear();
            startTime = null;
            state = PipelineState.SETUP;
            log.info("Pipeline '{}' set up: [{}] (threading={})", id(), g.describe(), definition.useThreading());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Opens the reader and writers, then starts the workers.
     *
     * @throws PipelineException     when the reader cannot be opened; the pipeline ends STOPPED
     * @throws IllegalStateException unless SETUP (a RUNNING pipeline only logs a warning)
     */
    public void start() {
        lock.lock();
        try {
            if (state == PipelineState.RUNNING) {
                log.warn("Pipeline '{}' is already running", id());
                return;
            }
            if (state != PipelineState.SETUP) {
                throw new IllegalStateException("Pipeline '" + id() + "' must be set up before start (state=" + state + ")");
            }

            final StageNode source = graph.source();
            try {
                ((Reader) source.stage()).open();
            } catch (Exception e) {
                log.error("Pipeline '{}': reader '{}' failed to open", id(), source.type(), e);
                teardownStages();
                state = PipelineState.STOPPED;
                throw new PipelineException("Failed to open reader for pipeline '" + id() + "'", e);
            }

            for (StageNode node : graph.nodes(PluginKind.WRITER)) {
                try {
                    ((Writer) node.stage()).open();
                } catch (Exception e) {
                    log.error("Pipeline '{}': writer '{}' ({}) failed to open; detaching it", id(), node.name(), node.type(), e);
                    graph.detach(node);
                    release(node.name(), node.stage());
                }
            }

            paused.set(false);
            if (startTime == null) {
                startTime = Instant.now();
            }
            launchWorkers();
            state = PipelineState.RUNNING;
            log.info("Pipeline '{}' started with {} worker(s)", id(), workers.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Alias of {@link #start()}.
     */
    public void run() {
        start();
    }

    /**
     * Idempotent: only the call that finds the pipeline RUNNING does anything.
     */
    public void stop() {
        final List<Map.Entry<String, Thread>> toJoin;
        lock.lock();
        try {
            if (state != PipelineState.RUNNING) {
                log.warn("Pipeline '{}' is not running (state={}); stop ignored", id(), state);
                return;
            }
            state = PipelineState.STOPPING;
            toJoin = new ArrayList<>(workers.entrySet());
        } finally {
            lock.unlock();
        }

        log.info("Stopping pipeline '{}'...", id());
        cancelled.set(true);
        paused.set(false);
        graph.completeAll();

        final long joinTimeoutMs = definition.settings().joinTimeoutMs();
        for (Map.Entry<String, Thread> worker : toJoin) {
            Thread t = worker.getValue();
            try {
                t.join(joinTimeoutMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (t.isAlive()) {
                log.warn("Shutdown timeout: worker '{}' of pipeline '{}' still running after {}ms",
                        worker.getKey(), id(), joinTimeoutMs);
                // Unblocks a stage stuck in an interruptible wait
                t.interrupt();
            }
        }

        lock.lock();
        try {
            teardownStages();
            state = PipelineState.STOPPED;
        } finally {
            lock.unlock();
        }

        MetricsSnapshot snapshot = getMetrics();
        log.info("Pipeline '{}' stopped. read={} written={} errors={} dropped={}",
                id(), snapshot.read(), snapshot.written(), snapshot.totalErrors(), snapshot.totalDropped());
    }

    public void pause() {
        if (state != PipelineState.RUNNING) {
            log.warn("Pipeline '{}' is not running (state={}); pause ignored", id(), state);
            return;
        }
        if (paused.compareAndSet(false, true)) {
            log.info("Pipeline '{}' paused", id());
        }
    }

    public void resume() {
        if (paused.compareAndSet(true, false)) {
            log.info("Pipeline '{}' resumed", id());
        }
    }

    /**
     * Waits for every worker to exit on its own, which happens after the reader's end of stream
     * has propagated through the graph. Does not stop the pipeline.
     *
     * @return true when no worker is alive
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        final List<Thread> threads;
        lock.lock();
        try {
            threads = new ArrayList<>(workers.values());
        } finally {
            lock.unlock();
        }

        final long deadline = System.nanoTime() + timeout.toNanos();
        for (Thread t : threads) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) break;
            TimeUnit.NANOSECONDS.timedJoin(t, remaining);
        }
        return threads.stream().noneMatch(Thread::isAlive);
    }

    /**
     * True when the pipeline is RUNNING but every worker has already exited.
     */
    public boolean isDrained() {
        lock.lock();
        try {
            return state == PipelineState.RUNNING
                    && !workers.isEmpty()
                    && workers.values().stream().noneMatch(Thread::isAlive);
        } finally {
            lock.unlock();
        }
    }

    // -------------------------------------------------------------------------
    // Export
    // -------------------------------------------------------------------------

    public Optional<String> export() {
        return export(ConfigSection.empty());
    }

    /**
     * Hands the retained writer-stream history to the configured exporter.
     *
     * @return the exporter's artifact id; empty when no exporter is configured
     */
    public Optional<String> export(ConfigSection overrides) {
        final Exporter target;
        lock.lock();
        try {
            target = exporter;
        } finally {
            lock.unlock();
        }
        if (target == null) {
            log.info("Pipeline '{}' has no exporter configured", id());
            return Optional.empty();
        }

        List<SensorData> batch = history.snapshot();
        try {
            String artifact = target.export(batch, overrides == null ? ConfigSection.empty() : overrides);
            log.info("Pipeline '{}' exported {} records -> {}", id(), batch.size(), artifact);
            return Optional.ofNullable(artifact);
        } catch (Exception e) {
            throw new PipelineException("Export failed for pipeline '" + id() + "'", e);
        }
    }

    // -------------------------------------------------------------------------
    // Status & metrics
    // -------------------------------------------------------------------------

    public String id() {
        return definition.id();
    }

    public PipelineDefinition definition() {
        return definition;
    }

    public PipelineState state() {
        return state;
    }

    public boolean isPaused() {
        return paused.get();
    }

    public MetricsSnapshot getMetrics() {
        lock.lock();
        try {
            if (graph == null) return MetricsSnapshot.empty();

            Map<String, Long> stageCounts = new LinkedHashMap<>();
            Map<String, Long> errors = new LinkedHashMap<>();
            Map<String, Long> kindCounts = new LinkedHashMap<>();
            for (PluginKind kind : List.of(PluginKind.READER, PluginKind.DECODER, PluginKind.PROCESSOR,
                    PluginKind.ANALYZER, PluginKind.VISUALIZER, PluginKind.WRITER)) {
                kindCounts.put(kind.counterName(), 0L);
            }
            for (StageNode node : graph.nodes()) {
                stageCounts.put(node.name(), node.items());
                errors.put(node.name(), node.errors());
                kindCounts.merge(node.kind().counterName(), node.items(), Long::sum);
            }

            Map<String, Long> dropped = new LinkedHashMap<>();
            for (StageChannel<Object> channel : graph.channels().values()) {
                dropped.put(channel.name(), channel.dropped());
            }

            Instant started = startTime;
            double throughput = 0.0;
            if (started != null) {
                double elapsed = Duration.between(started, Instant.now()).toNanos() / 1_000_000_000.0;
                if (elapsed > 0) {
                    throughput = kindCounts.get(PluginKind.WRITER.counterName()) / elapsed;
                }
            }
            return new MetricsSnapshot(stageCounts, kindCounts, errors, dropped, started, throughput);
        } finally {
            lock.unlock();
        }
    }

    public PipelineStatus getStatus() {
        final MetricsSnapshot snapshot = getMetrics();
        lock.lock();
        try {
            Map<String, Map<String, Object>> components = new LinkedHashMap<>();
            Map<String, Integer> queues = new LinkedHashMap<>();
            if (graph != null) {
                for (StageNode node : graph.nodes()) {
                    components.put(node.name(), describe(node));
                }
                for (StageChannel<Object> channel : graph.channels().values()) {
                    queues.put(channel.name(), channel.size());
                }
            }

            Map<String, Boolean> alive = new LinkedHashMap<>();
            workers.forEach((name, thread) -> alive.put(name, thread.isAlive()));

            return new PipelineStatus(id(), state, state == PipelineState.RUNNING, paused.get(),
                    snapshot, components, queues, alive);
        } finally {
            lock.unlock();
        }
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private void bindChannelGauges(StageGraph g) {
        for (StageChannel<Object> channel : g.channels().values()) {
            Map<String, String> tags = Map.of("pipeline", id(), "channel", channel.name());
            metrics.gauge(METRIC_DROPPED, tags, channel::dropped);
            metrics.gauge(METRIC_QUEUE_DEPTH, tags, channel::size);
        }
    }

    private void launchWorkers() {
        workers.clear();
        final ExecutionSettings settings = definition.settings();
        final AtomicBoolean cancelled = this.cancelled;

        if (definition.useThreading()) {
            // Consumers first so the reader never fills a channel nobody drains yet
            List<StageNode> order = new ArrayList<>(graph.nodes());
            Collections.reverse(order);
            for (StageNode node : order) {
                startWorker(node.name(), new StageWorker(node, settings, cancelled, paused, log));
            }
        } else {
            startWorker("driver", new SequentialDriver(graph, settings, cancelled, paused, log));
        }
    }

    private void startWorker(String stage, Runnable body) {
        Thread t = new Thread(logging.forStage(stage).wrap(body), "sk-" + id() + "-" + stage);
        t.setDaemon(true);
        t.setUncaughtExceptionHandler((thread, ex) -> log.error("Uncaught failure in {}", thread.getName(), ex));
        workers.put(stage, t);
        t.start();
    }

    private <T> Optional<T> optional(PluginKind kind, StageSpec spec, Class<T> contract) {
        if (spec == null) return Optional.empty();
        if (!spec.hasType()) {
            log.warn("Pipeline '{}': {} entry without a type; skipping it", id(), kind.label());
            return Optional.empty();
        }
        try {
            return Optional.of(registry.createInstance(kind, spec.type(), spec.config(), contract));
        } catch (PipelineException e) {
            log.warn("Pipeline '{}': {} '{}' unavailable, continuing without it: {}",
                    id(), kind.label(), spec.type(), e.getMessage());
            return Optional.empty();
        }
    }

    private void requireType(StageSpec spec, String role) {
        if (spec == null || !spec.hasType()) {
            throw new ConfigurationException("Pipeline '" + id() + "' requires a " + role + " with a type");
        }
    }

    private Map<String, Object> describe(StageNode node) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("kind", node.kind().label());
        entry.put("type", node.type());
        entry.put("class", node.stage().getClass().getName());
        entry.put("items", node.items());
        entry.put("errors", node.errors());
        if (node.kind() == PluginKind.WRITER) {
            entry.put("units_written", node.units());
        }
        entry.put("escalated", node.escalated());

        if (node.stage() instanceof StatusReporter reporter) {
            try {
                Map<String, Object> own = reporter.getStatus();
                entry.put("status", own == null ? Map.of() : new LinkedHashMap<>(own));
            } catch (RuntimeException e) {
                entry.put("status", Map.of("error", String.valueOf(e.getMessage())));
            }
        }
        return Collections.unmodifiableMap(entry);
    }

    // Each step isolated so one failing stage cannot keep the others from releasing resources
    private void teardownStages() {
        if (graph != null) {
            for (StageNode node : graph.nodes()) {
                release(node.name(), node.stage());
            }
        }
        if (exporter != null) {
            release("exporter", exporter);
        }
    }

    private void release(String name, Object stage) {
        if (stage instanceof Reader || stage instanceof Writer) {
            safeClose((AutoCloseable) stage, name);
        }
        if (stage instanceof StageLifecycle lifecycle) {
            try {
                lifecycle.teardown();
            } catch (Exception e) {
                log.warn("Error tearing down {} in pipeline '{}': {}", name, id(), e.getMessage());
            }
        }
    }

    private void safeClose(AutoCloseable c, String name) {
        try {
            c.close();
        } catch (Exception e) {
            log.warn("Error closing {} in pipeline '{}': {}", name, id(), e.getMessage());
        }
    }

    @Override
    public String toString() {
        return "PipelineExecutor[" + id() + ", " + state + "]";
    }
}
