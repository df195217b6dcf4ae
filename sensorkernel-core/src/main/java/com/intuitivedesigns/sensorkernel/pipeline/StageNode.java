/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.pipeline;

import com.intuitivedesigns.sensorkernel.core.SensorData;
import com.intuitivedesigns.sensorkernel.core.StageRuntimeException;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.sensorkernel.spi.PluginKind;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.Consumer;

/**
 * One stage instance placed in the graph: its input channel, its downstream edges, its counters
 * and the error policy applied to each item it handles.
 */
final class StageNode {

    static final String METRIC_ITEMS = "sensorkernel.stage.items";
    static final String METRIC_ERRORS = "sensorkernel.stage.errors";

    /**
     * Applies the stage to one item. {@code units} accumulates writer output sizes.
     */
    @FunctionalInterface
    interface StageFunction {
        Iterable<?> apply(Object item, LongAdder units) throws Exception;
    }

    private final String name;
    private final PluginKind kind;
    private final String type;
    private final Object stage;
    private final StageChannel<Object> input;
    private final StageFunction function;
    private final ItemErrorPolicy policy;
    private final MetricsRuntime metrics;
    private final Map<String, String> tags;
    private final Logger log;

    private final List<StageChannel<Object>> outputs = new CopyOnWriteArrayList<>();
    private final List<StageNode> downstream = new CopyOnWriteArrayList<>();
    private volatile Consumer<SensorData> tap;

    private final LongAdder items = new LongAdder();
    private final LongAdder errors = new LongAdder();
    private final LongAdder units = new LongAdder();
    private volatile boolean escalated;

    StageNode(String pipelineId,
              String name,
              PluginKind kind,
              String type,
              Object stage,
              StageChannel<Object> input,
              StageFunction function,
              ItemErrorPolicy policy,
              MetricsRuntime metrics,
              Logger log) {
        this.name = name;
        this.kind = kind;
        this.type = type;
        this.stage = stage;
        this.input = input;
        this.function = function;
        this.policy = policy;
        this.metrics = metrics;
        this.tags = Map.of("pipeline", pipelineId, "stage", name, "kind", kind.label());
        this.log = log;
    }

    // -------------------------------------------------------------------------
    // Wiring
    // -------------------------------------------------------------------------

    void connect(StageNode consumer) {
        consumer.input.addProducer(name);
        outputs.add(consumer.input);
        downstream.add(consumer);
    }

    void disconnect(StageNode consumer) {
        outputs.remove(consumer.input);
        downstream.remove(consumer);
    }

    void tapInto(Consumer<SensorData> tap) {
        this.tap = tap;
    }

    // -------------------------------------------------------------------------
    // Item handling
    // -------------------------------------------------------------------------

    /**
     * Applies the stage to {@code item}, consulting the error policy until it succeeds or the
     * policy gives up. Never throws for a stage failure.
     */
    StageResult handle(Object item) {
        int attempt = 0;
        while (true) {
            attempt++;
            StageResult result = invoke(item);
            if (result.isSuccess()) {
                recordSuccess();
                return result;
            }

            ItemErrorPolicy.Decision decision = decide(result, attempt);
            if (decision == ItemErrorPolicy.Decision.RETRY) {
                log.debug("Stage '{}' retrying item (attempt {}): {}", name, attempt, result.error().getMessage());
                continue;
            }

            recordFailure(result.error(), item);
            if (decision == ItemErrorPolicy.Decision.ESCALATE) {
                escalated = true;
                log.error("Stage '{}' escalated a failure; its worker stops", name);
            }
            return result;
        }
    }

    /**
     * Hands outputs to the export tap, then to every downstream channel in emission order.
     */
    void emit(List<Object> produced) throws InterruptedException {
        if (produced.isEmpty()) return;
        tap(produced);
        for (Object out : produced) {
            for (StageChannel<Object> channel : outputs) {
                channel.push(out);
            }
        }
    }

    void tap(List<Object> produced) {
        Consumer<SensorData> sink = tap;
        if (sink == null) return;
        for (Object out : produced) {
            if (out instanceof SensorData record) sink.accept(record);
        }
    }

    void completeOutputs() {
        for (StageChannel<Object> channel : outputs) {
            channel.complete(name);
        }
    }

    void recordSuccess() {
        items.increment();
        metrics.counter(METRIC_ITEMS, 1.0, tags);
    }

    void recordFailure(StageRuntimeException error, Object item) {
        errors.increment();
        metrics.counter(METRIC_ERRORS, 1.0, tags);
        if (kind == PluginKind.WRITER) {
            log.error("Writer '{}' failed to write record {}: {}", name, item, error.getMessage(), error.getCause());
        } else {
            log.warn("Stage '{}' dropped an item: {}", name, error.getMessage());
        }
    }

    private StageResult invoke(Object item) {
        try {
            Iterable<?> produced = function.apply(item, units);
            if (produced == null) return StageResult.success(item, List.of());

            // Materialized here so lazy iterables fail inside the stage boundary
            List<Object> outputs = new ArrayList<>();
            for (Object out : produced) {
                if (out != null) outputs.add(out);
            }
            return StageResult.success(item, outputs);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            return StageResult.failure(item, new StageRuntimeException(name, e));
        }
    }

    private ItemErrorPolicy.Decision decide(StageResult failure, int attempt) {
        try {
            ItemErrorPolicy.Decision decision = policy.onFailure(name, failure, attempt);
            return decision == null ? ItemErrorPolicy.Decision.DROP : decision;
        } catch (RuntimeException e) {
            log.warn("Error policy of stage '{}' failed, dropping item: {}", name, e.toString());
            return ItemErrorPolicy.Decision.DROP;
        }
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    String name() { return name; }

    PluginKind kind() { return kind; }

    String type() { return type; }

    Object stage() { return stage; }

    StageChannel<Object> input() { return input; }

    List<StageChannel<Object>> outputs() { return outputs; }

    List<StageNode> downstream() { return downstream; }

    boolean escalated() { return escalated; }

    long items() { return items.sum(); }

    long errors() { return errors.sum(); }

    long units() { return units.sum(); }

    @Override
    public String toString() {
        return name + "(" + type + ")";
    }
}
