/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.pipeline;

import com.intuitivedesigns.sensorkernel.core.Analyzer;
import com.intuitivedesigns.sensorkernel.core.Decoder;
import com.intuitivedesigns.sensorkernel.core.Processor;
import com.intuitivedesigns.sensorkernel.core.Reader;
import com.intuitivedesigns.sensorkernel.core.SensorData;
import com.intuitivedesigns.sensorkernel.core.Visualizer;
import com.intuitivedesigns.sensorkernel.core.Writer;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.sensorkernel.spi.PluginKind;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Stage nodes of one pipeline and the channels between them.
 *
 * <pre>
 * reader -> decoder -> processor-0 -> ... -> processor-N --+--> analyzer-i ----+
 *                                                          +--> visualizer-i   |
 *                                                          +--> writer-i  <----+
 * </pre>
 *
 * <p>Each consumer owns one input channel named {@code <stage>.in}. Writer channels are fed by the
 * processing tail and by every analyzer, so they count {@code 1 + analyzers} producers.</p>
 */
final class StageGraph {

    private final String pipelineId;
    private final ExecutionSettings settings;
    private final BooleanSupplier cancelled;
    private final ItemErrorPolicy policy;
    private final MetricsRuntime metrics;
    private final Logger log;

    private final List<StageNode> nodes = new CopyOnWriteArrayList<>();
    private final Map<String, StageChannel<Object>> channels = Collections.synchronizedMap(new LinkedHashMap<>());

    private StageNode source;
    private StageNode decoder;
    private final List<StageNode> processors = new ArrayList<>();
    private final List<StageNode> analyzers = new ArrayList<>();
    private final List<StageNode> visualizers = new ArrayList<>();
    private final List<StageNode> writers = new ArrayList<>();

    StageGraph(String pipelineId,
               ExecutionSettings settings,
               BooleanSupplier cancelled,
               ItemErrorPolicy policy,
               MetricsRuntime metrics,
               Logger log) {
        this.pipelineId = pipelineId;
        this.settings = settings;
        this.cancelled = cancelled;
        this.policy = policy;
        this.metrics = metrics;
        this.log = log;
    }

    // -------------------------------------------------------------------------
    // Construction
    // -------------------------------------------------------------------------

    void reader(String type, Reader reader) {
        source = new StageNode(pipelineId, "reader", PluginKind.READER, type, reader, null,
                (item, units) -> List.of(item), policy, metrics, log);
    }

    void decoder(String type, Decoder stage) {
        decoder = node("decoder", PluginKind.DECODER, type, stage,
                (item, units) -> stage.decode((byte[]) item));
    }

    void processor(String type, Processor stage) {
        processors.add(node("processor-" + processors.size(), PluginKind.PROCESSOR, type, stage,
                (item, units) -> stage.process((SensorData) item)));
    }

    void analyzer(String type, Analyzer stage) {
        analyzers.add(node("analyzer-" + analyzers.size(), PluginKind.ANALYZER, type, stage,
                (item, units) -> stage.analyze((SensorData) item)));
    }

    void visualizer(String type, Visualizer stage) {
        visualizers.add(node("visualizer-" + visualizers.size(), PluginKind.VISUALIZER, type, stage,
                (item, units) -> {
                    stage.visualize((SensorData) item);
                    return List.of();
                }));
    }

    void writer(String type, Writer stage) {
        writers.add(node("writer-" + writers.size(), PluginKind.WRITER, type, stage,
                (item, units) -> {
                    units.add(stage.write((SensorData) item));
                    return List.of();
                }));
    }

    /**
     * Connects the nodes and fixes their order. Call once, after every stage has been added.
     *
     * @param history receives every record entering the writer stream
     */
    void wire(Consumer<SensorData> history) {
        if (source == null || decoder == null) {
            throw new IllegalStateException("Reader and decoder are required");
        }

        source.connect(decoder);
        StageNode tail = decoder;
        for (StageNode processor : processors) {
            tail.connect(processor);
            tail = processor;
        }

        // Writers first so sequential mode persists a record before analyzing it
        for (StageNode writer : writers) {
            tail.connect(writer);
        }
        for (StageNode visualizer : visualizers) {
            tail.connect(visualizer);
        }
        for (StageNode analyzer : analyzers) {
            tail.connect(analyzer);
            for (StageNode writer : writers) {
                analyzer.connect(writer);
            }
            analyzer.tapInto(history);
        }
        tail.tapInto(history);

        nodes.add(source);
        nodes.add(decoder);
        nodes.addAll(processors);
        nodes.addAll(analyzers);
        nodes.addAll(visualizers);
        nodes.addAll(writers);
    }

    /**
     * Removes a stage that will never run. Its input channel is dropped and it is removed from
     * every producer's outputs.
     */
    void detach(StageNode node) {
        for (StageNode producer : nodes) {
            producer.disconnect(node);
        }
        nodes.remove(node);
        writers.remove(node);
        analyzers.remove(node);
        visualizers.remove(node);
        if (node.input() != null) {
            channels.remove(node.input().name());
        }
        // Its own downstream channels must not wait for it
        for (StageChannel<Object> out : node.outputs()) {
            out.removeProducer(node.name());
        }
    }

    /**
     * Completes every channel on behalf of all its producers; used by shutdown.
     */
    void completeAll() {
        List<StageChannel<Object>> snapshot;
        synchronized (channels) {
            snapshot = new ArrayList<>(channels.values());
        }
        for (StageChannel<Object> channel : snapshot) {
            channel.completeAll();
        }
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    StageNode source() {
        return source;
    }

    StageNode decoderNode() {
        return decoder;
    }

    /**
     * All nodes in topological order (reader first, writers last).
     */
    List<StageNode> nodes() {
        return nodes;
    }

    List<StageNode> nodes(PluginKind kind) {
        return nodes.stream().filter(n -> n.kind() == kind).collect(Collectors.toList());
    }

    Map<String, StageChannel<Object>> channels() {
        synchronized (channels) {
            return new LinkedHashMap<>(channels);
        }
    }

    String describe() {
        return nodes.stream().map(StageNode::toString).collect(Collectors.joining(", "));
    }

    private StageNode node(String name, PluginKind kind, String type, Object stage, StageNode.StageFunction fn) {
        StageChannel<Object> input = new StageChannel<>(name + ".in", settings.queueSize(),
                settings.pushTimeoutMs(), settings.pushRetries(), cancelled);
        channels.put(input.name(), input);
        return new StageNode(pipelineId, name, kind, type, stage, input, fn, policy, metrics, log);
    }
}
