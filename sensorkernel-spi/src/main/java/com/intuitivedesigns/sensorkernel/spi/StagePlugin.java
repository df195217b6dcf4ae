/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.spi;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;

/**
 * Service interface for every stage factory.
 *
 * <p>Implementations are listed in
 * {@code META-INF/services/com.intuitivedesigns.sensorkernel.spi.StagePlugin} and picked up by the
 * registry's {@link java.util.ServiceLoader} scan. Implement one of the per-kind sub-interfaces
 * ({@link ReaderPlugin}, {@link DecoderPlugin}...) rather than this one directly.</p>
 *
 * @param <T> the stage contract produced
 */
public interface StagePlugin<T> {

    /**
     * @return name used in pipeline configuration (e.g. "csv", "file")
     */
    String id();

    PluginKind kind();

    /**
     * Concrete class of the instances {@link #create} returns.
     * Checked against {@link PluginKind#contract()} before the plugin is accepted.
     */
    Class<? extends T> stageType();

    T create(ConfigSection config, MetricsRuntime metrics) throws Exception;
}
