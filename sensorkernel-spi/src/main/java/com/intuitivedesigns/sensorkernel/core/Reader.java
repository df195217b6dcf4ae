/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */
package com.intuitivedesigns.sensorkernel.core;

import java.util.Iterator;

/**
 * Source of raw byte chunks (file replay, device port, socket...).
 *
 * <p>{@link #read()} is called once per run. The returned iterator is pulled by a single thread;
 * it ends the stream by returning {@code false} from {@code hasNext()}. Chunk boundaries are
 * arbitrary, so decoders must cope with records split across chunks.</p>
 */
public interface Reader extends AutoCloseable {

    default void open() throws Exception {}

    Iterator<byte[]> read() throws Exception;

    @Override
    default void close() throws Exception {}
}
