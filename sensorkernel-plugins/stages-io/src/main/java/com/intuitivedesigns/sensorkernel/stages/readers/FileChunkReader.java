/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.stages.readers;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.ConfigurationException;
import com.intuitivedesigns.sensorkernel.core.Reader;
import com.intuitivedesigns.sensorkernel.core.StatusReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Replays a recorded capture file as fixed-size byte chunks.
 *
 * <p>Config keys: {@code file_path} (required), {@code chunk_size} (default 1024),
 * {@code replay_delay_ms} (pause between chunks, default 0).</p>
 */
public final class FileChunkReader implements Reader, StatusReporter {

    private static final Logger log = LoggerFactory.getLogger(FileChunkReader.class);

    public static final String CFG_FILE_PATH = "file_path";
    public static final String CFG_CHUNK_SIZE = "chunk_size";
    public static final String CFG_REPLAY_DELAY_MS = "replay_delay_ms";

    private static final int DEFAULT_CHUNK_SIZE = 1024;
    private static final int MAX_CHUNK_SIZE = 16 * 1024 * 1024;

    private final Path path;
    private final int chunkSize;
    private final long replayDelayMs;

    private final AtomicLong position = new AtomicLong();
    private volatile long fileSize = -1L;
    private volatile InputStream in;

    public FileChunkReader(ConfigSection config) {
        String filePath = config.getString(CFG_FILE_PATH, "").trim();
        if (filePath.isEmpty()) {
            throw new ConfigurationException("File reader requires '" + CFG_FILE_PATH + "'");
        }
        this.path = Paths.get(filePath);
        this.chunkSize = Math.max(1, Math.min(MAX_CHUNK_SIZE, config.getInt(CFG_CHUNK_SIZE, DEFAULT_CHUNK_SIZE)));
        this.replayDelayMs = Math.max(0L, config.getLong(CFG_REPLAY_DELAY_MS, 0L));
    }

    @Override
    public void open() throws IOException {
        if (in != null) return;
        if (!Files.isRegularFile(path)) {
            throw new IOException("File not found: " + path);
        }
        fileSize = Files.size(path);
        position.set(0L);
        in = Files.newInputStream(path);
        log.info("Opened {} ({} bytes, chunk_size={})", path, fileSize, chunkSize);
    }

    @Override
    public Iterator<byte[]> read() throws IOException {
        if (in == null) open();
        final InputStream stream = in;

        return new Iterator<>() {
            private byte[] next;
            private boolean done;

            @Override
            public boolean hasNext() {
                if (next != null) return true;
                if (done) return false;
                next = readChunk(stream);
                if (next == null) done = true;
                return next != null;
            }

            @Override
            public byte[] next() {
                if (!hasNext()) throw new NoSuchElementException();
                byte[] chunk = next;
                next = null;
                return chunk;
            }
        };
    }

    private byte[] readChunk(InputStream stream) {
        if (replayDelayMs > 0 && position.get() > 0) {
            try {
                TimeUnit.MILLISECONDS.sleep(replayDelayMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        }
        try {
            byte[] buffer = new byte[chunkSize];
            int n = stream.readNBytes(buffer, 0, chunkSize);
            if (n <= 0) return null;
            position.addAndGet(n);
            return n == chunkSize ? buffer : Arrays.copyOf(buffer, n);
        } catch (IOException e) {
            throw new UncheckedIOException("Read failed at offset " + position.get() + " of " + path, e);
        }
    }

    @Override
    public void close() throws IOException {
        InputStream stream = in;
        in = null;
        if (stream != null) {
            stream.close();
            log.info("Closed {} after {} bytes", path, position.get());
        }
    }

    @Override
    public Map<String, Object> getStatus() {
        long size = fileSize;
        long pos = position.get();
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("file_path", path.toString());
        status.put("file_size", size);
        status.put("position", pos);
        status.put("progress", size > 0 ? (double) pos / size : 0.0);
        return status;
    }

    public Path path() {
        return path;
    }

    public int chunkSize() {
        return chunkSize;
    }
}
