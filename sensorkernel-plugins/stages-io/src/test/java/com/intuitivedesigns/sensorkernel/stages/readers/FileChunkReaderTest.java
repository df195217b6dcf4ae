/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.stages.readers;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileChunkReaderTest {

    @TempDir
    Path dir;

    private FileChunkReader reader(Path file, int chunkSize) {
        return new FileChunkReader(ConfigSection.of(Map.of(
                "file_path", file.toString(),
                "chunk_size", chunkSize)));
    }

    @Test
    void testReadsFileInFixedSizeChunks() throws Exception {
        // Setup
        Path file = dir.resolve("imu.csv");
        Files.writeString(file, "0123456789", StandardCharsets.UTF_8);
        FileChunkReader reader = reader(file, 4);

        // Act
        List<Integer> sizes = new ArrayList<>();
        ByteArrayOutputStream all = new ByteArrayOutputStream();
        reader.open();
        Iterator<byte[]> chunks = reader.read();
        while (chunks.hasNext()) {
            byte[] chunk = chunks.next();
            sizes.add(chunk.length);
            all.write(chunk);
        }
        reader.close();

        // Assert
        assertEquals(List.of(4, 4, 2), sizes);
        assertEquals("0123456789", all.toString(StandardCharsets.UTF_8));
        Map<String, Object> status = reader.getStatus();
        assertEquals(10L, status.get("file_size"));
        assertEquals(10L, status.get("position"));
        assertEquals(1.0, status.get("progress"));
    }

    @Test
    void testEmptyFileEndsImmediately() throws Exception {
        Path file = dir.resolve("empty.csv");
        Files.createFile(file);
        FileChunkReader reader = reader(file, 16);

        reader.open();

        assertFalse(reader.read().hasNext());
        assertEquals(0.0, reader.getStatus().get("progress"));
        reader.close();
    }

    @Test
    void testMissingFileFailsOnOpen() {
        FileChunkReader reader = reader(dir.resolve("absent.csv"), 16);

        IOException e = assertThrows(IOException.class, reader::open);
        assertTrue(e.getMessage().contains("File not found"));
    }

    @Test
    void testFilePathIsRequired() {
        assertThrows(ConfigurationException.class, () -> new FileChunkReader(ConfigSection.empty()));
    }

    @Test
    void testChunkSizeIsClamped() {
        FileChunkReader reader = reader(dir.resolve("x.csv"), 0);

        assertEquals(1, reader.chunkSize());
    }

    @Test
    void testCloseIsIdempotent() throws Exception {
        Path file = dir.resolve("data.csv");
        Files.writeString(file, "abc", StandardCharsets.UTF_8);
        FileChunkReader reader = reader(file, 2);
        reader.open();

        reader.close();
        reader.close();

        assertEquals(0L, reader.getStatus().get("position"));
    }
}
