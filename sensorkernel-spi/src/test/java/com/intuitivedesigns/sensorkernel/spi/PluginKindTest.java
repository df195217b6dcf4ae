/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.spi;

import com.intuitivedesigns.sensorkernel.core.Decoder;
import com.intuitivedesigns.sensorkernel.core.Writer;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PluginKindTest {

    @Test
    void testFromStringAcceptsSingularAndPlural() {
        assertEquals(PluginKind.DECODER, PluginKind.fromString("decoder"));
        assertEquals(PluginKind.DECODER, PluginKind.fromString(" Decoders "));
        assertEquals(PluginKind.CONFIGURATOR, PluginKind.fromString("CONFIGURATORS"));
    }

    @Test
    void testUnknownKindIsRejected() {
        assertThrows(InvalidKindException.class, () -> PluginKind.fromString("transformer"));
        assertThrows(InvalidKindException.class, () -> PluginKind.fromString(null));
    }

    @Test
    void testKindDescriptors() {
        assertEquals(Decoder.class, PluginKind.DECODER.contract());
        assertEquals(Writer.class, PluginKind.WRITER.contract());
        assertEquals("com.intuitivedesigns.sensorkernel.stages.writers", PluginKind.WRITER.defaultPackage());
        assertEquals("written", PluginKind.WRITER.counterName());
        assertEquals("analyzer", PluginKind.ANALYZER.label());
    }

    @Test
    void testPluginIds() {
        assertEquals("csv_file", PluginIds.normalize("  CSV_File "));
        assertEquals("", PluginIds.normalize(null));
        assertEquals("CsvDecoder", PluginIds.pascalCase("csv_decoder"));
        assertEquals("AnomalyDetector", PluginIds.pascalCase("anomaly-detector"));
        assertEquals("MovingAverage", PluginIds.pascalCase("movingAverage"));
    }
}
