/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.config;

import com.intuitivedesigns.sensorkernel.core.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Kernel configuration document.
 *
 * <p>Loaded from {@code -Dsensorkernel.config.path}, then env {@code SENSORKERNEL_CONFIG_PATH},
 * then the classpath resource {@value #CLASSPATH_RESOURCE}. Top-level sections:
 * {@code system}, {@code plugins}, {@code metrics}, {@code status}, {@code pipelines}.</p>
 */
public final class KernelConfig {

    private static final Logger log = LoggerFactory.getLogger(KernelConfig.class);

    public static final String PROP_CONFIG_PATH = "sensorkernel.config.path";
    public static final String ENV_CONFIG_PATH = "SENSORKERNEL_CONFIG_PATH";
    public static final String CLASSPATH_RESOURCE = "sensorkernel.yaml";

    public static final String CFG_MAX_PIPELINES = "system.max_pipelines";
    public static final String CFG_SEARCH_PATHS = "plugins.search_paths";
    public static final int DEFAULT_MAX_PIPELINES = 5;

    private final ConfigSection root;

    private KernelConfig(ConfigSection root) {
        this.root = root;
    }

    public static KernelConfig of(Map<String, ?> document) {
        return new KernelConfig(ConfigSection.of(document));
    }

    public static KernelConfig empty() {
        return new KernelConfig(ConfigSection.empty());
    }

    /**
     * Resolves the configuration location the same way the launcher documents it.
     * Falls back to an empty configuration when nothing is found.
     */
    public static KernelConfig load() {
        String path = System.getProperty(PROP_CONFIG_PATH);
        if (path == null || path.isBlank()) {
            path = System.getenv(ENV_CONFIG_PATH);
        }

        if (path != null && !path.isBlank()) {
            try {
                return load(Paths.get(path.trim()));
            } catch (IOException e) {
                throw new ConfigurationException("Failed to read configuration file: " + path, e);
            }
        }

        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = KernelConfig.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(CLASSPATH_RESOURCE)) {
            if (in != null) {
                log.info("Loading configuration from classpath resource {}", CLASSPATH_RESOURCE);
                return parse(new InputStreamReader(in, StandardCharsets.UTF_8), CLASSPATH_RESOURCE);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read classpath resource " + CLASSPATH_RESOURCE, e);
        }

        log.warn("No configuration specified. Usage: -D{}=/path/to/sensorkernel.yaml", PROP_CONFIG_PATH);
        return empty();
    }

    public static KernelConfig load(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        log.info("Loading configuration from: {}", path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader, path.toString());
        }
    }

    public static KernelConfig parse(String yaml) {
        return parse(new StringReader(yaml), "inline");
    }

    /**
     * @throws ConfigurationException on malformed YAML or a non-mapping root
     */
    public static KernelConfig parse(Reader reader, String origin) {
        final Object document;
        try {
            document = new Yaml().load(reader);
        } catch (YAMLException e) {
            throw new ConfigurationException("Failed to parse YAML config at " + origin, e);
        }
        if (document == null) {
            return empty();
        }
        return new KernelConfig(ConfigSection.of(asMap(document, "root")));
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    public ConfigSection root() {
        return root;
    }

    public ConfigSection section(String name) {
        return root.section(name);
    }

    public int maxPipelines() {
        return root.getInt(CFG_MAX_PIPELINES, DEFAULT_MAX_PIPELINES);
    }

    public List<Path> pluginSearchPaths() {
        List<Path> paths = new ArrayList<>();
        for (String entry : root.getStringList(CFG_SEARCH_PATHS)) {
            if (!entry.isBlank()) paths.add(Paths.get(entry.trim()));
        }
        return paths;
    }

    /**
     * Raw entries of the {@code pipelines} list. Non-mapping entries are reported and skipped.
     */
    public List<ConfigSection> pipelineSections() {
        List<ConfigSection> out = new ArrayList<>();
        int index = 0;
        for (Object entry : root.getList("pipelines")) {
            if (entry instanceof Map<?, ?> raw) {
                out.add(ConfigSection.asSection(raw));
            } else {
                log.error("Ignoring pipelines[{}]: expected a mapping but found {}", index, entry);
            }
            index++;
        }
        return out;
    }

    private static Map<String, Object> asMap(Object node, String context) {
        if (!(node instanceof Map<?, ?> raw)) {
            throw new ConfigurationException(context + " section must be a mapping");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new ConfigurationException(context + " section contains non-string key: " + entry.getKey());
            }
            map.put(key, entry.getValue());
        }
        return map;
    }

    @Override
    public String toString() {
        return "KernelConfig" + root.keys();
    }
}
