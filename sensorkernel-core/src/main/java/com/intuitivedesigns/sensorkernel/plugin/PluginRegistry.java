/*
 * Copyright 2026 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.plugin;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.core.StageLifecycle;
import com.intuitivedesigns.sensorkernel.logging.LoggingContext;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.sensorkernel.spi.PluginIds;
import com.intuitivedesigns.sensorkernel.spi.PluginKind;
import com.intuitivedesigns.sensorkernel.spi.PluginLoadException;
import com.intuitivedesigns.sensorkernel.spi.PluginNotFoundException;
import com.intuitivedesigns.sensorkernel.spi.StagePlugin;
import org.slf4j.Logger;

import java.io.IOException;
import java.lang.reflect.Modifier;
import java.net.MalformedURLException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Process-wide catalog of stage factories, keyed by {@code (PluginKind, name)}.
 *
 * <p><b>Discovery:</b> {@link #discoverPlugins(List)} runs a {@link ServiceLoader} scan over the
 * application class loader and over one {@link URLClassLoader} per search path. A location keeps its
 * loader across scans once it has contributed a plugin; loaders of locations that contributed
 * nothing are closed. Every candidate passes the same capability check as
 * {@link #register(StagePlugin)}.</p>
 *
 * <p><b>Collisions:</b> the last registration for a key wins and a WARN names both classes.</p>
 *
 * <p><b>Concurrency:</b> registration is serialized by a lock; lookups read a concurrent map and
 * never block.</p>
 */
public final class PluginRegistry {

    private static final int MAX_PROVIDER_ERRORS = 256;

    private final Logger log;
    private final MetricsRuntime metrics;
    private final ReentrantLock registrationLock = new ReentrantLock();
    private final Map<PluginKind, Map<String, StagePlugin<?>>> plugins = new EnumMap<>(PluginKind.class);

    // Loaders consulted by the conventional-path lookup, application loader first
    private final List<ClassLoader> searchLoaders = new CopyOnWriteArrayList<>();
    private final Map<Path, URLClassLoader> locationLoaders = new ConcurrentHashMap<>();

    public PluginRegistry(LoggingContext logging, MetricsRuntime metrics) {
        this.log = Objects.requireNonNull(logging, "logging").logger(PluginRegistry.class);
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        for (PluginKind kind : PluginKind.values()) {
            plugins.put(kind, new ConcurrentHashMap<>());
        }
        searchLoaders.add(resolveClassLoader());
    }

    // -------------------------------------------------------------------------
    // Discovery & registration
    // -------------------------------------------------------------------------

    /**
     * Scans the application class path, then each search path (a directory of jars, a single jar
     * or a class directory). Unreadable locations are logged and skipped.
     *
     * @return number of plugins accepted by this call
     */
    public int discoverPlugins(List<Path> searchPaths) {
        int accepted = scan(resolveClassLoader(), "classpath", false);

        if (searchPaths != null) {
            for (Path location : searchPaths) {
                if (location == null) continue;
                accepted += scanLocation(location);
            }
        }

        log.info("Plugin discovery complete: {} accepted", accepted);
        return accepted;
    }

    /**
     * Validates and registers a factory. Structurally invalid factories are skipped with an INFO
     * log rather than failing the caller.
     *
     * @return true when the plugin was accepted
     */
    public boolean register(StagePlugin<?> plugin) {
        Objects.requireNonNull(plugin, "plugin");
        final String rejection = validate(plugin);
        if (rejection != null) {
            log.info("Skipping plugin {}: {}", plugin.getClass().getName(), rejection);
            return false;
        }

        final PluginKind kind = plugin.kind();
        final String key = PluginIds.normalize(plugin.id());

        registrationLock.lock();
        try {
            StagePlugin<?> previous = plugins.get(kind).put(key, plugin);
            if (previous != null && previous != plugin && !sameImplementation(previous, plugin)) {
                log.warn("Duplicate {} plugin '{}': {} replaces {}",
                        kind.label(), key, describe(plugin), describe(previous));
            }
        } finally {
            registrationLock.unlock();
        }
        log.debug("Registered {} plugin '{}' -> {}", kind.label(), key, plugin.stageType().getName());
        return true;
    }

    // -------------------------------------------------------------------------
    // Lookup & instantiation
    // -------------------------------------------------------------------------

    /**
     * Resolves a factory by name, falling back to a class named after it in the kind's default
     * package ({@code csv_decoder} resolves {@code ...stages.decoders.CsvDecoder}).
     *
     * @throws PluginNotFoundException when neither finds anything
     */
    public StagePlugin<?> getConstructor(PluginKind kind, String name) {
        Objects.requireNonNull(kind, "kind");
        final String key = PluginIds.normalize(name);

        StagePlugin<?> plugin = plugins.get(kind).get(key);
        if (plugin != null) return plugin;

        plugin = conventionalLookup(kind, name);
        if (plugin != null && register(plugin)) {
            log.info("Resolved {} '{}' by convention -> {}", kind.label(), key, plugin.stageType().getName());
            return plugin;
        }

        throw new PluginNotFoundException(kind, name, listAvailable(kind));
    }

    /**
     * Instantiates a stage, checks it against the kind's contract and runs its
     * {@link StageLifecycle#setup()} hook.
     *
     * @throws PluginNotFoundException unchanged from {@link #getConstructor}
     * @throws PluginLoadException     for anything that fails after resolution
     */
    public Object createInstance(PluginKind kind, String name, ConfigSection config) {
        final StagePlugin<?> plugin = getConstructor(kind, name);
        final ConfigSection settings = config == null ? ConfigSection.empty() : config;

        final Object instance;
        try {
            instance = plugin.create(settings, metrics);
        } catch (Exception | LinkageError e) {
            throw new PluginLoadException(kind, name, e);
        }

        if (instance == null) {
            throw new PluginLoadException(kind, name, "factory returned null");
        }
        if (!kind.contract().isInstance(instance)) {
            throw new PluginLoadException(kind, name,
                    instance.getClass().getName() + " does not implement " + kind.contract().getSimpleName());
        }

        if (instance instanceof StageLifecycle lifecycle) {
            try {
                lifecycle.setup();
            } catch (Exception | LinkageError e) {
                throw new PluginLoadException(kind, name, e);
            }
        }

        log.info("Created {} '{}' ({})", kind.label(), PluginIds.normalize(name), instance.getClass().getSimpleName());
        return instance;
    }

    public <T> T createInstance(PluginKind kind, String name, ConfigSection config, Class<T> contract) {
        return contract.cast(createInstance(kind, name, config));
    }

    // -------------------------------------------------------------------------
    // Introspection
    // -------------------------------------------------------------------------

    public Set<String> listAvailable(PluginKind kind) {
        return Collections.unmodifiableSet(new TreeSet<>(plugins.get(kind).keySet()));
    }

    /**
     * @throws com.intuitivedesigns.sensorkernel.spi.InvalidKindException for an unknown kind
     */
    public Set<String> listAvailable(String kind) {
        return listAvailable(PluginKind.fromString(kind));
    }

    public Map<PluginKind, Set<String>> listAll() {
        Map<PluginKind, Set<String>> all = new EnumMap<>(PluginKind.class);
        for (PluginKind kind : PluginKind.values()) {
            all.put(kind, listAvailable(kind));
        }
        return Collections.unmodifiableMap(all);
    }

    public void logAvailablePlugins() {
        log.info("Plugin Catalog Loaded:");
        for (PluginKind kind : PluginKind.values()) {
            log.info("  {} {}", String.format("%-15s", capitalize(kind.plural()) + ":"), listAvailable(kind));
        }
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    @SuppressWarnings("rawtypes")
    private int scan(ClassLoader loader, String origin, boolean ownClassesOnly) {
        int accepted = 0;
        int errors = 0;
        Iterator<StagePlugin> it = ServiceLoader.load(StagePlugin.class, loader).iterator();

        while (true) {
            final StagePlugin<?> plugin;
            try {
                if (!it.hasNext()) break;
                plugin = it.next();
            } catch (ServiceConfigurationError e) {
                log.info("Skipping unloadable plugin in {}: {}", origin, e.getMessage());
                if (++errors >= MAX_PROVIDER_ERRORS) {
                    log.warn("Giving up on {} after {} provider errors", origin, errors);
                    break;
                }
                continue;
            }

            // A child loader also sees the parent's service files; those were handled already.
            if (ownClassesOnly && plugin.getClass().getClassLoader() != loader) continue;

            if (register(plugin)) accepted++;
        }
        return accepted;
    }

    private int scanLocation(Path location) {
        final Path key = location.toAbsolutePath().normalize();
        final URLClassLoader known = locationLoaders.get(key);
        if (known != null) {
            return scan(known, location.toString(), true);
        }

        final URLClassLoader loader;
        try {
            loader = loaderFor(location);
        } catch (IOException e) {
            log.warn("Skipping plugin location {}: {}", location, e.toString());
            return 0;
        }

        final int found = scan(loader, location.toString(), true);
        if (found == 0) {
            log.debug("No plugins in {}; releasing its class loader", location);
            try {
                loader.close();
            } catch (IOException e) {
                log.warn("Failed to close class loader for {}: {}", location, e.toString());
            }
            return 0;
        }
        locationLoaders.put(key, loader);
        searchLoaders.add(loader);
        return found;
    }

    int searchLoaderCount() {
        return searchLoaders.size();
    }

    private static URLClassLoader loaderFor(Path location) throws IOException {
        if (!Files.exists(location)) {
            throw new NoSuchFileException(location.toString());
        }

        List<URL> urls = new ArrayList<>();
        if (Files.isDirectory(location)) {
            urls.add(toUrl(location));
            try (Stream<Path> entries = Files.list(location)) {
                for (Path entry : (Iterable<Path>) entries.sorted()::iterator) {
                    if (entry.getFileName().toString().endsWith(".jar")) {
                        urls.add(toUrl(entry));
                    }
                }
            }
        } else {
            urls.add(toUrl(location));
        }
        return new URLClassLoader(urls.toArray(new URL[0]), resolveClassLoader());
    }

    private static URL toUrl(Path path) throws MalformedURLException {
        return path.toUri().toURL();
    }

    private StagePlugin<?> conventionalLookup(PluginKind kind, String name) {
        if (name == null || name.isBlank()) return null;

        for (String className : conventionalClassNames(kind, name.trim())) {
            for (ClassLoader loader : searchLoaders) {
                final Class<?> type;
                try {
                    type = Class.forName(className, false, loader);
                } catch (ClassNotFoundException | LinkageError e) {
                    log.debug("Convention lookup miss: {} ({})", className, e.toString());
                    continue;
                }
                ReflectiveStagePlugin plugin = ReflectiveStagePlugin.forClass(name.trim(), kind, type);
                if (plugin == null) {
                    log.info("Skipping plugin {}: no public (ConfigSection) or no-arg constructor", className);
                    return null;
                }
                return plugin;
            }
        }
        return null;
    }

    private static Set<String> conventionalClassNames(PluginKind kind, String name) {
        Set<String> names = new LinkedHashSet<>();
        if (name.indexOf('.') > 0) {
            names.add(name);
        }
        names.add(kind.defaultPackage() + "." + name);
        names.add(kind.defaultPackage() + "." + PluginIds.pascalCase(name));
        return names;
    }

    /**
     * @return null when the plugin is acceptable, otherwise the reason it is not
     */
    private static String validate(StagePlugin<?> plugin) {
        final String id;
        final PluginKind kind;
        final Class<?> type;
        try {
            id = plugin.id();
            kind = plugin.kind();
            type = plugin.stageType();
        } catch (RuntimeException e) {
            return "descriptor failed: " + e;
        }

        if (id == null || id.isBlank()) return "blank id";
        if (kind == null) return "no plugin kind";
        if (type == null) return "no stage type";
        if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
            return type.getName() + " is not a concrete class";
        }
        if (!kind.contract().isAssignableFrom(type)) {
            return type.getName() + " does not implement " + kind.contract().getName();
        }
        return null;
    }

    private static boolean sameImplementation(StagePlugin<?> a, StagePlugin<?> b) {
        return a.getClass() == b.getClass() && a.stageType() == b.stageType();
    }

    private static String describe(StagePlugin<?> plugin) {
        return plugin.getClass().getName() + "(" + plugin.stageType().getName() + ")";
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }

    private static ClassLoader resolveClassLoader() {
        final ClassLoader ctx = Thread.currentThread().getContextClassLoader();
        return (ctx != null) ? ctx : PluginRegistry.class.getClassLoader();
    }
}
