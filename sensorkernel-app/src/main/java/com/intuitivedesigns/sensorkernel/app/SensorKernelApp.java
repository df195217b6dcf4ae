/*
 * Copyright 2026 Steven Lopez
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.sensorkernel.app;

import com.intuitivedesigns.sensorkernel.config.ConfigSection;
import com.intuitivedesigns.sensorkernel.config.KernelConfig;
import com.intuitivedesigns.sensorkernel.engine.Engine;
import com.intuitivedesigns.sensorkernel.logging.LoggingContext;
import com.intuitivedesigns.sensorkernel.metrics.MetricsFactory;
import com.intuitivedesigns.sensorkernel.metrics.MetricsRuntime;
import com.intuitivedesigns.sensorkernel.metrics.MetricsSettings;
import com.intuitivedesigns.sensorkernel.pipeline.MetricsSnapshot;
import com.intuitivedesigns.sensorkernel.pipeline.PipelineStatus;
import com.intuitivedesigns.sensorkernel.plugin.PluginRegistry;
import org.slf4j.Logger;

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

public final class SensorKernelApp {

    // --- Config Keys (relative to the "status" / "system" sections) ---
    private static final String CFG_STATUS_ENABLED = "enabled";
    private static final String CFG_STATUS_INTERVAL_SECONDS = "interval_seconds";
    private static final String CFG_EXIT_WHEN_DRAINED = "exit_when_drained";
    private static final String CFG_EXPORT_ON_SHUTDOWN = "export_on_shutdown";
    private static final String CFG_APP_NAME = "name";

    // --- Defaults ---
    private static final int DEFAULT_INTERVAL_SECONDS = 10;
    private static final int MIN_INTERVAL_SECONDS = 1;
    private static final int MAX_INTERVAL_SECONDS = 300;
    private static final long SHUTDOWN_WAIT_SECONDS = 30;

    private SensorKernelApp() {}

    public static void main(String[] args) {
        final LoggingContext logging;
        final KernelConfig config;
        try {
            config = KernelConfig.load();
        } catch (RuntimeException e) {
            LoggingContext.root("sensorkernel").logger(SensorKernelApp.class).error("Invalid configuration", e);
            System.exit(2);
            return;
        }

        final ConfigSection system = config.section("system");
        final ConfigSection status = config.section("status");
        logging = LoggingContext.root(system.getString(CFG_APP_NAME, "sensorkernel"));
        final Logger log = logging.logger(SensorKernelApp.class);

        log.info("=== Booting SensorKernel ===");

        MetricsRuntime metrics = null;
        Engine engine = null;
        ScheduledExecutorService statusScheduler = null;

        final CountDownLatch exitSignal = new CountDownLatch(1);
        final CountDownLatch shutdownComplete = new CountDownLatch(1);
        final AtomicBoolean shutdownStarted = new AtomicBoolean(false);

        try (LoggingContext.Scope ignored = logging.open()) {
            // 1. Metrics
            metrics = MetricsFactory.init(MetricsSettings.from(config.section("metrics")));

            // 2. Engine (plugin discovery + pipeline setup)
            final PluginRegistry registry = new PluginRegistry(logging, metrics);
            engine = new Engine(config, registry, metrics, logging);
            final int ready = engine.setup();
            if (ready == 0) {
                log.error("No pipeline could be set up; exiting");
                closeQuietly(metrics, log);
                System.exit(1);
                return;
            }

            // 3. Status reporter
            final boolean exitWhenDrained = status.getBoolean(CFG_EXIT_WHEN_DRAINED, false);
            if (status.getBoolean(CFG_STATUS_ENABLED, true) || exitWhenDrained) {
                final int intervalSeconds = clampInt(
                        status.getInt(CFG_STATUS_INTERVAL_SECONDS, DEFAULT_INTERVAL_SECONDS),
                        MIN_INTERVAL_SECONDS,
                        MAX_INTERVAL_SECONDS);
                statusScheduler = Executors.newSingleThreadScheduledExecutor(new NamedDaemonThreadFactory("sk-status"));
                startStatusReporter(statusScheduler, engine, intervalSeconds, exitWhenDrained, exitSignal, logging);
            }

            // 4. Shutdown hook
            final boolean exportOnShutdown = system.getBoolean(CFG_EXPORT_ON_SHUTDOWN, false);
            final Runnable shutdown = shutdownTask(engine, statusScheduler, metrics, exportOnShutdown, logging,
                    shutdownStarted, shutdownComplete);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                if (shutdownStarted.get()) {
                    awaitQuietly(shutdownComplete);
                    return;
                }
                log.info("Shutdown signal received.");
                shutdown.run();
                exitSignal.countDown();
            }, "sk-shutdown"));

            // 5. Launch
            log.info("Starting {} pipeline(s): {}", ready, engine.pipelineIds());
            engine.start();

            exitSignal.await();
            shutdown.run();
        } catch (Throwable t) {
            log.error("Fatal application error", t);

            if (shutdownStarted.compareAndSet(false, true)) {
                if (statusScheduler != null) {
                    statusScheduler.shutdownNow();
                }
                closeQuietly(engine, log);
                closeQuietly(metrics, log);
                shutdownComplete.countDown();
            }

            System.exit(1);
        }
    }

    private static Runnable shutdownTask(
            Engine engine,
            ScheduledExecutorService statusScheduler,
            MetricsRuntime metrics,
            boolean exportOnShutdown,
            LoggingContext logging,
            AtomicBoolean shutdownStarted,
            CountDownLatch shutdownComplete
    ) {
        final Logger log = logging.logger(SensorKernelApp.class);
        return () -> {
            if (!shutdownStarted.compareAndSet(false, true)) {
                awaitQuietly(shutdownComplete);
                return;
            }
            try (LoggingContext.Scope ignored = logging.open()) {
                if (statusScheduler != null) {
                    statusScheduler.shutdownNow();
                }
                engine.stop();
                if (exportOnShutdown) {
                    exportAll(engine, log);
                }
                logFinalStatus(engine.getStatus(), log);
            } finally {
                closeQuietly(metrics, log);
                shutdownComplete.countDown();
            }
        };
    }

    private static void startStatusReporter(
            ScheduledExecutorService scheduler,
            Engine engine,
            int intervalSeconds,
            boolean exitWhenDrained,
            CountDownLatch exitSignal,
            LoggingContext logging
    ) {
        final Logger log = logging.logger(SensorKernelApp.class);
        log.info("Status reporter active ({}s interval{})", intervalSeconds, exitWhenDrained ? ", exit when drained" : "");

        scheduler.scheduleAtFixedRate(logging.wrap(() -> {
            try {
                for (Map.Entry<String, PipelineStatus> e : engine.getStatus().entrySet()) {
                    log.info(describe(e.getValue()));
                }
                if (exitWhenDrained && engine.isDrained()) {
                    log.info("All pipelines drained; shutting down");
                    exitSignal.countDown();
                }
            } catch (Throwable t) {
                log.warn("Status reporter error", t);
            }
        }), intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    private static void exportAll(Engine engine, Logger log) {
        for (String id : engine.pipelineIds()) {
            try {
                engine.export(id).ifPresent(artifact -> log.info("Pipeline '{}' exported to {}", id, artifact));
            } catch (RuntimeException e) {
                log.warn("Pipeline '{}' export failed: {}", id, e.getMessage());
            }
        }
    }

    private static void logFinalStatus(Map<String, PipelineStatus> statuses, Logger log) {
        for (PipelineStatus status : statuses.values()) {
            log.info("FINAL {}", describe(status));
        }
    }

    static String describe(PipelineStatus status) {
        MetricsSnapshot m = status.metrics();
        return String.format(
                Locale.US,
                "PIPELINE %s | %s%s | READ: %,d | WRITTEN: %,d | SPEED: %,.1f rec/s | ERRORS: %,d | DROPPED: %,d",
                status.id(),
                status.state(),
                status.paused() ? " (paused)" : "",
                m.read(),
                m.written(),
                m.throughput(),
                m.totalErrors(),
                m.totalDropped());
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void closeQuietly(AutoCloseable resource, Logger log) {
        if (resource == null) return;
        try {
            resource.close();
        } catch (Exception e) {
            log.warn("Error closing {}: {}", resource.getClass().getSimpleName(), e.getMessage());
        }
    }

    private static int clampInt(int v, int min, int max) {
        return Math.max(min, Math.min(max, v));
    }

    private static final class NamedDaemonThreadFactory implements ThreadFactory {
        private final String name;

        private NamedDaemonThreadFactory(String name) {
            this.name = name;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        }
    }
}
