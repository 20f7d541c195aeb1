package dev.mars.eventloom.core;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import dev.mars.eventloom.api.EventStore;
import dev.mars.eventloom.api.metrics.EngineMetrics;
import dev.mars.eventloom.api.metrics.NoOpEngineMetrics;
import dev.mars.eventloom.core.config.EventLoomConfiguration;
import dev.mars.eventloom.core.dispatch.EventDispatcher;
import dev.mars.eventloom.core.metrics.MicrometerEngineMetrics;
import dev.mars.eventloom.core.replay.ReplayCoordinator;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the engine components around one event store.
 *
 * <pre>{@code
 * try (EventLoomEngine engine = EventLoomEngine.builder()
 *         .eventStore(new InMemoryEventStore())
 *         .meterRegistry(registry)
 *         .build()) {
 *     engine.dispatcher().publishNewStateTo(projection).and(auditLog);
 *     engine.commands().provide(OrderAggregate.TYPE).with(command).execute(order -> order.place(command));
 * }
 * }</pre>
 *
 * The engine owns the store it was built with and a worker pool that runs handler deliveries;
 * both are released on {@link #close()}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class EventLoomEngine implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventLoomEngine.class);

    private final EventLoomConfiguration configuration;
    private final EventStore eventStore;
    private final EngineMetrics metrics;
    private final ExecutorService workerExecutor;
    private final EventDispatcher dispatcher;
    private final CommandExecutor commandExecutor;
    private final ReplayCoordinator replayCoordinator;
    private volatile boolean closed = false;

    private EventLoomEngine(Builder builder) {
        this.configuration = builder.configuration != null ? builder.configuration : new EventLoomConfiguration();
        this.eventStore = Objects.requireNonNull(builder.eventStore, "Event store is required");
        this.metrics = resolveMetrics(configuration, builder);
        this.workerExecutor = createWorkerExecutor(configuration.getWorkerThreads());
        this.dispatcher = new EventDispatcher(configuration, metrics, workerExecutor);
        this.commandExecutor = new CommandExecutor(eventStore, dispatcher, configuration, metrics);
        this.replayCoordinator = new ReplayCoordinator(eventStore, dispatcher, configuration, metrics);
        logger.info("EventLoom engine started (profile: {}, metrics: {}, worker threads: {})",
            configuration.getProfile(), metrics.getClass().getSimpleName(), configuration.getWorkerThreads());
    }

    private static ExecutorService createWorkerExecutor(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "eventloom-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    private static EngineMetrics resolveMetrics(EventLoomConfiguration configuration, Builder builder) {
        if (!configuration.isMetricsEnabled()) {
            return NoOpEngineMetrics.INSTANCE;
        }
        if (builder.metrics != null) {
            return builder.metrics;
        }
        if (builder.meterRegistry != null) {
            return new MicrometerEngineMetrics(builder.meterRegistry);
        }
        return NoOpEngineMetrics.INSTANCE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public CommandExecutor commands() {
        ensureOpen();
        return commandExecutor;
    }

    public ReplayCoordinator replay() {
        ensureOpen();
        return replayCoordinator;
    }

    public EventDispatcher dispatcher() {
        return dispatcher;
    }

    public EventLoomConfiguration getConfiguration() {
        return configuration;
    }

    public EngineMetrics getMetrics() {
        return metrics;
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        workerExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("Worker threads still busy after 5s, interrupting them");
                workerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }

        try {
            eventStore.close();
            logger.info("EventLoom engine closed");
        } catch (Exception e) {
            logger.warn("Failed to close event store", e);
        }
    }

    /**
     * @return true once {@link #close()} has stopped the worker pool
     */
    boolean isWorkerPoolShutdown() {
        return workerExecutor.isShutdown();
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("EventLoom engine is closed");
        }
    }

    public static class Builder {
        private EventLoomConfiguration configuration;
        private EventStore eventStore;
        private MeterRegistry meterRegistry;
        private EngineMetrics metrics;

        public Builder configuration(EventLoomConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        public Builder eventStore(EventStore eventStore) {
            this.eventStore = eventStore;
            return this;
        }

        /**
         * Records engine metrics into the registry through {@link MicrometerEngineMetrics}.
         */
        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        /**
         * Uses a custom metrics implementation; takes precedence over {@link #meterRegistry}.
         */
        public Builder metrics(EngineMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public EventLoomEngine build() {
            return new EventLoomEngine(this);
        }
    }
}
