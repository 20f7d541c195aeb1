package dev.mars.eventloom.core.metrics;

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

import dev.mars.eventloom.api.metrics.EngineMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Objects;

/**
 * Micrometer-based implementation of EngineMetrics.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public class MicrometerEngineMetrics implements EngineMetrics {

    private final MeterRegistry registry;

    public MicrometerEngineMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "Meter registry cannot be null");
    }

    @Override
    public void recordCommand(String aggregateType, String outcome, Duration duration) {
        Counter.builder("eventloom.commands.total")
            .tag("aggregate_type", tagValue(aggregateType))
            .tag("outcome", tagValue(outcome))
            .description("Total count of executed commands by outcome")
            .register(registry)
            .increment();

        Timer.builder("eventloom.commands.duration")
            .tag("aggregate_type", tagValue(aggregateType))
            .description("Duration of command execution from load to dispatch")
            .register(registry)
            .record(duration);
    }

    @Override
    public void recordEventsCommitted(String aggregateType, int count) {
        Counter.builder("eventloom.events.committed.total")
            .tag("aggregate_type", tagValue(aggregateType))
            .description("Total count of events persisted by commits")
            .register(registry)
            .increment(count);
    }

    @Override
    public void recordConcurrencyConflict(String aggregateType) {
        Counter.builder("eventloom.concurrency.conflicts.total")
            .tag("aggregate_type", tagValue(aggregateType))
            .description("Total count of commits rejected by the version check")
            .register(registry)
            .increment();
    }

    @Override
    public void recordDispatchFailure(String handlerName, String reason) {
        Counter.builder("eventloom.dispatch.failures.total")
            .tag("handler", tagValue(handlerName))
            .tag("reason", tagValue(reason))
            .description("Total count of failed event deliveries by handler")
            .register(registry)
            .increment();
    }

    @Override
    public void recordEventsReplayed(String aggregateType, long deliveries) {
        Counter.builder("eventloom.events.replayed.total")
            .tag("aggregate_type", tagValue(aggregateType))
            .description("Total count of event deliveries made by replays")
            .register(registry)
            .increment(deliveries);
    }

    private static String tagValue(String value) {
        return value != null ? value : "unknown";
    }
}
