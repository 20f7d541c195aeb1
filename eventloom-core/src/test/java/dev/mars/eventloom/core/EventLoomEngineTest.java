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

import dev.mars.eventloom.api.AggregateId;
import dev.mars.eventloom.api.EventHandler;
import dev.mars.eventloom.api.error.EventLoomErrorCodes;
import dev.mars.eventloom.api.metrics.NoOpEngineMetrics;
import dev.mars.eventloom.core.config.EventLoomConfiguration;
import dev.mars.eventloom.core.metrics.MicrometerEngineMetrics;
import dev.mars.eventloom.core.replay.ReplayReport;
import dev.mars.eventloom.inmemory.InMemoryEventStore;
import dev.mars.eventloom.test.categories.TestCategories;
import dev.mars.eventloom.test.handlers.RecordingEventHandler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.INTEGRATION)
class EventLoomEngineTest {

    @Test
    void testEventStoreIsRequired() {
        assertThrows(NullPointerException.class,
            () -> EventLoomEngine.builder().configuration(TestConfigurations.with()).build());
    }

    @Test
    void testMetricsSelection() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();

        try (EventLoomEngine withRegistry = EventLoomEngine.builder()
                .configuration(TestConfigurations.with())
                .eventStore(new InMemoryEventStore())
                .meterRegistry(registry)
                .build();
             EventLoomEngine disabled = EventLoomEngine.builder()
                .configuration(TestConfigurations.with("eventloom.metrics.enabled", "false"))
                .eventStore(new InMemoryEventStore())
                .meterRegistry(registry)
                .build();
             EventLoomEngine bare = EventLoomEngine.builder()
                .configuration(TestConfigurations.with())
                .eventStore(new InMemoryEventStore())
                .build()) {

            assertInstanceOf(MicrometerEngineMetrics.class, withRegistry.getMetrics());
            assertSame(NoOpEngineMetrics.INSTANCE, disabled.getMetrics());
            assertSame(NoOpEngineMetrics.INSTANCE, bare.getMetrics());
        }
    }

    @Test
    @DisplayName("Commands, dispatch and replay work together over one store")
    void testEndToEnd() throws Exception {
        InMemoryEventStore store = new InMemoryEventStore();
        RecordingEventHandler projection = new RecordingEventHandler("projection");
        AggregateId id = AggregateId.of("task-42");

        try (EventLoomEngine engine = EventLoomEngine.builder()
                .configuration(TestConfigurations.with())
                .eventStore(store)
                .build()) {
            engine.dispatcher().publishNewStateTo(projection);

            engine.commands().provide(TaskAggregate.TYPE).with(id).execute(task -> task.start(1))
                .get(5, TimeUnit.SECONDS);
            engine.commands().provide(TaskAggregate.TYPE).with(id).execute(task -> task.advance(2))
                .get(5, TimeUnit.SECONDS);
            assertEquals(2, projection.count());

            RecordingEventHandler rebuilt = new RecordingEventHandler("rebuilt");
            ReplayReport report = engine.replay().replayFor(TaskAggregate.TYPE).eventsWithAggregateId(id).to(rebuilt)
                .getCompletion().get(5, TimeUnit.SECONDS);

            assertEquals(2, report.getDeliveries());
            assertEquals(projection.getReceivedEventIds(), rebuilt.getReceivedEventIds());
            assertEquals(2, projection.count());
        }

        assertTrue(store.isClosed());
    }

    @Test
    void testClosedEngineRejectsCommands() {
        EventLoomEngine engine = EventLoomEngine.builder()
            .configuration(TestConfigurations.with())
            .eventStore(new InMemoryEventStore())
            .build();

        engine.close();
        engine.close();

        assertTrue(engine.isClosed());
        assertThrows(IllegalStateException.class, engine::commands);
        assertThrows(IllegalStateException.class, engine::replay);
        assertTrue(engine.isWorkerPoolShutdown());
    }

    @Test
    @DisplayName("A subscriber blocking inside handle() does not hold up the command")
    void testBlockingSubscriberIsTimedOut() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        EventHandler blocking = event -> {
            try {
                release.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return CompletableFuture.completedFuture(null);
        };
        RecordingEventHandler after = new RecordingEventHandler("after");

        EventLoomEngine engine = EventLoomEngine.builder()
            .configuration(TestConfigurations.with(EventLoomConfiguration.HANDLER_TIMEOUT, "PT0.2S"))
            .eventStore(new InMemoryEventStore())
            .build();
        try {
            engine.dispatcher().publishNewStateTo(blocking).and(after);

            ExecutionOutcome<TaskAggregate> outcome = engine.commands().provide(TaskAggregate.TYPE)
                .with(AggregateId.of("task-7"))
                .execute(task -> task.start(1))
                .get(5, TimeUnit.SECONDS);

            assertTrue(outcome.isSuccess());
            assertEquals(1, outcome.getDispatchReport().getFailures().size());
            assertEquals(EventLoomErrorCodes.DISPATCH_HANDLER_TIMEOUT,
                outcome.getDispatchReport().getFailures().get(0).getErrorCode());
            assertEquals(1, after.count());
        } finally {
            release.countDown();
            engine.close();
        }
        assertTrue(engine.isWorkerPoolShutdown());
    }
}
