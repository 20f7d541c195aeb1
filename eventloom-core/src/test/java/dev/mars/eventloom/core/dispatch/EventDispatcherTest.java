package dev.mars.eventloom.core.dispatch;

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
import dev.mars.eventloom.api.EventRecord;
import dev.mars.eventloom.api.error.EventLoomErrorCodes;
import dev.mars.eventloom.api.error.OperationTimeoutException;
import dev.mars.eventloom.api.metrics.EngineMetrics;
import dev.mars.eventloom.test.categories.TestCategories;
import dev.mars.eventloom.test.handlers.FailingEventHandler;
import dev.mars.eventloom.test.handlers.RecordingEventHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@Tag(TestCategories.CORE)
class EventDispatcherTest {

    private EngineMetrics metrics;
    private EventDispatcher dispatcher;
    private ExecutorService workers;

    @BeforeEach
    void setUp() {
        metrics = mock(EngineMetrics.class);
        workers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "dispatch-test-worker");
            t.setDaemon(true);
            return t;
        });
        dispatcher = new EventDispatcher(Duration.ofMillis(300), metrics, workers);
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    /**
     * Blocks inside handle() before returning an already completed future.
     */
    private static EventHandler blocking(String name, long millis) {
        return new EventHandler() {
            @Override
            public CompletableFuture<Void> handle(EventRecord event) {
                try {
                    Thread.sleep(millis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return CompletableFuture.completedFuture(null);
            }

            @Override
            public String getName() {
                return name;
            }
        };
    }

    private static EventRecord event(long sequence, String type) {
        return new EventRecord("evt-" + sequence, "Task", AggregateId.of("task-1"), type, "payload-" + sequence,
            sequence, Instant.now(), Map.of());
    }

    /**
     * Writes "name:eventId" into a shared log so interleaving across handlers is visible.
     */
    private static EventHandler logging(String name, List<String> log) {
        return new EventHandler() {
            @Override
            public CompletableFuture<Void> handle(EventRecord event) {
                log.add(name + ":" + event.getEventId());
                return CompletableFuture.completedFuture(null);
            }

            @Override
            public String getName() {
                return name;
            }
        };
    }

    @Test
    void testSubscriberChainRules() {
        RecordingEventHandler first = new RecordingEventHandler("first");

        assertThrows(IllegalStateException.class, () -> dispatcher.and(first));

        dispatcher.publishNewStateTo(first);

        assertThrows(IllegalStateException.class,
            () -> dispatcher.publishNewStateTo(new RecordingEventHandler("second")));
        assertThrows(IllegalArgumentException.class, () -> dispatcher.and(first));
        assertEquals(List.of(first), dispatcher.getSubscribers());
    }

    @Test
    @DisplayName("Delivery is event-major, handler-minor, in registration order")
    void testDeliveryOrder() throws Exception {
        List<String> log = Collections.synchronizedList(new ArrayList<>());
        dispatcher.publishNewStateTo(logging("a", log)).and(logging("b", log)).and(logging("c", log));

        DispatchReport report = dispatcher.dispatch(List.of(event(1, "Started"), event(2, "Progressed")))
            .get(5, TimeUnit.SECONDS);

        assertEquals(List.of("a:evt-1", "b:evt-1", "c:evt-1", "a:evt-2", "b:evt-2", "c:evt-2"), log);
        assertEquals(2, report.getEventCount());
        assertEquals(6, report.getDeliveries());
        assertFalse(report.hasFailures());
    }

    @Test
    @DisplayName("Failed, throwing and hanging handlers are reported and delivery carries on")
    void testFailuresAreCollected() throws Exception {
        RecordingEventHandler last = new RecordingEventHandler("last");
        dispatcher.publishNewStateTo(new FailingEventHandler("future", FailingEventHandler.Mode.FAIL_FUTURE))
            .and(new FailingEventHandler("thrower", FailingEventHandler.Mode.THROW))
            .and(new FailingEventHandler("sleeper", FailingEventHandler.Mode.HANG))
            .and(last);

        DispatchReport report = dispatcher.dispatch(List.of(event(1, "Started"))).get(5, TimeUnit.SECONDS);

        assertEquals(3, report.getFailures().size());
        assertEquals(List.of("future", "thrower", "sleeper"),
            report.getFailures().stream().map(DispatchFailure::getHandlerName).collect(Collectors.toList()));
        assertEquals(EventLoomErrorCodes.DISPATCH_HANDLER_FAILED, report.getFailures().get(0).getErrorCode());
        assertEquals(EventLoomErrorCodes.DISPATCH_HANDLER_FAILED, report.getFailures().get(1).getErrorCode());
        DispatchFailure timeout = report.getFailures().get(2);
        assertEquals(EventLoomErrorCodes.DISPATCH_HANDLER_TIMEOUT, timeout.getErrorCode());
        assertInstanceOf(OperationTimeoutException.class, timeout.getCause());
        assertEquals(1, last.count());
        verify(metrics, times(3)).recordDispatchFailure(anyString(), anyString());
        verify(metrics).recordDispatchFailure("sleeper", "OperationTimeoutException");
    }

    @Test
    void testFailureListeners() throws Exception {
        List<DispatchFailure> seen = new ArrayList<>();
        dispatcher.publishNewStateTo(new FailingEventHandler("broken", FailingEventHandler.Mode.FAIL_FUTURE,
                event -> event.getSequence() == 2))
            .onDispatchFailure(failure -> {
                throw new IllegalStateException("listener bug");
            })
            .onDispatchFailure(seen::add);

        DispatchReport report = dispatcher.dispatch(List.of(event(1, "Started"), event(2, "Progressed")))
            .get(5, TimeUnit.SECONDS);

        assertEquals(1, seen.size());
        assertEquals("evt-2", seen.get(0).getEvent().getEventId());
        assertEquals(report.getFailures(), seen);
    }

    @Test
    void testNoSubscribersOrNoEvents() throws Exception {
        assertEquals(0, dispatcher.dispatch(List.of(event(1, "Started"))).get(5, TimeUnit.SECONDS).getDeliveries());

        dispatcher.publishNewStateTo(new RecordingEventHandler("only"));

        DispatchReport report = dispatcher.dispatch(List.of()).get(5, TimeUnit.SECONDS);
        assertEquals(0, report.getEventCount());
        assertEquals(0, report.getDeliveries());
    }

    @Test
    @DisplayName("Cancellation is checked between deliveries")
    void testCancellationStopsBetweenDeliveries() throws Exception {
        RecordingEventHandler target = new RecordingEventHandler("target");

        DispatchReport report = dispatcher.deliver(
                List.of(event(1, "Started"), event(2, "Progressed"), event(3, "Progressed")),
                List.of(target), Duration.ofSeconds(1), () -> target.count() >= 2)
            .get(5, TimeUnit.SECONDS);

        assertTrue(report.isCancelled());
        assertEquals(2, report.getDeliveries());
        assertEquals(List.of("evt-1", "evt-2"), target.getReceivedEventIds());
    }

    @Test
    @DisplayName("A handler that blocks inside handle() is cut off by the timeout")
    void testBlockingHandlerTimesOut() throws Exception {
        RecordingEventHandler next = new RecordingEventHandler("next");
        dispatcher.publishNewStateTo(blocking("blocker", 3000)).and(next);

        long start = System.nanoTime();
        DispatchReport report = dispatcher.dispatch(List.of(event(1, "Started"))).get(5, TimeUnit.SECONDS);
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals(1, report.getFailures().size());
        DispatchFailure failure = report.getFailures().get(0);
        assertEquals("blocker", failure.getHandlerName());
        assertEquals(EventLoomErrorCodes.DISPATCH_HANDLER_TIMEOUT, failure.getErrorCode());
        assertEquals(1, next.count());
        assertTrue(elapsedMillis < 2500, "dispatch took " + elapsedMillis + "ms");
    }

    @Test
    @DisplayName("Handlers after a timed-out one run on the delivery executor")
    void testDeliveryAfterTimeoutRunsOnDeliveryExecutor() throws Exception {
        List<String> threads = Collections.synchronizedList(new ArrayList<>());
        EventHandler threadRecorder = new EventHandler() {
            @Override
            public CompletableFuture<Void> handle(EventRecord event) {
                threads.add(Thread.currentThread().getName());
                return CompletableFuture.completedFuture(null);
            }

            @Override
            public String getName() {
                return "thread-recorder";
            }
        };
        dispatcher.publishNewStateTo(new FailingEventHandler("sleeper", FailingEventHandler.Mode.HANG))
            .and(threadRecorder);

        DispatchReport report = dispatcher.dispatch(List.of(event(1, "Started"))).get(5, TimeUnit.SECONDS);

        assertEquals(1, report.getFailures().size());
        assertEquals(List.of("dispatch-test-worker"), threads);
    }

    @Test
    void testRejectedDeliveryIsReportedAsFailure() throws Exception {
        RecordingEventHandler target = new RecordingEventHandler("target");
        dispatcher.publishNewStateTo(target);
        workers.shutdownNow();

        DispatchReport report = dispatcher.dispatch(List.of(event(1, "Started"))).get(5, TimeUnit.SECONDS);

        assertEquals(1, report.getFailures().size());
        assertEquals(EventLoomErrorCodes.DISPATCH_HANDLER_FAILED, report.getFailures().get(0).getErrorCode());
        assertEquals(0, target.count());
    }
}
