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

import dev.mars.eventloom.api.EventHandler;
import dev.mars.eventloom.api.EventRecord;
import dev.mars.eventloom.api.error.EventLoomErrorCodes;
import dev.mars.eventloom.api.error.OperationTimeoutException;
import dev.mars.eventloom.api.metrics.EngineMetrics;
import dev.mars.eventloom.core.config.EventLoomConfiguration;
import dev.mars.eventloom.core.util.FutureUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;

/**
 * Delivers committed and replayed events to the registered subscribers.
 *
 * Subscribers are wired once at startup:
 * <pre>{@code
 * dispatcher.publishNewStateTo(projection).and(auditLog).and(notifier);
 * }</pre>
 *
 * Delivery is sequential: events in the order given, and for each event the subscribers in
 * registration order. Each delivery is bounded by the handler timeout. A failing or timed-out
 * handler is recorded as a {@link DispatchFailure} and delivery carries on with the next
 * handler; nothing is retried.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class EventDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(EventDispatcher.class);

    private final List<EventHandler> subscribers = new CopyOnWriteArrayList<>();
    private final List<DispatchFailureListener> failureListeners = new CopyOnWriteArrayList<>();
    private final Duration handlerTimeout;
    private final EngineMetrics metrics;
    private final Executor deliveryExecutor;

    public EventDispatcher(EventLoomConfiguration configuration, EngineMetrics metrics, Executor deliveryExecutor) {
        this(configuration.getHandlerTimeout(), metrics, deliveryExecutor);
    }

    /**
     * @param deliveryExecutor Runs every handler call, so a handler that blocks inside
     *                         {@code handle()} is still cut off by the timeout
     */
    public EventDispatcher(Duration handlerTimeout, EngineMetrics metrics, Executor deliveryExecutor) {
        this.handlerTimeout = Objects.requireNonNull(handlerTimeout, "Handler timeout cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        this.deliveryExecutor = Objects.requireNonNull(deliveryExecutor, "Delivery executor cannot be null");
    }

    /**
     * Registers the first subscriber.
     *
     * @throws IllegalStateException if subscribers are already registered
     */
    public EventDispatcher publishNewStateTo(EventHandler handler) {
        if (!subscribers.isEmpty()) {
            throw new IllegalStateException("publishNewStateTo starts the subscriber chain; use and() to add "
                + handlerName(handler));
        }
        return register(handler);
    }

    /**
     * Registers a further subscriber.
     *
     * @throws IllegalStateException if no subscriber has been registered with publishNewStateTo
     */
    public EventDispatcher and(EventHandler handler) {
        if (subscribers.isEmpty()) {
            throw new IllegalStateException("Start the subscriber chain with publishNewStateTo before adding "
                + handlerName(handler));
        }
        return register(handler);
    }

    public EventDispatcher onDispatchFailure(DispatchFailureListener listener) {
        failureListeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
        return this;
    }

    /**
     * @return the subscribers in registration order
     */
    public List<EventHandler> getSubscribers() {
        return List.copyOf(subscribers);
    }

    public Duration getHandlerTimeout() {
        return handlerTimeout;
    }

    public Executor getDeliveryExecutor() {
        return deliveryExecutor;
    }

    /**
     * Delivers the events to every subscriber.
     *
     * @return A future that always completes normally with the report
     */
    public CompletableFuture<DispatchReport> dispatch(List<EventRecord> events) {
        return deliver(events, subscribers, handlerTimeout, () -> false);
    }

    /**
     * Delivers the events to the given targets, checking for cancellation before every delivery.
     * A cancellation never interrupts a delivery in progress.
     *
     * @param events Events in delivery order
     * @param targets Handlers in delivery order
     * @param timeout Bound for each single delivery
     * @param cancelled Checked before each delivery
     * @return A future that always completes normally with the report
     */
    public CompletableFuture<DispatchReport> deliver(List<EventRecord> events, List<EventHandler> targets,
                                                     Duration timeout, BooleanSupplier cancelled) {
        if (events.isEmpty() || targets.isEmpty()) {
            return CompletableFuture.completedFuture(new DispatchReport(events.size(), 0, List.of(), false));
        }
        List<EventHandler> snapshot = List.copyOf(targets);
        DeliveryProgress progress = new DeliveryProgress();

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (EventRecord event : events) {
            for (EventHandler handler : snapshot) {
                chain = chain.thenCompose(v -> {
                    if (progress.cancelled || cancelled.getAsBoolean()) {
                        progress.cancelled = true;
                        return CompletableFuture.completedFuture(null);
                    }
                    return deliverOne(event, handler, timeout, progress);
                });
            }
        }

        return chain.thenApply(v -> {
            DispatchReport report = progress.toReport(events.size());
            if (report.hasFailures()) {
                logger.warn("Dispatched {} events with {} failed deliveries out of {}",
                    events.size(), report.getFailures().size(), report.getDeliveries());
            } else {
                logger.debug("Dispatched {} events in {} deliveries", events.size(), report.getDeliveries());
            }
            return report;
        });
    }

    private CompletableFuture<Void> deliverOne(EventRecord event, EventHandler handler, Duration timeout,
                                               DeliveryProgress progress) {
        String name = handlerName(handler);
        String operation = "Delivery of " + event.getEventType() + " " + event.getEventId() + " to " + name;
        progress.deliveries++;
        return FutureUtils.withTimeout(operation, timeout, deliveryExecutor,
                () -> FutureUtils.invokeOn(operation, deliveryExecutor, () -> handler.handle(event)))
            .handle((ignored, error) -> {
                if (error != null) {
                    recordFailure(progress, event, name, FutureUtils.unwrap(error));
                }
                return null;
            });
    }

    private void recordFailure(DeliveryProgress progress, EventRecord event, String handlerName, Throwable cause) {
        String code = cause instanceof OperationTimeoutException
            ? EventLoomErrorCodes.DISPATCH_HANDLER_TIMEOUT
            : EventLoomErrorCodes.DISPATCH_HANDLER_FAILED;
        DispatchFailure failure = new DispatchFailure(event, handlerName, cause, code);
        progress.failures.add(failure);

        logger.warn("Handler {} failed on event {} ({}): {}", handlerName, event.getEventId(),
            event.getEventType(), cause.getMessage());
        metrics.recordDispatchFailure(handlerName, cause.getClass().getSimpleName());

        for (DispatchFailureListener listener : failureListeners) {
            try {
                listener.onFailure(failure);
            } catch (Exception e) {
                logger.error("Dispatch failure listener threw while reporting {}", failure, e);
            }
        }
    }

    private EventDispatcher register(EventHandler handler) {
        Objects.requireNonNull(handler, "Handler cannot be null");
        if (subscribers.contains(handler)) {
            throw new IllegalArgumentException("Handler " + handlerName(handler) + " is already subscribed");
        }
        subscribers.add(handler);
        logger.info("Registered event subscriber: {}", handlerName(handler));
        return this;
    }

    private static String handlerName(EventHandler handler) {
        if (handler == null) {
            return "null";
        }
        String name = handler.getName();
        return name != null ? name : handler.getClass().getName();
    }

    // Mutated only from the sequential delivery chain
    private static final class DeliveryProgress {
        private volatile long deliveries;
        private volatile boolean cancelled;
        private final List<DispatchFailure> failures = new ArrayList<>();

        private DispatchReport toReport(int eventCount) {
            return new DispatchReport(eventCount, deliveries, failures, cancelled);
        }
    }
}
