package dev.mars.eventloom.core.replay;

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
import dev.mars.eventloom.api.EventStore;
import dev.mars.eventloom.api.EventType;
import dev.mars.eventloom.api.History;
import dev.mars.eventloom.api.error.EventLoomErrorCodes;
import dev.mars.eventloom.api.error.SystemException;
import dev.mars.eventloom.api.metrics.EngineMetrics;
import dev.mars.eventloom.core.AggregateType;
import dev.mars.eventloom.core.config.EventLoomConfiguration;
import dev.mars.eventloom.core.dispatch.EventDispatcher;
import dev.mars.eventloom.core.util.FutureUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Re-delivers stored events to handlers, e.g. to rebuild a projection or backfill a new subscriber.
 *
 * <pre>{@code
 * ReplaySession session = replay.replayFor(OrderAggregate.TYPE)
 *     .eventsWithAggregateId(orderId)
 *     .ofType(OrderEvents.ORDER_CONFIRMED)
 *     .to(shippingProjection);
 * session.getCompletion().join();
 * }</pre>
 *
 * A replay only reads from the store. Events are delivered in persisted order: by sequence
 * within an aggregate, and aggregates in the order the store returns them.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class ReplayCoordinator {
    private static final Logger logger = LoggerFactory.getLogger(ReplayCoordinator.class);

    private final EventStore eventStore;
    private final EventDispatcher dispatcher;
    private final EngineMetrics metrics;
    private final Duration queryTimeout;
    private final Duration handlerTimeout;

    public ReplayCoordinator(EventStore eventStore, EventDispatcher dispatcher,
                             EventLoomConfiguration configuration, EngineMetrics metrics) {
        this.eventStore = Objects.requireNonNull(eventStore, "Event store cannot be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "Dispatcher cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        this.queryTimeout = configuration.getLoadTimeout();
        this.handlerTimeout = configuration.getReplayHandlerTimeout();
    }

    public ReplayScope replayFor(AggregateType<?> aggregateType) {
        Objects.requireNonNull(aggregateType, "Aggregate type cannot be null");
        return replayFor(aggregateType.getName());
    }

    public ReplayScope replayFor(String aggregateType) {
        Objects.requireNonNull(aggregateType, "Aggregate type cannot be null");
        if (aggregateType.isBlank()) {
            throw new IllegalArgumentException("Aggregate type cannot be blank");
        }
        return new ReplayScope(this, aggregateType);
    }

    ReplaySession start(String aggregateType, AggregateId aggregateId, EventType<?> eventType,
                        List<EventHandler> explicitTargets) {
        List<EventHandler> targets = explicitTargets != null ? explicitTargets : dispatcher.getSubscribers();
        if (targets.isEmpty()) {
            logger.warn("Replay for {} has no handlers to deliver to", aggregateType);
        }
        String scope = aggregateType + (aggregateId != null ? "/" + aggregateId : " (all)")
            + (eventType != null ? " of type " + eventType.getName() : "");
        logger.info("Starting replay for {} to {} handler(s)", scope, targets.size());

        ReplaySession session = new ReplaySession();
        query(aggregateType, aggregateId)
            .thenCompose(histories -> {
                List<EventRecord> selected = select(histories, eventType);
                logger.debug("Replay for {} selected {} events", scope, selected.size());
                return dispatcher.deliver(selected, targets, handlerTimeout, session::isCancelled)
                    .thenApply(report -> new ReplayReport(aggregateType, selected.size(), report));
            })
            .whenComplete((report, error) -> {
                if (error != null) {
                    Throwable cause = FutureUtils.unwrap(error);
                    logger.warn("Replay for {} failed: {}", scope, cause.getMessage());
                    session.getCompletion().completeExceptionally(cause);
                    return;
                }
                metrics.recordEventsReplayed(aggregateType, report.getDeliveries());
                logger.info("Replay for {} finished: {}", scope, report);
                session.getCompletion().complete(report);
            });
        return session;
    }

    private CompletableFuture<List<History>> query(String aggregateType, AggregateId aggregateId) {
        String operation = "Replay query for " + aggregateType + (aggregateId != null ? "/" + aggregateId : "");
        CompletableFuture<List<History>> histories = aggregateId != null
            ? FutureUtils.withTimeout(operation, queryTimeout, dispatcher.getDeliveryExecutor(),
                () -> eventStore.queryByAggregateId(aggregateType, aggregateId)).thenApply(history -> List.of(history))
            : FutureUtils.withTimeout(operation, queryTimeout, dispatcher.getDeliveryExecutor(),
                () -> eventStore.queryByAggregateType(aggregateType));

        CompletableFuture<List<History>> result = new CompletableFuture<>();
        histories.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
            } else {
                Throwable cause = FutureUtils.unwrap(error);
                result.completeExceptionally(new SystemException(EventLoomErrorCodes.REPLAY_QUERY_FAILED,
                    operation + " failed: " + cause.getMessage(), cause));
            }
        });
        return result;
    }

    private static List<EventRecord> select(List<History> histories, EventType<?> eventType) {
        List<EventRecord> selected = new ArrayList<>();
        for (History history : histories) {
            for (EventRecord record : history.getEvents()) {
                if (eventType == null || eventType.matches(record)) {
                    selected.add(record);
                }
            }
        }
        return selected;
    }
}
