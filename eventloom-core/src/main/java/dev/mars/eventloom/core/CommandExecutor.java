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
import dev.mars.eventloom.api.EventRecord;
import dev.mars.eventloom.api.EventStore;
import dev.mars.eventloom.api.History;
import dev.mars.eventloom.api.PendingEvent;
import dev.mars.eventloom.api.error.BusinessFault;
import dev.mars.eventloom.api.error.CommitFailedException;
import dev.mars.eventloom.api.error.ConcurrencyConflictException;
import dev.mars.eventloom.api.error.EventLoomErrorCodes;
import dev.mars.eventloom.api.error.OperationTimeoutException;
import dev.mars.eventloom.api.error.SystemException;
import dev.mars.eventloom.api.metrics.EngineMetrics;
import dev.mars.eventloom.core.concurrency.AggregateExecutionQueue;
import dev.mars.eventloom.core.concurrency.SerializationMode;
import dev.mars.eventloom.core.config.EventLoomConfiguration;
import dev.mars.eventloom.core.dispatch.EventDispatcher;
import dev.mars.eventloom.core.util.FutureUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Runs commands against event-sourced aggregates.
 *
 * <pre>{@code
 * executor.provide(OrderAggregate.TYPE)
 *     .with(command)
 *     .execute(order -> order.confirm(command));
 * }</pre>
 *
 * Every execution loads the aggregate's history, builds a fresh aggregate, runs the business
 * action, commits the recorded events with the loaded version as expected version, and then
 * dispatches committed and replayed events in production order. Failures of the action either
 * fail the returned future ({@code execute}) or are routed to catch handlers ({@code attempt}).
 * Commit failures always fail the future; dispatch failures never do.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class CommandExecutor {
    private static final Logger logger = LoggerFactory.getLogger(CommandExecutor.class);

    private final EventStore eventStore;
    private final EventDispatcher dispatcher;
    private final EngineMetrics metrics;
    private final Duration loadTimeout;
    private final Duration appendTimeout;
    private final SerializationMode serializationMode;
    private final AggregateExecutionQueue executionQueue = new AggregateExecutionQueue();

    public CommandExecutor(EventStore eventStore, EventDispatcher dispatcher,
                           EventLoomConfiguration configuration, EngineMetrics metrics) {
        this.eventStore = Objects.requireNonNull(eventStore, "Event store cannot be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "Dispatcher cannot be null");
        this.metrics = Objects.requireNonNull(metrics, "Metrics cannot be null");
        this.loadTimeout = configuration.getLoadTimeout();
        this.appendTimeout = configuration.getAppendTimeout();
        this.serializationMode = configuration.getSerializationMode();
        logger.info("CommandExecutor created with serialization mode {}, load timeout {}, append timeout {}",
            serializationMode, loadTimeout, appendTimeout);
    }

    /**
     * Starts a command against an aggregate kind.
     */
    public <A extends Aggregate> ProvidedAggregate<A> provide(AggregateType<A> aggregateType) {
        return new ProvidedAggregate<>(this, Objects.requireNonNull(aggregateType, "Aggregate type cannot be null"));
    }

    public SerializationMode getSerializationMode() {
        return serializationMode;
    }

    // ========== EXECUTION PIPELINE ==========

    /**
     * Runs one execution. A null routing means fail-fast.
     */
    <A extends Aggregate> CompletableFuture<ExecutionOutcome<A>> run(AggregateType<A> type, AggregateId id,
                                                                   AggregateAction<? super A> action,
                                                                   FailureRouting<A> routing) {
        Objects.requireNonNull(action, "Action cannot be null");
        long startNanos = System.nanoTime();
        String key = type.getName() + "/" + id.value();

        CompletableFuture<ExecutionOutcome<A>> execution = serializationMode == SerializationMode.LOCAL_QUEUE
            ? executionQueue.submit(key, () -> runOnce(type, id, action, routing))
            : FutureUtils.invokeSafely("Execution of " + key, () -> runOnce(type, id, action, routing));

        CompletableFuture<ExecutionOutcome<A>> result = new CompletableFuture<>();
        execution.whenComplete((outcome, error) -> {
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            if (error == null) {
                metrics.recordCommand(type.getName(), outcome.getStatus().name(), elapsed);
                logger.debug("Command on {} finished: {}", key, outcome);
                result.complete(outcome);
            } else {
                Throwable cause = FutureUtils.unwrap(error);
                metrics.recordCommand(type.getName(), outcomeName(cause), elapsed);
                logger.debug("Command on {} failed: {}", key, cause.toString());
                result.completeExceptionally(cause);
            }
        });
        return result;
    }

    private <A extends Aggregate> CompletableFuture<ExecutionOutcome<A>> runOnce(AggregateType<A> type, AggregateId id,
                                                                               AggregateAction<? super A> action,
                                                                               FailureRouting<A> routing) {
        return loadHistory(type.getName(), id)
            .thenCompose(history -> applyAction(type, id, history, action, routing));
    }

    private CompletableFuture<History> loadHistory(String typeName, AggregateId id) {
        CompletableFuture<History> result = new CompletableFuture<>();
        FutureUtils.withTimeout("Load of " + typeName + "/" + id, loadTimeout, dispatcher.getDeliveryExecutor(),
                () -> eventStore.load(typeName, id))
            .whenComplete((history, error) -> {
                if (error == null && history != null) {
                    result.complete(history);
                } else if (error == null) {
                    result.completeExceptionally(new SystemException(EventLoomErrorCodes.AGGREGATE_LOAD_FAILED,
                        "Event store returned no history for " + typeName + "/" + id));
                } else {
                    Throwable cause = FutureUtils.unwrap(error);
                    logger.warn("Failed to load {}/{}: {}", typeName, id, cause.getMessage());
                    result.completeExceptionally(cause instanceof SystemException ? cause
                        : new SystemException(EventLoomErrorCodes.AGGREGATE_LOAD_FAILED,
                            "Failed to load " + typeName + "/" + id + ": " + cause.getMessage(), cause));
                }
            });
        return result;
    }

    private <A extends Aggregate> CompletableFuture<ExecutionOutcome<A>> applyAction(AggregateType<A> type, AggregateId id,
                                                                                   History history,
                                                                                   AggregateAction<? super A> action,
                                                                                   FailureRouting<A> routing) {
        A aggregate;
        try {
            aggregate = type.newInstance();
            aggregate.bind(type.getName(), id, history);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(new SystemException(EventLoomErrorCodes.AGGREGATE_LOAD_FAILED,
                "Failed to build aggregate " + type.getName() + "/" + id + ": " + e.getMessage(), e));
        }

        Throwable failure = null;
        try {
            action.accept(aggregate);
        } catch (Throwable t) {
            // Errors from domain code (AssertionError, StackOverflowError) count as failures too
            failure = t;
        } finally {
            aggregate.retire();
        }
        if (failure != null) {
            return routeFailure(failure, aggregate, routing);
        }

        List<EventRecord> replayed = aggregate.getReplayedEvents();
        return commit(aggregate).thenCompose(committed -> {
            List<EventRecord> outgoing = aggregate.outgoingInProductionOrder(committed);
            return dispatcher.dispatch(outgoing)
                .thenApply(report -> ExecutionOutcome.success(aggregate, committed, replayed, report));
        });
    }

    private <A extends Aggregate> CompletableFuture<ExecutionOutcome<A>> routeFailure(Throwable error, A aggregate,
                                                                                    FailureRouting<A> routing) {
        boolean isFault = error instanceof BusinessFault;
        if (isFault) {
            logger.debug("Action on {}/{} raised business fault: {}", aggregate.getAggregateType(), aggregate.getId(),
                error.getMessage());
        } else {
            logger.warn("Action on {}/{} failed: {}", aggregate.getAggregateType(), aggregate.getId(), error.toString());
        }

        if (routing == null) {
            return CompletableFuture.failedFuture(error);
        }
        try {
            if (isFault && routing.faultHandler != null) {
                routing.faultHandler.onFault((BusinessFault) error, aggregate);
                return CompletableFuture.completedFuture(
                    ExecutionOutcome.handledFailure(ExecutionOutcome.Status.BUSINESS_FAULT, aggregate, error));
            }
            if (!isFault && routing.exceptionHandler != null) {
                routing.exceptionHandler.onException(error, aggregate);
                return CompletableFuture.completedFuture(
                    ExecutionOutcome.handledFailure(ExecutionOutcome.Status.SYSTEM_EXCEPTION, aggregate, error));
            }
        } catch (RuntimeException handlerError) {
            handlerError.addSuppressed(error);
            logger.error("Catch handler for {}/{} threw", aggregate.getAggregateType(), aggregate.getId(), handlerError);
            return CompletableFuture.failedFuture(handlerError);
        }
        return CompletableFuture.failedFuture(error);
    }

    private CompletableFuture<List<EventRecord>> commit(Aggregate aggregate) {
        List<PendingEvent> pending = aggregate.getPendingChanges();
        if (pending.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }
        String typeName = aggregate.getAggregateType();
        AggregateId id = aggregate.getId();
        long expectedVersion = aggregate.getVersion();

        CompletableFuture<List<EventRecord>> result = new CompletableFuture<>();
        FutureUtils.withTimeout("Append to " + typeName + "/" + id, appendTimeout, dispatcher.getDeliveryExecutor(),
                () -> eventStore.append(typeName, id, expectedVersion, List.copyOf(pending)))
            .whenComplete((records, error) -> {
                if (error == null) {
                    if (records == null || records.size() != pending.size()) {
                        result.completeExceptionally(new CommitFailedException(typeName, id, new IllegalStateException(
                            "Store returned " + (records == null ? "no" : records.size()) + " records for "
                                + pending.size() + " pending events")));
                        return;
                    }
                    metrics.recordEventsCommitted(typeName, records.size());
                    logger.debug("Committed {} events to {}/{} at version {}", records.size(), typeName, id,
                        expectedVersion + records.size());
                    result.complete(records);
                    return;
                }
                Throwable cause = FutureUtils.unwrap(error);
                if (cause instanceof ConcurrencyConflictException) {
                    metrics.recordConcurrencyConflict(typeName);
                    logger.warn("Concurrency conflict on {}/{}: {}", typeName, id, cause.getMessage());
                    result.completeExceptionally(cause);
                } else if (cause instanceof CommitFailedException) {
                    result.completeExceptionally(cause);
                } else if (cause instanceof OperationTimeoutException) {
                    logger.warn("Commit of {}/{} timed out after {}", typeName, id, appendTimeout);
                    result.completeExceptionally(
                        CommitFailedException.timedOut(typeName, id, (OperationTimeoutException) cause));
                } else {
                    logger.error("Commit of {}/{} failed", typeName, id, cause);
                    result.completeExceptionally(new CommitFailedException(typeName, id, cause));
                }
            });
        return result;
    }

    private static String outcomeName(Throwable cause) {
        if (cause instanceof ConcurrencyConflictException) {
            return "CONCURRENCY_CONFLICT";
        }
        if (cause instanceof CommitFailedException) {
            return "COMMIT_FAILED";
        }
        if (cause instanceof BusinessFault) {
            return ExecutionOutcome.Status.BUSINESS_FAULT.name();
        }
        return ExecutionOutcome.Status.SYSTEM_EXCEPTION.name();
    }

    /**
     * Catch handlers registered through {@link AttemptedExecution}.
     */
    static final class FailureRouting<A extends Aggregate> {
        final FaultHandler<? super A> faultHandler;
        final ExceptionHandler<? super A> exceptionHandler;

        FailureRouting(FaultHandler<? super A> faultHandler, ExceptionHandler<? super A> exceptionHandler) {
            this.faultHandler = faultHandler;
            this.exceptionHandler = exceptionHandler;
        }
    }
}
