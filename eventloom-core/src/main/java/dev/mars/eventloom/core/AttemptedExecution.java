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

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * An execution with layered failure handling.
 *
 * <pre>{@code
 * executor.provide(OrderAggregate.TYPE).with(command)
 *     .attempt(order -> order.cancel(command))
 *     .catchFault((fault, order) -> rejections.add(fault.getMessage()))
 *     .catchException((error, order) -> alerts.raise(error))
 *     .run();
 * }</pre>
 *
 * The fault handler runs only for a {@link dev.mars.eventloom.api.error.BusinessFault}, the
 * exception handler only for anything else, so at most one runs per execution. A failure
 * without a matching handler fails the returned future. Commit and dispatch failures are never
 * routed to either handler.
 *
 * @param <A> the aggregate type
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public final class AttemptedExecution<A extends Aggregate> {

    private final CommandExecutor executor;
    private final AggregateType<A> aggregateType;
    private final AggregateId aggregateId;
    private final AggregateAction<? super A> action;
    private FaultHandler<? super A> faultHandler;
    private ExceptionHandler<? super A> exceptionHandler;
    private boolean started;

    AttemptedExecution(CommandExecutor executor, AggregateType<A> aggregateType, AggregateId aggregateId,
                       AggregateAction<? super A> action) {
        this.executor = executor;
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.action = Objects.requireNonNull(action, "Action cannot be null");
    }

    public AttemptedExecution<A> catchFault(FaultHandler<? super A> handler) {
        ensureNotStarted();
        if (faultHandler != null) {
            throw new IllegalStateException("A fault handler is already registered");
        }
        this.faultHandler = Objects.requireNonNull(handler, "Fault handler cannot be null");
        return this;
    }

    public AttemptedExecution<A> catchException(ExceptionHandler<? super A> handler) {
        ensureNotStarted();
        if (exceptionHandler != null) {
            throw new IllegalStateException("An exception handler is already registered");
        }
        this.exceptionHandler = Objects.requireNonNull(handler, "Exception handler cannot be null");
        return this;
    }

    /**
     * Runs the execution. May be called once.
     */
    public CompletableFuture<ExecutionOutcome<A>> run() {
        ensureNotStarted();
        started = true;
        return executor.run(aggregateType, aggregateId, action,
            new CommandExecutor.FailureRouting<>(faultHandler, exceptionHandler));
    }

    private void ensureNotStarted() {
        if (started) {
            throw new IllegalStateException("This attempt has already been run");
        }
    }
}
