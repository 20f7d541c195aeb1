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

import java.util.concurrent.CompletableFuture;

/**
 * Third step of a command: chooses between fail-fast execution and an attempt with catch handlers.
 *
 * @param <A> the aggregate type
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public final class TargetedExecution<A extends Aggregate> {

    private final CommandExecutor executor;
    private final AggregateType<A> aggregateType;
    private final AggregateId aggregateId;

    TargetedExecution(CommandExecutor executor, AggregateType<A> aggregateType, AggregateId aggregateId) {
        this.executor = executor;
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
    }

    /**
     * Runs the action and commits its changes. Any failure, including a business fault raised by
     * the action, fails the returned future with the original error.
     */
    public CompletableFuture<ExecutionOutcome<A>> execute(AggregateAction<? super A> action) {
        return executor.run(aggregateType, aggregateId, action, null);
    }

    /**
     * Prepares an execution whose action failures can be handled by catch handlers.
     * Nothing runs until {@link AttemptedExecution#run()}.
     */
    public AttemptedExecution<A> attempt(AggregateAction<? super A> action) {
        return new AttemptedExecution<>(executor, aggregateType, aggregateId, action);
    }

    public AggregateId getAggregateId() {
        return aggregateId;
    }
}
