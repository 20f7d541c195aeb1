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
import dev.mars.eventloom.api.Command;

import java.util.Objects;

/**
 * Second step of a command: selects the aggregate instance.
 *
 * @param <A> the aggregate type
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public final class ProvidedAggregate<A extends Aggregate> {

    private final CommandExecutor executor;
    private final AggregateType<A> aggregateType;

    ProvidedAggregate(CommandExecutor executor, AggregateType<A> aggregateType) {
        this.executor = executor;
        this.aggregateType = aggregateType;
    }

    /**
     * Targets the aggregate the command addresses.
     */
    public TargetedExecution<A> with(Command command) {
        Objects.requireNonNull(command, "Command cannot be null");
        AggregateId id = command.getAggregateId();
        if (id == null) {
            throw new IllegalArgumentException("Command " + command.getClass().getSimpleName()
                + " did not resolve an aggregate ID");
        }
        return new TargetedExecution<>(executor, aggregateType, id);
    }

    /**
     * Targets an aggregate by ID.
     */
    public TargetedExecution<A> with(AggregateId aggregateId) {
        return new TargetedExecution<>(executor, aggregateType,
            Objects.requireNonNull(aggregateId, "Aggregate ID cannot be null"));
    }

    /**
     * Targets an explicit aggregate, ignoring the ID the command would resolve.
     */
    public TargetedExecution<A> with(Command command, AggregateId aggregateIdOverride) {
        Objects.requireNonNull(command, "Command cannot be null");
        return with(aggregateIdOverride);
    }
}
