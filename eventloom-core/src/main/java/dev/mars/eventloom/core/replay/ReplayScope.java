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

import java.util.Objects;

/**
 * Chooses which aggregates of a type a replay reads.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public final class ReplayScope {

    private final ReplayCoordinator coordinator;
    private final String aggregateType;

    ReplayScope(ReplayCoordinator coordinator, String aggregateType) {
        this.coordinator = coordinator;
        this.aggregateType = aggregateType;
    }

    /**
     * Replays the history of one aggregate instance.
     */
    public ReplaySelection eventsWithAggregateId(AggregateId aggregateId) {
        return new ReplaySelection(coordinator, aggregateType,
            Objects.requireNonNull(aggregateId, "Aggregate ID cannot be null"));
    }

    /**
     * Replays the histories of every aggregate of the type.
     */
    public ReplaySelection allEvents() {
        return new ReplaySelection(coordinator, aggregateType, null);
    }
}
