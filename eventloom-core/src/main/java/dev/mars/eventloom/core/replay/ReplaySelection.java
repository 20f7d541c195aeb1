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
import dev.mars.eventloom.api.EventType;

import java.util.List;
import java.util.Objects;

/**
 * Narrows a replay to an event type and picks its recipients. Choosing the recipients starts
 * the replay.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public final class ReplaySelection {

    private final ReplayCoordinator coordinator;
    private final String aggregateType;
    private final AggregateId aggregateId;
    private EventType<?> eventType;

    ReplaySelection(ReplayCoordinator coordinator, String aggregateType, AggregateId aggregateId) {
        this.coordinator = coordinator;
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
    }

    /**
     * Keeps only events of the given type.
     */
    public ReplaySelection ofType(EventType<?> type) {
        Objects.requireNonNull(type, "Event type cannot be null");
        if (eventType != null) {
            throw new IllegalStateException("Replay is already filtered to " + eventType.getName());
        }
        this.eventType = type;
        return this;
    }

    /**
     * Delivers to every subscriber currently registered with the dispatcher.
     */
    public ReplaySession toAllEventHandlers() {
        return coordinator.start(aggregateType, aggregateId, eventType, null);
    }

    /**
     * Delivers to a single handler, which need not be a registered subscriber.
     */
    public ReplaySession to(EventHandler handler) {
        Objects.requireNonNull(handler, "Handler cannot be null");
        return coordinator.start(aggregateType, aggregateId, eventType, List.of(handler));
    }
}
