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
import dev.mars.eventloom.api.EventType;
import dev.mars.eventloom.api.History;
import dev.mars.eventloom.api.PendingEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for event-sourced aggregates.
 *
 * An aggregate is created fresh for every command, bound to the identity and committed history
 * loaded from the store, mutated by one business action and discarded afterwards. Subclasses
 * derive their state from history through {@link #aggregateAllEvents(FoldSpec)} and
 * {@link #history()}, and express decisions through two primitives:
 * <ul>
 *   <li>{@link #record(EventType, Object)} - a new fact, persisted once on commit and then
 *       delivered once to every subscriber</li>
 *   <li>{@link #replay(EventRecord)} - an already persisted fact whose handler side effects must
 *       fire again; delivered after commit, never persisted a second time</li>
 * </ul>
 *
 * History queries are protected: only the aggregate's own methods can derive state from its
 * history. Constructors must not touch identity or history, which are bound after creation.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public abstract class Aggregate {

    private String aggregateType;
    private AggregateId id;
    private History history;
    private HistoryQueries queries;

    private final List<PendingEvent> pendingChanges = new ArrayList<>();
    private final List<EventRecord> replayedEvents = new ArrayList<>();
    // Production order of changes: a non-negative value indexes pendingChanges, -(i + 1) indexes replayedEvents
    private final List<Integer> changeOrder = new ArrayList<>();
    private boolean retired = false;

    protected Aggregate() {
    }

    // ========== PUBLIC SURFACE ==========

    public final AggregateId getId() {
        ensureBound();
        return id;
    }

    public final String getAggregateType() {
        ensureBound();
        return aggregateType;
    }

    /**
     * @return the version of the committed history this instance was built from
     */
    public final long getVersion() {
        ensureBound();
        return history.getVersion();
    }

    public final boolean hasPendingChanges() {
        return !pendingChanges.isEmpty();
    }

    // ========== MUTATION PRIMITIVES ==========

    /**
     * Records a new event. It is persisted when the command commits and then dispatched once.
     *
     * @param type The event type tag
     * @param payload The payload, an instance of the tag's payload class
     */
    protected final <P> void record(EventType<P> type, P payload) {
        record(type, payload, Map.of());
    }

    /**
     * Records a new event with headers.
     */
    protected final <P> void record(EventType<P> type, P payload, Map<String, String> headers) {
        ensureMutable();
        Objects.requireNonNull(type, "Event type cannot be null");
        Objects.requireNonNull(payload, "Payload cannot be null");
        if (!type.getPayloadClass().isInstance(payload)) {
            throw new IllegalArgumentException("Payload " + payload.getClass().getName()
                + " does not match event type " + type.getName() + " (" + type.getPayloadClass().getName() + ")");
        }
        pendingChanges.add(new PendingEvent(type.getName(), payload, headers));
        changeOrder.add(pendingChanges.size() - 1);
    }

    /**
     * Re-fires an event that is already part of this aggregate's history.
     *
     * The event is handed to subscribers after the command commits, in the order it was produced
     * relative to recorded events. It is never added to the pending changes and never persisted again.
     *
     * @param event A record taken from this aggregate's own history
     * @throws IllegalArgumentException if the record does not belong to this aggregate's history
     */
    protected final void replay(EventRecord event) {
        ensureMutable();
        Objects.requireNonNull(event, "Event cannot be null");
        if (!history.contains(event)) {
            throw new IllegalArgumentException("Event " + event.getEventId() + " is not part of the history of "
                + aggregateType + "/" + id);
        }
        replayedEvents.add(event);
        changeOrder.add(-replayedEvents.size());
    }

    // ========== HISTORY-DERIVED STATE ==========

    /**
     * Folds the committed history with the given spec. Recomputed on every call.
     */
    protected final <S> S aggregateAllEvents(FoldSpec<S> spec) {
        ensureBound();
        Objects.requireNonNull(spec, "Fold spec cannot be null");
        return spec.aggregateAllEvents(history);
    }

    /**
     * Simple queries over the committed history.
     */
    protected final HistoryQueries history() {
        ensureBound();
        return queries;
    }

    // ========== ENGINE HOOKS ==========

    final void bind(String aggregateType, AggregateId id, History history) {
        if (this.history != null) {
            throw new IllegalStateException("Aggregate instance is already bound to " + this.aggregateType + "/" + this.id
                + "; aggregates cannot be reused across commands");
        }
        if (!history.getAggregateId().equals(id) || !history.getAggregateType().equals(aggregateType)) {
            throw new IllegalArgumentException("History of " + history.getAggregateType() + "/" + history.getAggregateId()
                + " cannot be bound to " + aggregateType + "/" + id);
        }
        this.aggregateType = aggregateType;
        this.id = id;
        this.history = history;
        this.queries = new HistoryQueries(history);
    }

    final List<PendingEvent> getPendingChanges() {
        return Collections.unmodifiableList(pendingChanges);
    }

    final List<EventRecord> getReplayedEvents() {
        return Collections.unmodifiableList(replayedEvents);
    }

    /**
     * Merges committed records and replayed events back into production order.
     *
     * @param committed The persisted records, one per pending change and in the same order
     */
    final List<EventRecord> outgoingInProductionOrder(List<EventRecord> committed) {
        if (committed.size() != pendingChanges.size()) {
            throw new IllegalStateException("Expected " + pendingChanges.size() + " committed records but got " + committed.size());
        }
        List<EventRecord> outgoing = new ArrayList<>(changeOrder.size());
        for (int index : changeOrder) {
            outgoing.add(index >= 0 ? committed.get(index) : replayedEvents.get(-index - 1));
        }
        return outgoing;
    }

    /**
     * Discards any uncommitted decisions and forbids further use of this instance.
     */
    final void retire() {
        retired = true;
    }

    final boolean isRetired() {
        return retired;
    }

    private void ensureBound() {
        if (history == null) {
            throw new IllegalStateException("Aggregate is not bound to a history yet");
        }
    }

    private void ensureMutable() {
        ensureBound();
        if (retired) {
            throw new IllegalStateException("Aggregate " + aggregateType + "/" + id
                + " has been discarded after its command completed");
        }
    }
}
