package dev.mars.eventloom.api;

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

import java.util.List;
import java.util.Objects;

/**
 * The ordered sequence of persisted events of one aggregate instance.
 *
 * A history is a read-only snapshot handed out by the store. Its version is the sequence
 * of its last event, or 0 for an aggregate that has never been written; the command engine
 * passes that version back to the store as the expected version when committing.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public final class History {

    private final String aggregateType;
    private final AggregateId aggregateId;
    private final List<EventRecord> events;

    public History(String aggregateType, AggregateId aggregateId, List<EventRecord> events) {
        this.aggregateType = Objects.requireNonNull(aggregateType, "Aggregate type cannot be null");
        this.aggregateId = Objects.requireNonNull(aggregateId, "Aggregate ID cannot be null");
        this.events = List.copyOf(Objects.requireNonNull(events, "Events cannot be null"));

        long expectedSequence = 1;
        for (EventRecord event : this.events) {
            if (!aggregateId.equals(event.getAggregateId()) || !aggregateType.equals(event.getAggregateType())) {
                throw new IllegalArgumentException("Event " + event.getEventId() + " belongs to "
                    + event.getAggregateType() + "/" + event.getAggregateId()
                    + ", not " + aggregateType + "/" + aggregateId);
            }
            if (event.getSequence() != expectedSequence) {
                throw new IllegalArgumentException("History of " + aggregateId + " is not contiguous: expected sequence "
                    + expectedSequence + " but found " + event.getSequence());
            }
            expectedSequence++;
        }
    }

    public static History empty(String aggregateType, AggregateId aggregateId) {
        return new History(aggregateType, aggregateId, List.of());
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public AggregateId getAggregateId() {
        return aggregateId;
    }

    /**
     * @return the events in append order, unmodifiable
     */
    public List<EventRecord> getEvents() {
        return events;
    }

    public long getVersion() {
        return events.isEmpty() ? 0 : events.get(events.size() - 1).getSequence();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public int size() {
        return events.size();
    }

    /**
     * Checks whether the given record is part of this history.
     */
    public boolean contains(EventRecord record) {
        if (record == null || record.getSequence() > events.size()) {
            return false;
        }
        return events.get((int) record.getSequence() - 1).equals(record);
    }

    @Override
    public String toString() {
        return "History{aggregateType='" + aggregateType + "', aggregateId=" + aggregateId
            + ", version=" + getVersion() + '}';
    }
}
