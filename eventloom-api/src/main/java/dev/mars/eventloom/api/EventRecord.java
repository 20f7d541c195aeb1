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

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable, persisted fact belonging to exactly one aggregate instance.
 *
 * The sequence is the 1-based position of the event in its aggregate's history and is
 * assigned by the store on append. Ordering among the events of one aggregate is total.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public final class EventRecord {

    private final String eventId;
    private final String aggregateType;
    private final AggregateId aggregateId;
    private final String eventType;
    private final Object payload;
    private final long sequence;
    private final Instant recordedAt;
    private final Map<String, String> headers;

    /**
     * Creates a new EventRecord.
     *
     * @param eventId The unique event identifier
     * @param aggregateType The aggregate type the event belongs to
     * @param aggregateId The aggregate instance the event belongs to
     * @param eventType The event type tag name
     * @param payload The event payload
     * @param sequence The position in the aggregate's history, starting at 1
     * @param recordedAt When the store persisted the event
     * @param headers Event headers
     */
    public EventRecord(String eventId, String aggregateType, AggregateId aggregateId, String eventType,
                       Object payload, long sequence, Instant recordedAt, Map<String, String> headers) {
        this.eventId = Objects.requireNonNull(eventId, "Event ID cannot be null");
        this.aggregateType = Objects.requireNonNull(aggregateType, "Aggregate type cannot be null");
        this.aggregateId = Objects.requireNonNull(aggregateId, "Aggregate ID cannot be null");
        this.eventType = Objects.requireNonNull(eventType, "Event type cannot be null");
        this.payload = Objects.requireNonNull(payload, "Payload cannot be null");
        this.recordedAt = Objects.requireNonNull(recordedAt, "Recorded time cannot be null");
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();
        this.sequence = sequence;

        if (sequence <= 0) {
            throw new IllegalArgumentException("Sequence must be positive");
        }
    }

    public String getEventId() {
        return eventId;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public AggregateId getAggregateId() {
        return aggregateId;
    }

    public String getEventType() {
        return eventType;
    }

    public Object getPayload() {
        return payload;
    }

    public long getSequence() {
        return sequence;
    }

    public Instant getRecordedAt() {
        return recordedAt;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventRecord)) return false;
        return eventId.equals(((EventRecord) o).eventId);
    }

    @Override
    public int hashCode() {
        return eventId.hashCode();
    }

    @Override
    public String toString() {
        return "EventRecord{" +
                "eventId='" + eventId + '\'' +
                ", aggregateType='" + aggregateType + '\'' +
                ", aggregateId=" + aggregateId +
                ", eventType='" + eventType + '\'' +
                ", sequence=" + sequence +
                ", recordedAt=" + recordedAt +
                '}';
    }
}
