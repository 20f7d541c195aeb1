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

import java.util.Objects;

/**
 * Explicit type tag for a domain event.
 *
 * Fold rules, replay filters and typed payload access all resolve events through the tag
 * name rather than by inspecting the runtime class of a payload. Two tags are equal when
 * their names are equal; a name is expected to be bound to exactly one payload class.
 *
 * <pre>{@code
 * public static final EventType<OrderPlaced> ORDER_PLACED = EventType.of("OrderPlaced", OrderPlaced.class);
 * }</pre>
 *
 * @param <P> The payload type carried by events of this type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public final class EventType<P> {

    private final String name;
    private final Class<P> payloadClass;

    private EventType(String name, Class<P> payloadClass) {
        this.name = Objects.requireNonNull(name, "Event type name cannot be null");
        this.payloadClass = Objects.requireNonNull(payloadClass, "Payload class cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Event type name cannot be blank");
        }
    }

    public static <P> EventType<P> of(String name, Class<P> payloadClass) {
        return new EventType<>(name, payloadClass);
    }

    public String getName() {
        return name;
    }

    public Class<P> getPayloadClass() {
        return payloadClass;
    }

    /**
     * Checks whether a stored event carries this tag.
     *
     * @param record The stored event
     * @return true if the record's type name equals this tag's name
     */
    public boolean matches(EventRecord record) {
        return record != null && name.equals(record.getEventType());
    }

    /**
     * Returns the payload of a record carrying this tag.
     *
     * @param record The stored event
     * @return The typed payload
     * @throws IllegalArgumentException if the record has a different tag or an incompatible payload
     */
    public P payloadOf(EventRecord record) {
        if (!matches(record)) {
            throw new IllegalArgumentException("Event " + (record == null ? null : record.getEventId())
                + " is not of type " + name);
        }
        Object payload = record.getPayload();
        if (!payloadClass.isInstance(payload)) {
            throw new IllegalArgumentException("Payload of event " + record.getEventId() + " is "
                + payload.getClass().getName() + ", expected " + payloadClass.getName());
        }
        return payloadClass.cast(payload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventType)) return false;
        return name.equals(((EventType<?>) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
