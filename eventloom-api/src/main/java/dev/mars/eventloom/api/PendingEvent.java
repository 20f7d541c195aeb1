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

import java.util.Map;
import java.util.Objects;

/**
 * An event decided by an aggregate but not yet persisted.
 *
 * The store turns pending events into {@link EventRecord}s when it appends them,
 * assigning the event ID, sequence and recording time.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public final class PendingEvent {

    private final String eventType;
    private final Object payload;
    private final Map<String, String> headers;

    public PendingEvent(String eventType, Object payload, Map<String, String> headers) {
        this.eventType = Objects.requireNonNull(eventType, "Event type cannot be null");
        this.payload = Objects.requireNonNull(payload, "Payload cannot be null");
        this.headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    public static <P> PendingEvent of(EventType<P> type, P payload) {
        return new PendingEvent(type.getName(), payload, Map.of());
    }

    public String getEventType() {
        return eventType;
    }

    public Object getPayload() {
        return payload;
    }

    public Map<String, String> getHeaders() {
        return headers;
    }

    @Override
    public String toString() {
        return "PendingEvent{eventType='" + eventType + "', payload=" + payload + '}';
    }
}
