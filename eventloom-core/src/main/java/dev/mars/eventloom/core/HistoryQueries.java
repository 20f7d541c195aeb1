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

import dev.mars.eventloom.api.EventRecord;
import dev.mars.eventloom.api.EventType;
import dev.mars.eventloom.api.History;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Read-only queries over the committed history of one aggregate.
 *
 * Instances are only handed out by {@link Aggregate#history()}, which is protected: code that
 * merely holds an aggregate reference cannot query its history. Every query is a linear scan of
 * committed events; events recorded during the current command are never visible here.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class HistoryQueries {

    private final History history;

    HistoryQueries(History history) {
        this.history = history;
    }

    public int size() {
        return history.size();
    }

    public boolean isEmpty() {
        return history.isEmpty();
    }

    public long getVersion() {
        return history.getVersion();
    }

    public int countOf(EventType<?> type) {
        int count = 0;
        for (EventRecord event : history.getEvents()) {
            if (type.matches(event)) {
                count++;
            }
        }
        return count;
    }

    public boolean exists(EventType<?> type) {
        for (EventRecord event : history.getEvents()) {
            if (type.matches(event)) {
                return true;
            }
        }
        return false;
    }

    public <P> Optional<P> firstOf(EventType<P> type) {
        for (EventRecord event : history.getEvents()) {
            if (type.matches(event)) {
                return Optional.of(type.payloadOf(event));
            }
        }
        return Optional.empty();
    }

    public <P> Optional<P> lastOf(EventType<P> type) {
        return lastRecordOf(type).map(type::payloadOf);
    }

    public Optional<EventRecord> lastRecordOf(EventType<?> type) {
        List<EventRecord> events = history.getEvents();
        for (int i = events.size() - 1; i >= 0; i--) {
            if (type.matches(events.get(i))) {
                return Optional.of(events.get(i));
            }
        }
        return Optional.empty();
    }

    public <P> List<P> allOf(EventType<P> type) {
        return history.getEvents().stream()
            .filter(type::matches)
            .map(type::payloadOf)
            .collect(Collectors.toList());
    }

    public List<EventRecord> recordsOf(EventType<?> type) {
        return history.getEvents().stream()
            .filter(type::matches)
            .collect(Collectors.toList());
    }

    public List<EventRecord> records() {
        return history.getEvents();
    }
}
