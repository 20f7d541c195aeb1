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
import dev.mars.eventloom.api.History;
import dev.mars.eventloom.api.PendingEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds committed histories without going through a store.
 */
final class Histories {

    private Histories() {
    }

    static History of(String aggregateType, AggregateId id, PendingEvent... events) {
        List<EventRecord> records = new ArrayList<>();
        long sequence = 0;
        for (PendingEvent event : events) {
            sequence++;
            records.add(new EventRecord(id + "-" + sequence, aggregateType, id, event.getEventType(),
                event.getPayload(), sequence, Instant.parse("2025-11-01T00:00:00Z").plusSeconds(sequence),
                event.getHeaders()));
        }
        return new History(aggregateType, id, records);
    }
}
