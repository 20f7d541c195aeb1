package dev.mars.eventloom.inmemory;

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
import dev.mars.eventloom.api.EventStore;
import dev.mars.eventloom.api.History;
import dev.mars.eventloom.api.PendingEvent;
import dev.mars.eventloom.api.error.ConcurrencyConflictException;
import dev.mars.eventloom.api.error.EventLoomErrorCodes;
import dev.mars.eventloom.api.error.EventStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Thread-safe in-memory implementation of {@link EventStore}.
 *
 * Writes to one aggregate are serialized on that aggregate's stream and checked against
 * the caller's expected version; writes to different aggregates do not contend. Histories
 * of one aggregate type are returned in the order their first event was appended.
 *
 * All futures complete before the method returns.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final Map<String, Map<AggregateId, EventStream>> streamsByType = new ConcurrentHashMap<>();
    private final AtomicLong streamCounter = new AtomicLong();
    private final AtomicLong appendCount = new AtomicLong();
    private final Clock clock;
    private volatile boolean closed = false;

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEventStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    @Override
    public CompletableFuture<History> load(String aggregateType, AggregateId aggregateId) {
        return queryByAggregateId(aggregateType, aggregateId);
    }

    @Override
    public CompletableFuture<List<EventRecord>> append(String aggregateType, AggregateId aggregateId,
                                                       long expectedVersion, List<PendingEvent> events) {
        if (closed) {
            return CompletableFuture.failedFuture(new EventStoreException("Event store is closed"));
        }
        Objects.requireNonNull(aggregateType, "Aggregate type cannot be null");
        Objects.requireNonNull(aggregateId, "Aggregate ID cannot be null");
        if (events == null || events.isEmpty()) {
            return CompletableFuture.failedFuture(new EventStoreException(
                EventLoomErrorCodes.STORE_INVALID_APPEND, "Append requires at least one event"));
        }

        EventStream stream = streamsByType
            .computeIfAbsent(aggregateType, type -> new ConcurrentHashMap<>())
            .computeIfAbsent(aggregateId, id -> new EventStream(streamCounter.incrementAndGet()));

        synchronized (stream) {
            long currentVersion = stream.records.size();
            if (currentVersion != expectedVersion) {
                logger.debug("Rejecting append to {}/{}: expected version {} but was {}",
                    aggregateType, aggregateId, expectedVersion, currentVersion);
                return CompletableFuture.failedFuture(new ConcurrencyConflictException(
                    aggregateType, aggregateId, expectedVersion, currentVersion));
            }

            Instant now = clock.instant();
            List<EventRecord> appended = new ArrayList<>(events.size());
            long sequence = currentVersion;
            for (PendingEvent event : events) {
                appended.add(new EventRecord(UUID.randomUUID().toString(), aggregateType, aggregateId,
                    event.getEventType(), event.getPayload(), ++sequence, now, event.getHeaders()));
            }
            stream.records.addAll(appended);
            appendCount.incrementAndGet();

            logger.debug("Appended {} event(s) to {}/{}, version now {}",
                appended.size(), aggregateType, aggregateId, sequence);
            return CompletableFuture.completedFuture(List.copyOf(appended));
        }
    }

    @Override
    public CompletableFuture<History> queryByAggregateId(String aggregateType, AggregateId aggregateId) {
        if (closed) {
            return CompletableFuture.failedFuture(new EventStoreException("Event store is closed"));
        }
        Map<AggregateId, EventStream> streams = streamsByType.get(aggregateType);
        EventStream stream = streams != null ? streams.get(aggregateId) : null;
        if (stream == null) {
            return CompletableFuture.completedFuture(History.empty(aggregateType, aggregateId));
        }
        return CompletableFuture.completedFuture(stream.snapshot(aggregateType, aggregateId));
    }

    @Override
    public CompletableFuture<List<History>> queryByAggregateType(String aggregateType) {
        if (closed) {
            return CompletableFuture.failedFuture(new EventStoreException("Event store is closed"));
        }
        Map<AggregateId, EventStream> streams = streamsByType.get(aggregateType);
        if (streams == null) {
            return CompletableFuture.completedFuture(List.of());
        }
        List<History> histories = streams.entrySet().stream()
            .sorted(Comparator.comparingLong(entry -> entry.getValue().order))
            .map(entry -> entry.getValue().snapshot(aggregateType, entry.getKey()))
            .filter(history -> !history.isEmpty())
            .collect(Collectors.toList());
        return CompletableFuture.completedFuture(histories);
    }

    /**
     * Number of successful append calls since creation. Replay and query calls never change it.
     */
    public long getAppendCount() {
        return appendCount.get();
    }

    /**
     * Total number of events held for an aggregate type.
     */
    public long countEvents(String aggregateType) {
        Map<AggregateId, EventStream> streams = streamsByType.get(aggregateType);
        if (streams == null) {
            return 0;
        }
        return streams.values().stream().mapToLong(EventStream::size).sum();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (!closed) {
            closed = true;
            logger.info("In-memory event store closed");
        }
    }

    private static final class EventStream {
        private final long order;
        private final List<EventRecord> records = new ArrayList<>();

        private EventStream(long order) {
            this.order = order;
        }

        private synchronized History snapshot(String aggregateType, AggregateId aggregateId) {
            return new History(aggregateType, aggregateId, records);
        }

        private synchronized int size() {
            return records.size();
        }
    }
}
