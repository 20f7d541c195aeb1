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

import io.vertx.core.Future;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Interface for the durable event store consumed by the aggregate engine.
 *
 * The store is the single source of truth for aggregate histories. The engine only appends
 * through {@link #append(String, AggregateId, long, List)} and only reads through the load and
 * query methods; it never deletes or rewrites events.
 *
 * Implementations must serialize writes per aggregate instance and enforce the expected
 * version passed to {@code append}: when it does not match the current version of the
 * history, the returned future fails with
 * {@link dev.mars.eventloom.api.error.ConcurrencyConflictException}. Failure to reach the
 * underlying storage is reported as {@link dev.mars.eventloom.api.error.EventStoreException}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public interface EventStore extends AutoCloseable {

    /**
     * Loads the current history of one aggregate instance for command execution.
     *
     * @param aggregateType The aggregate type
     * @param aggregateId The aggregate instance
     * @return A CompletableFuture with the history, empty if nothing was ever appended
     */
    CompletableFuture<History> load(String aggregateType, AggregateId aggregateId);

    /**
     * Appends new events to one aggregate's history.
     *
     * @param aggregateType The aggregate type
     * @param aggregateId The aggregate instance
     * @param expectedVersion The history version the caller based its decision on
     * @param events The events to append, in order
     * @return A CompletableFuture with the persisted records, in order
     */
    CompletableFuture<List<EventRecord>> append(String aggregateType, AggregateId aggregateId,
                                                long expectedVersion, List<PendingEvent> events);

    /**
     * Queries the full history of one aggregate instance for read-only consumers such as replay.
     *
     * @param aggregateType The aggregate type
     * @param aggregateId The aggregate instance
     * @return A CompletableFuture with the history
     */
    CompletableFuture<History> queryByAggregateId(String aggregateType, AggregateId aggregateId);

    /**
     * Queries the histories of every instance of an aggregate type.
     *
     * @param aggregateType The aggregate type
     * @return A CompletableFuture with one history per instance, in the store's natural order
     */
    CompletableFuture<List<History>> queryByAggregateType(String aggregateType);

    // ========== REACTIVE METHODS (Vert.x Future-based) ==========

    /**
     * Loads a history (reactive version).
     */
    default Future<History> loadReactive(String aggregateType, AggregateId aggregateId) {
        return Future.fromCompletionStage(load(aggregateType, aggregateId));
    }

    /**
     * Queries one aggregate's history (reactive version).
     */
    default Future<History> queryByAggregateIdReactive(String aggregateType, AggregateId aggregateId) {
        return Future.fromCompletionStage(queryByAggregateId(aggregateType, aggregateId));
    }

    /**
     * Queries all histories of an aggregate type (reactive version).
     */
    default Future<List<History>> queryByAggregateTypeReactive(String aggregateType) {
        return Future.fromCompletionStage(queryByAggregateType(aggregateType));
    }

    @Override
    default void close() throws Exception {
    }
}
