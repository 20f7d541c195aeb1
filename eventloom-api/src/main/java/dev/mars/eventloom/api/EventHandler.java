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

import java.util.concurrent.CompletableFuture;

/**
 * Functional interface for consumers of committed or replayed events.
 *
 * Handlers may see the same event more than once (replay, retried replay) and are
 * expected to be idempotent.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
@FunctionalInterface
public interface EventHandler {

    /**
     * Handles one event.
     *
     * @param event The event to handle
     * @return A CompletableFuture that completes when the event is processed
     */
    CompletableFuture<Void> handle(EventRecord event);

    /**
     * Name used in dispatch reports, logs and metrics.
     */
    default String getName() {
        String simpleName = getClass().getSimpleName();
        return simpleName.isEmpty() ? getClass().getName() : simpleName;
    }
}
