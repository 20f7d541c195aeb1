package dev.mars.eventloom.core.concurrency;

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

import dev.mars.eventloom.core.util.FutureUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Chains asynchronous tasks per key so that tasks sharing a key run strictly one after another,
 * while tasks with different keys run in parallel.
 *
 * A task starts only after the previous task for its key has completed, successfully or not.
 * Keys with nothing queued hold no state.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public class AggregateExecutionQueue {
    private static final Logger logger = LoggerFactory.getLogger(AggregateExecutionQueue.class);

    private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    /**
     * Queues a task behind whatever is already running for the key.
     *
     * @param key The serialization key, typically aggregate type and id
     * @param task Starts the work and returns its completion
     * @return The task's own result
     */
    public <T> CompletableFuture<T> submit(String key, Supplier<CompletableFuture<T>> task) {
        CompletableFuture<Void> gate = new CompletableFuture<>();
        CompletableFuture<Void> previous = tails.put(key, gate);
        CompletableFuture<Void> ready = previous != null ? previous : CompletableFuture.completedFuture(null);
        if (previous != null) {
            logger.debug("Execution for {} queued behind a running execution", key);
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        ready.whenComplete((ignored, previousError) -> {
            CompletableFuture<T> running;
            try {
                running = task.get();
            } catch (Throwable t) {
                running = CompletableFuture.failedFuture(t);
            }
            if (running == null) {
                running = CompletableFuture.failedFuture(new IllegalStateException("Queued task returned null"));
            }
            running.whenComplete((value, error) -> {
                tails.remove(key, gate);
                gate.complete(null);
                if (error != null) {
                    result.completeExceptionally(FutureUtils.unwrap(error));
                } else {
                    result.complete(value);
                }
            });
        });
        return result;
    }

    /**
     * @return number of keys with a running or queued task
     */
    public int activeKeys() {
        return tails.size();
    }
}
