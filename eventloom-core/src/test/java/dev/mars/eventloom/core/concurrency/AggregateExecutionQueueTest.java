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

import dev.mars.eventloom.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CONCURRENCY)
class AggregateExecutionQueueTest {

    private final AggregateExecutionQueue queue = new AggregateExecutionQueue();

    @Test
    void testTasksForSameKeyRunInSubmissionOrder() throws Exception {
        List<String> log = Collections.synchronizedList(new ArrayList<>());
        CompletableFuture<Void> firstGate = new CompletableFuture<>();

        CompletableFuture<String> first = queue.submit("Task/1", () -> {
            log.add("first-start");
            return firstGate.thenApply(v -> {
                log.add("first-end");
                return "first";
            });
        });
        CompletableFuture<String> second = queue.submit("Task/1", () -> {
            log.add("second-start");
            return CompletableFuture.completedFuture("second");
        });

        assertFalse(second.isDone());
        assertEquals(List.of("first-start"), log);

        firstGate.complete(null);

        assertEquals("first", first.get(5, TimeUnit.SECONDS));
        assertEquals("second", second.get(5, TimeUnit.SECONDS));
        assertEquals(List.of("first-start", "first-end", "second-start"), log);
        assertEquals(0, queue.activeKeys());
    }

    @Test
    void testDifferentKeysDoNotWait() throws Exception {
        CompletableFuture<String> blocked = queue.submit("Task/1", CompletableFuture::new);

        String other = queue.submit("Task/2", () -> CompletableFuture.completedFuture("free"))
            .get(5, TimeUnit.SECONDS);

        assertEquals("free", other);
        assertFalse(blocked.isDone());
        assertEquals(1, queue.activeKeys());
    }

    @Test
    void testFailureDoesNotBlockNextTask() throws Exception {
        CompletableFuture<String> failing = queue.submit("Task/1",
            () -> CompletableFuture.failedFuture(new IllegalStateException("nope")));
        CompletableFuture<String> thrown = queue.submit("Task/1", () -> {
            throw new IllegalArgumentException("sync");
        });
        CompletableFuture<String> next = queue.submit("Task/1", () -> CompletableFuture.completedFuture("ok"));

        ExecutionException error = assertThrows(ExecutionException.class, () -> failing.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, error.getCause());
        ExecutionException syncError = assertThrows(ExecutionException.class, () -> thrown.get(5, TimeUnit.SECONDS));
        assertInstanceOf(IllegalArgumentException.class, syncError.getCause());
        assertEquals("ok", next.get(5, TimeUnit.SECONDS));
    }
}
