package dev.mars.eventloom.core.util;

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

import dev.mars.eventloom.api.error.OperationTimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Helpers for the CompletableFuture plumbing shared by the executor, dispatcher and replay.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public final class FutureUtils {
    private static final Logger logger = LoggerFactory.getLogger(FutureUtils.class);

    private FutureUtils() {
        // Utility class
    }

    /**
     * Invokes an asynchronous operation, turning a synchronous throw or a null return into a
     * failed future.
     *
     * @param operation Description used in the failure message
     * @param supplier The call to make
     */
    public static <T> CompletableFuture<T> invokeSafely(String operation, Supplier<CompletableFuture<T>> supplier) {
        try {
            CompletableFuture<T> future = supplier.get();
            if (future == null) {
                return CompletableFuture.failedFuture(
                    new IllegalStateException(operation + " returned null instead of a future"));
            }
            return future;
        } catch (Throwable t) {
            logger.trace("{} threw synchronously: {}", operation, t.getMessage());
            return CompletableFuture.failedFuture(t);
        }
    }

    /**
     * Invokes an asynchronous operation on the given executor so that a call which blocks
     * before returning its future does not hold up the caller. A rejected submission becomes
     * a failed future.
     */
    public static <T> CompletableFuture<T> invokeOn(String operation, Executor executor,
                                                    Supplier<CompletableFuture<T>> supplier) {
        try {
            return CompletableFuture.supplyAsync(() -> invokeSafely(operation, supplier), executor)
                .thenCompose(future -> future);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Bounds an operation by a timeout. The returned future fails with
     * {@link OperationTimeoutException} if the operation has not completed in time; the
     * operation's own future is left untouched.
     *
     * The returned future is completed on {@code completionExecutor}, never on the JDK's
     * shared timeout scheduler thread, so work chained onto it cannot stall other timeouts.
     */
    public static <T> CompletableFuture<T> withTimeout(String operation, Duration timeout, Executor completionExecutor,
                                                       Supplier<CompletableFuture<T>> supplier) {
        CompletableFuture<T> bounded = invokeSafely(operation, supplier)
            .copy()
            .orTimeout(timeout.toNanos(), TimeUnit.NANOSECONDS);

        CompletableFuture<T> result = new CompletableFuture<>();
        bounded.whenCompleteAsync((value, error) -> complete(operation, timeout, result, value, error),
                completionExecutor)
            .whenComplete((ignored, stageError) -> {
                // The async stage only ends without completing the result when the executor rejected it
                if (!result.isDone()) {
                    bounded.whenComplete((value, error) -> complete(operation, timeout, result, value, error));
                }
            });
        return result;
    }

    private static <T> void complete(String operation, Duration timeout, CompletableFuture<T> result,
                                     T value, Throwable error) {
        if (error == null) {
            result.complete(value);
            return;
        }
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) {
            logger.trace("{} timed out after {}", operation, timeout);
            result.completeExceptionally(new OperationTimeoutException(operation, timeout, cause));
        } else {
            result.completeExceptionally(cause);
        }
    }

    /**
     * Strips CompletionException and ExecutionException wrappers.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
