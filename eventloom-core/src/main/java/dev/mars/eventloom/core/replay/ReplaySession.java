package dev.mars.eventloom.core.replay;

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
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Handle on a running replay.
 *
 * Cancelling stops delivery before the next handler call; a delivery already in progress is
 * allowed to finish. The completion future still completes normally, with a report flagged as
 * cancelled.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public final class ReplaySession {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final CompletableFuture<ReplayReport> completion = new CompletableFuture<>();

    ReplaySession() {
    }

    /**
     * Requests cancellation.
     *
     * @return true if this call cancelled the replay, false if it was already cancelled or finished
     */
    public boolean cancel() {
        return !completion.isDone() && cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isDone() {
        return completion.isDone();
    }

    public CompletableFuture<ReplayReport> getCompletion() {
        return completion;
    }
}
