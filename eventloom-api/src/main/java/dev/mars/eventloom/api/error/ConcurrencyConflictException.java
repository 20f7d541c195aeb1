package dev.mars.eventloom.api.error;

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

/**
 * Raised when the history changed between load and commit.
 *
 * The engine never retries on its own; retry policy belongs to the caller.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class ConcurrencyConflictException extends CommitFailedException {

    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(String aggregateType, AggregateId aggregateId,
                                        long expectedVersion, long actualVersion) {
        super(EventLoomErrorCodes.CONCURRENCY_CONFLICT, aggregateType, aggregateId,
              "Concurrent modification of " + aggregateType + "/" + aggregateId
                  + ": expected version " + expectedVersion + " but was " + actualVersion, null);
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
