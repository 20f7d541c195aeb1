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
 * Raised when the pending changes of a successful business action could not be persisted.
 *
 * Commit failures are never routed to the {@code catchFault} / {@code catchException}
 * handlers of a command: those only cover the business action itself. The commit either
 * persisted all pending events or none of them.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class CommitFailedException extends EventLoomException {

    private final String aggregateType;
    private final AggregateId aggregateId;

    public CommitFailedException(String aggregateType, AggregateId aggregateId, Throwable cause) {
        this(EventLoomErrorCodes.COMMIT_FAILED, aggregateType, aggregateId,
             "Failed to commit changes of " + aggregateType + "/" + aggregateId
                 + (cause != null ? ": " + cause.getMessage() : ""), cause);
    }

    /**
     * Creates a commit failure for a store call that exceeded its timeout.
     */
    public static CommitFailedException timedOut(String aggregateType, AggregateId aggregateId,
                                                 OperationTimeoutException cause) {
        return new CommitFailedException(EventLoomErrorCodes.COMMIT_TIMEOUT, aggregateType, aggregateId,
            "Commit of " + aggregateType + "/" + aggregateId + " timed out after " + cause.getTimeout(), cause);
    }

    protected CommitFailedException(String errorCode, String aggregateType, AggregateId aggregateId,
                                    String message, Throwable cause) {
        super(errorCode, message, cause);
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public AggregateId getAggregateId() {
        return aggregateId;
    }
}
