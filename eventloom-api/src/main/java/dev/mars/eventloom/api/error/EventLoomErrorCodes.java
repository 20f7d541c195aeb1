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

/**
 * Standard error codes for the EventLoom engine.
 *
 * Error code ranges:
 * - ELMERR0001-0049: General/System errors
 * - ELMERR0050-0099: Fold specification errors
 * - ELMERR0100-0149: Business faults
 * - ELMERR0150-0199: Command execution errors
 * - ELMERR0200-0249: Commit errors
 * - ELMERR0250-0299: Dispatch errors
 * - ELMERR0300-0349: Replay errors
 * - ELMERR0350-0399: Event store errors
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public final class EventLoomErrorCodes {

    private EventLoomErrorCodes() {
        // Utility class - no instantiation
    }

    // ========================================================================
    // General/System Errors (0001-0049)
    // ========================================================================
    public static final String INTERNAL_ERROR = "ELMERR0001";
    public static final String TIMEOUT = "ELMERR0002";
    public static final String CANCELLED = "ELMERR0003";

    // ========================================================================
    // Fold Specification Errors (0050-0099)
    // ========================================================================
    public static final String FOLD_UNMATCHED_EVENT = "ELMERR0050";

    // ========================================================================
    // Business Faults (0100-0149)
    // ========================================================================
    public static final String BUSINESS_RULE_VIOLATED = "ELMERR0100";

    // ========================================================================
    // Command Execution Errors (0150-0199)
    // ========================================================================
    public static final String COMMAND_ACTION_FAILED = "ELMERR0150";
    public static final String AGGREGATE_LOAD_FAILED = "ELMERR0151";

    // ========================================================================
    // Commit Errors (0200-0249)
    // ========================================================================
    public static final String COMMIT_FAILED = "ELMERR0200";
    public static final String CONCURRENCY_CONFLICT = "ELMERR0201";
    public static final String COMMIT_TIMEOUT = "ELMERR0202";

    // ========================================================================
    // Dispatch Errors (0250-0299)
    // ========================================================================
    public static final String DISPATCH_HANDLER_FAILED = "ELMERR0250";
    public static final String DISPATCH_HANDLER_TIMEOUT = "ELMERR0251";

    // ========================================================================
    // Replay Errors (0300-0349)
    // ========================================================================
    public static final String REPLAY_QUERY_FAILED = "ELMERR0300";
    public static final String REPLAY_CANCELLED = "ELMERR0301";

    // ========================================================================
    // Event Store Errors (0350-0399)
    // ========================================================================
    public static final String STORE_UNAVAILABLE = "ELMERR0350";
    public static final String STORE_INVALID_APPEND = "ELMERR0351";
}
