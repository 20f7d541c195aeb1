package dev.mars.eventloom.api.metrics;

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

import java.time.Duration;

/**
 * Interface for metrics collection in the EventLoom engine.
 *
 * Implementations must never be null - use {@link NoOpEngineMetrics} if metrics
 * collection is disabled.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public interface EngineMetrics {

    // ========================================================================
    // Command lifecycle
    // ========================================================================

    /**
     * Records the completion of one command execution.
     *
     * @param aggregateType The aggregate type the command targeted
     * @param outcome The outcome name (e.g. SUCCESS, BUSINESS_FAULT, SYSTEM_EXCEPTION, COMMIT_FAILED)
     * @param duration Time from load start to dispatch end
     */
    void recordCommand(String aggregateType, String outcome, Duration duration);

    /**
     * Records events persisted by a commit.
     */
    void recordEventsCommitted(String aggregateType, int count);

    /**
     * Records a commit rejected because the history moved on.
     */
    void recordConcurrencyConflict(String aggregateType);

    // ========================================================================
    // Distribution
    // ========================================================================

    /**
     * Records a failed delivery of one event to one handler.
     *
     * @param handlerName The handler that failed
     * @param reason The failure reason (exception class name)
     */
    void recordDispatchFailure(String handlerName, String reason);

    /**
     * Records events re-delivered by a replay.
     *
     * @param aggregateType The aggregate type the replay was scoped to
     * @param deliveries Number of event deliveries made
     */
    void recordEventsReplayed(String aggregateType, long deliveries);
}
