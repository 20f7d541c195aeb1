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
 * No-operation implementation of EngineMetrics.
 *
 * Use this when metrics collection is disabled. All methods do nothing but are safe to call.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-04
 * @version 1.0
 */
public final class NoOpEngineMetrics implements EngineMetrics {

    /**
     * Singleton instance. Use this instead of creating new instances.
     */
    public static final NoOpEngineMetrics INSTANCE = new NoOpEngineMetrics();

    private NoOpEngineMetrics() {
        // Private constructor to enforce singleton pattern
    }

    @Override
    public void recordCommand(String aggregateType, String outcome, Duration duration) {
        // No-op
    }

    @Override
    public void recordEventsCommitted(String aggregateType, int count) {
        // No-op
    }

    @Override
    public void recordConcurrencyConflict(String aggregateType) {
        // No-op
    }

    @Override
    public void recordDispatchFailure(String handlerName, String reason) {
        // No-op
    }

    @Override
    public void recordEventsReplayed(String aggregateType, long deliveries) {
        // No-op
    }
}
