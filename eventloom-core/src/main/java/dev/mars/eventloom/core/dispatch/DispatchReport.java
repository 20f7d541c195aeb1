package dev.mars.eventloom.core.dispatch;

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

import java.util.List;

/**
 * Summary of one dispatch run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public final class DispatchReport {

    private static final DispatchReport EMPTY = new DispatchReport(0, 0, List.of(), false);

    private final int eventCount;
    private final long deliveries;
    private final List<DispatchFailure> failures;
    private final boolean cancelled;

    public DispatchReport(int eventCount, long deliveries, List<DispatchFailure> failures, boolean cancelled) {
        this.eventCount = eventCount;
        this.deliveries = deliveries;
        this.failures = List.copyOf(failures);
        this.cancelled = cancelled;
    }

    public static DispatchReport empty() {
        return EMPTY;
    }

    /**
     * @return number of events offered to the dispatcher
     */
    public int getEventCount() {
        return eventCount;
    }

    /**
     * @return number of handler invocations made, failed ones included
     */
    public long getDeliveries() {
        return deliveries;
    }

    public List<DispatchFailure> getFailures() {
        return failures;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    /**
     * @return true if delivery stopped early because of a cancellation
     */
    public boolean isCancelled() {
        return cancelled;
    }

    @Override
    public String toString() {
        return "DispatchReport{" +
                "eventCount=" + eventCount +
                ", deliveries=" + deliveries +
                ", failures=" + failures.size() +
                ", cancelled=" + cancelled +
                '}';
    }
}
