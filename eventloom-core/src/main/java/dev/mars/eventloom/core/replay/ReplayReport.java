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

import dev.mars.eventloom.core.dispatch.DispatchFailure;
import dev.mars.eventloom.core.dispatch.DispatchReport;

import java.util.List;
import java.util.Objects;

/**
 * Summary of one replay run.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public final class ReplayReport {

    private final String aggregateType;
    private final int eventsSelected;
    private final DispatchReport dispatchReport;

    public ReplayReport(String aggregateType, int eventsSelected, DispatchReport dispatchReport) {
        this.aggregateType = Objects.requireNonNull(aggregateType, "Aggregate type cannot be null");
        this.eventsSelected = eventsSelected;
        this.dispatchReport = Objects.requireNonNull(dispatchReport, "Dispatch report cannot be null");
    }

    public String getAggregateType() {
        return aggregateType;
    }

    /**
     * @return number of stored events that matched the selection
     */
    public int getEventsSelected() {
        return eventsSelected;
    }

    public long getDeliveries() {
        return dispatchReport.getDeliveries();
    }

    public List<DispatchFailure> getFailures() {
        return dispatchReport.getFailures();
    }

    public boolean isCancelled() {
        return dispatchReport.isCancelled();
    }

    public DispatchReport getDispatchReport() {
        return dispatchReport;
    }

    @Override
    public String toString() {
        return "ReplayReport{" +
                "aggregateType='" + aggregateType + '\'' +
                ", eventsSelected=" + eventsSelected +
                ", deliveries=" + getDeliveries() +
                ", failures=" + getFailures().size() +
                ", cancelled=" + isCancelled() +
                '}';
    }
}
