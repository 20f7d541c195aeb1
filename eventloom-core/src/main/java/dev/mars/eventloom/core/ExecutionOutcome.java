package dev.mars.eventloom.core;

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

import dev.mars.eventloom.api.EventRecord;
import dev.mars.eventloom.core.dispatch.DispatchReport;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one command execution.
 *
 * A successful execution carries the committed and replayed events together with the dispatch
 * report. An execution whose failure was handled by a catch handler carries the error and the
 * aggregate at the time of failure, and no events.
 *
 * @param <A> the aggregate type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public final class ExecutionOutcome<A extends Aggregate> {

    public enum Status {
        SUCCESS,
        BUSINESS_FAULT,
        SYSTEM_EXCEPTION
    }

    private final Status status;
    private final A aggregate;
    private final Throwable error;
    private final List<EventRecord> committedEvents;
    private final List<EventRecord> replayedEvents;
    private final DispatchReport dispatchReport;

    private ExecutionOutcome(Status status, A aggregate, Throwable error, List<EventRecord> committedEvents,
                             List<EventRecord> replayedEvents, DispatchReport dispatchReport) {
        this.status = status;
        this.aggregate = Objects.requireNonNull(aggregate, "Aggregate cannot be null");
        this.error = error;
        this.committedEvents = List.copyOf(committedEvents);
        this.replayedEvents = List.copyOf(replayedEvents);
        this.dispatchReport = dispatchReport;
    }

    static <A extends Aggregate> ExecutionOutcome<A> success(A aggregate, List<EventRecord> committed,
                                                             List<EventRecord> replayed, DispatchReport report) {
        return new ExecutionOutcome<>(Status.SUCCESS, aggregate, null, committed, replayed, report);
    }

    static <A extends Aggregate> ExecutionOutcome<A> handledFailure(Status status, A aggregate, Throwable error) {
        return new ExecutionOutcome<>(status, aggregate, error, List.of(), List.of(), DispatchReport.empty());
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public A getAggregate() {
        return aggregate;
    }

    public Optional<Throwable> getError() {
        return Optional.ofNullable(error);
    }

    /**
     * @return events persisted by this execution, in sequence order
     */
    public List<EventRecord> getCommittedEvents() {
        return committedEvents;
    }

    /**
     * @return historical events re-delivered by this execution
     */
    public List<EventRecord> getReplayedEvents() {
        return replayedEvents;
    }

    public DispatchReport getDispatchReport() {
        return dispatchReport;
    }

    @Override
    public String toString() {
        return "ExecutionOutcome{" +
                "status=" + status +
                ", aggregate=" + aggregate.getAggregateType() + "/" + aggregate.getId() +
                ", committed=" + committedEvents.size() +
                ", replayed=" + replayedEvents.size() +
                (error != null ? ", error=" + error : "") +
                '}';
    }
}
