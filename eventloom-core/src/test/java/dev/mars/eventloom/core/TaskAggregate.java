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

import dev.mars.eventloom.api.AggregateId;
import dev.mars.eventloom.api.Command;
import dev.mars.eventloom.api.EventRecord;
import dev.mars.eventloom.api.EventType;
import dev.mars.eventloom.api.error.BusinessFault;

/**
 * Small aggregate used across the core tests: a task that is started, advanced and completed.
 */
class TaskAggregate extends Aggregate {

    static final AggregateType<TaskAggregate> TYPE = AggregateType.of("Task", TaskAggregate::new);

    record Started(int value) {}
    record Progressed(int value) {}
    record Completed(String note) {}

    static final EventType<Started> STARTED = EventType.of("Started", Started.class);
    static final EventType<Progressed> PROGRESSED = EventType.of("Progressed", Progressed.class);
    static final EventType<Completed> COMPLETED = EventType.of("Completed", Completed.class);

    static final FoldSpec<Integer> PROGRESS = FoldSpec.initializedAs(0)
        .applyForAny(STARTED, (state, started) -> started.value())
        .applyForAny(PROGRESSED, (state, progressed) -> state + progressed.value())
        .otherwise(FoldSpec.keepState());

    record TaskCommand(AggregateId aggregateId, int amount) implements Command {
        @Override
        public AggregateId getAggregateId() {
            return aggregateId;
        }
    }

    int progress() {
        return aggregateAllEvents(PROGRESS);
    }

    void start(int value) {
        if (history().exists(STARTED)) {
            throw new BusinessFault("Task " + getId() + " is already started");
        }
        record(STARTED, new Started(value));
    }

    void advance(int value) {
        if (!history().exists(STARTED)) {
            throw new BusinessFault("Task " + getId() + " has not been started");
        }
        if (history().exists(COMPLETED)) {
            throw new BusinessFault("Task " + getId() + " is already completed");
        }
        record(PROGRESSED, new Progressed(value));
    }

    /**
     * Completes the task once; completing again re-announces the original completion.
     */
    void complete(String note) {
        if (history().exists(COMPLETED)) {
            replay(history().lastRecordOf(COMPLETED).orElseThrow());
            return;
        }
        record(COMPLETED, new Completed(note));
    }

    /**
     * Records, replays and records again so the production order can be checked.
     */
    void nudge() {
        record(PROGRESSED, new Progressed(0));
        replay(history().lastRecordOf(COMPLETED).orElseThrow());
        record(PROGRESSED, new Progressed(0));
    }

    void replayForeign(EventRecord record) {
        replay(record);
    }
}
