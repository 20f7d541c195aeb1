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
import dev.mars.eventloom.api.EventType;
import dev.mars.eventloom.api.History;
import dev.mars.eventloom.api.PendingEvent;
import dev.mars.eventloom.api.error.BusinessFault;
import dev.mars.eventloom.api.error.EventLoomErrorCodes;
import dev.mars.eventloom.test.categories.TestCategories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static dev.mars.eventloom.core.TaskAggregate.COMPLETED;
import static dev.mars.eventloom.core.TaskAggregate.PROGRESSED;
import static dev.mars.eventloom.core.TaskAggregate.STARTED;
import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class FoldSpecTest {

    private static final AggregateId ID = AggregateId.of("task-1");

    private static History history(PendingEvent... events) {
        return Histories.of("Task", ID, events);
    }

    @Test
    @DisplayName("Started(1) then Progressed(2) folds to 3")
    void testStartedThenProgressedFoldsToThree() {
        FoldSpec<Integer> spec = FoldSpec.initializedAs(0)
            .applyForAny(STARTED, (state, started) -> started.value())
            .applyForAny(PROGRESSED, (state, progressed) -> state + progressed.value())
            .otherwise(FoldSpec.keepState());

        History history = history(
            PendingEvent.of(STARTED, new TaskAggregate.Started(1)),
            PendingEvent.of(PROGRESSED, new TaskAggregate.Progressed(2)));

        assertEquals(3, spec.aggregateAllEvents(history));
    }

    @Test
    void testEmptyHistoryYieldsSeed() {
        assertEquals(0, TaskAggregate.PROGRESS.aggregateAllEvents(history()));
        assertEquals(0, TaskAggregate.PROGRESS.getSeed());
    }

    @Test
    @DisplayName("Folding is strictly left to right")
    void testFoldOrder() {
        FoldSpec<List<Integer>> spec = FoldSpec.<List<Integer>>initializedAs(List.of())
            .applyForAny(PROGRESSED, (state, progressed) -> {
                List<Integer> next = new ArrayList<>(state);
                next.add(progressed.value());
                return next;
            })
            .otherwise(FoldSpec.keepState());

        History history = history(
            PendingEvent.of(PROGRESSED, new TaskAggregate.Progressed(5)),
            PendingEvent.of(PROGRESSED, new TaskAggregate.Progressed(1)),
            PendingEvent.of(PROGRESSED, new TaskAggregate.Progressed(3)));

        assertEquals(List.of(5, 1, 3), spec.aggregateAllEvents(history));
    }

    @Test
    @DisplayName("Same history and spec always give the same result")
    void testDeterministic() {
        History history = history(
            PendingEvent.of(STARTED, new TaskAggregate.Started(4)),
            PendingEvent.of(PROGRESSED, new TaskAggregate.Progressed(6)),
            PendingEvent.of(COMPLETED, new TaskAggregate.Completed("done")));

        int first = TaskAggregate.PROGRESS.aggregateAllEvents(history);
        int second = TaskAggregate.PROGRESS.aggregateAllEvents(history);

        assertEquals(10, first);
        assertEquals(first, second);
    }

    @Test
    void testStateIgnoringTransition() {
        FoldSpec<String> spec = FoldSpec.initializedAs("none")
            .applyForAny(COMPLETED, completed -> completed.note())
            .otherwise(FoldSpec.keepState());

        History history = history(
            PendingEvent.of(STARTED, new TaskAggregate.Started(1)),
            PendingEvent.of(COMPLETED, new TaskAggregate.Completed("shipped")));

        assertEquals("shipped", spec.aggregateAllEvents(history));
    }

    @Test
    @DisplayName("Unmatched events go to the fallback")
    void testFallbackReceivesUnmatchedEvents() {
        List<String> unmatched = new ArrayList<>();
        FoldSpec<Integer> spec = FoldSpec.initializedAs(0)
            .applyForAny(STARTED, (state, started) -> started.value())
            .otherwise((state, event) -> {
                unmatched.add(event.getEventType());
                return state;
            });

        int result = spec.aggregateAllEvents(history(
            PendingEvent.of(STARTED, new TaskAggregate.Started(7)),
            PendingEvent.of(COMPLETED, new TaskAggregate.Completed("x"))));

        assertEquals(7, result);
        assertEquals(List.of("Completed"), unmatched);
    }

    @Test
    @DisplayName("A fallback that raises a business fault makes the fold raise it unchanged")
    void testOtherwiseRaisingBusinessFault() {
        BusinessFault fault = new BusinessFault("Unexpected event in task history");
        FoldSpec<Integer> spec = FoldSpec.initializedAs(0)
            .applyForAny(STARTED, (state, started) -> started.value())
            .otherwise(FoldSpec.rejectWith(event -> fault));

        History history = history(
            PendingEvent.of(STARTED, new TaskAggregate.Started(1)),
            PendingEvent.of(COMPLETED, new TaskAggregate.Completed("x")));

        BusinessFault thrown = assertThrows(BusinessFault.class, () -> spec.aggregateAllEvents(history));
        assertSame(fault, thrown);
    }

    @Test
    void testRejectUnmatchedCarriesErrorCode() {
        FoldSpec<Integer> spec = FoldSpec.initializedAs(0)
            .applyForAny(STARTED, (state, started) -> started.value())
            .otherwise(FoldSpec.rejectUnmatched());

        BusinessFault thrown = assertThrows(BusinessFault.class, () -> spec.aggregateAllEvents(history(
            PendingEvent.of(PROGRESSED, new TaskAggregate.Progressed(1)))));

        assertEquals(EventLoomErrorCodes.FOLD_UNMATCHED_EVENT, thrown.getErrorCode());
    }

    @Test
    @DisplayName("A second rule for the same tag is rejected at registration")
    void testDuplicateRuleRejected() {
        FoldSpec.Builder<Integer> builder = FoldSpec.initializedAs(0)
            .applyForAny(STARTED, (state, started) -> started.value());

        assertThrows(IllegalArgumentException.class,
            () -> builder.applyForAny(STARTED, (state, started) -> state + 1));
        assertThrows(IllegalArgumentException.class,
            () -> builder.applyForAny(EventType.of("Started", TaskAggregate.Started.class), (state, started) -> 0));
    }

    @Test
    void testBuilderClosedAfterOtherwise() {
        FoldSpec.Builder<Integer> builder = FoldSpec.initializedAs(0);
        FoldSpec<Integer> spec = builder
            .applyForAny(STARTED, (state, started) -> started.value())
            .otherwise(FoldSpec.keepState());

        assertEquals(List.of("Started"), List.copyOf(spec.getRegisteredTypes()));
        assertThrows(IllegalStateException.class,
            () -> builder.applyForAny(PROGRESSED, (state, progressed) -> state));
        assertThrows(IllegalStateException.class, () -> builder.otherwise(FoldSpec.keepState()));
    }
}
