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
import dev.mars.eventloom.api.EventType;
import dev.mars.eventloom.api.History;
import dev.mars.eventloom.api.error.BusinessFault;
import dev.mars.eventloom.api.error.EventLoomErrorCodes;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * Declarative state reducer evaluated over an aggregate's committed history.
 *
 * A fold spec maps event type tags to transition functions {@code (priorState, payload) -> newState},
 * starting from a seed value. Events whose tag has no rule go to the mandatory fallback, which may
 * keep the state, derive a new one, or throw a {@link BusinessFault} to forbid the history.
 *
 * <pre>{@code
 * private static final FoldSpec<Integer> PROGRESS = FoldSpec.<Integer>initializedAs(0)
 *     .applyForAny(STARTED, (state, started) -> started.value())
 *     .applyForAny(PROGRESSED, (state, progressed) -> state + progressed.value())
 *     .otherwise(FoldSpec.keepState());
 * }</pre>
 *
 * Specs are immutable once {@link Builder#otherwise(BiFunction)} returns, hold no per-history state and
 * may be shared as constants. The fold itself is only reachable through
 * {@link Aggregate#aggregateAllEvents(FoldSpec)}, never from outside an aggregate, and is recomputed on
 * every call.
 *
 * @param <S> The derived state type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class FoldSpec<S> {

    private final S seed;
    private final Map<String, BiFunction<S, EventRecord, S>> rules;
    private final BiFunction<S, EventRecord, S> fallback;

    private FoldSpec(Builder<S> builder, BiFunction<S, EventRecord, S> fallback) {
        this.seed = builder.seed;
        this.rules = Collections.unmodifiableMap(new LinkedHashMap<>(builder.rules));
        this.fallback = fallback;
    }

    /**
     * Starts a fold spec with the given seed state.
     *
     * @param seed The state before the first event; may be null
     * @return A builder accepting rules
     */
    public static <S> Builder<S> initializedAs(S seed) {
        return new Builder<>(seed);
    }

    /**
     * Fallback that leaves the state untouched for unmatched event types.
     */
    public static <S> BiFunction<S, EventRecord, S> keepState() {
        return (state, event) -> state;
    }

    /**
     * Fallback that forbids any history containing an unmatched event type.
     */
    public static <S> BiFunction<S, EventRecord, S> rejectUnmatched() {
        return (state, event) -> {
            throw new BusinessFault(EventLoomErrorCodes.FOLD_UNMATCHED_EVENT,
                "No fold rule accepts event type '" + event.getEventType() + "' (event " + event.getEventId() + ")");
        };
    }

    /**
     * Fallback that forbids unmatched event types with a domain specific fault.
     *
     * @param faultFactory Builds the fault from the offending event
     */
    public static <S> BiFunction<S, EventRecord, S> rejectWith(Function<EventRecord, ? extends BusinessFault> faultFactory) {
        Objects.requireNonNull(faultFactory, "Fault factory cannot be null");
        return (state, event) -> {
            throw faultFactory.apply(event);
        };
    }

    public S getSeed() {
        return seed;
    }

    /**
     * @return the tag names that have a rule, in registration order
     */
    public Set<String> getRegisteredTypes() {
        return rules.keySet();
    }

    /**
     * Strict left-to-right fold over the committed events of a history.
     *
     * For each event exactly one function runs: the rule registered for its tag, or the fallback.
     * A {@link BusinessFault} raised by a rule or the fallback escapes unchanged.
     */
    S aggregateAllEvents(History history) {
        S state = seed;
        for (EventRecord event : history.getEvents()) {
            BiFunction<S, EventRecord, S> rule = rules.get(event.getEventType());
            state = rule != null ? rule.apply(state, event) : fallback.apply(state, event);
        }
        return state;
    }

    /**
     * Collects transition rules until the fallback completes the spec.
     *
     * @param <S> The derived state type
     */
    public static final class Builder<S> {

        private final S seed;
        private final Map<String, BiFunction<S, EventRecord, S>> rules = new LinkedHashMap<>();
        private boolean completed = false;

        private Builder(S seed) {
            this.seed = seed;
        }

        /**
         * Registers the transition for one event type.
         *
         * @param type The event type tag
         * @param transition Receives the prior state and the event payload, returns the new state
         * @return this builder
         * @throws IllegalArgumentException if a rule for the same tag is already registered
         */
        public <P> Builder<S> applyForAny(EventType<P> type, BiFunction<? super S, ? super P, ? extends S> transition) {
            Objects.requireNonNull(type, "Event type cannot be null");
            Objects.requireNonNull(transition, "Transition cannot be null");
            register(type, (state, event) -> transition.apply(state, type.payloadOf(event)));
            return this;
        }

        /**
         * Registers a transition that ignores the prior state.
         *
         * @param type The event type tag
         * @param transition Receives the event payload, returns the new state
         * @return this builder
         * @throws IllegalArgumentException if a rule for the same tag is already registered
         */
        public <P> Builder<S> applyForAny(EventType<P> type, Function<? super P, ? extends S> transition) {
            Objects.requireNonNull(type, "Event type cannot be null");
            Objects.requireNonNull(transition, "Transition cannot be null");
            register(type, (state, event) -> transition.apply(type.payloadOf(event)));
            return this;
        }

        /**
         * Registers the fallback for event types without a rule and completes the spec.
         *
         * @param fallback Receives the prior state and the unmatched event; may throw a {@link BusinessFault}
         * @return the immutable fold spec
         */
        public FoldSpec<S> otherwise(BiFunction<? super S, EventRecord, ? extends S> fallback) {
            Objects.requireNonNull(fallback, "Fallback cannot be null");
            ensureOpen();
            completed = true;
            return new FoldSpec<>(this, fallback::apply);
        }

        private void register(EventType<?> type, BiFunction<S, EventRecord, S> rule) {
            ensureOpen();
            if (rules.containsKey(type.getName())) {
                throw new IllegalArgumentException("A fold rule for event type '" + type.getName()
                    + "' is already registered");
            }
            rules.put(type.getName(), rule);
        }

        private void ensureOpen() {
            if (completed) {
                throw new IllegalStateException("Fold spec is already completed by otherwise()");
            }
        }
    }
}
