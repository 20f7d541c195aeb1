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

import java.util.Objects;

/**
 * Names one kind of aggregate and knows how to create instances of it.
 *
 * <pre>{@code
 * public static final AggregateType<OrderAggregate> ORDER = AggregateType.of("Order", OrderAggregate::new);
 * }</pre>
 *
 * @param <A> The aggregate class
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
public final class AggregateType<A extends Aggregate> {

    private final String name;
    private final AggregateFactory<A> factory;

    private AggregateType(String name, AggregateFactory<A> factory) {
        this.name = Objects.requireNonNull(name, "Aggregate type name cannot be null");
        this.factory = Objects.requireNonNull(factory, "Aggregate factory cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Aggregate type name cannot be blank");
        }
    }

    public static <A extends Aggregate> AggregateType<A> of(String name, AggregateFactory<A> factory) {
        return new AggregateType<>(name, factory);
    }

    public String getName() {
        return name;
    }

    A newInstance() {
        A aggregate = factory.create();
        if (aggregate == null) {
            throw new IllegalStateException("Aggregate factory for '" + name + "' returned null");
        }
        return aggregate;
    }

    @Override
    public String toString() {
        return name;
    }
}
