package dev.mars.eventloom.api;

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
import java.util.UUID;

/**
 * Opaque identifier of one aggregate instance.
 *
 * The value is assigned once and never changes for the lifetime of the aggregate.
 *
 * @param value the identifier text, never blank
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public record AggregateId(String value) {

    public AggregateId {
        Objects.requireNonNull(value, "Aggregate ID cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Aggregate ID cannot be blank");
        }
    }

    public static AggregateId of(String value) {
        return new AggregateId(value);
    }

    public static AggregateId of(UUID value) {
        Objects.requireNonNull(value, "UUID cannot be null");
        return new AggregateId(value.toString());
    }

    public static AggregateId random() {
        return of(UUID.randomUUID());
    }

    @Override
    public String toString() {
        return value;
    }
}
