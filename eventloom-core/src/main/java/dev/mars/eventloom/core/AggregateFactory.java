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

/**
 * Creates blank aggregate instances for the command executor.
 *
 * Dependency wiring of aggregates happens here; the engine binds identity and history after creation.
 *
 * @param <A> The aggregate type
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-03
 * @version 1.0
 */
@FunctionalInterface
public interface AggregateFactory<A extends Aggregate> {

    /**
     * @return a new, unbound aggregate instance; never a previously used one
     */
    A create();
}
