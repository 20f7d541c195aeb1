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
 * The business action of a command: inspects the aggregate's history-derived state and records
 * or replays events. May throw a {@link dev.mars.eventloom.api.error.BusinessFault} to reject
 * the command.
 *
 * @param <A> the aggregate type
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
@FunctionalInterface
public interface AggregateAction<A extends Aggregate> {

    void accept(A aggregate) throws Exception;
}
