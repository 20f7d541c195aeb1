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

/**
 * A request to act on one aggregate instance.
 *
 * The engine only needs to know which aggregate the command addresses; the rest of the
 * command is opaque to it and is consumed by the business action.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public interface Command {

    /**
     * Resolves the aggregate this command targets.
     *
     * @return the target aggregate ID, never null
     */
    AggregateId getAggregateId();
}
