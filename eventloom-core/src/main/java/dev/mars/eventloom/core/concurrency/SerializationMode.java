package dev.mars.eventloom.core.concurrency;

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
 * How executions against the same aggregate are kept from interleaving.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public enum SerializationMode {

    /**
     * Executions for the same aggregate key are chained in-process; the store's version check
     * still guards against writers in other processes.
     */
    LOCAL_QUEUE,

    /**
     * Executions run concurrently and rely on the store's expected-version check alone.
     * A losing writer fails with a concurrency conflict.
     */
    OPTIMISTIC
}
