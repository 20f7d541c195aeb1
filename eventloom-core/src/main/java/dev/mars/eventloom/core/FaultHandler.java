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

import dev.mars.eventloom.api.error.BusinessFault;

/**
 * Handles a business fault raised by an attempted action.
 *
 * @param <A> the aggregate type
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
@FunctionalInterface
public interface FaultHandler<A extends Aggregate> {

    /**
     * @param fault The fault raised by the action
     * @param aggregate The aggregate as it stood when the fault was raised; it can no longer record
     */
    void onFault(BusinessFault fault, A aggregate);
}
