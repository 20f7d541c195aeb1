package dev.mars.eventloom.api.error;

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
 * Raised by event store implementations when the underlying storage cannot serve a request.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class EventStoreException extends SystemException {

    public EventStoreException(String message) {
        super(EventLoomErrorCodes.STORE_UNAVAILABLE, message);
    }

    public EventStoreException(String errorCode, String message) {
        super(errorCode, message);
    }

    public EventStoreException(String message, Throwable cause) {
        super(EventLoomErrorCodes.STORE_UNAVAILABLE, message, cause);
    }
}
