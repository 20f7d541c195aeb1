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

import java.time.Duration;

/**
 * Raised when a store call or a handler delivery exceeds its configured timeout, or is cancelled.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class OperationTimeoutException extends SystemException {

    private final String operation;
    private final Duration timeout;

    public OperationTimeoutException(String operation, Duration timeout) {
        super(EventLoomErrorCodes.TIMEOUT, operation + " did not complete within " + timeout);
        this.operation = operation;
        this.timeout = timeout;
    }

    public OperationTimeoutException(String operation, Duration timeout, Throwable cause) {
        super(EventLoomErrorCodes.TIMEOUT, operation + " did not complete within " + timeout, cause);
        this.operation = operation;
        this.timeout = timeout;
    }

    public String getOperation() {
        return operation;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
