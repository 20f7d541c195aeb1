package dev.mars.eventloom.core.dispatch;

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

import java.util.Objects;

/**
 * One failed delivery of one event to one handler. A value, not an exception: dispatch failures
 * never fail the command that produced the event.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-05
 * @version 1.0
 */
public final class DispatchFailure {

    private final EventRecord event;
    private final String handlerName;
    private final Throwable cause;
    private final String errorCode;

    public DispatchFailure(EventRecord event, String handlerName, Throwable cause, String errorCode) {
        this.event = Objects.requireNonNull(event, "Event cannot be null");
        this.handlerName = Objects.requireNonNull(handlerName, "Handler name cannot be null");
        this.cause = Objects.requireNonNull(cause, "Cause cannot be null");
        this.errorCode = Objects.requireNonNull(errorCode, "Error code cannot be null");
    }

    public EventRecord getEvent() {
        return event;
    }

    public String getHandlerName() {
        return handlerName;
    }

    public Throwable getCause() {
        return cause;
    }

    public String getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        return "DispatchFailure{" +
                "eventId='" + event.getEventId() + '\'' +
                ", eventType='" + event.getEventType() + '\'' +
                ", handler='" + handlerName + '\'' +
                ", errorCode='" + errorCode + '\'' +
                ", cause=" + cause +
                '}';
    }
}
