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
 * An expected, declared violation of a domain rule.
 *
 * Business faults are raised by business actions and by fold fallbacks that forbid certain
 * histories. They are the only failures routed to {@code catchFault} handlers; everything
 * else an action throws is treated as a system failure. Applications are encouraged to
 * subclass this type for their own rules.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-02
 * @version 1.0
 */
public class BusinessFault extends EventLoomException {

    public BusinessFault(String message) {
        super(EventLoomErrorCodes.BUSINESS_RULE_VIOLATED, message);
    }

    public BusinessFault(String errorCode, String message) {
        super(errorCode, message);
    }

    public BusinessFault(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
