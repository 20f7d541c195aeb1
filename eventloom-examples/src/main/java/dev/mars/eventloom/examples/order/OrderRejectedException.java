package dev.mars.eventloom.examples.order;

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

import dev.mars.eventloom.api.AggregateId;
import dev.mars.eventloom.api.error.BusinessFault;
import dev.mars.eventloom.api.error.EventLoomErrorCodes;

/**
 * Raised when an order command breaks an order rule.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class OrderRejectedException extends BusinessFault {

    private final AggregateId orderId;
    private final OrderStatus status;

    public OrderRejectedException(AggregateId orderId, OrderStatus status, String message) {
        super(EventLoomErrorCodes.BUSINESS_RULE_VIOLATED, "Order " + orderId + " (" + status + "): " + message);
        this.orderId = orderId;
        this.status = status;
    }

    public AggregateId getOrderId() {
        return orderId;
    }

    public OrderStatus getStatus() {
        return status;
    }
}
