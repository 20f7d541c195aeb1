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
import dev.mars.eventloom.api.Command;

import java.math.BigDecimal;

/**
 * Commands accepted by {@link OrderAggregate}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public final class OrderCommands {

    public record PlaceOrder(AggregateId orderId, String customerId) implements Command {
        @Override
        public AggregateId getAggregateId() {
            return orderId;
        }
    }

    public record AddItem(AggregateId orderId, String sku, int quantity, BigDecimal unitPrice) implements Command {
        @Override
        public AggregateId getAggregateId() {
            return orderId;
        }
    }

    public record ConfirmOrder(AggregateId orderId) implements Command {
        @Override
        public AggregateId getAggregateId() {
            return orderId;
        }
    }

    public record CancelOrder(AggregateId orderId, String reason) implements Command {
        @Override
        public AggregateId getAggregateId() {
            return orderId;
        }
    }

    private OrderCommands() {
        // Records only
    }
}
