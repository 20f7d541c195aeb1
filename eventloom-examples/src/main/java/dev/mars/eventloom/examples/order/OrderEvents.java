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

import dev.mars.eventloom.api.EventType;

import java.math.BigDecimal;

/**
 * Event payloads and type tags of the order fulfilment domain.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public final class OrderEvents {

    public record OrderPlaced(String customerId) {}

    public record ItemAdded(String sku, int quantity, BigDecimal unitPrice) {
        public BigDecimal lineTotal() {
            return unitPrice.multiply(BigDecimal.valueOf(quantity));
        }
    }

    public record OrderConfirmed(BigDecimal total) {}

    public record OrderCancelled(String reason) {}

    public static final EventType<OrderPlaced> ORDER_PLACED = EventType.of("OrderPlaced", OrderPlaced.class);
    public static final EventType<ItemAdded> ITEM_ADDED = EventType.of("ItemAdded", ItemAdded.class);
    public static final EventType<OrderConfirmed> ORDER_CONFIRMED = EventType.of("OrderConfirmed", OrderConfirmed.class);
    public static final EventType<OrderCancelled> ORDER_CANCELLED = EventType.of("OrderCancelled", OrderCancelled.class);

    private OrderEvents() {
        // Constants only
    }
}
