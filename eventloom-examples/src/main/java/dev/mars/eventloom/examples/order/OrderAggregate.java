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

import dev.mars.eventloom.core.Aggregate;
import dev.mars.eventloom.core.AggregateType;
import dev.mars.eventloom.core.FoldSpec;

import java.math.BigDecimal;

import static dev.mars.eventloom.examples.order.OrderEvents.ITEM_ADDED;
import static dev.mars.eventloom.examples.order.OrderEvents.ORDER_CANCELLED;
import static dev.mars.eventloom.examples.order.OrderEvents.ORDER_CONFIRMED;
import static dev.mars.eventloom.examples.order.OrderEvents.ORDER_PLACED;

/**
 * An order: placed, filled with items, then confirmed or cancelled.
 *
 * Confirming an order a second time does not record a new fact. It replays the original
 * confirmation so that downstream handlers such as shipping see it again.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-07
 * @version 1.0
 */
public class OrderAggregate extends Aggregate {

    public static final AggregateType<OrderAggregate> TYPE = AggregateType.of("Order", OrderAggregate::new);

    private static final FoldSpec<OrderStatus> STATUS = FoldSpec.initializedAs(OrderStatus.NEW)
        .applyForAny(ORDER_PLACED, placed -> OrderStatus.PLACED)
        .applyForAny(ORDER_CONFIRMED, confirmed -> OrderStatus.CONFIRMED)
        .applyForAny(ORDER_CANCELLED, cancelled -> OrderStatus.CANCELLED)
        .otherwise(FoldSpec.keepState());

    private static final FoldSpec<BigDecimal> TOTAL = FoldSpec.initializedAs(BigDecimal.ZERO)
        .applyForAny(ITEM_ADDED, (total, item) -> total.add(item.lineTotal()))
        .otherwise(FoldSpec.keepState());

    public OrderStatus status() {
        return aggregateAllEvents(STATUS);
    }

    public BigDecimal total() {
        return aggregateAllEvents(TOTAL);
    }

    public int itemCount() {
        return history().countOf(ITEM_ADDED);
    }

    public void place(OrderCommands.PlaceOrder command) {
        requireStatus(OrderStatus.NEW, "it has already been placed");
        if (command.customerId() == null || command.customerId().isBlank()) {
            throw new OrderRejectedException(getId(), OrderStatus.NEW, "a customer is required");
        }
        record(ORDER_PLACED, new OrderEvents.OrderPlaced(command.customerId()));
    }

    public void addItem(OrderCommands.AddItem command) {
        requireStatus(OrderStatus.PLACED, "items can only be added to a placed order");
        if (command.quantity() <= 0) {
            throw new OrderRejectedException(getId(), OrderStatus.PLACED, "quantity must be positive");
        }
        record(ITEM_ADDED, new OrderEvents.ItemAdded(command.sku(), command.quantity(), command.unitPrice()));
    }

    public void confirm(OrderCommands.ConfirmOrder command) {
        OrderStatus status = status();
        if (status == OrderStatus.CONFIRMED) {
            replay(history().lastRecordOf(ORDER_CONFIRMED).orElseThrow());
            return;
        }
        requireStatus(OrderStatus.PLACED, "only placed orders can be confirmed");
        if (itemCount() == 0) {
            throw new OrderRejectedException(getId(), status, "an empty order cannot be confirmed");
        }
        record(ORDER_CONFIRMED, new OrderEvents.OrderConfirmed(total()));
    }

    public void cancel(OrderCommands.CancelOrder command) {
        OrderStatus status = status();
        if (status == OrderStatus.CANCELLED) {
            return;
        }
        if (status != OrderStatus.PLACED) {
            throw new OrderRejectedException(getId(), status, "only placed orders can be cancelled");
        }
        record(ORDER_CANCELLED, new OrderEvents.OrderCancelled(command.reason()));
    }

    private void requireStatus(OrderStatus expected, String reason) {
        OrderStatus status = status();
        if (status != expected) {
            throw new OrderRejectedException(getId(), status, reason);
        }
    }
}
