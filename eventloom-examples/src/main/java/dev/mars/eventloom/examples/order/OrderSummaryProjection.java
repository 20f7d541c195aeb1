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
import dev.mars.eventloom.api.EventHandler;
import dev.mars.eventloom.api.EventRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import static dev.mars.eventloom.examples.order.OrderEvents.ITEM_ADDED;
import static dev.mars.eventloom.examples.order.OrderEvents.ORDER_CANCELLED;
import static dev.mars.eventloom.examples.order.OrderEvents.ORDER_CONFIRMED;
import static dev.mars.eventloom.examples.order.OrderEvents.ORDER_PLACED;

/**
 * Read model of order summaries.
 *
 * Events at or below the last applied sequence of an order are skipped, so replays and
 * re-announced confirmations never double count.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class OrderSummaryProjection implements EventHandler {
    private static final Logger logger = LoggerFactory.getLogger(OrderSummaryProjection.class);

    public record OrderSummary(String customerId, OrderStatus status, int items, BigDecimal total, long version) {}

    private final Map<AggregateId, OrderSummary> summaries = new ConcurrentHashMap<>();

    @Override
    public CompletableFuture<Void> handle(EventRecord event) {
        summaries.compute(event.getAggregateId(), (id, current) -> apply(current, event));
        return CompletableFuture.completedFuture(null);
    }

    private OrderSummary apply(OrderSummary current, EventRecord event) {
        OrderSummary summary = current != null ? current
            : new OrderSummary(null, OrderStatus.NEW, 0, BigDecimal.ZERO, 0);
        if (event.getSequence() <= summary.version()) {
            logger.debug("Skipping already applied event {} of order {}", event.getSequence(), event.getAggregateId());
            return summary;
        }
        if (ORDER_PLACED.matches(event)) {
            return new OrderSummary(ORDER_PLACED.payloadOf(event).customerId(), OrderStatus.PLACED,
                summary.items(), summary.total(), event.getSequence());
        }
        if (ITEM_ADDED.matches(event)) {
            OrderEvents.ItemAdded item = ITEM_ADDED.payloadOf(event);
            return new OrderSummary(summary.customerId(), summary.status(), summary.items() + item.quantity(),
                summary.total().add(item.lineTotal()), event.getSequence());
        }
        if (ORDER_CONFIRMED.matches(event)) {
            return new OrderSummary(summary.customerId(), OrderStatus.CONFIRMED, summary.items(),
                summary.total(), event.getSequence());
        }
        if (ORDER_CANCELLED.matches(event)) {
            return new OrderSummary(summary.customerId(), OrderStatus.CANCELLED, summary.items(),
                summary.total(), event.getSequence());
        }
        logger.warn("Ignoring unknown order event type {}", event.getEventType());
        return summary;
    }

    public Optional<OrderSummary> find(AggregateId orderId) {
        return Optional.ofNullable(summaries.get(orderId));
    }

    public int size() {
        return summaries.size();
    }

    @Override
    public String getName() {
        return "order-summary";
    }
}
