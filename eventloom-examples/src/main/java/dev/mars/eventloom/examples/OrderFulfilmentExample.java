package dev.mars.eventloom.examples;

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
import dev.mars.eventloom.core.EventLoomEngine;
import dev.mars.eventloom.core.ExecutionOutcome;
import dev.mars.eventloom.core.config.EventLoomConfiguration;
import dev.mars.eventloom.core.replay.ReplayReport;
import dev.mars.eventloom.examples.order.OrderAggregate;
import dev.mars.eventloom.examples.order.OrderCommands;
import dev.mars.eventloom.examples.order.OrderService;
import dev.mars.eventloom.examples.order.OrderSummaryProjection;
import dev.mars.eventloom.examples.order.ShippingNotifier;
import dev.mars.eventloom.inmemory.InMemoryEventStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Walks an order through its life cycle against the in-memory store.
 *
 * Demonstrated:
 * 1. Recording events and delivering them to live subscribers
 * 2. Business faults caught by an attempted execution
 * 3. Re-announcing a confirmation by replaying it instead of recording it twice
 * 4. Rebuilding a fresh projection through a replay of the whole aggregate type
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-07
 * @version 1.0
 */
public class OrderFulfilmentExample {
    private static final Logger logger = LoggerFactory.getLogger(OrderFulfilmentExample.class);
    private static final long WAIT_SECONDS = 10;

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final OrderSummaryProjection liveProjection = new OrderSummaryProjection();
    private final ShippingNotifier shipping = new ShippingNotifier();
    private OrderSummaryProjection rebuiltProjection;
    private OrderService orders;

    public static void main(String[] args) {
        OrderFulfilmentExample example = new OrderFulfilmentExample();
        try {
            example.runExample();
        } catch (Exception e) {
            logger.error("Example failed: {}", e.getMessage(), e);
            System.exit(1);
        }
    }

    public void runExample() throws Exception {
        logger.info("=== Starting Order Fulfilment Example ===");

        try (EventLoomEngine engine = EventLoomEngine.builder()
                .configuration(new EventLoomConfiguration())
                .eventStore(new InMemoryEventStore())
                .meterRegistry(meterRegistry)
                .build()) {
            engine.dispatcher().publishNewStateTo(liveProjection).and(shipping);
            orders = new OrderService(engine);

            AggregateId first = AggregateId.of("order-1001");
            AggregateId second = AggregateId.of("order-1002");

            demonstrateOrderLifecycle(first);
            demonstrateRejectedCommands(second);
            demonstrateReannouncedConfirmation(first);
            demonstrateProjectionRebuild();

            logger.info("=== Order Fulfilment Example Completed Successfully ===");
        }
    }

    private void demonstrateOrderLifecycle(AggregateId orderId) throws Exception {
        logger.info("--- Order life cycle ---");
        await(orders.place(new OrderCommands.PlaceOrder(orderId, "customer-7")));
        await(orders.addItem(new OrderCommands.AddItem(orderId, "SKU-RED-MUG", 2, new BigDecimal("8.50"))));
        await(orders.addItem(new OrderCommands.AddItem(orderId, "SKU-TEAPOT", 1, new BigDecimal("24.00"))));
        ExecutionOutcome<OrderAggregate> confirmed = await(orders.confirm(new OrderCommands.ConfirmOrder(orderId)));
        logger.info("Order {} is {} with total {} at version {}", orderId, confirmed.getAggregate().status(),
            confirmed.getAggregate().total(), confirmed.getAggregate().getVersion());
    }

    private void demonstrateRejectedCommands(AggregateId orderId) throws Exception {
        logger.info("--- Rejected commands ---");
        await(orders.place(new OrderCommands.PlaceOrder(orderId, "customer-9")));
        ExecutionOutcome<OrderAggregate> emptyConfirm = await(orders.confirm(new OrderCommands.ConfirmOrder(orderId)));
        logger.info("Confirming an empty order ended with {}", emptyConfirm.getStatus());
        await(orders.cancel(new OrderCommands.CancelOrder(orderId, "customer changed their mind")));
        ExecutionOutcome<OrderAggregate> lateItem = await(orders.addItem(
            new OrderCommands.AddItem(orderId, "SKU-SPOON", 4, new BigDecimal("1.25"))));
        logger.info("Adding to a cancelled order ended with {}", lateItem.getStatus());
    }

    private void demonstrateReannouncedConfirmation(AggregateId orderId) throws Exception {
        logger.info("--- Re-announced confirmation ---");
        ExecutionOutcome<OrderAggregate> again = await(orders.confirm(new OrderCommands.ConfirmOrder(orderId)));
        logger.info("Second confirmation committed {} events and replayed {}", again.getCommittedEvents().size(),
            again.getReplayedEvents().size());
    }

    private void demonstrateProjectionRebuild() throws Exception {
        logger.info("--- Projection rebuild ---");
        rebuiltProjection = new OrderSummaryProjection();
        ReplayReport report = orders.rebuild(rebuiltProjection).get(WAIT_SECONDS, TimeUnit.SECONDS);
        logger.info("Rebuilt {} order summaries from {} events", rebuiltProjection.size(), report.getEventsSelected());
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(WAIT_SECONDS, TimeUnit.SECONDS);
    }

    public OrderSummaryProjection getLiveProjection() {
        return liveProjection;
    }

    public OrderSummaryProjection getRebuiltProjection() {
        return rebuiltProjection;
    }

    public ShippingNotifier getShipping() {
        return shipping;
    }

    public OrderService getOrders() {
        return orders;
    }

    public SimpleMeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
}
