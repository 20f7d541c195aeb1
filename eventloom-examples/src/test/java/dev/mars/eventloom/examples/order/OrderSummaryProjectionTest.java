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
import dev.mars.eventloom.api.EventRecord;
import dev.mars.eventloom.test.categories.TestCategories;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@Tag(TestCategories.CORE)
class OrderSummaryProjectionTest {

    private static final AggregateId ORDER = AggregateId.of("order-9");

    private static EventRecord event(long sequence, String type, Object payload) {
        return new EventRecord("evt-" + sequence, "Order", ORDER, type, payload, sequence, Instant.EPOCH, Map.of());
    }

    @Test
    void testRedeliveredEventsAreSkipped() {
        OrderSummaryProjection projection = new OrderSummaryProjection();
        EventRecord placed = event(1, "OrderPlaced", new OrderEvents.OrderPlaced("c-1"));
        EventRecord item = event(2, "ItemAdded", new OrderEvents.ItemAdded("SKU", 3, new BigDecimal("2.00")));

        projection.handle(placed).join();
        projection.handle(item).join();
        projection.handle(item).join();
        projection.handle(placed).join();

        OrderSummaryProjection.OrderSummary summary = projection.find(ORDER).orElseThrow();
        assertEquals("c-1", summary.customerId());
        assertEquals(OrderStatus.PLACED, summary.status());
        assertEquals(3, summary.items());
        assertEquals(new BigDecimal("6.00"), summary.total());
        assertEquals(2, summary.version());
    }

    @Test
    void testUnknownOrderIsAbsent() {
        assertTrue(new OrderSummaryProjection().find(ORDER).isEmpty());
    }
}
