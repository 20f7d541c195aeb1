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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static dev.mars.eventloom.examples.order.OrderEvents.ORDER_CONFIRMED;

/**
 * Sends a shipping request for every confirmation it sees, including replayed ones.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class ShippingNotifier implements EventHandler {
    private static final Logger logger = LoggerFactory.getLogger(ShippingNotifier.class);

    private final List<AggregateId> requests = Collections.synchronizedList(new ArrayList<>());

    @Override
    public CompletableFuture<Void> handle(EventRecord event) {
        if (ORDER_CONFIRMED.matches(event)) {
            requests.add(event.getAggregateId());
            logger.info("Shipping requested for order {} (total {})", event.getAggregateId(),
                ORDER_CONFIRMED.payloadOf(event).total());
        }
        return CompletableFuture.completedFuture(null);
    }

    public List<AggregateId> getRequests() {
        synchronized (requests) {
            return List.copyOf(requests);
        }
    }

    @Override
    public String getName() {
        return "shipping";
    }
}
