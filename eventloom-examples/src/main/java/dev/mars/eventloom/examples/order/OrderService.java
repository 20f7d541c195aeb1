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

import dev.mars.eventloom.api.EventHandler;
import dev.mars.eventloom.core.CommandExecutor;
import dev.mars.eventloom.core.EventLoomEngine;
import dev.mars.eventloom.core.ExecutionOutcome;
import dev.mars.eventloom.core.replay.ReplayReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Application service translating order commands into aggregate executions.
 *
 * Rejected commands are caught and kept as rejections; unexpected failures propagate.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-11-06
 * @version 1.0
 */
public class OrderService {
    private static final Logger logger = LoggerFactory.getLogger(OrderService.class);

    private final EventLoomEngine engine;
    private final List<String> rejections = new CopyOnWriteArrayList<>();

    public OrderService(EventLoomEngine engine) {
        this.engine = engine;
    }

    public CompletableFuture<ExecutionOutcome<OrderAggregate>> place(OrderCommands.PlaceOrder command) {
        return commands().provide(OrderAggregate.TYPE).with(command).execute(order -> order.place(command));
    }

    public CompletableFuture<ExecutionOutcome<OrderAggregate>> addItem(OrderCommands.AddItem command) {
        return commands().provide(OrderAggregate.TYPE).with(command)
            .attempt(order -> order.addItem(command))
            .catchFault((fault, order) -> reject(fault.getMessage()))
            .run();
    }

    public CompletableFuture<ExecutionOutcome<OrderAggregate>> confirm(OrderCommands.ConfirmOrder command) {
        return commands().provide(OrderAggregate.TYPE).with(command)
            .attempt(order -> order.confirm(command))
            .catchFault((fault, order) -> reject(fault.getMessage()))
            .run();
    }

    public CompletableFuture<ExecutionOutcome<OrderAggregate>> cancel(OrderCommands.CancelOrder command) {
        return commands().provide(OrderAggregate.TYPE).with(command)
            .attempt(order -> order.cancel(command))
            .catchFault((fault, order) -> reject(fault.getMessage()))
            .catchException((error, order) -> logger.error("Cancelling order {} failed", order.getId(), error))
            .run();
    }

    /**
     * Feeds every stored order event to a handler, e.g. a freshly created projection.
     */
    public CompletableFuture<ReplayReport> rebuild(EventHandler handler) {
        return engine.replay().replayFor(OrderAggregate.TYPE).allEvents().to(handler).getCompletion();
    }

    public List<String> getRejections() {
        return List.copyOf(rejections);
    }

    private void reject(String reason) {
        logger.info("Order command rejected: {}", reason);
        rejections.add(reason);
    }

    private CommandExecutor commands() {
        return engine.commands();
    }
}
