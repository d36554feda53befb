/*
 * Copyright 2022 - 2025 The Original Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 *     you may not use this file except in compliance with the License.
 *     You may obtain a copy of the License at
 *
 *           http://www.apache.org/licenses/LICENSE-2.0
 *
 *     Unless required by applicable law or agreed to in writing, software
 *     distributed under the License is distributed on an "AS IS" BASIS,
 *     WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *     See the License for the specific language governing permissions and
 *     limitations under the License.
 *
 */

package org.elasticsoftware.restaurant.aggregates.order;

import org.elasticsoftware.deciders.decider.Decider;
import org.elasticsoftware.restaurant.aggregates.order.commands.CreateOrderCommand;
import org.elasticsoftware.restaurant.aggregates.order.commands.MarkOrderAsPreparedCommand;
import org.elasticsoftware.restaurant.aggregates.order.commands.OrderCommand;
import org.elasticsoftware.restaurant.aggregates.order.events.OrderCreatedEvent;
import org.elasticsoftware.restaurant.aggregates.order.events.OrderEvent;
import org.elasticsoftware.restaurant.aggregates.order.events.OrderNotCreatedEvent;
import org.elasticsoftware.restaurant.aggregates.order.events.OrderNotPreparedEvent;
import org.elasticsoftware.restaurant.aggregates.order.events.OrderPreparedEvent;
import org.elasticsoftware.restaurant.api.OrderStatus;
import org.elasticsoftware.restaurant.api.Reason;

import java.util.stream.Stream;

public final class OrderDecider implements Decider<OrderCommand, OrderState, OrderEvent> {
    @Override
    public Stream<OrderEvent> decide(OrderCommand command, OrderState state) {
        return command.accept(new OrderCommand.Visitor<Stream<OrderEvent>>() {
            @Override
            public Stream<OrderEvent> visit(CreateOrderCommand command) {
                if (state == null) {
                    return Stream.of(new OrderCreatedEvent(command.id(), command.restaurantId(), command.menuItems()));
                }
                return Stream.of(new OrderNotCreatedEvent(command.id(), command.restaurantId(), command.menuItems(),
                        Reason.ORDER_ALREADY_EXISTS));
            }

            @Override
            public Stream<OrderEvent> visit(MarkOrderAsPreparedCommand command) {
                if (state != null && state.orderId().equals(command.id())) {
                    return Stream.of(new OrderPreparedEvent(state.orderId()));
                }
                return Stream.of(new OrderNotPreparedEvent(command.id(), Reason.ORDER_DOES_NOT_EXIST));
            }
        });
    }

    @Override
    public OrderState evolve(OrderState state, OrderEvent event) {
        return event.accept(new OrderEvent.Visitor<OrderState>() {
            @Override
            public OrderState visit(OrderCreatedEvent event) {
                return new OrderState(event.id(), event.restaurantId(), event.menuItems(), OrderStatus.CREATED);
            }

            @Override
            public OrderState visit(OrderNotCreatedEvent event) {
                return state;
            }

            @Override
            public OrderState visit(OrderPreparedEvent event) {
                return state != null ? state.withStatus(OrderStatus.PREPARED) : null;
            }

            @Override
            public OrderState visit(OrderNotPreparedEvent event) {
                return state;
            }
        });
    }

    @Override
    public OrderState initialState() {
        return null;
    }
}
