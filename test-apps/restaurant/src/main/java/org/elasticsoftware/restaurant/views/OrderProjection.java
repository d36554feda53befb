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

package org.elasticsoftware.restaurant.views;

import org.elasticsoftware.deciders.decider.View;
import org.elasticsoftware.restaurant.aggregates.order.events.OrderCreatedEvent;
import org.elasticsoftware.restaurant.aggregates.order.events.OrderEvent;
import org.elasticsoftware.restaurant.aggregates.order.events.OrderNotCreatedEvent;
import org.elasticsoftware.restaurant.aggregates.order.events.OrderNotPreparedEvent;
import org.elasticsoftware.restaurant.aggregates.order.events.OrderPreparedEvent;
import org.elasticsoftware.restaurant.api.OrderStatus;

public final class OrderProjection implements View<OrderView, OrderEvent> {
    @Override
    public OrderView evolve(OrderView state, OrderEvent event) {
        return event.accept(new OrderEvent.Visitor<OrderView>() {
            @Override
            public OrderView visit(OrderCreatedEvent event) {
                return new OrderView(event.id(), event.restaurantId(), event.menuItems(), OrderStatus.CREATED);
            }

            @Override
            public OrderView visit(OrderNotCreatedEvent event) {
                return state;
            }

            @Override
            public OrderView visit(OrderPreparedEvent event) {
                return state != null
                        ? new OrderView(state.orderId(), state.restaurantId(), state.menuItems(), OrderStatus.PREPARED)
                        : null;
            }

            @Override
            public OrderView visit(OrderNotPreparedEvent event) {
                return state;
            }
        });
    }

    @Override
    public OrderView initialState() {
        return null;
    }
}
