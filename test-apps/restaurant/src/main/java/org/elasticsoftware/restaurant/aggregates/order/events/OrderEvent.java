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

package org.elasticsoftware.restaurant.aggregates.order.events;

import org.elasticsoftware.deciders.decider.Either;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantEvent;
import org.elasticsoftware.restaurant.api.RestaurantOrderEvent;

public sealed interface OrderEvent extends RestaurantOrderEvent
        permits OrderCreatedEvent, OrderNotCreatedEvent, OrderPreparedEvent, OrderNotPreparedEvent {
    String id();

    @Override
    default String getStreamId() {
        return id();
    }

    @Override
    default String getDecider() {
        return "Order";
    }

    @Override
    default Either<RestaurantEvent, OrderEvent> route() {
        return Either.right(this);
    }

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visit(OrderCreatedEvent event);

        R visit(OrderNotCreatedEvent event);

        R visit(OrderPreparedEvent event);

        R visit(OrderNotPreparedEvent event);
    }
}
