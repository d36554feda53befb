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

package org.elasticsoftware.restaurant.api;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import org.elasticsoftware.deciders.decider.Either;
import org.elasticsoftware.deciders.events.DomainEvent;
import org.elasticsoftware.restaurant.aggregates.order.events.OrderCreatedEvent;
import org.elasticsoftware.restaurant.aggregates.order.events.OrderEvent;
import org.elasticsoftware.restaurant.aggregates.order.events.OrderNotCreatedEvent;
import org.elasticsoftware.restaurant.aggregates.order.events.OrderNotPreparedEvent;
import org.elasticsoftware.restaurant.aggregates.order.events.OrderPreparedEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantCreatedEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantMenuChangedEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantMenuNotChangedEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantNotCreatedEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantOrderNotPlacedEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantOrderPlacedEvent;

@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RestaurantCreatedEvent.class, name = "RestaurantCreatedEvent"),
        @JsonSubTypes.Type(value = RestaurantNotCreatedEvent.class, name = "RestaurantNotCreatedEvent"),
        @JsonSubTypes.Type(value = RestaurantMenuChangedEvent.class, name = "RestaurantMenuChangedEvent"),
        @JsonSubTypes.Type(value = RestaurantMenuNotChangedEvent.class, name = "RestaurantMenuNotChangedEvent"),
        @JsonSubTypes.Type(value = RestaurantOrderPlacedEvent.class, name = "RestaurantOrderPlacedEvent"),
        @JsonSubTypes.Type(value = RestaurantOrderNotPlacedEvent.class, name = "RestaurantOrderNotPlacedEvent"),
        @JsonSubTypes.Type(value = OrderCreatedEvent.class, name = "OrderCreatedEvent"),
        @JsonSubTypes.Type(value = OrderNotCreatedEvent.class, name = "OrderNotCreatedEvent"),
        @JsonSubTypes.Type(value = OrderPreparedEvent.class, name = "OrderPreparedEvent"),
        @JsonSubTypes.Type(value = OrderNotPreparedEvent.class, name = "OrderNotPreparedEvent")
})
public interface RestaurantOrderEvent extends DomainEvent {
    Either<RestaurantEvent, OrderEvent> route();
}
