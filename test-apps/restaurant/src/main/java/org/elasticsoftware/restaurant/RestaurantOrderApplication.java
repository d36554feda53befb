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

package org.elasticsoftware.restaurant;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.deciders.aggregate.EventSourcingAggregate;
import org.elasticsoftware.deciders.decider.Decider;
import org.elasticsoftware.deciders.decider.Deciders;
import org.elasticsoftware.deciders.decider.Either;
import org.elasticsoftware.deciders.decider.Pair;
import org.elasticsoftware.deciders.decider.View;
import org.elasticsoftware.deciders.decider.Views;
import org.elasticsoftware.deciders.eventstore.EventRepository;
import org.elasticsoftware.deciders.views.MaterializedView;
import org.elasticsoftware.deciders.views.ViewStateRepository;
import org.elasticsoftware.restaurant.aggregates.order.OrderDecider;
import org.elasticsoftware.restaurant.aggregates.order.OrderState;
import org.elasticsoftware.restaurant.aggregates.order.events.OrderEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.RestaurantDecider;
import org.elasticsoftware.restaurant.aggregates.restaurant.RestaurantState;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantEvent;
import org.elasticsoftware.restaurant.api.RestaurantOrderCommand;
import org.elasticsoftware.restaurant.api.RestaurantOrderEvent;
import org.elasticsoftware.restaurant.views.OrderProjection;
import org.elasticsoftware.restaurant.views.OrderView;
import org.elasticsoftware.restaurant.views.RestaurantProjection;
import org.elasticsoftware.restaurant.views.RestaurantView;

/**
 * Combines the restaurant and order sub domains into one decider and one view that speak the application's
 * command and event types.
 */
public final class RestaurantOrderApplication {
    public static final String NAME = "RestaurantOrder";
    public static final String VIEW_NAME = "RestaurantOrderView";

    private RestaurantOrderApplication() {
    }

    public static Decider<RestaurantOrderCommand, Pair<RestaurantState, OrderState>, RestaurantOrderEvent> decider() {
        return Deciders.combine(new RestaurantDecider(), new OrderDecider())
                .<RestaurantOrderCommand>mapOnCommand(RestaurantOrderCommand::route)
                .<RestaurantOrderEvent>dimapOnEvent(RestaurantOrderEvent::route, RestaurantOrderApplication::merge);
    }

    /**
     * Only one side of the pair is filled for a given stream: restaurant streams carry a {@link RestaurantView},
     * order streams an {@link OrderView}.
     */
    public static View<Pair<RestaurantView, OrderView>, RestaurantOrderEvent> view() {
        return Views.combine(new RestaurantProjection(), new OrderProjection())
                .<RestaurantOrderEvent>dimapOnEvent(RestaurantOrderEvent::route);
    }

    public static EventSourcingAggregate<RestaurantOrderCommand, Pair<RestaurantState, OrderState>, RestaurantOrderEvent>
    aggregate(EventRepository eventRepository, ObjectMapper objectMapper) {
        return new EventSourcingAggregate.Builder<RestaurantOrderCommand, Pair<RestaurantState, OrderState>, RestaurantOrderEvent>()
                .setName(NAME)
                .setDecider(decider())
                .setEventRepository(eventRepository)
                .setObjectMapper(objectMapper)
                .setEventType(RestaurantOrderEvent.class)
                .build();
    }

    public static MaterializedView<Pair<RestaurantView, OrderView>, RestaurantOrderEvent>
    materializedView(ViewStateRepository repository, ObjectMapper objectMapper) {
        return new MaterializedView.Builder<Pair<RestaurantView, OrderView>, RestaurantOrderEvent>()
                .setView(view())
                .setRepository(repository)
                .setObjectMapper(objectMapper)
                .setStateType(new TypeReference<Pair<RestaurantView, OrderView>>() {
                })
                .setEventType(RestaurantOrderEvent.class)
                .build();
    }

    private static RestaurantOrderEvent merge(Either<RestaurantEvent, OrderEvent> event) {
        return event.<RestaurantOrderEvent>fold(restaurantEvent -> restaurantEvent, orderEvent -> orderEvent);
    }
}
