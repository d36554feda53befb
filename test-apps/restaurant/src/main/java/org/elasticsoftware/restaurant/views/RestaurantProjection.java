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
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantCreatedEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantMenuChangedEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantMenuNotChangedEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantNotCreatedEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantOrderNotPlacedEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantOrderPlacedEvent;

/**
 * Projects restaurant events into the {@link RestaurantView} used for queries.
 */
public final class RestaurantProjection implements View<RestaurantView, RestaurantEvent> {
    @Override
    public RestaurantView evolve(RestaurantView state, RestaurantEvent event) {
        return event.accept(new RestaurantEvent.Visitor<RestaurantView>() {
            @Override
            public RestaurantView visit(RestaurantCreatedEvent event) {
                return new RestaurantView(event.id(), event.name(), event.menu());
            }

            @Override
            public RestaurantView visit(RestaurantNotCreatedEvent event) {
                return state;
            }

            @Override
            public RestaurantView visit(RestaurantMenuChangedEvent event) {
                return state != null ? new RestaurantView(state.restaurantId(), state.name(), event.menu()) : null;
            }

            @Override
            public RestaurantView visit(RestaurantMenuNotChangedEvent event) {
                return state;
            }

            @Override
            public RestaurantView visit(RestaurantOrderPlacedEvent event) {
                return state;
            }

            @Override
            public RestaurantView visit(RestaurantOrderNotPlacedEvent event) {
                return state;
            }
        });
    }

    @Override
    public RestaurantView initialState() {
        return null;
    }
}
