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

package org.elasticsoftware.restaurant.aggregates.restaurant;

import org.elasticsoftware.deciders.decider.Decider;
import org.elasticsoftware.restaurant.aggregates.restaurant.commands.ChangeRestaurantMenuCommand;
import org.elasticsoftware.restaurant.aggregates.restaurant.commands.CreateRestaurantCommand;
import org.elasticsoftware.restaurant.aggregates.restaurant.commands.PlaceOrderCommand;
import org.elasticsoftware.restaurant.aggregates.restaurant.commands.RestaurantCommand;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantCreatedEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantMenuChangedEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantMenuNotChangedEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantNotCreatedEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantOrderNotPlacedEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantOrderPlacedEvent;
import org.elasticsoftware.restaurant.api.Reason;

import java.util.stream.Stream;

/**
 * Decides on restaurant commands. A restaurant can be created once, its menu can be changed and orders can be
 * placed at it once it exists. A rejected command results in an error event, never in an exception.
 */
public final class RestaurantDecider implements Decider<RestaurantCommand, RestaurantState, RestaurantEvent> {
    @Override
    public Stream<RestaurantEvent> decide(RestaurantCommand command, RestaurantState state) {
        return command.accept(new RestaurantCommand.Visitor<Stream<RestaurantEvent>>() {
            @Override
            public Stream<RestaurantEvent> visit(CreateRestaurantCommand command) {
                if (state == null) {
                    return Stream.of(new RestaurantCreatedEvent(command.id(), command.name(), command.menu()));
                }
                return Stream.of(new RestaurantNotCreatedEvent(command.id(), command.name(), command.menu(),
                        Reason.RESTAURANT_ALREADY_EXISTS));
            }

            @Override
            public Stream<RestaurantEvent> visit(ChangeRestaurantMenuCommand command) {
                if (exists(state, command.id())) {
                    return Stream.of(new RestaurantMenuChangedEvent(state.restaurantId(), command.menu()));
                }
                return Stream.of(new RestaurantMenuNotChangedEvent(command.id(), command.menu(),
                        Reason.RESTAURANT_DOES_NOT_EXIST));
            }

            @Override
            public Stream<RestaurantEvent> visit(PlaceOrderCommand command) {
                if (exists(state, command.id())) {
                    return Stream.of(new RestaurantOrderPlacedEvent(command.id(), command.orderId(), command.menuItems()));
                }
                return Stream.of(new RestaurantOrderNotPlacedEvent(command.id(), command.orderId(), command.menuItems(),
                        Reason.RESTAURANT_DOES_NOT_EXIST));
            }
        });
    }

    @Override
    public RestaurantState evolve(RestaurantState state, RestaurantEvent event) {
        return event.accept(new RestaurantEvent.Visitor<RestaurantState>() {
            @Override
            public RestaurantState visit(RestaurantCreatedEvent event) {
                return new RestaurantState(event.id(), event.name(), event.menu());
            }

            @Override
            public RestaurantState visit(RestaurantNotCreatedEvent event) {
                return state;
            }

            @Override
            public RestaurantState visit(RestaurantMenuChangedEvent event) {
                return state != null ? state.withMenu(event.menu()) : null;
            }

            @Override
            public RestaurantState visit(RestaurantMenuNotChangedEvent event) {
                return state;
            }

            @Override
            public RestaurantState visit(RestaurantOrderPlacedEvent event) {
                return state;
            }

            @Override
            public RestaurantState visit(RestaurantOrderNotPlacedEvent event) {
                return state;
            }
        });
    }

    @Override
    public RestaurantState initialState() {
        return null;
    }

    private static boolean exists(RestaurantState state, String restaurantId) {
        return state != null && state.restaurantId().equals(restaurantId);
    }
}
