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
import org.elasticsoftware.deciders.commands.Command;
import org.elasticsoftware.deciders.decider.Either;
import org.elasticsoftware.restaurant.aggregates.order.commands.CreateOrderCommand;
import org.elasticsoftware.restaurant.aggregates.order.commands.MarkOrderAsPreparedCommand;
import org.elasticsoftware.restaurant.aggregates.order.commands.OrderCommand;
import org.elasticsoftware.restaurant.aggregates.restaurant.commands.ChangeRestaurantMenuCommand;
import org.elasticsoftware.restaurant.aggregates.restaurant.commands.CreateRestaurantCommand;
import org.elasticsoftware.restaurant.aggregates.restaurant.commands.PlaceOrderCommand;
import org.elasticsoftware.restaurant.aggregates.restaurant.commands.RestaurantCommand;

/**
 * Any command the restaurant application accepts. The {@code kind} property selects the concrete command.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CreateRestaurantCommand.class, name = "CreateRestaurantCommand"),
        @JsonSubTypes.Type(value = ChangeRestaurantMenuCommand.class, name = "ChangeRestaurantMenuCommand"),
        @JsonSubTypes.Type(value = PlaceOrderCommand.class, name = "PlaceOrderCommand"),
        @JsonSubTypes.Type(value = CreateOrderCommand.class, name = "CreateOrderCommand"),
        @JsonSubTypes.Type(value = MarkOrderAsPreparedCommand.class, name = "MarkOrderAsPreparedCommand")
})
public interface RestaurantOrderCommand extends Command {
    /**
     * Selects the sub domain that handles this command.
     */
    Either<RestaurantCommand, OrderCommand> route();
}
