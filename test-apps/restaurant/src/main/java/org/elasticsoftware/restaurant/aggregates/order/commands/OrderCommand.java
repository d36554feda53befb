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

package org.elasticsoftware.restaurant.aggregates.order.commands;

import org.elasticsoftware.deciders.decider.Either;
import org.elasticsoftware.restaurant.aggregates.restaurant.commands.RestaurantCommand;
import org.elasticsoftware.restaurant.api.RestaurantOrderCommand;

public sealed interface OrderCommand extends RestaurantOrderCommand
        permits CreateOrderCommand, MarkOrderAsPreparedCommand {
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
    default Either<RestaurantCommand, OrderCommand> route() {
        return Either.right(this);
    }

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visit(CreateOrderCommand command);

        R visit(MarkOrderAsPreparedCommand command);
    }
}
