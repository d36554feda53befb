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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.deciders.DecidersRuntimeConfiguration;
import org.elasticsoftware.deciders.aggregate.EventSourcingAggregate;
import org.elasticsoftware.deciders.decider.Pair;
import org.elasticsoftware.deciders.eventstore.EventRepository;
import org.elasticsoftware.deciders.feed.EventFeedProcessorFactory;
import org.elasticsoftware.deciders.views.MaterializedView;
import org.elasticsoftware.deciders.views.ViewStateRepositoryFactory;
import org.elasticsoftware.restaurant.aggregates.order.OrderState;
import org.elasticsoftware.restaurant.aggregates.restaurant.RestaurantState;
import org.elasticsoftware.restaurant.api.RestaurantOrderCommand;
import org.elasticsoftware.restaurant.api.RestaurantOrderEvent;
import org.elasticsoftware.restaurant.views.OrderView;
import org.elasticsoftware.restaurant.views.RestaurantView;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.PropertySource;

@Configuration
@Import(DecidersRuntimeConfiguration.class)
@PropertySource("classpath:restaurant.properties")
public class RestaurantOrderConfiguration {
    @Bean(name = "restaurantOrderAggregate")
    public EventSourcingAggregate<RestaurantOrderCommand, Pair<RestaurantState, OrderState>, RestaurantOrderEvent>
    restaurantOrderAggregate(@Qualifier("decidersEventRepository") EventRepository eventRepository,
                             @Qualifier("decidersObjectMapper") ObjectMapper objectMapper) {
        return RestaurantOrderApplication.aggregate(eventRepository, objectMapper);
    }

    @Bean(name = "restaurantOrderView")
    public MaterializedView<Pair<RestaurantView, OrderView>, RestaurantOrderEvent>
    restaurantOrderView(@Qualifier("decidersViewStateRepositoryFactory") ViewStateRepositoryFactory repositoryFactory,
                        @Qualifier("decidersObjectMapper") ObjectMapper objectMapper) {
        return RestaurantOrderApplication.materializedView(
                repositoryFactory.create(RestaurantOrderApplication.VIEW_NAME), objectMapper);
    }

    @Bean(name = "restaurantOrderViewController", initMethod = "start", destroyMethod = "close")
    public RestaurantOrderViewController restaurantOrderViewController(
            @Qualifier("decidersEventFeedProcessorFactory") EventFeedProcessorFactory processorFactory,
            @Qualifier("restaurantOrderView") MaterializedView<Pair<RestaurantView, OrderView>, RestaurantOrderEvent> view) {
        return new RestaurantOrderViewController(
                processorFactory.create(RestaurantOrderApplication.VIEW_NAME, view::handle));
    }
}
