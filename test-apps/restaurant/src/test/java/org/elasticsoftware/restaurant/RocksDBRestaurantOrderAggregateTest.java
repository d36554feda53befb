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

import org.elasticsoftware.deciders.eventstore.KeyValueEventRepository;
import org.elasticsoftware.deciders.storage.KeyValueStore;
import org.elasticsoftware.deciders.storage.RocksDBKeyValueStore;
import org.elasticsoftware.restaurant.aggregates.restaurant.RestaurantState;
import org.elasticsoftware.restaurant.aggregates.restaurant.commands.ChangeRestaurantMenuCommand;
import org.elasticsoftware.restaurant.aggregates.restaurant.commands.CreateRestaurantCommand;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantMenuChangedEvent;
import org.elasticsoftware.restaurant.api.RestaurantOrderEvent;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

import static org.elasticsoftware.restaurant.RestaurantFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class RocksDBRestaurantOrderAggregateTest extends AbstractRestaurantOrderAggregateTest {
    @TempDir
    Path tempDir;

    @Override
    protected KeyValueStore createStore() {
        return new RocksDBKeyValueStore(tempDir.toString(), "restaurant");
    }

    @Test
    void testHistorySurvivesReopen() throws Exception {
        aggregate.handle(new CreateRestaurantCommand(RESTAURANT_ID, NAME, MENU), metadata());
        store.close();

        store = createStore();
        eventRepository = new KeyValueEventRepository(store, serde, List.of(RestaurantOrderApplication.VIEW_NAME));
        aggregate = RestaurantOrderApplication.aggregate(eventRepository, objectMapper);

        assertEquals(new RestaurantMenuChangedEvent(RESTAURANT_ID, ITALIAN_MENU),
                aggregate.handle(new ChangeRestaurantMenuCommand(RESTAURANT_ID, ITALIAN_MENU), metadata()).get(0).event());

        List<RestaurantOrderEvent> history = eventRepository.fetch(RESTAURANT_ID).stream()
                .map(record -> {
                    try {
                        return objectMapper.readValue(record.payload(), RestaurantOrderEvent.class);
                    } catch (IOException e) {
                        throw new IllegalStateException(e);
                    }
                })
                .toList();
        assertEquals(new RestaurantState(RESTAURANT_ID, NAME, ITALIAN_MENU),
                RestaurantOrderApplication.decider().fold(history).first());
    }
}
