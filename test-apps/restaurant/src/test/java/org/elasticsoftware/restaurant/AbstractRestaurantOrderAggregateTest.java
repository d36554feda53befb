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
import org.elasticsoftware.deciders.aggregate.EventSourcingAggregate;
import org.elasticsoftware.deciders.commands.CommandMetadata;
import org.elasticsoftware.deciders.decider.Pair;
import org.elasticsoftware.deciders.errors.ConcurrencyConflictException;
import org.elasticsoftware.deciders.eventstore.KeyValueEventRepository;
import org.elasticsoftware.deciders.eventstore.StoredEvent;
import org.elasticsoftware.deciders.feed.EventFeedProcessor;
import org.elasticsoftware.deciders.feed.KeyValueEventFeed;
import org.elasticsoftware.deciders.protocol.DomainEventRecord;
import org.elasticsoftware.deciders.serialization.ProtocolRecordSerde;
import org.elasticsoftware.deciders.storage.KeyValueStore;
import org.elasticsoftware.deciders.views.KeyValueViewStateRepository;
import org.elasticsoftware.deciders.views.MaterializedView;
import org.elasticsoftware.deciders.views.ProjectionResult;
import org.elasticsoftware.restaurant.aggregates.order.OrderState;
import org.elasticsoftware.restaurant.aggregates.order.commands.CreateOrderCommand;
import org.elasticsoftware.restaurant.aggregates.order.commands.MarkOrderAsPreparedCommand;
import org.elasticsoftware.restaurant.aggregates.order.events.OrderCreatedEvent;
import org.elasticsoftware.restaurant.aggregates.order.events.OrderPreparedEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.RestaurantState;
import org.elasticsoftware.restaurant.aggregates.restaurant.commands.ChangeRestaurantMenuCommand;
import org.elasticsoftware.restaurant.aggregates.restaurant.commands.CreateRestaurantCommand;
import org.elasticsoftware.restaurant.aggregates.restaurant.commands.PlaceOrderCommand;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantCreatedEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantMenuChangedEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantNotCreatedEvent;
import org.elasticsoftware.restaurant.aggregates.restaurant.events.RestaurantOrderPlacedEvent;
import org.elasticsoftware.restaurant.api.OrderStatus;
import org.elasticsoftware.restaurant.api.Reason;
import org.elasticsoftware.restaurant.api.RestaurantOrderCommand;
import org.elasticsoftware.restaurant.api.RestaurantOrderEvent;
import org.elasticsoftware.restaurant.views.OrderView;
import org.elasticsoftware.restaurant.views.RestaurantView;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

import static org.elasticsoftware.restaurant.RestaurantFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the restaurant application against a storage engine provided by the concrete test.
 */
abstract class AbstractRestaurantOrderAggregateTest {
    protected final ProtocolRecordSerde serde = new ProtocolRecordSerde();
    protected final ObjectMapper objectMapper = new ObjectMapper();
    protected KeyValueStore store;
    protected KeyValueEventRepository eventRepository;
    protected EventSourcingAggregate<RestaurantOrderCommand, Pair<RestaurantState, OrderState>, RestaurantOrderEvent> aggregate;

    protected abstract KeyValueStore createStore() throws Exception;

    @BeforeEach
    void setUp() throws Exception {
        store = createStore();
        eventRepository = new KeyValueEventRepository(store, serde, List.of(RestaurantOrderApplication.VIEW_NAME));
        aggregate = RestaurantOrderApplication.aggregate(eventRepository, objectMapper);
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    protected static CommandMetadata metadata() {
        return new CommandMetadata(UUID.randomUUID().toString());
    }

    protected MaterializedView<Pair<RestaurantView, OrderView>, RestaurantOrderEvent> materializedView() {
        return RestaurantOrderApplication.materializedView(
                new KeyValueViewStateRepository(store, serde, RestaurantOrderApplication.VIEW_NAME), objectMapper);
    }

    @Test
    void testCreateRestaurant() {
        CommandMetadata metadata = metadata();
        List<StoredEvent<RestaurantOrderEvent>> result =
                aggregate.handle(new CreateRestaurantCommand(RESTAURANT_ID, NAME, MENU), metadata);

        assertEquals(1, result.size());
        StoredEvent<RestaurantOrderEvent> stored = result.get(0);
        assertEquals(new RestaurantCreatedEvent(RESTAURANT_ID, NAME, MENU), stored.event());
        assertEquals(metadata.commandId(), stored.metadata().commandId());
        assertEquals(stored.metadata().eventId(), stored.metadata().streamVersion().value());
        assertEquals(stored.metadata().streamVersion(), eventRepository.currentVersion(RESTAURANT_ID).orElseThrow());

        DomainEventRecord record = eventRepository.fetch(RESTAURANT_ID).get(0);
        assertEquals("RestaurantCreatedEvent", record.name());
        assertEquals("Restaurant", record.decider());
        assertEquals(1, record.version());
    }

    @Test
    void testRejectedCommandIsRecordedAsErrorEvent() {
        aggregate.handle(new CreateRestaurantCommand(RESTAURANT_ID, NAME, MENU), metadata());
        List<StoredEvent<RestaurantOrderEvent>> result =
                aggregate.handle(new CreateRestaurantCommand(RESTAURANT_ID, NAME, ITALIAN_MENU), metadata());

        assertEquals(new RestaurantNotCreatedEvent(RESTAURANT_ID, NAME, ITALIAN_MENU, Reason.RESTAURANT_ALREADY_EXISTS),
                result.get(0).event());
        assertEquals(2, eventRepository.fetch(RESTAURANT_ID).size());
    }

    @Test
    void testRestaurantAndOrderLifecycle() {
        aggregate.handle(new CreateRestaurantCommand(RESTAURANT_ID, NAME, MENU), metadata());
        aggregate.handle(new ChangeRestaurantMenuCommand(RESTAURANT_ID, ITALIAN_MENU), metadata());
        List<StoredEvent<RestaurantOrderEvent>> placed =
                aggregate.handle(new PlaceOrderCommand(RESTAURANT_ID, ORDER_ID, ITALIAN_MENU.menuItems()), metadata());
        assertEquals(new RestaurantOrderPlacedEvent(RESTAURANT_ID, ORDER_ID, ITALIAN_MENU.menuItems()), placed.get(0).event());

        List<StoredEvent<RestaurantOrderEvent>> created =
                aggregate.handle(new CreateOrderCommand(ORDER_ID, RESTAURANT_ID, ITALIAN_MENU.menuItems()), metadata());
        assertEquals(new OrderCreatedEvent(ORDER_ID, RESTAURANT_ID, ITALIAN_MENU.menuItems()), created.get(0).event());
        List<StoredEvent<RestaurantOrderEvent>> prepared =
                aggregate.handle(new MarkOrderAsPreparedCommand(ORDER_ID), metadata());
        assertEquals(new OrderPreparedEvent(ORDER_ID), prepared.get(0).event());

        assertEquals(3, eventRepository.fetch(RESTAURANT_ID).size());
        assertEquals(2, eventRepository.fetch(ORDER_ID).size());
        assertTrue(created.get(0).metadata().eventId().compareTo(placed.get(0).metadata().eventId()) > 0);

        List<DomainEventRecord> all = eventRepository.fetchAll(null, 100);
        assertEquals(List.of("RestaurantCreatedEvent", "RestaurantMenuChangedEvent", "RestaurantOrderPlacedEvent",
                        "OrderCreatedEvent", "OrderPreparedEvent"),
                all.stream().map(DomainEventRecord::name).toList());
    }

    @Test
    void testConcurrentAppendFailsTheCommand() {
        aggregate.handle(new CreateRestaurantCommand(RESTAURANT_ID, NAME, MENU), metadata());
        AtomicBoolean interleave = new AtomicBoolean(true);
        // another writer changes the menu right after this command read the stream
        KeyValueEventRepository racingRepository =
                new KeyValueEventRepository(store, serde, List.of(RestaurantOrderApplication.VIEW_NAME)) {
                    @Override
                    public List<DomainEventRecord> fetch(String streamId) {
                        List<DomainEventRecord> history = super.fetch(streamId);
                        if (interleave.getAndSet(false)) {
                            aggregate.handle(new ChangeRestaurantMenuCommand(RESTAURANT_ID, ITALIAN_MENU), metadata());
                        }
                        return history;
                    }
                };
        var racing = RestaurantOrderApplication.aggregate(racingRepository, objectMapper);

        ConcurrencyConflictException exception = assertThrows(ConcurrencyConflictException.class,
                () -> racing.handle(new PlaceOrderCommand(RESTAURANT_ID, ORDER_ID, MENU_ITEMS), metadata()));
        assertEquals(RESTAURANT_ID, exception.getStreamId());

        List<DomainEventRecord> history = eventRepository.fetch(RESTAURANT_ID);
        assertEquals(List.of("RestaurantCreatedEvent", "RestaurantMenuChangedEvent"),
                history.stream().map(DomainEventRecord::name).toList());

        // a retry sees the new menu and succeeds
        assertEquals(new RestaurantOrderPlacedEvent(RESTAURANT_ID, ORDER_ID, MENU_ITEMS),
                racing.handle(new PlaceOrderCommand(RESTAURANT_ID, ORDER_ID, MENU_ITEMS), metadata()).get(0).event());
    }

    @Test
    void testConcurrentCommandsOnOneRestaurant() throws Exception {
        aggregate.handle(new CreateRestaurantCommand(RESTAURANT_ID, NAME, MENU), metadata());
        int writers = 4;
        int commandsPerWriter = 5;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        try {
            List<Callable<Integer>> tasks = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                int writer = w;
                tasks.add(() -> {
                    int conflicts = 0;
                    for (int i = 0; i < commandsPerWriter; i++) {
                        PlaceOrderCommand command =
                                new PlaceOrderCommand(RESTAURANT_ID, "o-" + writer + "-" + i, MENU_ITEMS);
                        while (true) {
                            try {
                                aggregate.handle(command, metadata());
                                break;
                            } catch (ConcurrencyConflictException e) {
                                conflicts++;
                            }
                        }
                    }
                    return conflicts;
                });
            }
            for (Future<Integer> future : executor.invokeAll(tasks, 60, TimeUnit.SECONDS)) {
                assertTrue(future.get() >= 0);
            }
        } finally {
            executor.shutdownNow();
        }

        List<DomainEventRecord> history = eventRepository.fetch(RESTAURANT_ID);
        assertEquals(1 + writers * commandsPerWriter, history.size());
        Set<String> orderIds = new HashSet<>();
        String previous = "";
        for (DomainEventRecord record : history) {
            assertTrue(record.eventId().compareTo(previous) > 0);
            assertEquals(record.eventId(), record.streamVersion());
            previous = record.eventId();
            if (record.name().equals("RestaurantOrderPlacedEvent")) {
                RestaurantOrderPlacedEvent event = objectMapper.readValue(record.payload(), RestaurantOrderPlacedEvent.class);
                orderIds.add(event.orderId());
            }
        }
        assertEquals(writers * commandsPerWriter, orderIds.size());
    }

    @Test
    void testViewFollowsTheFeed() throws Exception {
        MaterializedView<Pair<RestaurantView, OrderView>, RestaurantOrderEvent> view = materializedView();
        EventFeedProcessor processor = new EventFeedProcessor(RestaurantOrderApplication.VIEW_NAME,
                new KeyValueEventFeed(store, serde, RestaurantOrderApplication.VIEW_NAME, 10),
                view::handle,
                Duration.ofMillis(10),
                Duration.ofMillis(10));
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            executor.submit(processor);
            aggregate.handle(new CreateRestaurantCommand(RESTAURANT_ID, NAME, MENU), metadata());
            aggregate.handle(new ChangeRestaurantMenuCommand(RESTAURANT_ID, ITALIAN_MENU), metadata());
            aggregate.handle(new CreateOrderCommand(ORDER_ID, RESTAURANT_ID, MENU_ITEMS), metadata());
            aggregate.handle(new MarkOrderAsPreparedCommand(ORDER_ID), metadata());

            Pair<RestaurantView, OrderView> order = awaitState(view, ORDER_ID,
                    state -> state.second() != null && state.second().status() == OrderStatus.PREPARED);
            assertEquals(new OrderView(ORDER_ID, RESTAURANT_ID, MENU_ITEMS, OrderStatus.PREPARED), order.second());
            assertNull(order.first());
            Pair<RestaurantView, OrderView> restaurant = awaitState(view, RESTAURANT_ID,
                    state -> state.first() != null && state.first().menu().equals(ITALIAN_MENU));
            assertEquals(new RestaurantView(RESTAURANT_ID, NAME, ITALIAN_MENU), restaurant.first());
        } finally {
            processor.close();
            executor.shutdownNow();
        }
    }

    @Test
    void testReplayingTheLogIntoTheViewIsIdempotent() {
        MaterializedView<Pair<RestaurantView, OrderView>, RestaurantOrderEvent> view = materializedView();
        aggregate.handle(new CreateRestaurantCommand(RESTAURANT_ID, NAME, MENU), metadata());
        aggregate.handle(new ChangeRestaurantMenuCommand(RESTAURANT_ID, ITALIAN_MENU), metadata());

        List<DomainEventRecord> log = eventRepository.fetchAll(null, 100);
        for (DomainEventRecord record : log) {
            assertEquals(ProjectionResult.APPLIED, view.handle(record));
        }
        for (DomainEventRecord record : log) {
            assertEquals(ProjectionResult.DUPLICATE, view.handle(record));
        }
        assertEquals(new RestaurantView(RESTAURANT_ID, NAME, ITALIAN_MENU), view.getState(RESTAURANT_ID).orElseThrow().first());
    }

    private static Pair<RestaurantView, OrderView> awaitState(
            MaterializedView<Pair<RestaurantView, OrderView>, RestaurantOrderEvent> view,
            String streamId,
            Predicate<Pair<RestaurantView, OrderView>> condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (System.currentTimeMillis() < deadline) {
            var state = view.getState(streamId);
            if (state.isPresent() && condition.test(state.get())) {
                return state.get();
            }
            Thread.sleep(20);
        }
        return fail("View for " + streamId + " was not updated in time");
    }
}
