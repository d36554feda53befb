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

package org.elasticsoftware.deciders.feed;

import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Deserializer;
import org.elasticsoftware.deciders.eventstore.EventStoreKeys;
import org.elasticsoftware.deciders.protocol.DomainEventRecord;
import org.elasticsoftware.deciders.protocol.ProtocolRecord;
import org.elasticsoftware.deciders.serialization.ProtocolRecordSerde;
import org.elasticsoftware.deciders.storage.Key;
import org.elasticsoftware.deciders.storage.KeyValueEntry;
import org.elasticsoftware.deciders.storage.KeyValueStore;
import org.elasticsoftware.deciders.storage.KeyValueTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the feed entries the event repository writes for one subscription. Acknowledging deletes the entry, the
 * remaining entries are the unprocessed backlog.
 */
public class KeyValueEventFeed implements EventFeed {
    private static final Logger log = LoggerFactory.getLogger(KeyValueEventFeed.class);
    private static final String TOPIC = "Feed-" + ProtocolRecordSerde.DOMAIN_EVENTS_SUFFIX;
    private final KeyValueStore store;
    private final Deserializer<ProtocolRecord> deserializer;
    private final String subscription;
    private final Key feedKey;
    private final int batchSize;

    public KeyValueEventFeed(KeyValueStore store, ProtocolRecordSerde serde, String subscription, int batchSize) {
        this.store = store;
        this.deserializer = serde.deserializer();
        this.subscription = subscription;
        this.feedKey = EventStoreKeys.feed(subscription);
        this.batchSize = batchSize;
    }

    public String getSubscription() {
        return subscription;
    }

    @Override
    public List<FeedEntry> poll(Duration timeout) {
        List<KeyValueEntry> entries = store.scan(feedKey, null, batchSize);
        if (entries.isEmpty()) {
            try {
                Thread.sleep(timeout.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return List.of();
        }
        List<FeedEntry> feedEntries = new ArrayList<>(entries.size());
        for (KeyValueEntry entry : entries) {
            try {
                feedEntries.add(new FeedEntry(entry.key().lastPart(),
                        (DomainEventRecord) deserializer.deserialize(TOPIC, entry.value())));
            } catch (SerializationException e) {
                throw new SerializationException("Unreadable entry " + entry.key() + " in feed " + subscription, e);
            }
        }
        log.trace("Polled {} entries from feed {}", feedEntries.size(), subscription);
        return feedEntries;
    }

    @Override
    public void acknowledge(FeedEntry entry) {
        try (KeyValueTransaction transaction = store.beginTransaction()) {
            transaction.delete(EventStoreKeys.feedEntry(subscription, entry.id()));
            transaction.commit();
        }
    }

    /**
     * Number of unacknowledged entries.
     */
    public int backlog() {
        return store.scan(feedKey).size();
    }

    @Override
    public void close() {
        log.debug("Closing feed {}", subscription);
    }
}
