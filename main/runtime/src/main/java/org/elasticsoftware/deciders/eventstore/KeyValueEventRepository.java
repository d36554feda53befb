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

package org.elasticsoftware.deciders.eventstore;

import com.google.common.base.Charsets;
import com.google.common.primitives.Longs;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Deserializer;
import org.apache.kafka.common.serialization.Serializer;
import org.elasticsoftware.deciders.errors.ConcurrencyConflictException;
import org.elasticsoftware.deciders.protocol.DomainEventRecord;
import org.elasticsoftware.deciders.protocol.ProtocolRecord;
import org.elasticsoftware.deciders.serialization.ProtocolRecordSerde;
import org.elasticsoftware.deciders.storage.Key;
import org.elasticsoftware.deciders.storage.KeyValueEntry;
import org.elasticsoftware.deciders.storage.KeyValueStore;
import org.elasticsoftware.deciders.storage.KeyValueStoreException;
import org.elasticsoftware.deciders.storage.KeyValueTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link EventRepository} on a {@link KeyValueStore}. Every append runs in one transaction that locks the stream
 * version and the global sequence, so ids are handed out in commit order. Each appended event is also written
 * to the feed of every configured subscription.
 */
public class KeyValueEventRepository implements EventRepository {
    private static final Logger log = LoggerFactory.getLogger(KeyValueEventRepository.class);
    private static final String TOPIC = "Store-" + ProtocolRecordSerde.DOMAIN_EVENTS_SUFFIX;
    private final KeyValueStore store;
    private final Serializer<ProtocolRecord> serializer;
    private final Deserializer<ProtocolRecord> deserializer;
    private final List<String> subscriptions;

    public KeyValueEventRepository(KeyValueStore store, ProtocolRecordSerde serde, List<String> subscriptions) {
        this.store = store;
        this.serializer = serde.serializer();
        this.deserializer = serde.deserializer();
        this.subscriptions = List.copyOf(subscriptions);
    }

    @Override
    public List<DomainEventRecord> fetch(String streamId) {
        try {
            return store.scan(EventStoreKeys.streamEvents(streamId)).stream()
                    .map(entry -> deserialize(streamId, entry.value()))
                    .toList();
        } catch (KeyValueStoreException e) {
            throw new EventStoreException("Problem fetching events of stream " + streamId, streamId, e);
        }
    }

    @Override
    public Optional<StreamVersion> currentVersion(String streamId) {
        try {
            return store.get(EventStoreKeys.streamVersion(streamId)).map(this::toStreamVersion);
        } catch (KeyValueStoreException e) {
            throw new EventStoreException("Problem reading version of stream " + streamId, streamId, e);
        }
    }

    @Override
    public List<DomainEventRecord> append(String streamId,
                                          List<DomainEventRecord> events,
                                          String commandId,
                                          StreamVersion expectedVersion) {
        if (events.isEmpty()) {
            return List.of();
        }
        for (DomainEventRecord event : events) {
            if (!streamId.equals(event.streamId())) {
                throw new IllegalArgumentException("Event " + event.name() + " targets stream " + event.streamId() +
                        " and cannot be appended to stream " + streamId);
            }
        }
        List<Key> writtenKeys = new ArrayList<>(events.size());
        try (KeyValueTransaction transaction = store.beginTransaction()) {
            StreamVersion currentVersion = transaction.getForUpdate(EventStoreKeys.streamVersion(streamId))
                    .map(this::toStreamVersion)
                    .orElse(null);
            if (!Objects.equals(currentVersion, expectedVersion)) {
                transaction.rollback();
                log.debug("Version mismatch on stream {}: expected {} but found {}", streamId, expectedVersion, currentVersion);
                throw new ConcurrencyConflictException(streamId,
                        expectedVersion != null ? expectedVersion.value() : null,
                        currentVersion != null ? currentVersion.value() : null);
            }
            long sequence = transaction.getForUpdate(EventStoreKeys.SEQUENCE).map(Longs::fromByteArray).orElse(0L);
            StreamVersion newVersion = new StreamVersion(EventStoreKeys.formatEventId(sequence + events.size()));
            for (DomainEventRecord event : events) {
                sequence++;
                String eventId = EventStoreKeys.formatEventId(sequence);
                byte[] value = serializer.serialize(TOPIC, event.withStoreMetadata(eventId, commandId, newVersion.value()));
                Key streamEventKey = EventStoreKeys.streamEvent(streamId, eventId);
                transaction.put(streamEventKey, value);
                transaction.put(EventStoreKeys.eventLogEntry(eventId), value);
                for (String subscription : subscriptions) {
                    transaction.put(EventStoreKeys.feedEntry(subscription, eventId), value);
                }
                writtenKeys.add(streamEventKey);
            }
            transaction.put(EventStoreKeys.SEQUENCE, Longs.toByteArray(sequence));
            transaction.put(EventStoreKeys.streamVersion(streamId), newVersion.value().getBytes(Charsets.UTF_8));
            transaction.commit();
            log.trace("Appended {} events to stream {}, new version {}", events.size(), streamId, newVersion);
        } catch (KeyValueStoreException | SerializationException e) {
            throw new EventStoreException("Error appending events to stream " + streamId, streamId, e);
        }
        return reread(streamId, writtenKeys);
    }

    private List<DomainEventRecord> reread(String streamId, List<Key> writtenKeys) {
        List<DomainEventRecord> stored = new ArrayList<>(writtenKeys.size());
        for (Key key : writtenKeys) {
            byte[] value;
            try {
                value = store.get(key).orElse(null);
            } catch (KeyValueStoreException e) {
                throw new EventStoreException("Problem reading back appended event " + key.lastPart(), streamId, e);
            }
            if (value == null) {
                throw new EventStoreException("Failed to save event properly. Event not found.", streamId);
            }
            stored.add(deserialize(streamId, value));
        }
        return stored;
    }

    @Override
    public List<DomainEventRecord> fetchAll(String afterEventId, int limit) {
        Key startAfter = afterEventId != null ? EventStoreKeys.eventLogEntry(afterEventId) : null;
        try {
            List<KeyValueEntry> entries = store.scan(EventStoreKeys.EVENT_LOG, startAfter, limit);
            return entries.stream().map(entry -> deserialize(null, entry.value())).toList();
        } catch (KeyValueStoreException e) {
            throw new EventStoreException("Problem reading the event log", null, e);
        }
    }

    private StreamVersion toStreamVersion(byte[] bytes) {
        return new StreamVersion(new String(bytes, Charsets.UTF_8));
    }

    private DomainEventRecord deserialize(String streamId, byte[] value) {
        try {
            return (DomainEventRecord) deserializer.deserialize(TOPIC, value);
        } catch (SerializationException e) {
            throw new EventStoreException("Problem deserializing stored event", streamId, e);
        }
    }
}
