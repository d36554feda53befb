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

package org.elasticsoftware.deciders.views;

import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Deserializer;
import org.apache.kafka.common.serialization.Serializer;
import org.elasticsoftware.deciders.errors.ConcurrencyConflictException;
import org.elasticsoftware.deciders.protocol.PayloadEncoding;
import org.elasticsoftware.deciders.protocol.ProtocolRecord;
import org.elasticsoftware.deciders.protocol.ViewStateRecord;
import org.elasticsoftware.deciders.serialization.ProtocolRecordSerde;
import org.elasticsoftware.deciders.storage.Key;
import org.elasticsoftware.deciders.storage.KeyValueStore;
import org.elasticsoftware.deciders.storage.KeyValueStoreException;
import org.elasticsoftware.deciders.storage.KeyValueTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

public class KeyValueViewStateRepository implements ViewStateRepository {
    private static final Logger log = LoggerFactory.getLogger(KeyValueViewStateRepository.class);
    private static final Key VIEWS = Key.of("views");
    private final KeyValueStore store;
    private final String viewName;
    private final String topicName;
    private final Serializer<ProtocolRecord> serializer;
    private final Deserializer<ProtocolRecord> deserializer;

    public KeyValueViewStateRepository(KeyValueStore store, ProtocolRecordSerde serde, String viewName) {
        this.store = store;
        this.viewName = viewName;
        this.topicName = viewName + "-" + ProtocolRecordSerde.VIEW_STATE_SUFFIX;
        this.serializer = serde.serializer();
        this.deserializer = serde.deserializer();
    }

    @Override
    public String getViewName() {
        return viewName;
    }

    @Override
    public Optional<ViewStateRecord> fetch(String streamId) {
        try {
            return store.get(key(streamId)).map(bytes -> deserialize(streamId, bytes));
        } catch (KeyValueStoreException e) {
            throw new ViewStateRepositoryException("Problem reading view " + viewName + " for " + streamId, streamId, e);
        }
    }

    @Override
    public ViewStateRecord save(String streamId, byte[] state, String appliedEventId, ViewVersion priorVersion) {
        Key key = key(streamId);
        try (KeyValueTransaction transaction = store.beginTransaction()) {
            ViewVersion currentVersion = transaction.getForUpdate(key)
                    .map(bytes -> ViewStateRepository.versionOf(deserialize(streamId, bytes)))
                    .orElse(null);
            if (!Objects.equals(currentVersion, priorVersion)) {
                transaction.rollback();
                throw new ConcurrencyConflictException(streamId,
                        priorVersion != null ? priorVersion.value() : null,
                        currentVersion != null ? currentVersion.value() : null);
            }
            ViewStateRecord record = new ViewStateRecord(viewName, streamId, state, PayloadEncoding.JSON, appliedEventId);
            transaction.put(key, serializer.serialize(topicName, record));
            transaction.commit();
            log.trace("Saved view {} for {} at version {}", viewName, streamId, appliedEventId);
            return record;
        } catch (KeyValueStoreException | SerializationException e) {
            throw new ViewStateRepositoryException("Problem saving view " + viewName + " for " + streamId, streamId, e);
        }
    }

    private Key key(String streamId) {
        return VIEWS.append(viewName).append(streamId);
    }

    private ViewStateRecord deserialize(String streamId, byte[] bytes) {
        try {
            return (ViewStateRecord) deserializer.deserialize(topicName, bytes);
        } catch (SerializationException e) {
            throw new ViewStateRepositoryException("Problem deserializing view " + viewName + " for " + streamId, streamId, e);
        }
    }
}
