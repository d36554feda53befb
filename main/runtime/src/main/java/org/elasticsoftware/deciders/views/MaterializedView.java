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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.constraints.NotNull;
import org.apache.kafka.common.errors.SerializationException;
import org.elasticsoftware.deciders.decider.View;
import org.elasticsoftware.deciders.errors.ConcurrencyConflictException;
import org.elasticsoftware.deciders.events.DomainEvent;
import org.elasticsoftware.deciders.eventstore.EventMetadata;
import org.elasticsoftware.deciders.eventstore.StoredEvent;
import org.elasticsoftware.deciders.protocol.DomainEventRecord;
import org.elasticsoftware.deciders.protocol.ViewStateRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Keeps the state of a {@link View} up to date in a {@link ViewStateRepository}, one view instance per stream.
 * Events are applied one at a time. An event whose id is not newer than the last applied event id is skipped, so
 * redelivered events are harmless.
 *
 * @param <S> view state type
 * @param <E> event type
 */
public class MaterializedView<S, E extends DomainEvent> {
    private static final Logger log = LoggerFactory.getLogger(MaterializedView.class);
    private final View<S, E> view;
    private final ViewStateRepository repository;
    private final ObjectMapper objectMapper;
    private final JavaType stateType;
    private final Class<E> eventType;

    private MaterializedView(View<S, E> view,
                             ViewStateRepository repository,
                             ObjectMapper objectMapper,
                             JavaType stateType,
                             Class<E> eventType) {
        this.view = view;
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.stateType = stateType;
        this.eventType = eventType;
    }

    public String getName() {
        return repository.getViewName();
    }

    /**
     * Applies a stored event as read from the event feed.
     */
    public ProjectionResult handle(@NotNull DomainEventRecord eventRecord) {
        return handle(new StoredEvent<>(materialize(eventRecord), EventMetadata.from(eventRecord)));
    }

    public ProjectionResult handle(@NotNull StoredEvent<E> storedEvent) {
        String streamId = storedEvent.event().getStreamId();
        String eventId = storedEvent.metadata().eventId();
        Optional<ViewStateRecord> current = repository.fetch(streamId);
        if (current.isPresent() && eventId.compareTo(current.get().lastEventId()) <= 0) {
            log.trace("View {} for {} already at {}, skipping event {}",
                    getName(), streamId, current.get().lastEventId(), eventId);
            return ProjectionResult.DUPLICATE;
        }
        S state = current.map(record -> readState(streamId, record.payload())).orElseGet(view::initialState);
        S newState = view.evolve(state, storedEvent.event());
        try {
            repository.save(streamId,
                    writeState(streamId, newState),
                    eventId,
                    current.map(ViewStateRepository::versionOf).orElse(null));
            log.trace("Applied {} ({}) to view {} for {}", storedEvent.event().getKind(), eventId, getName(), streamId);
            return ProjectionResult.APPLIED;
        } catch (ConcurrencyConflictException e) {
            log.warn("View {} for {} was updated concurrently while applying event {}, dropping update: {}",
                    getName(), streamId, eventId, e.getMessage());
            return ProjectionResult.CONFLICT;
        }
    }

    public Optional<S> getState(@NotNull String streamId) {
        return repository.fetch(streamId).map(record -> readState(streamId, record.payload()));
    }

    private E materialize(DomainEventRecord eventRecord) {
        try {
            return objectMapper.readValue(eventRecord.payload(), eventType);
        } catch (IOException e) {
            throw new SerializationException("Unable to read " + eventRecord.name() + " event " + eventRecord.eventId(), e);
        }
    }

    private S readState(String streamId, byte[] payload) {
        try {
            return objectMapper.readValue(payload, stateType);
        } catch (IOException e) {
            throw new SerializationException("Unable to read state of view " + getName() + " for " + streamId, e);
        }
    }

    private byte[] writeState(String streamId, S state) {
        try {
            return objectMapper.writeValueAsBytes(state);
        } catch (IOException e) {
            throw new SerializationException("Unable to write state of view " + getName() + " for " + streamId, e);
        }
    }

    public static class Builder<S, E extends DomainEvent> {
        private View<S, E> view;
        private ViewStateRepository repository;
        private ObjectMapper objectMapper;
        private Class<S> stateClass;
        private TypeReference<S> stateTypeReference;
        private Class<E> eventType;

        public Builder<S, E> setView(View<S, E> view) {
            this.view = view;
            return this;
        }

        public Builder<S, E> setRepository(ViewStateRepository repository) {
            this.repository = repository;
            return this;
        }

        public Builder<S, E> setObjectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder<S, E> setStateType(Class<S> stateType) {
            this.stateClass = stateType;
            return this;
        }

        public Builder<S, E> setStateType(TypeReference<S> stateType) {
            this.stateTypeReference = stateType;
            return this;
        }

        public Builder<S, E> setEventType(Class<E> eventType) {
            this.eventType = eventType;
            return this;
        }

        public MaterializedView<S, E> build() {
            if (view == null || repository == null || objectMapper == null || eventType == null
                    || (stateClass == null && stateTypeReference == null)) {
                throw new IllegalStateException("view, repository, objectMapper, stateType and eventType are required");
            }
            JavaType stateType = stateClass != null
                    ? objectMapper.constructType(stateClass)
                    : objectMapper.getTypeFactory().constructType(stateTypeReference);
            return new MaterializedView<>(view, repository, objectMapper, stateType, eventType);
        }
    }
}
