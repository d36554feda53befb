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

package org.elasticsoftware.deciders.aggregate;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.constraints.NotNull;
import org.apache.kafka.common.errors.SerializationException;
import org.elasticsoftware.deciders.commands.Command;
import org.elasticsoftware.deciders.commands.CommandMetadata;
import org.elasticsoftware.deciders.decider.Decider;
import org.elasticsoftware.deciders.errors.ConcurrencyConflictException;
import org.elasticsoftware.deciders.events.DomainEvent;
import org.elasticsoftware.deciders.eventstore.EventMetadata;
import org.elasticsoftware.deciders.eventstore.EventRepository;
import org.elasticsoftware.deciders.eventstore.StoredEvent;
import org.elasticsoftware.deciders.eventstore.StreamVersion;
import org.elasticsoftware.deciders.protocol.DomainEventRecord;
import org.elasticsoftware.deciders.protocol.PayloadEncoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Handles commands against an event sourced {@link Decider}: loads the stream of the command, folds it into the
 * current state, decides and appends the new events guarded by the version that was read. A concurrent append
 * to the same stream surfaces as {@link ConcurrencyConflictException}, retrying is up to the caller.
 *
 * @param <C> command type
 * @param <S> state type
 * @param <E> event type
 */
public class EventSourcingAggregate<C extends Command, S, E extends DomainEvent> {
    private static final Logger log = LoggerFactory.getLogger(EventSourcingAggregate.class);
    private final String name;
    private final Decider<C, S, E> decider;
    private final EventRepository eventRepository;
    private final ObjectMapper objectMapper;
    private final Class<E> eventType;

    private EventSourcingAggregate(String name,
                                   Decider<C, S, E> decider,
                                   EventRepository eventRepository,
                                   ObjectMapper objectMapper,
                                   Class<E> eventType) {
        this.name = name;
        this.decider = decider;
        this.eventRepository = eventRepository;
        this.objectMapper = objectMapper;
        this.eventType = eventType;
    }

    public String getName() {
        return name;
    }

    public List<StoredEvent<E>> handle(@NotNull C command, @NotNull CommandMetadata metadata) {
        final String streamId = command.getStreamId();
        CommandHandlingPhase phase = CommandHandlingPhase.IDLE;
        try {
            phase = transition(phase, CommandHandlingPhase.FETCHING, command, metadata);
            // the version is read before the history, a version that is older than the history fails the append
            StreamVersion version = eventRepository.currentVersion(streamId).orElse(null);
            S state = decider.initialState();
            for (DomainEventRecord eventRecord : eventRepository.fetch(streamId)) {
                state = decider.evolve(state, materialize(eventRecord));
            }
            phase = transition(phase, CommandHandlingPhase.DECIDING, command, metadata);
            List<E> events = decider.decide(command, state).toList();
            if (events.isEmpty()) {
                transition(phase, CommandHandlingPhase.DONE, command, metadata);
                return List.of();
            }
            for (E event : events) {
                if (!streamId.equals(event.getStreamId())) {
                    throw new IllegalStateException("Command " + command.getKind() + " for stream " + streamId +
                            " produced " + event.getKind() + " for stream " + event.getStreamId());
                }
            }
            phase = transition(phase, CommandHandlingPhase.APPENDING, command, metadata);
            List<DomainEventRecord> stored = eventRepository.append(streamId,
                    events.stream().map(this::toRecord).toList(),
                    metadata.commandId(),
                    version);
            transition(phase, CommandHandlingPhase.DONE, command, metadata);
            return stored.stream()
                    .map(eventRecord -> new StoredEvent<>(materialize(eventRecord), EventMetadata.from(eventRecord)))
                    .toList();
        } catch (ConcurrencyConflictException e) {
            transition(phase, CommandHandlingPhase.CONFLICT, command, metadata);
            throw e;
        } catch (RuntimeException e) {
            transition(phase, CommandHandlingPhase.FAILED, command, metadata);
            log.error("Exception while handling command {} with id {} for stream {}",
                    command.getKind(), metadata.commandId(), streamId, e);
            throw e;
        }
    }

    private CommandHandlingPhase transition(CommandHandlingPhase from,
                                            CommandHandlingPhase to,
                                            Command command,
                                            CommandMetadata metadata) {
        log.debug("{} {} -> {} for command {} with id {} on stream {}",
                name, from, to, command.getKind(), metadata.commandId(), command.getStreamId());
        return to;
    }

    private DomainEventRecord toRecord(E event) {
        return new DomainEventRecord(event.getStreamId(),
                event.getDecider(),
                event.getKind(),
                event.version(),
                serialize(event),
                PayloadEncoding.JSON,
                event.finalEvent());
    }

    private byte[] serialize(E event) throws SerializationException {
        try {
            return objectMapper.writeValueAsBytes(event);
        } catch (IOException e) {
            throw new SerializationException("Unable to serialize " + event.getKind(), e);
        }
    }

    private E materialize(DomainEventRecord eventRecord) throws SerializationException {
        try {
            return objectMapper.readValue(eventRecord.payload(), eventType);
        } catch (IOException e) {
            throw new SerializationException("Unable to read " + eventRecord.name() + " event " + eventRecord.eventId(), e);
        }
    }

    public static class Builder<C extends Command, S, E extends DomainEvent> {
        private String name;
        private Decider<C, S, E> decider;
        private EventRepository eventRepository;
        private ObjectMapper objectMapper;
        private Class<E> eventType;

        public Builder<C, S, E> setName(String name) {
            this.name = name;
            return this;
        }

        public Builder<C, S, E> setDecider(Decider<C, S, E> decider) {
            this.decider = decider;
            return this;
        }

        public Builder<C, S, E> setEventRepository(EventRepository eventRepository) {
            this.eventRepository = eventRepository;
            return this;
        }

        public Builder<C, S, E> setObjectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public Builder<C, S, E> setEventType(Class<E> eventType) {
            this.eventType = eventType;
            return this;
        }

        public EventSourcingAggregate<C, S, E> build() {
            if (decider == null || eventRepository == null || objectMapper == null || eventType == null) {
                throw new IllegalStateException("decider, eventRepository, objectMapper and eventType are required");
            }
            return new EventSourcingAggregate<>(name != null ? name : eventType.getSimpleName(),
                    decider, eventRepository, objectMapper, eventType);
        }
    }
}
