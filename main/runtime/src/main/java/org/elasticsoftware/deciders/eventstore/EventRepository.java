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

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.deciders.errors.ConcurrencyConflictException;
import org.elasticsoftware.deciders.protocol.DomainEventRecord;

import java.util.List;
import java.util.Optional;

public interface EventRepository {
    /**
     * All events of the stream in append order, empty if the stream was never written.
     */
    List<DomainEventRecord> fetch(@NotNull String streamId);

    Optional<StreamVersion> currentVersion(@NotNull String streamId);

    /**
     * Appends the events atomically if the stream is still at {@code expectedVersion}, {@code null} meaning the
     * stream must not exist yet.
     *
     * @return the stored events with their assigned event id, command id and new stream version
     * @throws ConcurrencyConflictException when the stream moved on, nothing is written in that case
     * @throws EventStoreException when the storage failed
     */
    List<DomainEventRecord> append(@NotNull String streamId,
                                   @NotNull List<DomainEventRecord> events,
                                   @NotNull String commandId,
                                   @Nullable StreamVersion expectedVersion);

    /**
     * Reads the global event log in event id order, starting after {@code afterEventId} when given.
     */
    List<DomainEventRecord> fetchAll(@Nullable String afterEventId, int limit);
}
