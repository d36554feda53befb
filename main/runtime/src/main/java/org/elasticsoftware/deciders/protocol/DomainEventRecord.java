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

package org.elasticsoftware.deciders.protocol;

import jakarta.annotation.Nullable;

/**
 * Stored form of a domain event. {@code eventId}, {@code commandId} and {@code streamVersion} are assigned by the
 * event repository on append and are {@code null} before that.
 */
public record DomainEventRecord(
        @Nullable String eventId,
        String streamId,
        String decider,
        String name,
        int version,
        byte[] payload,
        PayloadEncoding encoding,
        @Nullable String commandId,
        @Nullable String streamVersion,
        boolean finalEvent
) implements ProtocolRecord {
    public DomainEventRecord(String streamId, String decider, String name, int version, byte[] payload,
                             PayloadEncoding encoding, boolean finalEvent) {
        this(null, streamId, decider, name, version, payload, encoding, null, null, finalEvent);
    }

    public DomainEventRecord withStoreMetadata(String eventId, String commandId, String streamVersion) {
        return new DomainEventRecord(eventId, streamId, decider, name, version, payload, encoding,
                commandId, streamVersion, finalEvent);
    }
}
