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

import org.elasticsoftware.deciders.storage.Key;

/**
 * Key layout of the event store.
 */
public final class EventStoreKeys {
    public static final Key SEQUENCE = Key.of("sequence");
    public static final Key EVENT_LOG = Key.of("eventLog");
    public static final Key FEED = Key.of("feed");
    private static final Key STREAM_EVENTS = Key.of("events");
    private static final Key STREAM_VERSIONS = Key.of("streamVersion");
    // 19 digits hold every positive long, so lexical order equals numeric order
    private static final String EVENT_ID_FORMAT = "%019d";

    private EventStoreKeys() {
    }

    public static Key streamEvents(String streamId) {
        return STREAM_EVENTS.append(streamId);
    }

    public static Key streamEvent(String streamId, String eventId) {
        return streamEvents(streamId).append(eventId);
    }

    public static Key streamVersion(String streamId) {
        return STREAM_VERSIONS.append(streamId);
    }

    public static Key eventLogEntry(String eventId) {
        return EVENT_LOG.append(eventId);
    }

    public static Key feed(String subscription) {
        return FEED.append(subscription);
    }

    public static Key feedEntry(String subscription, String eventId) {
        return feed(subscription).append(eventId);
    }

    public static String formatEventId(long sequence) {
        return String.format(EVENT_ID_FORMAT, sequence);
    }
}
