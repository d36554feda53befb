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

import java.time.Duration;
import java.util.List;

/**
 * At least once delivery of stored events in append order. Entries that are not acknowledged are delivered again
 * by a later {@link #poll(Duration)}, also after a restart. A feed has a single consumer at a time.
 */
public interface EventFeed extends AutoCloseable {
    /**
     * Returns the next batch of unacknowledged entries, waiting up to {@code timeout} when there are none.
     */
    List<FeedEntry> poll(Duration timeout);

    /**
     * Marks the entry as processed. Entries must be acknowledged in the order they were polled.
     */
    void acknowledge(FeedEntry entry);

    @Override
    void close();
}
