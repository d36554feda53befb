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

public class EventFeedProcessorFactory {
    private final EventFeedFactory feedFactory;
    private final Duration pollInterval;
    private final Duration retryBackoff;

    public EventFeedProcessorFactory(EventFeedFactory feedFactory, Duration pollInterval, Duration retryBackoff) {
        this.feedFactory = feedFactory;
        this.pollInterval = pollInterval;
        this.retryBackoff = retryBackoff;
    }

    public EventFeedProcessor create(String subscription, EventFeedHandler handler) {
        return new EventFeedProcessor(subscription, feedFactory.create(subscription), handler, pollInterval, retryBackoff);
    }
}
