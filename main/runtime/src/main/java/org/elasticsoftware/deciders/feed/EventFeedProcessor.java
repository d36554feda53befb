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

import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.errors.WakeupException;
import org.elasticsoftware.deciders.DecidersException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.elasticsoftware.deciders.feed.EventFeedProcessorState.*;

/**
 * Drives an {@link EventFeed} into an {@link EventFeedHandler}. Entries are acknowledged after the handler
 * returned. When the handler fails the rest of the batch is left unacknowledged, the processor backs off and polls
 * again, which redelivers the failed entry. Run it on its own thread and stop it with {@link #close()}. A new
 * processor on the same feed continues with the first unacknowledged entry.
 */
public class EventFeedProcessor implements Runnable, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(EventFeedProcessor.class);
    private final String name;
    private final EventFeed feed;
    private final EventFeedHandler handler;
    private final Duration pollInterval;
    private final Duration retryBackoff;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);
    private volatile EventFeedProcessorState processState;

    public EventFeedProcessor(String name,
                              EventFeed feed,
                              EventFeedHandler handler,
                              Duration pollInterval,
                              Duration retryBackoff) {
        this.name = name;
        this.feed = feed;
        this.handler = handler;
        this.pollInterval = pollInterval;
        this.retryBackoff = retryBackoff;
        this.processState = INITIALIZING;
    }

    public String getName() {
        return name;
    }

    @Override
    public void run() {
        try {
            logger.info("Starting EventFeedProcessor {}", name);
            if (processState == INITIALIZING) {
                processState = PROCESSING;
            }
            while (processState != SHUTTING_DOWN) {
                process();
            }
            logger.info("Shutting down EventFeedProcessor {}", name);
        } catch (Throwable t) {
            logger.error("Unexpected error in EventFeedProcessor {}", name, t);
        } finally {
            processState = SHUTTING_DOWN;
            try {
                feed.close();
            } catch (RuntimeException e) {
                logger.error("Error closing feed of EventFeedProcessor {}", name, e);
            }
        }
        logger.info("Finished Shutting down EventFeedProcessor {}", name);
        shutdownLatch.countDown();
    }

    @Override
    public void close() {
        processState = SHUTTING_DOWN;
        // wait maximum of 10 seconds for the shutdown to complete
        try {
            if (shutdownLatch.await(10, TimeUnit.SECONDS)) {
                logger.info("EventFeedProcessor={} has been shutdown", name);
            } else {
                logger.warn("EventFeedProcessor={} did not shutdown within 10 seconds", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void process() {
        List<FeedEntry> entries;
        try {
            entries = feed.poll(pollInterval);
        } catch (WakeupException ignore) {
            // non-fatal, the loop checks the state again
            return;
        } catch (InterruptException e) {
            // kafka restores the interrupt flag
            logger.info("EventFeedProcessor {} interrupted while polling", name);
            processState = SHUTTING_DOWN;
            return;
        } catch (KafkaException | DecidersException e) {
            // fatal
            logger.error("Fatal error while polling, shutting down EventFeedProcessor " + name, e);
            processState = SHUTTING_DOWN;
            return;
        }
        if (Thread.currentThread().isInterrupted()) {
            logger.info("EventFeedProcessor {} interrupted while polling", name);
            processState = SHUTTING_DOWN;
            return;
        }
        for (FeedEntry entry : entries) {
            if (processState == SHUTTING_DOWN) {
                return;
            }
            try {
                handler.handle(entry.record());
            } catch (InterruptedException e) {
                // the entry stays unacknowledged and is redelivered after a restart
                logger.info("EventFeedProcessor {} interrupted while handling event {}", name, entry.record().eventId());
                Thread.currentThread().interrupt();
                processState = SHUTTING_DOWN;
                return;
            } catch (Exception e) {
                logger.warn("EventFeedProcessor {} failed to handle {} event {} of stream {}, retrying in {}",
                        name, entry.record().name(), entry.record().eventId(), entry.record().streamId(), retryBackoff, e);
                backoff();
                return;
            }
            feed.acknowledge(entry);
        }
    }

    private void backoff() {
        try {
            Thread.sleep(retryBackoff.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            processState = SHUTTING_DOWN;
        }
    }

    public boolean isProcessing() {
        return processState == PROCESSING;
    }

    public EventFeedProcessorState getProcessState() {
        return processState;
    }
}
