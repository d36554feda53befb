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

package org.elasticsoftware.restaurant;

import org.elasticsoftware.deciders.feed.EventFeedProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs the {@link EventFeedProcessor} that keeps the restaurant order view up to date on a dedicated thread.
 */
public class RestaurantOrderViewController implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RestaurantOrderViewController.class);
    private final EventFeedProcessor processor;
    private final ExecutorService executorService;

    public RestaurantOrderViewController(EventFeedProcessor processor) {
        this.processor = processor;
        this.executorService = Executors.newSingleThreadExecutor(
                new CustomizableThreadFactory(processor.getName() + "EventFeedProcessorThread-"));
    }

    public void start() {
        log.info("Starting view updates for {}", processor.getName());
        executorService.submit(processor);
    }

    public boolean isRunning() {
        return processor.isProcessing();
    }

    @Override
    public void close() {
        processor.close();
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("{} did not stop within 10 seconds", processor.getName());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
