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

package org.elasticsoftware.deciders;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.elasticsoftware.deciders.eventstore.EventRepository;
import org.elasticsoftware.deciders.eventstore.KeyValueEventRepository;
import org.elasticsoftware.deciders.feed.EventFeedFactory;
import org.elasticsoftware.deciders.feed.EventFeedProcessorFactory;
import org.elasticsoftware.deciders.feed.KeyValueEventFeed;
import org.elasticsoftware.deciders.serialization.ProtocolRecordSerde;
import org.elasticsoftware.deciders.storage.InMemoryKeyValueStore;
import org.elasticsoftware.deciders.storage.KeyValueStore;
import org.elasticsoftware.deciders.storage.RocksDBKeyValueStore;
import org.elasticsoftware.deciders.views.KeyValueViewStateRepository;
import org.elasticsoftware.deciders.views.ViewStateRepositoryFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;

import java.time.Duration;
import java.util.List;

@Configuration
@PropertySource("classpath:deciders-runtime.properties")
public class DecidersRuntimeConfiguration {
    private static final Logger log = LoggerFactory.getLogger(DecidersRuntimeConfiguration.class);

    @Bean(name = "decidersProtocolRecordSerde")
    public ProtocolRecordSerde protocolRecordSerde() {
        return new ProtocolRecordSerde();
    }

    @Bean(name = "decidersObjectMapper")
    public ObjectMapper objectMapper() {
        return new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Bean(name = "decidersKeyValueStore", destroyMethod = "close")
    public KeyValueStore keyValueStore(@Value("${deciders.storage.type:in-memory}") String storageType,
                                       @Value("${deciders.rocksdb.baseDir:/tmp/deciders}") String baseDir,
                                       @Value("${deciders.rocksdb.name:deciders}") String name) {
        log.info("Using {} storage", storageType);
        return switch (storageType) {
            case "in-memory" -> new InMemoryKeyValueStore();
            case "rocksdb" -> new RocksDBKeyValueStore(baseDir, name);
            default -> throw new IllegalArgumentException("Unsupported deciders.storage.type " + storageType);
        };
    }

    @Bean(name = "decidersEventRepository")
    public EventRepository eventRepository(@Qualifier("decidersKeyValueStore") KeyValueStore store,
                                           @Qualifier("decidersProtocolRecordSerde") ProtocolRecordSerde serde,
                                           @Value("${deciders.feed.subscriptions:default}") String[] subscriptions) {
        return new KeyValueEventRepository(store, serde, List.of(subscriptions));
    }

    @Bean(name = "decidersViewStateRepositoryFactory")
    public ViewStateRepositoryFactory viewStateRepositoryFactory(@Qualifier("decidersKeyValueStore") KeyValueStore store,
                                                                 @Qualifier("decidersProtocolRecordSerde") ProtocolRecordSerde serde) {
        return viewName -> new KeyValueViewStateRepository(store, serde, viewName);
    }

    @Bean(name = "decidersEventFeedFactory")
    public EventFeedFactory eventFeedFactory(@Qualifier("decidersKeyValueStore") KeyValueStore store,
                                             @Qualifier("decidersProtocolRecordSerde") ProtocolRecordSerde serde,
                                             @Value("${deciders.feed.batchSize:100}") int batchSize) {
        return subscription -> new KeyValueEventFeed(store, serde, subscription, batchSize);
    }

    @Bean(name = "decidersEventFeedProcessorFactory")
    public EventFeedProcessorFactory eventFeedProcessorFactory(@Qualifier("decidersEventFeedFactory") EventFeedFactory feedFactory,
                                                               @Value("${deciders.feed.pollInterval:PT0.1S}") String pollInterval,
                                                               @Value("${deciders.feed.retryBackoff:PT1S}") String retryBackoff) {
        return new EventFeedProcessorFactory(feedFactory, Duration.parse(pollInterval), Duration.parse(retryBackoff));
    }
}
