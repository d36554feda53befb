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

package org.elasticsoftware.deciders.kafka;

import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.elasticsoftware.deciders.feed.EventFeedHandler;
import org.elasticsoftware.deciders.protocol.DomainEventRecord;
import org.elasticsoftware.deciders.protocol.ProtocolRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;

/**
 * Relays feed entries to a Kafka topic. Records are keyed by stream id, so the events of one stream land on one
 * partition in append order. The send is awaited, the entry is only acknowledged once Kafka has it.
 */
public class KafkaEventPublisher implements EventFeedHandler {
    private static final Logger log = LoggerFactory.getLogger(KafkaEventPublisher.class);
    private final Producer<String, ProtocolRecord> producer;
    private final String topic;

    public KafkaEventPublisher(Producer<String, ProtocolRecord> producer, String topic) {
        this.producer = producer;
        this.topic = topic;
    }

    @Override
    public void handle(DomainEventRecord eventRecord) throws InterruptedException {
        try {
            RecordMetadata metadata = producer.send(new ProducerRecord<>(topic, eventRecord.streamId(), eventRecord)).get();
            log.trace("Published event {} of stream {} to {}-{} at offset {}",
                    eventRecord.eventId(), eventRecord.streamId(), metadata.topic(), metadata.partition(), metadata.offset());
        } catch (ExecutionException e) {
            throw new KafkaException("Error publishing event " + eventRecord.eventId() + " to " + topic, e.getCause());
        }
    }

    public String getTopic() {
        return topic;
    }
}
