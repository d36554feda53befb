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

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;
import org.elasticsoftware.deciders.feed.EventFeed;
import org.elasticsoftware.deciders.feed.FeedEntry;
import org.elasticsoftware.deciders.protocol.DomainEventRecord;
import org.elasticsoftware.deciders.protocol.ProtocolRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;

/**
 * {@link EventFeed} over a Kafka topic written by {@link KafkaEventPublisher}. Acknowledging an entry commits the
 * offset after it. Entries of a poll that were not acknowledged are read again on the next poll.
 */
public class KafkaEventFeed implements EventFeed {
    private static final Logger log = LoggerFactory.getLogger(KafkaEventFeed.class);
    private final Consumer<String, ProtocolRecord> consumer;
    private final String topic;
    // lowest unacknowledged offset per partition of the last poll
    private final Map<TopicPartition, Long> pending = new HashMap<>();

    public KafkaEventFeed(Consumer<String, ProtocolRecord> consumer, String topic) {
        this.consumer = consumer;
        this.topic = topic;
        consumer.subscribe(List.of(topic));
    }

    @Override
    public List<FeedEntry> poll(Duration timeout) {
        pending.forEach(consumer::seek);
        pending.clear();
        ConsumerRecords<String, ProtocolRecord> records = consumer.poll(timeout);
        List<FeedEntry> entries = new ArrayList<>(records.count());
        for (ConsumerRecord<String, ProtocolRecord> record : records) {
            TopicPartition partition = new TopicPartition(record.topic(), record.partition());
            if (record.value() instanceof DomainEventRecord eventRecord) {
                pending.putIfAbsent(partition, record.offset());
                entries.add(new FeedEntry(entryId(partition, record.offset()), eventRecord));
            } else {
                log.warn("Skipping unexpected record of type {} on {} at offset {}",
                        record.value() != null ? record.value().getClass().getSimpleName() : "null",
                        partition, record.offset());
            }
        }
        return entries;
    }

    @Override
    public void acknowledge(FeedEntry entry) {
        int separator = entry.id().lastIndexOf('@');
        TopicPartition partition = parsePartition(entry.id().substring(0, separator));
        long offset = Long.parseLong(entry.id().substring(separator + 1));
        consumer.commitSync(Map.of(partition, new OffsetAndMetadata(offset + 1)));
        Long lowest = pending.get(partition);
        if (lowest != null && lowest <= offset) {
            pending.put(partition, offset + 1);
        }
    }

    @Override
    public void close() {
        try {
            consumer.close(Duration.ofSeconds(5));
        } catch (InterruptException e) {
            Thread.currentThread().interrupt();
        } catch (KafkaException e) {
            log.error("Error closing consumer of topic {}", topic, e);
        }
    }

    private static String entryId(TopicPartition partition, long offset) {
        return partition.topic() + "-" + partition.partition() + "@" + offset;
    }

    private static TopicPartition parsePartition(String value) {
        int separator = value.lastIndexOf('-');
        return new TopicPartition(value.substring(0, separator), Integer.parseInt(value.substring(separator + 1)));
    }
}
