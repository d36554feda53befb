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

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.TopicPartition;
import org.elasticsoftware.deciders.feed.FeedEntry;
import org.elasticsoftware.deciders.protocol.DomainEventRecord;
import org.elasticsoftware.deciders.protocol.PayloadEncoding;
import org.elasticsoftware.deciders.protocol.ProtocolRecord;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class KafkaEventFeedTest {
    private static final String TOPIC = "Orders-DomainEvents";
    private final TopicPartition partition = new TopicPartition(TOPIC, 0);

    private static DomainEventRecord stored(String streamId, String eventId) {
        return new DomainEventRecord(eventId, streamId, "Order", "OrderCreatedEvent", 1, new byte[]{'{', '}'},
                PayloadEncoding.JSON, "c-1", eventId, false);
    }

    @Test
    void testPollAndAcknowledgeCommitsNextOffset() {
        MockConsumer<String, ProtocolRecord> consumer = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        KafkaEventFeed feed = new KafkaEventFeed(consumer, TOPIC);
        consumer.rebalance(List.of(partition));
        consumer.updateBeginningOffsets(Map.of(partition, 0L));
        consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 0L, "o-1", stored("o-1", "0000000000000000001")));
        consumer.addRecord(new ConsumerRecord<>(TOPIC, 0, 1L, "o-2", stored("o-2", "0000000000000000002")));

        List<FeedEntry> entries = feed.poll(Duration.ofMillis(10));
        assertEquals(2, entries.size());
        assertEquals("0000000000000000001", entries.get(0).record().eventId());
        assertEquals(TOPIC + "-0@0", entries.get(0).id());

        feed.acknowledge(entries.get(0));
        assertEquals(1L, consumer.committed(Set.of(partition)).get(partition).offset());
        feed.acknowledge(entries.get(1));
        assertEquals(2L, consumer.committed(Set.of(partition)).get(partition).offset());
        feed.close();
        assertTrue(consumer.closed());
    }
}
