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

package org.elasticsoftware.deciders.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.protobuf.ProtobufMapper;
import com.fasterxml.jackson.dataformat.protobuf.schema.ProtobufSchema;
import com.fasterxml.jackson.dataformat.protobuf.schema.ProtobufSchemaLoader;
import org.apache.kafka.common.errors.SerializationException;
import org.apache.kafka.common.serialization.Deserializer;
import org.apache.kafka.common.serialization.Serde;
import org.apache.kafka.common.serialization.Serializer;
import org.elasticsoftware.deciders.protocol.DomainEventRecord;
import org.elasticsoftware.deciders.protocol.ProtocolRecord;
import org.elasticsoftware.deciders.protocol.ViewStateRecord;

import java.io.IOException;
import java.io.StringReader;

/**
 * Protobuf encoding of the protocol records, used both for the key value store and as Kafka {@link Serde}. The
 * record type is derived from the (logical) topic name: names ending in {@value #DOMAIN_EVENTS_SUFFIX} hold
 * {@link DomainEventRecord}s and names ending in {@value #VIEW_STATE_SUFFIX} hold {@link ViewStateRecord}s.
 */
public final class ProtocolRecordSerde implements Serde<ProtocolRecord> {
    public static final String DOMAIN_EVENTS_SUFFIX = "DomainEvents";
    public static final String VIEW_STATE_SUFFIX = "ViewState";
    private static final String domainEventRecordProto = """
            // org.elasticsoftware.deciders.protocol.DomainEventRecord

            // Message for org.elasticsoftware.deciders.protocol.DomainEventRecord
            message DomainEventRecord {
              optional string eventId = 1;
              optional string streamId = 2;
              optional string decider = 3;
              optional string name = 4;
              optional int32 version = 5;
              optional bytes payload = 6;
              optional PayloadEncoding encoding = 7;
              optional string commandId = 8;
              optional string streamVersion = 9;
              optional bool finalEvent = 10;
            }
            // Enum for org.elasticsoftware.deciders.protocol.PayloadEncoding
            enum PayloadEncoding {
              JSON = 0;
              PROTOBUF = 1;
              BYTES = 2;
            }
            """;
    private static final String viewStateRecordProto = """
            // org.elasticsoftware.deciders.protocol.ViewStateRecord

            // Message for org.elasticsoftware.deciders.protocol.ViewStateRecord
            message ViewStateRecord {
              optional string name = 1;
              optional string streamId = 2;
              optional bytes payload = 3;
              optional PayloadEncoding encoding = 4;
              optional string lastEventId = 5;
            }
            // Enum for org.elasticsoftware.deciders.protocol.PayloadEncoding
            enum PayloadEncoding {
              JSON = 0;
              PROTOBUF = 1;
              BYTES = 2;
            }
            """;
    private final ObjectMapper objectMapper = new ProtobufMapper();
    private final Serializer<ProtocolRecord> serializer;
    private final Deserializer<ProtocolRecord> deserializer;

    public ProtocolRecordSerde() {
        try {
            ProtobufSchema domainEventRecordSchema = ProtobufSchemaLoader.std.load(new StringReader(domainEventRecordProto));
            ProtobufSchema viewStateRecordSchema = ProtobufSchemaLoader.std.load(new StringReader(viewStateRecordProto));
            serializer = new SerializerImpl(objectMapper.writer(domainEventRecordSchema),
                    objectMapper.writer(viewStateRecordSchema));
            deserializer = new DeserializerImpl(objectMapper.readerFor(DomainEventRecord.class).with(domainEventRecordSchema),
                    objectMapper.readerFor(ViewStateRecord.class).with(viewStateRecordSchema));
        } catch (IOException e) {
            throw new SerializationException(e);
        }
    }

    @Override
    public Serializer<ProtocolRecord> serializer() {
        return serializer;
    }

    @Override
    public Deserializer<ProtocolRecord> deserializer() {
        return deserializer;
    }

    private record SerializerImpl(
            ObjectWriter domainEventRecordWriter,
            ObjectWriter viewStateRecordWriter
    ) implements Serializer<ProtocolRecord> {

        @Override
        public byte[] serialize(String topic, ProtocolRecord data) {
            try {
                if (data == null) {
                    return null;
                } else if (data instanceof DomainEventRecord r) {
                    return domainEventRecordWriter.writeValueAsBytes(r);
                } else if (data instanceof ViewStateRecord r) {
                    return viewStateRecordWriter.writeValueAsBytes(r);
                } else {
                    throw new SerializationException("Unsupported ProtocolRecord type " + data.getClass().getSimpleName());
                }
            } catch (JsonProcessingException e) {
                throw new SerializationException(e);
            }
        }
    }

    private record DeserializerImpl(
            ObjectReader domainEventRecordReader,
            ObjectReader viewStateRecordReader
    ) implements Deserializer<ProtocolRecord> {

        @Override
        public ProtocolRecord deserialize(String topic, byte[] data) {
            try {
                if (data == null) {
                    return null;
                } else if (topic.endsWith(DOMAIN_EVENTS_SUFFIX)) {
                    return domainEventRecordReader.readValue(data);
                } else if (topic.endsWith(VIEW_STATE_SUFFIX)) {
                    return viewStateRecordReader.readValue(data);
                } else {
                    throw new SerializationException("Unsupported topic name " + topic + " cannot determine ProtocolRecordType");
                }
            } catch (IOException e) {
                throw new SerializationException(e);
            }
        }
    }
}
