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

package org.elasticsoftware.strata.serialization;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.elasticsoftware.strata.eventstore.DomainEventTypeRegistry;
import org.elasticsoftware.strata.events.DomainEvent;
import org.elasticsoftware.strata.events.Issuer;
import org.elasticsoftware.strata.protocol.DomainEventRecord;

import java.io.IOException;
import java.time.Instant;

/**
 * JSON encoding of {@link DomainEventRecord}s. The payload class is resolved from the event type name.
 */
public class DomainEventRecordSerde {
    private final ObjectMapper objectMapper;
    private final DomainEventTypeRegistry eventTypeRegistry;

    public DomainEventRecordSerde(ObjectMapper objectMapper, DomainEventTypeRegistry eventTypeRegistry) {
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.eventTypeRegistry = eventTypeRegistry;
    }

    public byte[] serialize(DomainEventRecord record) {
        try {
            return objectMapper.writeValueAsBytes(new StoredDomainEvent(
                    record.eventType(),
                    record.aggregateId(),
                    record.aggregateType(),
                    record.version(),
                    record.timestamp(),
                    record.issuer(),
                    objectMapper.valueToTree(record.payload())));
        } catch (IOException | IllegalArgumentException e) {
            throw new SerializationException("Problem serializing DomainEvent " + record.eventType()
                    + " v" + record.version() + " of " + record.aggregateType() + " " + record.aggregateId(), e);
        }
    }

    public DomainEventRecord deserialize(byte[] data) {
        try {
            StoredDomainEvent stored = objectMapper.readValue(data, StoredDomainEvent.class);
            Class<? extends DomainEvent> payloadClass = eventTypeRegistry.getTypeClass(stored.eventType());
            return new DomainEventRecord(
                    stored.eventType(),
                    stored.aggregateId(),
                    stored.aggregateType(),
                    stored.version(),
                    stored.timestamp(),
                    stored.issuer(),
                    objectMapper.treeToValue(stored.payload(), payloadClass));
        } catch (IOException e) {
            throw new SerializationException("Problem deserializing DomainEvent", e);
        }
    }

    record StoredDomainEvent(String eventType,
                             String aggregateId,
                             String aggregateType,
                             long version,
                             Instant timestamp,
                             Issuer issuer,
                             JsonNode payload) {
    }
}
