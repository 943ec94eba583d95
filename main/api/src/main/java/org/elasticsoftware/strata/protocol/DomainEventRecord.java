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

package org.elasticsoftware.strata.protocol;

import jakarta.annotation.Nonnull;
import org.elasticsoftware.strata.events.DomainEvent;
import org.elasticsoftware.strata.events.Issuer;

import java.time.Instant;
import java.util.Objects;

/**
 * One committed (or about to be committed) fact in an aggregate's stream. {@code version} is the
 * aggregate version this event produces; streams are contiguous from 1.
 */
public record DomainEventRecord(
        @Nonnull String eventType,
        @Nonnull String aggregateId,
        @Nonnull String aggregateType,
        long version,
        @Nonnull Instant timestamp,
        @Nonnull Issuer issuer,
        @Nonnull DomainEvent payload) {
    public DomainEventRecord {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(aggregateId, "aggregateId");
        Objects.requireNonNull(aggregateType, "aggregateType");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(issuer, "issuer");
        Objects.requireNonNull(payload, "payload");
        if (version < 1) {
            throw new IllegalArgumentException("version must be positive, got " + version);
        }
    }

    public <E extends DomainEvent> E payload(Class<E> payloadClass) {
        return payloadClass.cast(payload);
    }
}
