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

package org.elasticsoftware.strata.eventstore;

import org.elasticsoftware.strata.aggregate.ConcurrencyConflictException;
import org.elasticsoftware.strata.protocol.DomainEventRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every stream as an immutable list; {@link ConcurrentHashMap#compute} is the atomic
 * compare-and-append section per aggregate id.
 */
public class InMemoryEventStore implements EventStore {
    private final ConcurrentMap<String, List<DomainEventRecord>> streams = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<String>> aggregateIdsByType = new ConcurrentHashMap<>();

    @Override
    public void append(String aggregateId, String aggregateType, long expectedVersion, List<DomainEventRecord> events) {
        EventStreamValidator.validateBatch(aggregateId, aggregateType, expectedVersion, events);
        if (events.isEmpty()) {
            return;
        }
        streams.compute(aggregateId, (id, stream) -> {
            long currentVersion = stream == null ? 0L : stream.size();
            if (currentVersion != expectedVersion) {
                throw new ConcurrencyConflictException(aggregateType, id, expectedVersion, currentVersion);
            }
            if (stream != null && !stream.get(0).aggregateType().equals(aggregateType)) {
                throw new IllegalArgumentException("Aggregate " + id + " is a " + stream.get(0).aggregateType() + ", not a " + aggregateType);
            }
            List<DomainEventRecord> next = stream == null ? new ArrayList<>(events.size()) : new ArrayList<>(stream);
            next.addAll(events);
            if (stream == null) {
                aggregateIdsByType.computeIfAbsent(aggregateType, type -> new CopyOnWriteArrayList<>()).add(id);
            }
            return List.copyOf(next);
        });
    }

    @Override
    public List<DomainEventRecord> read(String aggregateId, long fromVersion) {
        List<DomainEventRecord> stream = streams.get(aggregateId);
        if (stream == null || fromVersion > stream.size()) {
            return List.of();
        }
        return stream.subList((int) Math.max(0L, fromVersion - 1), stream.size());
    }

    @Override
    public long currentVersion(String aggregateId) {
        List<DomainEventRecord> stream = streams.get(aggregateId);
        return stream == null ? 0L : stream.size();
    }

    @Override
    public List<String> aggregateIds(String aggregateType) {
        List<String> ids = aggregateIdsByType.get(aggregateType);
        return ids == null ? List.of() : List.copyOf(ids);
    }
}
