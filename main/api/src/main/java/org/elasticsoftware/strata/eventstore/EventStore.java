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

import org.elasticsoftware.strata.protocol.DomainEventRecord;

import java.io.Closeable;
import java.util.List;

/**
 * Append-only event log keyed by aggregate id. Implementations must make {@link #append} a single
 * atomic compare-and-append.
 */
public interface EventStore extends Closeable {
    /**
     * Appends {@code events} (versions {@code expectedVersion + 1 .. expectedVersion + n}) if and only
     * if the stored latest version for {@code aggregateId} equals {@code expectedVersion}.
     *
     * @throws org.elasticsoftware.strata.aggregate.ConcurrencyConflictException when the stored version differs; nothing is written
     * @throws IllegalArgumentException when the batch is not contiguous or belongs to another aggregate
     * @throws org.elasticsoftware.strata.PersistenceException when the underlying store fails
     */
    void append(String aggregateId, String aggregateType, long expectedVersion, List<DomainEventRecord> events);

    /**
     * All events of the aggregate in ascending version order, empty when unknown.
     */
    default List<DomainEventRecord> read(String aggregateId) {
        return read(aggregateId, 1L);
    }

    List<DomainEventRecord> read(String aggregateId, long fromVersion);

    /**
     * The latest stored version, 0 when the aggregate has no events.
     */
    long currentVersion(String aggregateId);

    default boolean exists(String aggregateId) {
        return currentVersion(aggregateId) > 0L;
    }

    /**
     * Ids of all aggregates of the given type, in order of their first append.
     */
    List<String> aggregateIds(String aggregateType);

    @Override
    default void close() {
    }
}
