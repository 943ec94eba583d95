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

package org.elasticsoftware.strata.aggregate;

import org.elasticsoftware.strata.protocol.DomainEventRecord;

import java.util.List;
import java.util.Optional;

public interface AggregateRepository<A extends AggregateRoot<?>> {
    String getAggregateType();

    /**
     * A fresh, empty instance at version 0.
     */
    A newInstance(String aggregateId);

    /**
     * Loads the aggregate by replaying its full history.
     *
     * @throws AggregateNotFoundException when no events exist for the id
     */
    A getById(String aggregateId);

    Optional<A> findById(String aggregateId);

    boolean exists(String aggregateId);

    /**
     * Appends the uncommitted changes if the stored version equals {@code expectedVersion}.
     *
     * @return the committed events, in order
     * @throws ConcurrencyConflictException when another writer advanced the stream; nothing is persisted
     */
    List<DomainEventRecord> save(A aggregate, long expectedVersion);

    default List<DomainEventRecord> save(A aggregate) {
        return save(aggregate, aggregate.getOriginalVersion());
    }
}
