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

import org.elasticsoftware.strata.eventstore.EventStore;
import org.elasticsoftware.strata.protocol.DomainEventRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Loads aggregates by replaying their full history from an {@link EventStore} and saves them
 * through the store's compare-and-append.
 */
public class EventSourcedRepository<A extends AggregateRoot<?>> implements AggregateRepository<A> {
    private static final Logger log = LoggerFactory.getLogger(EventSourcedRepository.class);
    private final String aggregateType;
    private final Function<String, A> aggregateFactory;
    private final EventStore eventStore;

    public EventSourcedRepository(String aggregateType, Function<String, A> aggregateFactory, EventStore eventStore) {
        this.aggregateType = Objects.requireNonNull(aggregateType, "aggregateType");
        this.aggregateFactory = Objects.requireNonNull(aggregateFactory, "aggregateFactory");
        this.eventStore = Objects.requireNonNull(eventStore, "eventStore");
    }

    @Override
    public String getAggregateType() {
        return aggregateType;
    }

    @Override
    public A newInstance(String aggregateId) {
        A aggregate = aggregateFactory.apply(aggregateId);
        if (!aggregateType.equals(aggregate.getType())) {
            throw new IllegalStateException("Factory for " + aggregateType + " produced an aggregate of type " + aggregate.getType());
        }
        return aggregate;
    }

    @Override
    public A getById(String aggregateId) {
        return findById(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateType, aggregateId));
    }

    @Override
    public Optional<A> findById(String aggregateId) {
        List<DomainEventRecord> history = eventStore.read(aggregateId);
        if (history.isEmpty()) {
            return Optional.empty();
        }
        if (!aggregateType.equals(history.get(0).aggregateType())) {
            log.warn("Aggregate {} is a {}, not a {}", aggregateId, history.get(0).aggregateType(), aggregateType);
            return Optional.empty();
        }
        A aggregate = newInstance(aggregateId);
        aggregate.replay(history);
        log.trace("Loaded {} {} at version {}", aggregateType, aggregateId, aggregate.getCurrentVersion());
        return Optional.of(aggregate);
    }

    @Override
    public boolean exists(String aggregateId) {
        return eventStore.exists(aggregateId);
    }

    @Override
    public List<DomainEventRecord> save(A aggregate, long expectedVersion) {
        if (!aggregate.hasUncommittedChanges()) {
            return List.of();
        }
        aggregate.validate();
        List<DomainEventRecord> changes = aggregate.getUncommittedChanges();
        eventStore.append(aggregate.getId(), aggregateType, expectedVersion, changes);
        aggregate.markChangesAsCommitted();
        log.debug("Saved {} DomainEvent(s) for {} {}, now at version {}",
                changes.size(), aggregateType, aggregate.getId(), aggregate.getCurrentVersion());
        return changes;
    }

    @Override
    public String toString() {
        return "EventSourcedRepository{" + aggregateType + "}";
    }
}
