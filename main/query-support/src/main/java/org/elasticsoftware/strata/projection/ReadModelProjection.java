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

package org.elasticsoftware.strata.projection;

import org.elasticsoftware.strata.UnsupportedTypeException;
import org.elasticsoftware.strata.events.DomainEvent;
import org.elasticsoftware.strata.events.DomainEventType;
import org.elasticsoftware.strata.eventstore.EventStore;
import org.elasticsoftware.strata.protocol.DomainEventRecord;
import org.elasticsoftware.strata.readmodel.ReadModel;
import org.elasticsoftware.strata.readmodel.ReadModelType;
import org.elasticsoftware.strata.readmodel.ReadStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Projection that keeps one read model per source aggregate, keyed by the aggregate id. Event
 * handlers are registered per event type through the {@link Builder}.
 */
public class ReadModelProjection<R extends ReadModel> implements Projection {
    private static final Logger log = LoggerFactory.getLogger(ReadModelProjection.class);
    private final String name;
    private final String version;
    private final ReadModelType<R> readModelType;
    private final Set<String> aggregateTypes;
    private final Map<String, Handler<R, ?>> handlers;
    private final ReadStore readStore;
    private final EventStore eventStore;

    private ReadModelProjection(Builder<R> builder) {
        this.name = builder.name;
        this.version = builder.version;
        this.readModelType = builder.readModelType;
        this.aggregateTypes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.aggregateTypes));
        this.handlers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.handlers));
        this.readStore = builder.readStore;
        this.eventStore = builder.eventStore;
    }

    public static <R extends ReadModel> Builder<R> builder(String name, ReadModelType<R> readModelType) {
        return new Builder<>(name, readModelType);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public String getVersion() {
        return version;
    }

    public ReadModelType<R> getReadModelType() {
        return readModelType;
    }

    public Set<String> getAggregateTypes() {
        return aggregateTypes;
    }

    @Override
    public Set<String> getHandledEventTypes() {
        return handlers.keySet();
    }

    @Override
    public void project(DomainEventRecord event) {
        Handler<R, ?> handler = handlers.get(event.eventType());
        if (handler == null) {
            throw new UnsupportedTypeException("event", event.eventType());
        }
        String readModelId = event.aggregateId();
        R current = readStore.findById(readModelType, readModelId).orElse(null);
        if (current != null && event.version() <= current.getVersion()) {
            log.trace("{} skipping {} v{} for {}, already at version {}",
                    name, event.eventType(), event.version(), readModelId, current.getVersion());
            return;
        }
        if (current == null && !handler.create()) {
            throw new ProjectionException(name, "No " + readModelType.getTypeName() + " " + readModelId
                    + " exists to apply " + event.eventType() + " v" + event.version() + " to", event);
        }
        R next;
        try {
            next = handler.apply(event, current);
        } catch (ProjectionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ProjectionException(name, "Failed to apply " + event.eventType() + " v" + event.version()
                    + " to " + readModelType.getTypeName() + " " + readModelId, event, e);
        }
        if (next == null || next.getVersion() != event.version() || !readModelId.equals(next.getId())) {
            throw new ProjectionException(name, "Handler for " + event.eventType() + " must return " + readModelType.getTypeName()
                    + " " + readModelId + " at version " + event.version(), event);
        }
        readStore.save(readModelType, next);
    }

    @Override
    public void reset() {
        readStore.deleteAll(readModelType);
        log.info("{} reset, all {} read models removed", name, readModelType.getTypeName());
    }

    @Override
    public void rebuild() {
        reset();
        long replayed = 0L;
        for (String aggregateType : aggregateTypes) {
            for (String aggregateId : eventStore.aggregateIds(aggregateType)) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new ProjectionException(name, "Rebuild of " + name + " was interrupted");
                }
                for (DomainEventRecord event : eventStore.read(aggregateId)) {
                    if (canHandle(event.eventType())) {
                        project(event);
                        replayed++;
                    }
                }
            }
        }
        log.info("{} rebuilt from {} DomainEvent(s)", name, replayed);
    }

    @Override
    public String toString() {
        return "ReadModelProjection{" + name + ":" + version + "}";
    }

    private record Handler<R extends ReadModel, E extends DomainEvent>(DomainEventType<E> type,
                                                                      ReadModelEventHandlerFunction<R, E> function,
                                                                      boolean create) {
        R apply(DomainEventRecord record, R current) {
            return function.apply(type.typeClass().cast(record.payload()), record, current);
        }
    }

    public static final class Builder<R extends ReadModel> {
        private final String name;
        private final ReadModelType<R> readModelType;
        private final Set<String> aggregateTypes = new LinkedHashSet<>();
        private final Map<String, Handler<R, ?>> handlers = new LinkedHashMap<>();
        private String version = "1";
        private ReadStore readStore;
        private EventStore eventStore;

        private Builder(String name, ReadModelType<R> readModelType) {
            this.name = Objects.requireNonNull(name, "name");
            this.readModelType = Objects.requireNonNull(readModelType, "readModelType");
        }

        public Builder<R> setVersion(String version) {
            this.version = version;
            return this;
        }

        public Builder<R> setReadStore(ReadStore readStore) {
            this.readStore = readStore;
            return this;
        }

        public Builder<R> setEventStore(EventStore eventStore) {
            this.eventStore = eventStore;
            return this;
        }

        /**
         * Aggregate types whose history is replayed on {@link #rebuild()}.
         */
        public Builder<R> addAggregateType(String aggregateType) {
            aggregateTypes.add(aggregateType);
            return this;
        }

        public <E extends DomainEvent> Builder<R> addCreateHandler(DomainEventType<E> type, ReadModelEventHandlerFunction<R, E> function) {
            return addHandler(type, function, true);
        }

        public <E extends DomainEvent> Builder<R> addEventHandler(DomainEventType<E> type, ReadModelEventHandlerFunction<R, E> function) {
            return addHandler(type, function, false);
        }

        private <E extends DomainEvent> Builder<R> addHandler(DomainEventType<E> type, ReadModelEventHandlerFunction<R, E> function, boolean create) {
            if (handlers.containsKey(type.typeName())) {
                throw new IllegalStateException("Duplicate handler for DomainEvent " + type.typeName() + " in projection " + name);
            }
            handlers.put(type.typeName(), new Handler<>(type, function, create));
            return this;
        }

        public ReadModelProjection<R> build() {
            if (readStore == null || eventStore == null) {
                throw new IllegalStateException("Projection " + name + " needs a ReadStore and an EventStore");
            }
            if (aggregateTypes.isEmpty()) {
                throw new IllegalStateException("Projection " + name + " does not follow any aggregate type");
            }
            if (handlers.values().stream().noneMatch(Handler::create)) {
                throw new IllegalStateException("Projection " + name + " has no create handler");
            }
            return new ReadModelProjection<>(this);
        }
    }
}
