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

import org.elasticsoftware.strata.UnsupportedTypeException;
import org.elasticsoftware.strata.events.DomainEvent;
import org.elasticsoftware.strata.events.DomainEventType;
import org.elasticsoftware.strata.events.EventSourcingHandlerFunction;
import org.elasticsoftware.strata.protocol.DomainEventRecord;

import java.util.*;

/**
 * Immutable table that maps every event type of one aggregate type to the function folding it into
 * the aggregate state. Built once per aggregate class and shared by all of its instances.
 */
public final class EventSourcingHandlers<S extends AggregateState> {
    private final String aggregateType;
    private final Map<String, Handler<S, ?>> handlersByTypeName;
    private final Map<Class<?>, DomainEventType<?>> eventTypesByClass;

    private EventSourcingHandlers(String aggregateType, Map<String, Handler<S, ?>> handlersByTypeName) {
        this.aggregateType = aggregateType;
        this.handlersByTypeName = Collections.unmodifiableMap(handlersByTypeName);
        Map<Class<?>, DomainEventType<?>> byClass = new HashMap<>();
        handlersByTypeName.values().forEach(handler -> byClass.put(handler.type().typeClass(), handler.type()));
        this.eventTypesByClass = Collections.unmodifiableMap(byClass);
    }

    public static <S extends AggregateState> Builder<S> builder(String aggregateType) {
        return new Builder<>(aggregateType);
    }

    public String getAggregateType() {
        return aggregateType;
    }

    public boolean supports(String eventType) {
        return handlersByTypeName.containsKey(eventType);
    }

    public DomainEventType<?> getEventType(String eventType) {
        Handler<S, ?> handler = handlersByTypeName.get(eventType);
        if (handler == null) {
            throw new UnsupportedTypeException("event", eventType);
        }
        return handler.type();
    }

    public DomainEventType<?> getEventType(Class<? extends DomainEvent> eventClass) {
        DomainEventType<?> type = eventTypesByClass.get(eventClass);
        if (type == null) {
            throw new UnsupportedTypeException("event", eventClass.getName());
        }
        return type;
    }

    public List<DomainEventType<?>> getDomainEventTypes() {
        return handlersByTypeName.values().stream().<DomainEventType<?>>map(Handler::type).toList();
    }

    S apply(DomainEventRecord record, S state) {
        Handler<S, ?> handler = handlersByTypeName.get(record.eventType());
        if (handler == null) {
            throw new UnsupportedTypeException("event", record.eventType());
        }
        return handler.apply(record.payload(), state);
    }

    private record Handler<S extends AggregateState, E extends DomainEvent>(DomainEventType<E> type,
                                                                           EventSourcingHandlerFunction<S, E> function) {
        S apply(DomainEvent event, S state) {
            return function.apply(type.typeClass().cast(event), state);
        }
    }

    public static final class Builder<S extends AggregateState> {
        private final String aggregateType;
        private final Map<String, Handler<S, ?>> handlers = new LinkedHashMap<>();

        private Builder(String aggregateType) {
            this.aggregateType = Objects.requireNonNull(aggregateType, "aggregateType");
        }

        public <E extends DomainEvent> Builder<S> on(DomainEventType<E> type, EventSourcingHandlerFunction<S, E> function) {
            if (handlers.containsKey(type.typeName())) {
                throw new IllegalStateException("Duplicate EventSourcingHandler for DomainEvent " + type.typeName() + " on Aggregate " + aggregateType);
            }
            handlers.put(type.typeName(), new Handler<>(type, function));
            return this;
        }

        public EventSourcingHandlers<S> build() {
            long createHandlers = handlers.values().stream().filter(handler -> handler.type().create()).count();
            if (createHandlers != 1) {
                throw new IllegalStateException("Aggregate " + aggregateType + " must have exactly one create EventSourcingHandler, found " + createHandlers);
            }
            return new EventSourcingHandlers<>(aggregateType, new LinkedHashMap<>(handlers));
        }
    }
}
