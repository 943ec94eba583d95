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

import org.elasticsoftware.strata.UnsupportedTypeException;
import org.elasticsoftware.strata.events.DomainEvent;
import org.elasticsoftware.strata.events.DomainEventType;
import org.elasticsoftware.strata.registry.FreezableRegistry;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Resolves persisted event type names back to their payload classes.
 */
public class DomainEventTypeRegistry extends FreezableRegistry {
    private final Map<String, DomainEventType<?>> eventTypes = new HashMap<>();

    public synchronized DomainEventTypeRegistry register(DomainEventType<?> eventType) {
        checkNotFrozen();
        DomainEventType<?> existing = eventTypes.putIfAbsent(eventType.typeName(), eventType);
        if (existing != null && !existing.typeClass().equals(eventType.typeClass())) {
            throw new IllegalStateException("DomainEvent type " + eventType.typeName() + " is already registered for "
                    + existing.typeClass().getName());
        }
        return this;
    }

    public DomainEventTypeRegistry registerAll(Collection<DomainEventType<?>> eventTypes) {
        eventTypes.forEach(this::register);
        return this;
    }

    public Class<? extends DomainEvent> getTypeClass(String typeName) {
        checkFrozen();
        DomainEventType<?> eventType = eventTypes.get(typeName);
        if (eventType == null) {
            throw new UnsupportedTypeException("event", typeName);
        }
        return eventType.typeClass();
    }

    public Set<String> getTypeNames() {
        return Set.copyOf(eventTypes.keySet());
    }
}
