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

package org.elasticsoftware.strata.events;

import java.util.Objects;

/**
 * Type tag of a domain event. {@code create} marks the event that starts an aggregate's stream,
 * {@code delete} marks the event that soft-deletes it.
 */
public record DomainEventType<E extends DomainEvent>(String typeName, Class<E> typeClass, boolean create, boolean delete) {
    public DomainEventType {
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(typeClass, "typeClass");
        if (create && delete) {
            throw new IllegalArgumentException("DomainEventType " + typeName + " cannot both create and delete");
        }
    }
}
