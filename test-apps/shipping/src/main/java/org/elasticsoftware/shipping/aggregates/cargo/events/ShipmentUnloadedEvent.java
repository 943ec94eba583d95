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

package org.elasticsoftware.shipping.aggregates.cargo.events;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.strata.events.DomainEvent;
import org.elasticsoftware.strata.events.DomainEventType;

import java.time.Instant;

/**
 * A shipment left the cargo. Unloading at the destination removes the shipment from the cargo,
 * other unloads keep it on record with status unloaded.
 */
public record ShipmentUnloadedEvent(@NotNull String id,
                                    @NotNull String shipmentId,
                                    double weight,
                                    double volume,
                                    @NotNull String unloadedBy,
                                    @Nullable String reason,
                                    @Nullable String location,
                                    boolean destinationUnload,
                                    @NotNull Instant unloadedAt) implements DomainEvent {
    public static final DomainEventType<ShipmentUnloadedEvent> TYPE =
            new DomainEventType<>("ShipmentUnloaded", ShipmentUnloadedEvent.class, false, false);

    @Override
    public String getAggregateId() {
        return id();
    }
}
