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

package org.elasticsoftware.shipping.query;

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.shipping.aggregates.cargo.Cargo;
import org.elasticsoftware.shipping.aggregates.cargo.CargoStatus;
import org.elasticsoftware.shipping.aggregates.cargo.events.*;
import org.elasticsoftware.strata.eventstore.EventStore;
import org.elasticsoftware.strata.protocol.DomainEventRecord;
import org.elasticsoftware.strata.readmodel.ReadStore;
import org.elasticsoftware.strata.projection.ReadModelProjection;

import java.util.HashMap;
import java.util.Map;

/**
 * Keeps one {@link CargoView} per {@link Cargo}.
 */
public final class CargoViewProjection {
    public static final String NAME = "CargoViewProjection";

    private CargoViewProjection() {
    }

    public static ReadModelProjection<CargoView> create(ReadStore readStore, EventStore eventStore) {
        return ReadModelProjection.builder(NAME, CargoView.TYPE)
                .setVersion("1")
                .setReadStore(readStore)
                .setEventStore(eventStore)
                .addAggregateType(Cargo.TYPE)
                .addCreateHandler(CargoCreatedEvent.TYPE, CargoViewProjection::created)
                .addEventHandler(ShipmentLoadedEvent.TYPE, CargoViewProjection::shipmentLoaded)
                .addEventHandler(ShipmentUnloadedEvent.TYPE, CargoViewProjection::shipmentUnloaded)
                .addEventHandler(TransportStartedEvent.TYPE, CargoViewProjection::transportStarted)
                .addEventHandler(TransportCompletedEvent.TYPE, CargoViewProjection::transportCompleted)
                .addEventHandler(CargoDeletedEvent.TYPE, CargoViewProjection::deleted)
                .build();
    }

    static @NotNull CargoView created(@NotNull CargoCreatedEvent event, @NotNull DomainEventRecord record, CargoView isNull) {
        return new CargoView(event.id(), record.version(), event.origin(), event.destination(), CargoStatus.CREATED,
                event.maxWeight(), event.maxVolume(), 0.0, 0.0, Map.of(), null, null,
                record.timestamp(), record.timestamp(), false);
    }

    static @NotNull CargoView shipmentLoaded(@NotNull ShipmentLoadedEvent event, @NotNull DomainEventRecord record, @NotNull CargoView view) {
        Map<String, String> shipments = new HashMap<>(view.shipments());
        shipments.put(event.shipment().id(), event.shipment().description());
        return new CargoView(view.id(), record.version(), view.origin(), view.destination(), CargoStatus.LOADING,
                view.maxWeight(), view.maxVolume(),
                view.currentWeight() + event.shipment().weight(),
                view.currentVolume() + event.shipment().volume(),
                shipments, view.vehicleId(), view.estimatedArrival(), view.createdAt(), record.timestamp(), false);
    }

    static @NotNull CargoView shipmentUnloaded(@NotNull ShipmentUnloadedEvent event, @NotNull DomainEventRecord record, @NotNull CargoView view) {
        Map<String, String> shipments = new HashMap<>(view.shipments());
        shipments.remove(event.shipmentId());
        return new CargoView(view.id(), record.version(), view.origin(), view.destination(),
                shipments.isEmpty() ? CargoStatus.COMPLETED : CargoStatus.UNLOADING,
                view.maxWeight(), view.maxVolume(),
                shipments.isEmpty() ? 0.0 : view.currentWeight() - event.weight(),
                shipments.isEmpty() ? 0.0 : view.currentVolume() - event.volume(),
                shipments, view.vehicleId(), view.estimatedArrival(), view.createdAt(), record.timestamp(), false);
    }

    static @NotNull CargoView transportStarted(@NotNull TransportStartedEvent event, @NotNull DomainEventRecord record, @NotNull CargoView view) {
        return new CargoView(view.id(), record.version(), view.origin(), view.destination(), CargoStatus.IN_TRANSIT,
                view.maxWeight(), view.maxVolume(), view.currentWeight(), view.currentVolume(),
                view.shipments(), event.vehicleId(), event.estimatedArrival(), view.createdAt(), record.timestamp(), false);
    }

    static @NotNull CargoView transportCompleted(@NotNull TransportCompletedEvent event, @NotNull DomainEventRecord record, @NotNull CargoView view) {
        return new CargoView(view.id(), record.version(), view.origin(), view.destination(), CargoStatus.COMPLETED,
                view.maxWeight(), view.maxVolume(), view.currentWeight(), view.currentVolume(),
                view.shipments(), view.vehicleId(), view.estimatedArrival(), view.createdAt(), record.timestamp(), false);
    }

    static @NotNull CargoView deleted(@NotNull CargoDeletedEvent event, @NotNull DomainEventRecord record, @NotNull CargoView view) {
        return new CargoView(view.id(), record.version(), view.origin(), view.destination(), view.status(),
                view.maxWeight(), view.maxVolume(), view.currentWeight(), view.currentVolume(),
                view.shipments(), view.vehicleId(), view.estimatedArrival(), view.createdAt(), record.timestamp(), true);
    }
}
