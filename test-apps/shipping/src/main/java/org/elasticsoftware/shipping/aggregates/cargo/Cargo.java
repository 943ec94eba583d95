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

package org.elasticsoftware.shipping.aggregates.cargo;

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.shipping.aggregates.cargo.commands.*;
import org.elasticsoftware.shipping.aggregates.cargo.events.*;
import org.elasticsoftware.strata.aggregate.AggregateRoot;
import org.elasticsoftware.strata.aggregate.EventSourcingHandlers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * A cargo unit moving shipments from an origin to a destination within fixed weight and volume
 * capacities.
 */
public final class Cargo extends AggregateRoot<CargoState> {
    public static final String TYPE = "Cargo";
    private static final Logger log = LoggerFactory.getLogger(Cargo.class);

    public static final EventSourcingHandlers<CargoState> EVENT_SOURCING_HANDLERS = EventSourcingHandlers.<CargoState>builder(TYPE)
            .on(CargoCreatedEvent.TYPE, Cargo::created)
            .on(ShipmentLoadedEvent.TYPE, Cargo::shipmentLoaded)
            .on(ShipmentUnloadedEvent.TYPE, Cargo::shipmentUnloaded)
            .on(TransportStartedEvent.TYPE, Cargo::transportStarted)
            .on(TransportCompletedEvent.TYPE, Cargo::transportCompleted)
            .on(CargoDeletedEvent.TYPE, (event, state) -> state)
            .build();

    public Cargo(String id) {
        super(id, EVENT_SOURCING_HANDLERS);
    }

    public void create(@NotNull CreateCargoCommand cmd) {
        if (getCurrentVersion() != 0L) {
            throw invalid("cargo " + getId() + " is already created");
        }
        if (cmd.origin().trim().equalsIgnoreCase(cmd.destination().trim())) {
            throw invalid("cargo origin and destination must differ");
        }
        log.info("CommandHandler: Creating Cargo {} from {} to {}", getId(), cmd.origin(), cmd.destination());
        raise(new CargoCreatedEvent(getId(), cmd.origin(), cmd.destination(), cmd.maxWeight(), cmd.maxVolume()));
    }

    public void loadShipment(@NotNull LoadShipmentCommand cmd) {
        CargoState state = requireState();
        if (state.status() != CargoStatus.CREATED && state.status() != CargoStatus.LOADING) {
            throw invalid("cargo " + getId() + " is not available for loading, current status: " + state.status());
        }
        if (state.findShipment(cmd.shipmentId()).isPresent()) {
            throw invalid("shipment " + cmd.shipmentId() + " is already loaded in cargo " + getId());
        }
        double volume = cmd.dimensions().volume();
        if (state.currentWeight() + cmd.weight() > state.maxWeight()) {
            throw invalid(String.format(Locale.ROOT, "adding shipment %s would exceed weight capacity (current: %.2f, max: %.2f, adding: %.2f)",
                    cmd.shipmentId(), state.currentWeight(), state.maxWeight(), cmd.weight()));
        }
        if (state.currentVolume() + volume > state.maxVolume()) {
            throw invalid(String.format(Locale.ROOT, "adding shipment %s would exceed volume capacity (current: %.2f, max: %.2f, adding: %.2f)",
                    cmd.shipmentId(), state.currentVolume(), state.maxVolume(), volume));
        }
        Shipment shipment = new Shipment(cmd.shipmentId(), cmd.description(), cmd.shipmentType(), ShipmentStatus.LOADED,
                cmd.weight(), cmd.dimensions(), cmd.value(), cmd.handlingInstructions(), Instant.now(), null);
        raise(new ShipmentLoadedEvent(getId(), shipment, cmd.loadedBy()));
    }

    public void unloadShipment(@NotNull UnloadShipmentCommand cmd) {
        CargoState state = requireState();
        Shipment shipment = state.findShipment(cmd.shipmentId())
                .orElseThrow(() -> invalid("shipment " + cmd.shipmentId() + " not found in cargo " + getId()));
        if (shipment.status() != ShipmentStatus.LOADED && shipment.status() != ShipmentStatus.IN_TRANSIT) {
            throw invalid("shipment " + cmd.shipmentId() + " cannot be unloaded, current status: " + shipment.status());
        }
        raise(new ShipmentUnloadedEvent(getId(), shipment.id(), shipment.weight(), shipment.volume(), cmd.unloadedBy(),
                cmd.reason(), cmd.location(), cmd.atDestination(), Instant.now()));
    }

    public void startTransport(@NotNull StartTransportCommand cmd) {
        CargoState state = requireState();
        if (state.status() != CargoStatus.CREATED && state.status() != CargoStatus.LOADING) {
            throw invalid("cargo " + getId() + " cannot start transport, current status: " + state.status());
        }
        if (state.shipments().isEmpty()) {
            throw invalid("cargo " + getId() + " has no shipments to transport");
        }
        Instant now = Instant.now();
        if (!cmd.estimatedArrival().isAfter(now)) {
            throw invalid("estimated arrival of cargo " + getId() + " must be in the future");
        }
        log.info("CommandHandler: Cargo {} departs with vehicle {}", getId(), cmd.vehicleId());
        raise(new TransportStartedEvent(getId(), cmd.transportMode(), cmd.vehicleId(), cmd.driverId(), cmd.route(),
                now, cmd.estimatedArrival(), cmd.startedBy()));
    }

    public void completeTransport(@NotNull CompleteTransportCommand cmd) {
        CargoState state = requireState();
        if (state.status() != CargoStatus.IN_TRANSIT) {
            throw invalid("cargo " + getId() + " is not in transit, current status: " + state.status());
        }
        if (state.transport() == null) {
            throw invalid("cargo " + getId() + " transport start time is not set");
        }
        raise(new TransportCompletedEvent(getId(), Instant.now(), cmd.completedBy(), cmd.deliveryNotes()));
    }

    public void delete(@NotNull DeleteCargoCommand cmd) {
        CargoState state = requireState();
        if (state.status() == CargoStatus.IN_TRANSIT) {
            throw invalid("cargo " + getId() + " cannot be deleted while in transit");
        }
        log.info("CommandHandler: Deleting Cargo {}: {}", getId(), cmd.reason());
        markAsDeleted(new CargoDeletedEvent(getId(), cmd.reason(), cmd.deletedBy()));
    }

    @Override
    public void validate() {
        super.validate();
        CargoState state = getState();
        if (state == null) {
            return;
        }
        if (state.origin().isBlank()) {
            throw invalid("cargo origin cannot be empty");
        }
        if (state.destination().isBlank()) {
            throw invalid("cargo destination cannot be empty");
        }
        if (state.maxWeight() <= 0 || state.maxVolume() <= 0) {
            throw invalid("cargo capacities must be positive");
        }
        if (state.currentWeight() < 0 || state.currentWeight() > state.maxWeight()) {
            throw invalid("cargo current weight must be between 0 and " + state.maxWeight());
        }
        if (state.currentVolume() < 0 || state.currentVolume() > state.maxVolume()) {
            throw invalid("cargo current volume must be between 0 and " + state.maxVolume());
        }
    }

    static @NotNull CargoState created(@NotNull CargoCreatedEvent event, CargoState isNull) {
        return new CargoState(event.id(), event.origin(), event.destination(), event.maxWeight(), event.maxVolume(),
                0.0, 0.0, CargoStatus.CREATED, List.of(), null);
    }

    static @NotNull CargoState shipmentLoaded(@NotNull ShipmentLoadedEvent event, @NotNull CargoState state) {
        List<Shipment> shipments = new ArrayList<>(state.shipments());
        shipments.add(event.shipment());
        return state.withShipments(shipments, CargoStatus.LOADING);
    }

    static @NotNull CargoState shipmentUnloaded(@NotNull ShipmentUnloadedEvent event, @NotNull CargoState state) {
        List<Shipment> shipments = new ArrayList<>();
        for (Shipment shipment : state.shipments()) {
            if (!shipment.id().equals(event.shipmentId())) {
                shipments.add(shipment);
            } else if (!event.destinationUnload()) {
                shipments.add(shipment.unloaded(event.unloadedAt()));
            }
        }
        boolean onBoard = shipments.stream().anyMatch(shipment -> shipment.status() == ShipmentStatus.LOADED
                || shipment.status() == ShipmentStatus.IN_TRANSIT);
        return state.withShipments(shipments, onBoard ? CargoStatus.UNLOADING : CargoStatus.COMPLETED);
    }

    static @NotNull CargoState transportStarted(@NotNull TransportStartedEvent event, @NotNull CargoState state) {
        CargoState.Transport transport = new CargoState.Transport(event.transportMode(), event.vehicleId(), event.driverId(),
                event.route(), event.startedAt(), event.estimatedArrival(), null);
        return state.withTransport(transport,
                state.shipments().stream().map(shipment -> shipment.withStatus(ShipmentStatus.IN_TRANSIT)).toList(),
                CargoStatus.IN_TRANSIT);
    }

    static @NotNull CargoState transportCompleted(@NotNull TransportCompletedEvent event, @NotNull CargoState state) {
        return state.withTransport(state.transport() != null ? state.transport().completed(event.completedAt()) : null,
                state.shipments().stream()
                        .map(shipment -> shipment.status() == ShipmentStatus.IN_TRANSIT ? shipment.withStatus(ShipmentStatus.DELIVERED) : shipment)
                        .toList(),
                CargoStatus.COMPLETED);
    }
}
