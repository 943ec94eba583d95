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

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.strata.aggregate.AggregateState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

public record CargoState(@NotNull String id,
                         @NotNull String origin,
                         @NotNull String destination,
                         double maxWeight,
                         double maxVolume,
                         double currentWeight,
                         double currentVolume,
                         @NotNull CargoStatus status,
                         @NotNull List<Shipment> shipments,
                         @Nullable Transport transport) implements AggregateState {
    public CargoState {
        shipments = List.copyOf(shipments);
    }

    @Override
    public String getAggregateId() {
        return id();
    }

    public Optional<Shipment> findShipment(String shipmentId) {
        return shipments.stream().filter(shipment -> shipment.id().equals(shipmentId)).findFirst();
    }

    public double availableWeight() {
        return maxWeight - currentWeight;
    }

    public double availableVolume() {
        return maxVolume - currentVolume;
    }

    /**
     * Replaces the shipments and recomputes the load from every shipment that has not been unloaded, so
     * the totals never drift from the shipments actually on board.
     */
    public CargoState withShipments(List<Shipment> shipments, CargoStatus status) {
        double weight = 0.0;
        double volume = 0.0;
        for (Shipment shipment : shipments) {
            if (shipment.status() != ShipmentStatus.UNLOADED) {
                weight += shipment.weight();
                volume += shipment.volume();
            }
        }
        return new CargoState(id, origin, destination, maxWeight, maxVolume, weight, volume, status, shipments, transport);
    }

    public CargoState withTransport(Transport transport, List<Shipment> shipments, CargoStatus status) {
        return new CargoState(id, origin, destination, maxWeight, maxVolume, currentWeight, currentVolume, status, shipments, transport);
    }

    public record Transport(@NotNull String transportMode,
                            @NotNull String vehicleId,
                            @Nullable String driverId,
                            @Nullable String route,
                            @NotNull Instant startedAt,
                            @NotNull Instant estimatedArrival,
                            @Nullable Instant completedAt) {
        public Transport completed(Instant completedAt) {
            return new Transport(transportMode, vehicleId, driverId, route, startedAt, estimatedArrival, completedAt);
        }
    }
}
