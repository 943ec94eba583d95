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

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.shipping.aggregates.cargo.CargoStatus;
import org.elasticsoftware.strata.readmodel.ReadModel;
import org.elasticsoftware.strata.readmodel.ReadModelType;

import java.time.Instant;
import java.util.Map;

/**
 * Read side view of a cargo. {@code shipments} maps the id of every shipment still on board to its
 * description.
 */
public record CargoView(@NotNull String id,
                        long version,
                        @NotNull String origin,
                        @NotNull String destination,
                        @NotNull CargoStatus status,
                        double maxWeight,
                        double maxVolume,
                        double currentWeight,
                        double currentVolume,
                        @NotNull Map<String, String> shipments,
                        @Nullable String vehicleId,
                        @Nullable Instant estimatedArrival,
                        @NotNull Instant createdAt,
                        @NotNull Instant updatedAt,
                        boolean deleted) implements ReadModel {
    public static final ReadModelType<CargoView> TYPE = ReadModelType.builder("CargoView", CargoView.class)
            .filterField("status", CargoView::status)
            .filterField("origin", CargoView::origin)
            .filterField("destination", CargoView::destination)
            .filterField("vehicleId", CargoView::vehicleId)
            .filterField("deleted", CargoView::deleted)
            .sortField("origin", CargoView::origin)
            .sortField("destination", CargoView::destination)
            .sortField("status", cargo -> cargo.status().name())
            .sortField("currentWeight", CargoView::currentWeight)
            .sortField("shipmentCount", CargoView::shipmentCount)
            .dateField("createdAt", CargoView::createdAt)
            .dateField("updatedAt", CargoView::updatedAt)
            .build();

    public CargoView {
        shipments = Map.copyOf(shipments);
    }

    @Override
    public String getId() {
        return id();
    }

    @Override
    public long getVersion() {
        return version();
    }

    @Override
    public String getSearchableText() {
        StringBuilder text = new StringBuilder()
                .append(id).append(' ')
                .append(origin).append(' ')
                .append(destination);
        if (vehicleId != null) {
            text.append(' ').append(vehicleId);
        }
        shipments.forEach((shipmentId, description) -> text.append(' ').append(shipmentId).append(' ').append(description));
        return text.toString();
    }

    public int shipmentCount() {
        return shipments.size();
    }

    public double availableWeight() {
        return maxWeight - currentWeight;
    }
}
