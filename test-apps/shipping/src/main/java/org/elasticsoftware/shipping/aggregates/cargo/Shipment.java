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

import java.math.BigDecimal;
import java.time.Instant;

public record Shipment(@NotNull String id,
                       @NotNull String description,
                       @NotNull ShipmentType type,
                       @NotNull ShipmentStatus status,
                       double weight,
                       @NotNull Dimensions dimensions,
                       @NotNull BigDecimal value,
                       @Nullable String handlingInstructions,
                       @NotNull Instant loadedAt,
                       @Nullable Instant unloadedAt) {
    public double volume() {
        return dimensions.volume();
    }

    public Shipment withStatus(ShipmentStatus status) {
        return new Shipment(id, description, type, status, weight, dimensions, value, handlingInstructions, loadedAt, unloadedAt);
    }

    public Shipment unloaded(Instant unloadedAt) {
        return new Shipment(id, description, type, ShipmentStatus.UNLOADED, weight, dimensions, value, handlingInstructions, loadedAt, unloadedAt);
    }
}
