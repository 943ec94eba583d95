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

package org.elasticsoftware.shipping.aggregates.cargo.commands;

import jakarta.annotation.Nonnull;
import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.strata.commands.Command;
import org.elasticsoftware.strata.commands.CommandType;

import java.time.Instant;

public record StartTransportCommand(
        @NotBlank String id,
        @NotBlank String transportMode,
        @NotBlank String vehicleId,
        @Nullable String driverId,
        @Nullable String route,
        @NotNull Instant estimatedArrival,
        @NotBlank String startedBy
) implements Command {
    public static final CommandType<StartTransportCommand> TYPE = new CommandType<>("StartTransport", StartTransportCommand.class, false);

    @Nonnull
    @Override
    public String getAggregateId() {
        return id();
    }
}
