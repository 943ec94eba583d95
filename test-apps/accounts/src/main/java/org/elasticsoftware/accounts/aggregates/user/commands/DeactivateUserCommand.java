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

package org.elasticsoftware.accounts.aggregates.user.commands;

import jakarta.annotation.Nonnull;
import jakarta.validation.constraints.NotBlank;
import org.elasticsoftware.strata.commands.Command;
import org.elasticsoftware.strata.commands.CommandType;

public record DeactivateUserCommand(
        @NotBlank String id,
        @NotBlank String reason
) implements Command {
    public static final CommandType<DeactivateUserCommand> TYPE = new CommandType<>("DeactivateUser", DeactivateUserCommand.class, false);

    @Nonnull
    @Override
    public String getAggregateId() {
        return id();
    }
}
