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

package org.elasticsoftware.accounts.aggregates.user;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.strata.aggregate.AggregateState;

import java.time.Instant;
import java.util.List;

public record UserState(@NotNull String id,
                        @NotNull String email,
                        @NotNull String name,
                        @NotNull UserStatus status,
                        @NotNull UserProfile profile,
                        @NotNull List<Role> roles,
                        @Nullable String deactivationReason,
                        @Nullable Instant deactivatedAt) implements AggregateState {
    public UserState {
        roles = List.copyOf(roles);
    }

    @Override
    public String getAggregateId() {
        return id();
    }

    public boolean hasRole(RoleType type) {
        return roles.stream().anyMatch(role -> role.type() == type);
    }

    public UserState withEmail(String email) {
        return new UserState(id, email, name, status, profile, roles, deactivationReason, deactivatedAt);
    }

    public UserState withStatus(UserStatus status, @Nullable String deactivationReason, @Nullable Instant deactivatedAt) {
        return new UserState(id, email, name, status, profile, roles, deactivationReason, deactivatedAt);
    }

    public UserState withRoles(List<Role> roles) {
        return new UserState(id, email, name, status, profile, roles, deactivationReason, deactivatedAt);
    }

    public UserState withProfile(UserProfile profile) {
        return new UserState(id, email, name, status, profile, roles, deactivationReason, deactivatedAt);
    }
}
