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

package org.elasticsoftware.accounts.query;

import jakarta.annotation.Nullable;
import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.accounts.aggregates.user.UserStatus;
import org.elasticsoftware.strata.readmodel.ReadModel;
import org.elasticsoftware.strata.readmodel.ReadModelType;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public record UserView(@NotNull String id,
                       long version,
                       @NotNull String email,
                       @NotNull String name,
                       @Nullable String firstName,
                       @Nullable String lastName,
                       @NotNull UserStatus status,
                       @NotNull List<String> roles,
                       @Nullable String city,
                       @Nullable String country,
                       @NotNull Instant createdAt,
                       @NotNull Instant updatedAt,
                       boolean deleted) implements ReadModel {
    public static final ReadModelType<UserView> TYPE = ReadModelType.builder("UserView", UserView.class)
            .filterField("status", UserView::status)
            .filterField("country", UserView::country)
            .filterField("city", UserView::city)
            .filterField("deleted", UserView::deleted)
            .multiValuedFilterField("roles", UserView::roles)
            .sortField("name", UserView::name)
            .sortField("email", UserView::email)
            .sortField("status", user -> user.status().name())
            .dateField("createdAt", UserView::createdAt)
            .dateField("updatedAt", UserView::updatedAt)
            .build();

    public UserView {
        roles = List.copyOf(roles);
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
        return Stream.concat(Stream.of(email, name, firstName, lastName, city, country), roles.stream())
                .filter(Objects::nonNull)
                .collect(Collectors.joining(" "));
    }
}
