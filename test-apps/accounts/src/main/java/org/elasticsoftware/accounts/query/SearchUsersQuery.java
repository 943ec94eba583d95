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
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import org.elasticsoftware.strata.query.Query;
import org.elasticsoftware.strata.query.QueryType;

import java.time.Instant;
import java.util.List;

/**
 * Searches user views on free text, status, roles, country and creation date. Sortable on
 * {@code name}, {@code email}, {@code createdAt} and {@code status}; defaults to {@code createdAt}
 * descending. A limit of 0 selects the default page size.
 */
public record SearchUsersQuery(@Nullable String text,
                               @Nullable List<@NotBlank String> statuses,
                               @Nullable List<@NotBlank String> roles,
                               @Nullable String country,
                               @Nullable Instant createdFrom,
                               @Nullable Instant createdTo,
                               boolean includeDeleted,
                               @Nullable String sortBy,
                               @Nullable String sortDirection,
                               @PositiveOrZero int offset,
                               @PositiveOrZero int limit) implements Query {
    public static final QueryType<SearchUsersQuery> TYPE = new QueryType<>("SearchUsers", SearchUsersQuery.class);

    public static SearchUsersQuery page(int offset, int limit) {
        return new SearchUsersQuery(null, null, null, null, null, null, false, null, null, offset, limit);
    }
}
