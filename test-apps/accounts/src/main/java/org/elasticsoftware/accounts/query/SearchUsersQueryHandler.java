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

import org.elasticsoftware.strata.ValidationException;
import org.elasticsoftware.strata.query.QueryHandler;
import org.elasticsoftware.strata.query.QueryType;
import org.elasticsoftware.strata.readmodel.*;

import java.util.Set;

public class SearchUsersQueryHandler implements QueryHandler<SearchUsersQuery, Page<UserView>> {
    private static final Set<String> SORT_FIELDS = Set.of("name", "email", "createdAt", "status");
    private final ReadStore readStore;

    public SearchUsersQueryHandler(ReadStore readStore) {
        this.readStore = readStore;
    }

    @Override
    public QueryType<SearchUsersQuery> getQueryType() {
        return SearchUsersQuery.TYPE;
    }

    @Override
    public Page<UserView> handle(SearchUsersQuery query) {
        String sortBy = query.sortBy() != null ? query.sortBy() : "createdAt";
        if (!SORT_FIELDS.contains(sortBy)) {
            throw new ValidationException("Cannot sort users on '" + sortBy + "', expected one of " + SORT_FIELDS);
        }
        QueryCriteria.Builder criteria = QueryCriteria.builder()
                .text(query.text())
                .filter("status", query.statuses())
                .filter("roles", query.roles())
                .filter("country", query.country())
                .dateRange("createdAt", query.createdFrom(), query.createdTo())
                .sort(sortBy, query.sortDirection() != null ? SortDirection.fromString(query.sortDirection()) : SortDirection.DESC)
                .offset(query.offset())
                .limit(query.limit());
        if (!query.includeDeleted()) {
            criteria.filter("deleted", "false");
        }
        return readStore.query(UserView.TYPE, criteria.build());
    }
}
