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

import org.elasticsoftware.strata.query.QueryHandler;
import org.elasticsoftware.strata.query.QueryType;
import org.elasticsoftware.strata.readmodel.*;

public class SearchCargoQueryHandler implements QueryHandler<SearchCargoQuery, Page<CargoView>> {
    private final ReadStore readStore;

    public SearchCargoQueryHandler(ReadStore readStore) {
        this.readStore = readStore;
    }

    @Override
    public QueryType<SearchCargoQuery> getQueryType() {
        return SearchCargoQuery.TYPE;
    }

    @Override
    public Page<CargoView> handle(SearchCargoQuery query) {
        QueryCriteria.Builder criteria = QueryCriteria.builder()
                .text(query.text())
                .filter("status", query.statuses())
                .filter("origin", query.origin())
                .filter("destination", query.destination())
                .dateRange("createdAt", query.createdFrom(), query.createdTo())
                .sort(query.sortBy() != null ? query.sortBy() : "createdAt",
                        query.sortDirection() != null ? SortDirection.fromString(query.sortDirection()) : SortDirection.DESC)
                .offset(query.offset())
                .limit(query.limit());
        if (!query.includeDeleted()) {
            criteria.filter("deleted", "false");
        }
        return readStore.query(CargoView.TYPE, criteria.build());
    }
}
