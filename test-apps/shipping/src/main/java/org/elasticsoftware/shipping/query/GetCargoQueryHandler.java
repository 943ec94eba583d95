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
import org.elasticsoftware.strata.readmodel.ReadStore;

public class GetCargoQueryHandler implements QueryHandler<GetCargoQuery, CargoView> {
    private final ReadStore readStore;

    public GetCargoQueryHandler(ReadStore readStore) {
        this.readStore = readStore;
    }

    @Override
    public QueryType<GetCargoQuery> getQueryType() {
        return GetCargoQuery.TYPE;
    }

    @Override
    public CargoView handle(GetCargoQuery query) {
        return readStore.getById(CargoView.TYPE, query.id());
    }
}
