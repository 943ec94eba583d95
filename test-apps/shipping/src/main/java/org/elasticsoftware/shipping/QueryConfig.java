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

package org.elasticsoftware.shipping;

import org.elasticsoftware.shipping.query.*;
import org.elasticsoftware.strata.eventstore.EventStore;
import org.elasticsoftware.strata.projection.ReadModelProjection;
import org.elasticsoftware.strata.readmodel.ReadStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class QueryConfig {
    @Bean(name = "cargoViewProjection")
    public ReadModelProjection<CargoView> cargoViewProjection(ReadStore readStore, EventStore eventStore) {
        return CargoViewProjection.create(readStore, eventStore);
    }

    @Bean(name = "searchCargoQueryHandler")
    public SearchCargoQueryHandler searchCargoQueryHandler(ReadStore readStore) {
        return new SearchCargoQueryHandler(readStore);
    }

    @Bean(name = "getCargoQueryHandler")
    public GetCargoQueryHandler getCargoQueryHandler(ReadStore readStore) {
        return new GetCargoQueryHandler(readStore);
    }
}
