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

package org.elasticsoftware.accounts;

import org.elasticsoftware.accounts.query.*;
import org.elasticsoftware.strata.eventstore.EventStore;
import org.elasticsoftware.strata.projection.ReadModelProjection;
import org.elasticsoftware.strata.readmodel.ReadStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class QueryConfig {
    @Bean(name = "userViewProjection")
    public ReadModelProjection<UserView> userViewProjection(ReadStore readStore, EventStore eventStore) {
        return UserViewProjection.create(readStore, eventStore);
    }

    @Bean(name = "getUserQueryHandler")
    public GetUserQueryHandler getUserQueryHandler(ReadStore readStore) {
        return new GetUserQueryHandler(readStore);
    }

    @Bean(name = "searchUsersQueryHandler")
    public SearchUsersQueryHandler searchUsersQueryHandler(ReadStore readStore) {
        return new SearchUsersQueryHandler(readStore);
    }
}
