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

package org.elasticsoftware.strata;

import jakarta.validation.Validator;
import org.elasticsoftware.strata.eventbus.EventBus;
import org.elasticsoftware.strata.projection.Projection;
import org.elasticsoftware.strata.projection.ProjectionManager;
import org.elasticsoftware.strata.query.QueryDispatcher;
import org.elasticsoftware.strata.query.QueryHandler;
import org.elasticsoftware.strata.query.QueryValidator;
import org.elasticsoftware.strata.readmodel.InMemoryReadStore;
import org.elasticsoftware.strata.readmodel.QueryCriteriaEvaluator;
import org.elasticsoftware.strata.readmodel.ReadStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration(afterName = "org.elasticsoftware.strata.StrataRuntimeAutoConfiguration")
@EnableConfigurationProperties(StrataQueryProperties.class)
public class StrataQueryAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(StrataQueryAutoConfiguration.class);

    @ConditionalOnMissingBean(ReadStore.class)
    @Bean(name = "strataReadStore")
    public InMemoryReadStore readStore(StrataQueryProperties properties) {
        return new InMemoryReadStore(new QueryCriteriaEvaluator(properties.getDefaultPageSize(), properties.getMaxPageSize()));
    }

    @ConditionalOnBean(EventBus.class)
    @ConditionalOnMissingBean(ProjectionManager.class)
    @Bean(name = "strataProjectionManager", destroyMethod = "close")
    public ProjectionManager projectionManager(StrataQueryProperties properties,
                                               EventBus eventBus,
                                               ObjectProvider<Projection> projections) {
        ProjectionManager projectionManager = new ProjectionManager(eventBus);
        projections.orderedStream().forEach(projectionManager::register);
        projectionManager.freeze();
        if (properties.isRebuildOnStart()) {
            projectionManager.rebuildAll();
        }
        log.info("ProjectionManager started with projections {}", projectionManager.getProjectionNames());
        return projectionManager;
    }

    @ConditionalOnMissingBean(QueryValidator.class)
    @Bean(name = "strataQueryValidator")
    public QueryValidator queryValidator(ObjectProvider<Validator> validator) {
        Validator beanValidator = validator.getIfUnique();
        return beanValidator != null ? new QueryValidator(beanValidator) : QueryValidator.createDefault();
    }

    @ConditionalOnMissingBean(QueryDispatcher.class)
    @Bean(name = "strataQueryDispatcher")
    public QueryDispatcher queryDispatcher(QueryValidator queryValidator, ObjectProvider<QueryHandler<?, ?>> queryHandlers) {
        QueryDispatcher dispatcher = new QueryDispatcher(queryValidator);
        queryHandlers.orderedStream().forEach(dispatcher::register);
        dispatcher.freeze();
        log.info("QueryDispatcher ready for query types {}", dispatcher.getSupportedQueryTypes());
        return dispatcher;
    }
}
