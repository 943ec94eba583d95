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

package org.elasticsoftware.strata.query;

import org.elasticsoftware.strata.StrataException;
import org.elasticsoftware.strata.UnsupportedTypeException;
import org.elasticsoftware.strata.ValidationException;
import org.elasticsoftware.strata.protocol.QueryRecord;
import org.elasticsoftware.strata.registry.FreezableRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

public class QueryDispatcher extends FreezableRegistry {
    private static final Logger log = LoggerFactory.getLogger(QueryDispatcher.class);
    private final Map<String, QueryHandler<?, ?>> handlers = new LinkedHashMap<>();
    private final QueryValidator validator;

    public QueryDispatcher(QueryValidator validator) {
        this.validator = validator;
    }

    public synchronized QueryDispatcher register(QueryHandler<?, ?> handler) {
        checkNotFrozen();
        String queryType = handler.getQueryType().typeName();
        if (handlers.containsKey(queryType)) {
            throw new IllegalStateException("Duplicate QueryHandler for query type " + queryType);
        }
        handlers.put(queryType, handler);
        return this;
    }

    public Set<String> getSupportedQueryTypes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    public QueryResult<Object> dispatch(QueryRecord query) {
        checkFrozen();
        try {
            if (query.queryType() == null || query.queryType().isBlank()) {
                throw new ValidationException("queryType is required");
            }
            QueryHandler<?, ?> handler = handlers.get(query.queryType());
            if (handler == null) {
                throw new UnsupportedTypeException("query", query.queryType());
            }
            return QueryResult.success(invoke(handler, query.payload()));
        } catch (StrataException e) {
            log.debug("Query {} rejected with {}: {}", query.queryType(), e.getErrorCode(), e.getMessage());
            return QueryResult.failure(e);
        }
    }

    private <Q extends Query, T> T invoke(QueryHandler<Q, T> handler, Query payload) {
        QueryType<Q> queryType = handler.getQueryType();
        if (payload == null) {
            throw new ValidationException("Query " + queryType.typeName() + " requires a payload");
        }
        if (!queryType.typeClass().isInstance(payload)) {
            throw new ValidationException("Query " + queryType.typeName() + " expects a payload of type "
                    + queryType.typeClass().getSimpleName() + " but got " + payload.getClass().getSimpleName());
        }
        Q typedQuery = queryType.typeClass().cast(payload);
        validator.validate(queryType.typeName(), typedQuery);
        return handler.handle(typedQuery);
    }
}
