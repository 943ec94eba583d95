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

package org.elasticsoftware.strata.readmodel;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

public class InMemoryReadStore implements ReadStore {
    private final ConcurrentMap<String, ConcurrentMap<String, ReadModel>> readModels = new ConcurrentHashMap<>();
    private final QueryCriteriaEvaluator evaluator;

    public InMemoryReadStore() {
        this(new QueryCriteriaEvaluator());
    }

    public InMemoryReadStore(QueryCriteriaEvaluator evaluator) {
        this.evaluator = evaluator;
    }

    @Override
    public <R extends ReadModel> void save(ReadModelType<R> type, R readModel) {
        Objects.requireNonNull(readModel, "readModel");
        if (!type.getTypeClass().isInstance(readModel)) {
            throw new IllegalArgumentException(readModel.getClass().getName() + " is not a " + type.getTypeName());
        }
        of(type).put(readModel.getId(), readModel);
    }

    @Override
    public <R extends ReadModel> Optional<R> findById(ReadModelType<R> type, String id) {
        return Optional.ofNullable(of(type).get(id)).map(type.getTypeClass()::cast);
    }

    @Override
    public <R extends ReadModel> boolean delete(ReadModelType<R> type, String id) {
        return of(type).remove(id) != null;
    }

    @Override
    public <R extends ReadModel> void deleteAll(ReadModelType<R> type) {
        of(type).clear();
    }

    @Override
    public <R extends ReadModel> long count(ReadModelType<R> type) {
        return of(type).size();
    }

    @Override
    public <R extends ReadModel> Page<R> query(ReadModelType<R> type, QueryCriteria criteria) {
        return evaluator.evaluate(type, snapshot(type), criteria);
    }

    public <R extends ReadModel> long count(ReadModelType<R> type, QueryCriteria criteria) {
        return evaluator.count(type, snapshot(type), criteria);
    }

    private <R extends ReadModel> List<R> snapshot(ReadModelType<R> type) {
        return of(type).values().stream().map(type.getTypeClass()::cast).toList();
    }

    private Map<String, ReadModel> of(ReadModelType<?> type) {
        return readModels.computeIfAbsent(type.getTypeName(), typeName -> new ConcurrentHashMap<>());
    }
}
