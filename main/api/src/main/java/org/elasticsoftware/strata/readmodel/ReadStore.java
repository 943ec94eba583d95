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

import java.util.Optional;

public interface ReadStore {
    <R extends ReadModel> void save(ReadModelType<R> type, R readModel);

    <R extends ReadModel> Optional<R> findById(ReadModelType<R> type, String id);

    /**
     * @throws ReadModelNotFoundException when absent
     */
    default <R extends ReadModel> R getById(ReadModelType<R> type, String id) {
        return findById(type, id).orElseThrow(() -> new ReadModelNotFoundException(type.getTypeName(), id));
    }

    <R extends ReadModel> boolean delete(ReadModelType<R> type, String id);

    /**
     * Removes every read model of the type.
     */
    <R extends ReadModel> void deleteAll(ReadModelType<R> type);

    <R extends ReadModel> long count(ReadModelType<R> type);

    /**
     * @throws org.elasticsoftware.strata.ValidationException when the criteria refer to unknown fields
     *                                                        or carry a negative offset or limit
     */
    <R extends ReadModel> Page<R> query(ReadModelType<R> type, QueryCriteria criteria);
}
