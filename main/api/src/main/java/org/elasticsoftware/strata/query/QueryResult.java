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

import jakarta.annotation.Nullable;
import org.elasticsoftware.strata.ErrorCode;
import org.elasticsoftware.strata.StrataException;

public record QueryResult<T>(boolean success, @Nullable ErrorCode errorCode, @Nullable String error, @Nullable T data) {
    public static <T> QueryResult<T> success(T data) {
        return new QueryResult<>(true, null, null, data);
    }

    public static <T> QueryResult<T> failure(StrataException exception) {
        return new QueryResult<>(false, exception.getErrorCode(), exception.getMessage(), null);
    }
}
