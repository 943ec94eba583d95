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

/**
 * Root of the exception hierarchy. Every failure the engine surfaces to a caller is a
 * {@link StrataException} and reports an {@link ErrorCode}, so a transport layer can tell stale
 * data ({@link ErrorCode#CONCURRENCY_CONFLICT}) apart from invalid input ({@link ErrorCode#VALIDATION}).
 */
public abstract class StrataException extends RuntimeException {
    private final String aggregateType;
    private final String aggregateId;

    protected StrataException(String message, String aggregateType, String aggregateId) {
        super(message);
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
    }

    protected StrataException(String message, String aggregateType, String aggregateId, Throwable cause) {
        super(message, cause);
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
    }

    public abstract ErrorCode getErrorCode();

    public String getAggregateType() {
        return aggregateType;
    }

    public String getAggregateId() {
        return aggregateId;
    }
}
