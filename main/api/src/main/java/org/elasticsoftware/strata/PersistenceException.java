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
 * Failure of an underlying store. A save that ends in this exception did not durably succeed and
 * its events must not be published.
 */
public class PersistenceException extends StrataException {
    public PersistenceException(String message, Throwable cause) {
        super(message, null, null, cause);
    }

    public PersistenceException(String message, String aggregateType, String aggregateId) {
        super(message, aggregateType, aggregateId);
    }

    public PersistenceException(String message, String aggregateType, String aggregateId, Throwable cause) {
        super(message, aggregateType, aggregateId, cause);
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.PERSISTENCE;
    }
}
