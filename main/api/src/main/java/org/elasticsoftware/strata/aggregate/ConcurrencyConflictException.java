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

package org.elasticsoftware.strata.aggregate;

import org.elasticsoftware.strata.ErrorCode;
import org.elasticsoftware.strata.StrataException;

/**
 * The stored stream was advanced by another writer after the aggregate was loaded. The caller must
 * reload and reapply its intent, or give up.
 */
public class ConcurrencyConflictException extends StrataException {
    private final long expectedVersion;
    private final long actualVersion;

    public ConcurrencyConflictException(String aggregateType, String aggregateId, long expectedVersion, long actualVersion) {
        super("Concurrency conflict on " + aggregateType + " " + aggregateId
                + ": expected version " + expectedVersion + " but was " + actualVersion, aggregateType, aggregateId);
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.CONCURRENCY_CONFLICT;
    }
}
