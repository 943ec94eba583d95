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

package org.elasticsoftware.strata.eventstore;

import org.elasticsoftware.strata.protocol.DomainEventRecord;

import java.util.List;

public final class EventStreamValidator {
    private EventStreamValidator() {
    }

    /**
     * Checks that {@code events} all belong to the aggregate and continue its stream at {@code expectedVersion + 1}.
     */
    public static void validateBatch(String aggregateId, String aggregateType, long expectedVersion, List<DomainEventRecord> events) {
        if (expectedVersion < 0) {
            throw new IllegalArgumentException("expectedVersion must not be negative, got " + expectedVersion);
        }
        long next = expectedVersion + 1;
        for (DomainEventRecord event : events) {
            if (!aggregateId.equals(event.aggregateId()) || !aggregateType.equals(event.aggregateType())) {
                throw new IllegalArgumentException("DomainEvent " + event.eventType() + " for " + event.aggregateType()
                        + " " + event.aggregateId() + " cannot be appended to " + aggregateType + " " + aggregateId);
            }
            if (event.version() != next) {
                throw new IllegalArgumentException("Non-contiguous batch for " + aggregateType + " " + aggregateId
                        + ": expected version " + next + " but got " + event.version());
            }
            next++;
        }
    }
}
