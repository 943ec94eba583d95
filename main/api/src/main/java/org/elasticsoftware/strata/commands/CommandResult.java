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

package org.elasticsoftware.strata.commands;

import jakarta.annotation.Nullable;
import org.elasticsoftware.strata.ErrorCode;
import org.elasticsoftware.strata.StrataException;
import org.elasticsoftware.strata.protocol.DomainEventRecord;

import java.util.List;

public record CommandResult(boolean success,
                            @Nullable ErrorCode errorCode,
                            @Nullable String error,
                            String aggregateId,
                            long version,
                            List<DomainEventRecord> events,
                            @Nullable Object data) {
    public CommandResult {
        events = events != null ? List.copyOf(events) : List.of();
    }

    public static CommandResult success(String aggregateId, long version, List<DomainEventRecord> events, @Nullable Object data) {
        return new CommandResult(true, null, null, aggregateId, version, events, data);
    }

    public static CommandResult failure(@Nullable String aggregateId, StrataException exception) {
        return new CommandResult(false, exception.getErrorCode(), exception.getMessage(), aggregateId, 0L, List.of(), null);
    }
}
