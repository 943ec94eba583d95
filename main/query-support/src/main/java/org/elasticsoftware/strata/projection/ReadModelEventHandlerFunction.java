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

package org.elasticsoftware.strata.projection;

import jakarta.validation.constraints.NotNull;
import org.elasticsoftware.strata.events.DomainEvent;
import org.elasticsoftware.strata.protocol.DomainEventRecord;
import org.elasticsoftware.strata.readmodel.ReadModel;

/**
 * Folds one event into a read model. The returned read model must carry {@code record.version()}
 * as its version. {@code current} is null when no read model exists yet.
 */
@FunctionalInterface
public interface ReadModelEventHandlerFunction<R extends ReadModel, E extends DomainEvent> {
    @NotNull R apply(@NotNull E event, @NotNull DomainEventRecord record, R current);
}
