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

import org.elasticsoftware.strata.protocol.DomainEventRecord;

import java.util.Set;

/**
 * A named, versioned subscriber that folds committed events into the read models it owns.
 */
public interface Projection {
    String getName();

    String getVersion();

    Set<String> getHandledEventTypes();

    default boolean canHandle(String eventType) {
        return getHandledEventTypes().contains(eventType);
    }

    /**
     * Applies one event. Events reach a projection in version order per aggregate; an event whose
     * version is not greater than the stored read model version is a no-op.
     *
     * @throws ProjectionException when the event cannot be applied
     */
    void project(DomainEventRecord event);

    /**
     * Removes every read model this projection owns.
     */
    void reset();

    /**
     * {@link #reset()} followed by a replay of the full history of every followed aggregate type.
     */
    void rebuild();
}
