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

package org.elasticsoftware.strata.aggregate.wallet;

import org.elasticsoftware.strata.events.DomainEvent;
import org.elasticsoftware.strata.events.DomainEventType;

public record WalletClosedEvent(String id) implements DomainEvent {
    public static final DomainEventType<WalletClosedEvent> TYPE = new DomainEventType<>("WalletClosed", WalletClosedEvent.class, false, true);

    @Override
    public String getAggregateId() {
        return id();
    }
}
