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

import org.elasticsoftware.strata.UnsupportedTypeException;
import org.elasticsoftware.strata.aggregate.wallet.WalletCreatedEvent;
import org.elasticsoftware.strata.aggregate.wallet.WalletCreditedEvent;
import org.elasticsoftware.strata.events.DomainEventType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Set;

public class DomainEventTypeRegistryTests {
    @Test
    public void testLookupRequiresFrozenRegistry() {
        DomainEventTypeRegistry registry = new DomainEventTypeRegistry().register(WalletCreatedEvent.TYPE);

        Assertions.assertThrows(IllegalStateException.class, () -> registry.getTypeClass("WalletCreated"));
        registry.freeze();
        Assertions.assertEquals(WalletCreatedEvent.class, registry.getTypeClass("WalletCreated"));
        Assertions.assertThrows(IllegalStateException.class, () -> registry.register(WalletCreditedEvent.TYPE));
    }

    @Test
    public void testConflictingRegistrationsAreRejected() {
        DomainEventTypeRegistry registry = new DomainEventTypeRegistry()
                .register(WalletCreatedEvent.TYPE)
                .register(WalletCreatedEvent.TYPE);

        Assertions.assertThrows(IllegalStateException.class,
                () -> registry.register(new DomainEventType<>("WalletCreated", WalletCreditedEvent.class, false, false)));
        Assertions.assertEquals(Set.of("WalletCreated"), registry.getTypeNames());
    }

    @Test
    public void testUnknownTypeName() {
        DomainEventTypeRegistry registry = new DomainEventTypeRegistry();
        registry.freeze();

        Assertions.assertThrows(UnsupportedTypeException.class, () -> registry.getTypeClass("WalletCreated"));
    }
}
