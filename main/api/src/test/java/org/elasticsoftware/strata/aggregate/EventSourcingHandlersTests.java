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

import org.elasticsoftware.strata.UnsupportedTypeException;
import org.elasticsoftware.strata.aggregate.wallet.*;
import org.elasticsoftware.strata.events.DomainEventType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

public class EventSourcingHandlersTests {
    @Test
    public void testLookupByNameAndClass() {
        EventSourcingHandlers<WalletState> handlers = Wallet.HANDLERS;

        Assertions.assertEquals("Wallet", handlers.getAggregateType());
        Assertions.assertTrue(handlers.supports("WalletCredited"));
        Assertions.assertFalse(handlers.supports("WalletRenamed"));
        Assertions.assertEquals(WalletClosedEvent.TYPE, handlers.getEventType(WalletClosedEvent.class));
        Assertions.assertEquals(WalletCreatedEvent.TYPE, handlers.getEventType("WalletCreated"));
        Assertions.assertEquals(List.of(WalletCreatedEvent.TYPE, WalletCreditedEvent.TYPE, WalletDebitedEvent.TYPE, WalletClosedEvent.TYPE),
                handlers.getDomainEventTypes());
    }

    @Test
    public void testUnknownEventType() {
        UnsupportedTypeException exception = Assertions.assertThrows(UnsupportedTypeException.class,
                () -> Wallet.HANDLERS.getEventType("WalletRenamed"));

        Assertions.assertEquals("event", exception.getKind());
        Assertions.assertEquals("WalletRenamed", exception.getTypeName());
    }

    @Test
    public void testExactlyOneCreateHandlerIsRequired() {
        Assertions.assertThrows(IllegalStateException.class, () -> EventSourcingHandlers.<WalletState>builder("Wallet")
                .on(WalletCreditedEvent.TYPE, (event, state) -> state)
                .build());
        DomainEventType<WalletCreditedEvent> creatingCredit = new DomainEventType<>("WalletOpenedWithCredit", WalletCreditedEvent.class, true, false);
        Assertions.assertThrows(IllegalStateException.class, () -> EventSourcingHandlers.<WalletState>builder("Wallet")
                .on(WalletCreatedEvent.TYPE, (event, state) -> state)
                .on(creatingCredit, (event, state) -> state)
                .build());
    }

    @Test
    public void testDuplicateHandlerIsRejected() {
        EventSourcingHandlers.Builder<WalletState> builder = EventSourcingHandlers.<WalletState>builder("Wallet")
                .on(WalletCreatedEvent.TYPE, (event, state) -> state);

        Assertions.assertThrows(IllegalStateException.class, () -> builder.on(WalletCreatedEvent.TYPE, (event, state) -> state));
    }

    @Test
    public void testEventTypeCannotCreateAndDelete() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new DomainEventType<>("WalletReset", WalletCreatedEvent.class, true, true));
    }
}
