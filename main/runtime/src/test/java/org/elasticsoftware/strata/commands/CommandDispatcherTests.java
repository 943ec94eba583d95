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

import org.elasticsoftware.strata.ErrorCode;
import org.elasticsoftware.strata.PersistenceException;
import org.elasticsoftware.strata.aggregate.wallet.*;
import org.elasticsoftware.strata.eventbus.EventSubscriber;
import org.elasticsoftware.strata.eventbus.InMemoryEventBus;
import org.elasticsoftware.strata.eventstore.EventStore;
import org.elasticsoftware.strata.eventstore.InMemoryEventStore;
import org.elasticsoftware.strata.events.Issuer;
import org.elasticsoftware.strata.protocol.CommandRecord;
import org.elasticsoftware.strata.protocol.DomainEventRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.mockito.Mockito.*;

public class CommandDispatcherTests {
    private InMemoryEventStore eventStore;
    private CommandDispatcher dispatcher;

    @BeforeEach
    public void setUp() {
        eventStore = new InMemoryEventStore();
        dispatcher = new CommandDispatcher()
                .register(WalletConfiguration.commandHandler(WalletConfiguration.repository(eventStore), new InMemoryEventBus()));
        dispatcher.freeze();
    }

    @Test
    public void testSuccessfulDispatch() {
        CommandResult created = dispatcher.dispatch(new CommandRecord("CreateWallet", "Wallet", new CreateWalletCommand("w1", "EUR")));
        CommandResult credited = dispatcher.dispatch(new CommandRecord("CreditWallet", "Wallet", new CreditWalletCommand("w1", BigDecimal.TEN)));

        Assertions.assertTrue(created.success());
        Assertions.assertTrue(credited.success());
        Assertions.assertEquals(2L, credited.version());
        Assertions.assertNull(credited.errorCode());
    }

    @Test
    public void testFailuresCarryDistinctErrorCodes() {
        dispatcher.dispatch(new CommandRecord("CreateWallet", "Wallet", new CreateWalletCommand("w1", "EUR")));

        CommandResult invalid = dispatcher.dispatch(new CommandRecord("DebitWallet", "Wallet", new DebitWalletCommand("w1", BigDecimal.TEN)));
        CommandResult notFound = dispatcher.dispatch(new CommandRecord("CreditWallet", "Wallet", new CreditWalletCommand("w2", BigDecimal.TEN)));
        CommandResult unsupported = dispatcher.dispatch(new CommandRecord("RenameWallet", "Wallet", new CreditWalletCommand("w1", BigDecimal.TEN)));

        Assertions.assertFalse(invalid.success());
        Assertions.assertEquals(ErrorCode.VALIDATION, invalid.errorCode());
        Assertions.assertTrue(invalid.error().contains("insufficient funds"));
        Assertions.assertTrue(invalid.events().isEmpty());
        Assertions.assertEquals(ErrorCode.NOT_FOUND, notFound.errorCode());
        Assertions.assertEquals(ErrorCode.UNSUPPORTED_TYPE, unsupported.errorCode());
        Assertions.assertEquals(1L, eventStore.currentVersion("w1"));
    }

    @Test
    public void testConcurrencyConflictIsReportedSeparately() {
        EventStore conflictingStore = spy(new InMemoryEventStore());
        CommandDispatcher conflictingDispatcher = new CommandDispatcher()
                .register(WalletConfiguration.commandHandler(WalletConfiguration.repository(conflictingStore), new InMemoryEventBus()));
        conflictingDispatcher.freeze();
        conflictingDispatcher.dispatch(new CommandRecord("CreateWallet", "Wallet", new CreateWalletCommand("w1", "EUR")));
        // another writer sneaks in between load and save
        doAnswer(invocation -> {
            conflictingStore.append("w1", "Wallet", 1L, List.of(new DomainEventRecord("WalletCredited", "w1", "Wallet", 2L,
                    Instant.now(), Issuer.SYSTEM, new WalletCreditedEvent("w1", BigDecimal.ONE))));
            return invocation.callRealMethod();
        }).doCallRealMethod().when(conflictingStore).append(eq("w1"), eq("Wallet"), eq(1L), anyList());

        CommandResult result = conflictingDispatcher.dispatch(new CommandRecord("CreditWallet", "Wallet", new CreditWalletCommand("w1", BigDecimal.TEN)));

        Assertions.assertFalse(result.success());
        Assertions.assertEquals(ErrorCode.CONCURRENCY_CONFLICT, result.errorCode());
        Assertions.assertEquals(2L, conflictingStore.currentVersion("w1"));
    }

    @Test
    public void testPersistenceFailureIsReportedAndNothingIsPublished() {
        EventStore failingStore = mock(EventStore.class);
        when(failingStore.exists("w1")).thenReturn(false);
        doThrow(new PersistenceException("disk full", "Wallet", "w1")).when(failingStore).append(anyString(), anyString(), anyLong(), anyList());
        EventSubscriber subscriber = mock(EventSubscriber.class);
        when(subscriber.getName()).thenReturn("recorder");
        when(subscriber.canHandle(anyString())).thenReturn(true);
        InMemoryEventBus eventBus = new InMemoryEventBus();
        eventBus.subscribe(subscriber);
        CommandDispatcher failingDispatcher = new CommandDispatcher()
                .register(WalletConfiguration.commandHandler(WalletConfiguration.repository(failingStore), eventBus));
        failingDispatcher.freeze();

        CommandResult result = failingDispatcher.dispatch(new CommandRecord("CreateWallet", "Wallet", new CreateWalletCommand("w1", "EUR")));

        Assertions.assertEquals(ErrorCode.PERSISTENCE, result.errorCode());
        Assertions.assertTrue(result.events().isEmpty());
        Assertions.assertEquals(0L, eventBus.getPublishedCount());
        verify(subscriber, never()).handle(any());
        eventBus.close();
    }

    @Test
    public void testConcurrentCommandsOnOneAggregateKeepVersionsContiguous() throws InterruptedException {
        dispatcher.dispatch(new CommandRecord("CreateWallet", "Wallet", new CreateWalletCommand("w1", "EUR")));
        int commands = 20;
        ExecutorService executor = Executors.newFixedThreadPool(4);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger conflicted = new AtomicInteger();
        for (int i = 0; i < commands; i++) {
            executor.submit(() -> {
                CommandResult result = dispatcher.dispatch(new CommandRecord("CreditWallet", "Wallet", new CreditWalletCommand("w1", BigDecimal.ONE)));
                if (result.success()) {
                    succeeded.incrementAndGet();
                } else if (result.errorCode() == ErrorCode.CONCURRENCY_CONFLICT) {
                    conflicted.incrementAndGet();
                }
            });
        }
        executor.shutdown();
        Assertions.assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        Assertions.assertEquals(commands, succeeded.get() + conflicted.get());
        Assertions.assertEquals(1L + succeeded.get(), eventStore.currentVersion("w1"));
        long expected = 1L;
        for (DomainEventRecord event : eventStore.read("w1")) {
            Assertions.assertEquals(expected++, event.version());
        }
    }

    @Test
    public void testRegistrationLifecycle() {
        CommandDispatcher fresh = new CommandDispatcher();
        Assertions.assertThrows(IllegalStateException.class,
                () -> fresh.dispatch(new CommandRecord("CreateWallet", "Wallet", new CreateWalletCommand("w1", "EUR"))));

        AggregateCommandHandler<Wallet> handler = WalletConfiguration.commandHandler(WalletConfiguration.repository(eventStore), new InMemoryEventBus());
        fresh.register(handler);
        Assertions.assertThrows(IllegalStateException.class, () -> fresh.register(handler));
        fresh.freeze();
        Assertions.assertThrows(IllegalStateException.class, () -> fresh.register(handler));
        Assertions.assertTrue(fresh.getCommandHandler("CloseWallet").isPresent());
    }
}
