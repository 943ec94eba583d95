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

import org.elasticsoftware.strata.aggregate.ConcurrencyConflictException;
import org.elasticsoftware.strata.aggregate.wallet.WalletCreatedEvent;
import org.elasticsoftware.strata.aggregate.wallet.WalletCreditedEvent;
import org.elasticsoftware.strata.events.Issuer;
import org.elasticsoftware.strata.protocol.DomainEventRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemoryEventStoreTests {
    static DomainEventRecord created(String walletId) {
        return new DomainEventRecord("WalletCreated", walletId, "Wallet", 1L, Instant.now(), Issuer.SYSTEM,
                new WalletCreatedEvent(walletId, "EUR"));
    }

    static DomainEventRecord credited(String walletId, long version, String amount) {
        return new DomainEventRecord("WalletCredited", walletId, "Wallet", version, Instant.now(), Issuer.SYSTEM,
                new WalletCreditedEvent(walletId, new BigDecimal(amount)));
    }

    @Test
    public void testAppendAndRead() {
        InMemoryEventStore eventStore = new InMemoryEventStore();
        eventStore.append("w1", "Wallet", 0L, List.of(created("w1"), credited("w1", 2L, "10")));
        eventStore.append("w1", "Wallet", 2L, List.of(credited("w1", 3L, "5")));

        List<DomainEventRecord> events = eventStore.read("w1");
        Assertions.assertEquals(3, events.size());
        Assertions.assertEquals(List.of(1L, 2L, 3L), events.stream().map(DomainEventRecord::version).toList());
        Assertions.assertEquals(3L, eventStore.currentVersion("w1"));
        Assertions.assertEquals(List.of(3L), eventStore.read("w1", 3L).stream().map(DomainEventRecord::version).toList());
        Assertions.assertTrue(eventStore.exists("w1"));
    }

    @Test
    public void testUnknownAggregate() {
        InMemoryEventStore eventStore = new InMemoryEventStore();

        Assertions.assertTrue(eventStore.read("missing").isEmpty());
        Assertions.assertEquals(0L, eventStore.currentVersion("missing"));
        Assertions.assertFalse(eventStore.exists("missing"));
        Assertions.assertTrue(eventStore.aggregateIds("Wallet").isEmpty());
    }

    @Test
    public void testStaleExpectedVersionIsRejected() {
        InMemoryEventStore eventStore = new InMemoryEventStore();
        eventStore.append("w1", "Wallet", 0L, List.of(created("w1")));

        ConcurrencyConflictException exception = Assertions.assertThrows(ConcurrencyConflictException.class,
                () -> eventStore.append("w1", "Wallet", 0L, List.of(created("w1"))));

        Assertions.assertEquals(0L, exception.getExpectedVersion());
        Assertions.assertEquals(1L, exception.getActualVersion());
        Assertions.assertEquals(1L, eventStore.currentVersion("w1"));
    }

    @Test
    public void testEmptyBatchIsANoOp() {
        InMemoryEventStore eventStore = new InMemoryEventStore();
        eventStore.append("w1", "Wallet", 0L, List.of());

        Assertions.assertFalse(eventStore.exists("w1"));
    }

    @Test
    public void testNonContiguousBatchIsRejected() {
        InMemoryEventStore eventStore = new InMemoryEventStore();

        Assertions.assertThrows(IllegalArgumentException.class,
                () -> eventStore.append("w1", "Wallet", 0L, List.of(created("w1"), credited("w1", 3L, "1"))));
        Assertions.assertFalse(eventStore.exists("w1"));
    }

    @Test
    public void testAggregateIdsInCreationOrder() {
        InMemoryEventStore eventStore = new InMemoryEventStore();
        eventStore.append("w2", "Wallet", 0L, List.of(created("w2")));
        eventStore.append("w1", "Wallet", 0L, List.of(created("w1")));
        eventStore.append("w2", "Wallet", 1L, List.of(credited("w2", 2L, "1")));

        Assertions.assertEquals(List.of("w2", "w1"), eventStore.aggregateIds("Wallet"));
    }

    @Test
    public void testConcurrentAppendsHaveExactlyOneWinner() throws InterruptedException {
        InMemoryEventStore eventStore = new InMemoryEventStore();
        eventStore.append("w1", "Wallet", 0L, List.of(created("w1")));
        int writers = 8;
        ExecutorService executor = Executors.newFixedThreadPool(writers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        AtomicInteger conflicts = new AtomicInteger();
        for (int i = 0; i < writers; i++) {
            String amount = Integer.toString(i + 1);
            executor.submit(() -> {
                start.await();
                try {
                    eventStore.append("w1", "Wallet", 1L, List.of(credited("w1", 2L, amount)));
                    winners.incrementAndGet();
                } catch (ConcurrencyConflictException e) {
                    conflicts.incrementAndGet();
                }
                return null;
            });
        }
        start.countDown();
        executor.shutdown();
        Assertions.assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        Assertions.assertEquals(1, winners.get());
        Assertions.assertEquals(writers - 1, conflicts.get());
        Assertions.assertEquals(2L, eventStore.currentVersion("w1"));
        Assertions.assertEquals(2, eventStore.read("w1").size());
    }
}
