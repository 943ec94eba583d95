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

package org.elasticsoftware.strata;

import org.elasticsoftware.strata.aggregate.EventSourcedRepository;
import org.elasticsoftware.strata.aggregate.EventSourcingHandlers;
import org.elasticsoftware.strata.aggregate.wallet.CreateWalletCommand;
import org.elasticsoftware.strata.aggregate.wallet.Wallet;
import org.elasticsoftware.strata.aggregate.wallet.WalletConfiguration;
import org.elasticsoftware.strata.aggregate.wallet.WalletState;
import org.elasticsoftware.strata.commands.CommandDispatcher;
import org.elasticsoftware.strata.commands.CommandHandler;
import org.elasticsoftware.strata.commands.CommandResult;
import org.elasticsoftware.strata.eventbus.EventBus;
import org.elasticsoftware.strata.eventbus.InMemoryEventBus;
import org.elasticsoftware.strata.eventstore.DomainEventTypeRegistry;
import org.elasticsoftware.strata.eventstore.EventStore;
import org.elasticsoftware.strata.eventstore.InMemoryEventStore;
import org.elasticsoftware.strata.eventstore.RocksDBEventStore;
import org.elasticsoftware.strata.protocol.CommandRecord;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class StrataRuntimeAutoConfigurationTests {
    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(StrataRuntimeAutoConfiguration.class));

    @TempDir
    Path baseDir;

    @Configuration(proxyBeanMethods = false)
    static class WalletAggregateConfig {
        @Bean
        public EventSourcingHandlers<WalletState> walletEventSourcingHandlers() {
            return Wallet.HANDLERS;
        }

        @Bean
        public EventSourcedRepository<Wallet> walletRepository(EventStore eventStore) {
            return WalletConfiguration.repository(eventStore);
        }

        @Bean
        public CommandHandler walletCommandHandler(EventSourcedRepository<Wallet> walletRepository, EventBus eventBus) {
            return WalletConfiguration.commandHandler(walletRepository, eventBus);
        }
    }

    @Test
    public void testDefaultsToInMemoryInfrastructure() {
        contextRunner.withUserConfiguration(WalletAggregateConfig.class).run(context -> {
            assertThat(context).hasNotFailed()
                    .hasSingleBean(EventStore.class)
                    .hasSingleBean(EventBus.class)
                    .hasSingleBean(CommandDispatcher.class);
            Assertions.assertInstanceOf(InMemoryEventStore.class, context.getBean(EventStore.class));
            Assertions.assertEquals(0, context.getBean(InMemoryEventBus.class).getPartitionCount());
            Assertions.assertTrue(context.getBean(DomainEventTypeRegistry.class).isFrozen());
            Assertions.assertTrue(context.getBean(DomainEventTypeRegistry.class).getTypeNames().contains("WalletCreated"));

            CommandDispatcher dispatcher = context.getBean(CommandDispatcher.class);
            Assertions.assertTrue(dispatcher.getSupportedCommandTypes().contains("CreateWallet"));
            CommandResult result = dispatcher.dispatch(new CommandRecord("CreateWallet", "Wallet", new CreateWalletCommand("w1", "EUR")));
            Assertions.assertTrue(result.success());
            Assertions.assertEquals(1L, context.getBean(EventStore.class).currentVersion("w1"));
        });
    }

    @Test
    public void testRocksDBEventStoreAndPartitionedBus() {
        contextRunner.withUserConfiguration(WalletAggregateConfig.class)
                .withPropertyValues(
                        "strata.event-store.type=rocksdb",
                        "strata.event-store.rocksdb.base-dir=" + baseDir,
                        "strata.event-bus.partitions=3")
                .run(context -> {
                    Assertions.assertInstanceOf(RocksDBEventStore.class, context.getBean(EventStore.class));
                    Assertions.assertEquals(3, context.getBean(InMemoryEventBus.class).getPartitionCount());
                });
    }

    @Test
    public void testUserSuppliedEventStoreWins() {
        InMemoryEventStore eventStore = new InMemoryEventStore();
        contextRunner.withBean(EventStore.class, () -> eventStore)
                .run(context -> {
                    assertThat(context).hasSingleBean(EventStore.class).doesNotHaveBean(RocksDBEventStore.class);
                    Assertions.assertSame(eventStore, context.getBean(EventStore.class));
                });
    }
}
