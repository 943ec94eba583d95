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

import org.elasticsoftware.strata.aggregate.EventSourcedRepository;
import org.elasticsoftware.strata.commands.AggregateCommandHandler;
import org.elasticsoftware.strata.eventbus.EventBus;
import org.elasticsoftware.strata.eventstore.EventStore;

public final class WalletConfiguration {
    private WalletConfiguration() {
    }

    public static EventSourcedRepository<Wallet> repository(EventStore eventStore) {
        return new EventSourcedRepository<>(Wallet.TYPE, Wallet::new, eventStore);
    }

    public static AggregateCommandHandler<Wallet> commandHandler(EventSourcedRepository<Wallet> repository, EventBus eventBus) {
        return AggregateCommandHandler.builder(repository)
                .setEventBus(eventBus)
                .addCommandHandler(CreateWalletCommand.TYPE, (cmd, wallet) -> wallet.create(cmd))
                .addCommandHandler(CreditWalletCommand.TYPE, (cmd, wallet) -> wallet.credit(cmd))
                .addCommandHandler(DebitWalletCommand.TYPE, (cmd, wallet) -> wallet.debit(cmd))
                .addCommandHandler(CloseWalletCommand.TYPE, (cmd, wallet) -> wallet.close(cmd))
                .build();
    }
}
