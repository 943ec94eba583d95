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

package org.elasticsoftware.shipping;

import org.elasticsoftware.shipping.aggregates.cargo.Cargo;
import org.elasticsoftware.shipping.aggregates.cargo.CargoState;
import org.elasticsoftware.shipping.aggregates.cargo.commands.*;
import org.elasticsoftware.strata.aggregate.EventSourcedRepository;
import org.elasticsoftware.strata.aggregate.EventSourcingHandlers;
import org.elasticsoftware.strata.commands.AggregateCommandHandler;
import org.elasticsoftware.strata.commands.CommandValidator;
import org.elasticsoftware.strata.eventbus.EventBus;
import org.elasticsoftware.strata.eventstore.EventStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class AggregateConfig {
    @Bean(name = "cargoEventSourcingHandlers")
    public EventSourcingHandlers<CargoState> cargoEventSourcingHandlers() {
        return Cargo.EVENT_SOURCING_HANDLERS;
    }

    @Bean(name = "cargoRepository")
    public EventSourcedRepository<Cargo> cargoRepository(EventStore eventStore) {
        return new EventSourcedRepository<>(Cargo.TYPE, Cargo::new, eventStore);
    }

    @Bean(name = "cargoCommandHandler")
    public AggregateCommandHandler<Cargo> cargoCommandHandler(EventSourcedRepository<Cargo> cargoRepository,
                                                              EventBus eventBus,
                                                              CommandValidator commandValidator) {
        return AggregateCommandHandler.builder(cargoRepository)
                .setEventBus(eventBus)
                .setValidator(commandValidator)
                .addCommandHandler(CreateCargoCommand.TYPE, (cmd, cargo) -> cargo.create(cmd))
                .addCommandHandler(LoadShipmentCommand.TYPE, (cmd, cargo) -> cargo.loadShipment(cmd))
                .addCommandHandler(UnloadShipmentCommand.TYPE, (cmd, cargo) -> cargo.unloadShipment(cmd))
                .addCommandHandler(StartTransportCommand.TYPE, (cmd, cargo) -> cargo.startTransport(cmd))
                .addCommandHandler(CompleteTransportCommand.TYPE, (cmd, cargo) -> cargo.completeTransport(cmd))
                .addCommandHandler(DeleteCargoCommand.TYPE, (cmd, cargo) -> cargo.delete(cmd))
                .build();
    }
}
