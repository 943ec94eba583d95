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

package org.elasticsoftware.accounts;

import org.elasticsoftware.accounts.aggregates.user.User;
import org.elasticsoftware.accounts.aggregates.user.UserState;
import org.elasticsoftware.accounts.aggregates.user.commands.*;
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
    @Bean(name = "userEventSourcingHandlers")
    public EventSourcingHandlers<UserState> userEventSourcingHandlers() {
        return User.EVENT_SOURCING_HANDLERS;
    }

    @Bean(name = "userRepository")
    public EventSourcedRepository<User> userRepository(EventStore eventStore) {
        return new EventSourcedRepository<>(User.TYPE, User::new, eventStore);
    }

    @Bean(name = "userCommandHandler")
    public AggregateCommandHandler<User> userCommandHandler(EventSourcedRepository<User> userRepository,
                                                            EventBus eventBus,
                                                            CommandValidator commandValidator) {
        return AggregateCommandHandler.builder(userRepository)
                .setEventBus(eventBus)
                .setValidator(commandValidator)
                .addCommandHandler(CreateUserCommand.TYPE, (cmd, user) -> user.create(cmd))
                .addCommandHandler(ChangeEmailCommand.TYPE, (cmd, user) -> user.changeEmail(cmd))
                .addCommandHandler(DeactivateUserCommand.TYPE, (cmd, user) -> user.deactivate(cmd))
                .addCommandHandler(ActivateUserCommand.TYPE, (cmd, user) -> user.activate(cmd))
                .addCommandHandler(AssignRoleCommand.TYPE, (cmd, user) -> user.assignRole(cmd))
                .addCommandHandler(RevokeRoleCommand.TYPE, (cmd, user) -> user.revokeRole(cmd))
                .addCommandHandler(UpdateProfileCommand.TYPE, (cmd, user) -> user.updateProfile(cmd))
                .addCommandHandler(DeleteUserCommand.TYPE, (cmd, user) -> user.delete(cmd))
                .build();
    }
}
