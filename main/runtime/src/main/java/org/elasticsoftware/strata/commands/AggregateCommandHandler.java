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

import com.google.common.util.concurrent.Striped;
import org.elasticsoftware.strata.UnsupportedTypeException;
import org.elasticsoftware.strata.ValidationException;
import org.elasticsoftware.strata.aggregate.AggregateAlreadyExistsException;
import org.elasticsoftware.strata.aggregate.AggregateRepository;
import org.elasticsoftware.strata.aggregate.AggregateRoot;
import org.elasticsoftware.strata.eventbus.EventBus;
import org.elasticsoftware.strata.events.Issuer;
import org.elasticsoftware.strata.protocol.CommandRecord;
import org.elasticsoftware.strata.protocol.DomainEventRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.concurrent.locks.Lock;

/**
 * Runs the validate, load (or create), mutate, save, publish pipeline for the commands of one
 * aggregate type. Concurrency conflicts are propagated to the caller and never retried here.
 */
public class AggregateCommandHandler<A extends AggregateRoot<?>> implements CommandHandler {
    private static final Logger log = LoggerFactory.getLogger(AggregateCommandHandler.class);
    private final AggregateRepository<A> repository;
    private final EventBus eventBus;
    private final CommandValidator validator;
    private final Map<String, Registration<A, ?>> registrations;
    // keeps publication order per aggregate equal to commit order
    private final Striped<Lock> commitLocks = Striped.lazyWeakLock(256);

    private AggregateCommandHandler(AggregateRepository<A> repository,
                                    EventBus eventBus,
                                    CommandValidator validator,
                                    Map<String, Registration<A, ?>> registrations) {
        this.repository = repository;
        this.eventBus = eventBus;
        this.validator = validator;
        this.registrations = Collections.unmodifiableMap(registrations);
    }

    public static <A extends AggregateRoot<?>> Builder<A> builder(AggregateRepository<A> repository) {
        return new Builder<>(repository);
    }

    @Override
    public String getAggregateType() {
        return repository.getAggregateType();
    }

    @Override
    public Set<String> getSupportedCommandTypes() {
        return registrations.keySet();
    }

    public List<CommandType<?>> getCommandTypes() {
        return registrations.values().stream().<CommandType<?>>map(Registration::type).toList();
    }

    @Override
    public CommandResult handle(CommandRecord command) {
        validator.validate(command);
        if (!getAggregateType().equals(command.aggregateType())) {
            throw new ValidationException("Command " + command.commandType() + " targets aggregate type "
                    + command.aggregateType() + " but is handled by " + getAggregateType(), command.aggregateType(), command.aggregateId());
        }
        Registration<A, ?> registration = registrations.get(command.commandType());
        if (registration == null) {
            throw new UnsupportedTypeException("command", command.commandType());
        }
        String aggregateId = command.aggregateId();
        A aggregate;
        if (registration.type().create()) {
            if (repository.exists(aggregateId)) {
                throw new AggregateAlreadyExistsException(getAggregateType(), aggregateId);
            }
            aggregate = repository.newInstance(aggregateId);
        } else {
            aggregate = repository.getById(aggregateId);
        }
        aggregate.setIssuer(Issuer.of(command.issuerId()));
        registration.invoke(command, aggregate);
        List<DomainEventRecord> events;
        Lock lock = commitLocks.get(aggregateId);
        lock.lock();
        try {
            events = repository.save(aggregate, aggregate.getOriginalVersion());
            publish(events);
        } finally {
            lock.unlock();
        }
        log.debug("Handled {} for {} {}, produced {} DomainEvent(s), now at version {}",
                command.commandType(), getAggregateType(), aggregateId, events.size(), aggregate.getCurrentVersion());
        return CommandResult.success(aggregateId, aggregate.getCurrentVersion(), events, aggregate.getState());
    }

    private void publish(List<DomainEventRecord> events) {
        try {
            eventBus.publishAll(events);
        } catch (RuntimeException e) {
            // the events are committed, projections catch up through a rebuild
            log.error("Failed to publish {} committed DomainEvent(s) for {} {}",
                    events.size(), getAggregateType(), events.isEmpty() ? null : events.get(0).aggregateId(), e);
        }
    }

    @Override
    public String toString() {
        return "AggregateCommandHandler{" + getAggregateType() + "}";
    }

    private record Registration<A extends AggregateRoot<?>, C extends Command>(CommandType<C> type,
                                                                              CommandHandlerFunction<A, C> function) {
        void invoke(CommandRecord command, A aggregate) {
            if (!type.typeClass().isInstance(command.payload())) {
                throw new ValidationException("Command " + type.typeName() + " expects a payload of type "
                        + type.typeClass().getSimpleName() + " but got " + command.payload().getClass().getSimpleName(),
                        command.aggregateType(), command.aggregateId());
            }
            function.apply(type.typeClass().cast(command.payload()), aggregate);
        }
    }

    public static final class Builder<A extends AggregateRoot<?>> {
        private final AggregateRepository<A> repository;
        private final Map<String, Registration<A, ?>> registrations = new LinkedHashMap<>();
        private EventBus eventBus;
        private CommandValidator validator;

        private Builder(AggregateRepository<A> repository) {
            this.repository = Objects.requireNonNull(repository, "repository");
        }

        public Builder<A> setEventBus(EventBus eventBus) {
            this.eventBus = eventBus;
            return this;
        }

        public Builder<A> setValidator(CommandValidator validator) {
            this.validator = validator;
            return this;
        }

        public <C extends Command> Builder<A> addCommandHandler(CommandType<C> type, CommandHandlerFunction<A, C> function) {
            if (registrations.containsKey(type.typeName())) {
                throw new IllegalStateException("Duplicate CommandHandler for Command " + type.typeName()
                        + " on Aggregate " + repository.getAggregateType());
            }
            registrations.put(type.typeName(), new Registration<>(type, function));
            return this;
        }

        public AggregateCommandHandler<A> build() {
            if (eventBus == null) {
                throw new IllegalStateException("An EventBus is required");
            }
            if (registrations.isEmpty()) {
                throw new IllegalStateException("Aggregate " + repository.getAggregateType() + " has no CommandHandlers");
            }
            return new AggregateCommandHandler<>(repository,
                    eventBus,
                    validator != null ? validator : CommandValidator.createDefault(),
                    new LinkedHashMap<>(registrations));
        }
    }
}
