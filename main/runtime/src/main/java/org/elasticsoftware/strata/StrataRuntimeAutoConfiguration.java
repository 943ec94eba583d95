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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validator;
import org.elasticsoftware.strata.aggregate.EventSourcingHandlers;
import org.elasticsoftware.strata.commands.CommandDispatcher;
import org.elasticsoftware.strata.commands.CommandHandler;
import org.elasticsoftware.strata.commands.CommandValidator;
import org.elasticsoftware.strata.eventbus.EventBus;
import org.elasticsoftware.strata.eventbus.InMemoryEventBus;
import org.elasticsoftware.strata.eventstore.DomainEventTypeRegistry;
import org.elasticsoftware.strata.eventstore.EventStore;
import org.elasticsoftware.strata.eventstore.InMemoryEventStore;
import org.elasticsoftware.strata.eventstore.RocksDBEventStore;
import org.elasticsoftware.strata.serialization.DomainEventRecordSerde;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

@AutoConfiguration
@EnableConfigurationProperties(StrataRuntimeProperties.class)
public class StrataRuntimeAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(StrataRuntimeAutoConfiguration.class);

    @ConditionalOnMissingBean(DomainEventTypeRegistry.class)
    @Bean(name = "strataDomainEventTypeRegistry")
    public DomainEventTypeRegistry domainEventTypeRegistry(ObjectProvider<EventSourcingHandlers<?>> eventSourcingHandlers) {
        DomainEventTypeRegistry registry = new DomainEventTypeRegistry();
        eventSourcingHandlers.orderedStream().forEach(handlers -> registry.registerAll(handlers.getDomainEventTypes()));
        registry.freeze();
        return registry;
    }

    @ConditionalOnMissingBean(EventStore.class)
    @Bean(name = "strataEventStore", destroyMethod = "close")
    public EventStore eventStore(StrataRuntimeProperties properties,
                                 DomainEventTypeRegistry domainEventTypeRegistry,
                                 ObjectProvider<ObjectMapper> objectMapper) {
        log.info("Using {} EventStore", properties.getEventStore().getType());
        return switch (properties.getEventStore().getType()) {
            case IN_MEMORY -> new InMemoryEventStore();
            case ROCKSDB -> new RocksDBEventStore(
                    properties.getEventStore().getRocksdb().getBaseDir(),
                    new DomainEventRecordSerde(objectMapper.getIfAvailable(ObjectMapper::new), domainEventTypeRegistry));
        };
    }

    @ConditionalOnMissingBean(EventBus.class)
    @Bean(name = "strataEventBus", destroyMethod = "close")
    public InMemoryEventBus eventBus(StrataRuntimeProperties properties) {
        return new InMemoryEventBus(properties.getEventBus().getPartitions());
    }

    @ConditionalOnMissingBean(CommandValidator.class)
    @Bean(name = "strataCommandValidator")
    public CommandValidator commandValidator(ObjectProvider<Validator> validator) {
        Validator beanValidator = validator.getIfUnique();
        return beanValidator != null ? new CommandValidator(beanValidator) : CommandValidator.createDefault();
    }

    @ConditionalOnMissingBean(CommandDispatcher.class)
    @Bean(name = "strataCommandDispatcher")
    public CommandDispatcher commandDispatcher(ObjectProvider<CommandHandler> commandHandlers) {
        CommandDispatcher dispatcher = new CommandDispatcher();
        commandHandlers.orderedStream().forEach(dispatcher::register);
        dispatcher.freeze();
        log.info("CommandDispatcher ready for command types {}", dispatcher.getSupportedCommandTypes());
        return dispatcher;
    }
}
