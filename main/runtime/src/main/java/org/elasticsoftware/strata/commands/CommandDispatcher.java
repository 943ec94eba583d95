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
import org.elasticsoftware.strata.StrataException;
import org.elasticsoftware.strata.UnsupportedTypeException;
import org.elasticsoftware.strata.protocol.CommandRecord;
import org.elasticsoftware.strata.registry.FreezableRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Routes commands to the {@link CommandHandler} registered for their type and turns failures into
 * a {@link CommandResult} carrying the {@link ErrorCode}.
 */
public class CommandDispatcher extends FreezableRegistry {
    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);
    private final Map<String, CommandHandler> handlers = new LinkedHashMap<>();

    public synchronized CommandDispatcher register(CommandHandler handler) {
        checkNotFrozen();
        for (String commandType : handler.getSupportedCommandTypes()) {
            if (handlers.containsKey(commandType)) {
                throw new IllegalStateException("Duplicate CommandHandler for command type " + commandType);
            }
        }
        handler.getSupportedCommandTypes().forEach(commandType -> handlers.put(commandType, handler));
        log.debug("Registered {} for command types {}", handler, handler.getSupportedCommandTypes());
        return this;
    }

    public Optional<CommandHandler> getCommandHandler(String commandType) {
        checkFrozen();
        return Optional.ofNullable(handlers.get(commandType));
    }

    public Set<String> getSupportedCommandTypes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    public CommandResult dispatch(CommandRecord command) {
        checkFrozen();
        try {
            CommandHandler handler = handlers.get(command.commandType());
            if (handler == null) {
                throw new UnsupportedTypeException("command", command.commandType());
            }
            return handler.handle(command);
        } catch (StrataException e) {
            if (e.getErrorCode() == ErrorCode.PERSISTENCE) {
                log.error("Command {} for {} {} failed", command.commandType(), command.aggregateType(), command.aggregateId(), e);
            } else {
                log.debug("Command {} for {} {} rejected with {}: {}",
                        command.commandType(), command.aggregateType(), command.aggregateId(), e.getErrorCode(), e.getMessage());
            }
            return CommandResult.failure(command.aggregateId(), e);
        }
    }
}
