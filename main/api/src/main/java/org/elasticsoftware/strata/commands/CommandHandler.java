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

import org.elasticsoftware.strata.protocol.CommandRecord;

import java.util.Set;

public interface CommandHandler {
    String getAggregateType();

    Set<String> getSupportedCommandTypes();

    default boolean supports(String commandType) {
        return getSupportedCommandTypes().contains(commandType);
    }

    /**
     * Runs the command against its aggregate.
     *
     * @throws org.elasticsoftware.strata.StrataException on any failure; nothing is persisted or published then
     */
    CommandResult handle(CommandRecord command);
}
