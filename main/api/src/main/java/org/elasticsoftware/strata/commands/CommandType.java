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

import java.util.Objects;

/**
 * Type tag of a command. {@code create} commands start a new aggregate, all others load an existing one.
 */
public record CommandType<C extends Command>(String typeName, Class<C> typeClass, boolean create) {
    public CommandType {
        Objects.requireNonNull(typeName, "typeName");
        Objects.requireNonNull(typeClass, "typeClass");
    }
}
