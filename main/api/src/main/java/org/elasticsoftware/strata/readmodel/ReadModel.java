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

package org.elasticsoftware.strata.readmodel;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.validation.constraints.NotNull;

/**
 * A denormalized view written by exactly one projection. {@link #getVersion()} is the version of the
 * last event of the source aggregate incorporated into it.
 */
public interface ReadModel {
    @JsonIgnore
    @NotNull String getId();

    @JsonIgnore
    long getVersion();

    @JsonIgnore
    default String getSearchableText() {
        return "";
    }
}
