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

package org.elasticsoftware.accounts.aggregates.user;

import jakarta.annotation.Nullable;

public record UserProfile(@Nullable String firstName,
                          @Nullable String lastName,
                          @Nullable String displayName,
                          @Nullable String bio,
                          @Nullable String phoneNumber,
                          @Nullable String city,
                          @Nullable String country) {
    public static UserProfile initial(String name) {
        return new UserProfile(null, null, name, null, null, null, null);
    }
}
