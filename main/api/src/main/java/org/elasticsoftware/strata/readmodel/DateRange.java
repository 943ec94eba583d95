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

import jakarta.annotation.Nullable;
import org.elasticsoftware.strata.ValidationException;

import java.time.Instant;

/**
 * Half-open range: {@code from} inclusive, {@code to} exclusive. Either end may be open.
 */
public record DateRange(@Nullable Instant from, @Nullable Instant to) {
    public DateRange {
        if (from != null && to != null && !from.isBefore(to)) {
            throw new ValidationException("Invalid date range: " + from + " is not before " + to);
        }
    }

    public static DateRange after(Instant from) {
        return new DateRange(from, null);
    }

    public static DateRange before(Instant to) {
        return new DateRange(null, to);
    }

    public boolean contains(@Nullable Instant instant) {
        if (instant == null) {
            return false;
        }
        return (from == null || !instant.isBefore(from)) && (to == null || instant.isBefore(to));
    }
}
