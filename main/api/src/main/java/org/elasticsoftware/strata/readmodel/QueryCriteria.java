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
import java.util.*;

/**
 * Filter, sort and page settings for {@link ReadStore#query}. A limit of 0 selects the store's
 * default page size.
 */
public final class QueryCriteria {
    private final String text;
    private final Map<String, Set<String>> filters;
    private final Map<String, DateRange> dateRanges;
    private final Sort sort;
    private final int offset;
    private final int limit;

    private QueryCriteria(Builder builder) {
        this.text = builder.text;
        this.filters = Collections.unmodifiableMap(new LinkedHashMap<>(builder.filters));
        this.dateRanges = Collections.unmodifiableMap(new LinkedHashMap<>(builder.dateRanges));
        this.sort = builder.sort;
        this.offset = builder.offset;
        this.limit = builder.limit;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static QueryCriteria all() {
        return builder().build();
    }

    @Nullable
    public String getText() {
        return text;
    }

    public Map<String, Set<String>> getFilters() {
        return filters;
    }

    public Map<String, DateRange> getDateRanges() {
        return dateRanges;
    }

    @Nullable
    public Sort getSort() {
        return sort;
    }

    public int getOffset() {
        return offset;
    }

    public int getLimit() {
        return limit;
    }

    @Override
    public String toString() {
        return "QueryCriteria{text=" + text + ", filters=" + filters + ", dateRanges=" + dateRanges
                + ", sort=" + sort + ", offset=" + offset + ", limit=" + limit + "}";
    }

    public static final class Builder {
        private String text;
        private final Map<String, Set<String>> filters = new LinkedHashMap<>();
        private final Map<String, DateRange> dateRanges = new LinkedHashMap<>();
        private Sort sort;
        private int offset = 0;
        private int limit = 0;

        private Builder() {
        }

        public Builder text(@Nullable String text) {
            this.text = text == null || text.isBlank() ? null : text.trim();
            return this;
        }

        /**
         * Accepts models whose field matches any of the values. An empty or null collection adds no
         * filter.
         *
         * @throws ValidationException when one of the values is null or blank
         */
        public Builder filter(String field, @Nullable Collection<String> values) {
            if (values != null && !values.isEmpty()) {
                for (String value : values) {
                    if (value == null || value.isBlank()) {
                        throw new ValidationException("filter on '" + field + "' contains an empty value");
                    }
                }
                filters.put(field, Set.copyOf(values));
            }
            return this;
        }

        public Builder filter(String field, @Nullable String value) {
            if (value != null && !value.isBlank()) {
                filters.put(field, Set.of(value));
            }
            return this;
        }

        public Builder dateRange(String field, @Nullable Instant from, @Nullable Instant to) {
            if (from != null || to != null) {
                dateRanges.put(field, new DateRange(from, to));
            }
            return this;
        }

        public Builder sort(@Nullable Sort sort) {
            this.sort = sort;
            return this;
        }

        public Builder sort(String field, SortDirection direction) {
            this.sort = new Sort(field, direction);
            return this;
        }

        public Builder offset(int offset) {
            this.offset = offset;
            return this;
        }

        public Builder limit(int limit) {
            this.limit = limit;
            return this;
        }

        public QueryCriteria build() {
            return new QueryCriteria(this);
        }
    }
}
