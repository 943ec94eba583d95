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

import org.elasticsoftware.strata.ValidationException;

import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Applies {@link QueryCriteria} to a collection of read models: filter, sort (ties broken by id
 * ascending), then page. Unchanged data and criteria always give the same page.
 */
public class QueryCriteriaEvaluator {
    public static final int DEFAULT_PAGE_SIZE = 50;
    public static final int MAX_PAGE_SIZE = 1000;
    private final int defaultPageSize;
    private final int maxPageSize;

    public QueryCriteriaEvaluator() {
        this(DEFAULT_PAGE_SIZE, MAX_PAGE_SIZE);
    }

    public QueryCriteriaEvaluator(int defaultPageSize, int maxPageSize) {
        if (defaultPageSize < 1 || maxPageSize < defaultPageSize) {
            throw new IllegalArgumentException("Invalid page sizes: default " + defaultPageSize + ", max " + maxPageSize);
        }
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize = maxPageSize;
    }

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public int getMaxPageSize() {
        return maxPageSize;
    }

    public <R extends ReadModel> Page<R> evaluate(ReadModelType<R> type, Collection<R> readModels, QueryCriteria criteria) {
        validate(type, criteria);
        int offset = criteria.getOffset();
        int limit = effectiveLimit(criteria.getLimit());
        List<R> matched = readModels.stream()
                .filter(toPredicate(type, criteria))
                .sorted(toComparator(type, criteria.getSort()))
                .toList();
        int from = Math.min(offset, matched.size());
        int to = (int) Math.min((long) from + limit, matched.size());
        return new Page<>(matched.subList(from, to), matched.size(), offset, limit, to < matched.size());
    }

    public <R extends ReadModel> long count(ReadModelType<R> type, Collection<R> readModels, QueryCriteria criteria) {
        validate(type, criteria);
        return readModels.stream().filter(toPredicate(type, criteria)).count();
    }

    int effectiveLimit(int requested) {
        if (requested == 0) {
            return defaultPageSize;
        }
        return Math.min(requested, maxPageSize);
    }

    private <R extends ReadModel> void validate(ReadModelType<R> type, QueryCriteria criteria) {
        List<String> errors = new ArrayList<>();
        if (criteria.getOffset() < 0) {
            errors.add("offset must not be negative");
        }
        if (criteria.getLimit() < 0) {
            errors.add("limit must not be negative");
        }
        criteria.getFilters().keySet().stream()
                .filter(field -> type.getFilterField(field).isEmpty())
                .forEach(field -> errors.add("unknown filter field '" + field + "'"));
        criteria.getDateRanges().keySet().stream()
                .filter(field -> type.getDateField(field).isEmpty())
                .forEach(field -> errors.add("unknown date field '" + field + "'"));
        if (criteria.getSort() != null && type.getSortField(criteria.getSort().field()).isEmpty()) {
            errors.add("unknown sort field '" + criteria.getSort().field() + "', expected one of " + type.getSortFieldNames());
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid query on " + type.getTypeName() + ": " + String.join(", ", errors));
        }
    }

    private <R extends ReadModel> Predicate<R> toPredicate(ReadModelType<R> type, QueryCriteria criteria) {
        Predicate<R> predicate = readModel -> true;
        if (criteria.getText() != null) {
            String text = criteria.getText().toLowerCase(Locale.ROOT);
            predicate = predicate.and(readModel -> {
                String searchableText = readModel.getSearchableText();
                return searchableText != null && searchableText.toLowerCase(Locale.ROOT).contains(text);
            });
        }
        for (Map.Entry<String, Set<String>> filter : criteria.getFilters().entrySet()) {
            Function<R, Collection<String>> accessor = type.getFilterField(filter.getKey()).orElseThrow();
            Set<String> accepted = filter.getValue();
            predicate = predicate.and(readModel -> accessor.apply(readModel).stream()
                    .anyMatch(value -> accepted.stream().anyMatch(value::equalsIgnoreCase)));
        }
        for (Map.Entry<String, DateRange> range : criteria.getDateRanges().entrySet()) {
            Function<R, Instant> accessor = type.getDateField(range.getKey()).orElseThrow();
            DateRange dateRange = range.getValue();
            predicate = predicate.and(readModel -> dateRange.contains(accessor.apply(readModel)));
        }
        return predicate;
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private <R extends ReadModel> Comparator<R> toComparator(ReadModelType<R> type, Sort sort) {
        Comparator<R> byId = Comparator.comparing(ReadModel::getId);
        if (sort == null) {
            return byId;
        }
        Function<R, ? extends Comparable<?>> accessor = type.getSortField(sort.field()).orElseThrow();
        boolean descending = sort.direction() == SortDirection.DESC;
        Comparator<R> byField = (left, right) -> {
            Comparable leftValue = accessor.apply(left);
            Comparable rightValue = accessor.apply(right);
            // nulls last in both directions
            if (leftValue == null || rightValue == null) {
                return leftValue == rightValue ? 0 : (leftValue == null ? 1 : -1);
            }
            int result = leftValue.compareTo(rightValue);
            return descending ? -result : result;
        };
        return byField.thenComparing(byId);
    }
}
