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

import java.time.Instant;
import java.util.*;
import java.util.function.Function;

/**
 * Describes one read model type and the fields a {@link QueryCriteria} may refer to. Every field is
 * declared up front with an accessor, so the set of sortable and filterable fields is fixed.
 */
public final class ReadModelType<R extends ReadModel> {
    private final String typeName;
    private final Class<R> typeClass;
    private final Map<String, Function<R, ? extends Comparable<?>>> sortFields;
    private final Map<String, Function<R, Collection<String>>> filterFields;
    private final Map<String, Function<R, Instant>> dateFields;

    private ReadModelType(Builder<R> builder) {
        this.typeName = builder.typeName;
        this.typeClass = builder.typeClass;
        this.sortFields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.sortFields));
        this.filterFields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.filterFields));
        this.dateFields = Collections.unmodifiableMap(new LinkedHashMap<>(builder.dateFields));
    }

    public static <R extends ReadModel> Builder<R> builder(String typeName, Class<R> typeClass) {
        return new Builder<>(typeName, typeClass);
    }

    public String getTypeName() {
        return typeName;
    }

    public Class<R> getTypeClass() {
        return typeClass;
    }

    public Optional<Function<R, ? extends Comparable<?>>> getSortField(String name) {
        return Optional.ofNullable(sortFields.get(name));
    }

    public Optional<Function<R, Collection<String>>> getFilterField(String name) {
        return Optional.ofNullable(filterFields.get(name));
    }

    public Optional<Function<R, Instant>> getDateField(String name) {
        return Optional.ofNullable(dateFields.get(name));
    }

    public Set<String> getSortFieldNames() {
        return sortFields.keySet();
    }

    public Set<String> getFilterFieldNames() {
        return filterFields.keySet();
    }

    public Set<String> getDateFieldNames() {
        return dateFields.keySet();
    }

    @Override
    public String toString() {
        return "ReadModelType{" + typeName + "}";
    }

    public static final class Builder<R extends ReadModel> {
        private final String typeName;
        private final Class<R> typeClass;
        private final Map<String, Function<R, ? extends Comparable<?>>> sortFields = new LinkedHashMap<>();
        private final Map<String, Function<R, Collection<String>>> filterFields = new LinkedHashMap<>();
        private final Map<String, Function<R, Instant>> dateFields = new LinkedHashMap<>();

        private Builder(String typeName, Class<R> typeClass) {
            this.typeName = Objects.requireNonNull(typeName, "typeName");
            this.typeClass = Objects.requireNonNull(typeClass, "typeClass");
        }

        public Builder<R> sortField(String name, Function<R, ? extends Comparable<?>> accessor) {
            sortFields.put(name, accessor);
            return this;
        }

        /**
         * An equality filter on a single valued field. Enums are matched on their name.
         */
        public Builder<R> filterField(String name, Function<R, ?> accessor) {
            filterFields.put(name, model -> {
                Object value = accessor.apply(model);
                if (value == null) {
                    return List.of();
                }
                return List.of(value instanceof Enum<?> e ? e.name() : value.toString());
            });
            return this;
        }

        /**
         * An equality filter on a multi valued field such as roles or tags; a model matches when any
         * of its values is accepted.
         */
        public Builder<R> multiValuedFilterField(String name, Function<R, Collection<String>> accessor) {
            filterFields.put(name, model -> {
                Collection<String> values = accessor.apply(model);
                return values != null ? values : List.of();
            });
            return this;
        }

        /**
         * A date field, usable in range filters and as a sort field.
         */
        public Builder<R> dateField(String name, Function<R, Instant> accessor) {
            dateFields.put(name, accessor);
            sortFields.put(name, accessor);
            return this;
        }

        public ReadModelType<R> build() {
            return new ReadModelType<>(this);
        }
    }
}
