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

package org.elasticsoftware.strata.query;

import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.elasticsoftware.strata.ValidationException;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

import java.util.Comparator;
import java.util.List;

public class QueryValidator {
    private final Validator validator;

    public QueryValidator(Validator validator) {
        this.validator = validator;
    }

    public static QueryValidator createDefault() {
        return new QueryValidator(Validation.byDefaultProvider()
                .configure()
                .messageInterpolator(new ParameterMessageInterpolator())
                .buildValidatorFactory()
                .getValidator());
    }

    public void validate(String queryType, Query query) {
        List<String> errors = validator.validate(query).stream()
                .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                .map(violation -> violation.getPropertyPath() + " " + violation.getMessage())
                .toList();
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid query " + queryType + ": " + String.join(", ", errors));
        }
    }
}
