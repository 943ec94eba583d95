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

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import org.elasticsoftware.strata.ValidationException;
import org.elasticsoftware.strata.protocol.CommandRecord;
import org.hibernate.validator.messageinterpolation.ParameterMessageInterpolator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Structural validation of incoming commands: the envelope fields plus the jakarta.validation
 * constraints declared on the payload record. Runs before any storage access.
 */
public class CommandValidator {
    private final Validator validator;

    public CommandValidator(Validator validator) {
        this.validator = validator;
    }

    public static CommandValidator createDefault() {
        return new CommandValidator(Validation.byDefaultProvider()
                .configure()
                .messageInterpolator(new ParameterMessageInterpolator())
                .buildValidatorFactory()
                .getValidator());
    }

    public void validate(CommandRecord command) {
        List<String> errors = new ArrayList<>();
        if (isBlank(command.commandType())) {
            errors.add("commandType is required");
        }
        if (isBlank(command.aggregateType())) {
            errors.add("aggregateType is required");
        }
        if (command.payload() == null) {
            errors.add("payload is required");
        } else {
            if (isBlank(command.aggregateId())) {
                errors.add("aggregateId is required");
            }
            validator.validate(command.payload()).stream()
                    .sorted(Comparator.comparing(violation -> violation.getPropertyPath().toString()))
                    .map(CommandValidator::describe)
                    .forEach(errors::add);
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid command " + command.commandType() + ": " + String.join(", ", errors),
                    command.aggregateType(), command.aggregateId());
        }
    }

    private static String describe(ConstraintViolation<?> violation) {
        return violation.getPropertyPath() + " " + violation.getMessage();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
