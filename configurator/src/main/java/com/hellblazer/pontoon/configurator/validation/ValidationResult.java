/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Pontoon Configurator.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.pontoon.configurator.validation;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a validation: valid when no errors were found. Errors are kept in the order the rules reported them.
 *
 * @author hal.hildebrand
 */
public record ValidationResult(List<ValidationError> errors) {
    private static final ValidationResult VALID = new ValidationResult(List.of());

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public static ValidationResult valid() {
        return VALID;
    }

    public static ValidationResult of(ValidationError error) {
        return new ValidationResult(List.of(error));
    }

    public static ValidationResult of(ValidationErrorType type, String message) {
        return of(new ValidationError(type, message));
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public boolean has(ValidationErrorType type) {
        return errors.stream().anyMatch(e -> e.type() == type);
    }

    /**
     * Human readable messages in reporting order
     */
    public List<String> messages() {
        return errors.stream().map(ValidationError::message).toList();
    }

    public ValidationResult merge(ValidationResult other) {
        if (other.isValid()) {
            return this;
        }
        if (isValid()) {
            return other;
        }
        var merged = new ArrayList<>(errors);
        merged.addAll(other.errors);
        return new ValidationResult(merged);
    }
}
