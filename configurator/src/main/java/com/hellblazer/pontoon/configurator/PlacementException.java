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
package com.hellblazer.pontoon.configurator;

import com.hellblazer.pontoon.configurator.validation.ValidationResult;

/**
 * Thrown when externally supplied layout data cannot be turned into a valid grid.
 *
 * @author hal.hildebrand
 */
public class PlacementException extends Exception {

    private final ValidationResult validation;

    /**
     * @param message    the detail message
     * @param validation the rule violations found in the data
     */
    public PlacementException(String message, ValidationResult validation) {
        super(message);
        this.validation = validation;
    }

    /**
     * Creates an exception for data that could not be read at all.
     *
     * @param message the detail message
     * @param cause   the underlying cause
     */
    public PlacementException(String message, Throwable cause) {
        super(message, cause);
        this.validation = ValidationResult.valid();
    }

    /**
     * The rule violations, empty when the data was malformed rather than invalid
     */
    public ValidationResult getValidation() {
        return validation;
    }
}
