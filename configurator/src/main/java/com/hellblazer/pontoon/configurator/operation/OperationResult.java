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
package com.hellblazer.pontoon.configurator.operation;

import com.hellblazer.pontoon.configurator.model.Grid;
import com.hellblazer.pontoon.configurator.validation.ValidationError;
import com.hellblazer.pontoon.configurator.validation.ValidationResult;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a request against a grid. On failure the grid is the unchanged input grid and the validation carries
 * the reasons.
 *
 * @author hal.hildebrand
 */
public record OperationResult(boolean success, Grid grid, List<Operation> operations, ValidationResult validation) {

    public OperationResult {
        Objects.requireNonNull(grid, "grid");
        operations = List.copyOf(operations);
        Objects.requireNonNull(validation, "validation");
    }

    public static OperationResult success(Grid grid, Operation operation) {
        return new OperationResult(true, grid, List.of(operation), ValidationResult.valid());
    }

    public static OperationResult failure(Grid unchanged, ValidationResult validation) {
        return new OperationResult(false, unchanged, List.of(), validation);
    }

    public List<ValidationError> errors() {
        return validation.errors();
    }

    public List<String> messages() {
        return validation.messages();
    }
}
