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
package com.hellblazer.pontoon.configurator.pipeline;

import com.hellblazer.pontoon.configurator.model.Grid;
import com.hellblazer.pontoon.configurator.model.GridPosition;
import com.hellblazer.pontoon.configurator.operation.Operation;
import com.hellblazer.pontoon.configurator.validation.ValidationError;
import com.hellblazer.pontoon.configurator.validation.ValidationErrorType;
import com.hellblazer.pontoon.configurator.validation.ValidationResult;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one pipeline call. The grid is the session grid after the call: the new grid on a successful mutation,
 * otherwise the unchanged one. Operations are empty when nothing was recorded.
 *
 * @author hal.hildebrand
 */
public record PipelineResult(boolean success, Grid grid, List<Operation> operations, ValidationResult validation,
                             String description, Map<GridPosition, ValidationResult> skipped) {

    public PipelineResult {
        Objects.requireNonNull(grid, "grid");
        operations = List.copyOf(operations);
        Objects.requireNonNull(validation, "validation");
        description = description == null ? "" : description;
        skipped = skipped == null ? Map.of() : skipped;
    }

    public static PipelineResult success(Grid grid, List<Operation> operations, String description) {
        return new PipelineResult(true, grid, operations, ValidationResult.valid(), description, Map.of());
    }

    /**
     * A successful input that neither changed the grid nor recorded anything, such as a hover
     */
    public static PipelineResult noop(Grid grid, String description) {
        return success(grid, List.of(), description);
    }

    public static PipelineResult failure(Grid grid, ValidationResult validation, String description) {
        return new PipelineResult(false, grid, List.of(), validation, description, Map.of());
    }

    public static PipelineResult failure(Grid grid, ValidationErrorType type, String message) {
        return failure(grid, ValidationResult.of(type, message), message);
    }

    public static PipelineResult busy(Grid grid) {
        return failure(grid, ValidationErrorType.PIPELINE_BUSY, "Pipeline is busy processing a previous input");
    }

    public boolean isMutation() {
        return success && operations.stream().anyMatch(op -> op.kind().isMutation());
    }

    public List<ValidationError> errors() {
        return validation.errors();
    }

    public List<String> messages() {
        return validation.messages();
    }

    public boolean failedWith(ValidationErrorType type) {
        return !success && validation.has(type);
    }
}
