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

import com.hellblazer.pontoon.configurator.model.GridPosition;
import com.hellblazer.pontoon.configurator.model.Pontoon;
import com.hellblazer.pontoon.configurator.validation.ValidationError;
import com.hellblazer.pontoon.configurator.validation.ValidationErrorType;
import com.hellblazer.pontoon.configurator.validation.ValidationResult;

import java.util.List;
import java.util.Optional;

/**
 * Shared plumbing for the tools
 *
 * @author hal.hildebrand
 */
abstract class AbstractTool implements Tool {

    protected final OperationPipeline pipeline;

    protected AbstractTool(OperationPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @Override
    public PipelineResult handle(PointerInput input, ToolContext context, Optional<GridPosition> cell) {
        if (input.type() != InputType.CLICK) {
            return pipeline.ignored(input);
        }
        if (cell.isEmpty()) {
            return offGrid();
        }
        return click(input, context, cell.get());
    }

    protected abstract PipelineResult click(PointerInput input, ToolContext context, GridPosition cell);

    protected PipelineResult offGrid() {
        return pipeline.reject(ValidationResult.of(ValidationErrorType.OUT_OF_BOUNDS, "Pointer is outside the grid"),
                               type() + " outside the grid");
    }

    protected PipelineResult nothingAt(GridPosition cell) {
        return pipeline.reject(ValidationResult.of(
        new ValidationError(ValidationErrorType.NOT_FOUND, "No pontoon at position " + cell, cell)),
                               type() + " found no pontoon at " + cell);
    }

    protected Optional<Pontoon> pontoonAt(GridPosition cell) {
        return pipeline.getGrid().pontoonAt(cell);
    }

    /**
     * Preview highlighting the pontoon under the cell, valid when there is one
     */
    protected PreviewState occupantPreview(GridPosition cell) {
        var pontoon = pontoonAt(cell);
        if (pontoon.isEmpty()) {
            return PreviewState.of(cell, ValidationResult.of(
            new ValidationError(ValidationErrorType.NOT_FOUND, "No pontoon at position " + cell, cell)), List.of());
        }
        return PreviewState.of(cell, ValidationResult.valid(), pontoon.get().footprint());
    }
}
