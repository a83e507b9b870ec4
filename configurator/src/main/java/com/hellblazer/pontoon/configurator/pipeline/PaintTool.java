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
import com.hellblazer.pontoon.configurator.validation.ValidationError;
import com.hellblazer.pontoon.configurator.validation.ValidationErrorType;
import com.hellblazer.pontoon.configurator.validation.ValidationResult;

/**
 * Click recolors the pontoon under the pointer with the context's color.
 *
 * @author hal.hildebrand
 */
class PaintTool extends AbstractTool {

    PaintTool(OperationPipeline pipeline) {
        super(pipeline);
    }

    @Override
    public ToolType type() {
        return ToolType.PAINT;
    }

    @Override
    protected PipelineResult click(PointerInput input, ToolContext context, GridPosition cell) {
        var pontoon = pontoonAt(cell);
        if (pontoon.isEmpty()) {
            return nothingAt(cell);
        }
        var id = pontoon.get().id();
        return pipeline.apply(pipeline.getService().recolorPontoon(pipeline.getGrid(), id, context.color()),
                              "Paint " + id + " " + context.color().displayName());
    }

    @Override
    public PreviewState preview(ToolContext context, GridPosition cell) {
        var pontoon = pontoonAt(cell);
        if (pontoon.isPresent() && pontoon.get().color() == context.color()) {
            return PreviewState.of(cell, ValidationResult.of(
            new ValidationError(ValidationErrorType.SAME_VALUE, "Pontoon already has this color", cell,
                                pontoon.get().id())), pontoon.get().footprint());
        }
        return occupantPreview(cell);
    }
}
