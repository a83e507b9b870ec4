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
import com.hellblazer.pontoon.configurator.operation.OperationKind;
import com.hellblazer.pontoon.configurator.validation.ValidationResult;

import java.util.List;

/**
 * Click selects the pontoon under the pointer, replacing the selection, or toggles it when a modifier is held. Click
 * on empty water clears the selection.
 *
 * @author hal.hildebrand
 */
class SelectTool extends AbstractTool {

    SelectTool(OperationPipeline pipeline) {
        super(pipeline);
    }

    @Override
    public ToolType type() {
        return ToolType.SELECT;
    }

    @Override
    protected PipelineResult click(PointerInput input, ToolContext context, GridPosition cell) {
        var pontoon = pontoonAt(cell);
        if (pontoon.isEmpty()) {
            pipeline.clearSelection();
            return pipeline.recordSelection(OperationKind.CLEAR_SELECTION, List.of(), "Cleared selection");
        }
        var id = pontoon.get().id();
        if (input.modifiers().extendsSelection()) {
            boolean selected = pipeline.toggleSelection(id);
            return pipeline.recordSelection(OperationKind.SELECT, List.of(id),
                                            (selected ? "Added " : "Removed ") + id + (selected ? " to" : " from")
                                            + " selection");
        }
        pipeline.selectOnly(id);
        return pipeline.recordSelection(OperationKind.SELECT, List.of(id), "Selected " + id);
    }

    @Override
    public PreviewState preview(ToolContext context, GridPosition cell) {
        var pontoon = pontoonAt(cell);
        return PreviewState.of(cell, ValidationResult.valid(),
                               pontoon.isPresent() ? pontoon.get().footprint() : List.of(cell));
    }
}
