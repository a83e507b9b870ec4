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

import java.util.Optional;

/**
 * Click removes the pontoon under the pointer, provided nothing rests on it.
 *
 * @author hal.hildebrand
 */
class DeleteTool extends AbstractTool {

    DeleteTool(OperationPipeline pipeline) {
        super(pipeline);
    }

    @Override
    public ToolType type() {
        return ToolType.DELETE;
    }

    @Override
    protected PipelineResult click(PointerInput input, ToolContext context, GridPosition cell) {
        return removeAt(pipeline, cell).orElseGet(() -> nothingAt(cell));
    }

    @Override
    public PreviewState preview(ToolContext context, GridPosition cell) {
        var pontoon = pontoonAt(cell);
        if (pontoon.isEmpty()) {
            return occupantPreview(cell);
        }
        return PreviewState.of(cell, pipeline.validator().canRemove(pontoon.get().id()), pontoon.get().footprint());
    }

    static Optional<PipelineResult> removeAt(OperationPipeline pipeline, GridPosition cell) {
        var grid = pipeline.getGrid();
        return grid.pontoonAt(cell).map(pontoon -> pipeline.apply(
        pipeline.getService().removePontoon(grid, pipeline.getIndex(), pontoon.id()),
        "Remove " + pontoon.type().displayName() + " at " + pontoon.position()));
    }
}
