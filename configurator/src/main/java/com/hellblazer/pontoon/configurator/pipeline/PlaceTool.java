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

/**
 * Click places a pontoon of the context's type, color and rotation anchored at the cell.
 *
 * @author hal.hildebrand
 */
class PlaceTool extends AbstractTool {

    PlaceTool(OperationPipeline pipeline) {
        super(pipeline);
    }

    @Override
    public ToolType type() {
        return ToolType.PLACE;
    }

    @Override
    protected PipelineResult click(PointerInput input, ToolContext context, GridPosition cell) {
        return place(pipeline, context, cell);
    }

    @Override
    public PreviewState preview(ToolContext context, GridPosition cell) {
        return placementPreview(pipeline, context, cell);
    }

    static PipelineResult place(OperationPipeline pipeline, ToolContext context, GridPosition cell) {
        var result = pipeline.getService()
                             .placePontoon(pipeline.getGrid(), pipeline.getIndex(), cell, context.type(),
                                           context.color(), context.rotation());
        return pipeline.apply(result, "Place " + context.type().displayName() + " at " + cell);
    }

    static PreviewState placementPreview(OperationPipeline pipeline, ToolContext context, GridPosition cell) {
        return PreviewState.of(cell, pipeline.validator().canPlace(cell, context.type()),
                               context.type().footprint(cell));
    }
}
