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
import com.hellblazer.pontoon.configurator.model.PontoonId;
import com.hellblazer.pontoon.configurator.operation.OperationKind;

import java.util.List;
import java.util.Optional;

/**
 * Two click move. The first click on a pontoon arms the move without changing anything; the second click moves the
 * armed pontoon to the clicked cell. Whatever the second click's outcome, the tool returns to idle.
 *
 * @author hal.hildebrand
 */
class MoveTool extends AbstractTool {

    private PontoonId armed;

    MoveTool(OperationPipeline pipeline) {
        super(pipeline);
    }

    @Override
    public ToolType type() {
        return ToolType.MOVE;
    }

    @Override
    public PipelineResult handle(PointerInput input, ToolContext context, Optional<GridPosition> cell) {
        if (input.type() == InputType.CLICK && cell.isEmpty() && armed != null) {
            armed = null;
            return offGrid();
        }
        return super.handle(input, context, cell);
    }

    @Override
    protected PipelineResult click(PointerInput input, ToolContext context, GridPosition cell) {
        if (armed == null) {
            var pontoon = pontoonAt(cell);
            if (pontoon.isEmpty()) {
                return nothingAt(cell);
            }
            armed = pontoon.get().id();
            return pipeline.recordSelection(OperationKind.SELECT_FOR_MOVE, List.of(armed),
                                            "Selected " + armed + " for move");
        }
        var id = armed;
        armed = null;
        return pipeline.apply(pipeline.getService().movePontoon(pipeline.getGrid(), pipeline.getIndex(), id, cell),
                              "Move " + id + " to " + cell);
    }

    @Override
    public PreviewState preview(ToolContext context, GridPosition cell) {
        if (armed == null) {
            return occupantPreview(cell);
        }
        var pontoon = pipeline.getGrid().getPontoon(armed);
        if (pontoon.isEmpty()) {
            armed = null;
            return occupantPreview(cell);
        }
        var validation = pipeline.validator().canMove(armed, cell);
        return new PreviewState(cell, validation.isValid(), pontoon.get().type().footprint(cell), validation, armed);
    }

    @Override
    public void cancel() {
        armed = null;
    }

    @Override
    public boolean isActive() {
        return armed != null;
    }

    Optional<PontoonId> getArmed() {
        return Optional.ofNullable(armed);
    }
}
