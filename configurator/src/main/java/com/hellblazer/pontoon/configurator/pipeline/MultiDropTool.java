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
import com.hellblazer.pontoon.configurator.model.PontoonType;
import com.hellblazer.pontoon.configurator.validation.PlacementValidator;
import com.hellblazer.pontoon.configurator.validation.ValidationErrorType;
import com.hellblazer.pontoon.configurator.validation.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rectangle fill. Press fixes the anchor, drag grows the rectangle on the active level, release places one pontoon
 * per anchor cell as a single history entry, skipping cells that fail validation. Double pontoons are anchored on
 * every second column counted from the rectangle's own minimum x. A plain click places a single pontoon.
 *
 * @author hal.hildebrand
 */
class MultiDropTool extends AbstractTool {

    private GridPosition anchor;
    private GridPosition current;

    MultiDropTool(OperationPipeline pipeline) {
        super(pipeline);
    }

    /**
     * Anchors of the pontoons a drop over the rectangle between two corners places, in placement order
     */
    static List<GridPosition> dropPositions(GridPosition from, GridPosition to, PontoonType type, int level) {
        var cells = GridPosition.rectangle(from.atLevel(level), to.atLevel(level));
        if (type.footprintSize() == 1) {
            return cells;
        }
        int minX = Math.min(from.x, to.x);
        var anchors = new ArrayList<GridPosition>();
        for (var cell : cells) {
            if ((cell.x - minX) % type.footprintSize() == 0) {
                anchors.add(cell);
            }
        }
        return anchors;
    }

    @Override
    public ToolType type() {
        return ToolType.MULTI_DROP;
    }

    @Override
    public PipelineResult handle(PointerInput input, ToolContext context, Optional<GridPosition> cell) {
        return switch (input.type()) {
            case PRESS -> press(context, cell);
            case DRAG -> drag(context, cell);
            case RELEASE -> release(context, cell);
            default -> super.handle(input, context, cell);
        };
    }

    @Override
    protected PipelineResult click(PointerInput input, ToolContext context, GridPosition cell) {
        return PlaceTool.place(pipeline, context, cell);
    }

    @Override
    public PreviewState preview(ToolContext context, GridPosition cell) {
        if (anchor == null) {
            return PlaceTool.placementPreview(pipeline, context, cell);
        }
        return rectanglePreview(context, cell);
    }

    @Override
    public void cancel() {
        anchor = null;
        current = null;
    }

    @Override
    public boolean isActive() {
        return anchor != null;
    }

    private PipelineResult press(ToolContext context, Optional<GridPosition> cell) {
        if (cell.isEmpty()) {
            return offGrid();
        }
        anchor = cell.get();
        current = cell.get();
        pipeline.setPreview(rectanglePreview(context, current));
        return pipeline.ignored("Multi-drop started at " + anchor);
    }

    private PipelineResult drag(ToolContext context, Optional<GridPosition> cell) {
        if (anchor == null) {
            return pipeline.ignored("Drag without press");
        }
        cell.ifPresent(c -> current = c);
        pipeline.setPreview(rectanglePreview(context, current));
        return pipeline.ignored("Multi-drop to " + current);
    }

    private PipelineResult release(ToolContext context, Optional<GridPosition> cell) {
        if (anchor == null) {
            return pipeline.reject(ValidationResult.of(ValidationErrorType.NOT_FOUND, "No multi-drop in progress"),
                                   "Release without press");
        }
        var from = anchor;
        var to = cell.orElse(current);
        cancel();
        pipeline.setPreview(PreviewState.none());

        var positions = dropPositions(from, to, context.type(), context.activeLevel());
        var batch = pipeline.getService()
                            .placePontoonsBatch(pipeline.getGrid(), pipeline.getIndex(), positions, context.type(),
                                                context.color(), context.rotation(), true);
        return pipeline.applyBatch(batch, "Multi-drop " + batch.getSuccessCount() + " " + context.type().displayName()
                                          + " from " + from + " to " + to);
    }

    // anchors are checked one by one like the batch does; connectivity only for the drop as a whole
    private PreviewState rectanglePreview(ToolContext context, GridPosition corner) {
        var validator = pipeline.validator();
        var cellRules = new PlacementValidator(validator.getGrid(), pipeline.getIndex());
        var valid = new ArrayList<GridPosition>();
        var claimed = new ArrayList<GridPosition>();
        var rejected = ValidationResult.valid();
        for (var position : dropPositions(anchor, corner, context.type(), context.activeLevel())) {
            var validation = cellRules.canPlace(position, context.type());
            if (validation.isValid()) {
                valid.add(position);
                claimed.addAll(context.type().footprint(position));
            } else {
                rejected = rejected.merge(validation);
            }
        }
        var structure = valid.isEmpty() ? ValidationResult.valid() : validator.structureAfter(List.of(), claimed);
        return new PreviewState(corner, !valid.isEmpty() && structure.isValid(), valid, rejected.merge(structure),
                                null);
    }
}
