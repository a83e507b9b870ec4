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

import com.hellblazer.pontoon.configurator.config.ConfiguratorConfig;
import com.hellblazer.pontoon.configurator.model.Grid;
import com.hellblazer.pontoon.configurator.model.GridDimensions;
import com.hellblazer.pontoon.configurator.model.GridPosition;
import com.hellblazer.pontoon.configurator.model.PontoonType;
import com.hellblazer.pontoon.configurator.operation.OperationKind;
import com.hellblazer.pontoon.configurator.validation.ValidationErrorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hellblazer.pontoon.configurator.ScreenFixture.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Multi-drop tool tests")
class MultiDropToolTest {

    private static final GridDimensions DIMS = new GridDimensions(10, 10, 3);

    private OperationPipeline pipeline;
    private ToolContext       doubles;

    @BeforeEach
    void setUp() {
        pipeline = new OperationPipeline(Grid.empty(DIMS), new ConfiguratorConfig(), FIXED_CLOCK);
        doubles = context(DIMS, ToolType.MULTI_DROP).withType(PontoonType.DOUBLE);
    }

    private PipelineResult drop(ToolContext context, int fromX, int fromZ, int toX, int toZ) {
        pipeline.process(PointerInput.press(pixelX(fromX), pixelY(fromZ)), context);
        pipeline.process(PointerInput.drag(pixelX(toX), pixelY(toZ)), context);
        return pipeline.process(PointerInput.release(pixelX(toX), pixelY(toZ)), context);
    }

    @Test
    @DisplayName("Double pontoons are spaced by their footprint")
    void testDropPositions() {
        var anchors = MultiDropTool.dropPositions(new GridPosition(0, 0, 0), new GridPosition(9, 0, 1),
                                                  PontoonType.DOUBLE, 0);
        assertEquals(10, anchors.size());
        assertEquals(List.of(0, 2, 4, 6, 8), anchors.subList(0, 5).stream().map(p -> p.x).toList());
        assertEquals(anchors, MultiDropTool.dropPositions(new GridPosition(9, 0, 1), new GridPosition(0, 0, 0),
                                                          PontoonType.DOUBLE, 0));

        var singles = MultiDropTool.dropPositions(new GridPosition(2, 0, 2), new GridPosition(3, 2, 3),
                                                  PontoonType.SINGLE, 1);
        assertEquals(List.of(new GridPosition(2, 1, 2), new GridPosition(3, 1, 2), new GridPosition(2, 1, 3),
                             new GridPosition(3, 1, 3)), singles);
    }

    @Test
    @DisplayName("A full row of doubles is one batch and one history entry")
    void testDropRow() {
        var result = drop(doubles, 0, 0, 9, 0);
        assertTrue(result.success());
        assertEquals(5, pipeline.getGrid().size());
        assertEquals(1, result.operations().size());
        assertEquals(OperationKind.BATCH_PLACE, result.operations().get(0).kind());
        assertEquals(1, pipeline.getHistory().size());
        assertFalse(pipeline.isDragging());
        assertTrue(pipeline.getIndex().isConsistentWith(pipeline.getGrid()));
        for (int x = 0; x < 10; x++) {
            assertTrue(pipeline.getGrid().isOccupied(new GridPosition(x, 0, 0)));
        }

        pipeline.undo();
        assertTrue(pipeline.getGrid().isEmpty());
    }

    @Test
    @DisplayName("Drag preview lists the anchors that would be placed")
    void testDragPreview() {
        pipeline.process(PointerInput.press(pixelX(0), pixelY(0)), doubles);
        assertTrue(pipeline.isDragging());
        pipeline.process(PointerInput.drag(pixelX(3), pixelY(1)), doubles);

        var preview = pipeline.getPreview();
        assertTrue(preview.valid());
        assertEquals(List.of(new GridPosition(0, 0, 0), new GridPosition(2, 0, 0), new GridPosition(0, 0, 1),
                             new GridPosition(2, 0, 1)), preview.cells());
        assertTrue(pipeline.getGrid().isEmpty());

        pipeline.process(hover(new GridPosition(1, 0, 0)), doubles);
        assertEquals(List.of(new GridPosition(0, 0, 0)), pipeline.getPreview().cells());
    }

    @Test
    @DisplayName("Invalid anchors are skipped and reported")
    void testSkipInvalid() {
        pipeline.place(new GridPosition(4, 0, 0), PontoonType.SINGLE, doubles.color(), doubles.rotation());
        var result = drop(doubles, 0, 0, 9, 0);
        assertTrue(result.success());
        assertEquals(5, pipeline.getGrid().size());
        assertEquals(1, result.skipped().size());
        assertTrue(result.skipped().get(new GridPosition(4, 0, 0)).has(ValidationErrorType.OVERLAP));
    }

    @Test
    @DisplayName("Dragging off the grid keeps the last cell on it")
    void testOffGridRelease() {
        var singles = context(DIMS, ToolType.MULTI_DROP);
        pipeline.process(PointerInput.press(pixelX(1), pixelY(1)), singles);
        pipeline.process(PointerInput.drag(pixelX(2), pixelY(2)), singles);
        pipeline.process(PointerInput.drag(-50, -50), singles);
        var result = pipeline.process(PointerInput.release(-50, -50), singles);
        assertTrue(result.success());
        assertEquals(4, pipeline.getGrid().size());
        assertTrue(pipeline.getGrid().isOccupied(new GridPosition(2, 0, 2)));
    }

    @Test
    @DisplayName("Leaving the viewport cancels the drag")
    void testLeaveCancels() {
        pipeline.process(PointerInput.press(pixelX(0), pixelY(0)), doubles);
        pipeline.process(PointerInput.drag(pixelX(5), pixelY(5)), doubles);
        pipeline.process(PointerInput.leave(), doubles);
        assertFalse(pipeline.isDragging());
        assertTrue(pipeline.getPreview().isEmpty());

        var release = pipeline.process(PointerInput.release(pixelX(5), pixelY(5)), doubles);
        assertTrue(release.failedWith(ValidationErrorType.NOT_FOUND));
        assertTrue(pipeline.getGrid().isEmpty());
    }

    @Test
    @DisplayName("A drop that places nothing fails without a history entry")
    void testNothingPlaced() {
        drop(doubles, 0, 0, 3, 0);
        assertEquals(1, pipeline.getHistory().size());

        var again = drop(doubles, 0, 0, 3, 0);
        assertFalse(again.success());
        assertTrue(again.failedWith(ValidationErrorType.OVERLAP));
        assertEquals(2, again.skipped().size());
        assertEquals(1, pipeline.getHistory().size());
        assertEquals(2, pipeline.getGrid().size());
    }

    @Test
    @DisplayName("Press off the grid does not start a drag and a click places one pontoon")
    void testPressAndClick() {
        var press = pipeline.process(PointerInput.press(-50, -50), doubles);
        assertTrue(press.failedWith(ValidationErrorType.OUT_OF_BOUNDS));
        assertFalse(pipeline.isDragging());

        var drag = pipeline.process(PointerInput.drag(pixelX(1), pixelY(1)), doubles);
        assertTrue(drag.success());
        assertTrue(pipeline.getGrid().isEmpty());

        assertTrue(pipeline.process(click(new GridPosition(6, 0, 6)), doubles).isMutation());
        assertTrue(pipeline.getGrid().isOccupied(new GridPosition(7, 0, 6)));
    }
}
