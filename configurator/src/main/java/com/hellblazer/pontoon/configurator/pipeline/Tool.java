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
 * Interprets pointer input for one interaction mode. Tools validate through the pipeline's validator and hand their
 * results back to the pipeline, which owns every piece of session state that outlives a single input.
 *
 * @author hal.hildebrand
 */
public interface Tool {

    ToolType type();

    /**
     * Handle a click, press, drag or release.
     *
     * @param cell the cell under the pointer on the active level, empty when the pointer is off the grid
     */
    PipelineResult handle(PointerInput input, ToolContext context, Optional<GridPosition> cell);

    /**
     * Preview of what a click at the cell would do
     */
    PreviewState preview(ToolContext context, GridPosition cell);

    /**
     * Abandon any armed or in progress interaction without mutating anything
     */
    default void cancel() {
    }

    /**
     * Whether an interaction is armed or in progress
     */
    default boolean isActive() {
        return false;
    }
}
