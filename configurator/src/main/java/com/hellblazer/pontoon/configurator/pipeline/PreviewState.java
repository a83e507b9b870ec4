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
import com.hellblazer.pontoon.configurator.validation.ValidationResult;

import java.util.List;

/**
 * Overlay state for the renderer: the hovered cell, whether the pending action would succeed there, and the cells it
 * would cover. For a multi-drop drag the cells are the anchors the release would place.
 *
 * @author hal.hildebrand
 */
public record PreviewState(GridPosition cell, boolean valid, List<GridPosition> cells, ValidationResult validation,
                           PontoonId movingId) {
    private static final PreviewState NONE = new PreviewState(null, false, List.of(), ValidationResult.valid(), null);

    public PreviewState {
        cells = List.copyOf(cells);
    }

    public static PreviewState none() {
        return NONE;
    }

    public static PreviewState of(GridPosition cell, ValidationResult validation, List<GridPosition> cells) {
        return new PreviewState(cell, validation.isValid(), cells, validation, null);
    }

    public boolean isEmpty() {
        return cell == null;
    }
}
