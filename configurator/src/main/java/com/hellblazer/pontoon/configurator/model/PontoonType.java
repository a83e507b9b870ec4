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
package com.hellblazer.pontoon.configurator.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Pontoon body types. The footprint of a pontoon is a pure function of its anchor and its type: SINGLE covers the
 * anchor cell, DOUBLE covers the anchor and the cell at x+1 on the same level and row.
 *
 * @author hal.hildebrand
 */
public enum PontoonType {
    SINGLE(1, PhysicalDimensions.SINGLE_PONTOON, "Single Pontoon"),
    DOUBLE(2, PhysicalDimensions.DOUBLE_PONTOON, "Double Pontoon");

    private final int                footprintSize;
    private final PhysicalDimensions dimensions;
    private final String             displayName;

    PontoonType(int footprintSize, PhysicalDimensions dimensions, String displayName) {
        this.footprintSize = footprintSize;
        this.dimensions = dimensions;
        this.displayName = displayName;
    }

    /**
     * Number of cells covered along x
     */
    public int footprintSize() {
        return footprintSize;
    }

    public PhysicalDimensions dimensions() {
        return dimensions;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Cells covered by a pontoon of this type anchored at the given position
     */
    public List<GridPosition> footprint(GridPosition anchor) {
        return footprint(anchor, footprintSize);
    }

    public static List<GridPosition> footprint(GridPosition anchor, int footprintSize) {
        if (footprintSize <= 0) {
            throw new IllegalArgumentException("Footprint size must be positive: " + footprintSize);
        }
        var cells = new ArrayList<GridPosition>(footprintSize);
        for (int dx = 0; dx < footprintSize; dx++) {
            cells.add(anchor.offset(dx, 0, 0));
        }
        return cells;
    }
}
