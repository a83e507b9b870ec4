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

/**
 * Extent of the placement grid. Width runs along x, height along z, and levels stack along y starting at the base
 * level.
 *
 * @author hal.hildebrand
 */
public record GridDimensions(int width, int height, int levels, int baseLevel) {

    public GridDimensions {
        if (width <= 0 || height <= 0 || levels <= 0) {
            throw new IllegalArgumentException(
            "Grid dimensions must be positive: " + width + "x" + height + "x" + levels);
        }
    }

    public GridDimensions(int width, int height, int levels) {
        this(width, height, levels, 0);
    }

    /**
     * Highest valid level, inclusive
     */
    public int topLevel() {
        return baseLevel + levels - 1;
    }

    public boolean isValidLevel(int level) {
        return level >= baseLevel && level < baseLevel + levels;
    }

    public boolean contains(GridPosition cell) {
        return cell.x >= 0 && cell.x < width && cell.z >= 0 && cell.z < height && isValidLevel(cell.y);
    }

    public long cellsPerLevel() {
        return (long) width * height;
    }

    public long totalCells() {
        return cellsPerLevel() * levels;
    }
}
