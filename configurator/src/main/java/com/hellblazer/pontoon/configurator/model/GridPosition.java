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
 * Immutable grid cell address. X and Z are the horizontal axes; Y is the level, where 0 is the water surface,
 * negative levels are underwater foundation and positive levels are stacked decks.
 *
 * @author hal.hildebrand
 */
public final class GridPosition implements Comparable<GridPosition> {

    /** Grid cell X */
    public final int x;

    /** Level */
    public final int y;

    /** Grid cell Z */
    public final int z;

    public GridPosition(int x, int y, int z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    /**
     * Parse the {@code x,y,z} form produced by {@link #toString()}
     */
    public static GridPosition parse(String text) {
        var parts = text.split(",");
        if (parts.length != 3) {
            throw new IllegalArgumentException("Invalid grid position: " + text);
        }
        try {
            return new GridPosition(Integer.parseInt(parts[0].trim()), Integer.parseInt(parts[1].trim()),
                                    Integer.parseInt(parts[2].trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid grid position: " + text, e);
        }
    }

    /**
     * All cells of the axis-aligned box spanned by two corners, inclusive, ordered by y, then z, then x.
     */
    public static List<GridPosition> rectangle(GridPosition a, GridPosition b) {
        int minX = Math.min(a.x, b.x), maxX = Math.max(a.x, b.x);
        int minY = Math.min(a.y, b.y), maxY = Math.max(a.y, b.y);
        int minZ = Math.min(a.z, b.z), maxZ = Math.max(a.z, b.z);
        var cells = new ArrayList<GridPosition>((maxX - minX + 1) * (maxY - minY + 1) * (maxZ - minZ + 1));
        for (int y = minY; y <= maxY; y++) {
            for (int z = minZ; z <= maxZ; z++) {
                for (int x = minX; x <= maxX; x++) {
                    cells.add(new GridPosition(x, y, z));
                }
            }
        }
        return cells;
    }

    public GridPosition offset(int dx, int dy, int dz) {
        return new GridPosition(x + dx, y + dy, z + dz);
    }

    public GridPosition below() {
        return offset(0, -1, 0);
    }

    public GridPosition above() {
        return offset(0, 1, 0);
    }

    public GridPosition atLevel(int level) {
        return new GridPosition(x, level, z);
    }

    /**
     * The four neighbours on the same level
     */
    public List<GridPosition> horizontalNeighbors() {
        return List.of(offset(0, 0, -1), offset(0, 0, 1), offset(1, 0, 0), offset(-1, 0, 0));
    }

    /**
     * The six neighbours sharing a face with this cell
     */
    public List<GridPosition> faceNeighbors() {
        return List.of(offset(0, 0, -1), offset(0, 0, 1), offset(1, 0, 0), offset(-1, 0, 0), above(), below());
    }

    /**
     * Calculate Manhattan distance to another position.
     *
     * @return |dx| + |dy| + |dz|
     */
    public int manhattanDistance(GridPosition other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y) + Math.abs(z - other.z);
    }

    /**
     * Calculate Chebyshev distance to another position.
     *
     * @return max(|dx|, |dy|, |dz|)
     */
    public int chebyshevDistance(GridPosition other) {
        return Math.max(Math.abs(x - other.x), Math.max(Math.abs(y - other.y), Math.abs(z - other.z)));
    }

    @Override
    public int compareTo(GridPosition o) {
        if (y != o.y) {
            return Integer.compare(y, o.y);
        }
        if (z != o.z) {
            return Integer.compare(z, o.z);
        }
        return Integer.compare(x, o.x);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof GridPosition other)) {
            return false;
        }
        return x == other.x && y == other.y && z == other.z;
    }

    @Override
    public int hashCode() {
        int result = x;
        result = 31 * result + y;
        result = 31 * result + z;
        return result;
    }

    @Override
    public String toString() {
        return x + "," + y + "," + z;
    }
}
