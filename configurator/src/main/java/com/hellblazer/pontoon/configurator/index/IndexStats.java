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
package com.hellblazer.pontoon.configurator.index;

/**
 * Occupancy index statistics snapshot
 *
 * @author hal.hildebrand
 */
public record IndexStats(int elementCount, int cellCount, long insertions, long removals, long moves,
                         long conflicts, long rebuilds) {

    @Override
    public String toString() {
        return String.format(
        "OccupancyIndex[elements=%d, cells=%d, insertions=%d, removals=%d, moves=%d, conflicts=%d, rebuilds=%d]",
        elementCount, cellCount, insertions, removals, moves, conflicts, rebuilds);
    }
}
