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
package com.hellblazer.pontoon.configurator.validation;

import com.hellblazer.pontoon.configurator.model.Grid;
import com.hellblazer.pontoon.configurator.model.GridPosition;
import com.hellblazer.pontoon.configurator.model.PontoonId;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Face adjacency analysis of occupied cells. Two cells are adjacent when they share a face, so a deck pontoon is
 * connected to whatever it stands on.
 *
 * @author hal.hildebrand
 */
public final class ConnectivityAnalyzer {

    private ConnectivityAnalyzer() {
    }

    /**
     * Connected components of the given cells, each component sorted, components ordered by their smallest cell.
     */
    public static List<Set<GridPosition>> components(Collection<GridPosition> occupied) {
        var remaining = new HashSet<>(occupied);
        var seeds = new TreeSet<>(occupied);
        var components = new ArrayList<Set<GridPosition>>();
        for (var seed : seeds) {
            if (!remaining.remove(seed)) {
                continue;
            }
            var component = new TreeSet<GridPosition>();
            var queue = new ArrayDeque<GridPosition>();
            queue.add(seed);
            component.add(seed);
            while (!queue.isEmpty()) {
                var cell = queue.poll();
                for (var neighbor : cell.faceNeighbors()) {
                    if (remaining.remove(neighbor)) {
                        component.add(neighbor);
                        queue.add(neighbor);
                    }
                }
            }
            components.add(component);
        }
        return components;
    }

    /**
     * Connected components expressed as the pontoons they contain
     */
    public static List<Set<PontoonId>> pontoonComponents(Grid grid) {
        var result = new ArrayList<Set<PontoonId>>();
        for (var component : components(grid.getOccupiedCells())) {
            var ids = new TreeSet<PontoonId>();
            for (var cell : component) {
                grid.occupantAt(cell).ifPresent(ids::add);
            }
            result.add(ids);
        }
        return result;
    }

    /**
     * Empty and single cell structures are connected
     */
    public static boolean isConnected(Collection<GridPosition> occupied) {
        return occupied.size() <= 1 || components(occupied).size() == 1;
    }
}
