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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Summary of a grid's contents
 *
 * @author hal.hildebrand
 */
public record GridStatistics(int totalPontoons, int occupiedCells, long totalCells, double utilizationPercent,
                             Map<Integer, Integer> pontoonsByLevel, Map<PontoonType, Integer> pontoonsByType,
                             Map<PontoonColor, Integer> pontoonsByColor, double totalVolumeM3) {

    public GridStatistics {
        pontoonsByLevel = Collections.unmodifiableMap(new TreeMap<>(pontoonsByLevel));
        pontoonsByType = Collections.unmodifiableMap(pontoonsByType);
        pontoonsByColor = Collections.unmodifiableMap(pontoonsByColor);
    }

    public static GridStatistics of(Grid grid) {
        var byLevel = new TreeMap<Integer, Integer>();
        var byType = new EnumMap<PontoonType, Integer>(PontoonType.class);
        var byColor = new EnumMap<PontoonColor, Integer>(PontoonColor.class);
        double volume = 0.0;
        for (var pontoon : grid.getPontoons()) {
            byLevel.merge(pontoon.position().y, 1, Integer::sum);
            byType.merge(pontoon.type(), 1, Integer::sum);
            byColor.merge(pontoon.color(), 1, Integer::sum);
            volume += pontoon.type().dimensions().volumeM3();
        }
        int occupied = grid.getOccupiedCells().size();
        long total = grid.getDimensions().totalCells();
        double utilization = total == 0 ? 0.0 : occupied * 100.0 / total;
        return new GridStatistics(grid.size(), occupied, total, utilization, byLevel, byType, byColor, volume);
    }

    @Override
    public String toString() {
        return String.format("GridStatistics[pontoons=%d, cells=%d/%d (%.1f%%), volume=%.3fm3]", totalPontoons,
                             occupiedCells, totalCells, utilizationPercent, totalVolumeM3);
    }
}
