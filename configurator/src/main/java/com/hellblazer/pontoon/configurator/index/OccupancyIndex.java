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

import com.hellblazer.pontoon.configurator.model.Grid;
import com.hellblazer.pontoon.configurator.model.GridPosition;
import com.hellblazer.pontoon.configurator.model.OccupancyView;
import com.hellblazer.pontoon.configurator.model.PontoonId;
import com.hellblazer.pontoon.configurator.model.PontoonType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Cell to pontoon lookup derived from the {@link Grid}. The index is a cache: it can always be rebuilt from the Grid
 * and is expected to agree with it after every mutation.
 * <p>
 * Every mutating operation checks for conflicts before touching any state, so a rejected operation leaves the index
 * exactly as it was.
 *
 * @author hal.hildebrand
 */
public class OccupancyIndex implements OccupancyView {
    private static final Logger log = LoggerFactory.getLogger(OccupancyIndex.class);

    private final Map<GridPosition, PontoonId>       cells    = new HashMap<>();
    private final Map<PontoonId, List<GridPosition>> elements = new HashMap<>();

    private long insertions = 0;
    private long removals   = 0;
    private long moves      = 0;
    private long conflicts  = 0;
    private long rebuilds   = 0;

    public static OccupancyIndex of(Grid grid) {
        var index = new OccupancyIndex();
        index.rebuild(grid);
        return index;
    }

    /**
     * Register the cells covered by an element. Re-inserting an id replaces its previous registration.
     *
     * @param footprintSize cell extent along x
     * @throws IllegalStateException if a covered cell belongs to another element
     */
    public void insert(PontoonId id, GridPosition anchor, int footprintSize) {
        var footprint = PontoonType.footprint(anchor, footprintSize);
        checkConflicts(id, footprint);
        unregister(id);
        register(id, footprint);
        insertions++;
    }

    /**
     * @return true if the element was registered
     */
    public boolean remove(PontoonId id) {
        if (unregister(id)) {
            removals++;
            return true;
        }
        return false;
    }

    /**
     * Move a registered element to a new anchor, keeping its footprint size. The target cells are checked before
     * anything changes.
     *
     * @throws IllegalStateException if the element is unknown or a target cell belongs to another element
     */
    public void moveElement(PontoonId id, GridPosition newAnchor) {
        var current = elements.get(id);
        if (current == null) {
            throw new IllegalStateException("Cannot move unregistered element: " + id);
        }
        var footprint = PontoonType.footprint(newAnchor, current.size());
        checkConflicts(id, footprint);
        unregister(id);
        register(id, footprint);
        moves++;
    }

    @Override
    public Optional<PontoonId> occupantAt(GridPosition cell) {
        return Optional.ofNullable(cells.get(cell));
    }

    public List<GridPosition> cellsOf(PontoonId id) {
        var registered = elements.get(id);
        return registered == null ? List.of() : List.copyOf(registered);
    }

    public boolean contains(PontoonId id) {
        return elements.containsKey(id);
    }

    /**
     * Elements with at least one cell inside the inclusive box spanned by two corners
     */
    public Set<PontoonId> queryRegion(GridPosition min, GridPosition max) {
        int minX = Math.min(min.x, max.x), maxX = Math.max(min.x, max.x);
        int minY = Math.min(min.y, max.y), maxY = Math.max(min.y, max.y);
        int minZ = Math.min(min.z, max.z), maxZ = Math.max(min.z, max.z);
        var result = new TreeSet<PontoonId>();
        for (var entry : cells.entrySet()) {
            var cell = entry.getKey();
            if (cell.x >= minX && cell.x <= maxX && cell.y >= minY && cell.y <= maxY && cell.z >= minZ
            && cell.z <= maxZ) {
                result.add(entry.getValue());
            }
        }
        return result;
    }

    public int elementCount() {
        return elements.size();
    }

    public int cellCount() {
        return cells.size();
    }

    public void clear() {
        cells.clear();
        elements.clear();
    }

    /**
     * Discard the current contents and register every pontoon of the grid
     */
    public void rebuild(Grid grid) {
        clear();
        for (var pontoon : grid.getPontoons()) {
            register(pontoon.id(), pontoon.footprint());
        }
        rebuilds++;
        log.debug("Rebuilt occupancy index: {} elements, {} cells", elements.size(), cells.size());
    }

    /**
     * Full comparison against the grid: the same elements, each registered at exactly its footprint.
     */
    public boolean isConsistentWith(Grid grid) {
        if (grid.size() != elements.size() || grid.getOccupiedCells().size() != cells.size()) {
            return false;
        }
        for (var pontoon : grid.getPontoons()) {
            var registered = elements.get(pontoon.id());
            if (registered == null || !registered.equals(pontoon.footprint())) {
                return false;
            }
        }
        for (var cell : grid.getOccupiedCells()) {
            if (!grid.occupantAt(cell).equals(occupantAt(cell))) {
                return false;
            }
        }
        return true;
    }

    public IndexStats stats() {
        return new IndexStats(elements.size(), cells.size(), insertions, removals, moves, conflicts, rebuilds);
    }

    private void checkConflicts(PontoonId id, List<GridPosition> footprint) {
        for (var cell : footprint) {
            var owner = cells.get(cell);
            if (owner != null && !owner.equals(id)) {
                conflicts++;
                throw new IllegalStateException("Cell " + cell + " already occupied by " + owner);
            }
        }
    }

    private void register(PontoonId id, List<GridPosition> footprint) {
        for (var cell : footprint) {
            cells.put(cell, id);
        }
        elements.put(id, new ArrayList<>(footprint));
    }

    private boolean unregister(PontoonId id) {
        var previous = elements.remove(id);
        if (previous == null) {
            return false;
        }
        for (var cell : previous) {
            cells.remove(cell, id);
        }
        return true;
    }
}
