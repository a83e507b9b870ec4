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
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The authoritative, immutable placement state: grid dimensions, the ordered id to pontoon table, and the id
 * sequence. Every change produces a new Grid.
 * <p>
 * The Grid itself guarantees that claimed cells are inside the dimensions and that no two pontoons claim the same
 * cell. Structural support between levels is a placement rule and is checked by the validation engine before a new
 * Grid is produced.
 *
 * @author hal.hildebrand
 */
public final class Grid implements OccupancyView {

    private final GridDimensions                dimensions;
    private final Map<PontoonId, Pontoon>       pontoons;
    private final Map<GridPosition, PontoonId> cells;
    private final long                          nextId;

    public Grid(GridDimensions dimensions, Collection<Pontoon> pontoons, long nextId) {
        this.dimensions = Objects.requireNonNull(dimensions, "dimensions");
        var table = new LinkedHashMap<PontoonId, Pontoon>();
        var occupancy = new HashMap<GridPosition, PontoonId>();
        long maxId = 0;
        for (var pontoon : pontoons) {
            if (table.put(pontoon.id(), pontoon) != null) {
                throw new IllegalArgumentException("Duplicate pontoon id: " + pontoon.id());
            }
            for (var cell : pontoon.footprint()) {
                if (!dimensions.contains(cell)) {
                    throw new IllegalArgumentException(pontoon.id() + " claims cell outside the grid: " + cell);
                }
                var previous = occupancy.put(cell, pontoon.id());
                if (previous != null) {
                    throw new IllegalArgumentException(
                    "Cell " + cell + " claimed by both " + previous + " and " + pontoon.id());
                }
            }
            maxId = Math.max(maxId, pontoon.id().getValue());
        }
        this.pontoons = Collections.unmodifiableMap(table);
        this.cells = Collections.unmodifiableMap(occupancy);
        this.nextId = Math.max(nextId, Math.addExact(maxId, 1));
    }

    public static Grid empty(GridDimensions dimensions) {
        return new Grid(dimensions, List.of(), 1);
    }

    public GridDimensions getDimensions() {
        return dimensions;
    }

    /**
     * The id the next placed pontoon will receive. It is never the id of a pontoon already in this grid.
     *
     * @throws IllegalStateException if the id sequence is exhausted
     */
    public PontoonId nextPontoonId() {
        if (nextId == Long.MAX_VALUE) {
            throw new IllegalStateException("Pontoon id sequence exhausted");
        }
        return new PontoonId(nextId);
    }

    public long getNextId() {
        return nextId;
    }

    public int size() {
        return pontoons.size();
    }

    public boolean isEmpty() {
        return pontoons.isEmpty();
    }

    public boolean contains(PontoonId id) {
        return pontoons.containsKey(id);
    }

    public Optional<Pontoon> getPontoon(PontoonId id) {
        return Optional.ofNullable(pontoons.get(id));
    }

    /**
     * Pontoons in placement order
     */
    public List<Pontoon> getPontoons() {
        return List.copyOf(pontoons.values());
    }

    public List<Pontoon> getPontoonsAtLevel(int level) {
        var result = new ArrayList<Pontoon>();
        for (var pontoon : pontoons.values()) {
            if (pontoon.position().y == level) {
                result.add(pontoon);
            }
        }
        return result;
    }

    @Override
    public Optional<PontoonId> occupantAt(GridPosition cell) {
        return Optional.ofNullable(cells.get(cell));
    }

    public Optional<Pontoon> pontoonAt(GridPosition cell) {
        var id = cells.get(cell);
        return id == null ? Optional.empty() : Optional.of(pontoons.get(id));
    }

    public Set<GridPosition> getOccupiedCells() {
        return cells.keySet();
    }

    /**
     * Add a pontoon, or replace the pontoon with the same id keeping its place in the ordering
     */
    public Grid with(Pontoon pontoon) {
        return withAll(List.of(pontoon));
    }

    public Grid withAll(Collection<Pontoon> additions) {
        var table = new LinkedHashMap<>(pontoons);
        for (var pontoon : additions) {
            table.put(pontoon.id(), pontoon);
        }
        return new Grid(dimensions, table.values(), nextId);
    }

    public Grid without(PontoonId id) {
        return withoutAll(List.of(id));
    }

    public Grid withoutAll(Collection<PontoonId> ids) {
        var table = new LinkedHashMap<>(pontoons);
        for (var id : ids) {
            table.remove(id);
        }
        return new Grid(dimensions, table.values(), nextId);
    }

    public GridStatistics statistics() {
        return GridStatistics.of(this);
    }

    /**
     * Equality covers the dimensions and the id to pontoon mapping; the id sequence is bookkeeping.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Grid that)) return false;
        return dimensions.equals(that.dimensions) && pontoons.equals(that.pontoons);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimensions, pontoons);
    }

    @Override
    public String toString() {
        return String.format("Grid[%dx%dx%d, pontoons=%d]", dimensions.width(), dimensions.height(),
                             dimensions.levels(), pontoons.size());
    }
}
