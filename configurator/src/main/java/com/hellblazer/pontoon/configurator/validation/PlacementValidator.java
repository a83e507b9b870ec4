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
import com.hellblazer.pontoon.configurator.model.GridDimensions;
import com.hellblazer.pontoon.configurator.model.GridPosition;
import com.hellblazer.pontoon.configurator.model.OccupancyView;
import com.hellblazer.pontoon.configurator.model.Pontoon;
import com.hellblazer.pontoon.configurator.model.PontoonId;
import com.hellblazer.pontoon.configurator.model.PontoonType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * Placement rules for a grid. Hover previews and mutations ask the same questions of the same validator, so the
 * answer shown before an action is the answer the action gets.
 * <p>
 * Rules run in the order bounds, overlap, support. Every failing footprint cell contributes its own error, so
 * callers see which rule failed where. A validator that enforces connectivity additionally rejects, with
 * {@link ValidationErrorType#DISCONNECTED}, any otherwise valid place, move or remove whose resulting structure would
 * fall apart into more than one component.
 *
 * @author hal.hildebrand
 */
public class PlacementValidator {

    private final Grid          grid;
    private final OccupancyView occupancy;
    private final boolean       enforceConnectivity;

    public PlacementValidator(Grid grid) {
        this(grid, grid);
    }

    public PlacementValidator(Grid grid, OccupancyView occupancy) {
        this(grid, occupancy, false);
    }

    /**
     * @param occupancy           cell lookup used by the rules; the grid or an index consistent with it
     * @param enforceConnectivity when true, place, move and remove also require the result to stay one structure
     */
    public PlacementValidator(Grid grid, OccupancyView occupancy, boolean enforceConnectivity) {
        this.grid = Objects.requireNonNull(grid, "grid");
        this.occupancy = Objects.requireNonNull(occupancy, "occupancy");
        this.enforceConnectivity = enforceConnectivity;
    }

    /**
     * Full invariant check of a set of pontoons against grid dimensions: bounds, overlap and support.
     */
    public static ValidationResult validateStructure(GridDimensions dimensions, Collection<Pontoon> pontoons) {
        var errors = new ArrayList<ValidationError>();
        var claimed = new HashMap<GridPosition, PontoonId>();
        var ids = new HashSet<PontoonId>();
        for (var pontoon : pontoons) {
            if (!ids.add(pontoon.id())) {
                errors.add(new ValidationError(ValidationErrorType.OVERLAP, "Duplicate pontoon id " + pontoon.id(),
                                               pontoon.position(), pontoon.id()));
            }
            for (var cell : pontoon.footprint()) {
                if (!dimensions.contains(cell)) {
                    errors.add(new ValidationError(ValidationErrorType.OUT_OF_BOUNDS,
                                                   pontoon.id() + " is outside the grid at " + cell, cell,
                                                   pontoon.id()));
                    continue;
                }
                var previous = claimed.putIfAbsent(cell, pontoon.id());
                if (previous != null) {
                    errors.add(new ValidationError(ValidationErrorType.OVERLAP,
                                                   pontoon.id() + " overlaps " + previous + " at " + cell, cell,
                                                   pontoon.id()));
                }
            }
        }
        for (var pontoon : pontoons) {
            if (pontoon.position().y <= dimensions.baseLevel()) {
                continue;
            }
            for (var cell : pontoon.footprint()) {
                if (dimensions.contains(cell) && !claimed.containsKey(cell.below())) {
                    errors.add(new ValidationError(ValidationErrorType.NO_SUPPORT,
                                                   pontoon.id() + " has no support below " + cell, cell,
                                                   pontoon.id()));
                }
            }
        }
        return new ValidationResult(errors);
    }

    public Grid getGrid() {
        return grid;
    }

    public boolean isEnforcingConnectivity() {
        return enforceConnectivity;
    }

    public ValidationResult validateStructure() {
        return validateStructure(grid.getDimensions(), grid.getPontoons());
    }

    public ValidationResult canPlace(GridPosition position, PontoonType type) {
        return canPlace(position, type, null);
    }

    /**
     * @param excludeId pontoon whose own cells are treated as free, both for overlap and for support; may be null
     */
    public ValidationResult canPlace(GridPosition position, PontoonType type, PontoonId excludeId) {
        var result = placementRules(position, type, excludeId);
        if (!result.isValid()) {
            return result;
        }
        var vacated = excludeId == null ? List.<GridPosition>of()
                                        : grid.getPontoon(excludeId).map(Pontoon::footprint).orElse(List.of());
        return structureAfter(vacated, type.footprint(position));
    }

    public ValidationResult canMove(PontoonId id, GridPosition newPosition) {
        var found = grid.getPontoon(id);
        if (found.isEmpty()) {
            return ValidationResult.of(
            new ValidationError(ValidationErrorType.NOT_FOUND, "Pontoon " + id + " not found", newPosition, id));
        }
        var pontoon = found.get();
        if (pontoon.position().equals(newPosition)) {
            return ValidationResult.of(
            new ValidationError(ValidationErrorType.ALREADY_AT_POSITION, "Pontoon is already at this position",
                                newPosition, id));
        }
        var target = pontoon.type().footprint(newPosition);
        var vacated = new ArrayList<>(pontoon.footprint());
        vacated.removeAll(target);
        var result = placementRules(newPosition, pontoon.type(), id).merge(stranded(id, vacated));
        if (!result.isValid()) {
            return result;
        }
        return structureAfter(pontoon.footprint(), target);
    }

    public ValidationResult canRemove(PontoonId id) {
        var found = grid.getPontoon(id);
        if (found.isEmpty()) {
            return ValidationResult.of(
            new ValidationError(ValidationErrorType.NOT_FOUND, "Pontoon " + id + " not found", null, id));
        }
        var result = stranded(id, found.get().footprint());
        if (!result.isValid()) {
            return result;
        }
        return structureAfter(found.get().footprint(), List.of());
    }

    /**
     * Connectivity of the structure obtained by freeing the vacated cells and then claiming the claimed ones. Always
     * valid when this validator does not enforce connectivity.
     */
    public ValidationResult structureAfter(Collection<GridPosition> vacated, Collection<GridPosition> claimed) {
        if (!enforceConnectivity) {
            return ValidationResult.valid();
        }
        var cells = new HashSet<>(grid.getOccupiedCells());
        cells.removeAll(vacated);
        cells.addAll(claimed);
        return connectivityOf(cells);
    }

    private ValidationResult placementRules(GridPosition position, PontoonType type, PontoonId excludeId) {
        var dimensions = grid.getDimensions();
        var footprint = type.footprint(position);
        var errors = new ArrayList<ValidationError>();
        var inBounds = new ArrayList<GridPosition>(footprint.size());

        for (var cell : footprint) {
            if (dimensions.contains(cell)) {
                inBounds.add(cell);
            } else {
                errors.add(new ValidationError(ValidationErrorType.OUT_OF_BOUNDS,
                                               "Position " + cell + " is outside the grid", cell));
            }
        }
        for (var cell : inBounds) {
            var occupant = occupancy.occupantAt(cell);
            if (occupant.isPresent() && !occupant.get().equals(excludeId)) {
                errors.add(new ValidationError(ValidationErrorType.OVERLAP,
                                               "Position " + cell + " is occupied by " + occupant.get(), cell,
                                               occupant.get()));
            }
        }
        if (position.y > dimensions.baseLevel()) {
            for (var cell : inBounds) {
                if (!supported(cell, excludeId)) {
                    errors.add(new ValidationError(ValidationErrorType.NO_SUPPORT,
                                                   "Position " + cell + " has no support below", cell));
                }
            }
        }
        return errors.isEmpty() ? ValidationResult.valid() : new ValidationResult(errors);
    }

    /**
     * @return true if the position is on the base level or has an occupant directly below
     */
    public boolean hasSupport(GridPosition position) {
        return supported(position, null);
    }

    public ValidationResult validateConnectivity() {
        return connectivityOf(grid.getOccupiedCells());
    }

    private static ValidationResult connectivityOf(Collection<GridPosition> cells) {
        if (cells.size() <= 1) {
            return ValidationResult.valid();
        }
        var components = ConnectivityAnalyzer.components(cells);
        if (components.size() <= 1) {
            return ValidationResult.valid();
        }
        return ValidationResult.of(ValidationErrorType.DISCONNECTED,
                                   "Structure has " + components.size() + " disconnected components");
    }

    /**
     * Valid anchors for the type on the target's level, searched in Chebyshev rings of growing radius around the
     * target. Nearest ring first; within a ring ordered by x, then z.
     */
    public List<GridPosition> findNearbyValidPositions(GridPosition target, PontoonType type, int maxDistance) {
        var result = new ArrayList<GridPosition>();
        for (int ring = 0; ring <= maxDistance; ring++) {
            var candidates = new ArrayList<GridPosition>();
            for (int dx = -ring; dx <= ring; dx++) {
                for (int dz = -ring; dz <= ring; dz++) {
                    if (Math.max(Math.abs(dx), Math.abs(dz)) == ring) {
                        candidates.add(target.offset(dx, 0, dz));
                    }
                }
            }
            candidates.sort(Comparator.<GridPosition>comparingInt(p -> p.x).thenComparingInt(p -> p.z));
            for (var candidate : candidates) {
                if (canPlace(candidate, type).isValid()) {
                    result.add(candidate);
                }
            }
        }
        return result;
    }

    private boolean supported(GridPosition cell, PontoonId excludeId) {
        if (cell.y == grid.getDimensions().baseLevel()) {
            return true;
        }
        var below = occupancy.occupantAt(cell.below());
        return below.isPresent() && !below.get().equals(excludeId);
    }

    // pontoons resting on any of the cells that are about to be vacated by id
    private ValidationResult stranded(PontoonId id, List<GridPosition> vacated) {
        var errors = new ArrayList<ValidationError>();
        for (var cell : vacated) {
            var above = occupancy.occupantAt(cell.above());
            if (above.isPresent() && !above.get().equals(id)) {
                errors.add(new ValidationError(ValidationErrorType.NO_SUPPORT,
                                               above.get() + " rests on " + cell + " and would lose support",
                                               cell.above(), above.get()));
            }
        }
        return errors.isEmpty() ? ValidationResult.valid() : new ValidationResult(errors);
    }
}
