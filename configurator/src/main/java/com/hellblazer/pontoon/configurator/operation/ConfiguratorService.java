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
package com.hellblazer.pontoon.configurator.operation;

import com.hellblazer.pontoon.configurator.config.ConfiguratorConfig;
import com.hellblazer.pontoon.configurator.model.Grid;
import com.hellblazer.pontoon.configurator.model.GridPosition;
import com.hellblazer.pontoon.configurator.model.GridStatistics;
import com.hellblazer.pontoon.configurator.model.OccupancyView;
import com.hellblazer.pontoon.configurator.model.Pontoon;
import com.hellblazer.pontoon.configurator.model.PontoonColor;
import com.hellblazer.pontoon.configurator.model.PontoonId;
import com.hellblazer.pontoon.configurator.model.PontoonType;
import com.hellblazer.pontoon.configurator.model.Rotation;
import com.hellblazer.pontoon.configurator.validation.PlacementValidator;
import com.hellblazer.pontoon.configurator.validation.ValidationError;
import com.hellblazer.pontoon.configurator.validation.ValidationErrorType;
import com.hellblazer.pontoon.configurator.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Request to result operations on an immutable {@link Grid}. Each call validates, then produces a new grid together
 * with the {@link Operation} that describes the change. A failed call returns the input grid untouched.
 * <p>
 * Calls that accept an {@link OccupancyView} validate through it; it must agree with the grid.
 *
 * @author hal.hildebrand
 */
public class ConfiguratorService {
    private static final Logger log = LoggerFactory.getLogger(ConfiguratorService.class);

    private final ConfiguratorConfig config;
    private final Clock              clock;
    private final AtomicLong         operationSequence = new AtomicLong();

    public ConfiguratorService(ConfiguratorConfig config) {
        this(config, Clock.systemUTC());
    }

    public ConfiguratorService(ConfiguratorConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ConfiguratorConfig getConfig() {
        return config;
    }

    public Clock getClock() {
        return clock;
    }

    public OperationResult placePontoon(Grid grid, GridPosition position, PontoonType type, PontoonColor color,
                                        Rotation rotation) {
        return placePontoon(grid, grid, position, type, color, rotation);
    }

    public OperationResult placePontoon(Grid grid, OccupancyView occupancy, GridPosition position, PontoonType type,
                                        PontoonColor color, Rotation rotation) {
        var validation = validator(grid, occupancy).canPlace(position, type);
        if (!validation.isValid()) {
            return reject(grid, "place", validation);
        }
        var pontoon = new Pontoon(grid.nextPontoonId(), position, type, color, rotation);
        var next = grid.with(pontoon);
        return commit(next, operation(OperationKind.PLACE, List.of(pontoon.id()), List.of(), List.of(pontoon)));
    }

    public OperationResult removePontoon(Grid grid, PontoonId id) {
        return removePontoon(grid, grid, id);
    }

    public OperationResult removePontoon(Grid grid, OccupancyView occupancy, PontoonId id) {
        var validation = validator(grid, occupancy).canRemove(id);
        if (!validation.isValid()) {
            return reject(grid, "remove", validation);
        }
        var pontoon = grid.getPontoon(id).orElseThrow();
        return commit(grid.without(id), operation(OperationKind.REMOVE, List.of(id), List.of(pontoon),
                                                        List.of()));
    }

    public OperationResult movePontoon(Grid grid, PontoonId id, GridPosition newPosition) {
        return movePontoon(grid, grid, id, newPosition);
    }

    public OperationResult movePontoon(Grid grid, OccupancyView occupancy, PontoonId id, GridPosition newPosition) {
        var validation = validator(grid, occupancy).canMove(id, newPosition);
        if (!validation.isValid()) {
            return reject(grid, "move", validation);
        }
        var pontoon = grid.getPontoon(id).orElseThrow();
        var moved = pontoon.movedTo(newPosition);
        return commit(grid.with(moved),
                      operation(OperationKind.MOVE, List.of(id), List.of(pontoon), List.of(moved)));
    }

    /**
     * Turn a pontoon to its next orientation. Orientation does not affect the footprint, so this succeeds for any
     * existing pontoon.
     */
    public OperationResult rotatePontoon(Grid grid, PontoonId id) {
        var found = grid.getPontoon(id);
        if (found.isEmpty()) {
            return reject(grid, "rotate", notFound(id));
        }
        return rotatePontoon(grid, id, found.get().rotation().next());
    }

    public OperationResult rotatePontoon(Grid grid, PontoonId id, Rotation rotation) {
        var found = grid.getPontoon(id);
        if (found.isEmpty()) {
            return reject(grid, "rotate", notFound(id));
        }
        var pontoon = found.get();
        if (pontoon.rotation() == rotation) {
            return reject(grid, "rotate", ValidationResult.of(
            new ValidationError(ValidationErrorType.SAME_VALUE, "Pontoon already has this rotation",
                                pontoon.position(), id)));
        }
        var rotated = pontoon.withRotation(rotation);
        return commit(grid.with(rotated),
                      operation(OperationKind.ROTATE, List.of(id), List.of(pontoon), List.of(rotated)));
    }

    public OperationResult recolorPontoon(Grid grid, PontoonId id, PontoonColor color) {
        var found = grid.getPontoon(id);
        if (found.isEmpty()) {
            return reject(grid, "recolor", notFound(id));
        }
        var pontoon = found.get();
        if (pontoon.color() == color) {
            return reject(grid, "recolor", ValidationResult.of(
            new ValidationError(ValidationErrorType.SAME_VALUE, "Pontoon already has this color",
                                pontoon.position(), id)));
        }
        var painted = pontoon.withColor(color);
        return commit(grid.with(painted),
                      operation(OperationKind.PAINT, List.of(id), List.of(pontoon), List.of(painted)));
    }

    public BatchOperationResult placePontoonsBatch(Grid grid, List<GridPosition> positions, PontoonType type,
                                                   PontoonColor color, Rotation rotation, boolean skipInvalid) {
        return placePontoonsBatch(grid, null, positions, type, color, rotation, skipInvalid);
    }

    /**
     * Place one pontoon per position, in order, as a single operation. Later positions are validated against the
     * grid including the earlier placements of the same batch.
     *
     * @param occupancy   view of the input grid used for the first validation, or null to use the grid itself
     * @param skipInvalid when true invalid positions are skipped and reported, otherwise the first invalid position
     *                    fails the whole batch
     */
    public BatchOperationResult placePontoonsBatch(Grid grid, OccupancyView occupancy, List<GridPosition> positions,
                                                   PontoonType type, PontoonColor color, Rotation rotation,
                                                   boolean skipInvalid) {
        var builder = new BatchOperationResult.Builder().withRequestedCount(positions.size());
        var skipped = new LinkedHashMap<GridPosition, ValidationResult>();
        var placed = new ArrayList<Pontoon>();
        var working = grid;
        var view = occupancy == null ? grid : occupancy;

        for (var position : positions) {
            var validation = new PlacementValidator(working, view).canPlace(position, type);
            if (!validation.isValid()) {
                if (!skipInvalid) {
                    return builder.withResult(reject(grid, "batch place", validation)).build();
                }
                skipped.put(position, validation);
                continue;
            }
            var pontoon = new Pontoon(working.nextPontoonId(), position, type, color, rotation);
            placed.add(pontoon);
            working = working.with(pontoon);
            view = working;
        }
        builder.withSkipped(Collections.unmodifiableMap(skipped));

        if (placed.isEmpty()) {
            var reasons = new ValidationResult(
            skipped.values().stream().flatMap(v -> v.errors().stream()).toList());
            if (reasons.isValid()) {
                reasons = ValidationResult.of(ValidationErrorType.NOT_FOUND, "No positions to place");
            }
            return builder.withResult(reject(grid, "batch place", reasons)).build();
        }
        var ids = placed.stream().map(Pontoon::id).toList();
        var result = commitConnected(grid, working, operation(OperationKind.BATCH_PLACE, ids, List.of(), placed));
        if (result.success()) {
            builder.withAffectedIds(ids);
            log.debug("Batch placed {} of {} pontoons, {} skipped", placed.size(), positions.size(), skipped.size());
        }
        return builder.withResult(result).build();
    }

    /**
     * Remove all of the given pontoons as a single operation. The batch is validated as a whole: a pontoon may rest
     * on another one that is removed in the same batch only if it is removed as well.
     */
    public BatchOperationResult removePontoonsBatch(Grid grid, Collection<PontoonId> ids) {
        var builder = new BatchOperationResult.Builder().withRequestedCount(ids.size());
        var removing = new LinkedHashSet<>(ids);
        var errors = new ArrayList<ValidationError>();
        var removed = new ArrayList<Pontoon>();
        for (var id : removing) {
            var found = grid.getPontoon(id);
            if (found.isEmpty()) {
                errors.addAll(notFound(id).errors());
                continue;
            }
            removed.add(found.get());
        }
        for (var pontoon : removed) {
            for (var cell : pontoon.footprint()) {
                grid.occupantAt(cell.above()).filter(above -> !removing.contains(above)).ifPresent(
                above -> errors.add(new ValidationError(ValidationErrorType.NO_SUPPORT,
                                                        above + " rests on " + cell + " and would lose support",
                                                        cell.above(), above)));
            }
        }
        if (!errors.isEmpty() || removed.isEmpty()) {
            var reasons = errors.isEmpty() ? ValidationResult.of(ValidationErrorType.NOT_FOUND, "No pontoons to remove")
                                           : new ValidationResult(errors);
            return builder.withResult(reject(grid, "batch remove", reasons)).build();
        }
        var removedIds = removed.stream().map(Pontoon::id).toList();
        var result = commitConnected(grid, grid.withoutAll(removedIds),
                            operation(OperationKind.BATCH_REMOVE, removedIds, removed, List.of()));
        if (result.success()) {
            builder.withAffectedIds(removedIds);
        }
        return builder.withResult(result).build();
    }

    public GridStatistics statistics(Grid grid) {
        return grid.statistics();
    }

    /**
     * Record an operation that does not change the grid, such as a selection
     */
    public Operation record(OperationKind kind, List<PontoonId> affected) {
        return operation(kind, affected, List.of(), List.of());
    }

    /**
     * Validator for single mutations. With connectivity enforced it also answers whether the structure stays whole,
     * so a preview asking the same validator gets the answer the mutation gets.
     */
    public PlacementValidator validator(Grid grid, OccupancyView occupancy) {
        return new PlacementValidator(grid, occupancy, config.isEnforceConnectivity());
    }

    private OperationResult commit(Grid after, Operation operation) {
        return OperationResult.success(after, operation);
    }

    // batches validate cell by cell and are held to connectivity only as a whole
    private OperationResult commitConnected(Grid before, Grid after, Operation operation) {
        if (config.isEnforceConnectivity()) {
            var connectivity = new PlacementValidator(after).validateConnectivity();
            if (!connectivity.isValid()) {
                return reject(before, operation.kind().name().toLowerCase(Locale.ROOT), connectivity);
            }
        }
        return commit(after, operation);
    }

    private Operation operation(OperationKind kind, List<PontoonId> affected, List<Pontoon> before,
                                List<Pontoon> after) {
        var now = clock.instant();
        var id = "op_" + now.toEpochMilli() + "_" + operationSequence.incrementAndGet();
        return new Operation(id, kind, now, affected, before, after);
    }

    private static ValidationResult notFound(PontoonId id) {
        return ValidationResult.of(
        new ValidationError(ValidationErrorType.NOT_FOUND, "Pontoon " + id + " not found", null, id));
    }

    private static OperationResult reject(Grid grid, String action, ValidationResult validation) {
        log.debug("Rejected {}: {}", action, validation.messages());
        return OperationResult.failure(grid, validation);
    }
}
