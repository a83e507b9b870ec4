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

import com.hellblazer.pontoon.configurator.config.ConfiguratorConfig;
import com.hellblazer.pontoon.configurator.index.OccupancyIndex;
import com.hellblazer.pontoon.configurator.model.Grid;
import com.hellblazer.pontoon.configurator.model.GridDimensions;
import com.hellblazer.pontoon.configurator.model.GridPosition;
import com.hellblazer.pontoon.configurator.model.PontoonColor;
import com.hellblazer.pontoon.configurator.model.PontoonType;
import com.hellblazer.pontoon.configurator.model.Rotation;
import com.hellblazer.pontoon.configurator.operation.ConfiguratorService;
import net.jqwik.api.*;
import org.junit.jupiter.api.DisplayName;

import java.util.HashMap;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Random placement and removal sequences on a small grid, checked against the structural rules after every step.
 *
 * @author hal.hildebrand
 */
@DisplayName("Placement Property-Based Tests")
class PlacementPropertyTest {

    private static final GridDimensions DIMS = new GridDimensions(6, 6, 3);

    record Step(GridPosition position, PontoonType type, boolean removal) {
    }

    @Property(tries = 200)
    @Label("Preview validation predicts the outcome of placement")
    void previewAgreesWithPlacement(@ForAll("steps") List<Step> steps) {
        var service = new ConfiguratorService(new ConfiguratorConfig());
        var grid = Grid.empty(DIMS);
        for (var step : steps) {
            var preview = new PlacementValidator(grid).canPlace(step.position(), step.type());
            var result = service.placePontoon(grid, step.position(), step.type(), PontoonColor.BLUE, Rotation.NORTH);
            assertEquals(preview.isValid(), result.success());
            assertEquals(preview.errors(), result.validation().errors());
            grid = result.grid();
        }
    }

    @Property(tries = 200)
    @Label("Preview validation predicts the outcome when connectivity is enforced")
    void previewAgreesWithMutationWhenStrict(@ForAll("steps") List<Step> steps) {
        var service = new ConfiguratorService(ConfiguratorConfig.strict());
        var grid = Grid.empty(DIMS);
        for (var step : steps) {
            var validator = service.validator(grid, grid);
            if (step.removal()) {
                var target = grid.occupantAt(step.position());
                if (target.isEmpty()) {
                    continue;
                }
                var preview = validator.canRemove(target.get());
                var result = service.removePontoon(grid, target.get());
                assertEquals(preview.isValid(), result.success());
                assertEquals(preview.errors(), result.validation().errors());
                grid = result.grid();
            } else {
                var preview = validator.canPlace(step.position(), step.type());
                var result = service.placePontoon(grid, step.position(), step.type(), PontoonColor.BLUE,
                                                  Rotation.NORTH);
                assertEquals(preview.isValid(), result.success());
                assertEquals(preview.errors(), result.validation().errors());
                grid = result.grid();
            }
            assertTrue(new PlacementValidator(grid).validateConnectivity().isValid());
        }
    }

    @Property(tries = 200)
    @Label("Every reachable grid satisfies bounds, exclusivity and support")
    void reachableGridsAreSound(@ForAll("steps") List<Step> steps) {
        var service = new ConfiguratorService(new ConfiguratorConfig());
        var grid = Grid.empty(DIMS);
        for (var step : steps) {
            if (step.removal()) {
                var target = grid.occupantAt(step.position());
                if (target.isPresent()) {
                    grid = service.removePontoon(grid, target.get()).grid();
                }
            } else {
                grid = service.placePontoon(grid, step.position(), step.type(), PontoonColor.GREY, Rotation.WEST)
                              .grid();
            }
            assertTrue(PlacementValidator.validateStructure(DIMS, grid.getPontoons()).isValid());

            var owners = new HashMap<GridPosition, Object>();
            for (var pontoon : grid.getPontoons()) {
                for (var cell : pontoon.footprint()) {
                    assertNull(owners.put(cell, pontoon.id()), "cell claimed twice: " + cell);
                }
            }
            assertEquals(owners.keySet(), grid.getOccupiedCells());
        }
    }

    @Property(tries = 100)
    @Label("Incremental index maintenance matches a rebuild")
    void incrementalIndexMatchesRebuild(@ForAll("steps") List<Step> steps) {
        var service = new ConfiguratorService(new ConfiguratorConfig());
        var grid = Grid.empty(DIMS);
        var index = new OccupancyIndex();
        for (var step : steps) {
            if (step.removal()) {
                var target = index.occupantAt(step.position());
                if (target.isPresent() && service.removePontoon(grid, index, target.get()).success()) {
                    grid = grid.without(target.get());
                    index.remove(target.get());
                }
            } else {
                var result = service.placePontoon(grid, index, step.position(), step.type(), PontoonColor.BLUE,
                                                  Rotation.NORTH);
                if (result.success()) {
                    var placed = result.operations().get(0).after().get(0);
                    index.insert(placed.id(), placed.position(), placed.type().footprintSize());
                    grid = result.grid();
                }
            }
            assertTrue(index.isConsistentWith(grid));
        }
        assertTrue(OccupancyIndex.of(grid).isConsistentWith(grid));
    }

    @Property
    @Label("Placing at the same anchor twice fails the second time")
    void placementIsNotRepeatable(@ForAll("anchors") GridPosition anchor, @ForAll PontoonType type) {
        var service = new ConfiguratorService(new ConfiguratorConfig());
        var first = service.placePontoon(Grid.empty(DIMS), anchor, type, PontoonColor.BLUE, Rotation.NORTH);
        Assume.that(first.success());
        var second = service.placePontoon(first.grid(), anchor, type, PontoonColor.BLUE, Rotation.NORTH);
        assertFalse(second.success());
        assertTrue(second.validation().has(ValidationErrorType.OVERLAP));
        assertSame(first.grid(), second.grid());
    }

    @Provide
    Arbitrary<GridPosition> anchors() {
        return Combinators.combine(Arbitraries.integers().between(-1, 6), Arbitraries.just(0),
                                   Arbitraries.integers().between(-1, 6)).as(GridPosition::new);
    }

    @Provide
    Arbitrary<List<Step>> steps() {
        var positions = Combinators.combine(Arbitraries.integers().between(-1, 6), Arbitraries.integers().between(0, 3),
                                            Arbitraries.integers().between(-1, 6)).as(GridPosition::new);
        var step = Combinators.combine(positions, Arbitraries.of(PontoonType.class),
                                       Arbitraries.integers().between(0, 4))
                              .as((position, type, roll) -> new Step(position, type, roll == 0));
        return step.list().ofMinSize(1).ofMaxSize(60);
    }
}
