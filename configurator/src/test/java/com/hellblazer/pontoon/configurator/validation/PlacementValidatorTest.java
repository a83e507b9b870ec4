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
import com.hellblazer.pontoon.configurator.model.Pontoon;
import com.hellblazer.pontoon.configurator.model.PontoonColor;
import com.hellblazer.pontoon.configurator.model.PontoonId;
import com.hellblazer.pontoon.configurator.model.PontoonType;
import com.hellblazer.pontoon.configurator.model.Rotation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.hellblazer.pontoon.configurator.validation.ValidationErrorType.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Placement validator tests")
class PlacementValidatorTest {

    private static final GridDimensions DIMS = new GridDimensions(10, 10, 3);

    private static Pontoon pontoon(long id, int x, int y, int z, PontoonType type) {
        return new Pontoon(new PontoonId(id), new GridPosition(x, y, z), type, PontoonColor.BLUE, Rotation.NORTH);
    }

    private static Grid grid(Pontoon... pontoons) {
        return new Grid(DIMS, List.of(pontoons), 1);
    }

    private static List<ValidationErrorType> types(ValidationResult result) {
        return result.errors().stream().map(ValidationError::type).toList();
    }

    @Nested
    class Bounds {

        @Test
        void doubleAtTheEastEdgeLeavesTheGrid() {
            var result = new PlacementValidator(grid()).canPlace(new GridPosition(9, 0, 0), PontoonType.DOUBLE);
            assertEquals(List.of(OUT_OF_BOUNDS), types(result));
            assertEquals(new GridPosition(10, 0, 0), result.errors().get(0).position());

            assertTrue(new PlacementValidator(grid()).canPlace(new GridPosition(8, 0, 0), PontoonType.DOUBLE)
                                                     .isValid());
        }

        @Test
        void levelsOutsideTheStackAreOutOfBounds() {
            var validator = new PlacementValidator(grid());
            assertEquals(List.of(OUT_OF_BOUNDS), types(validator.canPlace(new GridPosition(0, 3, 0),
                                                                          PontoonType.SINGLE)));
            assertEquals(List.of(OUT_OF_BOUNDS), types(validator.canPlace(new GridPosition(0, -1, 0),
                                                                          PontoonType.SINGLE)));
            assertEquals(List.of(OUT_OF_BOUNDS, OUT_OF_BOUNDS),
                         types(validator.canPlace(new GridPosition(-3, 0, 0), PontoonType.DOUBLE)));
        }
    }

    @Nested
    class Overlap {

        @Test
        void everyOccupiedFootprintCellIsReported() {
            var validator = new PlacementValidator(grid(pontoon(7, 3, 0, 3, PontoonType.SINGLE)));
            var result = validator.canPlace(new GridPosition(2, 0, 3), PontoonType.DOUBLE);
            assertEquals(List.of(OVERLAP), types(result));
            var error = result.errors().get(0);
            assertEquals(new GridPosition(3, 0, 3), error.position());
            assertEquals(new PontoonId(7), error.pontoonId());
        }

        @Test
        void excludedPontoonDoesNotBlockItself() {
            var validator = new PlacementValidator(grid(pontoon(1, 0, 0, 0, PontoonType.DOUBLE)));
            assertTrue(validator.canPlace(new GridPosition(1, 0, 0), PontoonType.DOUBLE, new PontoonId(1)).isValid());
            assertFalse(validator.canPlace(new GridPosition(1, 0, 0), PontoonType.DOUBLE).isValid());
        }
    }

    @Nested
    class Support {

        @Test
        void supportChainsUpward() {
            var target = new GridPosition(5, 1, 5);
            var empty = new PlacementValidator(grid());
            assertEquals(List.of(NO_SUPPORT), types(empty.canPlace(target, PontoonType.SINGLE)));
            assertTrue(empty.hasSupport(new GridPosition(5, 0, 5)));
            assertFalse(empty.hasSupport(target));

            var base = new PlacementValidator(grid(pontoon(1, 5, 0, 5, PontoonType.SINGLE)));
            assertTrue(base.canPlace(target, PontoonType.SINGLE).isValid());
            assertEquals(List.of(NO_SUPPORT), types(base.canPlace(target.above(), PontoonType.SINGLE)));

            var stacked = new PlacementValidator(grid(pontoon(1, 5, 0, 5, PontoonType.SINGLE),
                                                      pontoon(2, 5, 1, 5, PontoonType.SINGLE)));
            assertTrue(stacked.canPlace(target.above(), PontoonType.SINGLE).isValid());
        }

        @Test
        void doubleNeedsSupportUnderBothCells() {
            var validator = new PlacementValidator(grid(pontoon(1, 5, 0, 5, PontoonType.SINGLE)));
            var result = validator.canPlace(new GridPosition(5, 1, 5), PontoonType.DOUBLE);
            assertEquals(List.of(NO_SUPPORT), types(result));
            assertEquals(new GridPosition(6, 1, 5), result.errors().get(0).position());

            var wide = new PlacementValidator(grid(pontoon(1, 4, 0, 5, PontoonType.SINGLE),
                                                   pontoon(2, 5, 0, 5, PontoonType.SINGLE)));
            assertTrue(wide.canPlace(new GridPosition(4, 1, 5), PontoonType.DOUBLE).isValid());
        }

        @Test
        void aPontoonCannotSupportItself() {
            var validator = new PlacementValidator(grid(pontoon(1, 3, 0, 3, PontoonType.SINGLE)));
            assertEquals(List.of(NO_SUPPORT), types(validator.canMove(new PontoonId(1), new GridPosition(3, 1, 3))));
        }
    }

    @Test
    @DisplayName("Errors are listed bounds first, then overlap, then support")
    void testErrorOrder() {
        var empty = new PlacementValidator(grid());
        assertEquals(List.of(OUT_OF_BOUNDS, NO_SUPPORT),
                     types(empty.canPlace(new GridPosition(9, 1, 5), PontoonType.DOUBLE)));

        var stack = new PlacementValidator(grid(pontoon(1, 4, 0, 4, PontoonType.SINGLE),
                                                pontoon(2, 4, 1, 4, PontoonType.SINGLE)));
        var result = stack.canPlace(new GridPosition(4, 1, 4), PontoonType.DOUBLE);
        assertEquals(List.of(OVERLAP, NO_SUPPORT), types(result));
        assertEquals(new GridPosition(5, 1, 4), result.errors().get(1).position());
        assertEquals(2, result.messages().size());
    }

    @Test
    @DisplayName("Moves report missing pontoons, no-op moves and stranded pontoons")
    void testCanMove() {
        var validator = new PlacementValidator(grid(pontoon(1, 2, 0, 2, PontoonType.SINGLE),
                                                    pontoon(2, 2, 1, 2, PontoonType.SINGLE),
                                                    pontoon(3, 0, 0, 0, PontoonType.DOUBLE)));

        assertEquals(List.of(NOT_FOUND), types(validator.canMove(new PontoonId(42), new GridPosition(1, 0, 1))));

        var same = validator.canMove(new PontoonId(1), new GridPosition(2, 0, 2));
        assertEquals(List.of(ALREADY_AT_POSITION), types(same));
        assertEquals("Pontoon is already at this position", same.messages().get(0));

        var stranding = validator.canMove(new PontoonId(1), new GridPosition(7, 0, 7));
        assertEquals(List.of(NO_SUPPORT), types(stranding));
        assertEquals(new PontoonId(2), stranding.errors().get(0).pontoonId());

        assertTrue(validator.canMove(new PontoonId(3), new GridPosition(1, 0, 0)).isValid());
        assertTrue(validator.canMove(new PontoonId(2), new GridPosition(0, 1, 0)).isValid());
        assertEquals(List.of(OVERLAP), types(validator.canMove(new PontoonId(3), new GridPosition(1, 0, 2))));
    }

    @Test
    @DisplayName("Removing a pontoon that carries another is rejected")
    void testCanRemove() {
        var validator = new PlacementValidator(grid(pontoon(1, 2, 0, 2, PontoonType.SINGLE),
                                                    pontoon(2, 2, 1, 2, PontoonType.SINGLE)));
        assertEquals(List.of(NO_SUPPORT), types(validator.canRemove(new PontoonId(1))));
        assertTrue(validator.canRemove(new PontoonId(2)).isValid());
        assertEquals(List.of(NOT_FOUND), types(validator.canRemove(new PontoonId(9))));
    }

    @Test
    @DisplayName("Nearby search walks rings outward, ordered by x then z")
    void testFindNearbyValidPositions() {
        var validator = new PlacementValidator(grid(pontoon(1, 5, 0, 5, PontoonType.SINGLE)));

        var singles = validator.findNearbyValidPositions(new GridPosition(5, 0, 5), PontoonType.SINGLE, 1);
        assertEquals(List.of(new GridPosition(4, 0, 4), new GridPosition(4, 0, 5), new GridPosition(4, 0, 6),
                             new GridPosition(5, 0, 4), new GridPosition(5, 0, 6), new GridPosition(6, 0, 4),
                             new GridPosition(6, 0, 5), new GridPosition(6, 0, 6)), singles);

        var doubles = validator.findNearbyValidPositions(new GridPosition(5, 0, 5), PontoonType.DOUBLE, 1);
        assertFalse(doubles.contains(new GridPosition(4, 0, 5)));
        assertEquals(7, doubles.size());

        assertEquals(List.of(new GridPosition(0, 0, 0)),
                     new PlacementValidator(grid()).findNearbyValidPositions(new GridPosition(0, 0, 0),
                                                                             PontoonType.SINGLE, 0));
        assertTrue(validator.findNearbyValidPositions(new GridPosition(5, 1, 5), PontoonType.DOUBLE, 0).isEmpty());
        assertEquals(List.of(new GridPosition(5, 1, 5)),
                     validator.findNearbyValidPositions(new GridPosition(5, 1, 5), PontoonType.SINGLE, 3));
    }

    @Test
    @DisplayName("Separate platforms are disconnected until joined")
    void testConnectivity() {
        var pontoons = new ArrayList<Pontoon>();
        long id = 1;
        for (int z = 0; z < 2; z++) {
            pontoons.add(pontoon(id++, 0, 0, z, PontoonType.DOUBLE));
            pontoons.add(pontoon(id++, 4, 0, z, PontoonType.DOUBLE));
        }
        var split = new Grid(DIMS, pontoons, 1);
        var result = new PlacementValidator(split).validateConnectivity();
        assertEquals(List.of(DISCONNECTED), types(result));
        assertEquals("Structure has 2 disconnected components", result.messages().get(0));
        assertEquals(List.of(Set.of(new PontoonId(1), new PontoonId(3)), Set.of(new PontoonId(2), new PontoonId(4))),
                     ConnectivityAnalyzer.pontoonComponents(split));

        var joined = split.with(pontoon(id, 2, 0, 0, PontoonType.DOUBLE));
        assertTrue(new PlacementValidator(joined).validateConnectivity().isValid());

        var tower = grid(pontoon(1, 3, 0, 3, PontoonType.SINGLE), pontoon(2, 3, 1, 3, PontoonType.SINGLE));
        assertTrue(ConnectivityAnalyzer.isConnected(tower.getOccupiedCells()));
        assertTrue(new PlacementValidator(grid()).validateConnectivity().isValid());
    }

    @Test
    @DisplayName("An enforcing validator refuses changes that split the structure")
    void testConnectivityEnforced() {
        var tower = grid(pontoon(1, 3, 0, 3, PontoonType.SINGLE), pontoon(2, 3, 1, 3, PontoonType.SINGLE));
        var enforcing = new PlacementValidator(tower, tower, true);
        assertTrue(enforcing.isEnforcingConnectivity());

        assertTrue(enforcing.canPlace(new GridPosition(3, 0, 4), PontoonType.SINGLE).isValid());
        assertTrue(enforcing.canPlace(new GridPosition(3, 2, 3), PontoonType.SINGLE).isValid());
        assertEquals(List.of(DISCONNECTED), types(enforcing.canPlace(new GridPosition(6, 0, 6), PontoonType.SINGLE)));
        assertEquals(List.of(OUT_OF_BOUNDS), types(enforcing.canPlace(new GridPosition(10, 0, 0), PontoonType.SINGLE)));
        assertTrue(new PlacementValidator(tower).canPlace(new GridPosition(6, 0, 6), PontoonType.SINGLE).isValid());

        assertEquals(List.of(NO_SUPPORT), types(enforcing.canRemove(new PontoonId(1))));
        assertTrue(enforcing.canRemove(new PontoonId(2)).isValid());
        assertEquals(List.of(DISCONNECTED), types(enforcing.canMove(new PontoonId(2), new GridPosition(6, 0, 6))));

        var empty = new PlacementValidator(grid(), grid(), true);
        assertTrue(empty.canPlace(new GridPosition(7, 0, 7), PontoonType.DOUBLE).isValid());
    }

    @Test
    @DisplayName("Structure validation reports every broken invariant")
    void testValidateStructure() {
        var broken = List.of(pontoon(1, 0, 0, 0, PontoonType.DOUBLE), pontoon(2, 1, 0, 0, PontoonType.SINGLE),
                             pontoon(3, 0, 2, 0, PontoonType.SINGLE), pontoon(4, 10, 0, 0, PontoonType.SINGLE),
                             pontoon(1, 5, 0, 5, PontoonType.SINGLE));
        var result = PlacementValidator.validateStructure(DIMS, broken);
        assertEquals(List.of(OVERLAP, OUT_OF_BOUNDS, OVERLAP, NO_SUPPORT), types(result));
        assertTrue(result.messages().get(2).contains("Duplicate"));

        var sound = grid(pontoon(1, 0, 0, 0, PontoonType.DOUBLE), pontoon(2, 1, 1, 0, PontoonType.SINGLE));
        assertTrue(new PlacementValidator(sound).validateStructure().isValid());
    }
}
