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
package com.hellblazer.pontoon.configurator.coordinate;

import com.hellblazer.pontoon.configurator.model.GridDimensions;
import com.hellblazer.pontoon.configurator.model.GridPosition;
import com.hellblazer.pontoon.geometry.Camera;
import com.hellblazer.pontoon.geometry.Viewport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.vecmath.Point3f;
import javax.vecmath.Vector3f;

import static com.hellblazer.pontoon.configurator.ScreenFixture.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Coordinate calculator tests")
class CoordinateCalculatorTest {
    private static final double EPSILON = 1e-9;

    private final GridDimensions dimensions = new GridDimensions(10, 10, 3);

    private CoordinateCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new CoordinateCalculator(500, 400, 16);
    }

    @Test
    @DisplayName("Grid to world places cell centres around the origin")
    void testGridToWorld() {
        var origin = calculator.gridToWorld(new GridPosition(0, 0, 0), dimensions);
        assertEquals(-2.25, origin.x(), EPSILON);
        assertEquals(0.0, origin.y(), EPSILON);
        assertEquals(-2.25, origin.z(), EPSILON);

        var corner = calculator.gridToWorld(new GridPosition(9, 2, 9), dimensions);
        assertEquals(2.25, corner.x(), EPSILON);
        assertEquals(0.8, corner.y(), EPSILON);
        assertEquals(2.25, corner.z(), EPSILON);

        var physical = calculator.gridToPhysical(new GridPosition(5, 1, 4), dimensions);
        assertEquals(250.0, physical.x, EPSILON);
        assertEquals(400.0, physical.y, EPSILON);
        assertEquals(-250.0, physical.z, EPSILON);
    }

    @Test
    @DisplayName("World to grid is the exact inverse of grid to world")
    void testAffineInverse() {
        for (int y = dimensions.baseLevel(); y <= dimensions.topLevel(); y++) {
            for (int z = 0; z < dimensions.height(); z++) {
                for (int x = 0; x < dimensions.width(); x++) {
                    var cell = new GridPosition(x, y, z);
                    assertEquals(cell, calculator.worldToGrid(calculator.gridToWorld(cell, dimensions), dimensions));
                }
            }
        }
        var odd = new GridDimensions(7, 5, 2, -1);
        var underwater = new GridPosition(6, -1, 4);
        assertEquals(underwater, calculator.worldToGrid(calculator.gridToWorld(underwater, odd), odd));
    }

    @Test
    @DisplayName("Cell below steps one level down and stops at the base level")
    void testCellBelow() {
        assertEquals(new GridPosition(4, 1, 6),
                     calculator.cellBelow(new GridPosition(4, 2, 6), dimensions).orElseThrow());
        assertTrue(calculator.cellBelow(new GridPosition(4, 0, 6), dimensions).isEmpty());
    }

    @Test
    @DisplayName("Grid intersections are cell corners")
    void testGridIntersections() {
        var first = calculator.gridIntersectionToWorld(0, 0, 1, dimensions);
        assertEquals(-2.5, first.x(), EPSILON);
        assertEquals(0.4, first.y(), EPSILON);
        assertEquals(-2.5, first.z(), EPSILON);
        var last = calculator.gridIntersectionToWorld(10, 10, 0, dimensions);
        assertEquals(2.5, last.x(), EPSILON);
        assertEquals(2.5, last.z(), EPSILON);
        assertEquals(500.0, calculator.physicalDistance(new GridPosition(0, 0, 0), new GridPosition(1, 0, 0),
                                                        dimensions), EPSILON);
    }

    @Test
    @DisplayName("Screen to grid resolves the cell under the pointer on the active level")
    void testScreenToGrid() {
        var camera = topDown(dimensions);
        var viewport = viewport(dimensions);
        for (int level = 0; level < 3; level++) {
            var cell = calculator.screenToGrid(new ScreenPoint(pixelX(5), pixelY(3)), camera, viewport, dimensions,
                                               level);
            assertEquals(new GridPosition(5, level, 3), cell.orElseThrow());
        }
        assertEquals(new GridPosition(0, 0, 9),
                     calculator.screenToGrid(new ScreenPoint(pixelX(0), pixelY(9)), camera, viewport, dimensions, 0)
                               .orElseThrow());
    }

    @Test
    @DisplayName("Screen to grid is empty off the grid, on invalid levels and when the ray misses")
    void testScreenToGridMisses() {
        var camera = topDown(dimensions);
        var viewport = viewport(dimensions);
        assertTrue(calculator.screenToGrid(new ScreenPoint(-50, -50), camera, viewport, dimensions, 0).isEmpty());
        assertTrue(calculator.screenToGrid(new ScreenPoint(pixelX(1), pixelY(1)), camera, viewport, dimensions, 3)
                             .isEmpty());

        // looking up from above the deck, the ray never meets the level plane
        var upward = Camera.perspective(new Point3f(0, 5, 0), new Point3f(10, 15, 0), new Vector3f(0, 1, 0),
                                        (float) Math.toRadians(30));
        assertTrue(calculator.screenToGrid(new ScreenPoint(500, 500), upward, viewport, dimensions, 2).isEmpty());
    }

    @Test
    @DisplayName("Perspective camera above the grid centre resolves the centre cells")
    void testPerspective() {
        var camera = Camera.perspective(new Point3f(0, 10, 0), new Point3f(0, 0, 0), new Vector3f(0, 0, -1),
                                        (float) Math.toRadians(45));
        var viewport = new Viewport(800, 800);
        var cell = calculator.screenToGrid(new ScreenPoint(405, 405), camera, viewport, dimensions, 0).orElseThrow();
        assertTrue(cell.x == 4 || cell.x == 5, "x near centre: " + cell);
        assertTrue(cell.z == 4 || cell.z == 5, "z near centre: " + cell);
    }

    @Test
    @DisplayName("Repeated resolutions are identical and served from the cache")
    void testDeterminismAndCaching() {
        var camera = topDown(dimensions);
        var viewport = viewport(dimensions);
        var pointer = new ScreenPoint(pixelX(7), pixelY(2));

        var first = calculator.screenToGrid(pointer, camera, viewport, dimensions, 1);
        var second = calculator.screenToGrid(pointer, camera, viewport, dimensions, 1);
        assertEquals(first, second);

        var stats = calculator.getCacheStats();
        assertEquals(1, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(1, stats.currentSize());
    }

    @Test
    @DisplayName("Changing the camera or viewport invalidates cached resolutions")
    void testCacheInvalidation() {
        var camera = topDown(dimensions);
        var viewport = viewport(dimensions);
        var pointer = new ScreenPoint(pixelX(7), pixelY(2));
        calculator.screenToGrid(pointer, camera, viewport, dimensions, 0);
        calculator.screenToGrid(new ScreenPoint(pixelX(1), pixelY(1)), camera, viewport, dimensions, 0);
        assertEquals(2, calculator.getCacheStats().currentSize());

        var zoomed = Camera.orthographic(new Point3f(0, 30, 0), new Point3f(0, 0, 0), new Vector3f(0, 0, -1), 5.0f);
        var resolved = calculator.screenToGrid(pointer, zoomed, viewport, dimensions, 0);
        var stats = calculator.getCacheStats();
        assertEquals(2, stats.invalidations());
        assertEquals(1, stats.currentSize());
        assertEquals(0, stats.hits());

        // pixel 750 of 1000 at twice the visible width lands at world x 2.5, the right edge
        assertTrue(resolved.isEmpty() || resolved.get().x >= 5);

        calculator.clearCache();
        assertEquals(0, calculator.getCacheStats().currentSize());
    }

    @Test
    @DisplayName("Cache evicts least recently used resolutions")
    void testCacheEviction() {
        var small = new CoordinateCalculator(500, 400, 2);
        var camera = topDown(dimensions);
        var viewport = viewport(dimensions);
        small.screenToGrid(new ScreenPoint(pixelX(1), pixelY(1)), camera, viewport, dimensions, 0);
        small.screenToGrid(new ScreenPoint(pixelX(2), pixelY(2)), camera, viewport, dimensions, 0);
        small.screenToGrid(new ScreenPoint(pixelX(3), pixelY(3)), camera, viewport, dimensions, 0);
        assertEquals(2, small.getCacheStats().currentSize());
        assertEquals(2, small.getCacheStats().maxSize());
    }
}
