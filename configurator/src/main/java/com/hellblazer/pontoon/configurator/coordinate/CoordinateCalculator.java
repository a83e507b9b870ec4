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

import com.hellblazer.pontoon.configurator.config.ConfiguratorConfig;
import com.hellblazer.pontoon.configurator.model.GridDimensions;
import com.hellblazer.pontoon.configurator.model.GridPosition;
import com.hellblazer.pontoon.geometry.Camera;
import com.hellblazer.pontoon.geometry.Plane3D;
import com.hellblazer.pontoon.geometry.Viewport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps between screen pixels, world space and grid cells.
 * <p>
 * World layout: cells are {@code cellSizeMm} wide on x and z, levels are {@code levelHeightMm} tall, the grid is
 * centred on the world origin and world units are metres. Grid to world and world to grid are exact affine inverses;
 * only {@link #screenToGrid} casts a ray.
 *
 * @author hal.hildebrand
 */
public class CoordinateCalculator {
    private static final Logger log          = LoggerFactory.getLogger(CoordinateCalculator.class);
    private static final double MM_PER_METRE = 1000.0;

    private final int             cellSizeMm;
    private final int             levelHeightMm;
    private final CoordinateCache cache;

    private Camera   lastCamera;
    private Viewport lastViewport;

    public CoordinateCalculator(ConfiguratorConfig config) {
        this(config.getCellSizeMm(), config.getLevelHeightMm(), config.getCoordinateCacheSize());
    }

    public CoordinateCalculator(int cellSizeMm, int levelHeightMm, int cacheSize) {
        if (cellSizeMm <= 0 || levelHeightMm <= 0) {
            throw new IllegalArgumentException(
            "Cell size and level height must be positive: " + cellSizeMm + ", " + levelHeightMm);
        }
        this.cellSizeMm = cellSizeMm;
        this.levelHeightMm = levelHeightMm;
        this.cache = new CoordinateCache(cacheSize);
    }

    public int getCellSizeMm() {
        return cellSizeMm;
    }

    public int getLevelHeightMm() {
        return levelHeightMm;
    }

    /**
     * Resolve a pointer to the cell it designates on the active level.
     *
     * @return the cell, or empty when the ray misses the level plane, the hit lies outside the grid, or the level is
     * not part of the grid
     */
    public Optional<GridPosition> screenToGrid(ScreenPoint pointer, Camera camera, Viewport viewport,
                                               GridDimensions dimensions, int activeLevel) {
        Objects.requireNonNull(pointer, "pointer");
        Objects.requireNonNull(camera, "camera");
        Objects.requireNonNull(viewport, "viewport");
        if (!camera.equals(lastCamera) || !viewport.equals(lastViewport)) {
            if (lastCamera != null) {
                log.debug("View changed, invalidating {} cached resolutions", cache.size());
            }
            cache.invalidateAll();
            lastCamera = camera;
            lastViewport = viewport;
        }

        var key = new CoordinateCache.Key(pointer, camera, viewport, dimensions, activeLevel);
        var cached = cache.get(key);
        if (cached != null) {
            return cached;
        }
        var resolved = castToLevel(pointer, camera, viewport, dimensions, activeLevel);
        cache.put(key, resolved);
        return resolved;
    }

    private Optional<GridPosition> castToLevel(ScreenPoint pointer, Camera camera, Viewport viewport,
                                               GridDimensions dimensions, int activeLevel) {
        if (!dimensions.isValidLevel(activeLevel)) {
            return Optional.empty();
        }
        var ndc = viewport.toNdc(pointer.x(), pointer.y());
        var ray = camera.rayThrough(ndc.x, ndc.y, viewport.aspectRatio());
        var hit = ray.intersect(Plane3D.horizontal((float) levelToWorldY(activeLevel)));
        if (hit.isEmpty()) {
            return Optional.empty();
        }
        var cell = worldToGrid(WorldPosition.of(hit.get()), dimensions).atLevel(activeLevel);
        return dimensions.contains(cell) ? Optional.of(cell) : Optional.empty();
    }

    /**
     * @return the world position of the cell centre, at the height of the cell's level
     */
    public WorldPosition gridToWorld(GridPosition cell, GridDimensions dimensions) {
        var physical = gridToPhysical(cell, dimensions);
        return new WorldPosition(physical.x / MM_PER_METRE, physical.y / MM_PER_METRE, physical.z / MM_PER_METRE);
    }

    /**
     * Inverse of {@link #gridToWorld}. The result is not bounds checked.
     */
    public GridPosition worldToGrid(WorldPosition world, GridDimensions dimensions) {
        double cellM = cellSizeMm / MM_PER_METRE;
        int x = (int) Math.floor((world.x() + dimensions.width() * cellM / 2.0) / cellM);
        int z = (int) Math.floor((world.z() + dimensions.height() * cellM / 2.0) / cellM);
        int y = (int) Math.round(world.y() / (levelHeightMm / MM_PER_METRE));
        return new GridPosition(x, y, z);
    }

    /**
     * Cell centre in millimetres
     */
    public Point3d gridToPhysical(GridPosition cell, GridDimensions dimensions) {
        double centreX = dimensions.width() * cellSizeMm / 2.0;
        double centreZ = dimensions.height() * cellSizeMm / 2.0;
        return new Point3d(cell.x * (double) cellSizeMm - centreX + cellSizeMm / 2.0,
                           (double) cell.y * levelHeightMm,
                           cell.z * (double) cellSizeMm - centreZ + cellSizeMm / 2.0);
    }

    /**
     * World position of a cell corner. Corners are addressed in cell units, x in [0, width] and z in [0, height].
     */
    public WorldPosition gridIntersectionToWorld(int cornerX, int cornerZ, int level, GridDimensions dimensions) {
        double halfWidthMm = dimensions.width() * cellSizeMm / 2.0;
        double halfHeightMm = dimensions.height() * cellSizeMm / 2.0;
        return new WorldPosition((cornerX * (double) cellSizeMm - halfWidthMm) / MM_PER_METRE,
                                 levelToWorldY(level),
                                 (cornerZ * (double) cellSizeMm - halfHeightMm) / MM_PER_METRE);
    }

    /**
     * The cell one level down, computed through the world transform.
     *
     * @return empty when the cell is already on the base level
     */
    public Optional<GridPosition> cellBelow(GridPosition cell, GridDimensions dimensions) {
        if (cell.y <= dimensions.baseLevel()) {
            return Optional.empty();
        }
        var world = gridToWorld(cell, dimensions);
        return Optional.of(worldToGrid(world.offset(0, -levelHeightMm / MM_PER_METRE, 0), dimensions));
    }

    /**
     * Euclidean distance between two cell centres in millimetres
     */
    public double physicalDistance(GridPosition a, GridPosition b, GridDimensions dimensions) {
        return gridToPhysical(a, dimensions).distance(gridToPhysical(b, dimensions));
    }

    public double levelToWorldY(int level) {
        return level * (double) levelHeightMm / MM_PER_METRE;
    }

    public void clearCache() {
        cache.invalidateAll();
        lastCamera = null;
        lastViewport = null;
    }

    public CoordinateCache.CacheStats getCacheStats() {
        return cache.getStats();
    }
}
