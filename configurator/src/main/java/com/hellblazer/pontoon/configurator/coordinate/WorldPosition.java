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

import javax.vecmath.Point3f;

/**
 * World space location in metres. The grid is centred on the origin and y grows upward from the water surface.
 *
 * @author hal.hildebrand
 */
public record WorldPosition(double x, double y, double z) {

    public static WorldPosition of(Point3f point) {
        return new WorldPosition(point.x, point.y, point.z);
    }

    public Point3f toPoint3f() {
        return new Point3f((float) x, (float) y, (float) z);
    }

    public WorldPosition offset(double dx, double dy, double dz) {
        return new WorldPosition(x + dx, y + dy, z + dz);
    }
}
