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

/**
 * Cardinal orientation of a pontoon. Orientation is rendering metadata: it never alters the footprint.
 *
 * @author hal.hildebrand
 */
public enum Rotation {
    NORTH(0), EAST(90), SOUTH(180), WEST(270);

    private final int degrees;

    Rotation(int degrees) {
        this.degrees = degrees;
    }

    public static Rotation fromDegrees(int degrees) {
        int normalized = Math.floorMod(degrees, 360);
        for (var rotation : values()) {
            if (rotation.degrees == normalized) {
                return rotation;
            }
        }
        throw new IllegalArgumentException("Not a cardinal rotation: " + degrees);
    }

    public int degrees() {
        return degrees;
    }

    /**
     * The next orientation clockwise, wrapping WEST back to NORTH
     */
    public Rotation next() {
        return values()[(ordinal() + 1) % values().length];
    }
}
