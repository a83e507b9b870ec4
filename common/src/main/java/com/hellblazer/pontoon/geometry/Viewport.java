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
package com.hellblazer.pontoon.geometry;

import javax.vecmath.Point2f;

/**
 * Pixel dimensions of the drawing surface the pointer moves over.
 *
 * @author hal.hildebrand
 */
public record Viewport(int width, int height) {

    public Viewport {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Viewport dimensions must be positive: " + width + "x" + height);
        }
    }

    public float aspectRatio() {
        return (float) width / height;
    }

    /**
     * Convert pixel coordinates (origin top-left, y down) to normalized device coordinates in [-1, 1] with y up
     */
    public Point2f toNdc(float screenX, float screenY) {
        return new Point2f(screenX / width * 2f - 1f, -(screenY / height) * 2f + 1f);
    }

    public boolean contains(float screenX, float screenY) {
        return screenX >= 0 && screenX < width && screenY >= 0 && screenY < height;
    }
}
