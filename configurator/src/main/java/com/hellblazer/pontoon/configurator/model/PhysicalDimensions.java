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
 * Physical size of a pontoon body in millimetres.
 *
 * @author hal.hildebrand
 */
public record PhysicalDimensions(int widthMm, int heightMm, int depthMm) {

    public static final PhysicalDimensions SINGLE_PONTOON = new PhysicalDimensions(500, 400, 500);
    public static final PhysicalDimensions DOUBLE_PONTOON = new PhysicalDimensions(1000, 400, 500);

    public PhysicalDimensions {
        if (widthMm <= 0 || heightMm <= 0 || depthMm <= 0) {
            throw new IllegalArgumentException(
            "Physical dimensions must be positive: " + widthMm + "x" + heightMm + "x" + depthMm);
        }
    }

    public double volumeM3() {
        return (double) widthMm * heightMm * depthMm / 1_000_000_000.0;
    }

    @Override
    public String toString() {
        return String.format("%.3fm x %.3fm x %.3fm", widthMm / 1000.0, heightMm / 1000.0, depthMm / 1000.0);
    }
}
