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

import java.util.List;
import java.util.Objects;

/**
 * A single placed pontoon. Immutable: changes produce replacement values that are swapped into a new {@link Grid}.
 *
 * @author hal.hildebrand
 */
public record Pontoon(PontoonId id, GridPosition position, PontoonType type, PontoonColor color, Rotation rotation) {

    public Pontoon {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(position, "position");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(rotation, "rotation");
    }

    public List<GridPosition> footprint() {
        return type.footprint(position);
    }

    public boolean covers(GridPosition cell) {
        return cell.y == position.y && cell.z == position.z && cell.x >= position.x
        && cell.x < position.x + type.footprintSize();
    }

    public Pontoon movedTo(GridPosition newPosition) {
        return new Pontoon(id, newPosition, type, color, rotation);
    }

    public Pontoon withColor(PontoonColor newColor) {
        return new Pontoon(id, position, type, newColor, rotation);
    }

    public Pontoon withRotation(Rotation newRotation) {
        return new Pontoon(id, position, type, color, newRotation);
    }
}
