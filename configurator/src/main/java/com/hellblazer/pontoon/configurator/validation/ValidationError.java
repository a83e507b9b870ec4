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

import com.hellblazer.pontoon.configurator.model.GridPosition;
import com.hellblazer.pontoon.configurator.model.PontoonId;

import java.util.Objects;

/**
 * A single rule failure. Position and pontoon id are present when the failure is tied to a cell or to a pontoon.
 *
 * @author hal.hildebrand
 */
public record ValidationError(ValidationErrorType type, String message, GridPosition position, PontoonId pontoonId) {

    public ValidationError {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(message, "message");
    }

    public ValidationError(ValidationErrorType type, String message) {
        this(type, message, null, null);
    }

    public ValidationError(ValidationErrorType type, String message, GridPosition position) {
        this(type, message, position, null);
    }

    @Override
    public String toString() {
        return type + ": " + message;
    }
}
