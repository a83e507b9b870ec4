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
package com.hellblazer.pontoon.configurator.operation;

/**
 * Kinds of recorded operations. Selection kinds never change the grid but are recorded so tools can report them
 * uniformly.
 *
 * @author hal.hildebrand
 */
public enum OperationKind {
    PLACE, REMOVE, MOVE, ROTATE, PAINT, BATCH_PLACE, BATCH_REMOVE, SELECT, CLEAR_SELECTION, SELECT_FOR_MOVE;

    public boolean isMutation() {
        return switch (this) {
            case SELECT, CLEAR_SELECTION, SELECT_FOR_MOVE -> false;
            default -> true;
        };
    }
}
