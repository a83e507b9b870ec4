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

/**
 * Reasons a requested operation cannot be carried out. All of them are recoverable: the caller reports them and the
 * session continues.
 *
 * @author hal.hildebrand
 */
public enum ValidationErrorType {
    /** A footprint cell lies outside the grid dimensions */
    OUT_OF_BOUNDS,
    /** A footprint cell is claimed by another pontoon */
    OVERLAP,
    /** A cell above the base level has nothing directly beneath it */
    NO_SUPPORT,
    /** The structure would split into more than one component */
    DISCONNECTED,
    /** The referenced pontoon does not exist */
    NOT_FOUND,
    /** A move targets the pontoon's current anchor */
    ALREADY_AT_POSITION,
    /** A recolor or rotation would not change anything */
    SAME_VALUE,
    /** Input arrived while a previous input was still being processed */
    PIPELINE_BUSY,
    /** Handling failed unexpectedly; the grid was left as it was and the index rebuilt */
    INTERNAL_ERROR
}
