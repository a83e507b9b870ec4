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
package com.hellblazer.pontoon.configurator.pipeline;

/**
 * Keyboard modifier state at the time of an input
 *
 * @author hal.hildebrand
 */
public record Modifiers(boolean shift, boolean ctrl, boolean alt, boolean meta) {
    public static final Modifiers NONE = new Modifiers(false, false, false, false);

    public static Modifiers shiftDown() {
        return new Modifiers(true, false, false, false);
    }

    public static Modifiers ctrlDown() {
        return new Modifiers(false, true, false, false);
    }

    public static Modifiers ctrlShiftDown() {
        return new Modifiers(true, true, false, false);
    }

    /**
     * Control on most platforms, command on macOS
     */
    public boolean command() {
        return ctrl || meta;
    }

    /**
     * Whether a click should add to or remove from the selection instead of replacing it
     */
    public boolean extendsSelection() {
        return shift || ctrl || meta;
    }
}
