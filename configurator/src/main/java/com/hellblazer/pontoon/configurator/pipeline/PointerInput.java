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

import com.hellblazer.pontoon.configurator.coordinate.ScreenPoint;

import java.util.Objects;

/**
 * A single input event. Pointer coordinates are viewport pixels; for key events they are the pointer location at the
 * time the key was pressed.
 *
 * @author hal.hildebrand
 */
public record PointerInput(InputType type, float screenX, float screenY, int button, Modifiers modifiers,
                           long timestamp, String key) {

    public PointerInput {
        Objects.requireNonNull(type, "type");
        modifiers = modifiers == null ? Modifiers.NONE : modifiers;
        if (type == InputType.KEY && (key == null || key.isEmpty())) {
            throw new IllegalArgumentException("Key input requires a key");
        }
    }

    public static PointerInput of(InputType type, float screenX, float screenY) {
        return new PointerInput(type, screenX, screenY, 0, Modifiers.NONE, System.currentTimeMillis(), null);
    }

    public static PointerInput hover(float screenX, float screenY) {
        return of(InputType.HOVER, screenX, screenY);
    }

    public static PointerInput click(float screenX, float screenY) {
        return of(InputType.CLICK, screenX, screenY);
    }

    public static PointerInput click(float screenX, float screenY, Modifiers modifiers) {
        return new PointerInput(InputType.CLICK, screenX, screenY, 0, modifiers, System.currentTimeMillis(), null);
    }

    public static PointerInput press(float screenX, float screenY) {
        return of(InputType.PRESS, screenX, screenY);
    }

    public static PointerInput drag(float screenX, float screenY) {
        return of(InputType.DRAG, screenX, screenY);
    }

    public static PointerInput release(float screenX, float screenY) {
        return of(InputType.RELEASE, screenX, screenY);
    }

    public static PointerInput leave() {
        return of(InputType.LEAVE, 0, 0);
    }

    public static PointerInput key(String key, Modifiers modifiers, float screenX, float screenY) {
        return new PointerInput(InputType.KEY, screenX, screenY, 0, modifiers, System.currentTimeMillis(), key);
    }

    public static PointerInput key(String key, Modifiers modifiers) {
        return key(key, modifiers, 0, 0);
    }

    public ScreenPoint screenPoint() {
        return new ScreenPoint(screenX, screenY);
    }
}
