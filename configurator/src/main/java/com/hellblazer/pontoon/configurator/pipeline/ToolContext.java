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

import com.hellblazer.pontoon.configurator.model.PontoonColor;
import com.hellblazer.pontoon.configurator.model.PontoonType;
import com.hellblazer.pontoon.configurator.model.Rotation;
import com.hellblazer.pontoon.geometry.Camera;
import com.hellblazer.pontoon.geometry.Viewport;

import java.util.Objects;

/**
 * The UI state an input is interpreted against: the view, the active level and the current tool with its settings.
 *
 * @author hal.hildebrand
 */
public record ToolContext(Camera camera, Viewport viewport, int activeLevel, ToolType tool, PontoonType type,
                          PontoonColor color, Rotation rotation) {

    public ToolContext {
        Objects.requireNonNull(camera, "camera");
        Objects.requireNonNull(viewport, "viewport");
        Objects.requireNonNull(tool, "tool");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(rotation, "rotation");
    }

    public ToolContext(Camera camera, Viewport viewport, int activeLevel, ToolType tool) {
        this(camera, viewport, activeLevel, tool, PontoonType.SINGLE, PontoonColor.BLUE, Rotation.NORTH);
    }

    public ToolContext withTool(ToolType newTool) {
        return new ToolContext(camera, viewport, activeLevel, newTool, type, color, rotation);
    }

    public ToolContext withLevel(int level) {
        return new ToolContext(camera, viewport, level, tool, type, color, rotation);
    }

    public ToolContext withType(PontoonType newType) {
        return new ToolContext(camera, viewport, activeLevel, tool, newType, color, rotation);
    }

    public ToolContext withColor(PontoonColor newColor) {
        return new ToolContext(camera, viewport, activeLevel, tool, type, newColor, rotation);
    }

    public ToolContext withCamera(Camera newCamera) {
        return new ToolContext(newCamera, viewport, activeLevel, tool, type, color, rotation);
    }
}
