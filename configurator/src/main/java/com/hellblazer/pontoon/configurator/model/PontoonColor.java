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
 * Available pontoon colors. Only bookkeeping and rendering care about color.
 *
 * @author hal.hildebrand
 */
public enum PontoonColor {
    BLUE("Blue", "#6183c2"),
    BLACK("Black", "#111111"),
    GREY("Grey", "#e3e4e5"),
    YELLOW("Yellow", "#f7e295");

    private final String displayName;
    private final String hex;

    PontoonColor(String displayName, String hex) {
        this.displayName = displayName;
        this.hex = hex;
    }

    public String displayName() {
        return displayName;
    }

    public String hex() {
        return hex;
    }
}
