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
 * Long-based pontoon identifier. Ids are issued sequentially by the {@link Grid} that owns the pontoon and are
 * positive. {@link Long#MAX_VALUE} is reserved so that the successor of every id is representable.
 *
 * @author hal.hildebrand
 */
public final class PontoonId implements Comparable<PontoonId> {
    private static final String PREFIX = "pontoon-";

    private final long id;

    public PontoonId(long id) {
        if (id <= 0 || id == Long.MAX_VALUE) {
            throw new IllegalArgumentException("Pontoon id out of range: " + id);
        }
        this.id = id;
    }

    /**
     * Parse the {@code pontoon-<n>} form produced by {@link #toString()}
     */
    public static PontoonId parse(String text) {
        if (text == null || !text.startsWith(PREFIX)) {
            throw new IllegalArgumentException("Invalid pontoon id: " + text);
        }
        try {
            return new PontoonId(Long.parseLong(text.substring(PREFIX.length())));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid pontoon id: " + text, e);
        }
    }

    public long getValue() {
        return id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PontoonId that)) return false;
        return id == that.id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public int compareTo(PontoonId other) {
        return Long.compare(this.id, other.id);
    }

    @Override
    public String toString() {
        return PREFIX + id;
    }
}
