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
package com.hellblazer.pontoon.configurator.coordinate;

import com.hellblazer.pontoon.configurator.model.GridDimensions;
import com.hellblazer.pontoon.configurator.model.GridPosition;
import com.hellblazer.pontoon.geometry.Camera;
import com.hellblazer.pontoon.geometry.Viewport;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * LRU cache of screen to grid resolutions, keyed by the complete input of the resolution. Misses are cached as well
 * so a pointer over open water does not re-cast its ray.
 *
 * @author hal.hildebrand
 */
public class CoordinateCache {

    /**
     * Every input that determines a screen to grid resolution
     */
    public record Key(ScreenPoint pointer, Camera camera, Viewport viewport, GridDimensions dimensions,
                      int activeLevel) {
    }

    private static final int   DEFAULT_MAX_ENTRIES = 256;
    private static final float LOAD_FACTOR         = 0.75f;

    private final Map<Key, Optional<GridPosition>> cache;
    private final int                              maxEntries;

    private long hits          = 0;
    private long misses        = 0;
    private long invalidations = 0;

    public CoordinateCache() {
        this(DEFAULT_MAX_ENTRIES);
    }

    public CoordinateCache(int maxEntries) {
        if (maxEntries <= 0) {
            throw new IllegalArgumentException("Cache size must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        // access-order for LRU
        this.cache = new LinkedHashMap<>((int) (maxEntries / LOAD_FACTOR) + 1, LOAD_FACTOR, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Key, Optional<GridPosition>> eldest) {
                return size() > CoordinateCache.this.maxEntries;
            }
        };
    }

    /**
     * @return the cached resolution, or null on a miss
     */
    public Optional<GridPosition> get(Key key) {
        var cached = cache.get(key);
        if (cached == null) {
            misses++;
            return null;
        }
        hits++;
        return cached;
    }

    public void put(Key key, Optional<GridPosition> resolution) {
        cache.put(key, resolution);
    }

    public void invalidateAll() {
        invalidations += cache.size();
        cache.clear();
    }

    public int size() {
        return cache.size();
    }

    public CacheStats getStats() {
        return new CacheStats(hits, misses, invalidations, cache.size(), maxEntries);
    }

    public void resetStats() {
        hits = 0;
        misses = 0;
        invalidations = 0;
    }

    /**
     * Cache statistics snapshot
     */
    public record CacheStats(long hits, long misses, long invalidations, int currentSize, int maxSize) {
        public double hitRate() {
            long total = hits + misses;
            return total == 0 ? 0.0 : (double) hits / total;
        }

        @Override
        public String toString() {
            return String.format("CoordinateCache[hits=%d, misses=%d, hitRate=%.1f%%, invalidations=%d, size=%d/%d]",
                                 hits, misses, hitRate() * 100, invalidations, currentSize, maxSize);
        }
    }
}
