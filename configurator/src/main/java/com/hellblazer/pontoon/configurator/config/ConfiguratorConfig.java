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
package com.hellblazer.pontoon.configurator.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Configuration of a configurator session: world scale, history depth, cache sizes and the optional structural
 * rules.
 *
 * @author hal.hildebrand
 */
public class ConfiguratorConfig {
    public static final String DEFAULT_RESOURCE = "/pontoon-configurator.json";

    private static final Logger log = LoggerFactory.getLogger(ConfiguratorConfig.class);

    private int     cellSizeMm              = 500;
    private int     levelHeightMm           = 400;
    private int     historyMaxSize          = 50;
    private int     coordinateCacheSize     = 256;
    private int     nearbySearchDistance    = 5;
    private boolean enforceConnectivity     = false;
    private boolean verifyIndexAfterMutation = true;
    private int     eventLogCapacity        = 1000;

    /**
     * Configuration from the {@code pontoon-configurator.json} classpath resource, or the built in defaults when the
     * resource is absent or unreadable.
     */
    public static ConfiguratorConfig defaults() {
        try (InputStream is = ConfiguratorConfig.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                log.debug("Configuration resource not found: {}, using built in defaults", DEFAULT_RESOURCE);
                return new ConfiguratorConfig();
            }
            return load(is);
        } catch (IOException | IllegalArgumentException e) {
            log.error("Failed to load configuration {}: {}", DEFAULT_RESOURCE, e.getMessage());
            return new ConfiguratorConfig();
        }
    }

    /**
     * Read a JSON configuration. Absent fields keep their defaults.
     *
     * @throws IOException              if the stream is not valid JSON
     * @throws IllegalArgumentException if a value is out of range
     */
    public static ConfiguratorConfig load(InputStream source) throws IOException {
        var root = new ObjectMapper().readTree(source);
        var config = new ConfiguratorConfig();
        if (root == null || !root.isObject()) {
            log.warn("Invalid configuration format: expected a JSON object");
            return config;
        }
        if (root.has("cellSizeMm")) {
            config.withCellSizeMm(root.get("cellSizeMm").asInt());
        }
        if (root.has("levelHeightMm")) {
            config.withLevelHeightMm(root.get("levelHeightMm").asInt());
        }
        if (root.has("historyMaxSize")) {
            config.withHistoryMaxSize(root.get("historyMaxSize").asInt());
        }
        if (root.has("coordinateCacheSize")) {
            config.withCoordinateCacheSize(root.get("coordinateCacheSize").asInt());
        }
        if (root.has("nearbySearchDistance")) {
            config.withNearbySearchDistance(root.get("nearbySearchDistance").asInt());
        }
        if (root.has("enforceConnectivity")) {
            config.withConnectivityEnforced(flag(root, "enforceConnectivity"));
        }
        if (root.has("verifyIndexAfterMutation")) {
            config.withIndexVerification(flag(root, "verifyIndexAfterMutation"));
        }
        if (root.has("eventLogCapacity")) {
            config.withEventLogCapacity(root.get("eventLogCapacity").asInt());
        }
        log.debug("Loaded configuration: {}", config);
        return config;
    }

    private static boolean flag(JsonNode root, String field) {
        return root.get(field).asBoolean();
    }

    /**
     * Edge length of a grid cell on x and z, in millimetres
     */
    public int getCellSizeMm() {
        return cellSizeMm;
    }

    /**
     * Height of one level, in millimetres
     */
    public int getLevelHeightMm() {
        return levelHeightMm;
    }

    /**
     * Number of history entries retained before the oldest are evicted
     */
    public int getHistoryMaxSize() {
        return historyMaxSize;
    }

    public int getCoordinateCacheSize() {
        return coordinateCacheSize;
    }

    /**
     * Largest Chebyshev ring searched for alternative placements
     */
    public int getNearbySearchDistance() {
        return nearbySearchDistance;
    }

    /**
     * Whether a mutation that splits the structure into several components is rejected
     */
    public boolean isEnforceConnectivity() {
        return enforceConnectivity;
    }

    /**
     * Whether the occupancy index is compared against the grid after every mutation
     */
    public boolean isVerifyIndexAfterMutation() {
        return verifyIndexAfterMutation;
    }

    public int getEventLogCapacity() {
        return eventLogCapacity;
    }

    public ConfiguratorConfig withCellSizeMm(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Cell size must be positive");
        }
        this.cellSizeMm = size;
        return this;
    }

    public ConfiguratorConfig withLevelHeightMm(int height) {
        if (height <= 0) {
            throw new IllegalArgumentException("Level height must be positive");
        }
        this.levelHeightMm = height;
        return this;
    }

    public ConfiguratorConfig withHistoryMaxSize(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("History size must be positive");
        }
        this.historyMaxSize = size;
        return this;
    }

    public ConfiguratorConfig withCoordinateCacheSize(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("Cache size must be positive");
        }
        this.coordinateCacheSize = size;
        return this;
    }

    public ConfiguratorConfig withNearbySearchDistance(int distance) {
        if (distance < 0) {
            throw new IllegalArgumentException("Search distance must not be negative");
        }
        this.nearbySearchDistance = distance;
        return this;
    }

    public ConfiguratorConfig withConnectivityEnforced(boolean enforce) {
        this.enforceConnectivity = enforce;
        return this;
    }

    public ConfiguratorConfig withIndexVerification(boolean verify) {
        this.verifyIndexAfterMutation = verify;
        return this;
    }

    public ConfiguratorConfig withEventLogCapacity(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Event log capacity must be positive");
        }
        this.eventLogCapacity = capacity;
        return this;
    }

    /**
     * Configuration that rejects disconnected structures.
     */
    public static ConfiguratorConfig strict() {
        return new ConfiguratorConfig().withConnectivityEnforced(true).withIndexVerification(true);
    }

    /**
     * Configuration for large layouts where the per mutation index comparison is too costly.
     */
    public static ConfiguratorConfig largeLayout() {
        return new ConfiguratorConfig().withIndexVerification(false)
                                       .withCoordinateCacheSize(4096)
                                       .withHistoryMaxSize(100);
    }

    @Override
    public String toString() {
        return String.format(
        "ConfiguratorConfig[cell=%dmm, level=%dmm, history=%d, cache=%d, nearby=%d, connectivity=%s, verifyIndex=%s, events=%d]",
        cellSizeMm, levelHeightMm, historyMaxSize, coordinateCacheSize, nearbySearchDistance, enforceConnectivity,
        verifyIndexAfterMutation, eventLogCapacity);
    }
}
