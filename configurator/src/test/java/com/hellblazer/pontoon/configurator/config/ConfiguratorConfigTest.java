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

import com.fasterxml.jackson.core.JsonProcessingException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
@DisplayName("Configurator configuration tests")
class ConfiguratorConfigTest {

    private static InputStream json(String text) {
        return new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Defaults come from the bundled resource")
    void testDefaults() {
        var config = ConfiguratorConfig.defaults();
        assertEquals(500, config.getCellSizeMm());
        assertEquals(400, config.getLevelHeightMm());
        assertEquals(50, config.getHistoryMaxSize());
        assertEquals(256, config.getCoordinateCacheSize());
        assertEquals(5, config.getNearbySearchDistance());
        assertFalse(config.isEnforceConnectivity());
        assertTrue(config.isVerifyIndexAfterMutation());
        assertEquals(1000, config.getEventLogCapacity());
    }

    @Test
    @DisplayName("Absent fields keep their defaults")
    void testPartialLoad() throws IOException {
        var config = ConfiguratorConfig.load(json("{\"historyMaxSize\": 10, \"enforceConnectivity\": true}"));
        assertEquals(10, config.getHistoryMaxSize());
        assertTrue(config.isEnforceConnectivity());
        assertEquals(500, config.getCellSizeMm());
    }

    @Test
    @DisplayName("Non object documents fall back to the defaults")
    void testNonObject() throws IOException {
        var config = ConfiguratorConfig.load(json("[1, 2, 3]"));
        assertEquals(50, config.getHistoryMaxSize());
    }

    @Test
    @DisplayName("Invalid documents and values are rejected")
    void testInvalid() {
        assertThrows(JsonProcessingException.class, () -> ConfiguratorConfig.load(json("{\"cellSizeMm\": ")));
        assertThrows(IllegalArgumentException.class, () -> ConfiguratorConfig.load(json("{\"cellSizeMm\": 0}")));
        assertThrows(IllegalArgumentException.class, () -> new ConfiguratorConfig().withHistoryMaxSize(0));
        assertThrows(IllegalArgumentException.class, () -> new ConfiguratorConfig().withNearbySearchDistance(-1));
        assertDoesNotThrow(() -> new ConfiguratorConfig().withNearbySearchDistance(0));
    }

    @Test
    @DisplayName("Presets")
    void testPresets() {
        assertTrue(ConfiguratorConfig.strict().isEnforceConnectivity());
        var large = ConfiguratorConfig.largeLayout();
        assertFalse(large.isVerifyIndexAfterMutation());
        assertEquals(4096, large.getCoordinateCacheSize());
        assertEquals(100, large.getHistoryMaxSize());
    }
}
