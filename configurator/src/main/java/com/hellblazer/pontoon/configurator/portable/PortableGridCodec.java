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
package com.hellblazer.pontoon.configurator.portable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.pontoon.configurator.PlacementException;
import com.hellblazer.pontoon.configurator.model.Grid;
import com.hellblazer.pontoon.configurator.model.GridDimensions;
import com.hellblazer.pontoon.configurator.model.GridPosition;
import com.hellblazer.pontoon.configurator.model.Pontoon;
import com.hellblazer.pontoon.configurator.model.PontoonColor;
import com.hellblazer.pontoon.configurator.model.PontoonId;
import com.hellblazer.pontoon.configurator.model.PontoonType;
import com.hellblazer.pontoon.configurator.model.Rotation;
import com.hellblazer.pontoon.configurator.validation.PlacementValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;

/**
 * Converts grids to and from their portable form and JSON. Import re-checks every placement rule, so a grid read
 * from outside is held to the same invariants as one built through the configurator. No I/O is performed here.
 *
 * @author hal.hildebrand
 */
public class PortableGridCodec {
    private static final Logger log = LoggerFactory.getLogger(PortableGridCodec.class);

    private final ObjectMapper objectMapper;

    public PortableGridCodec() {
        this(new ObjectMapper());
    }

    public PortableGridCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public PortableGrid toPortable(Grid grid) {
        var dimensions = grid.getDimensions();
        var pontoons = new ArrayList<PortablePontoon>(grid.size());
        for (var pontoon : grid.getPontoons()) {
            var position = pontoon.position();
            pontoons.add(new PortablePontoon(pontoon.id().toString(), position.x, position.y, position.z,
                                             pontoon.type().name(), pontoon.color().name(),
                                             pontoon.rotation().degrees()));
        }
        return new PortableGrid(dimensions.width(), dimensions.height(), dimensions.levels(), dimensions.baseLevel(),
                                pontoons);
    }

    /**
     * Rebuild a grid from its portable form.
     *
     * @throws PlacementException if the data is malformed or violates bounds, overlap or support
     */
    public Grid fromPortable(PortableGrid portable) throws PlacementException {
        GridDimensions dimensions;
        var pontoons = new ArrayList<Pontoon>(portable.pontoons().size());
        try {
            dimensions = new GridDimensions(portable.width(), portable.height(), portable.levels(),
                                            portable.baseLevel());
            for (var p : portable.pontoons()) {
                pontoons.add(new Pontoon(PontoonId.parse(p.id()), new GridPosition(p.x(), p.y(), p.z()),
                                         PontoonType.valueOf(p.type()), PontoonColor.valueOf(p.color()),
                                         Rotation.fromDegrees(p.rotation())));
            }
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new PlacementException("Malformed portable grid: " + e.getMessage(), e);
        }
        var validation = PlacementValidator.validateStructure(dimensions, pontoons);
        if (!validation.isValid()) {
            log.debug("Rejected portable grid: {}", validation.messages());
            throw new PlacementException("Portable grid violates placement rules: " + validation.messages(),
                                         validation);
        }
        return new Grid(dimensions, pontoons, 1);
    }

    public String toJson(Grid grid) {
        try {
            return objectMapper.writeValueAsString(toPortable(grid));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize grid", e);
        }
    }

    /**
     * @throws PlacementException if the text is not a portable grid or the grid violates the placement rules
     */
    public Grid fromJson(String json) throws PlacementException {
        PortableGrid portable;
        try {
            portable = objectMapper.readValue(json, PortableGrid.class);
        } catch (JsonProcessingException e) {
            throw new PlacementException("Unreadable portable grid: " + e.getOriginalMessage(), e);
        }
        if (portable == null) {
            throw new PlacementException("Unreadable portable grid: empty document", (Throwable) null);
        }
        return fromPortable(portable);
    }
}
