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
package com.hellblazer.pontoon.configurator;

import com.hellblazer.pontoon.configurator.config.ConfiguratorConfig;
import com.hellblazer.pontoon.configurator.history.HistoryLedger;
import com.hellblazer.pontoon.configurator.model.Grid;
import com.hellblazer.pontoon.configurator.model.GridDimensions;
import com.hellblazer.pontoon.configurator.model.GridPosition;
import com.hellblazer.pontoon.configurator.model.GridStatistics;
import com.hellblazer.pontoon.configurator.model.Pontoon;
import com.hellblazer.pontoon.configurator.model.PontoonColor;
import com.hellblazer.pontoon.configurator.model.PontoonId;
import com.hellblazer.pontoon.configurator.model.PontoonType;
import com.hellblazer.pontoon.configurator.model.Rotation;
import com.hellblazer.pontoon.configurator.pipeline.OperationPipeline;
import com.hellblazer.pontoon.configurator.pipeline.PipelineListener;
import com.hellblazer.pontoon.configurator.pipeline.PipelineResult;
import com.hellblazer.pontoon.configurator.pipeline.PipelineStats;
import com.hellblazer.pontoon.configurator.pipeline.PointerInput;
import com.hellblazer.pontoon.configurator.pipeline.PreviewState;
import com.hellblazer.pontoon.configurator.pipeline.ToolContext;
import com.hellblazer.pontoon.configurator.portable.PortableGrid;
import com.hellblazer.pontoon.configurator.portable.PortableGridCodec;
import com.hellblazer.pontoon.configurator.validation.ConnectivityAnalyzer;
import com.hellblazer.pontoon.configurator.validation.PlacementValidator;
import com.hellblazer.pontoon.configurator.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A configurator session: the entry point for a user interface. Requests, pointer input, undo and redo all run
 * through one {@link OperationPipeline}, so every successful change is validated, recorded in history and reflected
 * in the occupancy index. Queries are read only.
 *
 * @author hal.hildebrand
 */
public class PontoonConfigurator {
    private static final Logger log = LoggerFactory.getLogger(PontoonConfigurator.class);

    private final ConfiguratorConfig config;
    private final OperationPipeline  pipeline;
    private final PortableGridCodec  codec;

    public PontoonConfigurator(GridDimensions dimensions) {
        this(Grid.empty(dimensions), ConfiguratorConfig.defaults(), Clock.systemUTC());
    }

    public PontoonConfigurator(Grid initial, ConfiguratorConfig config, Clock clock) {
        this.config = config;
        this.pipeline = new OperationPipeline(initial, config, clock);
        this.codec = new PortableGridCodec();
        log.info("Configurator session started: {} with {}", initial, config);
    }

    // ---- requests

    public PipelineResult placePontoon(GridPosition position, PontoonType type, PontoonColor color,
                                       Rotation rotation) {
        return pipeline.place(position, type, color, rotation);
    }

    public PipelineResult placePontoon(GridPosition position, PontoonType type, PontoonColor color) {
        return placePontoon(position, type, color, Rotation.NORTH);
    }

    public PipelineResult removePontoon(PontoonId id) {
        return pipeline.remove(id);
    }

    public PipelineResult movePontoon(PontoonId id, GridPosition position) {
        return pipeline.move(id, position);
    }

    public PipelineResult rotatePontoon(PontoonId id) {
        return pipeline.rotate(id);
    }

    public PipelineResult recolorPontoon(PontoonId id, PontoonColor color) {
        return pipeline.recolor(id, color);
    }

    public PipelineResult placePontoonsBatch(List<GridPosition> positions, PontoonType type, PontoonColor color,
                                             Rotation rotation, boolean skipInvalid) {
        return pipeline.placeBatch(positions, type, color, rotation, skipInvalid);
    }

    public PipelineResult removePontoonsBatch(Collection<PontoonId> ids) {
        return pipeline.removeBatch(ids);
    }

    public PipelineResult undo() {
        return pipeline.undo();
    }

    public PipelineResult redo() {
        return pipeline.redo();
    }

    public boolean canUndo() {
        return pipeline.getHistory().canUndo();
    }

    public boolean canRedo() {
        return pipeline.getHistory().canRedo();
    }

    public String createCheckpoint(String description) {
        return pipeline.createCheckpoint(description);
    }

    public PipelineResult rollbackToCheckpoint(String checkpointId) {
        return pipeline.rollbackToCheckpoint(checkpointId);
    }

    public PipelineResult handleInput(PointerInput input, ToolContext context) {
        return pipeline.process(input, context);
    }

    public void cancelInteraction() {
        pipeline.cancel();
    }

    // ---- queries

    public Grid getGrid() {
        return pipeline.getGrid();
    }

    public Optional<Pontoon> pontoonAt(GridPosition cell) {
        return getGrid().pontoonAt(cell);
    }

    public List<Pontoon> pontoonsAtLevel(int level) {
        return getGrid().getPontoonsAtLevel(level);
    }

    public GridStatistics statistics() {
        return pipeline.getService().statistics(getGrid());
    }

    public ValidationResult validateConnectivity() {
        return validator().validateConnectivity();
    }

    public List<Set<PontoonId>> components() {
        return ConnectivityAnalyzer.pontoonComponents(getGrid());
    }

    public ValidationResult canPlace(GridPosition position, PontoonType type) {
        return validator().canPlace(position, type);
    }

    public List<GridPosition> findNearbyValidPositions(GridPosition target, PontoonType type) {
        return findNearbyValidPositions(target, type, config.getNearbySearchDistance());
    }

    public List<GridPosition> findNearbyValidPositions(GridPosition target, PontoonType type, int maxDistance) {
        return validator().findNearbyValidPositions(target, type, maxDistance);
    }

    public PreviewState getPreview() {
        return pipeline.getPreview();
    }

    public Set<PontoonId> getSelection() {
        return pipeline.getSelection();
    }

    public HistoryLedger getHistory() {
        return pipeline.getHistory();
    }

    public PipelineStats stats() {
        return pipeline.stats();
    }

    public OperationPipeline getPipeline() {
        return pipeline;
    }

    // ---- portable form

    public PortableGrid toPortable() {
        return codec.toPortable(getGrid());
    }

    public String toJson() {
        return codec.toJson(getGrid());
    }

    /**
     * Replace the session grid with a validated portable grid. The replacement is undoable.
     *
     * @throws PlacementException if the portable grid violates the placement rules
     */
    public PipelineResult loadPortable(PortableGrid portable) throws PlacementException {
        return pipeline.replaceGrid(codec.fromPortable(portable), "Load layout");
    }

    public PipelineResult loadJson(String json) throws PlacementException {
        return pipeline.replaceGrid(codec.fromJson(json), "Load layout");
    }

    // ---- listeners

    public void addListener(PipelineListener listener) {
        pipeline.addListener(listener);
    }

    public void removeListener(PipelineListener listener) {
        pipeline.removeListener(listener);
    }

    private PlacementValidator validator() {
        return pipeline.getService().validator(getGrid(), pipeline.getIndex());
    }
}
