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

import com.hellblazer.pontoon.configurator.config.ConfiguratorConfig;
import com.hellblazer.pontoon.configurator.coordinate.CoordinateCalculator;
import com.hellblazer.pontoon.configurator.history.HistoryLedger;
import com.hellblazer.pontoon.configurator.index.OccupancyIndex;
import com.hellblazer.pontoon.configurator.model.Grid;
import com.hellblazer.pontoon.configurator.model.GridPosition;
import com.hellblazer.pontoon.configurator.model.PontoonColor;
import com.hellblazer.pontoon.configurator.model.PontoonId;
import com.hellblazer.pontoon.configurator.model.PontoonType;
import com.hellblazer.pontoon.configurator.model.Rotation;
import com.hellblazer.pontoon.configurator.operation.BatchOperationResult;
import com.hellblazer.pontoon.configurator.operation.ConfiguratorService;
import com.hellblazer.pontoon.configurator.operation.Operation;
import com.hellblazer.pontoon.configurator.operation.OperationKind;
import com.hellblazer.pontoon.configurator.operation.OperationResult;
import com.hellblazer.pontoon.configurator.validation.PlacementValidator;
import com.hellblazer.pontoon.configurator.validation.ValidationErrorType;
import com.hellblazer.pontoon.configurator.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Single flight state machine turning input into validated mutations. Each input is resolved to a cell, validated
 * by the active tool, applied to a new {@link Grid}, recorded in the {@link HistoryLedger} and mirrored into the
 * {@link OccupancyIndex}.
 * <p>
 * Input that arrives while a previous input is still being processed, for instance from a listener, is dropped and
 * reported as {@link ValidationErrorType#PIPELINE_BUSY}. A failed input leaves the grid and the index exactly as they
 * were. If the index is found to disagree with the grid it is rebuilt from the grid.
 *
 * @author hal.hildebrand
 */
public class OperationPipeline {
    private static final Logger log = LoggerFactory.getLogger(OperationPipeline.class);

    private final ConfiguratorConfig             config;
    private final ConfiguratorService            service;
    private final CoordinateCalculator           calculator;
    private final HistoryLedger                  history;
    private final OccupancyIndex                 index;
    private final EventLog                       eventLog;
    private final Map<ToolType, Tool>            tools        = new EnumMap<>(ToolType.class);
    private final Set<PontoonId>                 selection    = new LinkedHashSet<>();
    private final List<PipelineListener>         listeners    = new CopyOnWriteArrayList<>();
    private final Deque<PipelineEvent>           pending      = new ArrayDeque<>();

    private Grid         grid;
    private PreviewState preview = PreviewState.none();
    private ToolType     lastTool;
    private boolean      processing;
    private boolean      notifying;

    public OperationPipeline(Grid initial, ConfiguratorConfig config) {
        this(initial, config, Clock.systemUTC());
    }

    public OperationPipeline(Grid initial, ConfiguratorConfig config, Clock clock) {
        this(initial, config, new ConfiguratorService(config, clock), new CoordinateCalculator(config),
             new HistoryLedger(config.getHistoryMaxSize(), clock));
    }

    public OperationPipeline(Grid initial, ConfiguratorConfig config, ConfiguratorService service,
                             CoordinateCalculator calculator, HistoryLedger history) {
        this.grid = Objects.requireNonNull(initial, "initial");
        this.config = Objects.requireNonNull(config, "config");
        this.service = Objects.requireNonNull(service, "service");
        this.calculator = Objects.requireNonNull(calculator, "calculator");
        this.history = Objects.requireNonNull(history, "history");
        this.index = OccupancyIndex.of(initial);
        this.eventLog = new EventLog(config.getEventLogCapacity());
        register(new SelectTool(this));
        register(new PlaceTool(this));
        register(new DeleteTool(this));
        register(new RotateTool(this));
        register(new PaintTool(this));
        register(new MoveTool(this));
        register(new MultiDropTool(this));
    }

    private void register(Tool tool) {
        tools.put(tool.type(), tool);
    }

    /**
     * Process one input against the given UI context.
     */
    public PipelineResult process(PointerInput input, ToolContext context) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(context, "context");
        return guarded(input.type() + " " + context.tool(), () -> dispatch(input, context));
    }

    public PipelineResult place(GridPosition position, PontoonType type, PontoonColor color, Rotation rotation) {
        return guarded("place", () -> apply(service.placePontoon(grid, index, position, type, color, rotation),
                                            "Place " + type.displayName() + " at " + position));
    }

    public PipelineResult remove(PontoonId id) {
        return guarded("remove", () -> apply(service.removePontoon(grid, index, id), "Remove " + id));
    }

    public PipelineResult move(PontoonId id, GridPosition position) {
        return guarded("move", () -> apply(service.movePontoon(grid, index, id, position),
                                           "Move " + id + " to " + position));
    }

    public PipelineResult rotate(PontoonId id) {
        return guarded("rotate", () -> apply(service.rotatePontoon(grid, id), "Rotate " + id));
    }

    public PipelineResult rotate(PontoonId id, Rotation rotation) {
        return guarded("rotate", () -> apply(service.rotatePontoon(grid, id, rotation),
                                             "Rotate " + id + " to " + rotation));
    }

    public PipelineResult recolor(PontoonId id, PontoonColor color) {
        return guarded("recolor", () -> apply(service.recolorPontoon(grid, id, color),
                                              "Paint " + id + " " + color.displayName()));
    }

    public PipelineResult placeBatch(List<GridPosition> positions, PontoonType type, PontoonColor color,
                                     Rotation rotation, boolean skipInvalid) {
        return guarded("batch place", () -> {
            var batch = service.placePontoonsBatch(grid, index, positions, type, color, rotation, skipInvalid);
            return applyBatch(batch, "Place " + batch.getSuccessCount() + " " + type.displayName());
        });
    }

    public PipelineResult removeBatch(Collection<PontoonId> ids) {
        return guarded("batch remove", () -> {
            var batch = service.removePontoonsBatch(grid, ids);
            return applyBatch(batch, "Remove " + batch.getSuccessCount() + " pontoons");
        });
    }

    public PipelineResult undo() {
        return guarded("undo", this::undoStep);
    }

    public PipelineResult redo() {
        return guarded("redo", this::redoStep);
    }

    /**
     * Mark the current grid so it can be returned to later.
     *
     * @return the checkpoint id
     */
    public String createCheckpoint(String description) {
        var id = history.createCheckpoint(grid, description);
        publish(PipelineEvent.Kind.CHECKPOINT, id + " " + description);
        return id;
    }

    public PipelineResult rollbackToCheckpoint(String checkpointId) {
        return guarded("rollback", () -> {
            var restored = history.rollbackToCheckpoint(checkpointId);
            if (restored.isEmpty()) {
                return reject(ValidationResult.of(ValidationErrorType.NOT_FOUND,
                                                  "Checkpoint " + checkpointId + " not found"),
                              "Rollback to " + checkpointId);
            }
            return restore(restored.get(), PipelineEvent.Kind.ROLLBACK, "Rolled back to " + checkpointId);
        });
    }

    /**
     * Replace the session grid from outside the pipeline, for instance after loading a saved layout. The replacement
     * is recorded in history and the index is rebuilt.
     */
    public PipelineResult replaceGrid(Grid replacement, String description) {
        Objects.requireNonNull(replacement, "replacement");
        return guarded("replace grid", () -> {
            var before = grid;
            rebuildIndex(replacement, "grid replaced");
            history.append(before, replacement, List.of(), description);
            grid = replacement;
            resetInteraction();
            publish(PipelineEvent.Kind.GRID_REPLACED, description);
            return PipelineResult.success(grid, List.of(), description);
        });
    }

    /**
     * Abandon an armed move or a multi-drop drag and clear the preview. Nothing is mutated.
     */
    public void cancel() {
        boolean active = tools.values().stream().anyMatch(Tool::isActive);
        resetInteraction();
        if (active) {
            publish(PipelineEvent.Kind.CANCELLED, "Interaction cancelled");
        }
    }

    /**
     * Compare the index with the grid and rebuild it on disagreement.
     *
     * @return true if the index was consistent
     */
    public boolean verifyIndex() {
        if (index.isConsistentWith(grid)) {
            return true;
        }
        log.warn("Occupancy index diverged from grid, rebuilding");
        rebuildIndex(grid, "consistency check failed");
        return false;
    }

    public void addListener(PipelineListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(PipelineListener listener) {
        listeners.remove(listener);
    }

    public Grid getGrid() {
        return grid;
    }

    public OccupancyIndex getIndex() {
        return index;
    }

    public HistoryLedger getHistory() {
        return history;
    }

    public CoordinateCalculator getCalculator() {
        return calculator;
    }

    public ConfiguratorService getService() {
        return service;
    }

    public EventLog getEventLog() {
        return eventLog;
    }

    public PreviewState getPreview() {
        return preview;
    }

    public Set<PontoonId> getSelection() {
        return Set.copyOf(selection);
    }

    public Optional<PontoonId> getArmedMove() {
        return ((MoveTool) tools.get(ToolType.MOVE)).getArmed();
    }

    public boolean isDragging() {
        return tools.get(ToolType.MULTI_DROP).isActive();
    }

    public boolean isProcessing() {
        return processing;
    }

    public PipelineStats stats() {
        return new PipelineStats(eventLog.total(PipelineEvent.Kind.INPUT_ACCEPTED),
                                 eventLog.total(PipelineEvent.Kind.INPUT_DROPPED),
                                 eventLog.total(PipelineEvent.Kind.MUTATION_APPLIED),
                                 eventLog.total(PipelineEvent.Kind.VALIDATION_FAILED),
                                 eventLog.total(PipelineEvent.Kind.INDEX_REBUILT), history.size(), grid.size(),
                                 selection.size());
    }

    // ---- tool support

    PlacementValidator validator() {
        return service.validator(grid, index);
    }

    PipelineResult apply(OperationResult result, String description) {
        if (!result.success()) {
            return reject(result.validation(), description);
        }
        return commit(result.grid(), result.operations(), description, Map.of());
    }

    PipelineResult applyBatch(BatchOperationResult batch, String description) {
        var result = batch.getResult();
        if (!result.success()) {
            var failure = reject(result.validation(), description);
            return new PipelineResult(false, grid, List.of(), failure.validation(), description, batch.getSkipped());
        }
        return commit(result.grid(), result.operations(), description, batch.getSkipped());
    }

    PipelineResult reject(ValidationResult validation, String description) {
        log.debug("Rejected {}: {}", description, validation.messages());
        publish(PipelineEvent.Kind.VALIDATION_FAILED, description + ": " + String.join("; ", validation.messages()));
        return PipelineResult.failure(grid, validation, description);
    }

    PipelineResult ignored(PointerInput input) {
        return ignored("Ignored " + input.type());
    }

    PipelineResult ignored(String description) {
        return PipelineResult.noop(grid, description);
    }

    PipelineResult recordSelection(OperationKind kind, List<PontoonId> ids, String description) {
        var operation = service.record(kind, ids);
        publish(PipelineEvent.Kind.SELECTION_CHANGED, description);
        return PipelineResult.success(grid, List.of(operation), description);
    }

    void selectOnly(PontoonId id) {
        selection.clear();
        selection.add(id);
    }

    /**
     * @return true if the id is selected afterwards
     */
    boolean toggleSelection(PontoonId id) {
        if (selection.remove(id)) {
            return false;
        }
        selection.add(id);
        return true;
    }

    void clearSelection() {
        selection.clear();
    }

    void setPreview(PreviewState state) {
        preview = state;
    }

    // ---- internals

    private PipelineResult guarded(String label, Supplier<PipelineResult> action) {
        if (processing) {
            log.warn("Dropped {} while processing a previous input", label);
            publish(PipelineEvent.Kind.INPUT_DROPPED, label);
            return PipelineResult.busy(grid);
        }
        processing = true;
        try {
            return action.get();
        } catch (RuntimeException e) {
            log.warn("Unexpected failure handling {}, grid left unchanged", label, e);
            rebuildIndex(grid, "recovery after " + label);
            resetInteraction();
            publish(PipelineEvent.Kind.ERROR, label + ": " + e.getMessage());
            var description = "Internal error handling " + label + ": " + e.getMessage();
            return PipelineResult.failure(grid, ValidationResult.of(ValidationErrorType.INTERNAL_ERROR, description),
                                          description);
        } finally {
            processing = false;
        }
    }

    private PipelineResult dispatch(PointerInput input, ToolContext context) {
        publish(PipelineEvent.Kind.INPUT_ACCEPTED, input.type() + " " + context.tool());
        if (lastTool != context.tool()) {
            if (lastTool != null) {
                resetInteraction();
            }
            lastTool = context.tool();
        }
        if (input.type() == InputType.KEY) {
            return handleKey(input, context);
        }
        if (input.type() == InputType.LEAVE) {
            tools.get(ToolType.MULTI_DROP).cancel();
            preview = PreviewState.none();
            return ignored(input);
        }
        var cell = resolve(input, context);
        var tool = tools.get(context.tool());
        if (input.type() == InputType.HOVER) {
            if (cell.isEmpty()) {
                preview = PreviewState.none();
                return PipelineResult.failure(grid, ValidationErrorType.OUT_OF_BOUNDS, "Pointer is outside the grid");
            }
            preview = tool.preview(context, cell.get());
            return PipelineResult.noop(grid, "Preview at " + cell.get());
        }
        log.debug("{} with {} at {}", input.type(), context.tool(), cell.map(Object::toString).orElse("off grid"));
        return tool.handle(input, context, cell);
    }

    private Optional<GridPosition> resolve(PointerInput input, ToolContext context) {
        return calculator.screenToGrid(input.screenPoint(), context.camera(), context.viewport(),
                                       grid.getDimensions(), context.activeLevel());
    }

    private PipelineResult handleKey(PointerInput input, ToolContext context) {
        var key = input.key().toLowerCase(Locale.ROOT);
        var modifiers = input.modifiers();
        switch (key) {
            case "delete", "backspace" -> {
                var cell = resolve(input, context);
                if (cell.isEmpty()) {
                    return reject(ValidationResult.of(ValidationErrorType.OUT_OF_BOUNDS, "Pointer is outside the grid"),
                                  "Delete outside the grid");
                }
                return DeleteTool.removeAt(this, cell.get())
                                 .orElseGet(() -> reject(ValidationResult.of(ValidationErrorType.NOT_FOUND,
                                                                             "No pontoon at position " + cell.get()),
                                                         "Delete at " + cell.get()));
            }
            case "z" -> {
                if (modifiers.command()) {
                    return modifiers.shift() ? redoStep() : undoStep();
                }
            }
            case "y" -> {
                if (modifiers.command()) {
                    return redoStep();
                }
            }
            case "escape" -> {
                cancel();
                return ignored("Cancelled");
            }
            default -> {
            }
        }
        return ignored("Ignored key " + input.key());
    }

    private PipelineResult undoStep() {
        var restored = history.undo();
        if (restored.isEmpty()) {
            return reject(ValidationResult.of(ValidationErrorType.NOT_FOUND, "Nothing to undo"), "Undo");
        }
        return restore(restored.get(), PipelineEvent.Kind.UNDO, "Undo");
    }

    private PipelineResult redoStep() {
        var restored = history.redo();
        if (restored.isEmpty()) {
            return reject(ValidationResult.of(ValidationErrorType.NOT_FOUND, "Nothing to redo"), "Redo");
        }
        return restore(restored.get(), PipelineEvent.Kind.REDO, "Redo");
    }

    private PipelineResult restore(Grid restored, PipelineEvent.Kind kind, String description) {
        index.rebuild(restored);
        grid = restored;
        resetInteraction();
        publish(kind, description);
        return PipelineResult.success(grid, List.of(), description);
    }

    private PipelineResult commit(Grid after, List<Operation> operations, String description,
                                  Map<GridPosition, ValidationResult> skipped) {
        var before = grid;
        updateIndex(after, operations);
        history.append(before, after, operations, description);
        grid = after;
        selection.removeIf(id -> !after.contains(id));
        publish(PipelineEvent.Kind.MUTATION_APPLIED, description);
        return new PipelineResult(true, grid, operations, ValidationResult.valid(), description, skipped);
    }

    private void updateIndex(Grid after, List<Operation> operations) {
        try {
            for (var operation : operations) {
                switch (operation.kind()) {
                    case PLACE, BATCH_PLACE -> operation.after()
                                                        .forEach(p -> index.insert(p.id(), p.position(),
                                                                                   p.type().footprintSize()));
                    case REMOVE, BATCH_REMOVE -> operation.before().forEach(p -> index.remove(p.id()));
                    case MOVE -> operation.after().forEach(p -> index.moveElement(p.id(), p.position()));
                    default -> {
                        // orientation and color do not affect occupancy
                    }
                }
            }
        } catch (IllegalStateException e) {
            log.warn("Incremental index update failed, rebuilding: {}", e.getMessage());
            rebuildIndex(after, "incremental update failed: " + e.getMessage());
            return;
        }
        if (config.isVerifyIndexAfterMutation() && !index.isConsistentWith(after)) {
            log.warn("Occupancy index diverged from grid, rebuilding");
            rebuildIndex(after, "consistency check failed");
        }
    }

    private void rebuildIndex(Grid source, String reason) {
        index.rebuild(source);
        log.info("Rebuilt occupancy index ({}): {} pontoons", reason, source.size());
        publish(PipelineEvent.Kind.INDEX_REBUILT, reason);
    }

    private void resetInteraction() {
        tools.values().forEach(Tool::cancel);
        selection.removeIf(id -> !grid.contains(id));
        preview = PreviewState.none();
    }

    // Events raised while listeners are being notified are queued and delivered once the current delivery returns.
    private void publish(PipelineEvent.Kind kind, String detail) {
        var event = new PipelineEvent(kind, service.getClock().instant(), detail);
        eventLog.append(event);
        pending.addLast(event);
        if (notifying) {
            return;
        }
        notifying = true;
        try {
            while (!pending.isEmpty()) {
                var next = pending.removeFirst();
                for (var listener : listeners) {
                    try {
                        listener.onEvent(next);
                    } catch (RuntimeException e) {
                        log.warn("Pipeline listener failed on {}", next.kind(), e);
                    }
                }
            }
        } finally {
            notifying = false;
        }
    }
}
