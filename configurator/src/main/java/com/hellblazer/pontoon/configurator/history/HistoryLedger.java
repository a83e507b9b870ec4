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
package com.hellblazer.pontoon.configurator.history;

import com.hellblazer.pontoon.configurator.model.Grid;
import com.hellblazer.pontoon.configurator.model.PontoonId;
import com.hellblazer.pontoon.configurator.operation.Operation;
import com.hellblazer.pontoon.configurator.operation.OperationKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded, linear undo/redo history of grid snapshots.
 * <p>
 * The cursor points at the most recently applied entry, or is -1 when nothing is applied. Appending while entries
 * exist beyond the cursor discards them. When the ledger grows past its maximum size the oldest entries are evicted
 * and the cursor shifts left by the number evicted, never below zero.
 *
 * @author hal.hildebrand
 */
public class HistoryLedger {
    private static final Logger log = LoggerFactory.getLogger(HistoryLedger.class);

    private final List<HistoryEntry> entries = new ArrayList<>();
    private final int                maxSize;
    private final Clock              clock;

    private int  cursor   = -1;
    private long sequence = 0;
    private long evicted  = 0;

    public HistoryLedger(int maxSize) {
        this(maxSize, Clock.systemUTC());
    }

    public HistoryLedger(int maxSize, Clock clock) {
        if (maxSize <= 0) {
            throw new IllegalArgumentException("History size must be positive: " + maxSize);
        }
        this.maxSize = maxSize;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Record a completed step. The operation type and affected ids are derived from the operations.
     *
     * @return the new entry
     */
    public HistoryEntry append(Grid before, Grid after, List<Operation> operations, String description) {
        var affected = new LinkedHashSet<PontoonId>();
        operations.forEach(op -> affected.addAll(op.affectedIds()));
        OperationKind type = operations.isEmpty() ? null : operations.get(operations.size() - 1).kind();
        var entry = new HistoryEntry(nextId(), clock.instant(), description, before, after, operations, type,
                                     List.copyOf(affected), false);
        push(entry);
        log.debug("History append: {} ({} entries, cursor {})", description, entries.size(), cursor);
        return entry;
    }

    /**
     * Step back over the current entry.
     *
     * @return the grid before the undone entry, or empty when there is nothing to undo
     */
    public Optional<Grid> undo() {
        if (!canUndo()) {
            return Optional.empty();
        }
        var entry = entries.get(cursor--);
        log.debug("Undo: {}", entry.description());
        return Optional.of(entry.before());
    }

    /**
     * Step forward over the next entry.
     *
     * @return the grid after the redone entry, or empty when there is nothing to redo
     */
    public Optional<Grid> redo() {
        if (!canRedo()) {
            return Optional.empty();
        }
        var entry = entries.get(++cursor);
        log.debug("Redo: {}", entry.description());
        return Optional.of(entry.after());
    }

    public boolean canUndo() {
        return cursor >= 0;
    }

    public boolean canRedo() {
        return cursor < entries.size() - 1;
    }

    public int getCursor() {
        return cursor;
    }

    public int size() {
        return entries.size();
    }

    public int getMaxSize() {
        return maxSize;
    }

    /**
     * @return the grid after the current entry, empty when nothing is applied
     */
    public Optional<Grid> currentGrid() {
        return cursor < 0 ? Optional.empty() : Optional.of(entries.get(cursor).after());
    }

    /**
     * Append a zero delta marker for the grid.
     *
     * @return the checkpoint id
     */
    public String createCheckpoint(Grid grid, String description) {
        var entry = new HistoryEntry(nextId(), clock.instant(), "Checkpoint: " + description, grid, grid, List.of(),
                                     null, List.of(), true);
        push(entry);
        log.debug("Created checkpoint {}: {}", entry.id(), description);
        return entry.id();
    }

    /**
     * Move the cursor to a checkpoint, regardless of what was recorded after it.
     *
     * @return the checkpoint's grid, or empty if the checkpoint is unknown or has been evicted
     */
    public Optional<Grid> rollbackToCheckpoint(String checkpointId) {
        for (int i = 0; i < entries.size(); i++) {
            var entry = entries.get(i);
            if (entry.checkpoint() && entry.id().equals(checkpointId)) {
                return jumpTo(i);
            }
        }
        log.warn("Checkpoint {} not found", checkpointId);
        return Optional.empty();
    }

    /**
     * Move the cursor to an entry.
     *
     * @return the grid after that entry, or empty if the index is out of range
     */
    public Optional<Grid> jumpTo(int index) {
        if (index < 0 || index >= entries.size()) {
            log.warn("Invalid history index {}", index);
            return Optional.empty();
        }
        cursor = index;
        var entry = entries.get(index);
        log.debug("Jumped to {}", entry.description());
        return Optional.of(entry.after());
    }

    public Optional<HistoryEntry> getEntry(int index) {
        if (index < 0 || index >= entries.size()) {
            return Optional.empty();
        }
        return Optional.of(entries.get(index));
    }

    public List<HistoryEntry> entries() {
        return List.copyOf(entries);
    }

    public List<HistoryEntry> recentEntries(int count) {
        int start = Math.max(0, entries.size() - count);
        return List.copyOf(entries.subList(start, entries.size()));
    }

    /**
     * Entries whose description contains the text, ignoring case
     */
    public List<HistoryEntry> search(String text) {
        var query = text.toLowerCase(Locale.ROOT);
        return entries.stream().filter(e -> e.description().toLowerCase(Locale.ROOT).contains(query)).toList();
    }

    public List<HistoryEntry> entriesOfType(OperationKind kind) {
        return entries.stream().filter(e -> e.operationType() == kind).toList();
    }

    public List<HistoryEntry> entriesAffecting(PontoonId id) {
        return entries.stream().filter(e -> e.affects(id)).toList();
    }

    public void clear() {
        entries.clear();
        cursor = -1;
        log.debug("History cleared");
    }

    public HistoryStats stats() {
        int checkpoints = (int) entries.stream().filter(HistoryEntry::checkpoint).count();
        return new HistoryStats(entries.size(), cursor, canUndo(), canRedo(), checkpoints, evicted, maxSize);
    }

    private void push(HistoryEntry entry) {
        if (cursor < entries.size() - 1) {
            entries.subList(cursor + 1, entries.size()).clear();
        }
        entries.add(entry);
        cursor = entries.size() - 1;
        trim();
    }

    private void trim() {
        if (entries.size() <= maxSize) {
            return;
        }
        int excess = entries.size() - maxSize;
        entries.subList(0, excess).clear();
        cursor = Math.max(0, cursor - excess);
        evicted += excess;
        log.info("History trimmed {} oldest entries, {} retained", excess, entries.size());
    }

    private String nextId() {
        return "history_" + (++sequence);
    }
}
