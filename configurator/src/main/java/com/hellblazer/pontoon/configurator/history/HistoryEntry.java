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

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * One undoable step: the grids before and after, and the operations that led from one to the other. Checkpoints are
 * zero delta entries whose before and after grids are the same and whose operation type is null.
 *
 * @author hal.hildebrand
 */
public record HistoryEntry(String id, Instant timestamp, String description, Grid before, Grid after,
                           List<Operation> operations, OperationKind operationType, List<PontoonId> affectedIds,
                           boolean checkpoint) {

    public HistoryEntry {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(description, "description");
        Objects.requireNonNull(before, "before");
        Objects.requireNonNull(after, "after");
        operations = List.copyOf(operations);
        affectedIds = List.copyOf(affectedIds);
    }

    public boolean affects(PontoonId id) {
        return affectedIds.contains(id);
    }
}
