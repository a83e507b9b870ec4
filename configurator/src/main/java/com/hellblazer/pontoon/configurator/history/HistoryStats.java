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

/**
 * History ledger statistics snapshot. The current position is -1 when nothing can be undone.
 *
 * @author hal.hildebrand
 */
public record HistoryStats(int totalEntries, int currentPosition, boolean canUndo, boolean canRedo, int checkpoints,
                           long evicted, int maxSize) {

    @Override
    public String toString() {
        return String.format("HistoryLedger[entries=%d/%d, position=%d, undo=%s, redo=%s, checkpoints=%d, evicted=%d]",
                             totalEntries, maxSize, currentPosition, canUndo, canRedo, checkpoints, evicted);
    }
}
