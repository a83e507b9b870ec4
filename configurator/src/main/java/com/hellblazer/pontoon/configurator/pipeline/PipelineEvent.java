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

import java.time.Instant;
import java.util.Objects;

/**
 * Structured record of something the pipeline did
 *
 * @author hal.hildebrand
 */
public record PipelineEvent(Kind kind, Instant timestamp, String detail) {

    public enum Kind {
        INPUT_ACCEPTED,
        INPUT_DROPPED,
        MUTATION_APPLIED,
        VALIDATION_FAILED,
        SELECTION_CHANGED,
        INDEX_REBUILT,
        GRID_REPLACED,
        UNDO,
        REDO,
        CHECKPOINT,
        ROLLBACK,
        CANCELLED,
        ERROR
    }

    public PipelineEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timestamp, "timestamp");
        detail = detail == null ? "" : detail;
    }

    @Override
    public String toString() {
        return kind + "@" + timestamp + (detail.isEmpty() ? "" : ": " + detail);
    }
}
