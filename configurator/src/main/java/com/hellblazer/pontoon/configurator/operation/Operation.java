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
package com.hellblazer.pontoon.configurator.operation;

import com.hellblazer.pontoon.configurator.model.Pontoon;
import com.hellblazer.pontoon.configurator.model.PontoonId;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Record of one applied operation: the pontoon values before and after, keyed by the affected ids.
 *
 * @author hal.hildebrand
 */
public record Operation(String id, OperationKind kind, Instant timestamp, List<PontoonId> affectedIds,
                        List<Pontoon> before, List<Pontoon> after) {

    public Operation {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(timestamp, "timestamp");
        affectedIds = List.copyOf(affectedIds);
        before = List.copyOf(before);
        after = List.copyOf(after);
    }
}
