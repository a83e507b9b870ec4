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

/**
 * Pipeline statistics snapshot
 *
 * @author hal.hildebrand
 */
public record PipelineStats(long inputsAccepted, long inputsDropped, long mutationsApplied, long validationFailures,
                            long indexRebuilds, int historyEntries, int pontoons, int selected) {

    @Override
    public String toString() {
        return String.format(
        "OperationPipeline[accepted=%d, dropped=%d, mutations=%d, failures=%d, rebuilds=%d, history=%d, pontoons=%d, selected=%d]",
        inputsAccepted, inputsDropped, mutationsApplied, validationFailures, indexRebuilds, historyEntries, pontoons,
        selected);
    }
}
