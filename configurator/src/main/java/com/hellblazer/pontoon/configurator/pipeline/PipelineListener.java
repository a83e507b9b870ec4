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

import java.util.EnumSet;
import java.util.Set;

/**
 * Receives pipeline events as they happen. Listeners run on the caller's thread while the pipeline is processing, so
 * input submitted from a listener is dropped as busy.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface PipelineListener {

    void onEvent(PipelineEvent event);

    /**
     * Create a listener that only receives the given kinds of events
     */
    static PipelineListener filtered(PipelineListener listener, Set<PipelineEvent.Kind> kinds) {
        var accepted = EnumSet.copyOf(kinds);
        return event -> {
            if (accepted.contains(event.kind())) {
                listener.onEvent(event);
            }
        };
    }
}
