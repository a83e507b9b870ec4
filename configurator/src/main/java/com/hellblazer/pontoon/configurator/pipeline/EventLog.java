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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded log of the most recent pipeline events. Per kind totals cover every event ever appended, including those
 * that have since been evicted.
 *
 * @author hal.hildebrand
 */
public class EventLog {

    private final Deque<PipelineEvent>         events = new ArrayDeque<>();
    private final Map<PipelineEvent.Kind, Long> totals = new EnumMap<>(PipelineEvent.Kind.class);
    private final int                           capacity;

    public EventLog(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Event log capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public void append(PipelineEvent event) {
        events.addLast(event);
        totals.merge(event.kind(), 1L, Long::sum);
        while (events.size() > capacity) {
            events.removeFirst();
        }
    }

    public List<PipelineEvent> events() {
        return List.copyOf(events);
    }

    public List<PipelineEvent> recent(int count) {
        var all = new ArrayList<>(events);
        return List.copyOf(all.subList(Math.max(0, all.size() - count), all.size()));
    }

    public List<PipelineEvent> eventsOfKind(PipelineEvent.Kind kind) {
        return events.stream().filter(e -> e.kind() == kind).toList();
    }

    public long total(PipelineEvent.Kind kind) {
        return totals.getOrDefault(kind, 0L);
    }

    public int size() {
        return events.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public void clear() {
        events.clear();
        totals.clear();
    }
}
