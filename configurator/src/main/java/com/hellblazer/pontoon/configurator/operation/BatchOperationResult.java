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

import com.hellblazer.pontoon.configurator.model.Grid;
import com.hellblazer.pontoon.configurator.model.GridPosition;
import com.hellblazer.pontoon.configurator.model.PontoonId;
import com.hellblazer.pontoon.configurator.validation.ValidationResult;

import java.util.List;
import java.util.Map;

/**
 * Result of a batch operation, with the per position failures of entries that were skipped.
 *
 * @author hal.hildebrand
 */
public class BatchOperationResult {

    private final OperationResult                     result;
    private final List<PontoonId>                     affectedIds;
    private final Map<GridPosition, ValidationResult> skipped;
    private final int                                 requested;

    private BatchOperationResult(Builder builder) {
        this.result = builder.result;
        this.affectedIds = builder.affectedIds;
        this.skipped = builder.skipped;
        this.requested = builder.requested;
    }

    /**
     * The combined outcome: the resulting grid, the single batch operation and, on failure, the reasons.
     */
    public OperationResult getResult() {
        return result;
    }

    public boolean isSuccess() {
        return result.success();
    }

    public Grid getGrid() {
        return result.grid();
    }

    /**
     * Ids placed or removed by the batch, in processing order
     */
    public List<PontoonId> getAffectedIds() {
        return affectedIds;
    }

    /**
     * Positions that were skipped because they failed validation
     */
    public Map<GridPosition, ValidationResult> getSkipped() {
        return skipped;
    }

    public int getRequestedCount() {
        return requested;
    }

    public int getSuccessCount() {
        return affectedIds.size();
    }

    public int getFailureCount() {
        return skipped.size();
    }

    public boolean isCompleteSuccess() {
        return result.success() && skipped.isEmpty();
    }

    public String getSummary() {
        return String.format("BatchOperationResult[requested=%d, success=%d, skipped=%d, applied=%s]", requested,
                             getSuccessCount(), getFailureCount(), result.success());
    }

    @Override
    public String toString() {
        return getSummary();
    }

    /**
     * Builder for BatchOperationResult.
     */
    public static class Builder {
        private OperationResult                     result;
        private List<PontoonId>                     affectedIds = List.of();
        private Map<GridPosition, ValidationResult> skipped     = Map.of();
        private int                                 requested;

        public BatchOperationResult build() {
            if (result == null) {
                throw new IllegalStateException("Batch result requires an operation result");
            }
            return new BatchOperationResult(this);
        }

        public Builder withResult(OperationResult result) {
            this.result = result;
            return this;
        }

        public Builder withAffectedIds(List<PontoonId> ids) {
            this.affectedIds = List.copyOf(ids);
            return this;
        }

        public Builder withSkipped(Map<GridPosition, ValidationResult> skipped) {
            this.skipped = skipped;
            return this;
        }

        public Builder withRequestedCount(int count) {
            this.requested = count;
            return this;
        }
    }
}
