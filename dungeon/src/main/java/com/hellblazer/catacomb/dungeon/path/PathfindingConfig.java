/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Catacomb.
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
package com.hellblazer.catacomb.dungeon.path;

/**
 * Configuration for {@link PathfindingEngine}.
 *
 * @author hal.hildebrand
 */
public class PathfindingConfig {

    public static final int DEFAULT_MAX_EXPANSIONS   = 2000;
    public static final int DEFAULT_REPLAN_TOLERANCE = 1;

    private final int     maxExpansions;
    private final boolean monstersBlock;
    private final int     replanTolerance;

    private PathfindingConfig(Builder builder) {
        this.maxExpansions = builder.maxExpansions;
        this.monstersBlock = builder.monstersBlock;
        this.replanTolerance = builder.replanTolerance;
    }

    /**
     * Maximum number of nodes closed before a search gives up and reports the goal unreachable.
     */
    public int getMaxExpansions() {
        return maxExpansions;
    }

    /**
     * Whether cells occupied by other monsters are treated as temporarily blocked.
     */
    public boolean isMonstersBlock() {
        return monstersBlock;
    }

    /**
     * How far, in tiles, the goal may drift from a cached path's terminal waypoint before the path is recomputed.
     */
    public int getReplanTolerance() {
        return replanTolerance;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PathfindingConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Builder class for PathfindingConfig
     */
    public static class Builder {
        private int     maxExpansions   = DEFAULT_MAX_EXPANSIONS;
        private boolean monstersBlock   = true;
        private int     replanTolerance = DEFAULT_REPLAN_TOLERANCE;

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if the cap is not positive
         */
        public Builder withMaxExpansions(int maxExpansions) {
            if (maxExpansions <= 0) {
                throw new IllegalArgumentException("Max expansions must be positive");
            }
            this.maxExpansions = maxExpansions;
            return this;
        }

        public Builder withMonstersBlock(boolean monstersBlock) {
            this.monstersBlock = monstersBlock;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the tolerance is negative
         */
        public Builder withReplanTolerance(int replanTolerance) {
            if (replanTolerance < 0) {
                throw new IllegalArgumentException("Replan tolerance must be non-negative");
            }
            this.replanTolerance = replanTolerance;
            return this;
        }

        public PathfindingConfig build() {
            return new PathfindingConfig(this);
        }
    }

    @Override
    public String toString() {
        return String.format("PathfindingConfig[maxExpansions=%d, monstersBlock=%s, replanTolerance=%d]",
                             maxExpansions, monstersBlock, replanTolerance);
    }
}
