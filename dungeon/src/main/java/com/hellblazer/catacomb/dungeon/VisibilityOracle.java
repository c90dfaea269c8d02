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
package com.hellblazer.catacomb.dungeon;

import com.hellblazer.catacomb.geometry.GridPoint;

import java.util.Set;

/**
 * Field-of-view provider. The shadowcasting itself lives outside this core; AI code only asks which cells are visible.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface VisibilityOracle {

    /**
     * Compute the cells visible from an origin.
     *
     * @param origin viewer position
     * @param radius maximum sight radius in tiles
     * @param level  level being viewed
     * @return visible cells, including the origin
     */
    Set<GridPoint> computeVisible(GridPoint origin, int radius, Level level);
}
