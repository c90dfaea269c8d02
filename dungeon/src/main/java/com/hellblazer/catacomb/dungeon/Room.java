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

/**
 * Rectangular room, interior cells only.
 *
 * @param id     room identifier, unique within a level
 * @param x      left column (inclusive)
 * @param y      top row (inclusive)
 * @param width  width in cells
 * @param height height in cells
 * @author hal.hildebrand
 */
public record Room(int id, int x, int y, int width, int height) {

    public Room {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Room dimensions must be positive: " + width + "x" + height);
        }
    }

    public boolean contains(GridPoint point) {
        return point.isWithinBounds(x, y, x + width, y + height);
    }
}
