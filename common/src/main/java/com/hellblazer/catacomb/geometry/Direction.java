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
package com.hellblazer.catacomb.geometry;

/**
 * The eight compass directions of grid movement. Declaration order is the canonical iteration order used wherever a
 * deterministic tie-break between neighbors is needed.
 *
 * @author hal.hildebrand
 */
public enum Direction {
    N(0, -1),
    NE(1, -1),
    E(1, 0),
    SE(1, 1),
    S(0, 1),
    SW(-1, 1),
    W(-1, 0),
    NW(-1, -1);

    public final int dx;
    public final int dy;

    Direction(int dx, int dy) {
        this.dx = dx;
        this.dy = dy;
    }

    public boolean isDiagonal() {
        return dx != 0 && dy != 0;
    }

    public Direction opposite() {
        return of(-dx, -dy);
    }

    /**
     * Look up the direction for a unit offset.
     *
     * @param dx -1, 0 or 1
     * @param dy -1, 0 or 1
     * @return the matching direction, or null for (0, 0)
     */
    public static Direction of(int dx, int dy) {
        for (var direction : values()) {
            if (direction.dx == dx && direction.dy == dy) {
                return direction;
            }
        }
        if (dx == 0 && dy == 0) {
            return null;
        }
        throw new IllegalArgumentException("Not a unit offset: (" + dx + ", " + dy + ")");
    }
}
