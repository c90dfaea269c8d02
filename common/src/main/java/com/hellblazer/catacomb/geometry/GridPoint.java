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

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable 2D point with integer coordinates on a level grid.
 * <p>
 * Movement on the grid is 8-directional, so the natural metric is the Chebyshev (uniform norm) distance: the number of
 * king moves between two cells.
 *
 * @author hal.hildebrand
 */
public final class GridPoint {

    /** X coordinate (column) */
    public final int x;

    /** Y coordinate (row, growing downward) */
    public final int y;

    /**
     * Create a new grid point.
     *
     * @param x X coordinate
     * @param y Y coordinate
     */
    public GridPoint(int x, int y) {
        this.x = x;
        this.y = y;
    }

    public static GridPoint of(int x, int y) {
        return new GridPoint(x, y);
    }

    /**
     * Create a point at the origin (0, 0).
     *
     * @return Point at origin
     */
    public static GridPoint origin() {
        return new GridPoint(0, 0);
    }

    /**
     * Step one cell in the given direction.
     *
     * @param direction Direction to step
     * @return New point adjacent to this one
     */
    public GridPoint step(Direction direction) {
        return new GridPoint(x + direction.dx, y + direction.dy);
    }

    public GridPoint add(int dx, int dy) {
        return new GridPoint(x + dx, y + dy);
    }

    /**
     * Calculate Chebyshev distance to another point.
     *
     * @param other Other point
     * @return max(|dx|, |dy|)
     */
    public int chebyshevDistance(GridPoint other) {
        return Math.max(Math.abs(x - other.x), Math.abs(y - other.y));
    }

    /**
     * Calculate Manhattan distance to another point.
     *
     * @param other Other point
     * @return Manhattan distance (|dx| + |dy|)
     */
    public int manhattanDistance(GridPoint other) {
        return Math.abs(x - other.x) + Math.abs(y - other.y);
    }

    /**
     * True when the other point is one king move away. A point is not adjacent to itself.
     */
    public boolean isAdjacentTo(GridPoint other) {
        return chebyshevDistance(other) == 1;
    }

    /**
     * The direction of a single greedy step from this point toward the target, by the signs of dx and dy.
     *
     * @param target Target point
     * @return Direction toward the target, or null when the target is this point
     */
    public Direction directionToward(GridPoint target) {
        return Direction.of(Integer.signum(target.x - x), Integer.signum(target.y - y));
    }

    /**
     * The eight neighbors of this point in {@link Direction} order. No bounds checking.
     *
     * @return Neighboring points
     */
    public List<GridPoint> neighbors() {
        var result = new ArrayList<GridPoint>(8);
        for (var direction : Direction.values()) {
            result.add(step(direction));
        }
        return result;
    }

    /**
     * Check if this point is within rectangular bounds.
     *
     * @param minX Minimum x (inclusive)
     * @param minY Minimum y (inclusive)
     * @param maxX Maximum x (exclusive)
     * @param maxY Maximum y (exclusive)
     * @return True if point is within bounds
     */
    public boolean isWithinBounds(int minX, int minY, int maxX, int maxY) {
        return x >= minX && x < maxX && y >= minY && y < maxY;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof GridPoint other)) return false;
        return x == other.x && y == other.y;
    }

    @Override
    public int hashCode() {
        return 31 * x + y;
    }

    @Override
    public String toString() {
        return String.format("(%d, %d)", x, y);
    }
}
