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

import com.hellblazer.catacomb.geometry.GridPoint;

import java.util.List;
import java.util.NoSuchElementException;

/**
 * An ordered sequence of waypoints, excluding the starting cell. Immutable; advancing yields a new path.
 *
 * @param waypoints cells to visit in order
 * @author hal.hildebrand
 */
public record Path(List<GridPoint> waypoints) {

    private static final Path EMPTY = new Path(List.of());

    public Path {
        waypoints = List.copyOf(waypoints);
    }

    public static Path empty() {
        return EMPTY;
    }

    public int length() {
        return waypoints.size();
    }

    public boolean isEmpty() {
        return waypoints.isEmpty();
    }

    public GridPoint nextWaypoint() {
        if (waypoints.isEmpty()) {
            throw new NoSuchElementException("Path is exhausted");
        }
        return waypoints.get(0);
    }

    /**
     * The final waypoint, where the path was planned to end.
     */
    public GridPoint terminal() {
        if (waypoints.isEmpty()) {
            throw new NoSuchElementException("Path is exhausted");
        }
        return waypoints.get(waypoints.size() - 1);
    }

    /**
     * The path remaining after stepping onto the next waypoint.
     */
    public Path advance() {
        if (waypoints.size() <= 1) {
            return EMPTY;
        }
        return new Path(waypoints.subList(1, waypoints.size()));
    }
}
