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

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GridPoint integer 2D point class.
 *
 * @author hal.hildebrand
 */
public class GridPointTest {

    @Test
    public void testConstruction() {
        var point = new GridPoint(3, 4);
        assertEquals(3, point.x);
        assertEquals(4, point.y);
        assertEquals(GridPoint.origin(), GridPoint.of(0, 0));
    }

    @Test
    public void testChebyshevDistance() {
        var a = GridPoint.of(0, 0);
        assertEquals(5, a.chebyshevDistance(GridPoint.of(5, 5)));
        assertEquals(7, a.chebyshevDistance(GridPoint.of(-7, 2)));
        assertEquals(0, a.chebyshevDistance(a));
    }

    @Test
    public void testManhattanDistance() {
        assertEquals(10, GridPoint.of(0, 0).manhattanDistance(GridPoint.of(5, 5)));
    }

    @Test
    public void testAdjacency() {
        var center = GridPoint.of(5, 5);
        for (var neighbor : center.neighbors()) {
            assertTrue(center.isAdjacentTo(neighbor), "Expected " + neighbor + " adjacent");
        }
        assertFalse(center.isAdjacentTo(center), "A point is not adjacent to itself");
        assertFalse(center.isAdjacentTo(GridPoint.of(7, 5)));
    }

    @Test
    public void testNeighborsFollowDirectionOrder() {
        var neighbors = GridPoint.of(1, 1).neighbors();
        assertEquals(8, neighbors.size());
        assertEquals(GridPoint.of(1, 0), neighbors.get(0));
        assertEquals(GridPoint.of(2, 0), neighbors.get(1));
        assertEquals(GridPoint.of(0, 0), neighbors.get(7));
    }

    @Test
    public void testDirectionToward() {
        var from = GridPoint.of(5, 5);
        assertEquals(Direction.SE, from.directionToward(GridPoint.of(9, 12)));
        assertEquals(Direction.W, from.directionToward(GridPoint.of(0, 5)));
        assertNull(from.directionToward(from));
    }

    @Test
    public void testDirectionOpposite() {
        assertEquals(Direction.SW, Direction.NE.opposite());
        assertTrue(Direction.NW.isDiagonal());
        assertFalse(Direction.S.isDiagonal());
        assertThrows(IllegalArgumentException.class, () -> Direction.of(2, 0));
    }

    @Test
    public void testEqualsAndHashCode() {
        var p1 = GridPoint.of(3, 9);
        var p2 = GridPoint.of(3, 9);
        assertEquals(p1, p2);
        assertEquals(p1.hashCode(), p2.hashCode());
        assertNotEquals(p1, GridPoint.of(9, 3));
    }
}
