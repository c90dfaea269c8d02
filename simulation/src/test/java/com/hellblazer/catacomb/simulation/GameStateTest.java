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
package com.hellblazer.catacomb.simulation;

import com.hellblazer.catacomb.geometry.GridPoint;
import com.hellblazer.catacomb.simulation.actor.MonsterState;
import com.hellblazer.catacomb.simulation.profile.BehaviorTag;
import org.junit.jupiter.api.Test;

import static com.hellblazer.catacomb.simulation.SimulationFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GameState occupancy, ordering and cleanup.
 *
 * @author hal.hildebrand
 */
class GameStateTest {

    @Test
    void testActorsListsPlayerFirstThenMonstersInOrder() {
        var rat = profile("Rat", BehaviorTag.SIMPLE).build();
        var a = monster("a", rat, GridPoint.of(1, 1), MonsterState.SLEEPING);
        var b = monster("b", rat, GridPoint.of(2, 2), MonsterState.SLEEPING);
        var state = state(openLevel(5, 5), player(GridPoint.of(0, 0)), blind(), a, b);

        var actors = state.actors();
        assertSame(state.getPlayer(), actors.get(0));
        assertSame(a, actors.get(1));
        assertSame(b, actors.get(2));
    }

    @Test
    void testOccupancyIgnoresDeadMonsters() {
        var rat = profile("Rat", BehaviorTag.SIMPLE).build();
        var a = monster("a", rat, GridPoint.of(1, 1), MonsterState.SLEEPING);
        var state = state(openLevel(5, 5), player(GridPoint.of(0, 0)), blind(), a);

        assertTrue(state.isOccupied(GridPoint.of(0, 0)));
        assertTrue(state.isOccupied(GridPoint.of(1, 1)));
        a.setHp(0);
        assertFalse(state.isOccupied(GridPoint.of(1, 1)));
        assertTrue(state.occupiedCells(null).contains(GridPoint.of(0, 0)));
        assertFalse(state.occupiedCells(null).contains(GridPoint.of(1, 1)));
    }

    @Test
    void testRemoveDeadMonsters() {
        var rat = profile("Rat", BehaviorTag.SIMPLE).build();
        var a = monster("a", rat, GridPoint.of(1, 1), MonsterState.SLEEPING);
        var b = monster("b", rat, GridPoint.of(2, 2), MonsterState.SLEEPING);
        var state = state(openLevel(5, 5), player(GridPoint.of(0, 0)), blind(), a, b);

        a.setHp(0);
        var removed = state.removeDeadMonsters();
        assertEquals(1, removed.size());
        assertSame(a, removed.get(0));
        assertFalse(state.containsMonster(a));
        assertTrue(state.containsMonster(b));
    }

    @Test
    void testRejectsDuplicateMonster() {
        var rat = profile("Rat", BehaviorTag.SIMPLE).build();
        var a = monster("a", rat, GridPoint.of(1, 1), MonsterState.SLEEPING);
        var state = state(openLevel(5, 5), player(GridPoint.of(0, 0)), blind(), a);
        assertThrows(IllegalArgumentException.class, () -> state.addMonster(a));
    }

    @Test
    void testMonsterIdsAreUnique() {
        var state = state(openLevel(5, 5), player(GridPoint.of(0, 0)), blind());
        assertNotEquals(state.nextMonsterId("Bat"), state.nextMonsterId("Bat"));
    }
}
