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

import com.hellblazer.catacomb.common.SeededRandom;
import com.hellblazer.catacomb.dungeon.Level;
import com.hellblazer.catacomb.dungeon.TileType;
import com.hellblazer.catacomb.dungeon.VisibilityOracle;
import com.hellblazer.catacomb.geometry.GridPoint;
import com.hellblazer.catacomb.simulation.actor.ActorId;
import com.hellblazer.catacomb.simulation.actor.Monster;
import com.hellblazer.catacomb.simulation.actor.MonsterState;
import com.hellblazer.catacomb.simulation.actor.Player;
import com.hellblazer.catacomb.simulation.profile.BehaviorProfile;
import com.hellblazer.catacomb.simulation.profile.BehaviorTag;

import java.util.HashSet;
import java.util.Set;

/**
 * Shared builders for simulation tests.
 *
 * @author hal.hildebrand
 */
public final class SimulationFixtures {

    private SimulationFixtures() {
    }

    /**
     * Open floor with no walls.
     */
    public static Level openLevel(int width, int height) {
        return Level.builder(width, height).fill(0, 0, width, height, TileType.FLOOR).build();
    }

    /**
     * Sees every passable cell of the level regardless of walls or distance.
     */
    public static VisibilityOracle seesEverything() {
        return (origin, radius, level) -> Set.copyOf(level.passableCells());
    }

    /**
     * Sees nothing at all.
     */
    public static VisibilityOracle blind() {
        return (origin, radius, level) -> Set.of();
    }

    /**
     * Sees every passable cell within Chebyshev radius, ignoring walls.
     */
    public static VisibilityOracle withinRadius() {
        return (origin, radius, level) -> {
            var visible = new HashSet<GridPoint>();
            for (var cell : level.passableCells()) {
                if (cell.chebyshevDistance(origin) <= radius) {
                    visible.add(cell);
                }
            }
            return visible;
        };
    }

    public static BehaviorProfile.Builder profile(String name, BehaviorTag... tags) {
        return BehaviorProfile.builder(name).withTags(tags).withAggroRange(10);
    }

    public static Monster monster(String id, BehaviorProfile profile, GridPoint position, MonsterState state) {
        return monster(id, profile, position, state, 10);
    }

    public static Monster monster(String id, BehaviorProfile profile, GridPoint position, MonsterState state,
                                  int hp) {
        return new Monster(ActorId.of(id), profile, position, hp, state, false);
    }

    public static Player player(GridPoint position) {
        return new Player(ActorId.of("player"), position, 10, 20);
    }

    public static GameState state(Level level, Player player, VisibilityOracle oracle, Monster... monsters) {
        return state(level, player, oracle, StatusEffects.none(), monsters);
    }

    public static GameState state(Level level, Player player, VisibilityOracle oracle, StatusEffects effects,
                                  Monster... monsters) {
        var state = new GameState(level, player, oracle, effects, SeededRandom.of(42L));
        for (var monster : monsters) {
            state.addMonster(monster);
        }
        return state;
    }
}
