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
package com.hellblazer.catacomb.simulation.wake;

import com.hellblazer.catacomb.common.SeededRandom;
import com.hellblazer.catacomb.dungeon.Level;
import com.hellblazer.catacomb.dungeon.VisibilityOracle;
import com.hellblazer.catacomb.geometry.GridPoint;
import com.hellblazer.catacomb.simulation.GameState;
import com.hellblazer.catacomb.simulation.SimulationConfig;
import com.hellblazer.catacomb.simulation.actor.Monster;
import com.hellblazer.catacomb.simulation.actor.MonsterState;
import com.hellblazer.catacomb.simulation.actor.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Decides when monsters notice the player.
 * <p>
 * Three sources of alarm:
 * <ol>
 *   <li>Aggro: the player is within the monster's aggro range, widened while running, and in its line of sight</li>
 *   <li>Door slam: the player steps onto a door, off it, and back; sleeping monsters in every room the noise reaches
 *   wake and hunt</li>
 *   <li>Wandering spawn: new monsters arrive over time, delegated to {@link WanderingMonsterSpawner}</li>
 * </ol>
 *
 * @author hal.hildebrand
 */
public class WakeDetector {
    private static final Logger log = LoggerFactory.getLogger(WakeDetector.class);

    private final SimulationConfig        config;
    private final WanderingMonsterSpawner spawner;

    public WakeDetector(SimulationConfig config, WanderingMonsterSpawner spawner) {
        this.config = config;
        this.spawner = spawner;
    }

    /**
     * Aggro range in effect, rounded half up when the player is running.
     */
    public int effectiveAggroRange(int aggroRange, boolean isPlayerRunning) {
        if (!isPlayerRunning) {
            return aggroRange;
        }
        return (int) Math.round(aggroRange * config.getRunningAggroMultiplier());
    }

    /**
     * Whether a monster notices the player this turn.
     *
     * @param monster         the monster looking
     * @param player          the player
     * @param level           current level
     * @param oracle          line of sight source
     * @param isPlayerRunning whether the player is in run mode
     * @return true when the player is within effective range and visible from the monster
     */
    public boolean checkAggro(Monster monster, Player player, Level level, VisibilityOracle oracle,
                              boolean isPlayerRunning) {
        int range = effectiveAggroRange(monster.getProfile().getAggroRange(), isPlayerRunning);
        if (range <= 0) {
            return false;
        }
        if (monster.getPosition().chebyshevDistance(player.getPosition()) > range) {
            return false;
        }
        return oracle.computeVisible(monster.getPosition(), range, level).contains(player.getPosition());
    }

    /**
     * Whether the player's recent moves form a door slam: standing on a door, stepping off, stepping back on.
     *
     * @param history recent positions, oldest first, ending with the current position
     * @param level   current level
     */
    public boolean isDoorSlam(List<GridPoint> history, Level level) {
        if (history.size() < 3) {
            return false;
        }
        var twoAgo = history.get(history.size() - 3);
        var previous = history.get(history.size() - 2);
        var current = history.get(history.size() - 1);
        return current.equals(twoAgo) && !previous.equals(current) && level.doorAt(current).isPresent();
    }

    /**
     * Wake every sleeping monster in a room the slam is heard in. Noise spreads from the rooms the door joins through
     * other doors, and stops at shut ones.
     *
     * @return the monsters woken, in list order
     */
    public List<Monster> onDoorSlam(GameState state, GridPoint doorPosition) {
        var level = state.getLevel();
        var door = level.doorAt(doorPosition);
        if (door.isEmpty()) {
            log.debug("No door at {}, nothing slammed", doorPosition);
            return List.of();
        }
        var heard = roomsReached(level, door.get().connectsRooms(), doorPosition);

        var woken = new ArrayList<Monster>();
        for (var monster : state.getMonsters()) {
            if (!monster.isAlive() || monster.getState() != MonsterState.SLEEPING) {
                continue;
            }
            var room = level.roomAt(monster.getPosition());
            if (room.isPresent() && heard.contains(room.get().id())) {
                monster.setState(MonsterState.HUNTING);
                monster.setLastKnownPlayerPosition(state.getPlayer().getPosition());
                woken.add(monster);
            }
        }
        log.debug("Door slam at {} heard in rooms {}, woke {}", doorPosition, heard, woken.size());
        return woken;
    }

    private Set<Integer> roomsReached(Level level, List<Integer> origin, GridPoint slammed) {
        var reached = new HashSet<Integer>(origin);
        var frontier = new ArrayDeque<Integer>(origin);
        while (!frontier.isEmpty()) {
            int room = frontier.poll();
            for (var door : level.doors()) {
                if (door.position().equals(slammed) || door.state().isShut() || !door.connects(room)) {
                    continue;
                }
                for (var next : door.connectsRooms()) {
                    if (reached.add(next)) {
                        frontier.add(next);
                    }
                }
            }
        }
        return reached;
    }

    /**
     * Roll for a wandering monster.
     *
     * @return the spawned monster, if any, and the advanced random state
     */
    public SeededRandom.Draw<Optional<Monster>> wanderingSpawnTick(GameState state, SeededRandom rng) {
        return spawner.tick(state, rng);
    }
}
