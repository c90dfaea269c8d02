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
package com.hellblazer.catacomb.simulation.schedule;

import com.hellblazer.catacomb.simulation.actor.ActorId;
import com.hellblazer.catacomb.simulation.ai.MonsterAction;

import java.util.List;
import java.util.Optional;

/**
 * What happened during one scheduler tick.
 *
 * @param turn            turn number the tick completed; the counter does not advance if the player died before
 *                        the monsters acted
 * @param grantPhases     number of energy grant phases run before the player could act
 * @param playerActions   the player's actions, in order; more than one when the player's energy allows
 * @param monsterTurns    every monster action, in execution order
 * @param wokenByDoorSlam monsters woken by a door slam this tick
 * @param spawned         wandering monster injected at the end of the tick
 * @param removed         dead monsters removed at the end of the tick
 * @param playerDead      whether the player died during the tick
 * @author hal.hildebrand
 */
public record TickReport(long turn, int grantPhases, List<PlayerAction> playerActions,
                         List<MonsterTurn> monsterTurns, List<ActorId> wokenByDoorSlam, Optional<ActorId> spawned,
                         List<ActorId> removed, boolean playerDead) {

    /**
     * One monster action.
     *
     * @param monster the acting monster
     * @param action  the action it chose
     * @param applied false when the world rejected the action, such as a move onto a cell taken earlier in the tick
     */
    public record MonsterTurn(ActorId monster, MonsterAction action, boolean applied) {
    }

    public TickReport {
        playerActions = List.copyOf(playerActions);
        monsterTurns = List.copyOf(monsterTurns);
        wokenByDoorSlam = List.copyOf(wokenByDoorSlam);
        removed = List.copyOf(removed);
    }

    /**
     * Number of actions taken by one monster this tick.
     */
    public long actionsBy(ActorId monster) {
        return monsterTurns.stream().filter(t -> t.monster().equals(monster)).count();
    }
}
