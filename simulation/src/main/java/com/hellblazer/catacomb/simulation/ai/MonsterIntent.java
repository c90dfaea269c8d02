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
package com.hellblazer.catacomb.simulation.ai;

import com.hellblazer.catacomb.common.SeededRandom;
import com.hellblazer.catacomb.dungeon.path.Path;
import com.hellblazer.catacomb.geometry.GridPoint;
import com.hellblazer.catacomb.simulation.actor.MonsterState;

import java.util.Optional;

/**
 * Outcome of one monster decision: the state the monster moves to, the action it takes, and the bookkeeping to store
 * back on the monster when the decision is applied.
 *
 * @param nextState               state after the decision
 * @param action                  action to execute
 * @param path                    cached path to keep, already advanced past the chosen step; present only when
 *                                hunting
 * @param calmTurns               consecutive calm fleeing decisions
 * @param lastKnownPlayerPosition where the monster last saw the player, or null if it never has
 * @param rng                     random state after every draw the decision made
 * @author hal.hildebrand
 */
public record MonsterIntent(MonsterState nextState, MonsterAction action, Optional<Path> path, int calmTurns,
                            GridPoint lastKnownPlayerPosition, SeededRandom rng) {

    public MonsterIntent {
        if (path.isPresent() && nextState != MonsterState.HUNTING) {
            throw new IllegalArgumentException("Only hunting monsters keep a path, not " + nextState);
        }
    }
}
