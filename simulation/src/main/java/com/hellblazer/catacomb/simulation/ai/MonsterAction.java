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

import com.hellblazer.catacomb.geometry.GridPoint;
import com.hellblazer.catacomb.simulation.actor.ActorId;

/**
 * Concrete action chosen for a monster on one of its turns. Every action costs one full action's worth of energy.
 *
 * @author hal.hildebrand
 */
public sealed interface MonsterAction {

    static Wait waiting() {
        return Wait.INSTANCE;
    }

    /**
     * Step to an adjacent cell.
     */
    record Move(GridPoint target, MoveKind kind) implements MonsterAction {
    }

    /**
     * Attack the adjacent actor.
     */
    record Attack(ActorId target, GridPoint at) implements MonsterAction {
    }

    /**
     * Attempt to steal from the adjacent actor.
     */
    record Steal(ActorId target, GridPoint at) implements MonsterAction {
    }

    /**
     * Do nothing this turn.
     */
    record Wait() implements MonsterAction {
        static final Wait INSTANCE = new Wait();
    }
}
