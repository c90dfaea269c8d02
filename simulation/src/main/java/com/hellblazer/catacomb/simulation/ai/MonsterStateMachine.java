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

import com.hellblazer.catacomb.simulation.SimulationConfig;
import com.hellblazer.catacomb.simulation.actor.Monster;
import com.hellblazer.catacomb.simulation.actor.MonsterState;
import com.hellblazer.catacomb.simulation.profile.BehaviorTag;

/**
 * Monster state transitions.
 * <p>
 * <pre>
 * SLEEPING  -> HUNTING   player noticed
 * WANDERING -> HUNTING   player noticed
 * HUNTING   -> FLEEING   coward below its flee threshold, or thief that has stolen
 * FLEEING   -> HUNTING   coward recovered to threshold + hysteresis
 * FLEEING   -> WANDERING player unseen for the configured number of calm decisions
 * </pre>
 * A monster that wakes is evaluated against the hunting rules in the same decision, so it never goes from asleep to
 * fleeing without passing through hunting.
 *
 * @author hal.hildebrand
 */
public class MonsterStateMachine {

    /**
     * State after a transition, with the calm decision counter to store.
     */
    public record Transition(MonsterState state, int calmTurns) {
    }

    private final SimulationConfig config;

    public MonsterStateMachine(SimulationConfig config) {
        this.config = config;
    }

    /**
     * Compute the next state. Pure: the monster is not modified.
     *
     * @param monster       the deciding monster
     * @param playerNoticed whether the aggro check succeeded this decision
     */
    public Transition next(Monster monster, boolean playerNoticed) {
        var state = monster.getState();
        int calmTurns = monster.getCalmTurns();

        if ((state == MonsterState.SLEEPING || state == MonsterState.WANDERING) && playerNoticed) {
            state = MonsterState.HUNTING;
        }

        if (state == MonsterState.FLEEING) {
            if (recovered(monster)) {
                state = MonsterState.HUNTING;
                calmTurns = 0;
            } else if (playerNoticed) {
                calmTurns = 0;
            } else if (++calmTurns >= config.getFleeCalmTurns()) {
                state = MonsterState.WANDERING;
                calmTurns = 0;
            }
        }

        if (state == MonsterState.HUNTING && shouldFlee(monster)) {
            state = MonsterState.FLEEING;
            calmTurns = 0;
        }
        return new Transition(state, calmTurns);
    }

    /**
     * Whether a hunting monster must turn and run.
     */
    public boolean shouldFlee(Monster monster) {
        var profile = monster.getProfile();
        if (profile.movementTag() == BehaviorTag.THIEF && monster.hasStolen()) {
            return true;
        }
        return profile.isCoward() && monster.getHpFraction() < profile.getFleeThreshold();
    }

    private boolean recovered(Monster monster) {
        var profile = monster.getProfile();
        if (!profile.isCoward() || shouldFlee(monster)) {
            return false;
        }
        return monster.getHpFraction() >= profile.getFleeThreshold() + config.getFleeHysteresis();
    }
}
