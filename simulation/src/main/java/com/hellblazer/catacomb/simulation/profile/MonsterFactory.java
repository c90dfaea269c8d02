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
package com.hellblazer.catacomb.simulation.profile;

import com.hellblazer.catacomb.common.SeededRandom;
import com.hellblazer.catacomb.geometry.GridPoint;
import com.hellblazer.catacomb.simulation.actor.ActorId;
import com.hellblazer.catacomb.simulation.actor.Monster;
import com.hellblazer.catacomb.simulation.actor.MonsterState;

/**
 * Creates monster instances from profiles, rolling hit points from the profile's hit dice.
 *
 * @author hal.hildebrand
 */
public final class MonsterFactory {

    private MonsterFactory() {
    }

    /**
     * Create a monster placed with the level. Mean monsters start hunting, all others asleep.
     */
    public static SeededRandom.Draw<Monster> create(BehaviorProfile profile, ActorId id, GridPoint position,
                                                    SeededRandom rng) {
        var state = profile.isMean() ? MonsterState.HUNTING : MonsterState.SLEEPING;
        return create(profile, id, position, state, false, rng);
    }

    /**
     * Create a wandering monster injected mid-level. Wanderers start awake and wandering.
     */
    public static SeededRandom.Draw<Monster> createWanderer(BehaviorProfile profile, ActorId id, GridPoint position,
                                                            SeededRandom rng) {
        return create(profile, id, position, MonsterState.WANDERING, true, rng);
    }

    private static SeededRandom.Draw<Monster> create(BehaviorProfile profile, ActorId id, GridPoint position,
                                                     MonsterState state, boolean wanderer, SeededRandom rng) {
        var hp = rng.roll(profile.getHitDice());
        var monster = new Monster(id, profile, position, Math.max(1, hp.value()), state, wanderer);
        return new SeededRandom.Draw<>(monster, hp.next());
    }
}
