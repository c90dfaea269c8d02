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

import com.hellblazer.catacomb.simulation.actor.Monster;
import com.hellblazer.catacomb.simulation.actor.Player;

/**
 * Resolves the outcome of hostile contact between the player and monsters. Damage, hit rolls, loot and item theft
 * live behind this interface; the scheduler only decides when contact happens.
 * <p>
 * Implementations adjust hit points on the actors they are handed. A monster reduced to zero hit points is skipped
 * for the rest of the tick and removed when the tick ends.
 *
 * @author hal.hildebrand
 */
public interface EncounterResolver {

    /**
     * A monster attacks the adjacent player.
     */
    void resolveAttack(Monster attacker, Player target, GameState state);

    /**
     * A thief attempts to steal from the adjacent player.
     *
     * @return true if something was stolen
     */
    boolean resolveSteal(Monster thief, Player target, GameState state);

    /**
     * The player bumps into a monster.
     */
    void resolvePlayerAttack(Player attacker, Monster target, GameState state);
}
