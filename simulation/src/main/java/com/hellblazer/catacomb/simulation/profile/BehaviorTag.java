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

/**
 * Behavior tags attached to a monster profile. The first tag that is not a modifier selects the movement style;
 * modifiers only change state transitions.
 *
 * @author hal.hildebrand
 */
public enum BehaviorTag {
    /** A* pursuit of the last observed player position. */
    SMART,
    /** One greedy step along the sign of the offset to the player. */
    SIMPLE,
    /** Heads for the nearest reachable gold before the player. */
    GREEDY,
    /** Random steps some of the time, SIMPLE otherwise. */
    ERRATIC,
    /** Approaches, steals, then runs. */
    THIEF,
    /** Never moves. */
    STATIONARY,
    /** Flees when wounded below its profile's flee threshold. */
    COWARD;

    public boolean isModifier() {
        return this == COWARD;
    }
}
