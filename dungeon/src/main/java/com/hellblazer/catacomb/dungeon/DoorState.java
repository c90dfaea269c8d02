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
package com.hellblazer.catacomb.dungeon;

/**
 * State of a door tile.
 *
 * @author hal.hildebrand
 */
public enum DoorState {
    OPEN,
    CLOSED,
    LOCKED,
    BROKEN,
    ARCHWAY,
    /**
     * Undiscovered by the player. Monsters know the way through, but it still stops sound.
     */
    SECRET;

    /**
     * Closed and locked doors are excluded from movement and path expansion.
     */
    public boolean blocksMovement() {
        return this == CLOSED || this == LOCKED;
    }

    /**
     * Whether the door leaf is shut, which stops noise from propagating past it.
     */
    public boolean isShut() {
        return this == CLOSED || this == LOCKED || this == SECRET;
    }
}
