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
 * Structural tile kinds of a level grid. Door tiles carry a separate {@link DoorState}.
 *
 * @author hal.hildebrand
 */
public enum TileType {
    WALL(false, '#'),
    FLOOR(true, '.'),
    CORRIDOR(true, ','),
    DOOR(true, '+'),
    STAIRS(true, '>');

    private final boolean walkable;
    private final char    glyph;

    TileType(boolean walkable, char glyph) {
        this.walkable = walkable;
        this.glyph = glyph;
    }

    /**
     * Whether the tile can be entered at all. Door tiles additionally depend on their door state.
     */
    public boolean isWalkable() {
        return walkable;
    }

    public char glyph() {
        return glyph;
    }
}
