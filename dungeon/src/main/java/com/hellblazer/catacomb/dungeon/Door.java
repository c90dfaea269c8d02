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

import com.hellblazer.catacomb.geometry.GridPoint;

import java.util.List;
import java.util.Objects;

/**
 * A door tile and the rooms it joins. The state is changed by the player's own commands between ticks.
 *
 * @author hal.hildebrand
 */
public final class Door {
    private final GridPoint     position;
    private final List<Integer> connectsRooms;
    private       DoorState     state;

    public Door(GridPoint position, DoorState state, List<Integer> connectsRooms) {
        this.position = Objects.requireNonNull(position, "position");
        this.state = Objects.requireNonNull(state, "state");
        this.connectsRooms = List.copyOf(connectsRooms);
    }

    public GridPoint position() {
        return position;
    }

    public DoorState state() {
        return state;
    }

    public void setState(DoorState state) {
        this.state = Objects.requireNonNull(state, "state");
    }

    /**
     * Ids of the rooms this door opens onto, usually two.
     */
    public List<Integer> connectsRooms() {
        return connectsRooms;
    }

    public boolean connects(int roomId) {
        return connectsRooms.contains(roomId);
    }

    @Override
    public String toString() {
        return String.format("Door{%s, %s, rooms=%s}", position, state, connectsRooms);
    }
}
