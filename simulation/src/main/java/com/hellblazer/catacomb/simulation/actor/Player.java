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
package com.hellblazer.catacomb.simulation.actor;

import com.hellblazer.catacomb.geometry.GridPoint;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * The player character. Tracks run mode, which widens monster aggro ranges, and the last few positions, which expose
 * door slams.
 *
 * @author hal.hildebrand
 */
public final class Player extends Actor {

    public static final int HISTORY_LENGTH = 3;

    private final Deque<GridPoint> history = new ArrayDeque<>(HISTORY_LENGTH);
    private       boolean          running;

    public Player(ActorId id, GridPoint position, int speed, int hp) {
        super(id, position, speed, hp, hp);
        history.addLast(position);
    }

    @Override
    public void moveTo(GridPoint position) {
        super.moveTo(position);
        if (history.size() == HISTORY_LENGTH) {
            history.removeFirst();
        }
        history.addLast(position);
    }

    /**
     * Positions the player most recently moved through, oldest first, ending with the current position.
     */
    public List<GridPoint> getPositionHistory() {
        return List.copyOf(history);
    }

    public boolean isRunning() {
        return running;
    }

    public void setRunning(boolean running) {
        this.running = running;
    }

    @Override
    public String toString() {
        return String.format("Player[%s at %s, energy=%d, hp=%d/%d%s]", getId(), getPosition(), getEnergy(), getHp(),
                             getMaxHp(), running ? ", running" : "");
    }
}
