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
package com.hellblazer.catacomb.simulation.schedule;

import com.hellblazer.catacomb.dungeon.DoorState;
import com.hellblazer.catacomb.geometry.Direction;
import com.hellblazer.catacomb.simulation.EncounterResolver;
import com.hellblazer.catacomb.simulation.GameState;

/**
 * An action the player takes on its turn.
 *
 * @author hal.hildebrand
 */
public interface PlayerAction {

    static PlayerAction move(Direction direction) {
        return new Move(direction, false);
    }

    static PlayerAction run(Direction direction) {
        return new Move(direction, true);
    }

    static PlayerAction rest() {
        return Rest.INSTANCE;
    }

    /**
     * Energy the action consumes.
     */
    default int cost() {
        return EnergyScheduler.ACTION_COST;
    }

    void apply(GameState state, EncounterResolver resolver);

    /**
     * Step one cell. Stepping into a monster attacks it; stepping into a closed door opens it without moving; walls
     * and locked doors stop the player in place.
     */
    record Move(Direction direction, boolean running) implements PlayerAction {

        @Override
        public void apply(GameState state, EncounterResolver resolver) {
            var player = state.getPlayer();
            var level = state.getLevel();
            var target = player.getPosition().step(direction);

            var monster = state.monsterAt(target);
            if (monster.isPresent()) {
                player.setRunning(false);
                resolver.resolvePlayerAttack(player, monster.get(), state);
                return;
            }
            var door = level.doorAt(target);
            if (door.isPresent() && door.get().state() == DoorState.CLOSED) {
                door.get().setState(DoorState.OPEN);
                player.setRunning(false);
                return;
            }
            if (!level.canStep(player.getPosition(), target)) {
                player.setRunning(false);
                return;
            }
            player.moveTo(target);
            player.setRunning(running);
        }
    }

    /**
     * Spend the turn in place.
     */
    record Rest() implements PlayerAction {
        static final Rest INSTANCE = new Rest();

        @Override
        public void apply(GameState state, EncounterResolver resolver) {
            state.getPlayer().setRunning(false);
        }
    }
}
