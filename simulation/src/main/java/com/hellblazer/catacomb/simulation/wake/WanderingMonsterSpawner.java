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
package com.hellblazer.catacomb.simulation.wake;

import com.hellblazer.catacomb.common.SeededRandom;
import com.hellblazer.catacomb.geometry.GridPoint;
import com.hellblazer.catacomb.simulation.GameState;
import com.hellblazer.catacomb.simulation.SimulationConfig;
import com.hellblazer.catacomb.simulation.actor.Monster;
import com.hellblazer.catacomb.simulation.profile.BehaviorProfileTable;
import com.hellblazer.catacomb.simulation.profile.MonsterFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Injects wandering monsters over time. The chance of a spawn starts at a base rate and grows with every turn since
 * the last one, up to a cap; no more than a configured number of living wanderers exist at once.
 * <p>
 * Wanderers never appear where the player can see them, inside the player's room, or on an occupied cell.
 *
 * @author hal.hildebrand
 */
public class WanderingMonsterSpawner {
    private static final Logger log = LoggerFactory.getLogger(WanderingMonsterSpawner.class);

    private final SimulationConfig     config;
    private final BehaviorProfileTable profiles;

    public WanderingMonsterSpawner(SimulationConfig config, BehaviorProfileTable profiles) {
        this.config = config;
        this.profiles = profiles;
    }

    /**
     * Spawn probability after a number of turns without a spawn.
     */
    public double spawnChance(long turnsSinceLastSpawn) {
        var chance = config.getWanderBaseChance() + config.getWanderChanceIncrement() * turnsSinceLastSpawn;
        return Math.min(chance, config.getWanderChanceCap());
    }

    /**
     * Roll for a wandering monster and add it to the state on success.
     *
     * @return the spawned monster, if any, and the advanced random state
     */
    public SeededRandom.Draw<Optional<Monster>> tick(GameState state, SeededRandom rng) {
        if (state.countLivingWanderers() >= config.getMaxWanderers()) {
            return new SeededRandom.Draw<>(Optional.empty(), rng);
        }
        var chance = spawnChance(state.getTurn() - state.getLastWanderingSpawnTurn());
        var roll = rng.chance(chance);
        if (!roll.value()) {
            return new SeededRandom.Draw<>(Optional.empty(), roll.next());
        }

        var candidates = candidateCells(state);
        if (candidates.isEmpty()) {
            log.debug("Wandering spawn rolled on turn {} but no hidden free cell exists", state.getTurn());
            return new SeededRandom.Draw<>(Optional.empty(), roll.next());
        }
        var cell = roll.next().pick(candidates);
        var selection = profiles.selectForDepth(state.getDepth(), cell.next());
        if (selection.value().isEmpty()) {
            return new SeededRandom.Draw<>(Optional.empty(), selection.next());
        }
        var profile = selection.value().get();
        var created = MonsterFactory.createWanderer(profile, state.nextMonsterId(profile.getName()), cell.value(),
                                                    selection.next());
        var monster = created.value();
        state.addMonster(monster);
        state.setLastWanderingSpawnTurn(state.getTurn());
        log.debug("Wandering {} spawned at {} on turn {}", profile.getName(), cell.value(), state.getTurn());
        return new SeededRandom.Draw<>(Optional.of(monster), created.next());
    }

    private List<GridPoint> candidateCells(GameState state) {
        var level = state.getLevel();
        var playerPosition = state.getPlayer().getPosition();
        var visible = state.getOracle().computeVisible(playerPosition, config.getVisionRadius(), level);
        var playerRoom = level.roomAt(playerPosition);

        var candidates = new ArrayList<GridPoint>();
        for (var cell : level.passableCells()) {
            if (visible.contains(cell) || state.isOccupied(cell)) {
                continue;
            }
            if (playerRoom.isPresent() && playerRoom.get().contains(cell)) {
                continue;
            }
            candidates.add(cell);
        }
        return candidates;
    }
}
