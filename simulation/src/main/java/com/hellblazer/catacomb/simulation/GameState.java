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

import com.hellblazer.catacomb.common.SeededRandom;
import com.hellblazer.catacomb.dungeon.Level;
import com.hellblazer.catacomb.dungeon.VisibilityOracle;
import com.hellblazer.catacomb.geometry.GridPoint;
import com.hellblazer.catacomb.simulation.actor.Actor;
import com.hellblazer.catacomb.simulation.actor.ActorId;
import com.hellblazer.catacomb.simulation.actor.Monster;
import com.hellblazer.catacomb.simulation.actor.Player;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable world state for one level: the level itself, the player, the ordered monster list, the turn counter and
 * the threaded random state.
 * <p>
 * The monster list order is the order monsters act within a tick. A single writer, the scheduler, mutates this state;
 * decision code reads it.
 *
 * @author hal.hildebrand
 */
public class GameState {

    private final Level            level;
    private final Player           player;
    private final List<Monster>    monsters = new ArrayList<>();
    private final VisibilityOracle oracle;
    private final StatusEffects    statusEffects;
    private       SeededRandom     rng;
    private       long             turn;
    private       long             lastWanderingSpawnTurn;
    private       int              nextSerial;

    public GameState(Level level, Player player, VisibilityOracle oracle, StatusEffects statusEffects,
                     SeededRandom rng) {
        this.level = Objects.requireNonNull(level, "level");
        this.player = Objects.requireNonNull(player, "player");
        this.oracle = Objects.requireNonNull(oracle, "oracle");
        this.statusEffects = Objects.requireNonNull(statusEffects, "statusEffects");
        this.rng = Objects.requireNonNull(rng, "rng");
    }

    public Level getLevel() {
        return level;
    }

    public int getDepth() {
        return level.depth();
    }

    public Player getPlayer() {
        return player;
    }

    /**
     * Monsters in acting order, including any killed this tick and not yet removed.
     */
    public List<Monster> getMonsters() {
        return Collections.unmodifiableList(monsters);
    }

    public void addMonster(Monster monster) {
        if (containsMonster(monster)) {
            throw new IllegalArgumentException(monster.getId() + " is already on the level");
        }
        monsters.add(monster);
    }

    public boolean removeMonster(Monster monster) {
        return monsters.removeIf(m -> m == monster);
    }

    public boolean containsMonster(Monster monster) {
        for (var m : monsters) {
            if (m == monster) {
                return true;
            }
        }
        return false;
    }

    /**
     * Remove every dead monster.
     *
     * @return the removed monsters in list order
     */
    public List<Monster> removeDeadMonsters() {
        var dead = new ArrayList<Monster>();
        for (var monster : monsters) {
            if (!monster.isAlive()) {
                dead.add(monster);
            }
        }
        monsters.removeAll(dead);
        return dead;
    }

    /**
     * The player followed by every monster, in acting order.
     */
    public List<Actor> actors() {
        var actors = new ArrayList<Actor>(monsters.size() + 1);
        actors.add(player);
        actors.addAll(monsters);
        return actors;
    }

    public Optional<Monster> monsterAt(GridPoint point) {
        for (var monster : monsters) {
            if (monster.isAlive() && monster.getPosition().equals(point)) {
                return Optional.of(monster);
            }
        }
        return Optional.empty();
    }

    /**
     * Whether the player or a living monster stands on a cell.
     */
    public boolean isOccupied(GridPoint point) {
        return player.getPosition().equals(point) || monsterAt(point).isPresent();
    }

    /**
     * Cells held by the player and every living monster other than the given one.
     */
    public Set<GridPoint> occupiedCells(Monster except) {
        var cells = new HashSet<GridPoint>();
        cells.add(player.getPosition());
        for (var monster : monsters) {
            if (monster != except && monster.isAlive()) {
                cells.add(monster.getPosition());
            }
        }
        return cells;
    }

    public long countLivingWanderers() {
        return monsters.stream().filter(m -> m.isAlive() && m.isWanderer()).count();
    }

    /**
     * Mint a fresh monster id, unique within this state.
     */
    public ActorId nextMonsterId(String prefix) {
        return ActorId.of(prefix + "-" + (++nextSerial));
    }

    public VisibilityOracle getOracle() {
        return oracle;
    }

    public StatusEffects getStatusEffects() {
        return statusEffects;
    }

    public SeededRandom getRng() {
        return rng;
    }

    public void setRng(SeededRandom rng) {
        this.rng = Objects.requireNonNull(rng, "rng");
    }

    public long getTurn() {
        return turn;
    }

    public void incrementTurn() {
        turn++;
    }

    public long getLastWanderingSpawnTurn() {
        return lastWanderingSpawnTurn;
    }

    public void setLastWanderingSpawnTurn(long lastWanderingSpawnTurn) {
        this.lastWanderingSpawnTurn = lastWanderingSpawnTurn;
    }

    public boolean isGameOver() {
        return !player.isAlive();
    }

    @Override
    public String toString() {
        return String.format("GameState[turn=%d, depth=%d, %s, monsters=%d]", turn, level.depth(), player,
                             monsters.size());
    }
}
