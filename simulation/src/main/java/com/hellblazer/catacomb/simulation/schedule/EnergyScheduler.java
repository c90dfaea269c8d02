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

import com.hellblazer.catacomb.dungeon.path.PathfindingEngine;
import com.hellblazer.catacomb.simulation.EncounterResolver;
import com.hellblazer.catacomb.simulation.GameState;
import com.hellblazer.catacomb.simulation.SimulationConfig;
import com.hellblazer.catacomb.simulation.StatusEffect;
import com.hellblazer.catacomb.simulation.StatusEffects;
import com.hellblazer.catacomb.simulation.actor.Actor;
import com.hellblazer.catacomb.simulation.actor.ActorId;
import com.hellblazer.catacomb.simulation.actor.Monster;
import com.hellblazer.catacomb.simulation.actor.MonsterState;
import com.hellblazer.catacomb.simulation.ai.MonsterAIEngine;
import com.hellblazer.catacomb.simulation.ai.MonsterAction;
import com.hellblazer.catacomb.simulation.ai.MonsterStateMachine;
import com.hellblazer.catacomb.simulation.profile.BehaviorProfileTable;
import com.hellblazer.catacomb.simulation.profile.BehaviorTag;
import com.hellblazer.catacomb.simulation.wake.WakeDetector;
import com.hellblazer.catacomb.simulation.wake.WanderingMonsterSpawner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Energy-based turn scheduler.
 * <p>
 * Every actor banks energy at its speed each grant phase and acts whenever it holds {@link #ACTION_COST}. A tick
 * proceeds:
 * <ol>
 *   <li>Grant energy to every actor, repeating until the player can act</li>
 *   <li>The player acts until its energy falls below {@link #ACTION_COST}; a door slam wakes the rooms that hear
 *   it</li>
 *   <li>If the player is alive, each monster in list order acts for as long as its energy allows, then a wandering
 *   monster is rolled for and the turn counter advances</li>
 *   <li>Remove the dead</li>
 * </ol>
 * Monsters act one after another against the live state, so a later monster sees where earlier ones moved.
 * <p>
 * Usage:
 * <pre>
 * var scheduler = EnergyScheduler.create(SimulationConfig.defaultConfig(), BehaviorProfileTable.loadDefault(),
 *                                        resolver);
 * while (!state.isGameOver()) {
 *     var report = scheduler.advanceTick(state, controller);
 *     log.debug("Turn {}: {} monster actions", report.turn(), report.monsterTurns().size());
 * }
 * </pre>
 *
 * @author hal.hildebrand
 */
public class EnergyScheduler {
    private static final Logger log = LoggerFactory.getLogger(EnergyScheduler.class);

    /**
     * Energy required for, and spent by, one action.
     */
    public static final int ACTION_COST = 100;

    /**
     * Speed of an ordinary actor: one action every ten grant phases.
     */
    public static final int NORMAL_SPEED = 10;

    private final SimulationConfig  config;
    private final MonsterAIEngine   ai;
    private final WakeDetector      wakeDetector;
    private final EncounterResolver resolver;

    public EnergyScheduler(SimulationConfig config, MonsterAIEngine ai, WakeDetector wakeDetector,
                           EncounterResolver resolver) {
        this.config = config;
        this.ai = ai;
        this.wakeDetector = wakeDetector;
        this.resolver = resolver;
        if (!config.isVerifyGrants()) {
            log.warn("Energy grant verification is disabled");
        }
    }

    /**
     * Wire a scheduler and its decision core from a configuration and a profile table.
     */
    public static EnergyScheduler create(SimulationConfig config, BehaviorProfileTable profiles,
                                         EncounterResolver resolver) {
        var wakeDetector = new WakeDetector(config, new WanderingMonsterSpawner(config, profiles));
        var ai = new MonsterAIEngine(new PathfindingEngine(config.getPathfinding()), wakeDetector,
                                     new MonsterStateMachine(config));
        return new EnergyScheduler(config, ai, wakeDetector, resolver);
    }

    /**
     * Energy an actor gains per grant phase: its speed, doubled when hasted, halved (never below one) when slowed.
     */
    public int computeGrant(Actor actor, StatusEffects effects) {
        int grant = actor.getSpeed();
        if (effects.hasStatus(actor, StatusEffect.HASTED)) {
            grant *= 2;
        }
        if (effects.hasStatus(actor, StatusEffect.SLOWED)) {
            grant = Math.max(1, grant / 2);
        }
        return grant;
    }

    /**
     * Run one grant phase: the player and every monster receive their grant.
     *
     * @throws SchedulerInvariantException if an actor's energy did not rise by exactly its computed grant
     */
    public void grantEnergyToAllActors(GameState state) {
        for (var actor : state.actors()) {
            int before = actor.getEnergy();
            int grant = computeGrant(actor, state.getStatusEffects());
            applyGrant(actor, grant);
            if (config.isVerifyGrants() && actor.getEnergy() != before + grant) {
                throw new SchedulerInvariantException(
                String.format("%s gained %d energy, expected %d", actor.getId(), actor.getEnergy() - before, grant));
            }
        }
    }

    /**
     * Credit a computed grant to an actor.
     */
    protected void applyGrant(Actor actor, int grant) {
        actor.addEnergy(grant);
    }

    public boolean canAct(Actor actor) {
        return actor.getEnergy() >= ACTION_COST;
    }

    /**
     * Spend energy on an action.
     *
     * @throws SchedulerInvariantException if the actor holds less energy than the cost
     */
    public void consumeEnergy(Actor actor, int cost) {
        if (cost < 0) {
            throw new IllegalArgumentException("Cost cannot be negative: " + cost);
        }
        if (actor.getEnergy() < cost) {
            throw new SchedulerInvariantException(
            String.format("%s cannot spend %d energy, holds %d", actor.getId(), cost, actor.getEnergy()));
        }
        actor.setEnergy(actor.getEnergy() - cost);
    }

    /**
     * The action a monster would take now, without changing anything.
     */
    public MonsterAction getMonsterIntent(Monster monster, GameState state) {
        return ai.getMonsterIntent(monster, state);
    }

    /**
     * Advance the simulation by one player turn. A player whose grant exceeds {@link #ACTION_COST} may act more than
     * once before the monsters do.
     *
     * @param state      world state, mutated in place
     * @param controller source of the player's actions, asked once per action
     * @return what happened
     * @throws IllegalStateException       if the player is already dead
     * @throws SchedulerInvariantException if the controller supplies an action that costs no energy
     */
    public TickReport advanceTick(GameState state, PlayerController controller) {
        var player = state.getPlayer();
        if (state.isGameOver()) {
            throw new IllegalStateException("Cannot advance turn " + state.getTurn() + ": the player is dead");
        }

        int phases = 0;
        do {
            grantEnergyToAllActors(state);
            if (++phases > ACTION_COST) {
                throw new SchedulerInvariantException(
                String.format("%s still cannot act after %d grant phases", player.getId(), phases));
            }
        } while (!canAct(player));

        var actions = new ArrayList<PlayerAction>();
        var woken = new ArrayList<ActorId>();
        while (canAct(player) && player.isAlive()) {
            var origin = player.getPosition();
            var action = controller.nextAction(state);
            if (action.cost() <= 0) {
                throw new SchedulerInvariantException(
                String.format("%s chose %s, which costs no energy", player.getId(), action));
            }
            action.apply(state, resolver);
            consumeEnergy(player, action.cost());
            actions.add(action);

            if (!player.getPosition().equals(origin) && wakeDetector.isDoorSlam(player.getPositionHistory(),
                                                                                state.getLevel())) {
                for (var monster : wakeDetector.onDoorSlam(state, player.getPosition())) {
                    woken.add(monster.getId());
                }
            }
        }

        var turn = state.getTurn();
        var turns = new ArrayList<TickReport.MonsterTurn>();
        Optional<ActorId> spawned = Optional.empty();
        if (player.isAlive()) {
            runMonsters(state, turns);
            if (player.isAlive()) {
                var spawn = wakeDetector.wanderingSpawnTick(state, state.getRng());
                state.setRng(spawn.next());
                spawned = spawn.value().map(Monster::getId);
            }
            state.incrementTurn();
        }

        var removed = new ArrayList<ActorId>();
        for (var dead : state.removeDeadMonsters()) {
            removed.add(dead.getId());
        }
        return new TickReport(turn, phases, actions, turns, woken, spawned, removed, !player.isAlive());
    }

    private void runMonsters(GameState state, List<TickReport.MonsterTurn> turns) {
        var player = state.getPlayer();
        for (var monster : List.copyOf(state.getMonsters())) {
            if (!player.isAlive()) {
                log.debug("Player died on turn {}, remaining monsters skipped", state.getTurn());
                return;
            }
            while (canAct(monster)) {
                if (!monster.isAlive() || !state.containsMonster(monster)) {
                    log.debug("Skipping stale monster {}", monster.getId());
                    break;
                }
                var intent = ai.decide(monster, state, state.getRng());
                state.setRng(intent.rng());
                ai.applyIntent(monster, intent);
                boolean applied = execute(monster, intent.action(), state);
                consumeEnergy(monster, ACTION_COST);
                turns.add(new TickReport.MonsterTurn(monster.getId(), intent.action(), applied));
                if (!player.isAlive()) {
                    break;
                }
            }
        }
    }

    private boolean execute(Monster monster, MonsterAction action, GameState state) {
        var player = state.getPlayer();
        if (action instanceof MonsterAction.Move move) {
            var target = move.target();
            if (!state.getLevel().canStep(monster.getPosition(), target) || state.isOccupied(target)) {
                log.debug("{} move to {} rejected", monster.getId(), target);
                monster.invalidatePath();
                return false;
            }
            monster.moveTo(target);
            if (monster.getProfile().movementTag() == BehaviorTag.GREEDY && state.getLevel().collectGold(target)) {
                log.debug("{} picked up gold at {}", monster.getId(), target);
            }
            return true;
        }
        if (action instanceof MonsterAction.Attack) {
            if (!monster.getPosition().isAdjacentTo(player.getPosition())) {
                return false;
            }
            resolver.resolveAttack(monster, player, state);
            return true;
        }
        if (action instanceof MonsterAction.Steal) {
            if (!monster.getPosition().isAdjacentTo(player.getPosition())) {
                return false;
            }
            if (resolver.resolveSteal(monster, player, state)) {
                monster.setHasStolen(true);
                monster.setState(MonsterState.FLEEING);
                monster.setCalmTurns(0);
                log.debug("{} stole from {} and flees", monster.getId(), player.getId());
            }
            return true;
        }
        return true;
    }
}
