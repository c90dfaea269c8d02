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
package com.hellblazer.catacomb.simulation.ai;

import com.hellblazer.catacomb.common.SeededRandom;
import com.hellblazer.catacomb.dungeon.path.Path;
import com.hellblazer.catacomb.dungeon.path.PathfindingEngine;
import com.hellblazer.catacomb.geometry.GridPoint;
import com.hellblazer.catacomb.simulation.GameState;
import com.hellblazer.catacomb.simulation.actor.Monster;
import com.hellblazer.catacomb.simulation.actor.MonsterState;
import com.hellblazer.catacomb.simulation.profile.BehaviorTag;
import com.hellblazer.catacomb.simulation.wake.WakeDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Turns a monster's profile and the live world into one concrete action per turn.
 * <p>
 * A decision runs in two parts. The {@link MonsterStateMachine} settles the monster's state from the aggro check and
 * its health; then the state, and for hunters the movement tag, picks the action:
 * <ul>
 *   <li>SLEEPING waits</li>
 *   <li>WANDERING steps to a random free neighbor; STATIONARY monsters stay put</li>
 *   <li>FLEEING steps to the free neighbor farthest from the player</li>
 *   <li>HUNTING attacks or steals when adjacent, otherwise moves by its movement tag</li>
 * </ul>
 * Decisions never mutate the world. Every random draw comes from the {@link SeededRandom} passed in, and the advanced
 * state is returned in the {@link MonsterIntent}; {@link #applyIntent} stores the decision on the monster.
 * <p>
 * Usage:
 * <pre>
 * var intent = engine.decide(monster, state, state.getRng());
 * state.setRng(intent.rng());
 * engine.applyIntent(monster, intent);
 * // execute intent.action()
 * </pre>
 *
 * @author hal.hildebrand
 */
public class MonsterAIEngine {
    private static final Logger log = LoggerFactory.getLogger(MonsterAIEngine.class);

    private final PathfindingEngine   pathfinding;
    private final WakeDetector        wakeDetector;
    private final MonsterStateMachine stateMachine;

    public MonsterAIEngine(PathfindingEngine pathfinding, WakeDetector wakeDetector,
                           MonsterStateMachine stateMachine) {
        this.pathfinding = pathfinding;
        this.wakeDetector = wakeDetector;
        this.stateMachine = stateMachine;
    }

    /**
     * The action a monster would take now. Pure query: neither the monster nor the state changes.
     */
    public MonsterAction getMonsterIntent(Monster monster, GameState state) {
        return decide(monster, state, state.getRng()).action();
    }

    /**
     * Decide a monster's next state and action.
     *
     * @param monster the deciding monster
     * @param state   current world state, read only
     * @param rng     random state to draw from
     * @return the decision, carrying the advanced random state
     */
    public MonsterIntent decide(Monster monster, GameState state, SeededRandom rng) {
        var player = state.getPlayer();
        boolean noticed = wakeDetector.checkAggro(monster, player, state.getLevel(), state.getOracle(),
                                                  player.isRunning());
        var transition = stateMachine.next(monster, noticed);
        var lastKnown = noticed ? player.getPosition() : monster.getLastKnownPlayerPosition().orElse(null);
        var decision = new Decision(MonsterAction.waiting(), Optional.empty(), rng);

        switch (transition.state()) {
            case SLEEPING -> {
            }
            case WANDERING -> decision = wander(monster, state, rng);
            case FLEEING -> decision = new Decision(flee(monster, state), Optional.empty(), rng);
            case HUNTING -> decision = hunt(monster, state, lastKnown, rng);
        }
        if (log.isTraceEnabled()) {
            log.trace("{} {} -> {}: {}", monster.getId(), monster.getState(), transition.state(), decision.action());
        }
        return new MonsterIntent(transition.state(), decision.action(), decision.path(), transition.calmTurns(),
                                 lastKnown, decision.rng());
    }

    /**
     * Store a decision's state, memory and path on the monster.
     */
    public void applyIntent(Monster monster, MonsterIntent intent) {
        monster.setState(intent.nextState());
        monster.setCalmTurns(intent.calmTurns());
        monster.setLastKnownPlayerPosition(intent.lastKnownPlayerPosition());
        intent.path().ifPresentOrElse(monster::setCurrentPath, monster::invalidatePath);
    }

    private Decision hunt(Monster monster, GameState state, GridPoint lastKnown, SeededRandom rng) {
        var profile = monster.getProfile();
        var player = state.getPlayer();
        var position = monster.getPosition();
        var cached = monster.getCurrentPath();

        if (position.isAdjacentTo(player.getPosition())) {
            MonsterAction action = profile.movementTag() == BehaviorTag.THIEF && !monster.hasStolen()
                                   ? new MonsterAction.Steal(player.getId(), player.getPosition())
                                   : new MonsterAction.Attack(player.getId(), player.getPosition());
            return new Decision(action, cached, rng);
        }

        if (profile.getChaseChance() < 1.0) {
            var chase = rng.chance(profile.getChaseChance());
            rng = chase.next();
            if (!chase.value()) {
                return new Decision(MonsterAction.waiting(), cached, rng);
            }
        }

        var goal = huntGoal(position, lastKnown, player.getPosition());
        return switch (profile.movementTag()) {
            case SMART, THIEF -> smart(monster, goal, state, rng);
            // COWARD is a modifier; movementTag() never selects it
            case COWARD -> smart(monster, goal, state, rng);
            case SIMPLE -> new Decision(simpleStep(monster, player.getPosition(), state), Optional.empty(), rng);
            case GREEDY -> greedy(monster, state, rng);
            case ERRATIC -> erratic(monster, state, rng);
            case STATIONARY -> new Decision(MonsterAction.waiting(), Optional.empty(), rng);
        };
    }

    private static GridPoint huntGoal(GridPoint position, GridPoint lastKnown, GridPoint playerPosition) {
        if (lastKnown == null || lastKnown.equals(position)) {
            return playerPosition;
        }
        return lastKnown;
    }

    private Decision smart(Monster monster, GridPoint goal, GameState state, SeededRandom rng) {
        var level = state.getLevel();
        var position = monster.getPosition();
        var blocked = state.occupiedCells(monster);

        var path = monster.getCurrentPath().orElse(null);
        if (pathfinding.needsReplan(path, position, goal, level, blocked)) {
            var found = pathfinding.findPath(position, goal, level, blocked);
            if (found.isEmpty() || found.get().isEmpty()) {
                log.debug("{} cannot reach {}, stepping directly", monster.getId(), goal);
                return new Decision(simpleStep(monster, goal, state), Optional.empty(), rng);
            }
            path = found.get();
        }
        var next = path.nextWaypoint();
        return new Decision(new MonsterAction.Move(next, MoveKind.DIRECTED), Optional.of(path.advance()), rng);
    }

    private MonsterAction simpleStep(Monster monster, GridPoint goal, GameState state) {
        var position = monster.getPosition();
        var target = position.add(Integer.signum(goal.x - position.x), Integer.signum(goal.y - position.y));
        if (target.equals(position) || !canEnter(position, target, state)) {
            return MonsterAction.waiting();
        }
        return new MonsterAction.Move(target, MoveKind.DIRECTED);
    }

    private Decision greedy(Monster monster, GameState state, SeededRandom rng) {
        var level = state.getLevel();
        var position = monster.getPosition();
        var blocked = state.occupiedCells(monster);

        var piles = new ArrayList<>(level.goldPiles());
        piles.remove(position);
        piles.sort(Comparator.comparingInt(position::chebyshevDistance));
        for (var pile : piles) {
            var route = pathfinding.findPath(position, pile, level, blocked);
            if (route.isEmpty()) {
                continue;
            }
            var step = simpleStep(monster, pile, state);
            if (step instanceof MonsterAction.Wait) {
                step = new MonsterAction.Move(route.get().nextWaypoint(), MoveKind.DIRECTED);
            }
            return new Decision(step, Optional.empty(), rng);
        }
        return new Decision(simpleStep(monster, state.getPlayer().getPosition(), state), Optional.empty(), rng);
    }

    private Decision erratic(Monster monster, GameState state, SeededRandom rng) {
        var roll = rng.chance(monster.getProfile().getErraticChance());
        if (!roll.value()) {
            return new Decision(simpleStep(monster, state.getPlayer().getPosition(), state), Optional.empty(),
                                roll.next());
        }
        var options = freeNeighbors(monster, state);
        if (options.isEmpty()) {
            return new Decision(MonsterAction.waiting(), Optional.empty(), roll.next());
        }
        var pick = roll.next().pick(options);
        return new Decision(new MonsterAction.Move(pick.value(), MoveKind.ERRATIC), Optional.empty(), pick.next());
    }

    private Decision wander(Monster monster, GameState state, SeededRandom rng) {
        if (isRooted(monster)) {
            return new Decision(MonsterAction.waiting(), Optional.empty(), rng);
        }
        var options = freeNeighbors(monster, state);
        if (options.isEmpty()) {
            return new Decision(MonsterAction.waiting(), Optional.empty(), rng);
        }
        var pick = rng.pick(options);
        return new Decision(new MonsterAction.Move(pick.value(), MoveKind.WANDER), Optional.empty(), pick.next());
    }

    private MonsterAction flee(Monster monster, GameState state) {
        if (isRooted(monster) && !monster.getProfile().isCoward()) {
            return MonsterAction.waiting();
        }
        var playerPosition = state.getPlayer().getPosition();
        int best = monster.getPosition().chebyshevDistance(playerPosition);
        GridPoint target = null;
        for (var option : freeNeighbors(monster, state)) {
            int distance = option.chebyshevDistance(playerPosition);
            if (distance > best) {
                best = distance;
                target = option;
            }
        }
        return target == null ? MonsterAction.waiting() : new MonsterAction.Move(target, MoveKind.FLEE);
    }

    private List<GridPoint> freeNeighbors(Monster monster, GameState state) {
        var result = new ArrayList<GridPoint>();
        for (var neighbor : state.getLevel().passableNeighbors(monster.getPosition())) {
            if (!state.isOccupied(neighbor)) {
                result.add(neighbor);
            }
        }
        return result;
    }

    private static boolean isRooted(Monster monster) {
        return monster.getProfile().movementTag() == BehaviorTag.STATIONARY;
    }

    private static boolean canEnter(GridPoint from, GridPoint to, GameState state) {
        return state.getLevel().canStep(from, to) && !state.isOccupied(to);
    }

    private record Decision(MonsterAction action, Optional<Path> path, SeededRandom rng) {
    }
}
