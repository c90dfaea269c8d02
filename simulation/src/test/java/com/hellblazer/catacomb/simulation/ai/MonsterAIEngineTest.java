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

import com.hellblazer.catacomb.dungeon.Level;
import com.hellblazer.catacomb.dungeon.TileType;
import com.hellblazer.catacomb.dungeon.path.PathfindingEngine;
import com.hellblazer.catacomb.geometry.GridPoint;
import com.hellblazer.catacomb.simulation.GameState;
import com.hellblazer.catacomb.simulation.SimulationConfig;
import com.hellblazer.catacomb.simulation.actor.Monster;
import com.hellblazer.catacomb.simulation.actor.MonsterState;
import com.hellblazer.catacomb.simulation.profile.BehaviorProfileTable;
import com.hellblazer.catacomb.simulation.profile.BehaviorTag;
import com.hellblazer.catacomb.simulation.wake.WakeDetector;
import com.hellblazer.catacomb.simulation.wake.WanderingMonsterSpawner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static com.hellblazer.catacomb.simulation.SimulationFixtures.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Tests for MonsterAIEngine decisions across states and movement tags.
 *
 * @author hal.hildebrand
 */
class MonsterAIEngineTest {

    private PathfindingEngine pathfinding;
    private MonsterAIEngine   engine;

    @BeforeEach
    void setUp() {
        var config = SimulationConfig.defaultConfig();
        pathfinding = spy(new PathfindingEngine(config.getPathfinding()));
        var wakeDetector = new WakeDetector(config,
                                            new WanderingMonsterSpawner(config, new BehaviorProfileTable(List.of())));
        engine = new MonsterAIEngine(pathfinding, wakeDetector, new MonsterStateMachine(config));
    }

    private MonsterIntent decide(Monster monster, GameState state) {
        return engine.decide(monster, state, state.getRng());
    }

    private static Level wallBetween() {
        return Level.builder(
            "#######",
            "#..#..#",
            "#..#..#",
            "#.....#",
            "#######").build();
    }

    @Test
    void testSmartFollowsAStarAroundWall() {
        var smart = monster("m", profile("Centaur", BehaviorTag.SMART).build(), GridPoint.of(1, 1),
                            MonsterState.HUNTING);
        var state = state(wallBetween(), player(GridPoint.of(5, 1)), seesEverything(), smart);

        var intent = decide(smart, state);
        assertEquals(new MonsterAction.Move(GridPoint.of(2, 2), MoveKind.DIRECTED), intent.action());
        assertEquals(List.of(GridPoint.of(3, 3), GridPoint.of(4, 2), GridPoint.of(5, 1)),
                     intent.path().orElseThrow().waypoints(), "Cached path is advanced past the chosen step");
        assertEquals(GridPoint.of(5, 1), intent.lastKnownPlayerPosition());
    }

    @Test
    void testSmartReusesCachedPath() {
        var smart = monster("m", profile("Centaur", BehaviorTag.SMART).build(), GridPoint.of(1, 1),
                            MonsterState.HUNTING);
        var state = state(wallBetween(), player(GridPoint.of(5, 1)), seesEverything(), smart);

        var first = decide(smart, state);
        engine.applyIntent(smart, first);
        smart.moveTo(((MonsterAction.Move) first.action()).target());

        var second = decide(smart, state);
        assertEquals(new MonsterAction.Move(GridPoint.of(3, 3), MoveKind.DIRECTED), second.action());
        verify(pathfinding, times(1)).findPath(any(), any(), any(), any());
    }

    @Test
    void testSmartReplansWhenPlayerMovesAway() {
        var smart = monster("m", profile("Centaur", BehaviorTag.SMART).build(), GridPoint.of(1, 1),
                            MonsterState.HUNTING);
        var player = player(GridPoint.of(5, 1));
        var state = state(wallBetween(), player, seesEverything(), smart);

        engine.applyIntent(smart, decide(smart, state));
        player.moveTo(GridPoint.of(5, 3));
        decide(smart, state);

        verify(pathfinding, times(2)).findPath(any(), any(), any(), any());
    }

    @Test
    void testSmartDegradesToDirectStepWhenUnreachable() {
        var level = Level.builder(
            "#######",
            "#...###",
            "#...#.#",
            "#...###",
            "#######").build();
        var smart = monster("m", profile("Centaur", BehaviorTag.SMART).build(), GridPoint.of(1, 2),
                            MonsterState.HUNTING);
        var state = state(level, player(GridPoint.of(5, 2)), seesEverything(), smart);

        var intent = decide(smart, state);
        assertEquals(new MonsterAction.Move(GridPoint.of(2, 2), MoveKind.DIRECTED), intent.action());
        assertTrue(intent.path().isEmpty());
    }

    @Test
    void testSimpleStepsBySign() {
        var simple = monster("m", profile("Rat", BehaviorTag.SIMPLE).build(), GridPoint.of(0, 0),
                             MonsterState.HUNTING);
        var state = state(openLevel(6, 6), player(GridPoint.of(3, 2)), seesEverything(), simple);

        assertEquals(new MonsterAction.Move(GridPoint.of(1, 1), MoveKind.DIRECTED), decide(simple, state).action());
    }

    @Test
    void testSimpleStallsAgainstWall() {
        var level = Level.builder(
            "#####",
            "#.#.#",
            "#####").build();
        var simple = monster("m", profile("Rat", BehaviorTag.SIMPLE).build(), GridPoint.of(1, 1),
                             MonsterState.HUNTING);
        var state = state(level, player(GridPoint.of(3, 1)), seesEverything(), simple);

        assertEquals(MonsterAction.waiting(), decide(simple, state).action());
    }

    @Test
    void testSimpleStallsAgainstAnotherMonster() {
        var rat = profile("Rat", BehaviorTag.SIMPLE).build();
        var first = monster("a", rat, GridPoint.of(1, 1), MonsterState.HUNTING);
        var second = monster("b", rat, GridPoint.of(0, 1), MonsterState.HUNTING);
        var state = state(openLevel(5, 3), player(GridPoint.of(3, 1)), seesEverything(), first, second);

        assertEquals(MonsterAction.waiting(), decide(second, state).action());
    }

    @Test
    void testGreedyHeadsForGold() {
        var level = Level.builder(5, 5).fill(0, 0, 5, 5, TileType.FLOOR).gold(0, 4).build();
        var orc = monster("o", profile("Orc", BehaviorTag.GREEDY).build(), GridPoint.of(2, 2), MonsterState.HUNTING);
        var state = state(level, player(GridPoint.of(4, 2)), seesEverything(), orc);

        assertEquals(new MonsterAction.Move(GridPoint.of(1, 3), MoveKind.DIRECTED), decide(orc, state).action());
    }

    @Test
    void testGreedyWithoutGoldChasesPlayer() {
        var orc = monster("o", profile("Orc", BehaviorTag.GREEDY).build(), GridPoint.of(2, 2), MonsterState.HUNTING);
        var state = state(openLevel(5, 5), player(GridPoint.of(4, 2)), seesEverything(), orc);

        assertEquals(new MonsterAction.Move(GridPoint.of(3, 2), MoveKind.DIRECTED), decide(orc, state).action());
    }

    @Test
    void testGreedyIgnoresUnreachableGold() {
        var level = Level.builder(
            "#######",
            "#....##",
            "#....#.",
            "#....##",
            "#######").gold(6, 2).build();
        var orc = monster("o", profile("Orc", BehaviorTag.GREEDY).build(), GridPoint.of(3, 2), MonsterState.HUNTING);
        var state = state(level, player(GridPoint.of(1, 2)), seesEverything(), orc);

        assertEquals(new MonsterAction.Move(GridPoint.of(2, 2), MoveKind.DIRECTED), decide(orc, state).action());
    }

    @Test
    void testErraticExtremes() {
        var always = monster("b", profile("Bat", BehaviorTag.ERRATIC).withErraticChance(1.0).build(),
                             GridPoint.of(2, 2), MonsterState.HUNTING);
        var never = monster("k", profile("Kestrel", BehaviorTag.ERRATIC).withErraticChance(0.0).build(),
                            GridPoint.of(2, 2), MonsterState.HUNTING);
        var player = player(GridPoint.of(5, 2));

        var move = (MonsterAction.Move) decide(always, state(openLevel(7, 5), player, seesEverything(), always))
        .action();
        assertEquals(MoveKind.ERRATIC, move.kind());
        assertTrue(move.target().isAdjacentTo(GridPoint.of(2, 2)));

        assertEquals(new MonsterAction.Move(GridPoint.of(3, 2), MoveKind.DIRECTED),
                     decide(never, state(openLevel(7, 5), player, seesEverything(), never)).action());
    }

    @Test
    void testAdjacentMonstersAttack() {
        var player = player(GridPoint.of(2, 2));
        for (var tag : List.of(BehaviorTag.SMART, BehaviorTag.SIMPLE, BehaviorTag.GREEDY, BehaviorTag.ERRATIC,
                               BehaviorTag.STATIONARY)) {
            var monster = monster("m", profile("M", tag).build(), GridPoint.of(3, 3), MonsterState.HUNTING);
            var state = state(openLevel(5, 5), player, seesEverything(), monster);
            assertEquals(new MonsterAction.Attack(player.getId(), player.getPosition()), decide(monster, state).action(),
                         tag.name());
        }
    }

    @Test
    void testAdjacentThiefSteals() {
        var player = player(GridPoint.of(2, 2));
        var thief = monster("l", profile("Leprechaun", BehaviorTag.THIEF).build(), GridPoint.of(2, 1),
                            MonsterState.HUNTING);
        var state = state(openLevel(5, 5), player, seesEverything(), thief);

        assertEquals(new MonsterAction.Steal(player.getId(), player.getPosition()), decide(thief, state).action());
    }

    @Test
    void testThiefThatHasStolenRunsAway() {
        var player = player(GridPoint.of(1, 2));
        var thief = monster("l", profile("Leprechaun", BehaviorTag.THIEF).build(), GridPoint.of(2, 2),
                            MonsterState.HUNTING);
        thief.setHasStolen(true);
        var state = state(openLevel(7, 5), player, seesEverything(), thief);

        var intent = decide(thief, state);
        assertEquals(MonsterState.FLEEING, intent.nextState());
        assertEquals(new MonsterAction.Move(GridPoint.of(3, 1), MoveKind.FLEE), intent.action(),
                     "First neighbor in direction order that increases distance");
        assertTrue(intent.path().isEmpty());
    }

    @Test
    void testCorneredFleeingMonsterWaits() {
        var level = Level.builder(
            "#####",
            "#..##",
            "#####").build();
        var coward = profile("Jackal", BehaviorTag.SIMPLE, BehaviorTag.COWARD).withFleeThreshold(0.5).build();
        var monster = monster("j", coward, GridPoint.of(1, 1), MonsterState.HUNTING, 10);
        monster.setHp(2);
        var state = state(level, player(GridPoint.of(2, 1)), seesEverything(), monster);

        var intent = decide(monster, state);
        assertEquals(MonsterState.FLEEING, intent.nextState());
        assertEquals(MonsterAction.waiting(), intent.action());
    }

    @Test
    void testStationaryNeverMoves() {
        var flytrap = monster("f", profile("Venus Flytrap", BehaviorTag.STATIONARY).build(), GridPoint.of(0, 0),
                              MonsterState.HUNTING);
        var state = state(openLevel(6, 6), player(GridPoint.of(4, 4)), seesEverything(), flytrap);

        assertEquals(MonsterAction.waiting(), decide(flytrap, state).action());
    }

    @Test
    void testWanderingFlytrapStaysRooted() {
        var flytrap = BehaviorProfileTable.loadDefault().get("Venus Flytrap").orElseThrow();
        assertTrue(BehaviorProfileTable.isEligible(flytrap, 4), "Offered to wandering spawns from depth 4");
        var wanderer = monster("f", flytrap, GridPoint.of(2, 2), MonsterState.WANDERING);
        var state = state(openLevel(5, 5), player(GridPoint.of(4, 4)), blind(), wanderer);

        var rng = state.getRng();
        for (int i = 0; i < 20; i++) {
            var intent = decide(wanderer, state);
            assertEquals(MonsterState.WANDERING, intent.nextState());
            assertEquals(MonsterAction.waiting(), intent.action());
            assertEquals(rng, intent.rng(), "No draw for a monster that cannot move");
        }
    }

    @Test
    void testFleeingStationaryWaitsUnlessCoward() {
        var rooted = monster("f", profile("Venus Flytrap", BehaviorTag.STATIONARY).build(), GridPoint.of(2, 2),
                             MonsterState.FLEEING);
        var state = state(openLevel(7, 5), player(GridPoint.of(1, 2)), seesEverything(), rooted);
        assertEquals(MonsterAction.waiting(), decide(rooted, state).action());

        var timid = profile("Shrinking Violet", BehaviorTag.STATIONARY, BehaviorTag.COWARD).withFleeThreshold(0.5)
                                                                                           .build();
        var coward = monster("v", timid, GridPoint.of(2, 2), MonsterState.FLEEING, 10);
        coward.setHp(2);
        var cowardState = state(openLevel(7, 5), player(GridPoint.of(1, 2)), seesEverything(), coward);
        assertEquals(new MonsterAction.Move(GridPoint.of(3, 1), MoveKind.FLEE), decide(coward, cowardState).action());
    }

    @Test
    void testFailedChaseRollWaits() {
        var lazy = monster("h", profile("Hobgoblin", BehaviorTag.SIMPLE).withChaseChance(0.0).build(),
                           GridPoint.of(0, 0), MonsterState.HUNTING);
        var state = state(openLevel(6, 6), player(GridPoint.of(4, 4)), seesEverything(), lazy);

        var intent = decide(lazy, state);
        assertEquals(MonsterAction.waiting(), intent.action());
        assertNotEquals(state.getRng(), intent.rng(), "The chase roll consumed a draw");
    }

    @Test
    void testSleepingMonsterWaits() {
        var sleeper = monster("s", profile("Aquator", BehaviorTag.SIMPLE).build(), GridPoint.of(0, 0),
                              MonsterState.SLEEPING);
        var state = state(openLevel(6, 6), player(GridPoint.of(4, 4)), blind(), sleeper);

        var intent = decide(sleeper, state);
        assertEquals(MonsterState.SLEEPING, intent.nextState());
        assertEquals(MonsterAction.waiting(), intent.action());
    }

    @Test
    void testSleepingMonsterThatNoticesActsImmediately() {
        var sleeper = monster("s", profile("Aquator", BehaviorTag.SIMPLE).build(), GridPoint.of(0, 0),
                              MonsterState.SLEEPING);
        var state = state(openLevel(6, 6), player(GridPoint.of(4, 4)), seesEverything(), sleeper);

        var intent = decide(sleeper, state);
        assertEquals(MonsterState.HUNTING, intent.nextState());
        assertEquals(new MonsterAction.Move(GridPoint.of(1, 1), MoveKind.DIRECTED), intent.action());
    }

    @Test
    void testWanderingStepsRandomly() {
        var wanderer = monster("w", profile("Snake", BehaviorTag.SIMPLE).build(), GridPoint.of(2, 2),
                               MonsterState.WANDERING);
        var state = state(openLevel(5, 5), player(GridPoint.of(4, 4)), blind(), wanderer);

        var intent = decide(wanderer, state);
        assertEquals(MonsterState.WANDERING, intent.nextState());
        var move = (MonsterAction.Move) intent.action();
        assertEquals(MoveKind.WANDER, move.kind());
        assertTrue(move.target().isAdjacentTo(GridPoint.of(2, 2)));
        assertFalse(move.target().equals(GridPoint.of(4, 4)));
    }

    @Test
    void testIntentQueryDoesNotMutate() {
        var bat = monster("b", profile("Bat", BehaviorTag.ERRATIC).build(), GridPoint.of(1, 1),
                          MonsterState.SLEEPING);
        var state = state(openLevel(6, 6), player(GridPoint.of(4, 4)), seesEverything(), bat);
        var rng = state.getRng();

        var first = engine.getMonsterIntent(bat, state);
        var second = engine.getMonsterIntent(bat, state);

        assertEquals(first, second);
        assertEquals(MonsterState.SLEEPING, bat.getState());
        assertEquals(GridPoint.of(1, 1), bat.getPosition());
        assertTrue(bat.getLastKnownPlayerPosition().isEmpty());
        assertEquals(rng, state.getRng());
    }

    @Test
    void testApplyIntentClearsPathOutsideHunting() {
        var smart = monster("m", profile("Centaur", BehaviorTag.SMART).build(), GridPoint.of(1, 1),
                            MonsterState.HUNTING);
        var player = player(GridPoint.of(5, 1));
        var state = state(wallBetween(), player, seesEverything(), smart);
        engine.applyIntent(smart, decide(smart, state));
        assertTrue(smart.getCurrentPath().isPresent());

        var fled = new MonsterIntent(MonsterState.WANDERING, MonsterAction.waiting(), Optional.empty(), 0,
                                     null, state.getRng());
        engine.applyIntent(smart, fled);
        assertTrue(smart.getCurrentPath().isEmpty());
        assertEquals(MonsterState.WANDERING, smart.getState());
    }
}
