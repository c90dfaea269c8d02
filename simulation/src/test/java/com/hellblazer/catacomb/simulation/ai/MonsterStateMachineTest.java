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

import com.hellblazer.catacomb.geometry.GridPoint;
import com.hellblazer.catacomb.simulation.SimulationConfig;
import com.hellblazer.catacomb.simulation.actor.Monster;
import com.hellblazer.catacomb.simulation.actor.MonsterState;
import com.hellblazer.catacomb.simulation.profile.BehaviorProfile;
import com.hellblazer.catacomb.simulation.profile.BehaviorTag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static com.hellblazer.catacomb.simulation.SimulationFixtures.monster;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for monster state transitions.
 *
 * @author hal.hildebrand
 */
class MonsterStateMachineTest {

    private MonsterStateMachine machine;
    private BehaviorProfile     coward;

    @BeforeEach
    void setUp() {
        machine = new MonsterStateMachine(SimulationConfig.defaultConfig());
        coward = BehaviorProfile.builder("Jackal")
                                .withTags(BehaviorTag.SIMPLE, BehaviorTag.COWARD)
                                .withFleeThreshold(0.25)
                                .build();
    }

    private Monster cowardAt(int hp, MonsterState state) {
        var monster = monster("jackal", coward, GridPoint.of(0, 0), state, 100);
        monster.setHp(hp);
        return monster;
    }

    @Test
    void testCowardFleesBelowThreshold() {
        assertEquals(MonsterState.FLEEING, machine.next(cowardAt(24, MonsterState.HUNTING), true).state());
    }

    @Test
    void testCowardAtThresholdKeepsHunting() {
        assertEquals(MonsterState.HUNTING, machine.next(cowardAt(25, MonsterState.HUNTING), true).state());
    }

    @Test
    void testRecoveryNeedsHysteresisMargin() {
        assertEquals(MonsterState.FLEEING, machine.next(cowardAt(30, MonsterState.FLEEING), true).state(),
                     "Above threshold but inside the margin");
        assertEquals(MonsterState.FLEEING, machine.next(cowardAt(34, MonsterState.FLEEING), true).state());
        assertEquals(MonsterState.HUNTING, machine.next(cowardAt(36, MonsterState.FLEEING), true).state());
    }

    @Test
    void testBraveMonsterNeverFlees() {
        var brave = BehaviorProfile.builder("Orc").withFleeThreshold(0.5).build();
        var monster = monster("orc", brave, GridPoint.of(0, 0), MonsterState.HUNTING, 100);
        monster.setHp(1);
        assertEquals(MonsterState.HUNTING, machine.next(monster, true).state());
    }

    @Test
    void testWakingCowardPassesThroughHunting() {
        var sleeper = cowardAt(10, MonsterState.SLEEPING);
        assertEquals(MonsterState.SLEEPING, machine.next(sleeper, false).state());
        assertEquals(MonsterState.FLEEING, machine.next(sleeper, true).state(),
                     "Hunting rules apply in the same decision the monster wakes");
    }

    @Test
    void testWanderingNoticesPlayer() {
        var rat = BehaviorProfile.builder("Rat").build();
        var monster = monster("rat", rat, GridPoint.of(0, 0), MonsterState.WANDERING);
        assertEquals(MonsterState.WANDERING, machine.next(monster, false).state());
        assertEquals(MonsterState.HUNTING, machine.next(monster, true).state());
    }

    @Test
    void testThiefFleesAfterStealingThenCalmsDown() {
        var thief = BehaviorProfile.builder("Nymph").withTags(BehaviorTag.THIEF).build();
        var monster = monster("nymph", thief, GridPoint.of(0, 0), MonsterState.HUNTING);
        monster.setHasStolen(true);

        var transition = machine.next(monster, true);
        assertEquals(MonsterState.FLEEING, transition.state());
        monster.setState(transition.state());
        monster.setCalmTurns(transition.calmTurns());

        for (int i = 1; i < SimulationConfig.DEFAULT_FLEE_CALM_TURNS; i++) {
            transition = machine.next(monster, false);
            assertEquals(MonsterState.FLEEING, transition.state(), "calm decision " + i);
            assertEquals(i, transition.calmTurns());
            monster.setCalmTurns(transition.calmTurns());
        }
        transition = machine.next(monster, false);
        assertEquals(MonsterState.WANDERING, transition.state());
        assertEquals(0, transition.calmTurns());
    }

    @Test
    void testSightingResetsCalmCount() {
        var thief = BehaviorProfile.builder("Nymph").withTags(BehaviorTag.THIEF).build();
        var monster = monster("nymph", thief, GridPoint.of(0, 0), MonsterState.FLEEING);
        monster.setHasStolen(true);
        monster.setCalmTurns(4);

        var transition = machine.next(monster, true);
        assertEquals(MonsterState.FLEEING, transition.state());
        assertEquals(0, transition.calmTurns());
    }

    @Test
    void testThiefThatHasStolenFleesAgainWhenItSeesThePlayer() {
        var thief = BehaviorProfile.builder("Leprechaun").withTags(BehaviorTag.THIEF).build();
        var monster = monster("lep", thief, GridPoint.of(0, 0), MonsterState.WANDERING);
        monster.setHasStolen(true);
        assertEquals(MonsterState.FLEEING, machine.next(monster, true).state());
    }

    @Test
    void testTransitionIsPure() {
        var monster = cowardAt(10, MonsterState.HUNTING);
        machine.next(monster, true);
        assertEquals(MonsterState.HUNTING, monster.getState());
        assertEquals(0, monster.getCalmTurns());
    }
}
