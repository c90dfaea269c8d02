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

import com.hellblazer.catacomb.dungeon.path.Path;
import com.hellblazer.catacomb.geometry.GridPoint;
import com.hellblazer.catacomb.simulation.profile.BehaviorProfile;

import java.util.Objects;
import java.util.Optional;

/**
 * A monster instance: a shared immutable {@link BehaviorProfile} plus the mutable state the decision core reads and
 * writes each turn.
 * <p>
 * The cached path belongs to this monster alone and is only held while it is {@link MonsterState#HUNTING}; changing
 * to any other state, or dying, drops it.
 *
 * @author hal.hildebrand
 */
public final class Monster extends Actor {

    private final BehaviorProfile profile;
    private final boolean         wanderer;
    private       MonsterState    state;
    private       Path            currentPath;
    private       GridPoint       lastKnownPlayerPosition;
    private       boolean         stolen;
    private       int             calmTurns;

    public Monster(ActorId id, BehaviorProfile profile, GridPoint position, int hp, MonsterState state,
                   boolean wanderer) {
        super(id, position, profile.getSpeed(), hp, hp);
        this.profile = profile;
        this.state = Objects.requireNonNull(state, "state");
        this.wanderer = wanderer;
    }

    public BehaviorProfile getProfile() {
        return profile;
    }

    public MonsterState getState() {
        return state;
    }

    public void setState(MonsterState state) {
        this.state = Objects.requireNonNull(state, "state");
        if (state != MonsterState.HUNTING) {
            invalidatePath();
        }
    }

    public Optional<Path> getCurrentPath() {
        return Optional.ofNullable(currentPath);
    }

    /**
     * @throws IllegalStateException if the monster is not hunting
     */
    public void setCurrentPath(Path path) {
        if (state != MonsterState.HUNTING) {
            throw new IllegalStateException(getId() + " cannot hold a path while " + state);
        }
        this.currentPath = Objects.requireNonNull(path, "path");
    }

    public void invalidatePath() {
        currentPath = null;
    }

    public Optional<GridPoint> getLastKnownPlayerPosition() {
        return Optional.ofNullable(lastKnownPlayerPosition);
    }

    public void setLastKnownPlayerPosition(GridPoint lastKnownPlayerPosition) {
        this.lastKnownPlayerPosition = lastKnownPlayerPosition;
    }

    public boolean hasStolen() {
        return stolen;
    }

    public void setHasStolen(boolean stolen) {
        this.stolen = stolen;
    }

    /**
     * Consecutive fleeing decisions made with the player out of aggro range.
     */
    public int getCalmTurns() {
        return calmTurns;
    }

    public void setCalmTurns(int calmTurns) {
        this.calmTurns = calmTurns;
    }

    /**
     * Whether this monster was injected by the wandering monster spawner rather than placed with the level.
     */
    public boolean isWanderer() {
        return wanderer;
    }

    @Override
    protected void onDeath() {
        invalidatePath();
    }

    @Override
    public String toString() {
        return String.format("Monster[%s %s at %s, %s, energy=%d, hp=%d/%d]", getId(), profile.getName(),
                             getPosition(), state, getEnergy(), getHp(), getMaxHp());
    }
}
