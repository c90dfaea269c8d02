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
import com.hellblazer.catacomb.simulation.ConfigurationException.InvalidSpeedException;

import java.util.Objects;

/**
 * Anything that takes turns on a level. Every actor accrues energy at its speed and acts whenever it has banked a full
 * action's worth.
 *
 * @author hal.hildebrand
 */
public abstract sealed class Actor permits Player, Monster {

    private final ActorId   id;
    private final int       speed;
    private final int       maxHp;
    private       GridPoint position;
    private       int       energy;
    private       int       hp;

    /**
     * @throws InvalidSpeedException    if speed is not positive
     * @throws IllegalArgumentException if the hit points are inconsistent
     */
    protected Actor(ActorId id, GridPoint position, int speed, int hp, int maxHp) {
        this.id = Objects.requireNonNull(id, "id");
        this.position = Objects.requireNonNull(position, "position");
        if (speed <= 0) {
            throw new InvalidSpeedException(id.toString(), speed);
        }
        if (maxHp <= 0 || hp < 0 || hp > maxHp) {
            throw new IllegalArgumentException(String.format("Invalid hit points %d/%d for %s", hp, maxHp, id));
        }
        this.speed = speed;
        this.hp = hp;
        this.maxHp = maxHp;
    }

    public ActorId getId() {
        return id;
    }

    public GridPoint getPosition() {
        return position;
    }

    public void moveTo(GridPoint position) {
        this.position = Objects.requireNonNull(position, "position");
    }

    public int getSpeed() {
        return speed;
    }

    public int getEnergy() {
        return energy;
    }

    /**
     * @throws IllegalArgumentException if energy is negative
     */
    public void setEnergy(int energy) {
        if (energy < 0) {
            throw new IllegalArgumentException("Energy cannot be negative: " + energy + " for " + id);
        }
        this.energy = energy;
    }

    public void addEnergy(int amount) {
        setEnergy(energy + amount);
    }

    public int getHp() {
        return hp;
    }

    /**
     * Set hit points, clamped to [0, maxHp].
     */
    public void setHp(int hp) {
        boolean wasAlive = isAlive();
        this.hp = Math.max(0, Math.min(maxHp, hp));
        if (wasAlive && !isAlive()) {
            onDeath();
        }
    }

    public int getMaxHp() {
        return maxHp;
    }

    public double getHpFraction() {
        return (double) hp / maxHp;
    }

    public boolean isAlive() {
        return hp > 0;
    }

    protected void onDeath() {
    }
}
