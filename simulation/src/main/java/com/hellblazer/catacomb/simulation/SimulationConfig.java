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

import com.hellblazer.catacomb.dungeon.path.PathfindingConfig;

/**
 * Tuning for the monster decision core and the wandering monster spawner.
 * <p>
 * Usage:
 * <pre>
 * var config = SimulationConfig.builder()
 *     .withFleeCalmTurns(3)
 *     .withMaxWanderers(0)
 *     .build();
 * </pre>
 *
 * @author hal.hildebrand
 */
public class SimulationConfig {

    public static final double DEFAULT_FLEE_HYSTERESIS          = 0.1;
    public static final int    DEFAULT_FLEE_CALM_TURNS          = 5;
    public static final double DEFAULT_RUNNING_AGGRO_MULTIPLIER = 1.5;
    public static final double DEFAULT_WANDER_BASE_CHANCE       = 0.005;
    public static final double DEFAULT_WANDER_CHANCE_INCREMENT  = 0.0001;
    public static final double DEFAULT_WANDER_CHANCE_CAP        = 0.05;
    public static final int    DEFAULT_MAX_WANDERERS            = 5;
    public static final int    DEFAULT_VISION_RADIUS            = 9;

    private final double            fleeHysteresis;
    private final int               fleeCalmTurns;
    private final double            runningAggroMultiplier;
    private final double            wanderBaseChance;
    private final double            wanderChanceIncrement;
    private final double            wanderChanceCap;
    private final int               maxWanderers;
    private final int               visionRadius;
    private final boolean           verifyGrants;
    private final PathfindingConfig pathfinding;

    private SimulationConfig(Builder builder) {
        this.fleeHysteresis = builder.fleeHysteresis;
        this.fleeCalmTurns = builder.fleeCalmTurns;
        this.runningAggroMultiplier = builder.runningAggroMultiplier;
        this.wanderBaseChance = builder.wanderBaseChance;
        this.wanderChanceIncrement = builder.wanderChanceIncrement;
        this.wanderChanceCap = builder.wanderChanceCap;
        this.maxWanderers = builder.maxWanderers;
        this.visionRadius = builder.visionRadius;
        this.verifyGrants = builder.verifyGrants;
        this.pathfinding = builder.pathfinding;
    }

    /**
     * Margin above the flee threshold a coward's health must regain before it turns to hunt again.
     */
    public double getFleeHysteresis() {
        return fleeHysteresis;
    }

    /**
     * Consecutive decisions with the player out of aggro range after which a fleeing monster starts wandering.
     */
    public int getFleeCalmTurns() {
        return fleeCalmTurns;
    }

    /**
     * Aggro range multiplier applied while the player is running.
     */
    public double getRunningAggroMultiplier() {
        return runningAggroMultiplier;
    }

    public double getWanderBaseChance() {
        return wanderBaseChance;
    }

    public double getWanderChanceIncrement() {
        return wanderChanceIncrement;
    }

    public double getWanderChanceCap() {
        return wanderChanceCap;
    }

    /**
     * Maximum number of living wandering monsters on a level.
     */
    public int getMaxWanderers() {
        return maxWanderers;
    }

    /**
     * Radius handed to the visibility oracle when computing what the player can see.
     */
    public int getVisionRadius() {
        return visionRadius;
    }

    /**
     * Whether every energy grant is checked against its computed amount.
     */
    public boolean isVerifyGrants() {
        return verifyGrants;
    }

    public PathfindingConfig getPathfinding() {
        return pathfinding;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SimulationConfig defaultConfig() {
        return builder().build();
    }

    /**
     * Builder class for SimulationConfig
     */
    public static class Builder {
        private double            fleeHysteresis         = DEFAULT_FLEE_HYSTERESIS;
        private int               fleeCalmTurns          = DEFAULT_FLEE_CALM_TURNS;
        private double            runningAggroMultiplier = DEFAULT_RUNNING_AGGRO_MULTIPLIER;
        private double            wanderBaseChance       = DEFAULT_WANDER_BASE_CHANCE;
        private double            wanderChanceIncrement  = DEFAULT_WANDER_CHANCE_INCREMENT;
        private double            wanderChanceCap        = DEFAULT_WANDER_CHANCE_CAP;
        private int               maxWanderers           = DEFAULT_MAX_WANDERERS;
        private int               visionRadius           = DEFAULT_VISION_RADIUS;
        private boolean           verifyGrants           = true;
        private PathfindingConfig pathfinding            = PathfindingConfig.defaultConfig();

        private Builder() {
        }

        public Builder withFleeHysteresis(double fleeHysteresis) {
            if (fleeHysteresis < 0.0 || fleeHysteresis > 1.0) {
                throw new IllegalArgumentException("Flee hysteresis must be in [0, 1]");
            }
            this.fleeHysteresis = fleeHysteresis;
            return this;
        }

        public Builder withFleeCalmTurns(int fleeCalmTurns) {
            if (fleeCalmTurns <= 0) {
                throw new IllegalArgumentException("Flee calm turns must be positive");
            }
            this.fleeCalmTurns = fleeCalmTurns;
            return this;
        }

        public Builder withRunningAggroMultiplier(double runningAggroMultiplier) {
            if (runningAggroMultiplier < 1.0) {
                throw new IllegalArgumentException("Running aggro multiplier must be at least 1");
            }
            this.runningAggroMultiplier = runningAggroMultiplier;
            return this;
        }

        public Builder withWanderBaseChance(double wanderBaseChance) {
            this.wanderBaseChance = probability("Wander base chance", wanderBaseChance);
            return this;
        }

        public Builder withWanderChanceIncrement(double wanderChanceIncrement) {
            this.wanderChanceIncrement = probability("Wander chance increment", wanderChanceIncrement);
            return this;
        }

        public Builder withWanderChanceCap(double wanderChanceCap) {
            this.wanderChanceCap = probability("Wander chance cap", wanderChanceCap);
            return this;
        }

        public Builder withMaxWanderers(int maxWanderers) {
            if (maxWanderers < 0) {
                throw new IllegalArgumentException("Max wanderers must be non-negative");
            }
            this.maxWanderers = maxWanderers;
            return this;
        }

        public Builder withVisionRadius(int visionRadius) {
            if (visionRadius < 0) {
                throw new IllegalArgumentException("Vision radius must be non-negative");
            }
            this.visionRadius = visionRadius;
            return this;
        }

        public Builder withVerifyGrants(boolean verifyGrants) {
            this.verifyGrants = verifyGrants;
            return this;
        }

        public Builder withPathfinding(PathfindingConfig pathfinding) {
            if (pathfinding == null) {
                throw new IllegalArgumentException("Pathfinding config cannot be null");
            }
            this.pathfinding = pathfinding;
            return this;
        }

        public SimulationConfig build() {
            if (wanderBaseChance > wanderChanceCap) {
                throw new IllegalArgumentException(
                String.format("Wander base chance %.4f exceeds cap %.4f", wanderBaseChance, wanderChanceCap));
            }
            return new SimulationConfig(this);
        }

        private static double probability(String name, double value) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be in [0, 1], got " + value);
            }
            return value;
        }
    }

    @Override
    public String toString() {
        return String.format(
        "SimulationConfig[fleeHysteresis=%.2f, fleeCalmTurns=%d, runningAggro=%.2f, wander=%.4f+%.5f<=%.3f, "
        + "maxWanderers=%d, vision=%d, verifyGrants=%s, %s]", fleeHysteresis, fleeCalmTurns, runningAggroMultiplier,
        wanderBaseChance, wanderChanceIncrement, wanderChanceCap, maxWanderers, visionRadius, verifyGrants,
        pathfinding);
    }
}
