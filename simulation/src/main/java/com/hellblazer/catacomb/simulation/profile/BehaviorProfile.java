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
package com.hellblazer.catacomb.simulation.profile;

import com.hellblazer.catacomb.simulation.ConfigurationException.InvalidSpeedException;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable per-type monster definition, shared by every instance of the type.
 * <p>
 * Usage:
 * <pre>
 * var orc = BehaviorProfile.builder("Orc")
 *     .withLetter('O')
 *     .withLevel(2)
 *     .withTags(BehaviorTag.GREEDY, BehaviorTag.COWARD)
 *     .withFleeThreshold(0.25)
 *     .build();
 * </pre>
 *
 * @author hal.hildebrand
 */
public final class BehaviorProfile {

    public static final int BOSS_LEVEL = 10;

    private static final Pattern HIT_DICE = Pattern.compile("\\d+d\\d+");

    private final String            name;
    private final char              letter;
    private final int               level;
    private final int               speed;
    private final String            hitDice;
    private final Rarity            rarity;
    private final boolean           mean;
    private final List<BehaviorTag> tags;
    private final int               aggroRange;
    private final double            fleeThreshold;
    private final double            erraticChance;
    private final double            chaseChance;
    private final int               intelligence;

    private BehaviorProfile(Builder builder) {
        this.name = builder.name;
        this.letter = builder.letter;
        this.level = builder.level;
        this.speed = builder.speed;
        this.hitDice = builder.hitDice;
        this.rarity = builder.rarity;
        this.mean = builder.mean;
        this.tags = List.copyOf(builder.tags);
        this.aggroRange = builder.aggroRange;
        this.fleeThreshold = builder.fleeThreshold;
        this.erraticChance = builder.erraticChance;
        this.chaseChance = builder.chaseChance;
        this.intelligence = builder.intelligence;
    }

    public String getName() {
        return name;
    }

    public char getLetter() {
        return letter;
    }

    public int getLevel() {
        return level;
    }

    public int getSpeed() {
        return speed;
    }

    /**
     * Hit point dice in NdM notation.
     */
    public String getHitDice() {
        return hitDice;
    }

    public Rarity getRarity() {
        return rarity;
    }

    /**
     * Mean monsters are created awake and hunting.
     */
    public boolean isMean() {
        return mean;
    }

    public List<BehaviorTag> getTags() {
        return tags;
    }

    public boolean hasTag(BehaviorTag tag) {
        return tags.contains(tag);
    }

    /**
     * The first non-modifier tag, or SMART when the profile carries modifiers only.
     */
    public BehaviorTag movementTag() {
        for (var tag : tags) {
            if (!tag.isModifier()) {
                return tag;
            }
        }
        return BehaviorTag.SMART;
    }

    public boolean isCoward() {
        return tags.contains(BehaviorTag.COWARD);
    }

    public boolean isBoss() {
        return level >= BOSS_LEVEL;
    }

    public int getAggroRange() {
        return aggroRange;
    }

    public double getFleeThreshold() {
        return fleeThreshold;
    }

    public double getErraticChance() {
        return erraticChance;
    }

    /**
     * Probability of pursuing on any given hunting turn.
     */
    public double getChaseChance() {
        return chaseChance;
    }

    public int getIntelligence() {
        return intelligence;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Builder class for BehaviorProfile
     */
    public static class Builder {
        private final String            name;
        private       char              letter        = '?';
        private       int               level         = 1;
        private       int               speed         = 10;
        private       String            hitDice       = "1d8";
        private       Rarity            rarity        = Rarity.COMMON;
        private       boolean           mean          = false;
        private       List<BehaviorTag> tags          = List.of(BehaviorTag.SIMPLE);
        private       int               aggroRange    = 7;
        private       double            fleeThreshold = 0.0;
        private       double            erraticChance = 0.5;
        private       double            chaseChance   = 1.0;
        private       int               intelligence  = 5;

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Profile name cannot be empty");
            }
            this.name = name;
        }

        public Builder withLetter(char letter) {
            this.letter = letter;
            return this;
        }

        public Builder withLevel(int level) {
            if (level < 1 || level > BOSS_LEVEL) {
                throw new IllegalArgumentException("Level must be 1-" + BOSS_LEVEL + ", got " + level);
            }
            this.level = level;
            return this;
        }

        /**
         * @throws InvalidSpeedException if speed is not positive
         */
        public Builder withSpeed(int speed) {
            if (speed <= 0) {
                throw new InvalidSpeedException(name, speed);
            }
            this.speed = speed;
            return this;
        }

        public Builder withHitDice(String hitDice) {
            if (hitDice == null || !HIT_DICE.matcher(hitDice).matches()) {
                throw new IllegalArgumentException("Hit dice must be NdM, got '" + hitDice + "'");
            }
            this.hitDice = hitDice;
            return this;
        }

        public Builder withRarity(Rarity rarity) {
            this.rarity = Objects.requireNonNull(rarity, "rarity");
            return this;
        }

        public Builder withMean(boolean mean) {
            this.mean = mean;
            return this;
        }

        public Builder withTags(BehaviorTag... tags) {
            return withTags(List.of(tags));
        }

        public Builder withTags(List<BehaviorTag> tags) {
            if (tags.isEmpty()) {
                throw new IllegalArgumentException("At least one behavior tag is required");
            }
            if (EnumSet.copyOf(tags).size() != tags.size()) {
                throw new IllegalArgumentException("Duplicate behavior tags: " + tags);
            }
            this.tags = List.copyOf(tags);
            return this;
        }

        public Builder withAggroRange(int aggroRange) {
            if (aggroRange < 0) {
                throw new IllegalArgumentException("Aggro range must be non-negative, got " + aggroRange);
            }
            this.aggroRange = aggroRange;
            return this;
        }

        public Builder withFleeThreshold(double fleeThreshold) {
            this.fleeThreshold = fraction("Flee threshold", fleeThreshold);
            return this;
        }

        public Builder withErraticChance(double erraticChance) {
            this.erraticChance = fraction("Erratic chance", erraticChance);
            return this;
        }

        public Builder withChaseChance(double chaseChance) {
            this.chaseChance = fraction("Chase chance", chaseChance);
            return this;
        }

        public Builder withIntelligence(int intelligence) {
            if (intelligence < 0 || intelligence > 10) {
                throw new IllegalArgumentException("Intelligence must be 0-10, got " + intelligence);
            }
            this.intelligence = intelligence;
            return this;
        }

        public BehaviorProfile build() {
            return new BehaviorProfile(this);
        }

        private static double fraction(String field, double value) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(field + " must be 0.0-1.0, got " + value);
            }
            return value;
        }
    }

    @Override
    public String toString() {
        return String.format("BehaviorProfile[%s '%c', level=%d, speed=%d, %s, tags=%s, aggro=%d]", name, letter,
                             level, speed, rarity, tags, aggroRange);
    }
}
