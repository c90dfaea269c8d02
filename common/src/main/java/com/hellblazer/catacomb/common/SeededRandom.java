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
package com.hellblazer.catacomb.common;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable, seeded random state for deterministic replay.
 * <p>
 * Every draw returns a {@link Draw} holding the value and the successor state; the caller threads the successor into
 * the next probabilistic call. No instance is ever mutated, so the same state always produces the same sequence and a
 * captured state can be replayed bit-exactly.
 * <p>
 * Usage:
 * <pre>
 * var rng = SeededRandom.of(42);
 * var roll = rng.chance(0.5);
 * if (roll.value()) { ... }
 * rng = roll.next();
 * </pre>
 * The generator is SplitMix64, which is fully specified by integer arithmetic and therefore identical on every JVM.
 *
 * @author hal.hildebrand
 */
public final class SeededRandom {

    private static final long    GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;
    private static final double  DOUBLE_UNIT  = 0x1.0p-53;
    private static final Pattern DICE_TERM    = Pattern.compile("(\\d+)d(\\d+)|(\\d+)");

    /**
     * A drawn value paired with the state to use for the next draw.
     *
     * @param value the drawn value
     * @param next  successor random state
     */
    public record Draw<T>(T value, SeededRandom next) {
    }

    private final long state;

    private SeededRandom(long state) {
        this.state = state;
    }

    public static SeededRandom of(long seed) {
        return new SeededRandom(seed);
    }

    /**
     * Derive a seed from a string, for human-readable game seeds.
     */
    public static SeededRandom of(String seed) {
        Objects.requireNonNull(seed, "seed");
        long hash = 1125899906842597L;
        for (int i = 0; i < seed.length(); i++) {
            hash = 31 * hash + seed.charAt(i);
        }
        return new SeededRandom(hash);
    }

    /**
     * The raw state, suitable for capturing and later restoring with {@link #of(long)}.
     */
    public long state() {
        return state;
    }

    public Draw<Long> nextLong() {
        long next = state + GOLDEN_GAMMA;
        long z = next;
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        z = z ^ (z >>> 31);
        return new Draw<>(z, new SeededRandom(next));
    }

    /**
     * Uniform double in [0, 1).
     */
    public Draw<Double> nextDouble() {
        var raw = nextLong();
        return new Draw<>((raw.value() >>> 11) * DOUBLE_UNIT, raw.next());
    }

    /**
     * Uniform integer in [0, bound).
     *
     * @param bound exclusive upper bound, must be positive
     */
    public Draw<Integer> nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        var unit = nextDouble();
        return new Draw<>((int) (unit.value() * bound), unit.next());
    }

    /**
     * Uniform integer in [min, max], both inclusive.
     */
    public Draw<Integer> nextInt(int min, int max) {
        if (max < min) {
            throw new IllegalArgumentException("max < min: " + max + " < " + min);
        }
        var offset = nextInt(max - min + 1);
        return new Draw<>(min + offset.value(), offset.next());
    }

    /**
     * Bernoulli trial. Always consumes exactly one draw, whatever the probability.
     *
     * @param probability chance of true, in [0, 1]
     */
    public Draw<Boolean> chance(double probability) {
        var unit = nextDouble();
        return new Draw<>(unit.value() < probability, unit.next());
    }

    /**
     * Pick one element uniformly.
     *
     * @param items non-empty list
     */
    public <T> Draw<T> pick(List<T> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty list");
        }
        var index = nextInt(items.size());
        return new Draw<>(items.get(index.value()), index.next());
    }

    /**
     * Roll dice notation such as {@code "2d8"}, {@code "1d6+3"} or {@code "1d2+1d4"}.
     *
     * @param dice dice expression of NdM and constant terms joined by '+'
     * @return the total and the successor state
     * @throws IllegalArgumentException for malformed notation
     */
    public Draw<Integer> roll(String dice) {
        if (dice == null || dice.isBlank()) {
            throw new IllegalArgumentException("Invalid dice notation: " + dice);
        }
        var current = this;
        int total = 0;
        for (var term : dice.trim().split("\\+")) {
            var matcher = DICE_TERM.matcher(term.trim());
            if (!matcher.matches()) {
                throw new IllegalArgumentException("Invalid dice notation: " + dice);
            }
            if (matcher.group(3) != null) {
                total += Integer.parseInt(matcher.group(3));
                continue;
            }
            int count = Integer.parseInt(matcher.group(1));
            int sides = Integer.parseInt(matcher.group(2));
            if (sides < 1) {
                throw new IllegalArgumentException("Invalid dice notation: " + dice);
            }
            for (int i = 0; i < count; i++) {
                var face = current.nextInt(1, sides);
                total += face.value();
                current = face.next();
            }
        }
        return new Draw<>(total, current);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SeededRandom that)) {
            return false;
        }
        return state == that.state;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(state);
    }

    @Override
    public String toString() {
        return "SeededRandom{state=" + Long.toHexString(state) + "}";
    }
}
