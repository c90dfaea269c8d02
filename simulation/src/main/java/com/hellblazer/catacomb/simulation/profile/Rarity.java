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

import java.util.Locale;

/**
 * How often a monster type is chosen relative to others eligible at the same depth.
 *
 * @author hal.hildebrand
 */
public enum Rarity {
    COMMON(5),
    UNCOMMON(3),
    RARE(2);

    private final int weight;

    Rarity(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    /**
     * Case-insensitive lookup.
     *
     * @throws IllegalArgumentException if the name is not a rarity
     */
    public static Rarity parse(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
