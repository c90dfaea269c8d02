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

import java.util.Objects;

/**
 * String-based actor identifier. Ordering is lexical, which keeps reports and logs stable across runs.
 *
 * @author hal.hildebrand
 */
public final class ActorId implements Comparable<ActorId> {
    private final String id;

    public ActorId(String id) {
        this.id = Objects.requireNonNull(id, "ID cannot be null");
        if (id.isEmpty()) {
            throw new IllegalArgumentException("ID cannot be empty");
        }
    }

    public static ActorId of(String id) {
        return new ActorId(id);
    }

    @Override
    public int compareTo(ActorId other) {
        return id.compareTo(other.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ActorId that)) {
            return false;
        }
        return id.equals(that.id);
    }

    public String getValue() {
        return id;
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return id;
    }
}
