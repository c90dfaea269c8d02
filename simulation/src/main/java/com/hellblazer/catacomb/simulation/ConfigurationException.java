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

/**
 * Base exception for configuration errors detected while loading monster profiles or constructing actors.
 * <p>
 * Configuration errors are fatal: they surface at load or construction time, never mid-simulation.
 * <p>
 * Subtypes:
 * <ul>
 * <li>{@link MalformedProfileException} - a behavior profile record is missing fields or holds out-of-range values</li>
 * <li>{@link InvalidSpeedException} - an actor speed is zero or negative</li>
 * </ul>
 *
 * @author hal.hildebrand
 */
public sealed class ConfigurationException extends RuntimeException
    permits ConfigurationException.MalformedProfileException,
            ConfigurationException.InvalidSpeedException {

    /**
     * Constructs a new configuration exception with the specified detail message.
     *
     * @param message the detail message
     */
    public ConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructs a new configuration exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause   the cause
     */
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Malformed behavior profile.
     * <p>
     * Thrown when the profile resource cannot be read, or a record is missing a field, names an unknown behavior
     * tag or rarity, or carries a value outside its legal range.
     */
    public static final class MalformedProfileException extends ConfigurationException {

        public MalformedProfileException(String message) {
            super(message);
        }

        public MalformedProfileException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Invalid actor speed.
     * <p>
     * Thrown when an actor or profile is configured with a speed that is not positive; such an actor would never
     * accumulate the energy to act.
     */
    public static final class InvalidSpeedException extends ConfigurationException {
        private final int speed;

        public InvalidSpeedException(String subject, int speed) {
            super(String.format("Speed must be positive for %s, got %d", subject, speed));
            this.speed = speed;
        }

        /**
         * Gets the rejected speed.
         *
         * @return the speed value
         */
        public int getSpeed() {
            return speed;
        }
    }
}
