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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.catacomb.common.SeededRandom;
import com.hellblazer.catacomb.simulation.ConfigurationException.MalformedProfileException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Table of monster behavior profiles, keyed by type name.
 * <p>
 * Profiles are loaded from a JSON array on the classpath, one object per monster type:
 * <pre>
 * {
 *   "letter": "O", "name": "Orc", "hp": "1d8", "level": 2, "speed": 10,
 *   "rarity": "uncommon", "mean": true,
 *   "aiProfile": {
 *     "behavior": ["GREEDY", "COWARD"], "intelligence": 5, "aggroRange": 8,
 *     "fleeThreshold": 0.25, "chaseChance": 0.67
 *   }
 * }
 * </pre>
 * {@code erraticChance} and {@code chaseChance} are optional. Every other field is required and validated at load;
 * any violation is a {@link MalformedProfileException}.
 *
 * @author hal.hildebrand
 */
public class BehaviorProfileTable {
    private static final Logger log = LoggerFactory.getLogger(BehaviorProfileTable.class);

    public static final String DEFAULT_RESOURCE = "/monsters.json";

    private static final double DEFAULT_ERRATIC_CHANCE = 0.5;
    private static final double DEFAULT_CHASE_CHANCE   = 1.0;

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final List<BehaviorProfile>        profiles;
    private final Map<String, BehaviorProfile> byName;

    /**
     * @throws MalformedProfileException if two profiles share a name
     */
    public BehaviorProfileTable(List<BehaviorProfile> profiles) {
        var index = new LinkedHashMap<String, BehaviorProfile>();
        for (var profile : profiles) {
            if (index.putIfAbsent(profile.getName(), profile) != null) {
                throw new MalformedProfileException("Duplicate monster name '" + profile.getName() + "'");
            }
        }
        this.profiles = List.copyOf(profiles);
        this.byName = Collections.unmodifiableMap(index);
    }

    /**
     * Load the bundled monster table.
     */
    public static BehaviorProfileTable loadDefault() {
        return load(DEFAULT_RESOURCE);
    }

    /**
     * Load a profile table from a classpath resource.
     *
     * @param resourcePath absolute classpath resource path
     * @return the validated table
     * @throws MalformedProfileException if the resource is missing, unreadable or invalid
     */
    public static BehaviorProfileTable load(String resourcePath) {
        try (var is = BehaviorProfileTable.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new MalformedProfileException("Profile resource not found: " + resourcePath);
            }
            var table = parse(is);
            log.info("Loaded {} behavior profiles from {}", table.size(), resourcePath);
            return table;
        } catch (IOException e) {
            throw new MalformedProfileException("Failed to read profiles from " + resourcePath, e);
        }
    }

    /**
     * Parse a profile table from a JSON stream.
     *
     * @throws IOException               if the stream is not readable JSON
     * @throws MalformedProfileException if the JSON does not describe valid profiles
     */
    public static BehaviorProfileTable parse(InputStream is) throws IOException {
        var root = OBJECT_MAPPER.readTree(is);
        if (root == null || !root.isArray()) {
            throw new MalformedProfileException("Monster profiles must be a JSON array");
        }
        var profiles = new ArrayList<BehaviorProfile>(root.size());
        int index = 0;
        for (var node : root) {
            var profile = parseProfile(node, ++index);
            log.debug("Parsed profile {}", profile);
            profiles.add(profile);
        }
        return new BehaviorProfileTable(profiles);
    }

    private static BehaviorProfile parseProfile(JsonNode node, int index) {
        var prefix = "Monster " + index;
        if (!node.isObject()) {
            throw new MalformedProfileException(prefix + ": expected an object");
        }
        var name = requireText(node, "name", prefix);
        prefix = prefix + " (" + name + ")";

        var letter = requireText(node, "letter", prefix);
        if (letter.length() != 1 || !Character.isLetter(letter.charAt(0))) {
            throw new MalformedProfileException(prefix + ": letter must be a single letter, got '" + letter + "'");
        }
        var hp = requireText(node, "hp", prefix);
        int level = requireInt(node, "level", prefix);
        int speed = requireInt(node, "speed", prefix);
        var rarity = requireText(node, "rarity", prefix);
        var mean = require(node, "mean", prefix);
        if (!mean.isBoolean()) {
            throw new MalformedProfileException(prefix + ": 'mean' must be boolean, got " + mean.getNodeType());
        }
        var ai = require(node, "aiProfile", prefix);
        if (!ai.isObject()) {
            throw new MalformedProfileException(prefix + ": 'aiProfile' must be an object");
        }

        try {
            return BehaviorProfile.builder(name)
                                  .withLetter(letter.charAt(0))
                                  .withHitDice(hp)
                                  .withLevel(level)
                                  .withSpeed(speed)
                                  .withRarity(parseRarity(rarity))
                                  .withMean(mean.booleanValue())
                                  .withTags(parseTags(require(ai, "behavior", prefix)))
                                  .withIntelligence(requireInt(ai, "intelligence", prefix))
                                  .withAggroRange(requireInt(ai, "aggroRange", prefix))
                                  .withFleeThreshold(requireNumber(ai, "fleeThreshold", prefix))
                                  .withErraticChance(optionalNumber(ai, "erraticChance", DEFAULT_ERRATIC_CHANCE, prefix))
                                  .withChaseChance(optionalNumber(ai, "chaseChance", DEFAULT_CHASE_CHANCE, prefix))
                                  .build();
        } catch (IllegalArgumentException e) {
            throw new MalformedProfileException(prefix + ": " + e.getMessage(), e);
        }
    }

    private static Rarity parseRarity(String rarity) {
        try {
            return Rarity.parse(rarity);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid rarity '" + rarity + "', expected one of common, uncommon, rare",
                                               e);
        }
    }

    private static List<BehaviorTag> parseTags(JsonNode behavior) {
        var names = new ArrayList<String>();
        if (behavior.isTextual()) {
            names.add(behavior.asText());
        } else if (behavior.isArray()) {
            for (var element : behavior) {
                if (!element.isTextual()) {
                    throw new IllegalArgumentException("Behavior entries must be strings");
                }
                names.add(element.asText());
            }
        } else {
            throw new IllegalArgumentException("Behavior must be a string or an array of strings");
        }
        var tags = new ArrayList<BehaviorTag>(names.size());
        for (var tagName : names) {
            try {
                tags.add(BehaviorTag.valueOf(tagName.toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Invalid behavior '" + tagName + "'", e);
            }
        }
        return tags;
    }

    private static JsonNode require(JsonNode node, String field, String prefix) {
        var value = node.get(field);
        if (value == null || value.isNull()) {
            throw new MalformedProfileException(prefix + ": missing '" + field + "'");
        }
        return value;
    }

    private static String requireText(JsonNode node, String field, String prefix) {
        var value = require(node, field, prefix);
        if (!value.isTextual() || value.asText().isBlank()) {
            throw new MalformedProfileException(prefix + ": '" + field + "' must be a non-empty string");
        }
        return value.asText();
    }

    private static int requireInt(JsonNode node, String field, String prefix) {
        var value = require(node, field, prefix);
        if (!value.isInt()) {
            throw new MalformedProfileException(prefix + ": '" + field + "' must be an integer");
        }
        return value.intValue();
    }

    private static double requireNumber(JsonNode node, String field, String prefix) {
        var value = require(node, field, prefix);
        if (!value.isNumber()) {
            throw new MalformedProfileException(prefix + ": '" + field + "' must be a number");
        }
        return value.doubleValue();
    }

    private static double optionalNumber(JsonNode node, String field, double defaultValue, String prefix) {
        return node.has(field) ? requireNumber(node, field, prefix) : defaultValue;
    }

    public Optional<BehaviorProfile> get(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Optional<BehaviorProfile> byLetter(char letter) {
        return profiles.stream().filter(p -> p.getLetter() == letter).findFirst();
    }

    /**
     * All profiles in load order.
     */
    public List<BehaviorProfile> profiles() {
        return profiles;
    }

    public int size() {
        return profiles.size();
    }

    /**
     * Whether a monster type may appear at a dungeon depth: no more than two levels above the depth, and bosses only
     * from one level above their own.
     */
    public static boolean isEligible(BehaviorProfile profile, int depth) {
        if (profile.getLevel() > depth + 2) {
            return false;
        }
        return !profile.isBoss() || depth >= profile.getLevel() - 1;
    }

    public List<BehaviorProfile> eligibleForDepth(int depth) {
        return profiles.stream().filter(p -> isEligible(p, depth)).toList();
    }

    /**
     * Choose a monster type for a depth, weighted by rarity.
     *
     * @param depth dungeon depth
     * @param rng   random state
     * @return the chosen profile, empty when no type is eligible, and the advanced random state
     */
    public SeededRandom.Draw<Optional<BehaviorProfile>> selectForDepth(int depth, SeededRandom rng) {
        var eligible = eligibleForDepth(depth);
        if (eligible.isEmpty()) {
            log.debug("No monster types eligible at depth {}", depth);
            return new SeededRandom.Draw<>(Optional.empty(), rng);
        }
        int total = 0;
        for (var profile : eligible) {
            total += profile.getRarity().weight();
        }
        var roll = rng.nextInt(total);
        int remaining = roll.value();
        for (var profile : eligible) {
            remaining -= profile.getRarity().weight();
            if (remaining < 0) {
                return new SeededRandom.Draw<>(Optional.of(profile), roll.next());
            }
        }
        throw new IllegalStateException("Weighted selection overran total weight " + total);
    }

    @Override
    public String toString() {
        return "BehaviorProfileTable[" + profiles.size() + " profiles]";
    }
}
