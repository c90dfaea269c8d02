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
package com.hellblazer.catacomb.dungeon.path;

import com.hellblazer.catacomb.dungeon.Level;
import com.hellblazer.catacomb.geometry.Direction;
import com.hellblazer.catacomb.geometry.GridPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * A* search over a level grid with 8-directional movement.
 * <p>
 * Properties:
 * <ul>
 *   <li>Heuristic is the Chebyshev distance, admissible and consistent for unit-cost king moves</li>
 *   <li>Walls and closed or locked doors are never expanded; occupied cells are skipped when configured</li>
 *   <li>Equal f-scores are broken by discovery order, so identical inputs always produce identical paths</li>
 *   <li>The search closes at most {@link PathfindingConfig#getMaxExpansions()} nodes; past that the goal is reported
 *   unreachable</li>
 * </ul>
 * Unreachable goals are not errors: callers get an empty {@link Optional} and degrade their movement.
 *
 * @author hal.hildebrand
 */
public class PathfindingEngine {
    private static final Logger log = LoggerFactory.getLogger(PathfindingEngine.class);

    private final PathfindingConfig config;

    public PathfindingEngine() {
        this(PathfindingConfig.defaultConfig());
    }

    public PathfindingEngine(PathfindingConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public PathfindingConfig getConfig() {
        return config;
    }

    /**
     * Chebyshev distance heuristic.
     */
    public static int heuristic(GridPoint a, GridPoint b) {
        return a.chebyshevDistance(b);
    }

    /**
     * Find a path ignoring other actors.
     */
    public Optional<Path> findPath(GridPoint start, GridPoint goal, Level level) {
        return findPath(start, goal, level, Set.of());
    }

    /**
     * Find a shortest path from start to goal.
     *
     * @param start   starting cell, not part of the returned path
     * @param goal    target cell, the last waypoint of the returned path
     * @param level   level to search
     * @param blocked cells occupied by other actors; ignored unless monsters block, and never applied to the goal
     * @return the path, or empty when the goal is unreachable or the expansion cap was hit
     */
    public Optional<Path> findPath(GridPoint start, GridPoint goal, Level level, Set<GridPoint> blocked) {
        if (start.equals(goal)) {
            return Optional.of(Path.empty());
        }
        if (!level.isPassable(goal)) {
            log.trace("Goal {} is not passable", goal);
            return Optional.empty();
        }
        var obstacles = config.isMonstersBlock() ? blocked : Set.<GridPoint>of();

        var open = new PriorityQueue<Node>(Comparator.comparingInt(Node::f).thenComparingLong(Node::sequence));
        var bestG = new HashMap<GridPoint, Integer>();
        var cameFrom = new HashMap<GridPoint, GridPoint>();
        var discovered = new HashMap<GridPoint, Long>();
        var closed = new HashSet<GridPoint>();
        long sequence = 0;

        bestG.put(start, 0);
        discovered.put(start, sequence);
        open.add(new Node(start, 0, heuristic(start, goal), sequence++));
        int expansions = 0;

        while (!open.isEmpty()) {
            var current = open.poll();
            if (closed.contains(current.point()) || current.g() > bestG.get(current.point())) {
                continue;
            }
            if (current.point().equals(goal)) {
                var path = reconstruct(cameFrom, start, goal);
                log.trace("Path {} -> {} found, length {}, {} expansions", start, goal, path.length(), expansions);
                return Optional.of(path);
            }
            closed.add(current.point());
            if (++expansions > config.getMaxExpansions()) {
                log.debug("Expansion cap {} reached searching {} -> {}", config.getMaxExpansions(), start, goal);
                return Optional.empty();
            }

            for (var direction : Direction.values()) {
                var next = current.point().step(direction);
                if (closed.contains(next) || !level.canStep(current.point(), next)) {
                    continue;
                }
                if (obstacles.contains(next) && !next.equals(goal)) {
                    continue;
                }
                int g = current.g() + 1;
                var known = bestG.get(next);
                if (known != null && g >= known) {
                    continue;
                }
                bestG.put(next, g);
                cameFrom.put(next, current.point());
                Long seq = discovered.get(next);
                if (seq == null) {
                    seq = sequence++;
                    discovered.put(next, seq);
                }
                open.add(new Node(next, g, g + heuristic(next, goal), seq));
            }
        }
        log.trace("No path {} -> {}", start, goal);
        return Optional.empty();
    }

    /**
     * Whether a goal can be reached at all within the expansion cap.
     */
    public boolean isReachable(GridPoint start, GridPoint goal, Level level, Set<GridPoint> blocked) {
        return findPath(start, goal, level, blocked).isPresent();
    }

    /**
     * Decide whether a cached path must be recomputed.
     * <p>
     * A path is stale when
     * <ol>
     *   <li>there is no cached path, or it is exhausted</li>
     *   <li>the goal has moved more than the replan tolerance away from the terminal waypoint</li>
     *   <li>the next waypoint can no longer be stepped onto from the current position</li>
     * </ol>
     *
     * @param cached   cached path, may be null
     * @param position current position of the follower
     * @param goal     current goal
     * @param level    level being traversed
     * @param blocked  cells occupied by other actors
     * @return true if a new path should be planned
     */
    public boolean needsReplan(Path cached, GridPoint position, GridPoint goal, Level level, Set<GridPoint> blocked) {
        if (cached == null || cached.isEmpty()) {
            return true;
        }
        if (cached.terminal().chebyshevDistance(goal) > config.getReplanTolerance()) {
            return true;
        }
        var next = cached.nextWaypoint();
        if (!level.canStep(position, next)) {
            return true;
        }
        return config.isMonstersBlock() && blocked.contains(next) && !next.equals(goal);
    }

    private Path reconstruct(Map<GridPoint, GridPoint> cameFrom, GridPoint start, GridPoint goal) {
        var reversed = new ArrayList<GridPoint>();
        var current = goal;
        while (!current.equals(start)) {
            reversed.add(current);
            current = cameFrom.get(current);
        }
        Collections.reverse(reversed);
        return new Path(reversed);
    }

    private record Node(GridPoint point, int g, int f, long sequence) {
    }
}
