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
package com.hellblazer.catacomb.dungeon;

import com.hellblazer.catacomb.geometry.Direction;
import com.hellblazer.catacomb.geometry.GridPoint;

import java.util.*;

/**
 * Tile, room, door and gold data of one dungeon level.
 * <p>
 * The tile grid is fixed at construction. Door states and gold piles change only between scheduler phases (player
 * commands, greedy monsters picking up gold), so within one decision the level can be treated as immutable.
 * <p>
 * Levels are usually built from ASCII art in tests:
 * <pre>
 * var level = Level.builder(
 *     "#######",
 *     "#..$..#",
 *     "#######").depth(3).build();
 * </pre>
 * Glyphs: {@code #} wall, {@code .} floor, {@code ,} corridor, {@code >} stairs, {@code $} floor with gold,
 * {@code +} closed door, {@code '} open door, {@code L} locked door, {@code S} secret door.
 *
 * @author hal.hildebrand
 */
public class Level {

    private final int                     depth;
    private final int                     width;
    private final int                     height;
    private final TileType[][]            tiles;
    private final List<Room>              rooms;
    private final Map<GridPoint, Door>    doors;
    private final Set<GridPoint>          gold;

    private Level(Builder builder) {
        this.depth = builder.depth;
        this.width = builder.width;
        this.height = builder.height;
        this.tiles = new TileType[height][];
        for (int y = 0; y < height; y++) {
            this.tiles[y] = builder.tiles[y].clone();
        }
        this.rooms = List.copyOf(builder.rooms);
        this.doors = new LinkedHashMap<>(builder.doors);
        this.gold = new LinkedHashSet<>(builder.gold);
    }

    public int depth() {
        return depth;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean inBounds(GridPoint point) {
        return point.isWithinBounds(0, 0, width, height);
    }

    /**
     * Tile at a point; out-of-bounds cells read as walls.
     */
    public TileType tileAt(GridPoint point) {
        if (!inBounds(point)) {
            return TileType.WALL;
        }
        return tiles[point.y][point.x];
    }

    /**
     * Whether an actor may stand on the cell: walkable tile, and for doors a state that does not block movement.
     */
    public boolean isPassable(GridPoint point) {
        var tile = tileAt(point);
        if (!tile.isWalkable()) {
            return false;
        }
        if (tile == TileType.DOOR) {
            var door = doors.get(point);
            return door == null || !door.state().blocksMovement();
        }
        return true;
    }

    /**
     * Whether a single king move from one cell to an adjacent one is legal. Diagonal moves may not enter or leave a
     * doorway.
     */
    public boolean canStep(GridPoint from, GridPoint to) {
        if (from.chebyshevDistance(to) != 1 || !isPassable(to)) {
            return false;
        }
        boolean diagonal = from.x != to.x && from.y != to.y;
        return !diagonal || (tileAt(from) != TileType.DOOR && tileAt(to) != TileType.DOOR);
    }

    /**
     * Cells reachable by one legal step, in {@link Direction} order.
     */
    public List<GridPoint> passableNeighbors(GridPoint point) {
        var result = new ArrayList<GridPoint>(8);
        for (var direction : Direction.values()) {
            var next = point.step(direction);
            if (canStep(point, next)) {
                result.add(next);
            }
        }
        return result;
    }

    /**
     * Every passable cell in row-major order.
     */
    public List<GridPoint> passableCells() {
        var result = new ArrayList<GridPoint>();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                var point = new GridPoint(x, y);
                if (isPassable(point)) {
                    result.add(point);
                }
            }
        }
        return result;
    }

    public List<Room> rooms() {
        return rooms;
    }

    public Optional<Room> roomAt(GridPoint point) {
        for (var room : rooms) {
            if (room.contains(point)) {
                return Optional.of(room);
            }
        }
        return Optional.empty();
    }

    public Optional<Room> room(int id) {
        return rooms.stream().filter(r -> r.id() == id).findFirst();
    }

    public Optional<Door> doorAt(GridPoint point) {
        return Optional.ofNullable(doors.get(point));
    }

    public Collection<Door> doors() {
        return Collections.unmodifiableCollection(doors.values());
    }

    /**
     * Uncollected gold piles in placement order.
     */
    public Set<GridPoint> goldPiles() {
        return Collections.unmodifiableSet(gold);
    }

    public boolean hasGold(GridPoint point) {
        return gold.contains(point);
    }

    /**
     * Remove the gold pile at a point.
     *
     * @return true if there was a pile to collect
     */
    public boolean collectGold(GridPoint point) {
        return gold.remove(point);
    }

    /**
     * Start a builder of the given size, filled with walls.
     */
    public static Builder builder(int width, int height) {
        return new Builder(width, height);
    }

    /**
     * Start a builder from ASCII rows. All rows must have the same length.
     */
    public static Builder builder(String... rows) {
        if (rows.length == 0) {
            throw new IllegalArgumentException("At least one row is required");
        }
        var builder = new Builder(rows[0].length(), rows.length);
        for (int y = 0; y < rows.length; y++) {
            var row = rows[y];
            if (row.length() != builder.width) {
                throw new IllegalArgumentException("Row " + y + " has length " + row.length() + ", expected "
                                                   + builder.width);
            }
            for (int x = 0; x < row.length(); x++) {
                builder.glyph(x, y, row.charAt(x));
            }
        }
        return builder;
    }

    @Override
    public String toString() {
        var sb = new StringBuilder();
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                var point = new GridPoint(x, y);
                sb.append(gold.contains(point) ? '$' : tiles[y][x].glyph());
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Builder for levels.
     */
    public static class Builder {
        private final int                  width;
        private final int                  height;
        private final TileType[][]         tiles;
        private final List<Room>           rooms = new ArrayList<>();
        private final Map<GridPoint, Door> doors = new LinkedHashMap<>();
        private final Set<GridPoint>       gold  = new LinkedHashSet<>();
        private       int                  depth = 1;

        private Builder(int width, int height) {
            if (width <= 0 || height <= 0) {
                throw new IllegalArgumentException("Level dimensions must be positive: " + width + "x" + height);
            }
            this.width = width;
            this.height = height;
            this.tiles = new TileType[height][width];
            for (var row : tiles) {
                Arrays.fill(row, TileType.WALL);
            }
        }

        public Builder depth(int depth) {
            if (depth < 1) {
                throw new IllegalArgumentException("Depth must be at least 1");
            }
            this.depth = depth;
            return this;
        }

        public Builder tile(int x, int y, TileType type) {
            checkBounds(x, y);
            tiles[y][x] = type;
            return this;
        }

        /**
         * Fill a rectangle with one tile type.
         */
        public Builder fill(int x, int y, int w, int h, TileType type) {
            for (int row = y; row < y + h; row++) {
                for (int col = x; col < x + w; col++) {
                    tile(col, row, type);
                }
            }
            return this;
        }

        /**
         * Register a room; its interior is carved to floor.
         */
        public Builder room(int id, int x, int y, int w, int h) {
            rooms.add(new Room(id, x, y, w, h));
            for (int row = y; row < y + h; row++) {
                for (int col = x; col < x + w; col++) {
                    checkBounds(col, row);
                    if (tiles[row][col] == TileType.WALL) {
                        tiles[row][col] = TileType.FLOOR;
                    }
                }
            }
            return this;
        }

        public Builder door(int x, int y, DoorState state, Integer... connectsRooms) {
            checkBounds(x, y);
            tiles[y][x] = TileType.DOOR;
            var position = new GridPoint(x, y);
            doors.put(position, new Door(position, state, List.of(connectsRooms)));
            return this;
        }

        public Builder gold(int x, int y) {
            checkBounds(x, y);
            gold.add(new GridPoint(x, y));
            return this;
        }

        public Level build() {
            return new Level(this);
        }

        private void glyph(int x, int y, char c) {
            switch (c) {
                case '#', ' ' -> tile(x, y, TileType.WALL);
                case '.' -> tile(x, y, TileType.FLOOR);
                case ',' -> tile(x, y, TileType.CORRIDOR);
                case '>' -> tile(x, y, TileType.STAIRS);
                case '$' -> {
                    tile(x, y, TileType.FLOOR);
                    gold(x, y);
                }
                case '+' -> door(x, y, DoorState.CLOSED);
                case '\'' -> door(x, y, DoorState.OPEN);
                case 'L' -> door(x, y, DoorState.LOCKED);
                case 'S' -> door(x, y, DoorState.SECRET);
                default -> throw new IllegalArgumentException("Unknown glyph '" + c + "' at (" + x + ", " + y + ")");
            }
        }

        private void checkBounds(int x, int y) {
            if (x < 0 || y < 0 || x >= width || y >= height) {
                throw new IllegalArgumentException("(" + x + ", " + y + ") outside " + width + "x" + height);
            }
        }
    }
}
