package org.gerken.pupu.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Represents the kind of a single playfield cell.
 *
 * The first eight kinds are game pieces that fall and disappear when two or more
 * of the same kind touch. The glass block falls but never disappears. Walls,
 * background and empty floor never move.
 *
 * Each kind has a fixed one-character symbol used in level data.
 */
public enum Tile {

    HEART('H'),
    DIAMOND('D'),
    TRIANGLE('T'),
    RING('R'),
    CROSS_1('1'),
    SANDGLASS('S'),
    CROSS_2('2'),
    FRAME('F'),
    GLASS_BLOCK('G'),
    WALL('#'),
    BACKGROUND('P'),
    EMPTY('.');

    /** Number of erasable kinds. Erasable kinds have ordinals 0 to ERASABLE_KINDS - 1. */
    public static final int ERASABLE_KINDS = 8;

    private static final Tile[] VALUES = values();
    private static final Map<Character, Tile> BY_SYMBOL;

    static {
        Map<Character, Tile> map = new HashMap<>();
        for (Tile tile : VALUES) {
            map.put(tile.symbol, tile);
        }
        BY_SYMBOL = Collections.unmodifiableMap(map);
    }

    private final char symbol;

    Tile(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Gets the level-data symbol of this tile.
     *
     * @return the symbol character
     */
    public char getSymbol() {
        return symbol;
    }

    /**
     * Checks whether this tile falls under gravity and can be moved by the player.
     *
     * @return true for game pieces and the glass block
     */
    public boolean isMobile() {
        return ordinal() <= GLASS_BLOCK.ordinal();
    }

    /**
     * Checks whether this tile disappears when it touches a tile of the same kind.
     *
     * @return true for the eight game pieces
     */
    public boolean isErasable() {
        return ordinal() < ERASABLE_KINDS;
    }

    /**
     * Looks up the tile for a level-data symbol.
     *
     * @param symbol the symbol character
     * @return the tile, or null if the symbol is not part of the table
     */
    public static Tile fromSymbol(char symbol) {
        return BY_SYMBOL.get(symbol);
    }

    /**
     * Gets the tile with the given ordinal. Used to decode the compact board grid.
     *
     * @param ordinal the ordinal
     * @return the tile
     */
    public static Tile fromOrdinal(int ordinal) {
        return VALUES[ordinal];
    }
}
