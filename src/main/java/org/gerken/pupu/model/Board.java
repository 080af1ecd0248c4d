package org.gerken.pupu.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Represents the puzzle playfield - a grid of tiles.
 * Rows are labeled A, B, C, etc. from the top and columns are labeled 1, 2, 3, etc.
 * from the left.
 *
 * The grid is stored as one byte per cell and is surrounded by a one-cell border
 * of walls, so neighbour lookups one step outside the playfield return WALL
 * instead of failing. The border is never written.
 *
 * Equality and hash code depend on the tile layout only, which makes a board
 * usable as a visited-set key regardless of how it was reached.
 */
public class Board {

    /** Height of a standard playfield. */
    public static final int STANDARD_ROWS = 12;

    /** Width of a standard playfield. */
    public static final int STANDARD_COLUMNS = 12;

    private final int rowCount;
    private final int columnCount;
    private final int stride;
    private final byte[] cells;

    /**
     * Creates a new board with the specified dimensions.
     * All playfield cells start as BACKGROUND.
     *
     * @param rowCount the number of rows
     * @param columnCount the number of columns
     */
    public Board(int rowCount, int columnCount) {
        if (rowCount <= 0 || columnCount <= 0) {
            throw new IllegalArgumentException("Invalid board dimensions: " + rowCount + "x" + columnCount);
        }
        this.rowCount = rowCount;
        this.columnCount = columnCount;
        this.stride = columnCount + 2;
        this.cells = new byte[(rowCount + 2) * stride];
        Arrays.fill(cells, (byte) Tile.WALL.ordinal());
        for (int row = 0; row < rowCount; row++) {
            for (int col = 0; col < columnCount; col++) {
                cells[index(row, col)] = (byte) Tile.BACKGROUND.ordinal();
            }
        }
    }

    /**
     * Creates a copy of an existing board.
     */
    private Board(Board other) {
        this.rowCount = other.rowCount;
        this.columnCount = other.columnCount;
        this.stride = other.stride;
        this.cells = other.cells.clone();
    }

    /**
     * Creates an independent copy of this board.
     *
     * @return a new board with the same tiles
     */
    public Board copy() {
        return new Board(this);
    }

    /**
     * Gets the tile at the specified position.
     * Positions one step outside the playfield (row or column -1, or equal to
     * the count) are part of the border and return WALL.
     *
     * @param row the row index (0-based, -1 to rowCount)
     * @param col the column index (0-based, -1 to columnCount)
     * @return the tile at that position
     */
    public Tile getTile(int row, int col) {
        return Tile.fromOrdinal(cells[index(row, col)]);
    }

    /**
     * Sets the tile at the specified position.
     *
     * @param row the row index (0-based)
     * @param col the column index (0-based)
     * @param tile the tile to place
     * @throws IndexOutOfBoundsException if the position is outside the playfield
     */
    public void setTile(int row, int col, Tile tile) {
        Objects.checkIndex(row, rowCount);
        Objects.checkIndex(col, columnCount);
        cells[index(row, col)] = (byte) tile.ordinal();
    }

    /**
     * Gets the number of rows in the board.
     *
     * @return the row count
     */
    public int getRowCount() {
        return rowCount;
    }

    /**
     * Gets the number of columns in the board.
     *
     * @return the column count
     */
    public int getColumnCount() {
        return columnCount;
    }

    /**
     * Counts the remaining tiles of each erasable kind.
     *
     * @return array indexed by tile ordinal, length {@link Tile#ERASABLE_KINDS}
     */
    public int[] getErasableCounts() {
        int[] counts = new int[Tile.ERASABLE_KINDS];
        for (int row = 0; row < rowCount; row++) {
            for (int col = 0; col < columnCount; col++) {
                int ordinal = cells[index(row, col)];
                if (ordinal < Tile.ERASABLE_KINDS) {
                    counts[ordinal]++;
                }
            }
        }
        return counts;
    }

    /**
     * Counts all erasable tiles on the board.
     *
     * @return the number of erasable tiles
     */
    public int getErasableTileCount() {
        int total = 0;
        for (int count : getErasableCounts()) {
            total += count;
        }
        return total;
    }

    /**
     * Checks if this board is cleared, i.e. no erasable tile is left.
     * Glass blocks may remain.
     *
     * @return true if the board is cleared
     */
    public boolean isCleared() {
        for (int row = 0; row < rowCount; row++) {
            for (int col = 0; col < columnCount; col++) {
                if (cells[index(row, col)] < Tile.ERASABLE_KINDS) {
                    return false;
                }
            }
        }
        return true;
    }

    private int index(int row, int col) {
        return (row + 1) * stride + col + 1;
    }

    /**
     * Returns the board as level data: one line of symbols per row.
     *
     * @return the board rows separated by newlines
     */
    @Override
    public String toString() {
        StringBuilder result = new StringBuilder();
        for (int row = 0; row < rowCount; row++) {
            for (int col = 0; col < columnCount; col++) {
                result.append(getTile(row, col).getSymbol());
            }
            if (row < rowCount - 1) {
                result.append("\n");
            }
        }
        return result.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Board board = (Board) o;
        return rowCount == board.rowCount && columnCount == board.columnCount
            && Arrays.equals(cells, board.cells);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * rowCount + columnCount) + Arrays.hashCode(cells);
    }
}
