package org.gerken.pupu.model;

/**
 * Represents a move in the puzzle - sliding one tile horizontally within its row.
 * Moves are labeled using row/column labels (e.g., "D7-D5" slides the tile at D7 to D5).
 * Falling is never a move of its own; it happens as a consequence of a slide.
 */
public class Move {

    private final int row;
    private final int fromCol;
    private final int toCol;
    private final String notation;

    /**
     * Creates a move within a row.
     *
     * @param row the row index (0-based)
     * @param fromCol the column of the tile being moved (0-based)
     * @param toCol the destination column (0-based)
     */
    public Move(int row, int fromCol, int toCol) {
        this.row = row;
        this.fromCol = fromCol;
        this.toCol = toCol;
        this.notation = toNotation(row, fromCol) + "-" + toNotation(row, toCol);
    }

    public int getRow() {
        return row;
    }

    public int getFromCol() {
        return fromCol;
    }

    public int getToCol() {
        return toCol;
    }

    /**
     * Gets the move in algebraic notation (e.g., "D7-D5").
     *
     * @return the move notation
     */
    public String getNotation() {
        return notation;
    }

    /**
     * Gets the move as zero-based coordinates, column first: "(7,3)->(5,3)".
     *
     * @return the coordinate form of the move
     */
    public String getCoordinates() {
        return "(" + fromCol + "," + row + ")->(" + toCol + "," + row + ")";
    }

    /**
     * Converts row and column indices to algebraic notation.
     */
    private String toNotation(int row, int col) {
        char rowLabel = (char) ('A' + row);
        int colLabel = col + 1;
        return "" + rowLabel + colLabel;
    }

    @Override
    public String toString() {
        return notation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Move move = (Move) o;
        return row == move.row && fromCol == move.fromCol && toCol == move.toCol;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * row + fromCol) + toCol;
    }
}
