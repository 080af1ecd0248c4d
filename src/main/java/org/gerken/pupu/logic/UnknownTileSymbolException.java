package org.gerken.pupu.logic;

/**
 * Thrown when level data contains a character that is not a tile symbol.
 */
public class UnknownTileSymbolException extends LevelFormatException {

    private final char symbol;
    private final int row;
    private final int col;

    /**
     * Creates a new exception.
     *
     * @param symbol the offending character
     * @param row the row index (0-based)
     * @param col the column index (0-based)
     */
    public UnknownTileSymbolException(char symbol, int row, int col) {
        super(String.format("'%c' is not a valid tile (row %c, column %d)", symbol, (char) ('A' + row), col + 1));
        this.symbol = symbol;
        this.row = row;
        this.col = col;
    }

    public char getSymbol() {
        return symbol;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }
}
