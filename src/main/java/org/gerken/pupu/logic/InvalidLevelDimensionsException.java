package org.gerken.pupu.logic;

/**
 * Thrown when level data has the wrong number of rows, or a row has the wrong
 * number of symbols.
 */
public class InvalidLevelDimensionsException extends LevelFormatException {

    private final int expected;
    private final int actual;

    /**
     * Creates a new exception.
     *
     * @param what what was counted, e.g. "rows" or "symbols in row C"
     * @param expected the required count
     * @param actual the count found in the level data
     */
    public InvalidLevelDimensionsException(String what, int expected, int actual) {
        super(String.format("Expected %d %s, got %d", expected, what, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() {
        return expected;
    }

    public int getActual() {
        return actual;
    }
}
