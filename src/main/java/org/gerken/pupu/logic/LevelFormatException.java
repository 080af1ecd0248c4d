package org.gerken.pupu.logic;

/**
 * Thrown when level data cannot be turned into a board.
 */
public class LevelFormatException extends IllegalArgumentException {

    public LevelFormatException(String message) {
        super(message);
    }
}
