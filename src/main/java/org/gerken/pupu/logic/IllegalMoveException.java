package org.gerken.pupu.logic;

import org.gerken.pupu.model.Move;

/**
 * Thrown when a move is applied that the move generator would never produce
 * for the given board.
 */
public class IllegalMoveException extends IllegalArgumentException {

    private final Move move;

    /**
     * Creates a new exception.
     *
     * @param move the rejected move
     * @param reason why the move was rejected
     */
    public IllegalMoveException(Move move, String reason) {
        super("Illegal move " + move.getNotation() + ": " + reason);
        this.move = move;
    }

    public Move getMove() {
        return move;
    }
}
