package org.gerken.pupu.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Represents a board state in the search space.
 * Includes the current board configuration and links to the previous state,
 * so the move history is rebuilt on demand instead of being copied into every state.
 */
public class BoardState {

    private final Board board;
    private final Move lastMove;
    private final BoardState previousBoardState;
    private final int moveCount;

    /**
     * Creates an initial board state with the given board and no moves.
     *
     * @param board the board
     */
    public BoardState(Board board) {
        this(board, null, null);
    }

    /**
     * Creates a board state reached from {@code previousBoardState} by {@code lastMove}.
     *
     * @param board the resolved board after the move
     * @param lastMove the last move taken to reach this state, or null for an initial state
     * @param previousBoardState the state the move was applied to, or null for an initial state
     */
    public BoardState(Board board, Move lastMove, BoardState previousBoardState) {
        if ((lastMove == null) != (previousBoardState == null)) {
            throw new IllegalArgumentException("Move and previous state must both be set or both be null");
        }
        this.board = board;
        this.lastMove = lastMove;
        this.previousBoardState = previousBoardState;
        this.moveCount = previousBoardState == null ? 0 : previousBoardState.moveCount + 1;
    }

    /**
     * Gets the board for this state.
     *
     * @return the board
     */
    public Board getBoard() {
        return board;
    }

    /**
     * Gets the last move taken to reach this state.
     *
     * @return the last move, or null if this is the initial state
     */
    public Move getLastMove() {
        return lastMove;
    }

    /**
     * Gets the previous board state.
     *
     * @return the previous board state, or null if this is the initial state
     */
    public BoardState getPreviousBoardState() {
        return previousBoardState;
    }

    /**
     * Gets the number of moves taken to reach this state.
     *
     * @return the move count
     */
    public int getMoveCount() {
        return moveCount;
    }

    /**
     * Gets the initial state at the start of this state's history.
     *
     * @return the initial state
     */
    public BoardState getInitialState() {
        BoardState current = this;
        while (current.previousBoardState != null) {
            current = current.previousBoardState;
        }
        return current;
    }

    /**
     * Checks if the board in this state is cleared.
     *
     * @return true if no erasable tile is left
     */
    public boolean isSolved() {
        return board.isCleared();
    }

    /**
     * Gets the complete move history from the initial state to this state.
     * Traverses the previousBoardState chain to build the list in order.
     *
     * @return unmodifiable list of moves in order from first to last
     */
    public List<Move> getMoveHistory() {
        List<Move> history = new ArrayList<>(moveCount);
        BoardState current = this;
        while (current.lastMove != null) {
            history.add(current.lastMove);
            current = current.previousBoardState;
        }
        Collections.reverse(history);
        return Collections.unmodifiableList(history);
    }

    @Override
    public String toString() {
        return board.toString() + "\nMoves taken: " + moveCount;
    }
}
