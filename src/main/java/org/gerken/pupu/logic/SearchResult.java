package org.gerken.pupu.logic;

import org.gerken.pupu.model.Board;
import org.gerken.pupu.model.BoardState;
import org.gerken.pupu.model.Move;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of a search, with the solution when there is one and the counters
 * collected along the way.
 */
public class SearchResult {

    /** How a search ended. */
    public enum Outcome {
        /** A cleared board was reached. */
        SOLVED,
        /** Every reachable board was examined without clearing the playfield. */
        NO_SOLUTION,
        /** The configured cap on distinct boards was hit before the search ended. */
        STATE_LIMIT_REACHED
    }

    private final Outcome outcome;
    private final BoardState solution;
    private final long boardsExamined;
    private final long statesGenerated;
    private final long statesDuplicated;
    private final long statesPruned;
    private final int visitedCount;

    /**
     * Creates a result from the final contents of a pending states container.
     *
     * @param outcome how the search ended
     * @param pendingStates the container used by the search
     */
    public SearchResult(Outcome outcome, PendingStates pendingStates) {
        if ((outcome == Outcome.SOLVED) != pendingStates.isSolutionFound()) {
            throw new IllegalStateException("Outcome " + outcome + " does not match recorded solution");
        }
        this.outcome = outcome;
        this.solution = pendingStates.getSolution();
        this.boardsExamined = pendingStates.getBoardsExamined();
        this.statesGenerated = pendingStates.getStatesGenerated();
        this.statesDuplicated = pendingStates.getStatesDuplicated();
        this.statesPruned = pendingStates.getStatesPruned();
        this.visitedCount = pendingStates.getVisitedCount();
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isSolved() {
        return outcome == Outcome.SOLVED;
    }

    /**
     * Gets the solved state.
     *
     * @return the solution state, or null if the search did not solve the puzzle
     */
    public BoardState getSolution() {
        return solution;
    }

    /**
     * Gets the moves from the initial board to the cleared board.
     *
     * @return the moves, empty if not solved or if the initial board was already cleared
     */
    public List<Move> getMoves() {
        return solution == null ? Collections.emptyList() : solution.getMoveHistory();
    }

    /**
     * Gets the cleared board.
     *
     * @return the final board, or null if not solved
     */
    public Board getFinalBoard() {
        return solution == null ? null : solution.getBoard();
    }

    public long getBoardsExamined() {
        return boardsExamined;
    }

    public long getStatesGenerated() {
        return statesGenerated;
    }

    public long getStatesDuplicated() {
        return statesDuplicated;
    }

    public long getStatesPruned() {
        return statesPruned;
    }

    public int getVisitedCount() {
        return visitedCount;
    }

    @Override
    public String toString() {
        return outcome + " after " + boardsExamined + " boards examined"
            + (solution != null ? " (" + solution.getMoveCount() + " moves)" : "");
    }
}
