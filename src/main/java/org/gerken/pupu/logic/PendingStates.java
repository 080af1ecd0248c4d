package org.gerken.pupu.logic;

import org.gerken.pupu.model.Board;
import org.gerken.pupu.model.BoardState;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Container for pending board states, the set of boards already seen, and
 * processing statistics.
 *
 * This class provides a clean abstraction layer for:
 * - Managing pending states in first-in-first-out order (breadth-first search)
 * - Remembering every board layout reached so far, independent of move history
 * - Tracking processing statistics (examined, generated, duplicate, pruned counts)
 * - Recording the solution and whether the search has ended
 *
 * The search itself runs in one thread. The collections and counters are
 * concurrent so the progress reporter can read them while the search runs.
 */
public class PendingStates {

    private final ConcurrentLinkedQueue<BoardState> queue;
    private final Set<Board> visited;
    private final AtomicReference<BoardState> solution;
    private volatile boolean finished;
    private final AtomicLong boardsExamined;
    private final AtomicLong statesGenerated;
    private final AtomicLong statesDuplicated;
    private final AtomicLong statesPruned;

    /**
     * Creates a new, empty pending states container with all counters initialized to zero.
     */
    public PendingStates() {
        this.queue = new ConcurrentLinkedQueue<>();
        this.visited = ConcurrentHashMap.newKeySet();
        this.solution = new AtomicReference<>(null);
        this.finished = false;
        this.boardsExamined = new AtomicLong(0);
        this.statesGenerated = new AtomicLong(0);
        this.statesDuplicated = new AtomicLong(0);
        this.statesPruned = new AtomicLong(0);
    }

    // ========== Queue Operations (Breadth-First Strategy) ==========

    /**
     * Adds a board state to the back of the queue.
     *
     * @param state the board state to add
     */
    public void add(BoardState state) {
        queue.add(state);
    }

    /**
     * Retrieves and removes the oldest pending board state.
     *
     * @return the next board state, or null if the queue is empty
     */
    public BoardState poll() {
        return queue.poll();
    }

    /**
     * Returns the number of pending states.
     * The value may be stale when read from another thread.
     *
     * @return the current queue size
     */
    public int size() {
        return queue.size();
    }

    // ========== Visited Boards ==========

    /**
     * Records a board layout as seen.
     *
     * @param board the board to record
     * @return true if the layout had not been seen before
     */
    public boolean markVisited(Board board) {
        return visited.add(board);
    }

    /**
     * Gets the number of distinct board layouts seen so far.
     *
     * @return the visited count
     */
    public int getVisitedCount() {
        return visited.size();
    }

    // ========== Solution Coordination ==========

    /**
     * Checks if a solution has been found.
     *
     * @return true if a solution was found
     */
    public boolean isSolutionFound() {
        return solution.get() != null;
    }

    /**
     * Marks that a solution has been found.
     *
     * @param solutionState the solution board state
     */
    public void markSolutionFound(BoardState solutionState) {
        solution.set(solutionState);
    }

    /**
     * Gets the solution board state if one was found.
     *
     * @return the solution state, or null if no solution found
     */
    public BoardState getSolution() {
        return solution.get();
    }

    /**
     * Marks the search as ended, whatever the outcome.
     */
    public void setFinished() {
        finished = true;
    }

    /**
     * Checks if the search has ended.
     *
     * @return true once the search has stopped
     */
    public boolean isFinished() {
        return finished;
    }

    // ========== Statistics ==========

    public void incrementBoardsExamined() {
        boardsExamined.incrementAndGet();
    }

    public void incrementStatesGenerated() {
        statesGenerated.incrementAndGet();
    }

    public void incrementStatesDuplicated() {
        statesDuplicated.incrementAndGet();
    }

    public void incrementStatesPruned() {
        statesPruned.incrementAndGet();
    }

    /**
     * Gets the number of states taken from the queue and expanded.
     *
     * @return the examined count
     */
    public long getBoardsExamined() {
        return boardsExamined.get();
    }

    /**
     * Gets the number of successor states produced by applying moves.
     *
     * @return the generated count
     */
    public long getStatesGenerated() {
        return statesGenerated.get();
    }

    /**
     * Gets the number of generated states whose board had already been seen.
     *
     * @return the duplicate count
     */
    public long getStatesDuplicated() {
        return statesDuplicated.get();
    }

    /**
     * Gets the number of new states discarded by the invalidity tests.
     *
     * @return the pruned count
     */
    public long getStatesPruned() {
        return statesPruned.get();
    }
}
