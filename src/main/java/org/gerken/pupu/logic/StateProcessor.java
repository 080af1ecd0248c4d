package org.gerken.pupu.logic;

import org.gerken.pupu.invalidity.InvalidityTestCoordinator;
import org.gerken.pupu.model.BoardState;
import org.gerken.pupu.model.Move;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Runs the breadth-first search over board states.
 *
 * States are taken from the front of the queue, every legal move is applied,
 * and each successor is handled in this order:
 * 1. A board layout that was already seen is dropped.
 * 2. Otherwise the layout is recorded as seen right away.
 * 3. A board the invalidity tests reject is dropped.
 * 4. A cleared board is the solution and ends the search.
 * 5. Anything else is queued.
 *
 * Because states leave the queue in the order they were reached, the first
 * state recorded for a layout is one with the fewest moves.
 */
public class StateProcessor {

    private static final Logger log = LoggerFactory.getLogger(StateProcessor.class);

    private static final long LOG_INTERVAL = 100_000;

    private final PendingStates pendingStates;
    private final InvalidityTestCoordinator coordinator;
    private final MoveGenerator moveGenerator;
    private final TransitionEngine transitionEngine;
    private final long maxStates;

    /**
     * Creates a new state processor without a limit on the number of boards.
     *
     * @param pendingStates the container of pending states and statistics
     */
    public StateProcessor(PendingStates pendingStates) {
        this(pendingStates, 0);
    }

    /**
     * Creates a new state processor.
     *
     * @param pendingStates the container of pending states and statistics
     * @param maxStates stop once this many distinct boards have been seen (0 for no limit)
     */
    public StateProcessor(PendingStates pendingStates, long maxStates) {
        if (maxStates < 0) {
            throw new IllegalArgumentException("maxStates must be non-negative: " + maxStates);
        }
        this.pendingStates = pendingStates;
        this.coordinator = InvalidityTestCoordinator.getInstance();
        this.moveGenerator = MoveGenerator.getInstance();
        this.transitionEngine = TransitionEngine.getInstance();
        this.maxStates = maxStates;
    }

    /**
     * Searches for a sequence of moves that clears the board of the given state.
     * Runs in the calling thread until a solution is found, every reachable board
     * has been examined, or the state limit is hit.
     *
     * @param initialState the starting state
     * @return the outcome with the solution, if any, and the search counters
     */
    public SearchResult search(BoardState initialState) {
        try {
            return new SearchResult(runSearch(initialState), pendingStates);
        } finally {
            pendingStates.setFinished();
        }
    }

    private SearchResult.Outcome runSearch(BoardState initialState) {
        pendingStates.markVisited(initialState.getBoard());

        if (initialState.isSolved()) {
            log.info("Initial board has no erasable tiles, nothing to do");
            pendingStates.markSolutionFound(initialState);
            return SearchResult.Outcome.SOLVED;
        }
        if (coordinator.isInvalid(initialState.getBoard())) {
            log.info("Initial board can never be cleared");
            pendingStates.incrementStatesPruned();
            return SearchResult.Outcome.NO_SOLUTION;
        }

        pendingStates.add(initialState);
        log.info("Search started");

        BoardState state;
        while ((state = pendingStates.poll()) != null) {
            long examined = pendingStates.getBoardsExamined() + 1;
            pendingStates.incrementBoardsExamined();
            if (examined % LOG_INTERVAL == 0) {
                log.info("{} boards analysed, current queue size {}", examined, pendingStates.size());
            }

            SearchResult.Outcome outcome = processState(state);
            if (outcome != null) {
                return outcome;
            }
        }

        log.info("Search space exhausted after {} boards", pendingStates.getBoardsExamined());
        return SearchResult.Outcome.NO_SOLUTION;
    }

    /**
     * Processes a board state by generating all possible successor states.
     *
     * @return the outcome if the search ends here, otherwise null
     */
    private SearchResult.Outcome processState(BoardState state) {
        List<Move> possibleMoves = moveGenerator.generateMoves(state.getBoard());

        for (Move move : possibleMoves) {
            BoardState nextState = transitionEngine.apply(state, move);
            pendingStates.incrementStatesGenerated();

            if (!pendingStates.markVisited(nextState.getBoard())) {
                pendingStates.incrementStatesDuplicated();
                continue;
            }

            if (coordinator.isInvalid(nextState.getBoard())) {
                pendingStates.incrementStatesPruned();
            } else if (nextState.isSolved()) {
                log.info("Solution found with {} moves after {} boards",
                    nextState.getMoveCount(), pendingStates.getBoardsExamined());
                pendingStates.markSolutionFound(nextState);
                return SearchResult.Outcome.SOLVED;
            } else {
                pendingStates.add(nextState);
            }

            if (maxStates > 0 && pendingStates.getVisitedCount() >= maxStates) {
                log.warn("State limit of {} boards reached, giving up", maxStates);
                return SearchResult.Outcome.STATE_LIMIT_REACHED;
            }
        }
        return null;
    }
}
