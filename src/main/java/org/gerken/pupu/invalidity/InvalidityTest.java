package org.gerken.pupu.invalidity;

import org.gerken.pupu.model.Board;

/**
 * Interface for thread-safe singleton classes that test whether a board can no longer be cleared.
 * All implementations of this interface will be used to prune the search space.
 *
 * A test may only report boards that are certainly dead ends; returning false
 * says nothing about whether the board can still be cleared.
 */
public interface InvalidityTest {

    /**
     * Determines if the given board cannot lead to a solution.
     *
     * @param board the board to evaluate
     * @return true if the board is invalid and should be pruned from the search space
     */
    boolean isInvalid(Board board);

    /**
     * Returns a descriptive name for this invalidity test.
     * Useful for logging and progress reporting.
     *
     * @return the name of this test
     */
    String getName();
}
