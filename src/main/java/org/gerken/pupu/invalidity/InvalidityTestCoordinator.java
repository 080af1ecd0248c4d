package org.gerken.pupu.invalidity;

import org.gerken.pupu.model.Board;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Coordinator that runs all registered invalidity tests against boards.
 * This class is thread-safe and uses a singleton pattern.
 *
 * Currently registered tests:
 * 1. IsolatedTileTest - Detects an erasable kind with exactly one tile left
 */
public class InvalidityTestCoordinator {

    private static final InvalidityTestCoordinator INSTANCE = new InvalidityTestCoordinator();

    private final List<InvalidityTest> tests;

    private InvalidityTestCoordinator() {
        List<InvalidityTest> testList = new ArrayList<>();

        // Register invalidity test implementations here
        testList.add(IsolatedTileTest.getInstance());

        this.tests = Collections.unmodifiableList(testList);
    }

    public static InvalidityTestCoordinator getInstance() {
        return INSTANCE;
    }

    /**
     * Checks if the given board is invalid by running all registered tests.
     * Returns true if ANY test determines the board is invalid.
     *
     * @param board the board to evaluate
     * @return true if the board is invalid according to any test
     */
    public boolean isInvalid(Board board) {
        for (InvalidityTest test : tests) {
            if (test.isInvalid(board)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Checks whether the board passed every test. A true result does not
     * guarantee that the board can still be cleared.
     *
     * @param board the board to evaluate
     * @return true if no test found the board invalid
     */
    public boolean isSolvable(Board board) {
        return !isInvalid(board);
    }

    /**
     * Returns an unmodifiable list of all registered invalidity tests.
     *
     * @return the list of tests
     */
    public List<InvalidityTest> getTests() {
        return tests;
    }

    /**
     * Returns the number of registered invalidity tests.
     *
     * @return the count of tests
     */
    public int getTestCount() {
        return tests.size();
    }
}
