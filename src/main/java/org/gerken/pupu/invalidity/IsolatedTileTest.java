package org.gerken.pupu.invalidity;

import org.gerken.pupu.model.Board;

/**
 * Invalidity test that detects erasable tiles without a partner.
 *
 * Tiles only disappear in groups of two or more of the same kind. If exactly
 * one tile of some kind is left, it can never be cleared, and no later move
 * changes that.
 *
 * Thread-safe singleton implementation.
 */
public class IsolatedTileTest implements InvalidityTest {

    private static final IsolatedTileTest INSTANCE = new IsolatedTileTest();

    private IsolatedTileTest() {
        // Private constructor for singleton pattern
    }

    public static IsolatedTileTest getInstance() {
        return INSTANCE;
    }

    @Override
    public boolean isInvalid(Board board) {
        for (int count : board.getErasableCounts()) {
            if (count == 1) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String getName() {
        return "IsolatedTileTest";
    }
}
