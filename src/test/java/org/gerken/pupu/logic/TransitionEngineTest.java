package org.gerken.pupu.logic;

import static org.gerken.pupu.BoardFixtures.board;
import static org.gerken.pupu.BoardFixtures.level93;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

import org.gerken.pupu.model.Board;
import org.gerken.pupu.model.BoardState;
import org.gerken.pupu.model.Move;
import org.gerken.pupu.model.Tile;
import org.junit.jupiter.api.*;

class TransitionEngineTest {

    private static final TransitionEngine ENGINE = TransitionEngine.getInstance();
    private static final MoveGenerator GEN = MoveGenerator.getInstance();

    @Test
    void slideIntoAPairClearsItWithoutGravity() {
        Board result = ENGINE.apply(board("H..H/####"), new Move(0, 0, 2));
        assertEquals(board("..../####"), result);
    }

    @Test
    void slideWithoutMatchJustMovesTheTile() {
        Board result = ENGINE.apply(board("H..H/####"), new Move(0, 0, 1));
        assertEquals(board(".H.H/####"), result);
    }

    @Test
    void tileDropsOntoItsTwinAndBothDisappear() {
        Board result = ENGINE.apply(board("H../#../#H#"), new Move(0, 0, 1));
        assertEquals(board(".../#../#.#"), result);
    }

    @Test
    void removalLetsTilesAboveFallIntoTheNextMatch() {
        Board result = ENGINE.apply(board("..D../..H.H/##D##/#####"), new Move(1, 4, 3));
        assertEquals(board("...../...../##.##/#####"), result);
    }

    @Test
    void fallingTileLandsOnTheLowestEmptyCell() {
        Board result = ENGINE.apply(board("D../#../#../#H#"), new Move(0, 0, 1));
        assertEquals(board(".../#../#D./#H#"), result);
    }

    @Test
    void groupsOfAnyShapeAreClearedAtOnce() {
        Board stable = ENGINE.stabilize(board("HHD/.HD/HH#"));
        assertEquals(board(".../.../..#"), stable);
    }

    @Test
    void differentKindsDoNotMatch() {
        Board board = board("HD/##");
        assertEquals(board, ENGINE.stabilize(board));
    }

    @Test
    void glassBlocksFallButStay() {
        Board result = ENGINE.stabilize(board("GG/HH"));
        assertEquals(board("../GG"), result);
    }

    @Test
    void inputBoardIsNeverModified() {
        Board input = board("..D../..H.H/##D##/#####");
        Board snapshot = input.copy();
        ENGINE.apply(input, new Move(1, 4, 3));
        ENGINE.stabilize(input);
        assertEquals(snapshot, input);
    }

    @Test
    void stabilizingTwiceChangesNothing() {
        Board once = ENGINE.stabilize(board("D.H/H.D/.HD/##."));
        assertEquals(board(".../.../D../##H"), once);
        assertEquals(once, ENGINE.stabilize(once));

        Board board = level93().getBoard();
        for (Move move : GEN.generateMoves(board)) {
            Board next = ENGINE.apply(board, move);
            assertEquals(next, ENGINE.stabilize(next), move.toString());
        }
    }

    @Test
    void tilesAreOnlyEverRemovedOrRearranged() {
        // Walk a few levels of the level 93 state space
        Deque<Board> pending = new ArrayDeque<>();
        Set<Board> seen = new HashSet<>();
        pending.add(level93().getBoard());
        while (!pending.isEmpty() && seen.size() < 300) {
            Board board = pending.poll();
            int[] before = board.getErasableCounts();
            int glassBefore = countGlass(board);
            for (Move move : GEN.generateMoves(board)) {
                Board next = ENGINE.apply(board, move);
                int[] after = next.getErasableCounts();
                for (int kind = 0; kind < Tile.ERASABLE_KINDS; kind++) {
                    assertTrue(after[kind] <= before[kind], "tiles of kind " + kind + " appeared after " + move);
                }
                assertEquals(glassBefore, countGlass(next));
                if (seen.add(next)) {
                    pending.add(next);
                }
            }
        }
    }

    @Test
    void sceneryNeverChanges() {
        Board board = level93().getBoard();
        for (Move move : GEN.generateMoves(board)) {
            Board next = ENGINE.apply(board, move);
            for (int row = 0; row < board.getRowCount(); row++) {
                for (int col = 0; col < board.getColumnCount(); col++) {
                    Tile tile = board.getTile(row, col);
                    if (tile == Tile.WALL || tile == Tile.BACKGROUND) {
                        assertEquals(tile, next.getTile(row, col));
                    }
                }
            }
        }
    }

    @Test
    void stateTransitionLinksBackToTheParent() {
        BoardState initial = new BoardState(board("H..H/####"));
        Move move = new Move(0, 0, 2);
        BoardState next = ENGINE.apply(initial, move);

        assertSame(initial, next.getPreviousBoardState());
        assertEquals(move, next.getLastMove());
        assertEquals(1, next.getMoveCount());
        assertTrue(next.isSolved());
    }

    @Test
    void illegalMovesAreRejectedWithTheMove() {
        Board board = board("H.../#.##/####");
        Move move = new Move(0, 0, 3);
        IllegalMoveException e = assertThrows(IllegalMoveException.class, () -> ENGINE.apply(board, move));
        assertEquals(move, e.getMove());
        assertTrue(e.getMessage().contains("A1-A4"), e.getMessage());

        assertThrows(IllegalMoveException.class, () -> ENGINE.apply(board, new Move(1, 0, 1)));
    }

    private static int countGlass(Board board) {
        int count = 0;
        for (int row = 0; row < board.getRowCount(); row++) {
            for (int col = 0; col < board.getColumnCount(); col++) {
                if (board.getTile(row, col) == Tile.GLASS_BLOCK) {
                    count++;
                }
            }
        }
        return count;
    }
}
