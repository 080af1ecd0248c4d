package org.gerken.pupu.logic;

import static org.gerken.pupu.BoardFixtures.level93;
import static org.gerken.pupu.BoardFixtures.state;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.gerken.pupu.model.Board;
import org.gerken.pupu.model.BoardState;
import org.gerken.pupu.model.Move;
import org.gerken.pupu.model.Tile;
import org.junit.jupiter.api.*;

class StateProcessorTest {

    private static SearchResult search(BoardState initial) {
        return new StateProcessor(new PendingStates()).search(initial);
    }

    @Test
    void boardWithoutErasableTilesIsSolvedRightAway() {
        Board board = new Board(Board.STANDARD_ROWS, Board.STANDARD_COLUMNS);
        for (int col = 0; col < Board.STANDARD_COLUMNS; col++) {
            board.setTile(10, col, Tile.EMPTY);
            board.setTile(11, col, Tile.WALL);
        }
        SearchResult result = search(new BoardState(board));

        assertTrue(result.isSolved());
        assertEquals(SearchResult.Outcome.SOLVED, result.getOutcome());
        assertTrue(result.getMoves().isEmpty());
        assertEquals(board, result.getFinalBoard());
        assertEquals(0, result.getBoardsExamined());
    }

    @Test
    void onlyGlassLeftCountsAsSolved() {
        SearchResult result = search(state("G../###"));
        assertTrue(result.isSolved());
        assertTrue(result.getMoves().isEmpty());
    }

    @Test
    void singleSlideIntoAPair() {
        SearchResult result = search(state("H..H/####"));

        assertTrue(result.isSolved());
        assertEquals(List.of(new Move(0, 0, 2)), result.getMoves());
        assertTrue(result.getFinalBoard().isCleared());
        assertEquals(1, result.getBoardsExamined());
        assertEquals(2, result.getStatesGenerated());
    }

    @Test
    void loneTileIsNeverSolved() {
        SearchResult result = search(state("H.DD/####"));

        assertFalse(result.isSolved());
        assertEquals(SearchResult.Outcome.NO_SOLUTION, result.getOutcome());
        assertNull(result.getSolution());
        assertNull(result.getFinalBoard());
        assertTrue(result.getMoves().isEmpty());
        assertEquals(0, result.getBoardsExamined());
        assertEquals(1, result.getStatesPruned());
    }

    @Test
    void pairThatCanNeverMeetExhaustsTheSearch() {
        SearchResult result = search(state("H.#H/####"));

        assertEquals(SearchResult.Outcome.NO_SOLUTION, result.getOutcome());
        assertEquals(2, result.getBoardsExamined());
        assertEquals(2, result.getStatesGenerated());
        assertEquals(1, result.getStatesDuplicated());
        assertEquals(2, result.getVisitedCount());
    }

    @Test
    void prunedBoardsAreNotExpanded() {
        SearchResult result = search(state("HDHD./DHD#D/#####"));

        assertEquals(SearchResult.Outcome.NO_SOLUTION, result.getOutcome());
        assertEquals(4, result.getBoardsExamined());
        assertEquals(7, result.getStatesGenerated());
        assertEquals(2, result.getStatesDuplicated());
        assertEquals(2, result.getStatesPruned());
        assertEquals(6, result.getVisitedCount());
        // Everything generated was either dropped or examined later
        assertEquals(result.getStatesGenerated(), result.getStatesPruned() + result.getStatesDuplicated()
            + result.getBoardsExamined() - 1);
    }

    @Test
    void solvesLevel93() {
        BoardState initial = level93();
        SearchResult result = search(initial);

        assertTrue(result.isSolved());
        assertEquals(15, result.getMoves().size());
        assertEquals(1394, result.getBoardsExamined());
        assertTrue(result.getFinalBoard().isCleared());
        assertSame(initial, result.getSolution().getInitialState());
    }

    @Test
    void replayingTheSolutionReproducesTheFinalBoard() {
        BoardState initial = level93();
        SearchResult result = search(initial);

        List<Board> boards = SolutionReplayer.replay(initial.getBoard(), result.getMoves());
        Board last = boards.get(boards.size() - 1);
        assertEquals(result.getFinalBoard(), last);
        assertEquals(0, last.getErasableTileCount());
    }

    @Test
    void stateLimitStopsTheSearch() {
        SearchResult result = new StateProcessor(new PendingStates(), 10).search(level93());

        assertEquals(SearchResult.Outcome.STATE_LIMIT_REACHED, result.getOutcome());
        assertFalse(result.isSolved());
        assertEquals(10, result.getVisitedCount());
    }

    @Test
    void generousLimitDoesNotChangeTheResult() {
        SearchResult limited = new StateProcessor(new PendingStates(), 1_000_000).search(level93());
        SearchResult unlimited = search(level93());
        assertEquals(unlimited.getMoves(), limited.getMoves());
    }

    @Test
    void searchMarksTheContainerFinished() {
        PendingStates pendingStates = new PendingStates();
        assertFalse(pendingStates.isFinished());
        new StateProcessor(pendingStates).search(state("H..H/####"));
        assertTrue(pendingStates.isFinished());
    }

    @Test
    void negativeLimitIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new StateProcessor(new PendingStates(), -1));
    }

    @Test
    void resultMustAgreeWithTheRecordedSolution() {
        PendingStates unsolved = new PendingStates();
        assertFalse(unsolved.isSolutionFound());
        assertThrows(IllegalStateException.class, () -> new SearchResult(SearchResult.Outcome.SOLVED, unsolved));

        PendingStates solved = new PendingStates();
        solved.markSolutionFound(state("H..H/####"));
        assertTrue(solved.isSolutionFound());
        assertThrows(IllegalStateException.class, () -> new SearchResult(SearchResult.Outcome.NO_SOLUTION, solved));
    }
}
