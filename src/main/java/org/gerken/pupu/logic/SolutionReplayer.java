package org.gerken.pupu.logic;

import org.gerken.pupu.model.Board;
import org.gerken.pupu.model.Move;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Replays a move sequence from an initial board, producing every intermediate
 * board. This is what a viewer steps through when showing a solution.
 */
public class SolutionReplayer {

    private SolutionReplayer() {
    }

    /**
     * Applies the moves one after another.
     *
     * @param initial the starting board
     * @param moves the moves to apply in order
     * @return unmodifiable list with the initial board first followed by one board per move
     * @throws IllegalMoveException if a move is not legal on the board it is applied to
     */
    public static List<Board> replay(Board initial, List<Move> moves) {
        TransitionEngine engine = TransitionEngine.getInstance();
        List<Board> boards = new ArrayList<>(moves.size() + 1);
        Board current = initial;
        boards.add(current);
        for (Move move : moves) {
            current = engine.apply(current, move);
            boards.add(current);
        }
        return Collections.unmodifiableList(boards);
    }
}
