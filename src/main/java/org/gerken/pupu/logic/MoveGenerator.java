package org.gerken.pupu.logic;

import org.gerken.pupu.model.Board;
import org.gerken.pupu.model.Move;
import org.gerken.pupu.model.Tile;

import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates the legal moves of a board.
 *
 * A mobile tile may slide left or right across empty cells. Sliding in one
 * direction ends at the first destination that has empty floor or a tile of the
 * same kind directly below it; that destination is still offered. Destinations
 * further out are reached through other move sequences.
 *
 * Moves are produced in row-major order of the source tile, left before right,
 * nearest destination first.
 *
 * Thread-safe singleton implementation.
 */
public class MoveGenerator {

    private static final MoveGenerator INSTANCE = new MoveGenerator();

    private static final int[] DIRECTIONS = {-1, 1};

    private MoveGenerator() {
        // Private constructor for singleton pattern
    }

    public static MoveGenerator getInstance() {
        return INSTANCE;
    }

    /**
     * Generates all legal moves for the given board.
     *
     * @param board the board
     * @return the moves in a fixed, deterministic order
     */
    public List<Move> generateMoves(Board board) {
        List<Move> moves = new ArrayList<>();

        for (int row = 0; row < board.getRowCount(); row++) {
            for (int col = 0; col < board.getColumnCount(); col++) {
                Tile tile = board.getTile(row, col);
                if (!tile.isMobile()) {
                    continue;
                }

                for (int dir : DIRECTIONS) {
                    // The wall border ends every walk inside the board
                    int col2 = col + dir;
                    while (board.getTile(row, col2) == Tile.EMPTY) {
                        moves.add(new Move(row, col, col2));
                        if (stopsAt(board, tile, row, col2)) {
                            break;
                        }
                        col2 += dir;
                    }
                }
            }
        }

        return moves;
    }

    /**
     * Checks whether {@link #generateMoves(Board)} would produce the given move.
     *
     * @param board the board
     * @param move the move to check
     * @return true if the move is legal on this board
     */
    public boolean isLegal(Board board, Move move) {
        return describeViolation(board, move) == null;
    }

    /**
     * Explains why a move is not legal on a board.
     *
     * @return a short reason, or null if the move is legal
     */
    String describeViolation(Board board, Move move) {
        int row = move.getRow();
        int fromCol = move.getFromCol();
        int toCol = move.getToCol();

        if (row < 0 || row >= board.getRowCount()
                || fromCol < 0 || fromCol >= board.getColumnCount()
                || toCol < 0 || toCol >= board.getColumnCount()) {
            return "outside the playfield";
        }
        if (fromCol == toCol) {
            return "source and destination are the same cell";
        }

        Tile tile = board.getTile(row, fromCol);
        if (!tile.isMobile()) {
            return "no movable tile at the source (found " + tile + ")";
        }

        int dir = toCol > fromCol ? 1 : -1;
        for (int col = fromCol + dir; ; col += dir) {
            if (board.getTile(row, col) != Tile.EMPTY) {
                return "cell " + (col + 1) + " on the way is not empty";
            }
            if (col == toCol) {
                return null;
            }
            if (stopsAt(board, tile, row, col)) {
                return "the tile stops at column " + (col + 1) + " before reaching the destination";
            }
        }
    }

    /**
     * A slide stops above empty floor (the tile drops) or above its own kind (it matches).
     */
    private boolean stopsAt(Board board, Tile tile, int row, int col) {
        Tile below = board.getTile(row + 1, col);
        return below == Tile.EMPTY || below == tile;
    }
}
