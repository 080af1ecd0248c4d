package org.gerken.pupu.logic;

import org.gerken.pupu.model.Board;
import org.gerken.pupu.model.BoardState;
import org.gerken.pupu.model.Move;
import org.gerken.pupu.model.Tile;

/**
 * Applies moves to boards.
 *
 * Applying a move slides the tile, then alternates a gravity pass and a removal
 * pass until a full cycle changes nothing:
 * - Gravity: from the second-lowest row upwards, every mobile tile above empty
 *   floor drops to the lowest empty cell of that run.
 * - Removal: every group of two or more 4-connected erasable tiles of the same
 *   kind is cleared.
 *
 * The input board is never modified; every call works on a copy.
 *
 * Thread-safe singleton implementation.
 */
public class TransitionEngine {

    private static final TransitionEngine INSTANCE = new TransitionEngine();

    private final MoveGenerator moveGenerator;

    private TransitionEngine() {
        this.moveGenerator = MoveGenerator.getInstance();
    }

    public static TransitionEngine getInstance() {
        return INSTANCE;
    }

    /**
     * Creates a new board state by applying a move to the given state.
     *
     * @param state the state to move from
     * @param move the move to apply
     * @return the successor state, linked back to {@code state}
     * @throws IllegalMoveException if the move is not legal on the state's board
     */
    public BoardState apply(BoardState state, Move move) {
        return new BoardState(apply(state.getBoard(), move), move, state);
    }

    /**
     * Creates a new, stable board by applying a move to the given board.
     *
     * @param board the board to move on (left unchanged)
     * @param move the move to apply
     * @return the resolved board
     * @throws IllegalMoveException if the move is not legal on the board
     */
    public Board apply(Board board, Move move) {
        String violation = moveGenerator.describeViolation(board, move);
        if (violation != null) {
            throw new IllegalMoveException(move, violation);
        }

        Board result = board.copy();
        int row = move.getRow();
        Tile tile = result.getTile(row, move.getFromCol());
        result.setTile(row, move.getFromCol(), Tile.EMPTY);
        result.setTile(row, move.getToCol(), tile);

        resolve(result);
        return result;
    }

    /**
     * Runs gravity and removal on a copy of the board until nothing changes.
     *
     * @param board the board (left unchanged)
     * @return the stable board
     */
    public Board stabilize(Board board) {
        Board result = board.copy();
        resolve(result);
        return result;
    }

    private void resolve(Board board) {
        boolean changed;
        do {
            changed = dropTiles(board);
            changed |= removeTiles(board);
        } while (changed);
    }

    /**
     * Lets every mobile tile fall as far as the empty cells below it reach.
     * Lower rows go first, so one pass settles the whole board.
     *
     * @return true if any tile moved
     */
    private boolean dropTiles(Board board) {
        boolean changed = false;
        for (int row = board.getRowCount() - 2; row >= 0; row--) {
            for (int col = 0; col < board.getColumnCount(); col++) {
                Tile tile = board.getTile(row, col);
                if (!tile.isMobile() || board.getTile(row + 1, col) != Tile.EMPTY) {
                    continue;
                }
                int target = row + 1;
                while (board.getTile(target + 1, col) == Tile.EMPTY) {
                    target++;
                }
                board.setTile(row, col, Tile.EMPTY);
                board.setTile(target, col, tile);
                changed = true;
            }
        }
        return changed;
    }

    /**
     * Clears every group of at least two touching erasable tiles of the same kind.
     * Each cell is assigned to exactly one group per pass.
     *
     * @return true if any tile was cleared
     */
    private boolean removeTiles(Board board) {
        int rows = board.getRowCount();
        int cols = board.getColumnCount();
        boolean[] decided = new boolean[rows * cols];
        int[] stack = new int[rows * cols];
        int[] group = new int[rows * cols];
        boolean changed = false;

        for (int row = 0; row < rows; row++) {
            for (int col = 0; col < cols; col++) {
                int start = row * cols + col;
                Tile tile = board.getTile(row, col);
                if (decided[start] || !tile.isErasable()) {
                    continue;
                }

                int stackSize = 0;
                int groupSize = 0;
                decided[start] = true;
                stack[stackSize++] = start;
                while (stackSize > 0) {
                    int cell = stack[--stackSize];
                    group[groupSize++] = cell;
                    int r = cell / cols;
                    int c = cell % cols;
                    stackSize = push(board, tile, r - 1, c, decided, stack, stackSize);
                    stackSize = push(board, tile, r + 1, c, decided, stack, stackSize);
                    stackSize = push(board, tile, r, c - 1, decided, stack, stackSize);
                    stackSize = push(board, tile, r, c + 1, decided, stack, stackSize);
                }

                if (groupSize >= 2) {
                    for (int i = 0; i < groupSize; i++) {
                        board.setTile(group[i] / cols, group[i] % cols, Tile.EMPTY);
                    }
                    changed = true;
                }
            }
        }
        return changed;
    }

    /**
     * Pushes a neighbour onto the flood-fill stack if it continues the group.
     * Border cells are walls and never match.
     *
     * @return the new stack size
     */
    private int push(Board board, Tile tile, int row, int col, boolean[] decided, int[] stack, int stackSize) {
        if (board.getTile(row, col) != tile) {
            return stackSize;
        }
        int cell = row * board.getColumnCount() + col;
        if (decided[cell]) {
            return stackSize;
        }
        decided[cell] = true;
        stack[stackSize] = cell;
        return stackSize + 1;
    }
}
