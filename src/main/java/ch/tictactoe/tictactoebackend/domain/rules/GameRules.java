package ch.tictactoe.tictactoebackend.domain.rules;

import ch.tictactoe.tictactoebackend.domain.Board;
import ch.tictactoe.tictactoebackend.domain.enums.Cell;
import ch.tictactoe.tictactoebackend.domain.enums.Symbol;
import ch.tictactoe.tictactoebackend.domain.exception.MoveRejectedException;
import ch.tictactoe.tictactoebackend.domain.exception.MoveRejection;

import java.util.List;
import java.util.Optional;

/**
 * Pure Tic Tac Toe rules over a {@link Board} snapshot.
 *
 * <p>Stateless and side-effect free: none of the methods modify the board.
 */
public final class GameRules {

    /**
     * The eight winning lines: rows, columns, diagonals. Checked in this order.
     */
    private static final List<int[]> WINNING_LINES = List.of(
            new int[]{0, 1, 2},
            new int[]{3, 4, 5},
            new int[]{6, 7, 8},
            new int[]{0, 3, 6},
            new int[]{1, 4, 7},
            new int[]{2, 5, 8},
            new int[]{0, 4, 8},
            new int[]{2, 4, 6}
    );

    private GameRules() {
    }

    /**
     * Returns the symbol of the first completed line.
     *
     * @param board board snapshot
     * @return winning symbol, or empty if no line is complete
     */
    public static Optional<Symbol> checkWinner(Board board) {
        for (int[] line : WINNING_LINES) {
            Cell a = board.cellAt(line[0]);
            if (!a.isEmpty() && a == board.cellAt(line[1]) && a == board.cellAt(line[2])) {
                return Optional.of(a.symbol());
            }
        }
        return Optional.empty();
    }

    /**
     * A full board with a completed line is a win, not a draw.
     *
     * @param board board snapshot
     * @return {@code true} if all cells are occupied and no line is complete
     */
    public static boolean isDraw(Board board) {
        return board.isFull() && checkWinner(board).isEmpty();
    }

    /**
     * Checks that a symbol may be placed at the given position.
     *
     * @param board board snapshot
     * @param position requested position
     * @throws MoveRejectedException with {@link MoveRejection#OUT_OF_RANGE} or {@link MoveRejection#CELL_OCCUPIED}
     */
    public static void validateMove(Board board, int position) {
        if (position < 0 || position >= Board.SIZE) {
            throw new MoveRejectedException(MoveRejection.OUT_OF_RANGE,
                    "Position must be between 0 and " + (Board.SIZE - 1));
        }
        if (!board.isEmptyAt(position)) {
            throw new MoveRejectedException(MoveRejection.CELL_OCCUPIED,
                    "Position " + position + " is already occupied");
        }
    }
}
