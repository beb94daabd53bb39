package ch.tictactoe.tictactoebackend.domain.exception;

/**
 * Reasons for rejecting a submitted move.
 *
 * <p>The {@link #code()} is the error kind reported to API clients.
 */
public enum MoveRejection {
    /**
     * The game is already WON or DRAW.
     */
    GAME_FINISHED("GameFinished"),

    /**
     * The submitted symbol is not the one whose turn it is.
     */
    WRONG_TURN("WrongTurn"),

    /**
     * The position is outside 0..8.
     */
    OUT_OF_RANGE("OutOfRange"),

    /**
     * The targeted cell already holds a symbol.
     */
    CELL_OCCUPIED("CellOccupied");

    private final String code;

    MoveRejection(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
