package ch.tictactoe.tictactoebackend.domain.exception;

import lombok.Getter;

/**
 * Thrown when a move violates the game rules. The game is never modified when this is thrown.
 */
@Getter
public class MoveRejectedException extends IllegalStateException {

    private final MoveRejection reason;

    public MoveRejectedException(MoveRejection reason, String message) {
        super(message);
        this.reason = reason;
    }
}
