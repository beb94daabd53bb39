package ch.tictactoe.tictactoebackend.domain.exception;

/**
 * Thrown when a player is created with a name that is already taken.
 */
public class DuplicatePlayerNameException extends IllegalStateException {

    public DuplicatePlayerNameException(String name) {
        super("Player name already exists: " + name);
    }

    public DuplicatePlayerNameException(String name, Throwable cause) {
        super("Player name already exists: " + name, cause);
    }
}
