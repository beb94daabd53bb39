package ch.tictactoe.tictactoebackend.domain.enums;

public enum GameStatus {
    IN_PROGRESS,
    /**
     * Terminal: one symbol completed a line, {@code winner} is set.
     */
    WON,
    /**
     * Terminal: the board is full and no line was completed.
     */
    DRAW;

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }
}
