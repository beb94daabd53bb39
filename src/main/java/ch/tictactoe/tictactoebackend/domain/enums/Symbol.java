package ch.tictactoe.tictactoebackend.domain.enums;

/**
 * Marker placed by a player on the board.
 */
public enum Symbol {
    X,
    O;

    /**
     * @return the symbol of the other player
     */
    public Symbol opponent() {
        return this == X ? O : X;
    }
}
