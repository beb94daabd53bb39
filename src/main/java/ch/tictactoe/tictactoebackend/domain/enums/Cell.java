package ch.tictactoe.tictactoebackend.domain.enums;

/**
 * Content of a single board cell.
 *
 * <p>Each cell has a one-character representation which is used for persistence
 * ({@code ' '}, {@code 'X'}, {@code 'O'}) and in the JSON board view.
 */
public enum Cell {
    EMPTY(' '),
    X('X'),
    O('O');

    private final char mark;

    Cell(char mark) {
        this.mark = mark;
    }

    public char mark() {
        return mark;
    }

    public boolean isEmpty() {
        return this == EMPTY;
    }

    /**
     * Returns the symbol occupying this cell.
     *
     * @return the symbol, or {@code null} for an empty cell
     */
    public Symbol symbol() {
        return switch (this) {
            case X -> Symbol.X;
            case O -> Symbol.O;
            case EMPTY -> null;
        };
    }

    public static Cell of(Symbol symbol) {
        return symbol == Symbol.X ? X : O;
    }

    /**
     * Parses the persisted one-character representation.
     *
     * @param mark {@code ' '}, {@code 'X'} or {@code 'O'}
     * @return matching cell
     * @throws IllegalArgumentException if the character is not a valid cell mark
     */
    public static Cell fromMark(char mark) {
        for (Cell cell : values()) {
            if (cell.mark == mark) {
                return cell;
            }
        }
        throw new IllegalArgumentException("Invalid board cell: '" + mark + "'");
    }
}
