package ch.tictactoe.tictactoebackend.domain;

import ch.tictactoe.tictactoebackend.domain.enums.Cell;
import ch.tictactoe.tictactoebackend.domain.enums.Symbol;

import java.util.Arrays;
import java.util.List;

/**
 * Immutable value object representing the 3x3 Tic Tac Toe board.
 *
 * <p>Cells are addressed by a 0-based position (0..8), row by row:
 * <pre>
 *  0 | 1 | 2
 *  3 | 4 | 5
 *  6 | 7 | 8
 * </pre>
 * A board always holds exactly {@link #SIZE} cells. Placing a symbol returns a new board
 * instance; rule enforcement (bounds, occupied cells, turn order) is done by
 * {@link ch.tictactoe.tictactoebackend.domain.rules.GameRules} and {@link Game}.
 */
public final class Board {

    public static final int SIZE = 9;

    private static final Board EMPTY = new Board(filled(Cell.EMPTY));

    private final Cell[] cells;

    private Board(Cell[] cells) {
        this.cells = cells;
    }

    public static Board empty() {
        return EMPTY;
    }

    /**
     * Creates a board from exactly nine cells.
     *
     * @param cells cell values in position order
     * @return board holding a copy of the given cells
     * @throws IllegalArgumentException if not exactly nine cells are given or one is null
     */
    public static Board of(Cell... cells) {
        if (cells == null || cells.length != SIZE) {
            throw new IllegalArgumentException("Board must have exactly " + SIZE + " cells");
        }
        for (Cell cell : cells) {
            if (cell == null) {
                throw new IllegalArgumentException("Board cells must not be null");
            }
        }
        return new Board(cells.clone());
    }

    /**
     * Parses the persisted representation: nine characters out of {@code ' '}, {@code 'X'}, {@code 'O'}.
     *
     * @param marks board string
     * @return parsed board
     * @throws IllegalArgumentException if the string is not a valid board
     */
    public static Board fromMarks(String marks) {
        if (marks == null || marks.length() != SIZE) {
            throw new IllegalArgumentException("Board must have exactly " + SIZE + " cells");
        }
        Cell[] parsed = new Cell[SIZE];
        for (int i = 0; i < SIZE; i++) {
            parsed[i] = Cell.fromMark(marks.charAt(i));
        }
        return new Board(parsed);
    }

    public Cell cellAt(int position) {
        return cells[position];
    }

    public boolean isEmptyAt(int position) {
        return cells[position].isEmpty();
    }

    public boolean isFull() {
        return Arrays.stream(cells).noneMatch(Cell::isEmpty);
    }

    public int occupiedCount() {
        return (int) Arrays.stream(cells).filter(c -> !c.isEmpty()).count();
    }

    /**
     * Returns a copy of this board with the given symbol placed at the given position.
     *
     * <p>Does not check whether the position is free; callers validate first.
     *
     * @param position 0-based position (0..8)
     * @param symbol symbol to place
     * @return new board instance
     */
    public Board withMove(int position, Symbol symbol) {
        Cell[] copy = cells.clone();
        copy[position] = Cell.of(symbol);
        return new Board(copy);
    }

    public List<Cell> cells() {
        return List.of(cells);
    }

    /**
     * @return persisted representation, e.g. {@code "X O  X   "}
     */
    public String toMarks() {
        StringBuilder sb = new StringBuilder(SIZE);
        for (Cell cell : cells) {
            sb.append(cell.mark());
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Board other)) return false;
        return Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        return "Board[" + toMarks() + "]";
    }

    private static Cell[] filled(Cell cell) {
        Cell[] result = new Cell[SIZE];
        Arrays.fill(result, cell);
        return result;
    }
}
