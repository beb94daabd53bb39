package ch.tictactoe.tictactoebackend.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores a {@link Board} as a fixed nine-character string column.
 */
@Converter
public class BoardConverter implements AttributeConverter<Board, String> {

    @Override
    public String convertToDatabaseColumn(Board board) {
        return board == null ? null : board.toMarks();
    }

    @Override
    public Board convertToEntityAttribute(String marks) {
        return marks == null ? null : Board.fromMarks(marks);
    }
}
