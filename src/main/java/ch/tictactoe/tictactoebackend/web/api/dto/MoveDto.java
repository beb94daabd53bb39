package ch.tictactoe.tictactoebackend.web.api.dto;

import ch.tictactoe.tictactoebackend.domain.Move;
import ch.tictactoe.tictactoebackend.domain.enums.Symbol;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * DTO representing one entry of a game's move history.
 *
 * @param moveNumber sequential number starting at 1
 * @param position board position 0..8
 * @param player symbol that made the move
 * @param createdAt time the move was recorded
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MoveDto(
        int moveNumber,
        int position,
        Symbol player,
        Instant createdAt
) {

    public static MoveDto from(Move move) {
        return new MoveDto(
                move.getMoveNumber(),
                move.getPosition(),
                move.getPlayerSymbol(),
                move.getCreatedAt()
        );
    }
}
