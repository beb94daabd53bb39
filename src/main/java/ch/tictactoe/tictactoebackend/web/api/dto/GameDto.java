package ch.tictactoe.tictactoebackend.web.api.dto;

import ch.tictactoe.tictactoebackend.domain.Game;
import ch.tictactoe.tictactoebackend.domain.enums.Symbol;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * DTO representing the full state of a game.
 *
 * <p>The board is exposed as nine one-character strings ({@code " "}, {@code "X"}, {@code "O"})
 * and the status in lower case ({@code in_progress}, {@code won}, {@code draw}).
 *
 * @param id game id
 * @param board nine cells in position order
 * @param nextPlayer symbol to move next (keeps its last value once the game has ended)
 * @param status current status
 * @param winner winning symbol if status is {@code won}, otherwise null
 * @param playerX player assigned to X (may be null)
 * @param playerO player assigned to O (may be null)
 * @param moves chronological move history
 * @param createdAt creation timestamp
 * @param updatedAt last modification timestamp
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record GameDto(
        UUID id,
        List<String> board,
        Symbol nextPlayer,
        String status,
        Symbol winner,
        PlayerDto playerX,
        PlayerDto playerO,
        List<MoveDto> moves,
        Instant createdAt,
        Instant updatedAt
) {

    /**
     * Creates a {@code GameDto} from the given domain {@link Game}.
     *
     * <p>Must be called while the game's moves and players can still be loaded.
     *
     * @param game domain game entity
     * @return mapped DTO including players and moves
     */
    public static GameDto from(Game game) {
        return new GameDto(
                game.getId(),
                game.getBoard().cells().stream().map(c -> String.valueOf(c.mark())).toList(),
                game.getNextPlayer(),
                game.getStatus().name().toLowerCase(Locale.ROOT),
                game.getWinner(),
                PlayerDto.from(game.getPlayerX()),
                PlayerDto.from(game.getPlayerO()),
                game.getMoves().stream().map(MoveDto::from).toList(),
                game.getCreatedAt(),
                game.getUpdatedAt()
        );
    }
}
