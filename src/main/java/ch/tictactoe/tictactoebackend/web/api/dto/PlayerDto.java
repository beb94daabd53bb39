package ch.tictactoe.tictactoebackend.web.api.dto;

import ch.tictactoe.tictactoebackend.domain.Player;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.UUID;

/**
 * DTO representing a player.
 *
 * @param id unique identifier of the player
 * @param name unique display name
 * @param createdAt creation timestamp
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PlayerDto(
        UUID id,
        String name,
        Instant createdAt
) {

    /**
     * Creates a {@code PlayerDto} from the given domain {@link Player}.
     *
     * @param player domain player entity, may be null
     * @return mapped DTO, or {@code null} if no player is given
     */
    public static PlayerDto from(Player player) {
        if (player == null) {
            return null;
        }
        return new PlayerDto(
                player.getId(),
                player.getName(),
                player.getCreatedAt()
        );
    }
}
