package ch.tictactoe.tictactoebackend.web.api.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.Size;

/**
 * Request DTO used to start a new game.
 *
 * <p>Both names are optional. Players that do not exist yet are created by name.
 *
 * @param playerXName name of the player playing X
 * @param playerOName name of the player playing O
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CreateGameRequest(
        @Size(max = 100, message = "player_x_name must be at most 100 characters")
        String playerXName,
        @Size(max = 100, message = "player_o_name must be at most 100 characters")
        String playerOName
) {}
