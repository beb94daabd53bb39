package ch.tictactoe.tictactoebackend.web.api.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Request DTO used to create a player.
 *
 * <p>Names are stored as given: whitespace is neither trimmed nor rejected.
 *
 * @param name unique display name of the player (1..100 characters)
 */
public record CreatePlayerRequest(
        @NotNull(message = "name is required")
        @Size(min = 1, max = 100, message = "name must be between 1 and 100 characters")
        String name
) {}
