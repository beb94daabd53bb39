package ch.tictactoe.tictactoebackend.web.api.dto;

import ch.tictactoe.tictactoebackend.domain.enums.Symbol;
import jakarta.validation.constraints.NotNull;

/**
 * Request DTO used to submit a move.
 *
 * <p>Range, turn and game state are checked by the game itself so that the client gets
 * the specific rejection reason.
 *
 * @param position target position (0..8)
 * @param player symbol making the move
 */
public record MoveRequest(
        @NotNull(message = "position is required")
        Integer position,
        @NotNull(message = "player is required")
        Symbol player
) {}
