package ch.tictactoe.tictactoebackend.web.api.dto;

/**
 * Error body returned for rejected requests.
 *
 * @param error error kind, e.g. {@code WrongTurn} or {@code NotFound}
 * @param detail human-readable message
 */
public record ErrorResponseDto(
        String error,
        String detail
) {}
