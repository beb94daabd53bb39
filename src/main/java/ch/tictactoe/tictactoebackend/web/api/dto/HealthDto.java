package ch.tictactoe.tictactoebackend.web.api.dto;

/**
 * Health check response.
 *
 * @param message always {@code "Healthy"}
 */
public record HealthDto(
        String message
) {}
