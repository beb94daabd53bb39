package ch.tictactoe.tictactoebackend.web.api.controller;

import ch.tictactoe.tictactoebackend.web.api.dto.HealthDto;
import io.swagger.v3.oas.annotations.Operation;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Simple health check controller.
 *
 * <p>Only confirms that the application context is alive; the database is not checked.
 */
@RestController
public class HealthController {

    /**
     * Health check endpoint.
     *
     * @return {@code {"message": "Healthy"}}
     */
    @Operation(summary = "Health check")
    @GetMapping("/")
    public HealthDto health() {
        return new HealthDto("Healthy");
    }
}
