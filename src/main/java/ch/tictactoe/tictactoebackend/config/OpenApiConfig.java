package ch.tictactoe.tictactoebackend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for the OpenAPI / Swagger documentation.
 */
@Configuration
public class OpenApiConfig {

    /**
     * Creates the OpenAPI definition used by Swagger UI.
     *
     * @return configured {@link OpenAPI} instance with API metadata
     */
    @Bean
    public OpenAPI ticTacToeOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Tic Tac Toe API")
                        .description("REST API for a Tic Tac Toe game with game state tracking and winner detection.")
                        .version("v0.1.0"));
    }
}
