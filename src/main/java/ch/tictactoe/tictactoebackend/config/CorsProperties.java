package ch.tictactoe.tictactoebackend.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * CORS settings bound from {@code tictactoe.cors.*}.
 */
@ConfigurationProperties(prefix = "tictactoe.cors")
@Getter
@Setter
public class CorsProperties {

    /**
     * Allowed origin patterns, see
     * {@link org.springframework.web.cors.CorsConfiguration#setAllowedOriginPatterns(List)}.
     */
    private List<String> allowedOrigins = new ArrayList<>(List.of("*"));

    /**
     * HTTP methods the API is called with.
     */
    private List<String> allowedMethods = new ArrayList<>(List.of("GET", "POST", "OPTIONS"));

    private boolean allowCredentials = true;

    /**
     * How long browsers may cache a preflight response.
     */
    private Duration maxAge = Duration.ofMinutes(30);
}
