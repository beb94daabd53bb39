package ch.tictactoe.tictactoebackend.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Spring MVC configuration for cross-origin requests.
 *
 * <p>The browser front end is served from a different origin than the API, so every
 * endpoint (health, players, games, moves) answers CORS preflight requests. Allowed
 * origins, methods and the preflight cache duration come from {@link CorsProperties}
 * ({@code tictactoe.cors.*}); by default any origin may call the API.
 */
@Configuration
@EnableConfigurationProperties(CorsProperties.class)
@RequiredArgsConstructor
@Slf4j
public class CorsConfig implements WebMvcConfigurer {

    private final CorsProperties corsProperties;

    /**
     * Registers one CORS mapping that covers the whole API.
     *
     * @param registry registry provided by Spring MVC
     */
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        log.info("CORS enabled for origins {} (methods {})",
                corsProperties.getAllowedOrigins(), corsProperties.getAllowedMethods());

        registry.addMapping("/**")
                // patterns instead of plain origins: "*" is not allowed together with credentials
                .allowedOriginPatterns(corsProperties.getAllowedOrigins().toArray(String[]::new))
                .allowedMethods(corsProperties.getAllowedMethods().toArray(String[]::new))
                .allowedHeaders("*")
                .allowCredentials(corsProperties.isAllowCredentials())
                .maxAge(corsProperties.getMaxAge().toSeconds());
    }
}
