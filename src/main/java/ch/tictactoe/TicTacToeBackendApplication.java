package ch.tictactoe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Tic Tac Toe backend.
 *
 * <p>Enables Spring Boot auto-configuration and component scanning for the entire application.
 */
@SpringBootApplication
public class TicTacToeBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(TicTacToeBackendApplication.class, args);
    }

}
