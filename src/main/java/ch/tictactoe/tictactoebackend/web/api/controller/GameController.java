package ch.tictactoe.tictactoebackend.web.api.controller;

import ch.tictactoe.tictactoebackend.service.GameService;
import ch.tictactoe.tictactoebackend.web.api.dto.*;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST endpoints for starting games, reading their state and submitting moves.
 *
 * <p>Errors are mapped to HTTP responses by {@link ApiExceptionHandler}.
 */
@RestController
@RequestMapping("/games")
public class GameController {

    private final GameService gameService;

    public GameController(GameService gameService) {
        this.gameService = gameService;
    }

    @Operation(summary = "Start a new game, optionally with player names for X and O")
    @PostMapping
    public ResponseEntity<GameDto> createGame(@Valid @RequestBody(required = false) CreateGameRequest request) {
        String playerXName = request == null ? null : request.playerXName();
        String playerOName = request == null ? null : request.playerOName();
        GameDto game = gameService.createGame(playerXName, playerOName);
        return ResponseEntity.status(HttpStatus.CREATED).body(game);
    }

    @Operation(summary = "List recent games, newest first")
    @GetMapping
    public ResponseEntity<GameListDto> listGames(@RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(gameService.listRecentGames(limit));
    }

    @Operation(summary = "Get game state including board, status, next player and moves")
    @GetMapping("/{gameId}")
    public ResponseEntity<GameDto> getGame(@PathVariable UUID gameId) {
        return ResponseEntity.ok(gameService.getGame(gameId));
    }

    @Operation(summary = "Submit a move")
    @PostMapping("/{gameId}/moves")
    public ResponseEntity<GameDto> submitMove(@PathVariable UUID gameId,
                                              @Valid @RequestBody MoveRequest request) {
        GameDto game = gameService.submitMove(gameId, request.player(), request.position());
        return ResponseEntity.ok(game);
    }
}
