package ch.tictactoe.tictactoebackend.web.api.controller;

import ch.tictactoe.tictactoebackend.domain.Player;
import ch.tictactoe.tictactoebackend.service.PlayerService;
import ch.tictactoe.tictactoebackend.web.api.dto.CreatePlayerRequest;
import ch.tictactoe.tictactoebackend.web.api.dto.PlayerDto;
import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/players")
public class PlayerController {

    private final PlayerService playerService;

    public PlayerController(PlayerService playerService) {
        this.playerService = playerService;
    }

    @Operation(summary = "Create a player with a unique name")
    @PostMapping
    public ResponseEntity<PlayerDto> createPlayer(@Valid @RequestBody CreatePlayerRequest request) {
        Player player = playerService.createPlayer(request.name());
        return ResponseEntity.status(HttpStatus.CREATED).body(PlayerDto.from(player));
    }
}
