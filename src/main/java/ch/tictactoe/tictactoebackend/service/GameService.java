package ch.tictactoe.tictactoebackend.service;

import ch.tictactoe.tictactoebackend.domain.Game;
import ch.tictactoe.tictactoebackend.domain.Move;
import ch.tictactoe.tictactoebackend.domain.Player;
import ch.tictactoe.tictactoebackend.domain.enums.Symbol;
import ch.tictactoe.tictactoebackend.repository.GameRepository;
import ch.tictactoe.tictactoebackend.web.api.dto.GameDto;
import ch.tictactoe.tictactoebackend.web.api.dto.GameListDto;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Application service for games.
 *
 * <p>Each public method runs in its own transaction. {@link #submitMove(UUID, Symbol, int)} loads the
 * game with a row lock, lets {@link Game#applyMove(Symbol, int)} validate and apply the move, and
 * persists board, status, turn and the new move together. If the move is rejected, the
 * transaction is rolled back and the game stays unchanged.
 */
@Service
@Transactional
@Slf4j
public class GameService {

    private final GameRepository gameRepository;
    private final PlayerService playerService;

    /**
     * Upper bound for the number of games returned by {@link #listRecentGames(int)}.
     * Configurable via {@code tictactoe.games.recent-limit}.
     */
    @Value("${tictactoe.games.recent-limit:50}")
    private int recentLimit = 50;

    public GameService(GameRepository gameRepository, PlayerService playerService) {
        this.gameRepository = gameRepository;
        this.playerService = playerService;
    }

    /**
     * Starts a new game. Players are looked up by name and created if missing.
     *
     * @param playerXName name of the X player, may be null or empty
     * @param playerOName name of the O player, may be null or empty
     * @return the new game
     */
    public GameDto createGame(String playerXName, String playerOName) {
        Player playerX = resolvePlayer(playerXName);
        Player playerO = resolvePlayer(playerOName);

        Game saved = gameRepository.saveAndFlush(new Game(playerX, playerO));
        log.info("Created game {} (X: {}, O: {})", saved.getId(), nameOf(playerX), nameOf(playerO));
        return GameDto.from(saved);
    }

    @Transactional(readOnly = true)
    public GameDto getGame(UUID gameId) {
        Game game = gameRepository.findById(gameId)
                .orElseThrow(() -> new EntityNotFoundException("Game not found: " + gameId));
        return GameDto.from(game);
    }

    /**
     * Lists the most recently created games, newest first.
     *
     * @param limit requested number of games, clamped to {@code 1..recentLimit}
     * @return recent games with moves and players
     */
    @Transactional(readOnly = true)
    public GameListDto listRecentGames(int limit) {
        int size = Math.max(1, Math.min(limit, recentLimit));
        List<GameDto> items = gameRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, size))
                .stream()
                .map(GameDto::from)
                .toList();
        return new GameListDto(items);
    }

    /**
     * Submits a move for the given game.
     *
     * @param gameId game id
     * @param symbol symbol making the move
     * @param position target position
     * @return the updated game
     * @throws EntityNotFoundException if the game does not exist
     * @throws ch.tictactoe.tictactoebackend.domain.exception.MoveRejectedException if the move is not allowed
     */
    public GameDto submitMove(UUID gameId, Symbol symbol, int position) {
        Game game = gameRepository.findByIdForUpdate(gameId)
                .orElseThrow(() -> new EntityNotFoundException("Game not found: " + gameId));

        Move move = game.applyMove(symbol, position);
        Game saved = gameRepository.saveAndFlush(game);

        log.debug("Game {}: move #{} {} -> {}", gameId, move.getMoveNumber(), symbol, position);
        if (saved.getStatus().isTerminal()) {
            log.info("Game {} finished: {} (winner: {})", gameId, saved.getStatus(), saved.getWinner());
        }
        return GameDto.from(saved);
    }

    private Player resolvePlayer(String name) {
        if (name == null || name.isEmpty()) {
            return null;
        }
        return playerService.findOrCreate(name);
    }

    private static String nameOf(Player player) {
        return player == null ? "-" : player.getName();
    }
}
