package ch.tictactoe.tictactoebackend.application.service;

import ch.tictactoe.tictactoebackend.domain.Game;
import ch.tictactoe.tictactoebackend.domain.Player;
import ch.tictactoe.tictactoebackend.domain.enums.GameStatus;
import ch.tictactoe.tictactoebackend.domain.enums.Symbol;
import ch.tictactoe.tictactoebackend.domain.exception.MoveRejectedException;
import ch.tictactoe.tictactoebackend.domain.exception.MoveRejection;
import ch.tictactoe.tictactoebackend.repository.GameRepository;
import ch.tictactoe.tictactoebackend.service.GameService;
import ch.tictactoe.tictactoebackend.service.PlayerService;
import ch.tictactoe.tictactoebackend.web.api.dto.GameDto;
import ch.tictactoe.tictactoebackend.web.api.dto.GameListDto;
import ch.tictactoe.tictactoebackend.web.api.dto.MoveDto;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.Pageable;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static ch.tictactoe.tictactoebackend.testutil.EntityTestUtils.setId;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GameServiceTest {

    private static final UUID GAME_ID = UUID.fromString("10000000-0000-0000-0000-000000000001");

    @Mock
    private GameRepository gameRepository;

    @Mock
    private PlayerService playerService;

    @InjectMocks
    private GameService gameService;

    private Game existingGame() {
        Game game = new Game(null, null);
        setId(game, GAME_ID);
        return game;
    }

    // ------------------------------------------------------------------------------------
    // createGame
    // ------------------------------------------------------------------------------------

    @Nested
    class CreateGame {

        @Test
        void createGame_shouldResolvePlayersByName_andSaveNewGame() {
            Player alice = new Player("Alice");
            Player bob = new Player("Bob");
            when(playerService.findOrCreate("Alice")).thenReturn(alice);
            when(playerService.findOrCreate("Bob")).thenReturn(bob);
            when(gameRepository.saveAndFlush(any(Game.class))).thenAnswer(inv -> inv.getArgument(0));

            ArgumentCaptor<Game> captor = ArgumentCaptor.forClass(Game.class);

            GameDto dto = gameService.createGame("Alice", "Bob");

            verify(gameRepository).saveAndFlush(captor.capture());
            Game saved = captor.getValue();
            assertThat(saved.getPlayerX()).isSameAs(alice);
            assertThat(saved.getPlayerO()).isSameAs(bob);
            assertThat(saved.getStatus()).isEqualTo(GameStatus.IN_PROGRESS);

            assertThat(dto.status()).isEqualTo("in_progress");
            assertThat(dto.nextPlayer()).isEqualTo(Symbol.X);
            assertThat(dto.board()).hasSize(9).containsOnly(" ");
            assertThat(dto.playerX().name()).isEqualTo("Alice");
            assertThat(dto.playerO().name()).isEqualTo("Bob");
            assertThat(dto.moves()).isEmpty();
        }

        @Test
        void createGame_withoutNames_shouldNotTouchPlayers() {
            when(gameRepository.saveAndFlush(any(Game.class))).thenAnswer(inv -> inv.getArgument(0));

            GameDto dto = gameService.createGame(null, "");

            assertThat(dto.playerX()).isNull();
            assertThat(dto.playerO()).isNull();
            verifyNoInteractions(playerService);
        }

        @Test
        void createGame_withWhitespaceName_shouldStillResolvePlayer() {
            Player spaces = new Player(" ");
            when(playerService.findOrCreate(" ")).thenReturn(spaces);
            when(gameRepository.saveAndFlush(any(Game.class))).thenAnswer(inv -> inv.getArgument(0));

            GameDto dto = gameService.createGame(" ", null);

            assertThat(dto.playerX().name()).isEqualTo(" ");
            assertThat(dto.playerO()).isNull();
        }
    }

    // ------------------------------------------------------------------------------------
    // getGame / listRecentGames
    // ------------------------------------------------------------------------------------

    @Test
    void getGame_shouldReturnMappedGame() {
        when(gameRepository.findById(GAME_ID)).thenReturn(Optional.of(existingGame()));

        GameDto dto = gameService.getGame(GAME_ID);

        assertThat(dto.id()).isEqualTo(GAME_ID);
        assertThat(dto.winner()).isNull();
    }

    @Test
    void getGame_shouldThrowNotFound_whenGameMissing() {
        when(gameRepository.findById(GAME_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> gameService.getGame(GAME_ID))
                .isInstanceOf(EntityNotFoundException.class)
                .hasMessageContaining(GAME_ID.toString());
    }

    @Test
    void listRecentGames_shouldCapPageSizeAtConfiguredLimit() {
        ReflectionTestUtils.setField(gameService, "recentLimit", 50);
        when(gameRepository.findAllByOrderByCreatedAtDesc(any(Pageable.class))).thenReturn(List.of(existingGame()));

        ArgumentCaptor<Pageable> captor = ArgumentCaptor.forClass(Pageable.class);

        GameListDto result = gameService.listRecentGames(500);

        verify(gameRepository).findAllByOrderByCreatedAtDesc(captor.capture());
        assertThat(captor.getValue().getPageNumber()).isZero();
        assertThat(captor.getValue().getPageSize()).isEqualTo(50);
        assertThat(result.items()).hasSize(1);
    }

    @Test
    void listRecentGames_shouldUseAtLeastOneGame() {
        when(gameRepository.findAllByOrderByCreatedAtDesc(any(Pageable.class))).thenReturn(List.of());

        ArgumentCaptor<Pageable> captor = ArgumentCaptor.forClass(Pageable.class);

        GameListDto result = gameService.listRecentGames(0);

        verify(gameRepository).findAllByOrderByCreatedAtDesc(captor.capture());
        assertThat(captor.getValue().getPageSize()).isEqualTo(1);
        assertThat(result.items()).isEmpty();
    }

    // ------------------------------------------------------------------------------------
    // submitMove
    // ------------------------------------------------------------------------------------

    @Nested
    class SubmitMove {

        @Test
        void submitMove_shouldLoadWithLock_applyMove_andSave() {
            Game game = existingGame();
            when(gameRepository.findByIdForUpdate(GAME_ID)).thenReturn(Optional.of(game));
            when(gameRepository.saveAndFlush(game)).thenReturn(game);

            GameDto dto = gameService.submitMove(GAME_ID, Symbol.X, 4);

            assertThat(dto.board().get(4)).isEqualTo("X");
            assertThat(dto.nextPlayer()).isEqualTo(Symbol.O);
            assertThat(dto.moves()).hasSize(1);
            assertThat(dto.moves().get(0).moveNumber()).isEqualTo(1);
            assertThat(dto.moves().get(0).player()).isEqualTo(Symbol.X);

            verify(gameRepository).findByIdForUpdate(GAME_ID);
            verify(gameRepository).saveAndFlush(game);
            verify(gameRepository, never()).findById(any());
        }

        @Test
        void submitMove_winningMove_shouldReturnWonGame() {
            Game game = existingGame();
            game.applyMove(Symbol.X, 0);
            game.applyMove(Symbol.O, 4);
            game.applyMove(Symbol.X, 1);
            game.applyMove(Symbol.O, 5);
            when(gameRepository.findByIdForUpdate(GAME_ID)).thenReturn(Optional.of(game));
            when(gameRepository.saveAndFlush(game)).thenReturn(game);

            GameDto dto = gameService.submitMove(GAME_ID, Symbol.X, 2);

            assertThat(dto.status()).isEqualTo("won");
            assertThat(dto.winner()).isEqualTo(Symbol.X);
            assertThat(dto.nextPlayer()).isEqualTo(Symbol.X);
            assertThat(dto.moves()).extracting(MoveDto::moveNumber).containsExactly(1, 2, 3, 4, 5);
        }

        @Test
        void submitMove_shouldThrowNotFound_whenGameMissing() {
            when(gameRepository.findByIdForUpdate(GAME_ID)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> gameService.submitMove(GAME_ID, Symbol.X, 0))
                    .isInstanceOf(EntityNotFoundException.class);

            verify(gameRepository, never()).saveAndFlush(any());
        }

        @Test
        void submitMove_wrongTurn_shouldNotSave() {
            Game game = existingGame();
            when(gameRepository.findByIdForUpdate(GAME_ID)).thenReturn(Optional.of(game));

            assertThatThrownBy(() -> gameService.submitMove(GAME_ID, Symbol.O, 0))
                    .isInstanceOf(MoveRejectedException.class)
                    .hasFieldOrPropertyWithValue("reason", MoveRejection.WRONG_TURN);

            verify(gameRepository, never()).saveAndFlush(any());
            assertThat(game.getMoves()).isEmpty();
            assertThat(game.getBoard().occupiedCount()).isZero();
        }

        @Test
        void submitMove_onFinishedGame_shouldThrowGameFinished_andNotSave() {
            Game game = existingGame();
            game.applyMove(Symbol.X, 0);
            game.applyMove(Symbol.O, 4);
            game.applyMove(Symbol.X, 1);
            game.applyMove(Symbol.O, 5);
            game.applyMove(Symbol.X, 2);
            when(gameRepository.findByIdForUpdate(GAME_ID)).thenReturn(Optional.of(game));

            assertThatThrownBy(() -> gameService.submitMove(GAME_ID, Symbol.X, 8))
                    .isInstanceOf(MoveRejectedException.class)
                    .hasFieldOrPropertyWithValue("reason", MoveRejection.GAME_FINISHED);

            verify(gameRepository, never()).saveAndFlush(any());
        }
    }
}
