package ch.tictactoe.tictactoebackend.repository;

import ch.tictactoe.tictactoebackend.domain.Game;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for {@link Game} entities. Moves are persisted through the game (cascade).
 */
public interface GameRepository extends JpaRepository<Game, UUID> {

    /**
     * Loads a game and locks its row until the surrounding transaction ends.
     *
     * <p>Used when applying a move: a second request for the same game waits for the first
     * one to commit and then sees the updated board, turn and status.
     *
     * @param id the game id
     * @return the locked game, empty if not found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT g FROM Game g WHERE g.id = :id")
    Optional<Game> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Returns games newest first.
     *
     * @param pageable page size limits the number of games returned
     * @return games ordered by creation time descending
     */
    List<Game> findAllByOrderByCreatedAtDesc(Pageable pageable);
}
