package ch.tictactoe.tictactoebackend.repository;

import ch.tictactoe.tictactoebackend.domain.Player;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data repository for {@link Player} entities.
 *
 * <p>Player names are unique (enforced by a database constraint), so a lookup by name
 * returns at most one player.
 */
public interface PlayerRepository extends JpaRepository<Player, UUID> {

    /**
     * Finds a player by its exact name.
     *
     * @param name player name
     * @return the player if present; otherwise {@link Optional#empty()}
     */
    Optional<Player> findByName(String name);

    boolean existsByName(String name);
}
