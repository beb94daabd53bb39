package ch.tictactoe.tictactoebackend.service;

import ch.tictactoe.tictactoebackend.domain.Player;
import ch.tictactoe.tictactoebackend.domain.exception.DuplicatePlayerNameException;
import ch.tictactoe.tictactoebackend.repository.PlayerRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Service for creating and looking up players by name.
 */
@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class PlayerService {

    private final PlayerRepository playerRepository;

    @Transactional(readOnly = true)
    public Optional<Player> findByName(String name) {
        return playerRepository.findByName(name);
    }

    /**
     * Creates a new player.
     *
     * @param name unique player name
     * @return the persisted player
     * @throws DuplicatePlayerNameException if the name is already taken
     */
    public Player createPlayer(String name) {
        if (playerRepository.existsByName(name)) {
            throw new DuplicatePlayerNameException(name);
        }
        Player saved;
        try {
            saved = playerRepository.saveAndFlush(new Player(name));
        } catch (DataIntegrityViolationException e) {
            // concurrent insert with the same name
            throw new DuplicatePlayerNameException(name, e);
        }
        log.info("Created player '{}' ({})", saved.getName(), saved.getId());
        return saved;
    }

    /**
     * Returns the player with the given name, creating it if it does not exist yet.
     *
     * <p>A concurrent insert of the same name is not reported as a duplicate here: the
     * constraint violation propagates as a storage failure.
     *
     * @param name player name
     * @return existing or newly created player
     * @throws DataIntegrityViolationException if another request created the same name concurrently
     */
    public Player findOrCreate(String name) {
        return findByName(name).orElseGet(() -> {
            Player saved = playerRepository.saveAndFlush(new Player(name));
            log.info("Created player '{}' ({}) for a new game", saved.getName(), saved.getId());
            return saved;
        });
    }
}
