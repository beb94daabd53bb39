package ch.tictactoe.tictactoebackend.domain;

import ch.tictactoe.tictactoebackend.domain.common.BaseEntity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Represents a player identified by a unique name.
 *
 * <p>Players are referenced by games as X or O but not owned by them; the same player
 * may take part in many games. Players are never modified or deleted after creation.
 */
@Entity
@Table(name = "players")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Player extends BaseEntity {

    public static final int MAX_NAME_LENGTH = 100;

    /**
     * Unique display name of the player.
     */
    @Column(nullable = false, unique = true, length = MAX_NAME_LENGTH)
    private String name;

    /**
     * Creates a new player with the given name.
     *
     * @param name unique display name
     */
    public Player(String name) {
        this.name = name;
    }
}
