package ch.tictactoe.tictactoebackend.domain;

import ch.tictactoe.tictactoebackend.domain.common.BaseEntity;
import ch.tictactoe.tictactoebackend.domain.enums.Symbol;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * A single move in a game's history.
 *
 * <p>Moves are created by {@link Game#applyMove(Symbol, int)} only and never change afterwards.
 * Within a game, both the position and the move number are unique; move numbers start at 1
 * and have no gaps.
 */
@Entity
@Table(name = "moves", uniqueConstraints = {
        @UniqueConstraint(name = "uq_game_position", columnNames = {"game_id", "position"}),
        @UniqueConstraint(name = "uq_game_move_number", columnNames = {"game_id", "move_number"})
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Move extends BaseEntity {

    @ManyToOne(optional = false, fetch = FetchType.LAZY)
    @JoinColumn(name = "game_id", nullable = false, updatable = false)
    private Game game;

    @Enumerated(EnumType.STRING)
    @Column(name = "player_symbol", nullable = false, length = 1, updatable = false)
    private Symbol playerSymbol;

    @Column(nullable = false, updatable = false)
    private int position;

    @Column(name = "move_number", nullable = false, updatable = false)
    private int moveNumber;

    Move(Game game, Symbol playerSymbol, int position, int moveNumber) {
        this.game = game;
        this.playerSymbol = playerSymbol;
        this.position = position;
        this.moveNumber = moveNumber;
    }
}
