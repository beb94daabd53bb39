package ch.tictactoe.tictactoebackend.domain;

import ch.tictactoe.tictactoebackend.domain.common.BaseEntity;
import ch.tictactoe.tictactoebackend.domain.enums.GameStatus;
import ch.tictactoe.tictactoebackend.domain.enums.Symbol;
import ch.tictactoe.tictactoebackend.domain.exception.MoveRejectedException;
import ch.tictactoe.tictactoebackend.domain.exception.MoveRejection;
import ch.tictactoe.tictactoebackend.domain.rules.GameRules;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Represents a Tic Tac Toe game including board, turn, outcome and move history.
 *
 * <p>A game starts {@link GameStatus#IN_PROGRESS} with an empty board and X to move, and ends in
 * exactly one terminal state ({@link GameStatus#WON} or {@link GameStatus#DRAW}). The only way to
 * change a game after creation is {@link #applyMove(Symbol, int)}; persistence and transaction
 * handling are done in the service layer.
 */
@Entity
@Table(name = "games")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Game extends BaseEntity {

    /**
     * Board content, persisted as a nine-character string.
     */
    @Convert(converter = BoardConverter.class)
    @Column(nullable = false, length = Board.SIZE)
    private Board board;

    /**
     * Symbol whose turn it is. Keeps its last value once the game has ended.
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "next_player", nullable = false, length = 1)
    private Symbol nextPlayer;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private GameStatus status;

    /**
     * Winning symbol; only set when status is WON.
     */
    @Enumerated(EnumType.STRING)
    @Column(length = 1)
    private Symbol winner;

    @ManyToOne
    @JoinColumn(name = "player_x_id")
    private Player playerX;

    @ManyToOne
    @JoinColumn(name = "player_o_id")
    private Player playerO;

    /**
     * Move history ordered by move number.
     */
    @OneToMany(mappedBy = "game", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("moveNumber ASC")
    private List<Move> moves = new ArrayList<>();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Version
    private long version;

    /**
     * Creates a new game with an empty board and X to move.
     *
     * @param playerX player assigned to X (may be null)
     * @param playerO player assigned to O (may be null)
     */
    public Game(Player playerX, Player playerO) {
        this.board = Board.empty();
        this.nextPlayer = Symbol.X;
        this.status = GameStatus.IN_PROGRESS;
        this.playerX = playerX;
        this.playerO = playerO;
    }

    /**
     * @return read-only view of the move history
     */
    public List<Move> getMoves() {
        return Collections.unmodifiableList(moves);
    }

    /**
     * Applies a move for the given symbol and returns the recorded move.
     *
     * <p>Checks are done in this order, and nothing is modified if one of them fails:
     * <ol>
     *   <li>the game must be IN_PROGRESS ({@link MoveRejection#GAME_FINISHED})</li>
     *   <li>it must be the symbol's turn ({@link MoveRejection#WRONG_TURN})</li>
     *   <li>the position must be on the board and free
     *       ({@link MoveRejection#OUT_OF_RANGE}, {@link MoveRejection#CELL_OCCUPIED})</li>
     * </ol>
     * After placing the symbol the outcome is recomputed on the new board. On a win the
     * {@code nextPlayer} is left as it was.
     *
     * @param symbol symbol submitted by the client
     * @param position 0-based target position
     * @return the new move, already appended to the history
     * @throws MoveRejectedException if the move is not allowed
     */
    public Move applyMove(Symbol symbol, int position) {
        if (status != GameStatus.IN_PROGRESS) {
            throw new MoveRejectedException(MoveRejection.GAME_FINISHED, "Game already finished");
        }
        if (symbol != nextPlayer) {
            throw new MoveRejectedException(MoveRejection.WRONG_TURN, "It is " + nextPlayer + "'s turn");
        }
        GameRules.validateMove(board, position);

        board = board.withMove(position, symbol);
        Move move = new Move(this, symbol, position, nextMoveNumber());
        moves.add(move);

        Optional<Symbol> lineWinner = GameRules.checkWinner(board);
        if (lineWinner.isPresent()) {
            status = GameStatus.WON;
            winner = lineWinner.get();
        } else if (GameRules.isDraw(board)) {
            status = GameStatus.DRAW;
            winner = null;
        } else {
            nextPlayer = nextPlayer.opponent();
        }
        return move;
    }

    private int nextMoveNumber() {
        return moves.isEmpty() ? 1 : moves.get(moves.size() - 1).getMoveNumber() + 1;
    }

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = Instant.now();
    }
}
