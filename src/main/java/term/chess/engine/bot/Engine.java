package term.chess.engine.bot;

import term.chess.engine.game.Game;
import term.chess.engine.movegen.Move;
import term.chess.engine.search.Deadline;

/**
 * A computer opponent. Optional abilities are exposed through {@link Configurable}, {@link Stateful} and
 * {@link Inspectable}, callers test for them with {@code instanceof}.
 */
public interface Engine {
    /**
     * Picks a legal move for the side to move. The caller's game is never modified.
     * When the deadline passes mid-search the best move found so far is returned, expiry is not an error.
     *
     * @throws EngineClosedException after {@link #close()}
     * @throws NoLegalMovesException when the side to move has no legal move
     */
    Move selectMove(Game position, Deadline deadline);

    default Move selectMove(Game position) {
        return selectMove(position, Deadline.never());
    }

    String name();

    /** Idempotent. Every later {@link #selectMove} call fails. */
    void close();
}
