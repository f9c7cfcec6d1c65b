package term.chess.engine.bot;

import term.chess.engine.common.Difficulty;
import term.chess.engine.game.Game;
import term.chess.engine.movegen.Move;
import term.chess.engine.search.Deadline;
import term.chess.engine.search.MoveOrdering;
import term.chess.engine.utils.notations.FENUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Easy tier: random legal moves with a bias towards captures, then checks.
 */
public class RandomEngine implements Inspectable {
    public static final String NAME = "Easy Bot";
    public static final Duration DEFAULT_TIME_LIMIT = Duration.ofSeconds(2);

    static final double CAPTURE_PROBABILITY = 0.7;
    static final double CHECK_PROBABILITY = 0.5;

    private final Random random;
    private final Duration timeLimit;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public RandomEngine() {
        this(new Random(), DEFAULT_TIME_LIMIT);
    }

    public RandomEngine(Random random, Duration timeLimit) {
        this.random = random;
        this.timeLimit = timeLimit;
    }

    @Override
    public Move selectMove(Game position, Deadline deadline) {
        if (closed.get()) {
            throw new EngineClosedException(NAME);
        }
        List<Move> moves = position.legalMoves();
        if (moves.isEmpty()) {
            throw new NoLegalMovesException(FENUtils.getFENFromBoard(position));
        }
        if (moves.size() == 1) {
            return moves.get(0);
        }
        List<Move> captures = filterCaptures(position, moves);
        if (random.nextDouble() < CAPTURE_PROBABILITY && !captures.isEmpty()) {
            return pick(captures);
        }

        List<Move> checks = filterChecks(position, moves);
        if (random.nextDouble() < CHECK_PROBABILITY && !checks.isEmpty()) {
            return pick(checks);
        }
        return pick(moves);
    }

    static List<Move> filterCaptures(Game position, List<Move> moves) {
        List<Move> captures = new ArrayList<>();
        for (Move move : moves) {
            if (MoveOrdering.isCapture(position, move)) {
                captures.add(move);
            }
        }
        return captures;
    }

    // Scans every move whatever the deadline
    static List<Move> filterChecks(Game position, List<Move> moves) {
        List<Move> checks = new ArrayList<>();
        for (Move move : moves) {
            Game child = position.copy();
            child.playMove(move);
            if (child.inCheck()) {
                checks.add(move);
            }
        }
        return checks;
    }

    private Move pick(List<Move> moves) {
        return moves.get(random.nextInt(moves.size()));
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void close() {
        closed.set(true);
    }

    public Duration timeLimit() {
        return timeLimit;
    }

    @Override
    public EngineInfo info() {
        return new EngineInfo(NAME, EngineInfo.AUTHOR, EngineInfo.VERSION, EngineType.INTERNAL, Difficulty.EASY,
                Map.of("random_selection", true,
                        "tactical_awareness", true,
                        "weighted_selection", true));
    }
}
