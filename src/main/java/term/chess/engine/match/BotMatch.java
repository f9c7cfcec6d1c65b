package term.chess.engine.match;

import term.chess.engine.bot.Engine;
import term.chess.engine.bot.Stateful;
import term.chess.engine.common.Color;
import term.chess.engine.game.Game;
import term.chess.engine.game.GameStatus;
import term.chess.engine.movegen.Move;
import term.chess.engine.search.Deadline;
import term.chess.engine.utils.notations.FENUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * One game between two engines. The engines are borrowed, closing them is up to the caller.
 */
public final class BotMatch {
    public static final int MAX_MOVE_COUNT = 500;
    public static final Duration DEFAULT_MOVE_TIMEOUT = Duration.ofSeconds(30);

    private final int gameNumber;
    private final Engine whiteEngine;
    private final Engine blackEngine;
    private final String whiteName;
    private final String blackName;
    private final Game startPosition;
    private final Duration moveTimeout;

    public BotMatch(int gameNumber, Engine whiteEngine, Engine blackEngine, String whiteName, String blackName,
                    Game startPosition, Duration moveTimeout) {
        this.gameNumber = gameNumber;
        this.whiteEngine = whiteEngine;
        this.blackEngine = blackEngine;
        this.whiteName = whiteName;
        this.blackName = blackName;
        this.startPosition = startPosition.copy();
        this.moveTimeout = moveTimeout;
    }

    /** Plays until the game is decided, an engine fails, or {@value #MAX_MOVE_COUNT} moves have been made. */
    public MatchResult play() {
        final long start = System.nanoTime();
        Game board = startPosition.copy();
        List<Move> moveHistory = new ArrayList<>();
        List<Game> positions = new ArrayList<>();
        positions.add(board.copy());

        if (board.isGameOver()) {
            return finishWithStatus(board, moveHistory, start);
        }

        while (true) {
            Color active = board.activeColor();
            Engine engine = active == Color.WHITE ? whiteEngine : blackEngine;
            try {
                if (engine instanceof Stateful stateful) {
                    stateful.setPositionHistory(List.copyOf(positions));
                }
                Move move = engine.selectMove(board.copy(), Deadline.after(moveTimeout));
                board.playMove(move);
                moveHistory.add(move);
            } catch (RuntimeException e) {
                // The engine that failed loses the game
                return finishWithError(board, active, e, moveHistory, start);
            }
            positions.add(board.copy());

            if (board.status() != GameStatus.ONGOING) {
                return finishWithStatus(board, moveHistory, start);
            }
            if (moveHistory.size() >= MAX_MOVE_COUNT) {
                return new MatchResult(gameNumber, MatchResult.DRAW, null, "move limit exceeded",
                        moveHistory.size(), elapsed(start), FENUtils.getFENFromBoard(board), moveHistory);
            }
        }
    }

    private MatchResult finishWithStatus(Game board, List<Move> moveHistory, long start) {
        GameStatus status = board.status();
        String winner = MatchResult.DRAW;
        Color winnerColor = null;
        if (status == GameStatus.CHECKMATE) {
            winnerColor = board.activeColor().getOppositeColor();
            winner = nameOf(winnerColor);
        }
        return new MatchResult(gameNumber, winner, winnerColor, status.description(),
                moveHistory.size(), elapsed(start), FENUtils.getFENFromBoard(board), moveHistory);
    }

    private MatchResult finishWithError(Game board, Color failingColor, RuntimeException error,
                                        List<Move> moveHistory, long start) {
        Color winnerColor = failingColor.getOppositeColor();
        return new MatchResult(gameNumber, nameOf(winnerColor), winnerColor, "engine error: " + error.getMessage(),
                moveHistory.size(), elapsed(start), FENUtils.getFENFromBoard(board), moveHistory);
    }

    private String nameOf(Color color) {
        return color == Color.WHITE ? whiteName : blackName;
    }

    private static Duration elapsed(long startNs) {
        return Duration.ofNanos(System.nanoTime() - startNs);
    }
}
