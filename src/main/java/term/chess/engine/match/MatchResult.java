package term.chess.engine.match;

import term.chess.engine.common.Color;
import term.chess.engine.movegen.Move;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one bot-vs-bot game. {@code winnerColor} is {@code null} for draws, {@code winner} is then "Draw".
 */
public record MatchResult(int gameNumber, String winner, Color winnerColor, String endReason,
                          int moveCount, Duration duration, String finalFen, List<Move> moveHistory) {
    public static final String DRAW = "Draw";

    public MatchResult {
        moveHistory = List.copyOf(moveHistory);
    }

    public boolean isDraw() {
        return winnerColor == null;
    }
}
