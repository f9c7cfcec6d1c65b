package term.chess.engine.match;

import term.chess.engine.common.Color;

import java.time.Duration;
import java.util.List;

/**
 * Aggregate of a series of games. Wins are counted by color, so two bots sharing a name are still told apart.
 */
public record MatchStats(int totalGames, String whiteName, String blackName,
                         int whiteWins, int blackWins, int draws,
                         double whiteWinPct, double blackWinPct,
                         double averageMoveCount, Duration averageDuration,
                         MatchResult shortestGame, MatchResult longestGame) {

    public static MatchStats compute(List<MatchResult> results, String whiteName, String blackName) {
        if (results.isEmpty()) {
            return new MatchStats(0, whiteName, blackName, 0, 0, 0, 0.0, 0.0, 0.0, Duration.ZERO, null, null);
        }
        int whiteWins = 0;
        int blackWins = 0;
        int draws = 0;
        long totalMoves = 0;
        Duration totalDuration = Duration.ZERO;
        MatchResult shortest = results.get(0);
        MatchResult longest = results.get(0);

        for (MatchResult r : results) {
            if (r.isDraw()) draws++;
            else if (r.winnerColor() == Color.WHITE) whiteWins++;
            else blackWins++;

            totalMoves += r.moveCount();
            totalDuration = totalDuration.plus(r.duration());
            if (r.moveCount() < shortest.moveCount()) shortest = r;
            if (r.moveCount() > longest.moveCount()) longest = r;
        }

        int n = results.size();
        return new MatchStats(n, whiteName, blackName, whiteWins, blackWins, draws,
                whiteWins * 100.0 / n, blackWins * 100.0 / n,
                (double) totalMoves / n, totalDuration.dividedBy(n),
                shortest, longest);
    }
}
