package term.chess.engine.search;

import term.chess.engine.game.Game;
import term.chess.engine.movegen.Move;

import java.util.List;

final class RootSearch {

    private RootSearch() {}

    /**
     * Full-window search of every root move at {@code depth}. The result is marked incomplete as soon as
     * any node saw the deadline; its move and score must then be ignored.
     */
    static SearchResult searchAtDepth(Game game, SearchContext ctx, int depth, Deadline deadline) {
        final long start = System.nanoTime();
        ctx.newDepth(depth);

        List<Move> moves = MoveOrdering.order(game, game.legalMoves());
        if (moves.isEmpty()) {
            throw new IllegalStateException("No legal moves at root: " + game);
        }

        Move bestMove = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        double alpha = Double.NEGATIVE_INFINITY;
        final double beta = Double.POSITIVE_INFINITY;

        for (Move move : moves) {
            if (deadline.expired()) {
                ctx.aborted = true;
                break;
            }
            Game child = game.copy();
            child.playMove(move);
            double score = -Negamax.search(child, ctx, depth - 1, -beta, -alpha, 1, deadline);
            if (ctx.aborted) break;

            if (score > bestScore) {
                bestScore = score;
                bestMove = move;
            }
            if (bestScore > alpha) alpha = bestScore;
        }

        long timeMs = (System.nanoTime() - start) / 1_000_000L;
        if (bestMove == null) {
            return new SearchResult(moves.get(0), 0.0, ctx.currentDepth, ctx.nodes, timeMs, false);
        }
        return new SearchResult(bestMove, bestScore, ctx.currentDepth, ctx.nodes, timeMs, !ctx.aborted);
    }
}
