package term.chess.engine.search;

import term.chess.engine.common.Color;
import term.chess.engine.game.Game;
import term.chess.engine.movegen.Move;
import term.chess.engine.search.evaluator.GameValues;
import term.chess.engine.search.evaluator.PositionEvaluator;

import java.util.List;

final class Negamax {

    private Negamax() {}

    /**
     * Fail-soft negamax with alpha-beta pruning. Scores are from the side to move's point of view.
     * Every trial move is played on a copy, {@code game} is never mutated.
     */
    static double search(Game game, SearchContext ctx, int depth, double alpha, double beta, int ply, Deadline deadline) {
        if (deadline.expired()) {
            ctx.aborted = true;
            return 0.0;
        }
        ctx.nodes++; ctx.totalNodes++;

        List<Move> moves = game.legalMoves();
        if (depth == 0 || game.isGameOver() || moves.isEmpty()) {
            return evaluateForSideToMove(game, ctx, ply);
        }

        double best = Double.NEGATIVE_INFINITY;
        for (Move move : MoveOrdering.order(game, moves)) {
            Game child = game.copy();
            child.playMove(move);
            double score = -search(child, ctx, depth - 1, -beta, -alpha, ply + 1, deadline);
            if (ctx.aborted) {
                return 0.0;
            }
            if (score > best) best = score;
            if (best > alpha) alpha = best;
            if (alpha >= beta) break;
        }
        return best;
    }

    /** Static score for the side to move, mate scores pulled towards zero by the distance from the root. */
    static double evaluateForSideToMove(Game game, SearchContext ctx, int ply) {
        double whiteScore = PositionEvaluator.evaluate(game, ctx.difficulty, ctx.weights);
        if (whiteScore >= GameValues.MATE_THRESHOLD) {
            whiteScore -= ply;
        } else if (whiteScore <= -GameValues.MATE_THRESHOLD) {
            whiteScore += ply;
        }
        return game.activeColor() == Color.WHITE ? whiteScore : -whiteScore;
    }
}
