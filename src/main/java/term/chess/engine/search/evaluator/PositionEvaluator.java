package term.chess.engine.search.evaluator;

import term.chess.engine.common.Color;
import term.chess.engine.common.Difficulty;
import term.chess.engine.game.Game;
import term.chess.engine.game.GameStatus;
import term.chess.engine.game.Piece;

import static term.chess.engine.search.evaluator.PieceValues.*;

/**
 * Static evaluation in pawns, always from White's point of view. Layers are added by difficulty:
 * material for every tier, positional terms and mobility from medium, king safety for hard.
 */
public class PositionEvaluator {
    static final double MOBILITY_PER_MOVE = 0.1;

    private PositionEvaluator() {}

    public static double evaluate(Game game, Difficulty difficulty) {
        return evaluate(game, difficulty, EvalWeights.DEFAULT);
    }

    public static double evaluate(Game game, Difficulty difficulty, EvalWeights weights) {
        GameStatus status = game.status();
        if (status == GameStatus.CHECKMATE) {
            // The side to move is the one mated
            return game.activeColor() == Color.WHITE ? -GameValues.CHECKMATE_VALUE : GameValues.CHECKMATE_VALUE;
        }
        if (status.isDraw()) {
            return GameValues.DRAW_VALUE;
        }

        double score = weights.material() * material(game);
        if (difficulty.atLeast(Difficulty.MEDIUM)) {
            double phase = GamePhase.currentPhase(game);
            score += weights.pieceSquare() * (piecePositions(game, phase) + PawnEval.passedPawns(game, phase));
            score += weights.mobility() * mobility(game);
        }
        if (difficulty.atLeast(Difficulty.HARD)) {
            score += weights.kingSafety() * KingSafety.evaluate(game);
        }
        return score;
    }

    public static double material(Game game) {
        double score = 0.0;
        for (int sq = 0; sq < 64; sq++) {
            Piece piece = game.pieceAt(sq);
            if (piece.isEmpty()) {
                continue;
            }
            double value = valueOf(piece.type());
            score += piece.color() == Color.WHITE ? value : -value;
        }
        return score;
    }

    public static double piecePositions(Game game, double phase) {
        double score = 0.0;
        for (int sq = 0; sq < 64; sq++) {
            Piece piece = game.pieceAt(sq);
            if (piece.isEmpty()) {
                continue;
            }
            int index = tableIndex(sq, piece.color());
            double bonus = switch (piece.type()) {
                case PAWN -> PAWN_TABLE[index];
                case KNIGHT -> KNIGHT_TABLE[index];
                case BISHOP -> BISHOP_TABLE[index];
                case ROOK -> ROOK_TABLE[index];
                case KING -> phase * KING_MG_TABLE[index] + (1.0 - phase) * KING_EG_TABLE[index];
                case QUEEN, NONE -> 0.0;
            };
            score += piece.color() == Color.WHITE ? bonus : -bonus;
        }
        return score;
    }

    /** Legal move count of the side to move, counted for White and against Black. */
    public static double mobility(Game game) {
        double mobility = game.legalMoves().size() * MOBILITY_PER_MOVE;
        return game.activeColor() == Color.WHITE ? mobility : -mobility;
    }
}
