package term.chess.engine.search.evaluator;

import term.chess.engine.common.Color;
import term.chess.engine.common.PieceType;
import term.chess.engine.game.Game;
import term.chess.engine.game.Piece;

public final class PawnEval {
    // By rank relative to the pawn's own side, 0 = home rank
    static final double[] PASSED_PAWN_BONUS = {0.0, 0.05, 0.1, 0.2, 0.35, 0.6, 1.0, 0.0};

    private PawnEval() {}

    /** Passed-pawn bonus from White's perspective, grown up to twice as large as the phase drops to 0. */
    public static double passedPawns(Game game, double phase) {
        double scale = 1.0 + (1.0 - phase);
        double score = 0.0;
        for (int sq = 0; sq < 64; sq++) {
            Piece piece = game.pieceAt(sq);
            if (piece.type() != PieceType.PAWN || !isPassed(game, sq, piece.color())) {
                continue;
            }
            int relativeRank = piece.color() == Color.WHITE ? sq >>> 3 : 7 - (sq >>> 3);
            double bonus = PASSED_PAWN_BONUS[relativeRank] * scale;
            score += piece.color() == Color.WHITE ? bonus : -bonus;
        }
        return score;
    }

    /** No enemy pawn on the same or an adjacent file anywhere ahead of the pawn. */
    public static boolean isPassed(Game game, int square, Color color) {
        int file = square & 7;
        int rank = square >>> 3;
        Piece enemyPawn = Piece.of(PieceType.PAWN, color.getOppositeColor());
        for (int r = rank + color.forward(); r >= 0 && r < 8; r += color.forward()) {
            for (int f = Math.max(0, file - 1); f <= Math.min(7, file + 1); f++) {
                if (game.pieceAt(r * 8 + f) == enemyPawn) {
                    return false;
                }
            }
        }
        return true;
    }
}
