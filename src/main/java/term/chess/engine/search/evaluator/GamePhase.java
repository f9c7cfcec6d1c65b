package term.chess.engine.search.evaluator;

import term.chess.engine.common.PieceType;
import term.chess.engine.game.Game;
import term.chess.engine.game.Piece;

public final class GamePhase {
    // Knights, bishops, rooks and queens of both sides at the start: 2 * (6 + 6.5 + 10 + 9)
    static final double STARTING_PIECE_MATERIAL = 63.0;

    private GamePhase() {}

    /** 1.0 = opening or middlegame, 0.0 = bare kings and pawns. Promotions cannot push it above 1.0. */
    public static double currentPhase(Game game) {
        double material = 0.0;
        for (int sq = 0; sq < 64; sq++) {
            Piece piece = game.pieceAt(sq);
            if (piece.isEmpty() || piece.type() == PieceType.PAWN || piece.type() == PieceType.KING) {
                continue;
            }
            material += PieceValues.valueOf(piece.type());
        }
        return Math.min(1.0, material / STARTING_PIECE_MATERIAL);
    }
}
