package term.chess.engine.search.evaluator;

import term.chess.engine.common.Color;
import term.chess.engine.common.PieceType;
import term.chess.engine.game.Game;
import term.chess.engine.game.Piece;

public final class KingSafety {
    public static final double MISSING_SHIELD_PAWN = 0.3;
    public static final double OPEN_FILE_NEAR_KING = 0.25;
    public static final double ATTACKED_ZONE_SQUARE = 0.1;

    private KingSafety() {}

    /** White's penalty minus Black's penalty, negated: positive when White's king is the safer one. */
    public static double evaluate(Game game) {
        double score = 0.0;
        int whiteKing = game.findKing(Color.WHITE);
        if (whiteKing != -1) {
            score -= penalty(game, whiteKing, Color.WHITE);
        }
        int blackKing = game.findKing(Color.BLACK);
        if (blackKing != -1) {
            score += penalty(game, blackKing, Color.BLACK);
        }
        return score;
    }

    static double penalty(Game game, int kingSquare, Color color) {
        return pawnShield(game, kingSquare, color)
                + openFiles(game, kingSquare)
                + attackedZone(game, kingSquare, color);
    }

    // Off-board shield squares count as missing
    static double pawnShield(Game game, int kingSquare, Color color) {
        int kingFile = kingSquare & 7;
        int shieldRank = (kingSquare >>> 3) + color.forward();
        Piece ownPawn = Piece.of(PieceType.PAWN, color);
        int pawns = 0;
        if (shieldRank >= 0 && shieldRank < 8) {
            for (int file = kingFile - 1; file <= kingFile + 1; file++) {
                if (file >= 0 && file < 8 && game.pieceAt(shieldRank * 8 + file) == ownPawn) {
                    pawns++;
                }
            }
        }
        return (3 - pawns) * MISSING_SHIELD_PAWN;
    }

    static double openFiles(Game game, int kingSquare) {
        int kingFile = kingSquare & 7;
        double penalty = 0.0;
        for (int file = Math.max(0, kingFile - 1); file <= Math.min(7, kingFile + 1); file++) {
            if (!hasPawnOnFile(game, file)) {
                penalty += OPEN_FILE_NEAR_KING;
            }
        }
        return penalty;
    }

    static double attackedZone(Game game, int kingSquare, Color color) {
        int kingFile = kingSquare & 7;
        int kingRank = kingSquare >>> 3;
        Color opponent = color.getOppositeColor();
        int attacked = 0;
        for (int rank = kingRank - 1; rank <= kingRank + 1; rank++) {
            for (int file = kingFile - 1; file <= kingFile + 1; file++) {
                if (rank < 0 || rank > 7 || file < 0 || file > 7) {
                    continue;
                }
                if (game.isSquareAttacked(rank * 8 + file, opponent)) {
                    attacked++;
                }
            }
        }
        return attacked * ATTACKED_ZONE_SQUARE;
    }

    private static boolean hasPawnOnFile(Game game, int file) {
        for (int rank = 0; rank < 8; rank++) {
            if (game.pieceAt(rank * 8 + file).type() == PieceType.PAWN) {
                return true;
            }
        }
        return false;
    }
}
