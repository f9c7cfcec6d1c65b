package term.chess.engine.search.evaluator;

import term.chess.engine.common.Color;
import term.chess.engine.common.PieceType;

/**
 * Material values and piece-square tables, in pawns. Tables are indexed from White's side
 * (a1 = 0, h8 = 63); Black reads them mirrored through {@link #tableIndex(int, Color)}.
 */
public final class PieceValues {
    public static final double PAWN_VALUE = 1.0;
    public static final double KNIGHT_VALUE = 3.0;
    public static final double BISHOP_VALUE = 3.25;
    public static final double ROOK_VALUE = 5.0;
    public static final double QUEEN_VALUE = 9.0;
    public static final double KING_VALUE = 0.0;

    // Indexed by PieceType ordinal
    static final double[] VAL = {PAWN_VALUE, KNIGHT_VALUE, BISHOP_VALUE, ROOK_VALUE, QUEEN_VALUE, KING_VALUE, 0.0};

    static final double[] PAWN_TABLE = {
            0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0,
            0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0,
            0.1, 0.1, 0.2, 0.3, 0.3, 0.2, 0.1, 0.1,
            0.15, 0.15, 0.2, 0.35, 0.35, 0.2, 0.15, 0.15,
            0.2, 0.2, 0.3, 0.4, 0.4, 0.3, 0.2, 0.2,
            0.3, 0.3, 0.4, 0.5, 0.5, 0.4, 0.3, 0.3,
            0.5, 0.5, 0.6, 0.7, 0.7, 0.6, 0.5, 0.5,
            0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0,
    };

    static final double[] KNIGHT_TABLE = {
            -0.5, -0.4, -0.3, -0.3, -0.3, -0.3, -0.4, -0.5,
            -0.4, -0.2, 0.0, 0.0, 0.0, 0.0, -0.2, -0.4,
            -0.3, 0.0, 0.1, 0.15, 0.15, 0.1, 0.0, -0.3,
            -0.3, 0.05, 0.15, 0.2, 0.2, 0.15, 0.05, -0.3,
            -0.3, 0.0, 0.15, 0.2, 0.2, 0.15, 0.0, -0.3,
            -0.3, 0.05, 0.1, 0.15, 0.15, 0.1, 0.05, -0.3,
            -0.4, -0.2, 0.0, 0.05, 0.05, 0.0, -0.2, -0.4,
            -0.5, -0.4, -0.3, -0.3, -0.3, -0.3, -0.4, -0.5,
    };

    static final double[] BISHOP_TABLE = {
            -0.2, -0.1, -0.1, -0.1, -0.1, -0.1, -0.1, -0.2,
            -0.1, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, -0.1,
            -0.1, 0.0, 0.05, 0.1, 0.1, 0.05, 0.0, -0.1,
            -0.1, 0.05, 0.05, 0.1, 0.1, 0.05, 0.05, -0.1,
            -0.1, 0.0, 0.1, 0.1, 0.1, 0.1, 0.0, -0.1,
            -0.1, 0.1, 0.1, 0.1, 0.1, 0.1, 0.1, -0.1,
            -0.1, 0.05, 0.0, 0.0, 0.0, 0.0, 0.05, -0.1,
            -0.2, -0.1, -0.1, -0.1, -0.1, -0.1, -0.1, -0.2,
    };

    static final double[] ROOK_TABLE = {
            0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0,
            0.05, 0.1, 0.1, 0.1, 0.1, 0.1, 0.1, 0.05,
            -0.05, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, -0.05,
            -0.05, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, -0.05,
            -0.05, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, -0.05,
            -0.05, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, -0.05,
            0.25, 0.25, 0.25, 0.25, 0.25, 0.25, 0.25, 0.25,
            0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0, 0.0,
    };

    // King tucked behind its pawns
    static final double[] KING_MG_TABLE = {
            0.2, 0.3, 0.1, 0.0, 0.0, 0.1, 0.3, 0.2,
            0.2, 0.2, 0.0, 0.0, 0.0, 0.0, 0.2, 0.2,
            -0.1, -0.2, -0.2, -0.2, -0.2, -0.2, -0.2, -0.1,
            -0.2, -0.3, -0.3, -0.4, -0.4, -0.3, -0.3, -0.2,
            -0.3, -0.4, -0.4, -0.5, -0.5, -0.4, -0.4, -0.3,
            -0.3, -0.4, -0.4, -0.5, -0.5, -0.4, -0.4, -0.3,
            -0.3, -0.4, -0.4, -0.5, -0.5, -0.4, -0.4, -0.3,
            -0.3, -0.4, -0.4, -0.5, -0.5, -0.4, -0.4, -0.3,
    };

    // King walking to the center
    static final double[] KING_EG_TABLE = {
            -0.3, -0.4, -0.4, -0.5, -0.5, -0.4, -0.4, -0.3,
            -0.3, -0.4, -0.4, -0.5, -0.5, -0.4, -0.4, -0.3,
            -0.3, -0.4, -0.2, 0.0, 0.0, -0.2, -0.4, -0.3,
            -0.3, -0.3, 0.0, 0.2, 0.2, 0.0, -0.3, -0.3,
            -0.3, -0.3, 0.0, 0.2, 0.2, 0.0, -0.3, -0.3,
            -0.3, -0.4, -0.2, 0.0, 0.0, -0.2, -0.4, -0.3,
            -0.3, -0.4, -0.4, -0.5, -0.5, -0.4, -0.4, -0.3,
            -0.3, -0.4, -0.4, -0.5, -0.5, -0.4, -0.4, -0.3,
    };

    private PieceValues() {}

    public static double valueOf(PieceType pieceType) {
        return VAL[pieceType.ordinal()];
    }

    static int tableIndex(int square, Color color) {
        if (color == Color.WHITE) {
            return square;
        }
        return (7 - (square >>> 3)) * 8 + (square & 7);
    }
}
