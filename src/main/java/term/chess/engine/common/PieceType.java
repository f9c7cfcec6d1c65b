package term.chess.engine.common;

public enum PieceType {
    PAWN, KNIGHT, BISHOP, ROOK, QUEEN, KING, NONE;

    public static final PieceType[] VALUES = PieceType.values();

    // Pieces a pawn may promote to, strongest first
    public static final PieceType[] PROMOTIONS = {QUEEN, ROOK, BISHOP, KNIGHT};
}
