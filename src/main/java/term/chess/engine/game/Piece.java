package term.chess.engine.game;

import term.chess.engine.common.Color;
import term.chess.engine.common.PieceType;

/**
 * Content of a board square. Empty squares hold {@link #NONE}, whose color is {@code null}.
 */
public record Piece(PieceType type, Color color) {
    public static final Piece NONE = new Piece(PieceType.NONE, null);

    // [color][type] so the board never allocates pieces
    private static final Piece[][] CACHE = new Piece[2][6];
    static {
        for (Color color : Color.values()) {
            for (int t = 0; t < 6; t++) {
                CACHE[color.ordinal()][t] = new Piece(PieceType.VALUES[t], color);
            }
        }
    }

    public static Piece of(PieceType type, Color color) {
        if (type == PieceType.NONE) {
            return NONE;
        }
        return CACHE[color.ordinal()][type.ordinal()];
    }

    public boolean isEmpty() {
        return type == PieceType.NONE;
    }

    public boolean is(PieceType pieceType, Color pieceColor) {
        return type == pieceType && color == pieceColor;
    }

    /** FEN letter: uppercase for White, lowercase for Black, '.' when empty. */
    public char toFENLetter() {
        char c = switch (type) {
            case PAWN -> 'p';
            case KNIGHT -> 'n';
            case BISHOP -> 'b';
            case ROOK -> 'r';
            case QUEEN -> 'q';
            case KING -> 'k';
            case NONE -> '.';
        };
        return color == Color.WHITE ? Character.toUpperCase(c) : c;
    }

    @Override
    public String toString() {
        return String.valueOf(toFENLetter());
    }
}
