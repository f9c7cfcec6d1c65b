package term.chess.engine.movegen;

import term.chess.engine.common.PieceType;
import term.chess.engine.utils.notations.MoveIOUtils;

/**
 * A move from one square to another, squares indexed {@code rank * 8 + file} with a1 = 0.
 * Castling is the king's two-square move; {@code promotion} is {@link PieceType#NONE} unless a pawn promotes.
 */
public record Move(int startPosition, int endPosition, PieceType promotion) {
    public Move {
        if (startPosition < 0 || startPosition > 63 || endPosition < 0 || endPosition > 63) {
            throw new IllegalArgumentException("Square index out of board: " + startPosition + " -> " + endPosition);
        }
        if (promotion == null) {
            promotion = PieceType.NONE;
        }
    }

    public Move(int startPosition, int endPosition) {
        this(startPosition, endPosition, PieceType.NONE);
    }

    public static Move fromAlgebraicNotation(String notation) {
        if (notation == null || (notation.length() != 4 && notation.length() != 5)) {
            throw new IllegalArgumentException("Cannot parse algebraic notation " + notation);
        }
        int startPosition = MoveIOUtils.getIndexFromSquare(notation.substring(0, 2));
        int endPosition = MoveIOUtils.getIndexFromSquare(notation.substring(2, 4));
        if (notation.length() == 4) {
            return new Move(startPosition, endPosition);
        }
        return new Move(startPosition, endPosition, MoveIOUtils.getPieceTypeFromLetter(notation.charAt(4)));
    }

    public boolean isPromotion() {
        return promotion != PieceType.NONE;
    }

    @Override
    public String toString() {
        return MoveIOUtils.writeAlgebraicNotation(this);
    }
}
