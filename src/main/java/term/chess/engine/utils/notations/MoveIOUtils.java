package term.chess.engine.utils.notations;

import term.chess.engine.common.PieceType;
import term.chess.engine.movegen.Move;

public class MoveIOUtils {
    private MoveIOUtils() {}

    /** Coordinate notation, e.g. {@code e2e4} or {@code e7e8q}. */
    public static String writeAlgebraicNotation(Move move) {
        String initialPosition = getSquareFromIndex(move.startPosition());
        String targetPosition = getSquareFromIndex(move.endPosition());
        String promotedPiece = move.isPromotion() ? String.valueOf(getLetterFromPieceType(move.promotion())) : "";
        return initialPosition + targetPosition + promotedPiece;
    }

    public static char getLetterFromPieceType(PieceType pieceType) {
        return switch (pieceType) {
            case KING -> 'k';
            case QUEEN -> 'q';
            case ROOK -> 'r';
            case BISHOP -> 'b';
            case KNIGHT -> 'n';
            case PAWN -> 'p';
            case NONE -> throw new IllegalArgumentException("No letter for an empty square");
        };
    }

    public static PieceType getPieceTypeFromLetter(char letter) {
        return switch (letter) {
            case 'k', 'K' -> PieceType.KING;
            case 'n', 'N' -> PieceType.KNIGHT;
            case 'q', 'Q' -> PieceType.QUEEN;
            case 'r', 'R' -> PieceType.ROOK;
            case 'b', 'B' -> PieceType.BISHOP;
            case 'p', 'P' -> PieceType.PAWN;
            default -> throw new IllegalArgumentException("Unknown piece letter " + letter);
        };
    }

    public static String getSquareFromIndex(int index) {
        return String.valueOf((char) ('a' + (index & 7))) + ((index >>> 3) + 1);
    }

    public static int getIndexFromSquare(String square) {
        if (square.length() != 2) {
            throw new IllegalArgumentException("Invalid square " + square);
        }
        int file = square.charAt(0) - 'a';
        int rank = square.charAt(1) - '1';
        if (file < 0 || file > 7 || rank < 0 || rank > 7) {
            throw new IllegalArgumentException("Invalid square " + square);
        }
        return rank * 8 + file;
    }
}
