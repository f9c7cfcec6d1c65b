package term.chess.engine.movegen;

import term.chess.engine.common.Color;
import term.chess.engine.common.PieceType;
import term.chess.engine.game.Game;
import term.chess.engine.game.Piece;

import java.util.ArrayList;
import java.util.List;

/**
 * Mailbox move generation: pseudo-legal moves filtered by "does the mover's king stay safe".
 */
public final class MoveGenerator {
    private static final int[][] KNIGHT_STEPS = {{1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}};
    private static final int[][] KING_STEPS = {{1, 0}, {1, 1}, {0, 1}, {-1, 1}, {-1, 0}, {-1, -1}, {0, -1}, {1, -1}};
    private static final int[][] DIAGONALS = {{1, 1}, {1, -1}, {-1, 1}, {-1, -1}};
    private static final int[][] ORTHOGONALS = {{1, 0}, {-1, 0}, {0, 1}, {0, -1}};

    private MoveGenerator() {}

    public static List<Move> generateLegalMoves(Game game) {
        Piece[] squares = game.squaresSnapshot();
        Color us = game.activeColor();
        Color them = us.getOppositeColor();
        int enPassantIndex = game.enPassantIndex();

        List<Move> pseudoLegal = new ArrayList<>(64);
        generatePseudoLegalMoves(game, squares, us, pseudoLegal);

        List<Move> legal = new ArrayList<>(pseudoLegal.size());
        for (Move move : pseudoLegal) {
            Piece[] after = squares.clone();
            applyToSquares(after, move, enPassantIndex);
            int king = findKing(after, us);
            if (king == -1 || !isSquareAttacked(after, king, them)) {
                legal.add(move);
            }
        }
        return legal;
    }

    /**
     * Moves the pieces of {@code move} on {@code squares}, including the rook of a castle, the pawn taken
     * en passant and the promoted piece.
     *
     * @return the captured piece, {@link Piece#NONE} if nothing was taken
     */
    public static Piece applyToSquares(Piece[] squares, Move move, int enPassantIndex) {
        int start = move.startPosition();
        int end = move.endPosition();
        Piece moving = squares[start];
        Piece captured = squares[end];

        if (moving.type() == PieceType.PAWN && end == enPassantIndex && captured.isEmpty() && (start & 7) != (end & 7)) {
            int takenPawn = end - 8 * moving.color().forward();
            captured = squares[takenPawn];
            squares[takenPawn] = Piece.NONE;
        }
        if (moving.type() == PieceType.KING && Math.abs(end - start) == 2) {
            boolean kingSide = end > start;
            int rookFrom = kingSide ? start + 3 : start - 4;
            int rookTo = kingSide ? start + 1 : start - 1;
            squares[rookTo] = squares[rookFrom];
            squares[rookFrom] = Piece.NONE;
        }

        squares[start] = Piece.NONE;
        squares[end] = move.isPromotion() ? Piece.of(move.promotion(), moving.color()) : moving;
        return captured;
    }

    /** True when any piece of {@code byColor} attacks {@code square}, pins ignored. */
    public static boolean isSquareAttacked(Piece[] squares, int square, Color byColor) {
        int file = square & 7;
        int rank = square >>> 3;

        // Pawns of byColor attack from one rank behind the target, relative to their direction
        int pawnRank = rank - byColor.forward();
        Piece pawn = Piece.of(PieceType.PAWN, byColor);
        if (pawnRank >= 0 && pawnRank < 8) {
            if (file > 0 && squares[pawnRank * 8 + file - 1] == pawn) return true;
            if (file < 7 && squares[pawnRank * 8 + file + 1] == pawn) return true;
        }

        Piece knight = Piece.of(PieceType.KNIGHT, byColor);
        for (int[] step : KNIGHT_STEPS) {
            int target = squareAt(file + step[0], rank + step[1]);
            if (target != -1 && squares[target] == knight) return true;
        }

        Piece king = Piece.of(PieceType.KING, byColor);
        for (int[] step : KING_STEPS) {
            int target = squareAt(file + step[0], rank + step[1]);
            if (target != -1 && squares[target] == king) return true;
        }

        Piece queen = Piece.of(PieceType.QUEEN, byColor);
        Piece bishop = Piece.of(PieceType.BISHOP, byColor);
        Piece rook = Piece.of(PieceType.ROOK, byColor);
        for (int[] direction : DIAGONALS) {
            Piece blocker = firstPieceOnRay(squares, file, rank, direction);
            if (blocker == bishop || blocker == queen) return true;
        }
        for (int[] direction : ORTHOGONALS) {
            Piece blocker = firstPieceOnRay(squares, file, rank, direction);
            if (blocker == rook || blocker == queen) return true;
        }
        return false;
    }

    public static int findKing(Piece[] squares, Color color) {
        for (int sq = 0; sq < 64; sq++) {
            if (squares[sq].is(PieceType.KING, color)) {
                return sq;
            }
        }
        return -1;
    }

    private static Piece firstPieceOnRay(Piece[] squares, int file, int rank, int[] direction) {
        int f = file + direction[0];
        int r = rank + direction[1];
        while (f >= 0 && f < 8 && r >= 0 && r < 8) {
            Piece piece = squares[r * 8 + f];
            if (!piece.isEmpty()) {
                return piece;
            }
            f += direction[0];
            r += direction[1];
        }
        return Piece.NONE;
    }

    private static void generatePseudoLegalMoves(Game game, Piece[] squares, Color us, List<Move> moves) {
        for (int sq = 0; sq < 64; sq++) {
            Piece piece = squares[sq];
            if (piece.isEmpty() || piece.color() != us) {
                continue;
            }
            switch (piece.type()) {
                case PAWN -> generatePawnMoves(squares, sq, us, game.enPassantIndex(), moves);
                case KNIGHT -> generateStepMoves(squares, sq, us, KNIGHT_STEPS, moves);
                case BISHOP -> generateSlidingMoves(squares, sq, us, DIAGONALS, moves);
                case ROOK -> generateSlidingMoves(squares, sq, us, ORTHOGONALS, moves);
                case QUEEN -> {
                    generateSlidingMoves(squares, sq, us, DIAGONALS, moves);
                    generateSlidingMoves(squares, sq, us, ORTHOGONALS, moves);
                }
                case KING -> {
                    generateStepMoves(squares, sq, us, KING_STEPS, moves);
                    generateCastles(game, squares, sq, us, moves);
                }
                case NONE -> {}
            }
        }
    }

    private static void generatePawnMoves(Piece[] squares, int from, Color us, int enPassantIndex, List<Move> moves) {
        int file = from & 7;
        int rank = from >>> 3;
        int forward = us.forward();
        int startRank = us.isWhite() ? 1 : 6;

        int oneStep = squareAt(file, rank + forward);
        if (oneStep != -1 && squares[oneStep].isEmpty()) {
            addPawnMove(from, oneStep, moves);
            int twoSteps = squareAt(file, rank + 2 * forward);
            if (rank == startRank && twoSteps != -1 && squares[twoSteps].isEmpty()) {
                moves.add(new Move(from, twoSteps));
            }
        }
        for (int side = -1; side <= 1; side += 2) {
            int target = squareAt(file + side, rank + forward);
            if (target == -1) {
                continue;
            }
            Piece victim = squares[target];
            if ((!victim.isEmpty() && victim.color() != us) || target == enPassantIndex) {
                addPawnMove(from, target, moves);
            }
        }
    }

    private static void addPawnMove(int from, int to, List<Move> moves) {
        int toRank = to >>> 3;
        if (toRank == 0 || toRank == 7) {
            for (PieceType promotion : PieceType.PROMOTIONS) {
                moves.add(new Move(from, to, promotion));
            }
        } else {
            moves.add(new Move(from, to));
        }
    }

    private static void generateStepMoves(Piece[] squares, int from, Color us, int[][] steps, List<Move> moves) {
        int file = from & 7;
        int rank = from >>> 3;
        for (int[] step : steps) {
            int target = squareAt(file + step[0], rank + step[1]);
            if (target != -1 && squares[target].color() != us) {
                moves.add(new Move(from, target));
            }
        }
    }

    private static void generateSlidingMoves(Piece[] squares, int from, Color us, int[][] directions, List<Move> moves) {
        int file = from & 7;
        int rank = from >>> 3;
        for (int[] direction : directions) {
            int f = file + direction[0];
            int r = rank + direction[1];
            while (f >= 0 && f < 8 && r >= 0 && r < 8) {
                int target = r * 8 + f;
                Piece piece = squares[target];
                if (piece.isEmpty()) {
                    moves.add(new Move(from, target));
                } else {
                    if (piece.color() != us) {
                        moves.add(new Move(from, target));
                    }
                    break;
                }
                f += direction[0];
                r += direction[1];
            }
        }
    }

    private static void generateCastles(Game game, Piece[] squares, int kingSquare, Color us, List<Move> moves) {
        int home = us.isWhite() ? 4 : 60;
        if (kingSquare != home) {
            return;
        }
        Color them = us.getOppositeColor();
        Piece rook = Piece.of(PieceType.ROOK, us);
        if (game.canCastleKingSide(us)
                && squares[home + 3] == rook
                && squares[home + 1].isEmpty() && squares[home + 2].isEmpty()
                && !isSquareAttacked(squares, home, them)
                && !isSquareAttacked(squares, home + 1, them)
                && !isSquareAttacked(squares, home + 2, them)) {
            moves.add(new Move(home, home + 2));
        }
        if (game.canCastleQueenSide(us)
                && squares[home - 4] == rook
                && squares[home - 1].isEmpty() && squares[home - 2].isEmpty() && squares[home - 3].isEmpty()
                && !isSquareAttacked(squares, home, them)
                && !isSquareAttacked(squares, home - 1, them)
                && !isSquareAttacked(squares, home - 2, them)) {
            moves.add(new Move(home, home - 2));
        }
    }

    private static int squareAt(int file, int rank) {
        if (file < 0 || file > 7 || rank < 0 || rank > 7) {
            return -1;
        }
        return rank * 8 + file;
    }
}
