package term.chess.engine.utils.notations;

import term.chess.engine.common.Color;
import term.chess.engine.common.PieceType;
import term.chess.engine.game.Game;
import term.chess.engine.game.Piece;

// https://en.wikipedia.org/wiki/Forsyth%E2%80%93Edwards_Notation
public class FENUtils {
    private FENUtils() {}

    /**
     * Parses a FEN record. The halfmove clock and fullmove number may be omitted, they then default to 0 and 1.
     *
     * @throws IllegalArgumentException when the record is malformed
     */
    public static Game getBoardFrom(String fen) {
        if (fen == null) {
            throw new IllegalArgumentException("Invalid FEN record: null");
        }
        String[] fenFields = fen.trim().split("\\s+");
        if (fenFields.length != 4 && fenFields.length != 6) {
            throw new IllegalArgumentException("Invalid FEN record: " + fen);
        }

        Game game = new Game();
        injectPiecePlacement(game, fenFields[0], fen);
        injectCurrentTurn(game, fenFields[1], fen);
        injectCastlingRights(game, fenFields[2], fen);
        injectEnPassantSquare(game, fenFields[3], fen);
        if (fenFields.length == 6) {
            game.setHalfMoveClock(parseCounter(fenFields[4], 0, fen));
            game.setFullMoveClock(parseCounter(fenFields[5], 1, fen));
        }

        game.recomputeZobristKey();
        return game;
    }

    public static String getFENFromBoard(Game game) {
        StringBuilder fen = new StringBuilder();
        injectPiecePlacement(game, fen);
        fen.append(' ').append(game.activeColor() == Color.BLACK ? 'b' : 'w');
        injectCastlingRights(game, fen);
        fen.append(' ');
        if (game.enPassantIndex() != -1) {
            fen.append(MoveIOUtils.getSquareFromIndex(game.enPassantIndex()));
        } else {
            fen.append('-');
        }
        fen.append(' ').append(game.halfMoveClock());
        fen.append(' ').append(game.fullMoveClock());
        return fen.toString();
    }

    private static void injectPiecePlacement(Game game, StringBuilder fen) {
        for (int rank = 7; rank >= 0; rank--) {
            int emptySpaceCounter = 0;
            if (rank != 7) {
                fen.append('/');
            }
            for (int file = 0; file < 8; file++) {
                Piece piece = game.pieceAt(rank * 8 + file);
                if (piece.isEmpty()) {
                    emptySpaceCounter++;
                    continue;
                }
                if (emptySpaceCounter != 0) {
                    fen.append(emptySpaceCounter);
                    emptySpaceCounter = 0;
                }
                fen.append(piece.toFENLetter());
            }
            if (emptySpaceCounter != 0) {
                fen.append(emptySpaceCounter);
            }
        }
    }

    private static void injectCastlingRights(Game game, StringBuilder fen) {
        fen.append(' ');
        StringBuilder castlingRights = new StringBuilder();
        if (game.canCastleKingSide(Color.WHITE)) castlingRights.append('K');
        if (game.canCastleQueenSide(Color.WHITE)) castlingRights.append('Q');
        if (game.canCastleKingSide(Color.BLACK)) castlingRights.append('k');
        if (game.canCastleQueenSide(Color.BLACK)) castlingRights.append('q');
        fen.append(castlingRights.isEmpty() ? "-" : castlingRights);
    }

    private static void injectPiecePlacement(Game game, String piecePlacement, String fen) {
        String[] rows = piecePlacement.split("/", -1);
        if (rows.length != 8) {
            throw new IllegalArgumentException("Invalid FEN record, expected 8 ranks: " + fen);
        }
        for (int row = 0; row < 8; row++) {
            int rank = 7 - row;
            int file = 0;
            for (char character : rows[row].toCharArray()) {
                if (character >= '1' && character <= '8') {
                    file += character - '0';
                    continue;
                }
                if (file > 7) {
                    throw new IllegalArgumentException("Invalid FEN record, rank overflow: " + fen);
                }
                Color color = Character.isUpperCase(character) ? Color.WHITE : Color.BLACK;
                PieceType pieceType;
                try {
                    pieceType = MoveIOUtils.getPieceTypeFromLetter(character);
                } catch (IllegalArgumentException e) {
                    throw new IllegalArgumentException("Invalid FEN record, unknown piece '" + character + "': " + fen, e);
                }
                game.setPieceAt(rank * 8 + file, Piece.of(pieceType, color));
                file++;
            }
            if (file != 8) {
                throw new IllegalArgumentException("Invalid FEN record, rank " + (rank + 1) + " does not span 8 files: " + fen);
            }
        }
    }

    private static void injectCurrentTurn(Game game, String currentTurn, String fen) {
        switch (currentTurn) {
            case "w" -> game.setCurrentPlayer(Color.WHITE);
            case "b" -> game.setCurrentPlayer(Color.BLACK);
            default -> throw new IllegalArgumentException("Invalid FEN record, unknown side to move: " + fen);
        }
    }

    private static void injectCastlingRights(Game game, String castlingRights, String fen) {
        boolean whiteKingSide = false;
        boolean whiteQueenSide = false;
        boolean blackKingSide = false;
        boolean blackQueenSide = false;
        if (!"-".equals(castlingRights)) {
            for (char character : castlingRights.toCharArray()) {
                switch (character) {
                    case 'K' -> whiteKingSide = true;
                    case 'Q' -> whiteQueenSide = true;
                    case 'k' -> blackKingSide = true;
                    case 'q' -> blackQueenSide = true;
                    default -> throw new IllegalArgumentException("Invalid FEN record, bad castling rights: " + fen);
                }
            }
        }
        game.setCastlingRights(whiteKingSide, whiteQueenSide, blackKingSide, blackQueenSide);
    }

    private static void injectEnPassantSquare(Game game, String enPassantSquare, String fen) {
        if ("-".equals(enPassantSquare)) {
            game.setEnPassantIndex(-1);
            return;
        }
        try {
            game.setEnPassantIndex(MoveIOUtils.getIndexFromSquare(enPassantSquare));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid FEN record, bad en passant square: " + fen, e);
        }
    }

    private static int parseCounter(String value, int minimum, String fen) {
        try {
            int counter = Integer.parseInt(value);
            if (counter < minimum) {
                throw new IllegalArgumentException("Invalid FEN record, counter below " + minimum + ": " + fen);
            }
            return counter;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid FEN record, bad counter '" + value + "': " + fen, e);
        }
    }
}
