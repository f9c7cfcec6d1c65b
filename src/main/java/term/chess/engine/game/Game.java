package term.chess.engine.game;

import it.unimi.dsi.fastutil.longs.LongArrayList;
import term.chess.engine.common.Color;
import term.chess.engine.common.PieceType;
import term.chess.engine.movegen.Move;
import term.chess.engine.movegen.MoveGenerator;
import term.chess.engine.utils.notations.FENUtils;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * A chess position together with the history needed to adjudicate repetition draws.
 * <p>
 * Games are mutated only through {@link #playMove(Move)}. Searches work on {@link #copy()}s so the
 * caller's game is never touched.
 */
public class Game {
    private final Piece[] squares;
    private final LongArrayList history;

    private Color currentPlayer = Color.WHITE;
    private boolean whiteCanCastleKingSide = false;
    private boolean whiteCanCastleQueenSide = false;
    private boolean blackCanCastleKingSide = false;
    private boolean blackCanCastleQueenSide = false;
    private int enPassantIndex = -1;
    private int halfMoveClock = 0;
    private int fullMoveClock = 1;
    private long zobristKey;

    // Both caches are immutable once computed, copies share them
    private List<Move> legalMovesCache;
    private GameStatus statusCache;

    /** Empty board, White to move, no castling rights. Populate through the setters or {@link FENUtils}. */
    public Game() {
        squares = new Piece[64];
        Arrays.fill(squares, Piece.NONE);
        history = new LongArrayList();
        recomputeZobristKey();
    }

    private Game(Game other) {
        squares = other.squares.clone();
        history = other.history.clone();
        currentPlayer = other.currentPlayer;
        whiteCanCastleKingSide = other.whiteCanCastleKingSide;
        whiteCanCastleQueenSide = other.whiteCanCastleQueenSide;
        blackCanCastleKingSide = other.blackCanCastleKingSide;
        blackCanCastleQueenSide = other.blackCanCastleQueenSide;
        enPassantIndex = other.enPassantIndex;
        halfMoveClock = other.halfMoveClock;
        fullMoveClock = other.fullMoveClock;
        zobristKey = other.zobristKey;
        legalMovesCache = other.legalMovesCache;
        statusCache = other.statusCache;
    }

    /** Independent deep copy; mutating the copy never affects this game. */
    public Game copy() {
        return new Game(this);
    }

    /**
     * Legal moves for the side to move. Returned even when the position is already drawn by rule,
     * callers decide whether the game goes on.
     */
    public List<Move> legalMoves() {
        if (legalMovesCache == null) {
            legalMovesCache = List.copyOf(MoveGenerator.generateLegalMoves(this));
        }
        return legalMovesCache;
    }

    public void playMove(Move move) {
        if (!legalMoves().contains(move)) {
            throw new IllegalMoveException(move, FENUtils.getFENFromBoard(this));
        }
        applyMove(move);
    }

    public void playMoves(String moves) {
        for (String move : moves.trim().split("\\s+")) {
            playMove(Move.fromAlgebraicNotation(move));
        }
    }

    private void applyMove(Move move) {
        int start = move.startPosition();
        int end = move.endPosition();
        Piece moving = squares[start];
        Piece captured = MoveGenerator.applyToSquares(squares, move, enPassantIndex);

        if (moving.type() == PieceType.KING) {
            if (currentPlayer.isWhite()) {
                whiteCanCastleKingSide = false;
                whiteCanCastleQueenSide = false;
            } else {
                blackCanCastleKingSide = false;
                blackCanCastleQueenSide = false;
            }
        }
        // A rook leaving or being captured on its corner
        if (start == 7 || end == 7) whiteCanCastleKingSide = false;
        if (start == 0 || end == 0) whiteCanCastleQueenSide = false;
        if (start == 63 || end == 63) blackCanCastleKingSide = false;
        if (start == 56 || end == 56) blackCanCastleQueenSide = false;

        enPassantIndex = -1;
        if (moving.type() == PieceType.PAWN && Math.abs(end - start) == 16) {
            enPassantIndex = (start + end) / 2;
        }

        if (moving.type() == PieceType.PAWN || !captured.isEmpty()) {
            halfMoveClock = 0;
        } else {
            halfMoveClock++;
        }
        if (currentPlayer == Color.BLACK) {
            fullMoveClock++;
        }
        currentPlayer = currentPlayer.getOppositeColor();

        invalidateCaches();
        zobristKey = ZobristHashKeys.getHashKey(this);
        history.add(zobristKey);
    }

    public GameStatus status() {
        if (statusCache == null) {
            statusCache = computeStatus();
        }
        return statusCache;
    }

    private GameStatus computeStatus() {
        if (legalMoves().isEmpty()) {
            return inCheck() ? GameStatus.CHECKMATE : GameStatus.STALEMATE;
        }
        if (isInsufficientMaterial()) {
            return GameStatus.DRAW_INSUFFICIENT_MATERIAL;
        }
        if (halfMoveClock >= 150) {
            return GameStatus.DRAW_SEVENTY_FIVE_MOVE_RULE;
        }
        int repetitions = repetitionCount();
        if (repetitions >= 5) {
            return GameStatus.DRAW_FIVEFOLD_REPETITION;
        }
        if (repetitions >= 3) {
            return GameStatus.DRAW_THREEFOLD_REPETITION;
        }
        if (halfMoveClock >= 100) {
            return GameStatus.DRAW_FIFTY_MOVE_RULE;
        }
        return GameStatus.ONGOING;
    }

    public boolean isGameOver() {
        return status() != GameStatus.ONGOING;
    }

    /** The side that delivered mate, empty for ongoing or drawn games. */
    public Optional<Color> winner() {
        if (status() == GameStatus.CHECKMATE) {
            return Optional.of(currentPlayer.getOppositeColor());
        }
        return Optional.empty();
    }

    /** How many times the current position occurred, the current occurrence included. */
    public int repetitionCount() {
        int count = 0;
        for (int i = 0; i < history.size(); i++) {
            if (history.getLong(i) == zobristKey) {
                count++;
            }
        }
        return count;
    }

    public boolean isInsufficientMaterial() {
        int whiteMinors = 0;
        int blackMinors = 0;
        int bishopSquareColors = 0; // bit 0: a light-square bishop, bit 1: a dark-square bishop
        boolean whiteBishop = false;
        boolean blackBishop = false;
        for (int sq = 0; sq < 64; sq++) {
            Piece piece = squares[sq];
            switch (piece.type()) {
                case NONE, KING -> {}
                case PAWN, ROOK, QUEEN -> {
                    return false;
                }
                case KNIGHT, BISHOP -> {
                    if (piece.color() == Color.WHITE) whiteMinors++;
                    else blackMinors++;
                    if (piece.type() == PieceType.BISHOP) {
                        if (piece.color() == Color.WHITE) whiteBishop = true;
                        else blackBishop = true;
                        boolean dark = ((sq >>> 3) + (sq & 7)) % 2 == 0;
                        bishopSquareColors |= dark ? 2 : 1;
                    }
                }
            }
        }
        int minors = whiteMinors + blackMinors;
        if (minors <= 1) {
            return true;
        }
        // K+B vs K+B with both bishops on the same square color
        return whiteMinors == 1 && blackMinors == 1 && whiteBishop && blackBishop
                && (bishopSquareColors == 1 || bishopSquareColors == 2);
    }

    public boolean inCheck() {
        int king = findKing(currentPlayer);
        return king != -1 && isSquareAttacked(king, currentPlayer.getOppositeColor());
    }

    public boolean isSquareAttacked(int square, Color byColor) {
        return MoveGenerator.isSquareAttacked(squares, square, byColor);
    }

    public int findKing(Color color) {
        for (int sq = 0; sq < 64; sq++) {
            if (squares[sq].is(PieceType.KING, color)) {
                return sq;
            }
        }
        return -1;
    }

    /**
     * True when the en passant target is set and a pawn of the side to move can actually reach it.
     * Positions differing only by an unusable en passant square hash identically.
     */
    public boolean isEnPassantCapturable() {
        if (enPassantIndex == -1) {
            return false;
        }
        int pushedPawn = enPassantIndex - 8 * currentPlayer.forward();
        int file = pushedPawn & 7;
        Piece capturer = Piece.of(PieceType.PAWN, currentPlayer);
        return (file > 0 && squares[pushedPawn - 1] == capturer)
                || (file < 7 && squares[pushedPawn + 1] == capturer);
    }

    public Piece pieceAt(int square) {
        return squares[square];
    }

    public Piece[] squaresSnapshot() {
        return squares.clone();
    }

    public Color activeColor() {
        return currentPlayer;
    }

    public boolean canCastleKingSide(Color color) {
        return color.isWhite() ? whiteCanCastleKingSide : blackCanCastleKingSide;
    }

    public boolean canCastleQueenSide(Color color) {
        return color.isWhite() ? whiteCanCastleQueenSide : blackCanCastleQueenSide;
    }

    public int enPassantIndex() {
        return enPassantIndex;
    }

    public int halfMoveClock() {
        return halfMoveClock;
    }

    public int fullMoveClock() {
        return fullMoveClock;
    }

    public long zobristKey() {
        return zobristKey;
    }

    // Setup mutators, used when building a position. Call recomputeZobristKey() once done.

    public void setPieceAt(int square, Piece piece) {
        squares[square] = piece;
        invalidateCaches();
    }

    public void setCurrentPlayer(Color currentPlayer) {
        this.currentPlayer = currentPlayer;
        invalidateCaches();
    }

    public void setCastlingRights(boolean whiteKingSide, boolean whiteQueenSide, boolean blackKingSide, boolean blackQueenSide) {
        this.whiteCanCastleKingSide = whiteKingSide;
        this.whiteCanCastleQueenSide = whiteQueenSide;
        this.blackCanCastleKingSide = blackKingSide;
        this.blackCanCastleQueenSide = blackQueenSide;
        invalidateCaches();
    }

    public void setEnPassantIndex(int enPassantIndex) {
        this.enPassantIndex = enPassantIndex;
        invalidateCaches();
    }

    public void setHalfMoveClock(int halfMoveClock) {
        this.halfMoveClock = halfMoveClock;
        invalidateCaches();
    }

    public void setFullMoveClock(int fullMoveClock) {
        this.fullMoveClock = fullMoveClock;
    }

    /** Rehashes the position and restarts the repetition history from it. */
    public void recomputeZobristKey() {
        zobristKey = ZobristHashKeys.getHashKey(this);
        history.clear();
        history.add(zobristKey);
        invalidateCaches();
    }

    private void invalidateCaches() {
        legalMovesCache = null;
        statusCache = null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Game game)) return false;
        return zobristKey == game.zobristKey
                && halfMoveClock == game.halfMoveClock
                && fullMoveClock == game.fullMoveClock
                && Arrays.equals(squares, game.squares);
    }

    @Override
    public int hashCode() {
        return Long.hashCode(zobristKey);
    }

    @Override
    public String toString() {
        return FENUtils.getFENFromBoard(this);
    }
}
