package term.chess.engine.game;

import term.chess.engine.common.Color;

import java.util.SplittableRandom;

public final class ZobristHashKeys {
    // [color * 6 + pieceType][square]
    private static final long[][] PIECE_SQUARE = new long[12][64];
    private static final long BLACK_TO_MOVE;
    private static final long WHITE_KING_SIDE_CASTLE;
    private static final long WHITE_QUEEN_SIDE_CASTLE;
    private static final long BLACK_KING_SIDE_CASTLE;
    private static final long BLACK_QUEEN_SIDE_CASTLE;
    private static final long[] EN_PASSANT_FILE = new long[8];

    static {
        // Fixed seed: keys must be identical across runs and across copies of a game
        SplittableRandom random = new SplittableRandom(0x7E_C4E55L);
        for (int p = 0; p < 12; p++) {
            for (int sq = 0; sq < 64; sq++) {
                PIECE_SQUARE[p][sq] = random.nextLong();
            }
        }
        BLACK_TO_MOVE = random.nextLong();
        WHITE_KING_SIDE_CASTLE = random.nextLong();
        WHITE_QUEEN_SIDE_CASTLE = random.nextLong();
        BLACK_KING_SIDE_CASTLE = random.nextLong();
        BLACK_QUEEN_SIDE_CASTLE = random.nextLong();
        for (int f = 0; f < 8; f++) {
            EN_PASSANT_FILE[f] = random.nextLong();
        }
    }

    private ZobristHashKeys() {}

    public static long getHashKey(Game game) {
        long key = 0L;
        for (int sq = 0; sq < 64; sq++) {
            Piece piece = game.pieceAt(sq);
            if (!piece.isEmpty()) {
                key ^= PIECE_SQUARE[piece.color().ordinal() * 6 + piece.type().ordinal()][sq];
            }
        }
        if (game.activeColor() == Color.BLACK) key ^= BLACK_TO_MOVE;
        if (game.canCastleKingSide(Color.WHITE)) key ^= WHITE_KING_SIDE_CASTLE;
        if (game.canCastleQueenSide(Color.WHITE)) key ^= WHITE_QUEEN_SIDE_CASTLE;
        if (game.canCastleKingSide(Color.BLACK)) key ^= BLACK_KING_SIDE_CASTLE;
        if (game.canCastleQueenSide(Color.BLACK)) key ^= BLACK_QUEEN_SIDE_CASTLE;
        if (game.isEnPassantCapturable()) {
            key ^= EN_PASSANT_FILE[game.enPassantIndex() & 7];
        }
        return key;
    }
}
