package term.chess.engine.search;

import term.chess.engine.game.Game;
import term.chess.engine.movegen.Move;

import java.util.ArrayList;
import java.util.List;

/**
 * Captures-first move ordering. A move counts as a capture when its destination square is occupied,
 * so en passant is ordered with the quiet moves.
 */
public final class MoveOrdering {

    private MoveOrdering() {}

    /** Stable partition: captures, then the rest, both in input order. The input list is not modified. */
    public static List<Move> order(Game game, List<Move> moves) {
        List<Move> ordered = new ArrayList<>(moves.size());
        for (Move move : moves) {
            if (isCapture(game, move)) {
                ordered.add(move);
            }
        }
        for (Move move : moves) {
            if (!isCapture(game, move)) {
                ordered.add(move);
            }
        }
        return ordered;
    }

    public static boolean isCapture(Game game, Move move) {
        return !game.pieceAt(move.endPosition()).isEmpty();
    }
}
