package term.chess.engine.search;

import term.chess.engine.movegen.Move;

/**
 * Outcome of a search. {@code score} is from the side to move's point of view, {@code depth} 0 means
 * the move was returned without searching.
 */
public record SearchResult(Move move, double score, int depth, long nodes, long timeMs, boolean completed) {

    public String toInfoLine() {
        return "info depth " + depth
                + " score " + String.format(java.util.Locale.ROOT, "%.2f", score)
                + " nodes " + nodes
                + " time " + timeMs
                + " pv " + move;
    }
}
