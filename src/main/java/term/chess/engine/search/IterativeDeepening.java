package term.chess.engine.search;

import term.chess.engine.game.Game;
import term.chess.engine.movegen.Move;

import java.util.List;
import java.util.function.Consumer;

public final class IterativeDeepening {

    private IterativeDeepening() {}

    /**
     * Searches depth 1, 2, ... up to {@code maxDepth} and returns the result of the deepest depth that
     * completed before the deadline. A depth interrupted by the deadline is thrown away.
     * Each completed depth is reported to {@code out} as an info line.
     *
     * @throws IllegalStateException when the side to move has no legal move
     */
    public static SearchResult run(Game game, SearchContext ctx, int maxDepth, Deadline deadline, Consumer<String> out) {
        final long start = System.nanoTime();
        List<Move> legalMoves = game.legalMoves();
        if (legalMoves.isEmpty()) {
            throw new IllegalStateException("No legal moves to search: " + game);
        }
        if (legalMoves.size() == 1) {
            return new SearchResult(legalMoves.get(0), 0.0, 0, 0, 0, true);
        }

        SearchResult last = null;
        for (int depth = 1; depth <= maxDepth; depth++) {
            if (deadline.expired()) break;

            SearchResult r = RootSearch.searchAtDepth(game, ctx, depth, deadline);
            if (!r.completed()) break; // timed out during depth
            last = r;
            out.accept(r.toInfoLine());
        }

        if (last == null) {
            // Fallback: first legal move
            long timeMs = (System.nanoTime() - start) / 1_000_000L;
            return new SearchResult(legalMoves.get(0), 0.0, 0, ctx.totalNodes, timeMs, false);
        }
        return last;
    }
}
